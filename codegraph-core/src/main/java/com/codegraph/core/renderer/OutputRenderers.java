package com.codegraph.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers the registered {@link OutputRenderer}s.
 */
public final class OutputRenderers {

    private OutputRenderers() {
        // Utility class
    }

    public static List<OutputRenderer> loadAll() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }

    public static Optional<OutputRenderer> find(String id) {
        return loadAll().stream().filter(renderer -> renderer.getId().equalsIgnoreCase(id)).findFirst();
    }
}
