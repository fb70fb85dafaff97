package com.codegraph.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one report run.
 *
 * @param files files in rendering order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
