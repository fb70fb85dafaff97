package com.codegraph.core.renderer;

/**
 * Writes generated reports to a destination.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.codegraph.core.renderer.OutputRenderer}.
 */
public interface OutputRenderer {

    /**
     * Returns the lowercase identifier used to select this renderer (e.g. "filesystem").
     */
    String getId();

    /**
     * Renders every file of the output.
     *
     * @param output files to render
     * @param context destination and renderer settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
