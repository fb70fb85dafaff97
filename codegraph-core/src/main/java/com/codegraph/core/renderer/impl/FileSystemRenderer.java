package com.codegraph.core.renderer.impl;

import com.codegraph.core.renderer.GeneratedFile;
import com.codegraph.core.renderer.GeneratedOutput;
import com.codegraph.core.renderer.OutputRenderer;
import com.codegraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated files below the output directory, creating directories as needed and
 * overwriting existing files.
 *
 * <p>A file whose relative path leaves the output directory is rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext(Path.of("reports"), Map.of());
 * new FileSystemRenderer().render(output, context);
 * // Creates: reports/markdown/quality.md, reports/mermaid/dependency-graph.md, ...
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.info("Rendering {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("File path leaves the output directory: " + file.relativePath());
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
