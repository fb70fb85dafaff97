package com.codegraph.core.renderer.impl;

import com.codegraph.core.renderer.GeneratedFile;
import com.codegraph.core.renderer.GeneratedOutput;
import com.codegraph.core.renderer.OutputRenderers;
import com.codegraph.core.renderer.RenderContext;
import com.codegraph.core.report.GeneratedReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
        assertThat(OutputRenderers.find("filesystem")).isPresent();
    }

    @Test
    void render_withNestedFiles_createsDirectories() throws IOException {
        // Given
        GeneratedReport report = new GeneratedReport("dependency-graph", "graph LR", "md");
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.of("mermaid", report),
            GeneratedFile.of(null, new GeneratedReport("index", "# Index", "md"))));
        Path outputDir = tempDir.resolve("reports");

        // When
        renderer.render(output, new RenderContext(outputDir, Map.of()));

        // Then
        assertThat(Files.readString(outputDir.resolve("mermaid/dependency-graph.md"))).isEqualTo("graph LR");
        assertThat(Files.readString(outputDir.resolve("index.md"))).isEqualTo("# Index");
    }

    @Test
    void render_withExistingFile_overwritesIt() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("quality.md"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("quality.md", "new", GeneratedFile.MARKDOWN)));

        // When
        renderer.render(output, new RenderContext(tempDir, Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("quality.md"))).isEqualTo("new");
    }

    @Test
    void render_withPathLeavingOutputDirectory_throws() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("../escape.md", "x", GeneratedFile.MARKDOWN)));
        Path outputDir = tempDir.resolve("reports");

        // When / Then
        assertThatThrownBy(() -> renderer.render(output, new RenderContext(outputDir, Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("leaves the output directory");
        assertThat(tempDir.resolve("escape.md")).doesNotExist();
    }

    @Test
    void generatedFile_withBlankPath_throws() {
        assertThatThrownBy(() -> new GeneratedFile(" ", "x", GeneratedFile.MARKDOWN))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
