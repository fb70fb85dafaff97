package com.codegraph.core.renderer.impl;

import com.codegraph.core.renderer.GeneratedFile;
import com.codegraph.core.renderer.GeneratedOutput;
import com.codegraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withMultipleFiles_printsHeadersAndSeparator() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("markdown/overview.md", "Content 1", GeneratedFile.MARKDOWN),
            new GeneratedFile("markdown/quality.md", "Content 2", GeneratedFile.MARKDOWN)));

        // When
        renderer.render(output, new RenderContext(Path.of("."), Map.of()));

        // Then
        String printed = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("File 1/2: markdown/overview.md", "File 2/2: markdown/quality.md");
        assertThat(printed).contains("Content 1", "Content 2");
        assertThat(printed).contains("-".repeat(78));
        assertThat(printed).doesNotContain("\u001B[");
    }

    @Test
    void render_withColorsAndNoHeaders_printsAnsiSeparatorOnly() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.md", "A", GeneratedFile.MARKDOWN),
            new GeneratedFile("b.md", "B", GeneratedFile.MARKDOWN)));
        RenderContext context = new RenderContext(Path.of("."), Map.of(
            "console.colors", "true",
            "console.showHeaders", "false",
            "console.separator", "=="));

        // When
        renderer.render(output, context);

        // Then
        String printed = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(printed).doesNotContain("File 1/2");
        assertThat(printed).contains("\u001B[33m" + "==".repeat(40) + "\u001B[0m");
    }

    @Test
    void render_withEmptyOutput_printsNothing() {
        renderer.render(new GeneratedOutput(List.of()), new RenderContext(Path.of("."), null));

        assertThat(outputStream.size()).isZero();
    }
}
