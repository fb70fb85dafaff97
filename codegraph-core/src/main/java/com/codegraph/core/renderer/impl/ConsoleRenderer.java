package com.codegraph.core.renderer.impl;

import com.codegraph.core.renderer.GeneratedFile;
import com.codegraph.core.renderer.GeneratedOutput;
import com.codegraph.core.renderer.OutputRenderer;
import com.codegraph.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to a stream, with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - print a header per file ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.getBooleanSetting("console.colors", false);
        boolean showHeaders = context.getBooleanSetting("console.showHeaders", true);
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);

        log.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            out.println(file.content());
            if (i < total - 1) {
                printSeparator(separator, useColors);
            }
        }
        out.flush();
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String color = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(color + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        out.println();
    }

    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";
        int repeatCount = Math.max(1, LINE_WIDTH / Math.max(1, separator.length()));
        out.println(color + separator.repeat(repeatCount) + reset);
    }
}
