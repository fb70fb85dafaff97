package com.codegraph.core.renderer;

import com.codegraph.core.report.GeneratedReport;

import java.util.Objects;

/**
 * A file to be rendered.
 *
 * @param relativePath path below the output directory (e.g. "mermaid/dependency-graph.md")
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String MARKDOWN = "text/markdown";

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Wraps a report, placing it below {@code directory} when one is given.
     */
    public static GeneratedFile of(String directory, GeneratedReport report) {
        String path = directory == null || directory.isBlank()
            ? report.fileName()
            : directory + "/" + report.fileName();
        return new GeneratedFile(path, report.content(), MARKDOWN);
    }
}
