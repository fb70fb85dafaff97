package com.codegraph.core.report;

import java.util.Objects;

/**
 * A generated report document.
 *
 * @param name report name, used as file name
 * @param content document content
 * @param fileExtension file extension without leading dot
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension
) {
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    public String fileName() {
        return name + "." + fileExtension;
    }
}
