package com.codegraph.core.model;

import java.util.Objects;

/**
 * A recoverable, per-file extraction failure.
 *
 * @param filePath project-relative path of the file
 * @param kind cause of the failure
 * @param message human readable description
 * @param line line the problem was detected on, or 0 when unknown
 */
public record ParseError(
    String filePath,
    ParseErrorKind kind,
    String message,
    int line
) {
    public ParseError {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null) {
            message = kind.name().toLowerCase();
        }
        if (line < 0) {
            line = 0;
        }
    }

    public static ParseError syntax(String filePath, int line, String message) {
        return new ParseError(filePath, ParseErrorKind.SYNTAX, message, line);
    }

    public static ParseError timeout(String filePath, long budgetMillis) {
        return new ParseError(filePath, ParseErrorKind.TIMEOUT,
            "Extraction exceeded time budget of " + budgetMillis + " ms", 0);
    }

    public static ParseError io(String filePath, String message) {
        return new ParseError(filePath, ParseErrorKind.IO, message, 0);
    }

    @Override
    public String toString() {
        return filePath + (line > 0 ? ":" + line : "") + " [" + kind + "] " + message;
    }
}
