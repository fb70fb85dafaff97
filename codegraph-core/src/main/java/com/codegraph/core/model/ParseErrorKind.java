package com.codegraph.core.model;

/**
 * Cause of a per-file parse failure.
 */
public enum ParseErrorKind {
    SYNTAX,
    TIMEOUT,
    IO,
    UNSUPPORTED
}
