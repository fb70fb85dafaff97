package com.codegraph.core.query;

/**
 * Grouping used by architecture summaries.
 */
public enum GroupBy {
    /** One group per directory of the file path. */
    DIRECTORY,
    /** One group per file. */
    FILE
}
