package com.codegraph.core.model;

/**
 * Lifecycle state of a quality issue. Issues start {@link #OPEN}; the other states
 * are only reached through an explicit external action.
 */
public enum IssueStatus {
    OPEN,
    RESOLVED,
    IGNORED
}
