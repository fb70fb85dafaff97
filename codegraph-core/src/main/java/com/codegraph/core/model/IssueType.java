package com.codegraph.core.model;

/**
 * Kinds of structural problems reported by the quality analyzer.
 */
public enum IssueType {
    CIRCULAR_DEPENDENCY("Circular dependency"),
    LONG_FUNCTION("Long function"),
    GOD_CLASS("God class"),
    TIGHT_COUPLING("Tight coupling"),
    COUPLING_IMBALANCE("Coupling imbalance");

    private final String title;

    IssueType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
