package com.codegraph.core.extractor;

/**
 * Confidence level of extracted facts, based on how they were obtained.
 */
public enum ConfidenceLevel {
    /**
     * Facts read from a full syntax tree.
     */
    HIGH("AST-based", 1.0),

    /**
     * Facts read with keyword-anchored patterns and bracket matching.
     */
    MEDIUM("Pattern-based", 0.7),

    /**
     * Facts guessed from naming or layout alone.
     */
    LOW("Heuristic-based", 0.4);

    private final String description;
    private final double weight;

    ConfidenceLevel(String description, double weight) {
        this.description = description;
        this.weight = weight;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the multiplier applied to relation confidence.
     *
     * @return weight in [0, 1]
     */
    public double getWeight() {
        return weight;
    }
}
