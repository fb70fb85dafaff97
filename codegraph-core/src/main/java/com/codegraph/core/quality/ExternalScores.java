package com.codegraph.core.quality;

/**
 * Category scores (0-10, 10 = healthy) supplied by collaborators outside the graph,
 * such as a coverage tool. A null category is left out of the overall score.
 *
 * @param testCoverage test coverage score
 * @param documentation documentation score
 * @param dependencies dependency health score
 * @param todos score derived from TODO/FIXME markers
 */
public record ExternalScores(
    Double testCoverage,
    Double documentation,
    Double dependencies,
    Double todos
) {
    public ExternalScores {
        testCoverage = clamp(testCoverage);
        documentation = clamp(documentation);
        dependencies = clamp(dependencies);
        todos = clamp(todos);
    }

    public static ExternalScores none() {
        return new ExternalScores(null, null, null, null);
    }

    private static Double clamp(Double score) {
        if (score == null || score.isNaN()) {
            return null;
        }
        return Math.max(0.0, Math.min(10.0, score));
    }
}
