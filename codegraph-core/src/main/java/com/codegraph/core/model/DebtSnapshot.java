package com.codegraph.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time technical debt measurement of a project. Snapshots are append-only.
 *
 * @param id snapshot identifier
 * @param projectId owning project
 * @param overallScore weighted score on a 0-10 scale (10 = healthy)
 * @param categoryScores per-category 0-10 scores (code_quality, test_coverage, ...)
 * @param issueCountsBySeverity open, active issue counts by severity
 * @param issuesCount total open, active issues
 * @param estimatedDaysToFix estimated effort in 8-hour days
 * @param createdAt creation time
 */
public record DebtSnapshot(
    String id,
    String projectId,
    double overallScore,
    Map<String, Double> categoryScores,
    Map<Severity, Integer> issueCountsBySeverity,
    int issuesCount,
    double estimatedDaysToFix,
    Instant createdAt
) {
    public DebtSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        categoryScores = categoryScores == null ? Map.of() : Map.copyOf(categoryScores);
        issueCountsBySeverity = issueCountsBySeverity == null ? Map.of() : Map.copyOf(issueCountsBySeverity);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
