package com.codegraph.core.quality;

import com.codegraph.core.model.Severity;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Technical debt of a project computed from its open, active issues.
 *
 * @param projectId scored project
 * @param totalDebt sum of severity weights over all files
 * @param overallScore weighted average of the available category scores, 0-10
 * @param categoryScores available category scores keyed by category name
 * @param issueCountsBySeverity open, active issues per severity
 * @param issuesCount open, active issues
 * @param estimatedHours estimated effort to fix every issue
 * @param estimatedDaysToFix {@code estimatedHours / 8}
 * @param files per-file debt, highest debt first
 */
public record DebtScore(
    String projectId,
    double totalDebt,
    double overallScore,
    Map<String, Double> categoryScores,
    Map<Severity, Integer> issueCountsBySeverity,
    int issuesCount,
    int estimatedHours,
    double estimatedDaysToFix,
    List<FileDebt> files
) {
    public DebtScore {
        categoryScores = categoryScores == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(categoryScores));
        issueCountsBySeverity = issueCountsBySeverity == null ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(issueCountsBySeverity));
        files = files == null ? List.of() : List.copyOf(files);
    }

    public double codeQualityScore() {
        return categoryScores.getOrDefault(DebtCalculator.CODE_QUALITY, 10.0);
    }
}
