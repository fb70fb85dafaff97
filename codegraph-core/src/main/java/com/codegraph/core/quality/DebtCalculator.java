package com.codegraph.core.quality;

import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Utility for turning quality issues into debt and health scores.
 *
 * <p>Only issues that are open and active count. Per file the debt score is the sum of
 * severity weights (critical 4, high 2, medium 1, low 0.5) and the health score is
 * {@code max(0, 10 - debt)}. The project's overall score is a weighted average of the
 * categories that are available; missing categories are dropped and the remaining weights
 * renormalised.
 */
public final class DebtCalculator {

    public static final String CODE_QUALITY = "code_quality";
    public static final String TEST_COVERAGE = "test_coverage";
    public static final String DOCUMENTATION = "documentation";
    public static final String DEPENDENCIES = "dependencies";
    public static final String TODOS = "todos";

    static final Map<String, Double> CATEGORY_WEIGHTS = Map.of(
        CODE_QUALITY, 0.4,
        TEST_COVERAGE, 0.25,
        DOCUMENTATION, 0.15,
        DEPENDENCIES, 0.1,
        TODOS, 0.1
    );

    static final double MAX_SCORE = 10.0;
    static final int HOURS_PER_DAY = 8;
    private static final int MAIN_ISSUES = 3;

    private static final Comparator<QualityIssue> MOST_SEVERE_FIRST = Comparator
        .comparing(QualityIssue::severity).reversed()
        .thenComparingInt(QualityIssue::lineNumber)
        .thenComparing(QualityIssue::id);

    private DebtCalculator() {
        // Utility class
    }

    /**
     * Sums the severity weights of the issues that count toward debt.
     */
    public static double debtScore(Collection<QualityIssue> issues) {
        return issues.stream()
            .filter(QualityIssue::countsTowardDebt)
            .mapToDouble(issue -> issue.severity().getDebtWeight())
            .sum();
    }

    public static double healthScore(double debtScore) {
        return Math.max(0.0, MAX_SCORE - debtScore);
    }

    /**
     * Maps a file's debt score onto a fixing priority.
     *
     * @return CRITICAL from 8, HIGH from 4, otherwise MEDIUM
     */
    public static Severity priority(double debtScore) {
        if (debtScore >= 8.0) {
            return Severity.CRITICAL;
        }
        return debtScore >= 4.0 ? Severity.HIGH : Severity.MEDIUM;
    }

    /**
     * Groups counting issues by file, highest debt first, ties by path.
     */
    public static List<FileDebt> fileDebts(Collection<QualityIssue> issues) {
        Map<String, List<QualityIssue>> byFile = new TreeMap<>();
        for (QualityIssue issue : issues) {
            if (issue.countsTowardDebt()) {
                byFile.computeIfAbsent(issue.filePath() == null ? "" : issue.filePath(), key -> new ArrayList<>())
                    .add(issue);
            }
        }
        List<FileDebt> files = new ArrayList<>();
        byFile.forEach((file, fileIssues) -> {
            double debt = debtScore(fileIssues);
            List<QualityIssue> sorted = new ArrayList<>(fileIssues);
            sorted.sort(MOST_SEVERE_FIRST);
            files.add(new FileDebt(file, debt, healthScore(debt), fileIssues.size(), estimatedHours(fileIssues),
                sorted.subList(0, Math.min(MAIN_ISSUES, sorted.size())), priority(debt)));
        });
        files.sort(Comparator.comparingDouble(FileDebt::debtScore).reversed().thenComparing(FileDebt::filePath));
        return files;
    }

    public static int estimatedHours(Collection<QualityIssue> issues) {
        return issues.stream()
            .filter(QualityIssue::countsTowardDebt)
            .mapToInt(issue -> issue.severity().getFixHours())
            .sum();
    }

    /**
     * Scores the code-quality category from the project's total debt.
     */
    public static double codeQualityScore(double totalDebt) {
        return Math.max(0.0, MAX_SCORE - totalDebt / 10.0);
    }

    /**
     * Collects the available category scores.
     */
    public static Map<String, Double> categoryScores(double totalDebt, ExternalScores external) {
        ExternalScores scores = external == null ? ExternalScores.none() : external;
        Map<String, Double> categories = new LinkedHashMap<>();
        categories.put(CODE_QUALITY, round(codeQualityScore(totalDebt)));
        putIfPresent(categories, TEST_COVERAGE, scores.testCoverage());
        putIfPresent(categories, DOCUMENTATION, scores.documentation());
        putIfPresent(categories, DEPENDENCIES, scores.dependencies());
        putIfPresent(categories, TODOS, scores.todos());
        return categories;
    }

    /**
     * Weighted average of the given categories with weights renormalised over them.
     */
    public static double overallScore(Map<String, Double> categoryScores) {
        double weighted = 0.0;
        double weights = 0.0;
        for (Map.Entry<String, Double> entry : categoryScores.entrySet()) {
            Double weight = CATEGORY_WEIGHTS.get(entry.getKey());
            if (weight != null && entry.getValue() != null) {
                weighted += weight * entry.getValue();
                weights += weight;
            }
        }
        return weights == 0.0 ? MAX_SCORE : round(weighted / weights);
    }

    public static DebtScore score(String projectId, Collection<QualityIssue> issues, ExternalScores external) {
        List<FileDebt> files = fileDebts(issues);
        double totalDebt = files.stream().mapToDouble(FileDebt::debtScore).sum();
        Map<String, Double> categories = categoryScores(totalDebt, external);
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        int count = 0;
        for (QualityIssue issue : issues) {
            if (issue.countsTowardDebt()) {
                bySeverity.merge(issue.severity(), 1, Integer::sum);
                count++;
            }
        }
        int hours = estimatedHours(issues);
        return new DebtScore(projectId, totalDebt, overallScore(categories), categories, bySeverity, count, hours,
            round((double) hours / HOURS_PER_DAY), files);
    }

    public static DebtSnapshot snapshot(DebtScore score, Instant createdAt) {
        return new DebtSnapshot(UUID.randomUUID().toString(), score.projectId(), score.overallScore(),
            score.categoryScores(), score.issueCountsBySeverity(), score.issuesCount(), score.estimatedDaysToFix(),
            createdAt);
    }

    private static void putIfPresent(Map<String, Double> categories, String key, Double value) {
        if (value != null) {
            categories.put(key, value);
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
