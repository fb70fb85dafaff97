package com.codegraph.core.quality;

import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Debt accumulated by one file.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * FileDebt debt = new FileDebt("pkg/a.py", 5.0, 5.0, 3, 10, mainIssues, Severity.HIGH);
 * debt.getFormattedHealth(); // "5.0/10"
 * }</pre>
 *
 * @param filePath project-relative file path
 * @param debtScore sum of severity weights of the file's open, active issues
 * @param healthScore {@code max(0, 10 - debtScore)}
 * @param issuesCount open, active issues
 * @param estimatedHours estimated effort to fix all issues
 * @param mainIssues the most severe issues, at most three
 * @param priority CRITICAL, HIGH or MEDIUM depending on the debt score
 */
public record FileDebt(
    String filePath,
    double debtScore,
    double healthScore,
    int issuesCount,
    int estimatedHours,
    List<QualityIssue> mainIssues,
    Severity priority
) {
    public FileDebt {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (debtScore < 0.0) {
            throw new IllegalArgumentException("debtScore must be >= 0");
        }
        mainIssues = mainIssues == null ? List.of() : List.copyOf(mainIssues);
    }

    public String getFormattedHealth() {
        return String.format(Locale.ROOT, "%.1f/10", healthScore);
    }
}
