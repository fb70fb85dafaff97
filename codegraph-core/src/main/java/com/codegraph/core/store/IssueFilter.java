package com.codegraph.core.store;

import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;

import java.util.Set;

/**
 * Criteria for listing quality issues. Empty sets and null values match everything.
 *
 * @param statuses accepted statuses
 * @param severities accepted severities
 * @param types accepted issue types
 * @param filePath exact file path, or null
 * @param active required activity flag, or null for both
 */
public record IssueFilter(
    Set<IssueStatus> statuses,
    Set<Severity> severities,
    Set<IssueType> types,
    String filePath,
    Boolean active
) {
    public IssueFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        severities = severities == null ? Set.of() : Set.copyOf(severities);
        types = types == null ? Set.of() : Set.copyOf(types);
    }

    public static IssueFilter all() {
        return new IssueFilter(Set.of(), Set.of(), Set.of(), null, null);
    }

    /**
     * Issues that count toward debt: open and detected by the latest run.
     */
    public static IssueFilter openAndActive() {
        return new IssueFilter(Set.of(IssueStatus.OPEN), Set.of(), Set.of(), null, Boolean.TRUE);
    }

    public IssueFilter withStatuses(Set<IssueStatus> newStatuses) {
        return new IssueFilter(newStatuses, severities, types, filePath, active);
    }

    public IssueFilter withSeverities(Set<Severity> newSeverities) {
        return new IssueFilter(statuses, newSeverities, types, filePath, active);
    }

    public boolean matches(QualityIssue issue) {
        return (statuses.isEmpty() || statuses.contains(issue.status()))
            && (severities.isEmpty() || severities.contains(issue.severity()))
            && (types.isEmpty() || types.contains(issue.issueType()))
            && (filePath == null || filePath.equals(issue.filePath()))
            && (active == null || active == issue.active());
    }
}
