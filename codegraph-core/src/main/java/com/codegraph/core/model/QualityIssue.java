package com.codegraph.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A structural problem detected by the quality analyzer.
 *
 * <p>Issues are never deleted. {@code active} tells whether the most recent analyzer run
 * still detected the problem; only open and active issues count toward debt.
 *
 * @param id deterministic identifier derived from project, type and subject
 * @param projectId owning project
 * @param issueType kind of problem
 * @param severity severity
 * @param entityId affected entity
 * @param filePath file of the affected entity
 * @param lineNumber line of the affected entity
 * @param title short title
 * @param description detailed description
 * @param suggestion suggested remedy
 * @param status lifecycle state
 * @param active true if the latest run detected it
 * @param metadata measured values (line counts, fan-in, cycle members, ...)
 * @param detectedAt first detection time
 * @param updatedAt last change of status or detection
 */
public record QualityIssue(
    String id,
    String projectId,
    IssueType issueType,
    Severity severity,
    String entityId,
    String filePath,
    int lineNumber,
    String title,
    String description,
    String suggestion,
    IssueStatus status,
    boolean active,
    Map<String, Object> metadata,
    Instant detectedAt,
    Instant updatedAt
) {
    public QualityIssue {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(issueType, "issueType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (status == null) {
            status = IssueStatus.OPEN;
        }
        if (title == null) {
            title = issueType.getTitle();
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (detectedAt == null) {
            detectedAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = detectedAt;
        }
    }

    public QualityIssue withStatus(IssueStatus newStatus, Instant at) {
        return new QualityIssue(id, projectId, issueType, severity, entityId, filePath, lineNumber,
            title, description, suggestion, newStatus, active, metadata, detectedAt, at);
    }

    public QualityIssue withActive(boolean isActive, Instant at) {
        return new QualityIssue(id, projectId, issueType, severity, entityId, filePath, lineNumber,
            title, description, suggestion, status, isActive, metadata, detectedAt, at);
    }

    /**
     * Returns true if this issue contributes to debt: open and still detected.
     *
     * @return true for open, active issues
     */
    public boolean countsTowardDebt() {
        return status == IssueStatus.OPEN && active;
    }
}
