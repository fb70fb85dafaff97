package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;
import com.codegraph.core.util.IdGenerator;

import java.time.Instant;
import java.util.Map;

/**
 * Creates detected issues with ids derived from project, issue type and subject, so the
 * same problem found by a later run maps onto the same record.
 */
final class IssueFactory {

    private IssueFactory() {
        // Utility class
    }

    static String issueId(String projectId, IssueType type, String subjectKey) {
        return IdGenerator.generate(projectId, "issue", type.name(), subjectKey);
    }

    static QualityIssue create(String projectId, IssueType type, Severity severity, String subjectKey,
                               CodeEntity entity, String description, String suggestion,
                               Map<String, Object> metadata, Instant detectedAt) {
        return new QualityIssue(
            issueId(projectId, type, subjectKey),
            projectId,
            type,
            severity,
            entity.id(),
            entity.filePath(),
            entity.lineStart(),
            type.getTitle() + ": " + entity.qualifiedName(),
            description,
            suggestion,
            IssueStatus.OPEN,
            true,
            metadata,
            detectedAt,
            detectedAt
        );
    }
}
