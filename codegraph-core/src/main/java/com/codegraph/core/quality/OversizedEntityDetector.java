package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reports long functions and god classes.
 */
public class OversizedEntityDetector {

    private final QualityThresholds thresholds;

    public OversizedEntityDetector(QualityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<QualityIssue> detect(String projectId, List<CodeEntity> entities, Instant now) {
        Map<String, Integer> methodCounts = new HashMap<>();
        for (CodeEntity entity : entities) {
            if (entity.parentId() != null && entity.kind().isCallable()) {
                methodCounts.merge(entity.parentId(), 1, Integer::sum);
            }
        }

        List<QualityIssue> issues = new ArrayList<>();
        for (CodeEntity entity : entities) {
            if (entity.kind().isCallable()) {
                Severity severity = thresholds.longFunctionSeverity(entity.getLength());
                if (severity != null) {
                    issues.add(longFunction(projectId, entity, severity, now));
                }
            } else if (entity.kind().isTypeLike()) {
                int methods = methodCounts.getOrDefault(entity.id(), 0);
                Severity severity = Severity.max(thresholds.godClassMethodSeverity(methods),
                    thresholds.godClassLineSeverity(entity.getLength()));
                if (severity != null) {
                    issues.add(godClass(projectId, entity, methods, severity, now));
                }
            }
        }
        return issues;
    }

    private QualityIssue longFunction(String projectId, CodeEntity entity, Severity severity, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("lines", entity.getLength());
        metadata.put("threshold", thresholds.longFunctionMedium());
        return IssueFactory.create(projectId, IssueType.LONG_FUNCTION, severity, entity.id(), entity,
            entity.kind().name().toLowerCase(Locale.ROOT) + " " + entity.qualifiedName() + " spans " + entity.getLength()
                + " lines (limit " + thresholds.longFunctionMedium() + ")",
            "Split it into smaller functions with one responsibility each",
            metadata, now);
    }

    private QualityIssue godClass(String projectId, CodeEntity entity, int methods, Severity severity, Instant now) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("methods", methods);
        metadata.put("lines", entity.getLength());
        metadata.put("methodThreshold", thresholds.godClassMethodsMedium());
        metadata.put("lineThreshold", thresholds.godClassLinesMedium());
        return IssueFactory.create(projectId, IssueType.GOD_CLASS, severity, entity.id(), entity,
            entity.qualifiedName() + " has " + methods + " methods over " + entity.getLength() + " lines",
            "Move cohesive groups of methods into separate types",
            metadata, now);
    }
}
