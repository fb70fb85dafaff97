package com.codegraph.core;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.Language;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;
import com.codegraph.core.util.IdGenerator;

import java.time.Instant;
import java.util.Map;

/**
 * Builders for hand-made graph content shared by store, query and quality tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
        // Utility class
    }

    public static CodeEntity module(String projectId, String filePath) {
        String qualifiedName = filePath.substring(0, filePath.lastIndexOf('.')).replace('/', '.');
        return entity(projectId, qualifiedName, EntityKind.MODULE, filePath, 1, 100, null);
    }

    public static CodeEntity entity(String projectId, String qualifiedName, EntityKind kind, String filePath,
                                    int lineStart, int lineEnd, CodeEntity parent) {
        String name = qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
        return new CodeEntity(IdGenerator.generate(projectId, qualifiedName, filePath), projectId, name,
            qualifiedName, kind, Language.PYTHON, filePath, lineStart, lineEnd, null, null,
            parent == null ? null : parent.id(), Map.of());
    }

    public static CodeRelation relation(CodeEntity source, CodeEntity target, RelationType type) {
        String id = IdGenerator.generate(source.projectId(), source.id(), type.name(), target.id());
        return new CodeRelation(id, source.projectId(), source.id(), target.id(), target.qualifiedName(), type,
            1.0, Map.of());
    }

    public static CodeRelation external(CodeEntity source, String targetName, RelationType type) {
        String id = IdGenerator.generate(source.projectId(), source.id(), type.name(), "external:" + targetName);
        return new CodeRelation(id, source.projectId(), source.id(), null, targetName, type, 0.7, Map.of());
    }

    public static QualityIssue issue(CodeEntity entity, IssueType type, Severity severity) {
        return new QualityIssue(IdGenerator.generate(entity.projectId(), type.name(), entity.id()),
            entity.projectId(), type, severity, entity.id(), entity.filePath(), entity.lineStart(),
            type.getTitle() + " in " + entity.qualifiedName(), null, null, IssueStatus.OPEN, true, Map.of(),
            Instant.parse("2026-01-01T00:00:00Z"), null);
    }
}
