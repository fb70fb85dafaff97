package com.codegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.Objects;

/**
 * A directed, typed edge between two entities.
 *
 * <p>A relation whose target could not be resolved inside the project keeps
 * {@code targetId == null} and the textual {@code targetName}; it is then "external".
 *
 * @param id deterministic identifier derived from source, type and target
 * @param projectId owning project
 * @param sourceId entity the relation starts from
 * @param targetId resolved target entity, or null when external
 * @param targetName textual target as written in source (or the qualified name of the resolved target)
 * @param type relation type
 * @param confidence confidence in [0, 1]
 * @param metadata extra facts such as the source line or import alias
 */
public record CodeRelation(
    String id,
    String projectId,
    String sourceId,
    String targetId,
    String targetName,
    RelationType type,
    double confidence,
    Map<String, Object> metadata
) {
    public CodeRelation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (targetId == null && (targetName == null || targetName.isBlank())) {
            throw new IllegalArgumentException("External relation requires a targetName");
        }
        if (confidence < 0.0) {
            confidence = 0.0;
        } else if (confidence > 1.0) {
            confidence = 1.0;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Returns true if the target lies outside the analysed project.
     *
     * @return true when {@code targetId} is null
     */
    @JsonIgnore
    public boolean isExternal() {
        return targetId == null;
    }
}
