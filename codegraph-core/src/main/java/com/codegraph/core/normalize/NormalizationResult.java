package com.codegraph.core.normalize;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;

import java.util.List;

/**
 * Entities and relations of a set of files in the unified vocabulary, ready to be written.
 *
 * @param entities normalized entities with assigned ids
 * @param relations resolved or external relations, deduplicated by id
 * @param warnings recoverable problems (id collisions, unknown vocabulary)
 * @param unresolvedRelations number of relations left external
 */
public record NormalizationResult(
    List<CodeEntity> entities,
    List<CodeRelation> relations,
    List<String> warnings,
    int unresolvedRelations
) {
    public NormalizationResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
