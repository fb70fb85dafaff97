package com.codegraph.core.store;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;

import java.util.List;
import java.util.Set;

/**
 * One atomic change to a project graph.
 *
 * <p>Applying a batch removes every entity of {@code replacedFiles} (and the relations they
 * are the source of), then writes {@code entities} and {@code relations}. A file listed in
 * {@code replacedFiles} without new entities is thereby deleted from the graph.
 *
 * @param replacedFiles project-relative paths whose previous content is discarded
 * @param entities entities to upsert
 * @param relations relations to upsert; their sources must exist after the entities are written
 */
public record WriteBatch(
    Set<String> replacedFiles,
    List<CodeEntity> entities,
    List<CodeRelation> relations
) {
    public WriteBatch {
        replacedFiles = replacedFiles == null ? Set.of() : Set.copyOf(replacedFiles);
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    public static WriteBatch removeFiles(Set<String> filePaths) {
        return new WriteBatch(filePaths, List.of(), List.of());
    }

    public boolean isEmpty() {
        return replacedFiles.isEmpty() && entities.isEmpty() && relations.isEmpty();
    }
}
