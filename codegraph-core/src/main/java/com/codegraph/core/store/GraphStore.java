package com.codegraph.core.store;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent, project-partitioned storage of entities, relations, quality issues and debt
 * snapshots.
 *
 * <p>Writes go through {@link #apply(String, WriteBatch)}, which is atomic: either the whole
 * batch becomes visible or nothing changes. Writes to one project are serialized; reads
 * never block and always observe a complete batch.
 *
 * <p>No operation reads or writes data of a project other than the one it is given.
 */
public interface GraphStore {

    /**
     * Applies a batch atomically.
     *
     * @param projectId project to write
     * @param batch entities, relations and replaced files
     * @throws StorageWriteException if a relation has no source entity or persistence fails
     */
    void apply(String projectId, WriteBatch batch);

    default void upsertEntities(String projectId, List<CodeEntity> batch) {
        apply(projectId, new WriteBatch(Set.of(), batch, List.of()));
    }

    /**
     * Replaces the content of a set of files in one atomic step.
     */
    default void upsertReplaceEntitiesForFiles(String projectId, Set<String> filePaths,
                                               List<CodeEntity> entities, List<CodeRelation> relations) {
        apply(projectId, new WriteBatch(filePaths, entities, relations));
    }

    default void upsertRelations(String projectId, List<CodeRelation> batch) {
        apply(projectId, new WriteBatch(Set.of(), List.of(), batch));
    }

    Optional<CodeEntity> getEntity(String projectId, String id);

    List<CodeEntity> findByQualifiedName(String projectId, String qualifiedName);

    /**
     * Returns relations attached to an entity.
     *
     * @param projectId project to read
     * @param entityId entity id
     * @param types accepted relation types; null or empty accepts all
     * @param direction outgoing, incoming or both
     * @return relations ordered by id
     */
    List<CodeRelation> getRelations(String projectId, String entityId, Set<RelationType> types, Direction direction);

    List<CodeEntity> listEntities(String projectId);

    List<CodeEntity> listEntitiesInFile(String projectId, String filePath);

    List<CodeRelation> listRelations(String projectId);

    Set<String> listFiles(String projectId);

    /**
     * Inserts or replaces issues by id. An issue already stored keeps its status; status
     * changes go through {@link #updateIssueStatus(String, String, IssueStatus)} only.
     */
    void saveIssues(String projectId, List<QualityIssue> issues);

    List<QualityIssue> listIssues(String projectId, IssueFilter filter);

    /**
     * Changes the status of one issue.
     *
     * @return the updated issue, or empty if the id is unknown
     */
    Optional<QualityIssue> updateIssueStatus(String projectId, String issueId, IssueStatus status);

    void appendSnapshot(DebtSnapshot snapshot);

    /**
     * Returns the snapshots of a project in chronological order.
     */
    List<DebtSnapshot> listSnapshots(String projectId);

    Set<String> listProjects();
}
