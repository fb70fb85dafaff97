package com.codegraph.core.engine;

import com.codegraph.core.model.AnalysisStatus;
import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.store.GraphStore;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits normalized results into store batches and commits them.
 *
 * <p>Files are grouped into batches of {@code batchSize} in path order. A batch replaces the
 * content of its files and carries every relation whose later endpoint belongs to it, so
 * after any committed prefix all stored relations point at stored entities or are external.
 * Cancellation is honoured between batches; a failing batch is retried once.
 */
public class IncrementalUpdater {

    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

    private final GraphStore store;

    public IncrementalUpdater(GraphStore store) {
        this.store = store;
    }

    /**
     * Outcome of committing a list of batches.
     *
     * @param status COMPLETED if every batch was applied
     * @param batchesCommitted batches applied
     * @param entitiesWritten entities in the applied batches
     * @param relationsWritten relations in the applied batches
     * @param failure message of the storage failure, or null
     */
    public record CommitOutcome(
        AnalysisStatus status,
        int batchesCommitted,
        int entitiesWritten,
        int relationsWritten,
        String failure
    ) {
    }

    /**
     * Plans the batches for a set of files.
     *
     * @param files files to replace, in commit order
     * @param entities normalized entities of those files
     * @param relations normalized relations sourced in those files
     * @param batchSize files per batch
     * @return batches in commit order; never empty when {@code files} is not empty
     */
    public List<WriteBatch> plan(List<String> files, List<CodeEntity> entities, List<CodeRelation> relations,
                                 int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        Map<String, Integer> fileIndex = new HashMap<>();
        for (int i = 0; i < files.size(); i++) {
            fileIndex.put(files.get(i), i);
        }
        int batchCount = (files.size() + batchSize - 1) / batchSize;
        List<Set<String>> batchFiles = new ArrayList<>();
        List<List<CodeEntity>> batchEntities = new ArrayList<>();
        List<List<CodeRelation>> batchRelations = new ArrayList<>();
        for (int b = 0; b < batchCount; b++) {
            batchFiles.add(new LinkedHashSet<>(files.subList(b * batchSize, Math.min(files.size(), (b + 1) * batchSize))));
            batchEntities.add(new ArrayList<>());
            batchRelations.add(new ArrayList<>());
        }

        Map<String, Integer> entityIndex = new HashMap<>();
        for (CodeEntity entity : entities) {
            Integer index = fileIndex.get(entity.filePath());
            if (index == null) {
                throw new IllegalArgumentException("Entity " + entity.qualifiedName() + " belongs to unplanned file "
                    + entity.filePath());
            }
            entityIndex.put(entity.id(), index);
            batchEntities.get(index / batchSize).add(entity);
        }
        for (CodeRelation relation : relations) {
            Integer source = entityIndex.get(relation.sourceId());
            if (source == null) {
                throw new IllegalArgumentException("Relation " + relation.id() + " has a source outside the planned files");
            }
            int target = relation.isExternal() ? -1 : entityIndex.getOrDefault(relation.targetId(), -1);
            batchRelations.get(Math.max(source, target) / batchSize).add(relation);
        }

        List<WriteBatch> batches = new ArrayList<>(batchCount);
        for (int b = 0; b < batchCount; b++) {
            batches.add(new WriteBatch(batchFiles.get(b), batchEntities.get(b), batchRelations.get(b)));
        }
        return batches;
    }

    /**
     * Applies batches in order, stopping on cancellation or a repeated storage failure.
     */
    public CommitOutcome commit(AnalysisSession session, List<WriteBatch> batches) {
        String projectId = session.getProjectId();
        int committed = 0;
        int entities = 0;
        int relations = 0;
        for (WriteBatch batch : batches) {
            if (session.isCancelled()) {
                log.info("Run on {} cancelled after {} of {} batches", projectId, committed, batches.size());
                return new CommitOutcome(AnalysisStatus.CANCELLED, committed, entities, relations, null);
            }
            try {
                applyWithRetry(projectId, batch);
            } catch (StorageWriteException e) {
                log.error("Batch {} of {} for {} failed twice, stopping: {}",
                    committed + 1, batches.size(), projectId, e.getMessage(), e);
                return new CommitOutcome(AnalysisStatus.FAILED, committed, entities, relations, e.getMessage());
            }
            committed++;
            entities += batch.entities().size();
            relations += batch.relations().size();
            log.debug("Committed batch {}/{} for {}: {} files", committed, batches.size(), projectId,
                batch.replacedFiles().size());
        }
        return new CommitOutcome(AnalysisStatus.COMPLETED, committed, entities, relations, null);
    }

    private void applyWithRetry(String projectId, WriteBatch batch) {
        try {
            store.apply(projectId, batch);
        } catch (StorageWriteException first) {
            log.warn("Storage write for {} failed, retrying once: {}", projectId, first.getMessage());
            store.apply(projectId, batch);
        }
    }
}
