package com.codegraph.core.store.impl;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.IssueStatus;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.store.Direction;
import com.codegraph.core.store.GraphStore;
import com.codegraph.core.store.IssueFilter;
import com.codegraph.core.store.StorageWriteException;
import com.codegraph.core.store.WriteBatch;
import com.codegraph.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Graph store keeping every project in memory.
 *
 * <p>Each project is an immutable {@link ProjectGraph} snapshot. A write copies the current
 * snapshot, applies the change to the copy, calls {@link #persist(String, ProjectGraph)} and
 * only then publishes the copy. Readers pick up whichever snapshot is published and never
 * see a half-applied batch. Writers of one project are serialized by a per-project lock.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private static final ProjectGraph EMPTY = new ProjectGraph();

    private final Map<String, ProjectGraph> projects = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    // ==================== Writes ====================

    @Override
    public void apply(String projectId, WriteBatch batch) {
        requireProject(projectId);
        Objects.requireNonNull(batch, "batch must not be null");
        write(projectId, graph -> {
            applyBatch(projectId, graph, batch);
            return graph;
        });
        log.debug("Applied batch to {}: {} replaced files, {} entities, {} relations",
            projectId, batch.replacedFiles().size(), batch.entities().size(), batch.relations().size());
    }

    private void applyBatch(String projectId, ProjectGraph graph, WriteBatch batch) {
        Map<String, CodeEntity> removed = new LinkedHashMap<>();
        for (String file : batch.replacedFiles()) {
            for (String id : graph.idsInFile(file)) {
                removed.put(id, graph.removeEntity(id));
            }
        }

        Set<String> written = new HashSet<>();
        for (CodeEntity entity : batch.entities()) {
            if (!projectId.equals(entity.projectId())) {
                throw new StorageWriteException("Entity " + entity.id() + " belongs to project " + entity.projectId());
            }
            graph.putEntity(entity);
            written.add(entity.id());
        }

        // Relations sourced in replaced content are superseded by the batch.
        for (String id : removed.keySet()) {
            for (CodeRelation relation : graph.outgoing(id, null)) {
                graph.removeRelation(relation.id());
            }
        }

        for (Map.Entry<String, CodeEntity> entry : removed.entrySet()) {
            if (graph.containsEntity(entry.getKey())) {
                continue;
            }
            for (CodeRelation relation : graph.incoming(entry.getKey(), null)) {
                graph.removeRelation(relation.id());
                CodeRelation replacement = retarget(projectId, graph, relation, entry.getValue().qualifiedName());
                if (graph.relation(replacement.id()) == null) {
                    graph.putRelation(replacement);
                }
            }
        }

        for (String id : written) {
            CodeEntity entity = graph.entity(id);
            for (CodeRelation external : graph.externalRelationsNamed(entity.qualifiedName())) {
                if (external.sourceId().equals(id)) {
                    continue;
                }
                graph.removeRelation(external.id());
                CodeRelation resolved = withTarget(projectId, external, entity.id(), entity.qualifiedName());
                if (graph.relation(resolved.id()) == null) {
                    graph.putRelation(resolved);
                }
            }
        }

        for (CodeRelation relation : batch.relations()) {
            if (!projectId.equals(relation.projectId())) {
                throw new StorageWriteException("Relation " + relation.id() + " belongs to project " + relation.projectId());
            }
            if (!graph.containsEntity(relation.sourceId())) {
                throw new StorageWriteException("Relation " + relation.id() + " references missing source entity "
                    + relation.sourceId());
            }
            CodeRelation toWrite = relation;
            if (!relation.isExternal() && !graph.containsEntity(relation.targetId())) {
                toWrite = withTarget(projectId, relation, null, relation.targetName());
            }
            graph.putRelation(toWrite);
        }
    }

    /**
     * Points a relation whose target disappeared at a same-named entity, or makes it external.
     */
    private CodeRelation retarget(String projectId, ProjectGraph graph, CodeRelation relation, String qualifiedName) {
        List<CodeEntity> candidates = graph.entitiesByQualifiedName(qualifiedName);
        if (!candidates.isEmpty()) {
            CodeEntity target = candidates.stream().min(Comparator.comparing(CodeEntity::id)).orElseThrow();
            return withTarget(projectId, relation, target.id(), qualifiedName);
        }
        return withTarget(projectId, relation, null, qualifiedName);
    }

    private static CodeRelation withTarget(String projectId, CodeRelation relation, String targetId, String targetName) {
        String id = IdGenerator.generate(projectId, relation.sourceId(), relation.type().name(),
            targetId != null ? targetId : "external:" + targetName);
        return new CodeRelation(id, projectId, relation.sourceId(), targetId, targetName, relation.type(),
            relation.confidence(), relation.metadata());
    }

    @Override
    public void saveIssues(String projectId, List<QualityIssue> issues) {
        requireProject(projectId);
        write(projectId, graph -> {
            for (QualityIssue issue : issues) {
                if (!projectId.equals(issue.projectId())) {
                    throw new StorageWriteException("Issue " + issue.id() + " belongs to project " + issue.projectId());
                }
                graph.putIssue(keepStatus(graph.issue(issue.id()), issue));
            }
            return graph;
        });
    }

    // The stored status wins; only updateIssueStatus moves an issue between statuses.
    private static QualityIssue keepStatus(QualityIssue stored, QualityIssue incoming) {
        if (stored == null || stored.status() == incoming.status()) {
            return incoming;
        }
        Instant updatedAt = stored.updatedAt().isAfter(incoming.updatedAt()) ? stored.updatedAt() : incoming.updatedAt();
        return incoming.withStatus(stored.status(), updatedAt);
    }

    @Override
    public Optional<QualityIssue> updateIssueStatus(String projectId, String issueId, IssueStatus status) {
        requireProject(projectId);
        Objects.requireNonNull(status, "status must not be null");
        QualityIssue[] updated = new QualityIssue[1];
        write(projectId, graph -> {
            QualityIssue issue = graph.issue(issueId);
            if (issue == null) {
                return null;
            }
            updated[0] = issue.withStatus(status, Instant.now());
            graph.putIssue(updated[0]);
            return graph;
        });
        return Optional.ofNullable(updated[0]);
    }

    @Override
    public void appendSnapshot(DebtSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        requireProject(snapshot.projectId());
        write(snapshot.projectId(), graph -> {
            graph.addSnapshot(snapshot);
            return graph;
        });
    }

    /**
     * Runs a change on a private copy of the project graph and publishes it after persistence.
     *
     * @param change mutates the copy and returns it, or returns null to abandon the write
     */
    private void write(String projectId, UnaryOperator<ProjectGraph> change) {
        ReentrantLock lock = writeLocks.computeIfAbsent(projectId, key -> new ReentrantLock());
        lock.lock();
        try {
            ProjectGraph working = projects.getOrDefault(projectId, EMPTY).copy();
            ProjectGraph changed = change.apply(working);
            if (changed == null) {
                return;
            }
            persist(projectId, changed);
            projects.put(projectId, changed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Persists a graph before it is published. The in-memory store keeps nothing on disk.
     *
     * @throws StorageWriteException if the graph cannot be persisted
     */
    protected void persist(String projectId, ProjectGraph graph) {
        // in-memory only
    }

    /**
     * Publishes a graph loaded from persistent storage.
     */
    protected void load(String projectId, ProjectGraph graph) {
        projects.put(projectId, graph);
    }

    // ==================== Reads ====================

    protected ProjectGraph graph(String projectId) {
        requireProject(projectId);
        return projects.getOrDefault(projectId, EMPTY);
    }

    @Override
    public Optional<CodeEntity> getEntity(String projectId, String id) {
        return Optional.ofNullable(graph(projectId).entity(id));
    }

    @Override
    public List<CodeEntity> findByQualifiedName(String projectId, String qualifiedName) {
        List<CodeEntity> result = graph(projectId).entitiesByQualifiedName(qualifiedName);
        result.sort(ProjectGraph.ENTITY_ORDER);
        return result;
    }

    @Override
    public List<CodeRelation> getRelations(String projectId, String entityId, Set<RelationType> types,
                                           Direction direction) {
        ProjectGraph graph = graph(projectId);
        return switch (direction) {
            case OUT -> graph.outgoing(entityId, types);
            case IN -> graph.incoming(entityId, types);
            case BOTH -> {
                Map<String, CodeRelation> both = new HashMap<>();
                graph.outgoing(entityId, types).forEach(relation -> both.put(relation.id(), relation));
                graph.incoming(entityId, types).forEach(relation -> both.put(relation.id(), relation));
                List<CodeRelation> result = new ArrayList<>(both.values());
                result.sort(Comparator.comparing(CodeRelation::id));
                yield result;
            }
        };
    }

    @Override
    public List<CodeEntity> listEntities(String projectId) {
        return graph(projectId).allEntities();
    }

    @Override
    public List<CodeEntity> listEntitiesInFile(String projectId, String filePath) {
        return graph(projectId).entitiesInFile(filePath);
    }

    @Override
    public List<CodeRelation> listRelations(String projectId) {
        return graph(projectId).allRelations();
    }

    @Override
    public Set<String> listFiles(String projectId) {
        return graph(projectId).files();
    }

    @Override
    public List<QualityIssue> listIssues(String projectId, IssueFilter filter) {
        IssueFilter effective = filter == null ? IssueFilter.all() : filter;
        return graph(projectId).allIssues().stream()
            .filter(effective::matches)
            .sorted(Comparator.comparing(QualityIssue::severity).reversed()
                .thenComparing(issue -> issue.filePath() == null ? "" : issue.filePath())
                .thenComparingInt(QualityIssue::lineNumber)
                .thenComparing(QualityIssue::id))
            .toList();
    }

    @Override
    public List<DebtSnapshot> listSnapshots(String projectId) {
        return graph(projectId).allSnapshots();
    }

    @Override
    public Set<String> listProjects() {
        return new TreeSet<>(projects.keySet());
    }

    private static void requireProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be blank");
        }
    }
}
