package com.codegraph.core.store.impl;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.DebtSnapshot;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * All data of one project with its lookup indices.
 *
 * <p>Instances are mutated only while private to a writer. Once published by
 * {@link InMemoryGraphStore} a graph is never modified again; writers work on a
 * {@link #copy()}, which shares each {@link Section} with its origin until it writes to it.
 */
public final class ProjectGraph {

    static final Comparator<CodeEntity> ENTITY_ORDER = Comparator.comparing(CodeEntity::filePath)
        .thenComparingInt(CodeEntity::lineStart)
        .thenComparing(CodeEntity::qualifiedName)
        .thenComparing(CodeEntity::id);

    /**
     * Groups of data that are copied and persisted together.
     */
    public enum Section {
        ENTITIES, RELATIONS, ISSUES, SNAPSHOTS
    }

    private Map<String, CodeEntity> entities;
    private Map<String, Set<String>> idsByQualifiedName;
    private Map<String, Set<String>> idsByFile;
    private Map<String, CodeRelation> relations;
    private Map<String, Map<RelationType, Set<String>>> outgoing;
    private Map<String, Map<RelationType, Set<String>>> incoming;
    private Map<String, Set<String>> externalByTargetName;
    private Map<String, QualityIssue> issues;
    private List<DebtSnapshot> snapshots;

    // Sections this instance owns privately, i.e. changed since it was copied.
    private final EnumSet<Section> owned;

    public ProjectGraph() {
        this.entities = new HashMap<>();
        this.idsByQualifiedName = new HashMap<>();
        this.idsByFile = new HashMap<>();
        this.relations = new HashMap<>();
        this.outgoing = new HashMap<>();
        this.incoming = new HashMap<>();
        this.externalByTargetName = new HashMap<>();
        this.issues = new LinkedHashMap<>();
        this.snapshots = new ArrayList<>();
        this.owned = EnumSet.allOf(Section.class);
    }

    private ProjectGraph(ProjectGraph other) {
        this.entities = other.entities;
        this.idsByQualifiedName = other.idsByQualifiedName;
        this.idsByFile = other.idsByFile;
        this.relations = other.relations;
        this.outgoing = other.outgoing;
        this.incoming = other.incoming;
        this.externalByTargetName = other.externalByTargetName;
        this.issues = other.issues;
        this.snapshots = other.snapshots;
        this.owned = EnumSet.noneOf(Section.class);
    }

    /**
     * Returns a copy that can be modified without affecting this graph. Sections are
     * shared until the copy first modifies them.
     */
    public ProjectGraph copy() {
        return new ProjectGraph(this);
    }

    /**
     * Returns the sections modified since this graph was copied; all of them for a new graph.
     */
    public Set<Section> changedSections() {
        return EnumSet.copyOf(owned);
    }

    private void own(Section section) {
        if (!owned.add(section)) {
            return;
        }
        switch (section) {
            case ENTITIES -> {
                entities = new HashMap<>(entities);
                idsByQualifiedName = copySets(idsByQualifiedName);
                idsByFile = copySets(idsByFile);
            }
            case RELATIONS -> {
                relations = new HashMap<>(relations);
                outgoing = copyAdjacency(outgoing);
                incoming = copyAdjacency(incoming);
                externalByTargetName = copySets(externalByTargetName);
            }
            case ISSUES -> issues = new LinkedHashMap<>(issues);
            case SNAPSHOTS -> snapshots = new ArrayList<>(snapshots);
        }
    }

    // ==================== Entities ====================

    public CodeEntity entity(String id) {
        return entities.get(id);
    }

    public boolean containsEntity(String id) {
        return entities.containsKey(id);
    }

    public void putEntity(CodeEntity entity) {
        own(Section.ENTITIES);
        removeEntity(entity.id());
        entities.put(entity.id(), entity);
        idsByQualifiedName.computeIfAbsent(entity.qualifiedName(), key -> new TreeSet<>()).add(entity.id());
        idsByFile.computeIfAbsent(entity.filePath(), key -> new TreeSet<>()).add(entity.id());
    }

    /**
     * Removes an entity and its index entries; relations are left to the caller.
     *
     * @return the removed entity, or null
     */
    public CodeEntity removeEntity(String id) {
        if (!entities.containsKey(id)) {
            return null;
        }
        own(Section.ENTITIES);
        CodeEntity removed = entities.remove(id);
        if (removed != null) {
            removeFromIndex(idsByQualifiedName, removed.qualifiedName(), id);
            removeFromIndex(idsByFile, removed.filePath(), id);
        }
        return removed;
    }

    public Set<String> idsInFile(String filePath) {
        return Set.copyOf(idsByFile.getOrDefault(filePath, Set.of()));
    }

    public List<CodeEntity> entitiesByQualifiedName(String qualifiedName) {
        return resolve(idsByQualifiedName.getOrDefault(qualifiedName, Set.of()));
    }

    public List<CodeEntity> entitiesInFile(String filePath) {
        List<CodeEntity> result = resolve(idsByFile.getOrDefault(filePath, Set.of()));
        result.sort(ENTITY_ORDER);
        return result;
    }

    public List<CodeEntity> allEntities() {
        List<CodeEntity> result = new ArrayList<>(entities.values());
        result.sort(ENTITY_ORDER);
        return result;
    }

    public Set<String> files() {
        return new TreeSet<>(idsByFile.keySet());
    }

    private List<CodeEntity> resolve(Collection<String> ids) {
        List<CodeEntity> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            CodeEntity entity = entities.get(id);
            if (entity != null) {
                result.add(entity);
            }
        }
        return result;
    }

    // ==================== Relations ====================

    public CodeRelation relation(String id) {
        return relations.get(id);
    }

    public void putRelation(CodeRelation relation) {
        own(Section.RELATIONS);
        removeRelation(relation.id());
        relations.put(relation.id(), relation);
        addAdjacency(outgoing, relation.sourceId(), relation.type(), relation.id());
        if (relation.isExternal()) {
            externalByTargetName.computeIfAbsent(relation.targetName(), key -> new TreeSet<>()).add(relation.id());
        } else {
            addAdjacency(incoming, relation.targetId(), relation.type(), relation.id());
        }
    }

    public CodeRelation removeRelation(String id) {
        if (!relations.containsKey(id)) {
            return null;
        }
        own(Section.RELATIONS);
        CodeRelation removed = relations.remove(id);
        if (removed != null) {
            removeAdjacency(outgoing, removed.sourceId(), removed.type(), id);
            if (removed.isExternal()) {
                removeFromIndex(externalByTargetName, removed.targetName(), id);
            } else {
                removeAdjacency(incoming, removed.targetId(), removed.type(), id);
            }
        }
        return removed;
    }

    /**
     * Returns relations whose source is the entity, ordered by id.
     *
     * @param entityId source entity
     * @param types accepted types; null or empty accepts all
     */
    public List<CodeRelation> outgoing(String entityId, Set<RelationType> types) {
        return adjacent(outgoing, entityId, types);
    }

    /**
     * Returns resolved relations whose target is the entity, ordered by id.
     */
    public List<CodeRelation> incoming(String entityId, Set<RelationType> types) {
        return adjacent(incoming, entityId, types);
    }

    public List<CodeRelation> externalRelationsNamed(String targetName) {
        List<CodeRelation> result = new ArrayList<>();
        for (String id : externalByTargetName.getOrDefault(targetName, Set.of())) {
            result.add(relations.get(id));
        }
        return result;
    }

    public List<CodeRelation> allRelations() {
        List<CodeRelation> result = new ArrayList<>(relations.values());
        result.sort(Comparator.comparing(CodeRelation::id));
        return result;
    }

    private List<CodeRelation> adjacent(Map<String, Map<RelationType, Set<String>>> adjacency, String entityId,
                                        Set<RelationType> types) {
        Map<RelationType, Set<String>> byType = adjacency.get(entityId);
        if (byType == null) {
            return new ArrayList<>();
        }
        Set<String> ids = new TreeSet<>();
        byType.forEach((type, relationIds) -> {
            if (types == null || types.isEmpty() || types.contains(type)) {
                ids.addAll(relationIds);
            }
        });
        List<CodeRelation> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(relations.get(id));
        }
        return result;
    }

    // ==================== Issues and Snapshots ====================

    public QualityIssue issue(String id) {
        return issues.get(id);
    }

    public void putIssue(QualityIssue issue) {
        own(Section.ISSUES);
        issues.put(issue.id(), issue);
    }

    public List<QualityIssue> allIssues() {
        return new ArrayList<>(issues.values());
    }

    public void addSnapshot(DebtSnapshot snapshot) {
        own(Section.SNAPSHOTS);
        snapshots.add(snapshot);
        snapshots.sort(Comparator.comparing(DebtSnapshot::createdAt).thenComparing(DebtSnapshot::id));
    }

    public List<DebtSnapshot> allSnapshots() {
        return List.copyOf(snapshots);
    }

    // ==================== Helpers ====================

    private static void addAdjacency(Map<String, Map<RelationType, Set<String>>> adjacency, String entityId,
                                     RelationType type, String relationId) {
        adjacency.computeIfAbsent(entityId, key -> new EnumMap<>(RelationType.class))
            .computeIfAbsent(type, key -> new TreeSet<>())
            .add(relationId);
    }

    private static void removeAdjacency(Map<String, Map<RelationType, Set<String>>> adjacency, String entityId,
                                        RelationType type, String relationId) {
        Map<RelationType, Set<String>> byType = adjacency.get(entityId);
        if (byType == null) {
            return;
        }
        Set<String> ids = byType.get(type);
        if (ids != null) {
            ids.remove(relationId);
            if (ids.isEmpty()) {
                byType.remove(type);
            }
        }
        if (byType.isEmpty()) {
            adjacency.remove(entityId);
        }
    }

    private static void removeFromIndex(Map<String, Set<String>> index, String key, String id) {
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private static Map<String, Set<String>> copySets(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new HashMap<>(source.size() * 2);
        source.forEach((key, value) -> copy.put(key, new TreeSet<>(value)));
        return copy;
    }

    private static Map<String, Map<RelationType, Set<String>>> copyAdjacency(
        Map<String, Map<RelationType, Set<String>>> source) {
        Map<String, Map<RelationType, Set<String>>> copy = new HashMap<>(source.size() * 2);
        source.forEach((entityId, byType) -> {
            Map<RelationType, Set<String>> typeCopy = new EnumMap<>(RelationType.class);
            byType.forEach((type, ids) -> typeCopy.put(type, new TreeSet<>(ids)));
            copy.put(entityId, typeCopy);
        });
        return copy;
    }
}
