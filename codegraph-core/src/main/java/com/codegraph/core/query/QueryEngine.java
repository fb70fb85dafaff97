package com.codegraph.core.query;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.EntityKind;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.store.Direction;
import com.codegraph.core.store.GraphStore;
import com.codegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only graph queries: call chains, dependencies, search and architecture summaries.
 *
 * <p>Queries read the store's published snapshot and never take a project write lock.
 * Every traversal keeps a visited set by entity id, so cyclic graphs terminate.
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_NODES = 500;
    public static final int DEFAULT_SEARCH_LIMIT = 50;

    static final double NAME_WEIGHT = 1.0;
    static final double QUALIFIED_NAME_WEIGHT = 0.8;
    static final double DOC_WEIGHT = 0.4;
    static final double EXACT_NAME_BONUS = 1.0;

    private static final Comparator<CodeRelation> BY_TARGET = Comparator
        .comparing((CodeRelation relation) -> relation.targetName() == null ? "" : relation.targetName())
        .thenComparing(CodeRelation::id);

    private final GraphStore store;
    private final int defaultMaxDepth;
    private final int defaultMaxNodes;

    public QueryEngine(GraphStore store) {
        this(store, DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);
    }

    public QueryEngine(GraphStore store, int defaultMaxDepth, int defaultMaxNodes) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.defaultMaxDepth = defaultMaxDepth;
        this.defaultMaxNodes = defaultMaxNodes;
    }

    // ==================== Entities ====================

    /**
     * Looks an entity up by id, then by qualified name.
     *
     * @param projectId project to search
     * @param idOrQualifiedName entity id or qualified name
     * @return the entity
     * @throws EntityNotFoundException if neither lookup succeeds
     */
    public CodeEntity getEntity(String projectId, String idOrQualifiedName) {
        return findEntity(projectId, idOrQualifiedName)
            .orElseThrow(() -> new EntityNotFoundException(projectId, idOrQualifiedName));
    }

    public Optional<CodeEntity> findEntity(String projectId, String idOrQualifiedName) {
        if (idOrQualifiedName == null || idOrQualifiedName.isBlank()) {
            throw new IllegalArgumentException("Entity reference must not be blank");
        }
        Optional<CodeEntity> byId = store.getEntity(projectId, idOrQualifiedName);
        if (byId.isPresent()) {
            return byId;
        }
        return store.findByQualifiedName(projectId, idOrQualifiedName).stream().findFirst();
    }

    // ==================== Call Chains ====================

    public CallChainResult traceCallChain(String projectId, String startId) {
        return traceCallChain(projectId, startId, defaultMaxDepth, defaultMaxNodes, Set.of(RelationType.CALLS));
    }

    /**
     * Expands the callees of an entity breadth-first.
     *
     * <p>Each entity is expanded at most once. An edge to an ancestor on the current path
     * ends that path with {@link CallPath.Truncation#CYCLE}; an edge to an entity expanded
     * elsewhere ends it with {@link CallPath.Truncation#REVISIT}. External callees become
     * leaves.
     *
     * @param projectId project to query
     * @param startId id or qualified name of the root
     * @param maxDepth deepest level expanded; 0 returns only the root
     * @param maxNodes upper bound on tree nodes, root included
     * @param relationTypes relation types followed; null or empty means CALLS
     * @return call tree, paths and truncation flags
     * @throws EntityNotFoundException if the start entity does not exist
     */
    public CallChainResult traceCallChain(String projectId, String startId, int maxDepth, int maxNodes,
                                          Set<RelationType> relationTypes) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be >= 1");
        }
        Set<RelationType> types = relationTypes == null || relationTypes.isEmpty()
            ? Set.of(RelationType.CALLS)
            : relationTypes;
        CodeEntity start = getEntity(projectId, startId);

        TreeNode root = new TreeNode(start.id(), start.qualifiedName(), false, null);
        Set<String> expanded = new HashSet<>();
        expanded.add(start.id());
        Deque<TreeNode> queue = new ArrayDeque<>();
        queue.add(root);
        List<CallPath> paths = new ArrayList<>();
        int nodes = 1;
        boolean truncatedByDepth = false;
        boolean truncatedByNodes = false;
        boolean cycleDetected = false;

        while (!queue.isEmpty()) {
            TreeNode node = queue.poll();
            List<CodeRelation> calls = new ArrayList<>(store.getRelations(projectId, node.entityId, types, Direction.OUT));
            if (calls.isEmpty()) {
                paths.add(node.path(CallPath.Truncation.NONE));
                continue;
            }
            if (node.depth >= maxDepth) {
                truncatedByDepth = true;
                paths.add(node.path(CallPath.Truncation.DEPTH));
                continue;
            }
            calls.sort(BY_TARGET);
            for (CodeRelation call : calls) {
                String targetId = call.targetId();
                if (targetId != null && node.isOnPath(targetId)) {
                    cycleDetected = true;
                    paths.add(node.pathTo(targetId, call.targetName(), CallPath.Truncation.CYCLE));
                    continue;
                }
                if (targetId != null && expanded.contains(targetId)) {
                    paths.add(node.pathTo(targetId, call.targetName(), CallPath.Truncation.REVISIT));
                    continue;
                }
                if (nodes >= maxNodes) {
                    truncatedByNodes = true;
                    paths.add(node.path(CallPath.Truncation.NODE_LIMIT));
                    break;
                }
                nodes++;
                TreeNode child = node.addChild(targetId, call.targetName(), call.isExternal());
                if (call.isExternal()) {
                    paths.add(child.path(CallPath.Truncation.NONE));
                } else {
                    expanded.add(targetId);
                    queue.add(child);
                }
            }
        }
        log.debug("Traced {} in {}: {} nodes, {} paths", start.qualifiedName(), projectId, nodes, paths.size());
        return new CallChainResult(root.freeze(), paths, nodes, truncatedByDepth, truncatedByNodes, cycleDetected);
    }

    /**
     * Mutable tree node used while tracing; frozen into {@link CallNode} records at the end.
     */
    private static final class TreeNode {
        final String entityId;
        final String name;
        final boolean external;
        final TreeNode parent;
        final int depth;
        final List<TreeNode> children = new ArrayList<>();

        TreeNode(String entityId, String name, boolean external, TreeNode parent) {
            this.entityId = entityId;
            this.name = name;
            this.external = external;
            this.parent = parent;
            this.depth = parent == null ? 0 : parent.depth + 1;
        }

        TreeNode addChild(String childId, String childName, boolean childExternal) {
            TreeNode child = new TreeNode(childId, childName, childExternal, this);
            children.add(child);
            return child;
        }

        boolean isOnPath(String id) {
            for (TreeNode node = this; node != null; node = node.parent) {
                if (id.equals(node.entityId)) {
                    return true;
                }
            }
            return false;
        }

        CallPath path(CallPath.Truncation truncation) {
            List<String> ids = new ArrayList<>();
            List<String> names = new ArrayList<>();
            for (TreeNode node = this; node != null; node = node.parent) {
                ids.add(0, node.entityId);
                names.add(0, node.name);
            }
            return new CallPath(ids, names, truncation);
        }

        CallPath pathTo(String nextId, String nextName, CallPath.Truncation truncation) {
            CallPath prefix = path(truncation);
            List<String> ids = new ArrayList<>(prefix.entityIds());
            List<String> names = new ArrayList<>(prefix.names());
            ids.add(nextId);
            names.add(nextName);
            return new CallPath(ids, names, truncation);
        }

        /**
         * Converts the subtree into records, children before parents.
         */
        CallNode freeze() {
            List<TreeNode> breadthFirst = new ArrayList<>();
            breadthFirst.add(this);
            for (int i = 0; i < breadthFirst.size(); i++) {
                breadthFirst.addAll(breadthFirst.get(i).children);
            }
            Map<TreeNode, CallNode> frozen = new IdentityHashMap<>();
            for (int i = breadthFirst.size() - 1; i >= 0; i--) {
                TreeNode node = breadthFirst.get(i);
                List<CallNode> frozenChildren = new ArrayList<>(node.children.size());
                for (TreeNode child : node.children) {
                    frozenChildren.add(frozen.remove(child));
                }
                frozen.put(node, new CallNode(node.entityId, node.name, node.depth, node.external, frozenChildren));
            }
            return frozen.get(this);
        }
    }

    // ==================== Dependencies ====================

    /**
     * Collects the IMPORTS/USES neighbourhood of an entity.
     *
     * @param projectId project to query
     * @param entityId id or qualified name of the root
     * @param direction OUT for what the entity depends on, IN for what depends on it
     * @param transitive false for direct neighbours only, true for the closure
     * @return reached entities; the root is never included
     * @throws EntityNotFoundException if the root does not exist
     */
    public DependencyResult findDependencies(String projectId, String entityId, Direction direction,
                                             boolean transitive) {
        Objects.requireNonNull(direction, "direction must not be null");
        CodeEntity root = getEntity(projectId, entityId);

        Map<String, DependencyNode> reached = new LinkedHashMap<>();
        Set<String> externalNames = new TreeSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        Map<String, Integer> depths = new HashMap<>();
        frontier.add(root.id());
        depths.put(root.id(), 0);

        while (!frontier.isEmpty()) {
            String current = frontier.poll();
            int depth = depths.get(current);
            for (CodeRelation relation : store.getRelations(projectId, current, RelationType.DEPENDENCY_TYPES, direction)) {
                boolean outgoing = relation.sourceId().equals(current);
                if (outgoing && relation.isExternal()) {
                    externalNames.add(relation.targetName());
                    continue;
                }
                String neighbour = outgoing ? relation.targetId() : relation.sourceId();
                if (neighbour.equals(root.id()) || depths.containsKey(neighbour)) {
                    continue;
                }
                Optional<CodeEntity> entity = store.getEntity(projectId, neighbour);
                if (entity.isEmpty()) {
                    continue;
                }
                depths.put(neighbour, depth + 1);
                reached.put(neighbour, new DependencyNode(entity.get(), depth + 1, relation.type()));
                if (transitive) {
                    frontier.add(neighbour);
                }
            }
        }

        List<DependencyNode> nodes = new ArrayList<>(reached.values());
        nodes.sort(Comparator.comparingInt(DependencyNode::depth)
            .thenComparing(node -> node.entity().qualifiedName()));
        return new DependencyResult(root.id(), direction, transitive, nodes, externalNames);
    }

    // ==================== Search ====================

    public List<SearchHit> searchEntities(String projectId, String query) {
        return searchEntities(projectId, query, Set.of(), DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Ranks entities by how well their names and documentation match a query.
     *
     * <p>The query is split on whitespace; every token must match at least one of simple
     * name, qualified name or doc summary. Matching is case-insensitive.
     *
     * @param projectId project to search
     * @param query search text; blank returns no hits
     * @param kindFilter accepted kinds; null or empty accepts all
     * @param limit maximum number of hits
     * @return hits by descending score, ties by qualified name
     */
    public List<SearchHit> searchEntities(String projectId, String query, Set<EntityKind> kindFilter, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (query == null || query.isBlank() || limit == 0) {
            return List.of();
        }
        List<String> tokens = Arrays.stream(query.trim().toLowerCase(Locale.ROOT).split("\\s+"))
            .filter(token -> !token.isEmpty())
            .toList();

        List<SearchHit> hits = new ArrayList<>();
        for (CodeEntity entity : store.listEntities(projectId)) {
            if (kindFilter != null && !kindFilter.isEmpty() && !kindFilter.contains(entity.kind())) {
                continue;
            }
            double score = score(entity, tokens);
            if (score > 0) {
                hits.add(new SearchHit(entity, score));
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed()
            .thenComparing(hit -> hit.entity().qualifiedName())
            .thenComparing(hit -> hit.entity().id()));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    /**
     * Scores an entity against lowercase query tokens; 0 if any token matches nowhere.
     */
    static double score(CodeEntity entity, List<String> tokens) {
        String name = lower(entity.name());
        String qualifiedName = lower(entity.qualifiedName());
        String doc = lower(entity.docSummary());
        double total = 0.0;
        for (String token : tokens) {
            double tokenScore = fieldScore(name, token, NAME_WEIGHT)
                + fieldScore(qualifiedName, token, QUALIFIED_NAME_WEIGHT)
                + fieldScore(doc, token, DOC_WEIGHT);
            if (tokenScore == 0.0) {
                return 0.0;
            }
            if (name.equals(token)) {
                tokenScore += EXACT_NAME_BONUS;
            }
            total += tokenScore;
        }
        return total;
    }

    static double fieldScore(String field, String token, double weight) {
        if (field.isEmpty()) {
            return 0.0;
        }
        int position = field.indexOf(token);
        if (position < 0) {
            return 0.0;
        }
        double length = field.length();
        double score = weight * (0.5 * token.length() / length + 0.5 * (1.0 - position / length));
        if (position == 0) {
            score += 0.5 * weight;
        }
        return score;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    // ==================== Architecture ====================

    public ArchitectureSummary summarizeArchitecture(String projectId) {
        return summarizeArchitecture(projectId, GroupBy.DIRECTORY);
    }

    /**
     * Aggregates entities and relations per directory or per file.
     *
     * @param projectId project to summarize
     * @param groupBy grouping of files into modules
     * @return summary with one {@link ModuleSummary} per group
     */
    public ArchitectureSummary summarizeArchitecture(String projectId, GroupBy groupBy) {
        GroupBy grouping = groupBy == null ? GroupBy.DIRECTORY : groupBy;
        List<CodeEntity> entities = store.listEntities(projectId);
        List<CodeRelation> relations = store.listRelations(projectId);

        Map<EntityKind, Integer> byKind = new EnumMap<>(EntityKind.class);
        Map<String, Integer> byLanguage = new TreeMap<>();
        Map<String, String> groupOf = new HashMap<>();
        Map<String, GroupStats> groups = new TreeMap<>();

        for (CodeEntity entity : entities) {
            byKind.merge(entity.kind(), 1, Integer::sum);
            if (entity.language() != null) {
                byLanguage.merge(entity.language().getId(), 1, Integer::sum);
            }
            String group = grouping == GroupBy.FILE ? entity.filePath() : FileUtils.directoryOf(entity.filePath());
            groupOf.put(entity.id(), group);
            GroupStats stats = groups.computeIfAbsent(group, key -> new GroupStats());
            stats.files.add(entity.filePath());
            stats.entityCounts.merge(entity.kind(), 1, Integer::sum);
            if (entity.language() != null) {
                stats.languages.add(entity.language().getId());
            }
        }

        for (CodeRelation relation : relations) {
            String sourceGroup = groupOf.get(relation.sourceId());
            if (sourceGroup == null) {
                continue;
            }
            GroupStats source = groups.get(sourceGroup);
            if (relation.isExternal()) {
                source.outDegree++;
                continue;
            }
            String targetGroup = groupOf.get(relation.targetId());
            if (targetGroup == null) {
                continue;
            }
            if (targetGroup.equals(sourceGroup)) {
                if (relation.type() != RelationType.CONTAINS) {
                    source.internalEdges++;
                }
            } else {
                source.outDegree++;
                source.dependsOn.add(targetGroup);
                groups.get(targetGroup).inDegree++;
            }
        }

        List<ModuleSummary> modules = new ArrayList<>();
        groups.forEach((name, stats) -> modules.add(new ModuleSummary(name, stats.languages, stats.files.size(),
            stats.entityCounts, stats.inDegree, stats.outDegree, stats.internalEdges, stats.dependsOn)));
        int totalFiles = store.listFiles(projectId).size();
        return new ArchitectureSummary(projectId, grouping, totalFiles, entities.size(), relations.size(),
            byKind, byLanguage, modules);
    }

    private static final class GroupStats {
        final Set<String> files = new TreeSet<>();
        final Set<String> languages = new TreeSet<>();
        final Map<EntityKind, Integer> entityCounts = new EnumMap<>(EntityKind.class);
        final Set<String> dependsOn = new TreeSet<>();
        int inDegree;
        int outDegree;
        int internalEdges;
    }
}
