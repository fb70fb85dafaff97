package com.codegraph.core.quality;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.CodeRelation;
import com.codegraph.core.model.IssueType;
import com.codegraph.core.model.QualityIssue;
import com.codegraph.core.model.RelationType;
import com.codegraph.core.model.Severity;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds dependency cycles over resolved IMPORTS and USES relations.
 *
 * <p>Depth-first search with an explicit frame stack, so deep graphs cannot overflow the
 * call stack. A back edge to a node on the stack yields the stack slice starting at that
 * node. Cycles are deduplicated by rotating them to start at their smallest entity id;
 * self-loops are ignored.
 */
public class CycleDetector {

    /**
     * Returns every distinct cycle found, each as entity ids in canonical rotation,
     * ordered by first id.
     */
    public List<List<String>> findCycles(List<CodeRelation> relations) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (CodeRelation relation : relations) {
            if (relation.isExternal() || !RelationType.DEPENDENCY_TYPES.contains(relation.type())
                || relation.sourceId().equals(relation.targetId())) {
                continue;
            }
            adjacency.computeIfAbsent(relation.sourceId(), key -> new TreeSet<>()).add(relation.targetId());
        }

        Map<List<String>, List<String>> cycles = new TreeMap<>(CycleDetector::compareCycles);
        Set<String> done = new HashSet<>();
        for (String start : adjacency.keySet()) {
            if (!done.contains(start)) {
                search(start, adjacency, done, cycles);
            }
        }
        return new ArrayList<>(cycles.values());
    }

    private static void search(String start, Map<String, Set<String>> adjacency, Set<String> done,
                               Map<List<String>, List<String>> cycles) {
        Deque<Frame> frames = new ArrayDeque<>();
        List<String> stack = new ArrayList<>();
        Map<String, Integer> stackIndex = new HashMap<>();
        frames.push(new Frame(start, adjacency));
        stackIndex.put(start, 0);
        stack.add(start);

        while (!frames.isEmpty()) {
            Frame frame = frames.peek();
            if (!frame.neighbours.hasNext()) {
                frames.pop();
                stack.remove(stack.size() - 1);
                stackIndex.remove(frame.node);
                done.add(frame.node);
                continue;
            }
            String next = frame.neighbours.next();
            Integer onStack = stackIndex.get(next);
            if (onStack != null) {
                List<String> cycle = canonical(stack.subList(onStack, stack.size()));
                cycles.putIfAbsent(cycle, cycle);
            } else if (!done.contains(next)) {
                frames.push(new Frame(next, adjacency));
                stackIndex.put(next, stack.size());
                stack.add(next);
            }
        }
    }

    private static final class Frame {
        final String node;
        final Iterator<String> neighbours;

        Frame(String node, Map<String, Set<String>> adjacency) {
            this.node = node;
            this.neighbours = adjacency.getOrDefault(node, Set.of()).iterator();
        }
    }

    /**
     * Rotates a cycle so that it starts at its smallest id.
     */
    static List<String> canonical(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0) {
                min = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((min + i) % cycle.size()));
        }
        return List.copyOf(rotated);
    }

    private static int compareCycles(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    static Severity severityOf(int length) {
        if (length > 4) {
            return Severity.CRITICAL;
        }
        return length >= 3 ? Severity.HIGH : Severity.MEDIUM;
    }

    /**
     * Detects cycles and reports one CIRCULAR_DEPENDENCY issue per cycle.
     */
    public List<QualityIssue> detect(String projectId, List<CodeEntity> entities, List<CodeRelation> relations,
                                     Instant now) {
        Map<String, CodeEntity> byId = new LinkedHashMap<>();
        entities.forEach(entity -> byId.put(entity.id(), entity));

        List<QualityIssue> issues = new ArrayList<>();
        for (List<String> cycle : findCycles(relations)) {
            CodeEntity first = byId.get(cycle.get(0));
            if (first == null) {
                continue;
            }
            List<String> names = cycle.stream()
                .map(id -> byId.containsKey(id) ? byId.get(id).qualifiedName() : id)
                .toList();
            Set<String> files = cycle.stream()
                .filter(byId::containsKey)
                .map(id -> byId.get(id).filePath())
                .collect(Collectors.toCollection(LinkedHashSet::new));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("cycle", names);
            metadata.put("entityIds", cycle);
            metadata.put("files", List.copyOf(files));
            metadata.put("length", cycle.size());
            String description = "Dependency cycle of " + cycle.size() + " entities: "
                + String.join(" -> ", names) + " -> " + names.get(0);
            issues.add(IssueFactory.create(projectId, IssueType.CIRCULAR_DEPENDENCY, severityOf(cycle.size()),
                String.join(",", cycle), first, description,
                "Break the cycle by extracting the shared part or inverting one dependency behind an interface",
                metadata, now));
        }
        return issues;
    }
}
