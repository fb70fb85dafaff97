package com.codegraph.core.query;

import com.codegraph.core.model.EntityKind;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Metrics of one group (directory or file) of an architecture summary.
 *
 * @param name directory or file path
 * @param languages language ids present in the group
 * @param fileCount files in the group
 * @param entityCounts entities per kind
 * @param inDegree relations entering the group from other groups
 * @param outDegree relations leaving the group, external ones included
 * @param internalEdges relations between entities of the group, containment excluded
 * @param dependsOn groups this group has outgoing relations to
 */
public record ModuleSummary(
    String name,
    Set<String> languages,
    int fileCount,
    Map<EntityKind, Integer> entityCounts,
    int inDegree,
    int outDegree,
    int internalEdges,
    Set<String> dependsOn
) {
    public ModuleSummary {
        languages = languages == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(languages));
        entityCounts = entityCounts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(entityCounts));
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(dependsOn));
    }

    public int totalEntities() {
        return entityCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Share of outgoing coupling among all coupling of the group, in [0, 1].
     * 0 means only depended upon, 1 means only depending on others.
     */
    public double instability() {
        int total = inDegree + outDegree;
        return total == 0 ? 0.0 : (double) outDegree / total;
    }
}
