package com.codegraph.core.query;

import com.codegraph.core.store.Direction;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dependencies or dependents of one entity.
 *
 * @param rootId entity the search started from; never part of {@code nodes}
 * @param direction OUT for dependencies, IN for dependents, BOTH for either
 * @param transitive true if the closure was computed
 * @param nodes reached entities ordered by depth, then qualified name
 * @param externalNames names of dependencies outside the project
 */
public record DependencyResult(
    String rootId,
    Direction direction,
    boolean transitive,
    List<DependencyNode> nodes,
    Set<String> externalNames
) {
    public DependencyResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        externalNames = externalNames == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(externalNames));
    }

    public int size() {
        return nodes.size();
    }
}
