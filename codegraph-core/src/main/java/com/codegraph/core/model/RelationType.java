package com.codegraph.core.model;

import java.util.Set;

/**
 * Unified vocabulary of relation types between code entities.
 */
public enum RelationType {
    CALLS,
    IMPORTS,
    INHERITS,
    IMPLEMENTS,
    CONTAINS,
    USES,
    DEFINES;

    /**
     * Relation types that express a dependency between modules or types.
     */
    public static final Set<RelationType> DEPENDENCY_TYPES = Set.of(IMPORTS, USES);

    /**
     * Relation types counted for fan-in/fan-out; structural containment is excluded.
     */
    public static final Set<RelationType> COUPLING_TYPES = Set.of(CALLS, IMPORTS, INHERITS, IMPLEMENTS, USES);
}
