package com.codegraph.core.store;

/**
 * Direction of relations relative to an entity.
 */
public enum Direction {
    /** Relations whose source is the entity. */
    OUT,
    /** Relations whose target is the entity. */
    IN,
    BOTH
}
