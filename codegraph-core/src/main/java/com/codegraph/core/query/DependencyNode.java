package com.codegraph.core.query;

import com.codegraph.core.model.CodeEntity;
import com.codegraph.core.model.RelationType;

/**
 * An entity reached while collecting dependencies.
 *
 * @param entity the dependency or dependent
 * @param depth number of hops from the root
 * @param viaType type of the relation it was first reached through
 */
public record DependencyNode(CodeEntity entity, int depth, RelationType viaType) {
}
