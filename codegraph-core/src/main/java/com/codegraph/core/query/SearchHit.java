package com.codegraph.core.query;

import com.codegraph.core.model.CodeEntity;

/**
 * A search result with its relevance score.
 */
public record SearchHit(CodeEntity entity, double score) {
}
