package com.codegraph.core.extractor;

import java.util.Map;
import java.util.Objects;

/**
 * A relation as reported by an extractor: the source is a local entity, the target is
 * still a name that the normalizer resolves against the whole project.
 *
 * @param sourceLocalId local id of the source entity
 * @param targetName target as written (possibly rewritten through import aliases)
 * @param type extractor vocabulary (e.g. "calls", "extends", "conforms")
 * @param line source line of the reference, or 0
 * @param metadata extra facts such as alias or receiver
 */
public record RawRelation(
    int sourceLocalId,
    String targetName,
    String type,
    int line,
    Map<String, Object> metadata
) {
    public RawRelation {
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(type, "type must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
