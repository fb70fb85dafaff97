package com.codegraph.core.extractor;

import java.util.Map;
import java.util.Objects;

/**
 * An entity as reported by an extractor, before id assignment and kind normalization.
 *
 * @param localId index of this entity within its {@link ExtractionResult}
 * @param parentLocalId local id of the containing entity, or {@link #NO_PARENT}
 * @param name simple name
 * @param qualifiedName dotted qualified name
 * @param kind extractor vocabulary (e.g. "struct", "method", "hook")
 * @param lineStart first line (1-based)
 * @param lineEnd last line
 * @param signature declaration signature, may be null
 * @param docSummary documentation summary, may be null
 * @param metadata extractor-specific facts
 */
public record RawEntity(
    int localId,
    int parentLocalId,
    String name,
    String qualifiedName,
    String kind,
    int lineStart,
    int lineEnd,
    String signature,
    String docSummary,
    Map<String, Object> metadata
) {
    public static final int NO_PARENT = -1;

    public RawEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (lineEnd < lineStart) {
            lineEnd = lineStart;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean hasParent() {
        return parentLocalId != NO_PARENT;
    }
}
