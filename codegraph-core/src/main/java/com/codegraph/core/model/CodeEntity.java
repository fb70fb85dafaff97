package com.codegraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.Objects;

/**
 * A named, located unit of source code: module, class, function, method, property or component.
 *
 * <p>Ids are derived from {@code (projectId, qualifiedName, filePath)}, so re-analysing unchanged
 * source reproduces the same ids. File paths are relative to the analysed root and use
 * {@code /} as separator.
 *
 * @param id deterministic identifier
 * @param projectId owning project
 * @param name simple name
 * @param qualifiedName dotted name including module and enclosing types
 * @param kind unified entity kind
 * @param language source language
 * @param filePath project-relative file path
 * @param lineStart first line (1-based)
 * @param lineEnd last line (1-based, {@code >= lineStart})
 * @param signature declaration signature, may be null
 * @param docSummary first sentence of the documentation, may be null
 * @param parentId containing entity, null for modules
 * @param metadata extractor-specific facts (decorators, modifiers, annotations, ...)
 */
public record CodeEntity(
    String id,
    String projectId,
    String name,
    String qualifiedName,
    EntityKind kind,
    Language language,
    String filePath,
    int lineStart,
    int lineEnd,
    String signature,
    String docSummary,
    String parentId,
    Map<String, Object> metadata
) {
    public CodeEntity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (name == null) {
            name = qualifiedName;
        }
        if (lineStart < 1) {
            lineStart = 1;
        }
        if (lineEnd < lineStart) {
            lineEnd = lineStart;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Returns the number of source lines spanned by this entity, not counting the first line.
     *
     * @return {@code lineEnd - lineStart}
     */
    @JsonIgnore
    public int getLength() {
        return lineEnd - lineStart;
    }
}
