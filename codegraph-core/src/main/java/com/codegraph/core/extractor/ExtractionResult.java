package com.codegraph.core.extractor;

import com.codegraph.core.model.Language;
import com.codegraph.core.model.ParseError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw facts extracted from one file.
 *
 * @param filePath project-relative path of the file
 * @param language language of the file
 * @param confidence how the facts were obtained; drops to MEDIUM when a grammar-based
 *                   extractor had to fall back to patterns
 * @param entities raw entities in source order; the first one is the file's module
 * @param relations raw relations
 * @param errors recoverable parse errors
 */
public record ExtractionResult(
    String filePath,
    Language language,
    ConfidenceLevel confidence,
    List<RawEntity> entities,
    List<RawRelation> relations,
    List<ParseError> errors
) {
    public ExtractionResult {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(language, "language must not be null");
        if (confidence == null) {
            confidence = ConfidenceLevel.MEDIUM;
        }
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a result holding only errors, for files that could not be read or parsed at all.
     *
     * @param filePath project-relative path
     * @param language language of the file
     * @param error the failure
     * @return result without entities
     */
    public static ExtractionResult failed(String filePath, Language language, ParseError error) {
        return new ExtractionResult(filePath, language, ConfidenceLevel.LOW, List.of(), List.of(), List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Builder used by extractors to collect facts while walking a file.
     */
    public static class Builder {
        private final String filePath;
        private final Language language;
        private ConfidenceLevel confidence;
        private final List<RawEntity> entities = new ArrayList<>();
        private final List<RawRelation> relations = new ArrayList<>();
        private final List<ParseError> errors = new ArrayList<>();

        public Builder(String filePath, Language language, ConfidenceLevel confidence) {
            this.filePath = Objects.requireNonNull(filePath, "filePath must not be null");
            this.language = Objects.requireNonNull(language, "language must not be null");
            this.confidence = confidence;
        }

        public String filePath() {
            return filePath;
        }

        public Builder confidence(ConfidenceLevel level) {
            this.confidence = level;
            return this;
        }

        /**
         * Adds an entity and returns its local id.
         */
        public int addEntity(int parentLocalId, String name, String qualifiedName, String kind,
                             int lineStart, int lineEnd, String signature, String docSummary,
                             Map<String, Object> metadata) {
            int localId = entities.size();
            entities.add(new RawEntity(localId, parentLocalId, name, qualifiedName, kind,
                lineStart, lineEnd, signature, docSummary, metadata));
            return localId;
        }

        public RawEntity entity(int localId) {
            return entities.get(localId);
        }

        public int entityCount() {
            return entities.size();
        }

        /**
         * Updates the end line of an entity whose extent is only known after its body was read.
         */
        public void closeEntity(int localId, int lineEnd) {
            RawEntity e = entities.get(localId);
            entities.set(localId, new RawEntity(e.localId(), e.parentLocalId(), e.name(), e.qualifiedName(),
                e.kind(), e.lineStart(), Math.max(e.lineStart(), lineEnd), e.signature(), e.docSummary(),
                e.metadata()));
        }

        /**
         * Adds a relation. Blank target names are ignored.
         */
        public Builder addRelation(int sourceLocalId, String targetName, String type, int line,
                                   Map<String, Object> metadata) {
            if (targetName != null && !targetName.isBlank()) {
                relations.add(new RawRelation(sourceLocalId, targetName.trim(), type, line, metadata));
            }
            return this;
        }

        public Builder addRelation(int sourceLocalId, String targetName, String type, int line) {
            return addRelation(sourceLocalId, targetName, type, line, Map.of());
        }

        public Builder addError(ParseError error) {
            errors.add(error);
            return this;
        }

        public Builder addSyntaxError(int line, String message) {
            return addError(ParseError.syntax(filePath, line, message));
        }

        public ExtractionResult build() {
            return new ExtractionResult(filePath, language, confidence, entities, relations, errors);
        }
    }
}
