package com.codegraph.core.extractor;

import com.codegraph.core.model.ParseErrorKind;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for extractor functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Parsing source text through the extractor under test</li>
 *   <li>Lookup helpers for raw entities by qualified name</li>
 *   <li>Helpers listing relation targets per source entity and type</li>
 * </ul>
 */
public abstract class ExtractorTestBase {

    /**
     * Returns the extractor under test.
     */
    protected abstract Extractor extractor();

    protected ExtractionResult parse(String filePath, String source) {
        return extractor().parse(source, filePath);
    }

    /**
     * Finds an entity by qualified name and fails when it is missing.
     *
     * @param result extraction result
     * @param qualifiedName qualified name to look up
     * @return the raw entity
     */
    protected RawEntity entity(ExtractionResult result, String qualifiedName) {
        Optional<RawEntity> found = findEntity(result, qualifiedName);
        assertThat(found)
            .as("entity %s in %s", qualifiedName, qualifiedNames(result))
            .isPresent();
        return found.get();
    }

    protected Optional<RawEntity> findEntity(ExtractionResult result, String qualifiedName) {
        return result.entities().stream()
            .filter(entity -> entity.qualifiedName().equals(qualifiedName))
            .findFirst();
    }

    protected List<String> qualifiedNames(ExtractionResult result) {
        return result.entities().stream().map(RawEntity::qualifiedName).toList();
    }

    /**
     * Lists the targets of relations of one type whose source is the given entity.
     *
     * @param result extraction result
     * @param sourceQualifiedName qualified name of the source entity
     * @param type raw relation type such as {@code "calls"}
     * @return target names in source order
     */
    protected List<String> targets(ExtractionResult result, String sourceQualifiedName, String type) {
        RawEntity source = entity(result, sourceQualifiedName);
        return result.relations().stream()
            .filter(relation -> relation.sourceLocalId() == source.localId())
            .filter(relation -> relation.type().equals(type))
            .map(RawRelation::targetName)
            .toList();
    }

    protected List<RawRelation> relationsOfType(ExtractionResult result, String type) {
        return result.relations().stream()
            .filter(relation -> relation.type().equals(type))
            .collect(Collectors.toList());
    }

    protected boolean hasError(ExtractionResult result, ParseErrorKind kind, String messageFragment) {
        return result.errors().stream()
            .anyMatch(error -> error.kind() == kind && error.message().contains(messageFragment));
    }
}
