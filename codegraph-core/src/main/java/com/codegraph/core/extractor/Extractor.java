package com.codegraph.core.extractor;

import com.codegraph.core.model.Language;

import java.util.Set;

/**
 * Parses the source text of one file into raw entities and relations.
 *
 * <p>Extractors are discovered via Java Service Provider Interface (SPI) and selected
 * by file extension through {@link ExtractorRegistry}. Each extractor reports facts in its
 * own vocabulary ({@code struct}, {@code protocol}, {@code decorator}, ...); the normalizer
 * maps them onto the unified model.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codegraph.core.extractor.Extractor}
 *
 * @see ExtractionResult
 * @see ExtractorRegistry
 */
public interface Extractor {

    /**
     * Returns unique identifier for this extractor, in kebab-case (e.g. "java-ast").
     *
     * @return unique extractor identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the languages this extractor handles.
     *
     * @return supported languages
     */
    Set<Language> getSupportedLanguages();

    /**
     * Returns lowercase file extensions (without dot) this extractor handles.
     *
     * @return supported extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Returns how much the produced facts can be trusted.
     *
     * <p>Grammar-based extractors report {@link ConfidenceLevel#HIGH}; pattern-based
     * heuristics report {@link ConfidenceLevel#MEDIUM}.
     *
     * @return confidence of extracted facts
     */
    ConfidenceLevel getConfidence();

    /**
     * Returns the language of a file handled by this extractor.
     *
     * @param filePath project-relative path
     * @return language of the file
     */
    default Language languageOf(String filePath) {
        return getSupportedLanguages().iterator().next();
    }

    /**
     * Parses one file.
     *
     * <p>Never throws for malformed input: syntax problems are reported as
     * {@link com.codegraph.core.model.ParseError}s alongside whatever partial structure
     * could be recovered.
     *
     * @param sourceText full file content
     * @param filePath project-relative path, used for module naming and error reporting
     * @return raw entities, relations and errors
     */
    ExtractionResult parse(String sourceText, String filePath);
}
