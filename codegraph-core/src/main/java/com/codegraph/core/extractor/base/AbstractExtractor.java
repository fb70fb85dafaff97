package com.codegraph.core.extractor.base;

import com.codegraph.core.extractor.ExtractionResult;
import com.codegraph.core.extractor.Extractor;
import com.codegraph.core.extractor.RawEntity;
import com.codegraph.core.model.Language;
import com.codegraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Abstract base class for extractor implementations providing common functionality.
 *
 * <p>This class reduces code duplication across extractors by providing:
 * <ul>
 *   <li>Logger initialization (one logger per extractor class)</li>
 *   <li>The module entity every file yields</li>
 *   <li>A guard turning unexpected runtime failures into parse errors</li>
 *   <li>Documentation summary helpers</li>
 * </ul>
 *
 * <p>Subclasses implement {@link #extract(String, FileContext)} and add the file's
 * entities below {@link FileContext#moduleLocalId()}.
 *
 * @see Extractor
 */
public abstract class AbstractExtractor implements Extractor {

    private static final int MAX_DOC_SUMMARY = 200;

    /**
     * Logger instance for this extractor.
     * Automatically initialized with the concrete extractor class name.
     */
    protected final Logger log;

    protected AbstractExtractor() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final ExtractionResult parse(String sourceText, String filePath) {
        String text = sourceText == null ? "" : sourceText;
        String path = FileUtils.toUnixPath(filePath);
        Language language = languageOf(path);
        ExtractionResult.Builder result = new ExtractionResult.Builder(path, language, getConfidence());

        String moduleName = FileUtils.moduleName(path);
        String simpleName = moduleName.contains(".")
            ? moduleName.substring(moduleName.lastIndexOf('.') + 1)
            : moduleName;
        int moduleId = result.addEntity(RawEntity.NO_PARENT, simpleName, moduleName, "module",
            1, countLines(text), null, null, Map.of("language", language.getId()));

        try {
            extract(text, new FileContext(path, moduleName, moduleId, result));
        } catch (RuntimeException e) {
            log.warn("Extractor {} failed on {}: {}", getId(), path, e.getMessage());
            log.debug("Extractor failure details", e);
            result.addSyntaxError(0, "Extraction aborted: " + e.getClass().getSimpleName()
                + (e.getMessage() != null ? " - " + e.getMessage() : ""));
        }
        return result.build();
    }

    /**
     * Extracts the entities and relations of one file.
     *
     * @param sourceText file content, never null
     * @param context file state, including the module entity and the result builder
     */
    protected abstract void extract(String sourceText, FileContext context);

    /**
     * Reduces a documentation block to its first sentence.
     *
     * @param doc raw documentation text, may be null
     * @return first sentence, or null if the doc is blank
     */
    protected String docSummary(String doc) {
        if (doc == null) {
            return null;
        }
        String flattened = doc.replaceAll("\\s+", " ").trim();
        if (flattened.isEmpty()) {
            return null;
        }
        int sentenceEnd = flattened.indexOf(". ");
        String summary = sentenceEnd > 0 ? flattened.substring(0, sentenceEnd + 1) : flattened;
        return summary.length() > MAX_DOC_SUMMARY ? summary.substring(0, MAX_DOC_SUMMARY) : summary;
    }

    protected static int countLines(String text) {
        if (text.isEmpty()) {
            return 1;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i < text.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
