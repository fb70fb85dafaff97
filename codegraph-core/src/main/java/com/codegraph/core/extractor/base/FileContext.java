package com.codegraph.core.extractor.base;

import com.codegraph.core.extractor.ExtractionResult;

import java.util.Objects;

/**
 * Per-file state handed to concrete extractors.
 *
 * @param filePath project-relative path
 * @param moduleName dotted module name derived from the path
 * @param moduleLocalId local id of the module entity already added to {@code result}
 * @param result builder collecting the file's facts
 */
public record FileContext(
    String filePath,
    String moduleName,
    int moduleLocalId,
    ExtractionResult.Builder result
) {
    public FileContext {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    /**
     * Qualifies a name with the module name.
     */
    public String qualify(String name) {
        return moduleName.isEmpty() ? name : moduleName + "." + name;
    }
}
