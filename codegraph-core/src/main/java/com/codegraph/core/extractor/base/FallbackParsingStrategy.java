package com.codegraph.core.extractor.base;

/**
 * Strategy for recovering structure from a file that the grammar-based parser rejected.
 *
 * <p>Implementations typically use {@link RegexPatterns} to find package, type and method
 * declarations and add them to the file's result builder.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FallbackParsingStrategy fallback = (content, context) -> {
 *     String pkg = RegexPatterns.extractPackageName(content);
 *     // add entities through context.result()
 * };
 * }</pre>
 */
@FunctionalInterface
public interface FallbackParsingStrategy {

    /**
     * Extracts what can be recovered from unparseable content.
     *
     * @param content raw file content
     * @param context file state and result builder
     */
    void parse(String content, FileContext context);
}
