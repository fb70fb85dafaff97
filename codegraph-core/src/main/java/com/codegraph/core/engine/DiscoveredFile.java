package com.codegraph.core.engine;

import com.codegraph.core.model.Language;

import java.nio.file.Path;

/**
 * A source file selected for analysis.
 *
 * @param path absolute path on disk
 * @param relativePath path relative to the analysed root, {@code /}-separated
 * @param language language of the file
 * @param size file size in bytes
 */
public record DiscoveredFile(Path path, String relativePath, Language language, long size) {
}
