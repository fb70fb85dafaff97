package com.codegraph.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Path helpers shared by file discovery, extractors and the normalizer.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Returns the path of {@code file} relative to {@code root}, always using {@code /}.
     *
     * @param root analysed root
     * @param file file below root
     * @return project-relative path
     */
    public static String relativePath(Path root, Path file) {
        Path relative = root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize());
        return toUnixPath(relative.toString());
    }

    public static String toUnixPath(String path) {
        return path.replace('\\', '/');
    }

    /**
     * Returns the lowercase extension of a file name without the dot.
     *
     * @param fileName file name or path
     * @return extension, or empty string if there is none
     */
    public static String getExtension(String fileName) {
        String name = fileName;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static String getExtension(Path path) {
        return getExtension(path.getFileName().toString());
    }

    /**
     * Derives the dotted module name of a file: the relative path without extension,
     * with separators replaced by dots. {@code pkg/a.py} becomes {@code pkg.a}.
     *
     * @param relativePath project-relative path
     * @return module name
     */
    public static String moduleName(String relativePath) {
        String path = toUnixPath(relativePath);
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash + 1) {
            path = path.substring(0, dot);
        }
        return path.replace('/', '.');
    }

    /**
     * Returns the directory part of a project-relative path, or {@code "."} for root files.
     *
     * @param relativePath project-relative path
     * @return parent directory
     */
    public static String directoryOf(String relativePath) {
        String path = toUnixPath(relativePath);
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : ".";
    }

    /**
     * Compiles glob patterns into path matchers.
     *
     * @param globPatterns glob patterns such as {@code *.min.js}
     * @return matchers in the same order
     */
    public static List<PathMatcher> globMatchers(List<String> globPatterns) {
        if (globPatterns == null) {
            return List.of();
        }
        return globPatterns.stream()
            .filter(pattern -> pattern != null && !pattern.isBlank())
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern.trim()))
            .toList();
    }

    /**
     * Checks a relative path against glob matchers. A pattern matches either the full
     * relative path or the bare file name.
     *
     * @param relativePath project-relative path
     * @param matchers compiled glob matchers
     * @return true if any matcher accepts the path
     */
    public static boolean matchesAny(String relativePath, List<PathMatcher> matchers) {
        if (matchers.isEmpty()) {
            return false;
        }
        Path path = Path.of(relativePath);
        Path fileName = path.getFileName();
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path) || (fileName != null && matcher.matches(fileName))) {
                return true;
            }
        }
        return false;
    }
}
