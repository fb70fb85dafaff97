package com.codegraph.core.extractor.base;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regex patterns for fallback parsing of Java-like sources.
 *
 * <p>Patterns are compiled once at class loading time.
 */
public final class RegexPatterns {

    public static final Pattern PACKAGE_PATTERN =
        Pattern.compile("^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);

    public static final Pattern IMPORT_PATTERN =
        Pattern.compile("^\\s*import\\s+(static\\s+)?([\\w.]+)(\\.\\*)?\\s*;", Pattern.MULTILINE);

    public static final Pattern TYPE_DECLARATION_PATTERN = Pattern.compile(
        "\\b(class|interface|enum|record)\\s+(\\w+)(?:\\s*<[^{]*?>)?(?:\\s*\\([^)]*\\))?"
            + "(?:\\s+extends\\s+([\\w.<>,\\s]+?))?(?:\\s+implements\\s+([\\w.<>,\\s]+?))?\\s*\\{");

    public static final Pattern METHOD_PATTERN = Pattern.compile(
        "(?:(?:public|protected|private|static|final|abstract|synchronized|native|default)\\s+)*"
            + "(?:<[^>]+>\\s+)?([\\w.<>\\[\\],?\\s]+?)\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*(?:throws\\s+[\\w.,\\s]+)?\\{");

    private RegexPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Extracts the package name from Java source.
     *
     * @param content Java source
     * @return package name, or empty string for the default package
     */
    public static String extractPackageName(String content) {
        Matcher matcher = PACKAGE_PATTERN.matcher(content);
        return matcher.find() ? matcher.group(1) : "";
    }

    /**
     * Builds a fully qualified name from a package and a simple name.
     *
     * @param packageName package, may be empty
     * @param name simple name
     * @return {@code packageName.name}, or {@code name} in the default package
     */
    public static String buildFullyQualifiedName(String packageName, String name) {
        if (packageName == null || packageName.isEmpty()) {
            return name;
        }
        return packageName + "." + name;
    }
}
