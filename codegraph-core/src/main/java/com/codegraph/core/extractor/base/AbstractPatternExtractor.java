package com.codegraph.core.extractor.base;

import com.codegraph.core.extractor.ConfidenceLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for heuristic extractors built on regular expressions and
 * bracket-balanced block scanning.
 *
 * <p>This class provides:
 * <ul>
 *   <li>Match helpers over precompiled patterns</li>
 *   <li>Top-level splitting of parameter and inheritance lists</li>
 *   <li>Call-site scanning over masked source regions</li>
 *   <li>Doc-comment lookup above a declaration</li>
 * </ul>
 *
 * <p>Used for Python, JavaScript/TypeScript, Swift and Vue, where no grammar-complete parser
 * is available. Results are approximate and reported with {@link ConfidenceLevel#MEDIUM}.
 *
 * @see AbstractExtractor
 * @see SourceText
 */
public abstract class AbstractPatternExtractor extends AbstractExtractor {

    private static final Pattern CALL_PATTERN = Pattern.compile(
        "(?<![\\w$.])(?:(new)\\s+)?([A-Za-z_$][\\w$]*(?:\\s*\\??\\.\\s*[A-Za-z_$][\\w$]*)*)\\s*(?:<[\\w$.,\\s<>\\[\\]?]*>)?\\s*\\(");

    /**
     * A call expression found in source.
     *
     * @param name callee as written, with whitespace and optional-chaining removed
     * @param offset offset of the callee name
     * @param instantiation true for {@code new T(...)}
     */
    protected record CallSite(String name, int offset, boolean instantiation) {}

    protected AbstractPatternExtractor() {
        super();
    }

    @Override
    public ConfidenceLevel getConfidence() {
        return ConfidenceLevel.MEDIUM;
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return immutable match results in order of appearance
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Finds all matches of a pattern inside {@code [from, to)}.
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text, int from, int to) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        matcher.region(Math.max(0, from), Math.min(to, text.length()));
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    // ==================== String Utilities ====================

    protected String safeSubstring(String text, int start, int end) {
        if (text == null || start < 0 || end > text.length() || start >= end) {
            return "";
        }
        return text.substring(start, end);
    }

    /**
     * Trims whitespace and removes surrounding quotes from a string.
     */
    protected String cleanQuotes(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && last == first) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    /**
     * Splits a list at commas that are not nested in brackets.
     *
     * <p>{@code "Map<K, V>, Other"} yields {@code ["Map<K, V>", "Other"]}.
     *
     * @param text comma separated text, may be null
     * @return trimmed, non-empty parts
     */
    protected List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>') {
                depth = Math.max(0, depth - 1);
            }
            if (c == ',' && depth == 0) {
                addPart(parts, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addPart(parts, current);
        return parts;
    }

    private static void addPart(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
    }

    /**
     * Removes generic arguments and array or optional markers from a type reference.
     *
     * <p>{@code "Repository<User>?"} yields {@code "Repository"}.
     */
    protected String baseTypeName(String typeReference) {
        if (typeReference == null) {
            return "";
        }
        String type = typeReference.trim();
        int generic = indexOfAny(type, '<', '[', '(');
        if (generic > 0) {
            type = type.substring(0, generic);
        }
        return type.replaceAll("[?!\\s]", "");
    }

    private static int indexOfAny(String text, char... chars) {
        int best = -1;
        for (char c : chars) {
            int index = text.indexOf(c);
            if (index >= 0 && (best < 0 || index < best)) {
                best = index;
            }
        }
        return best;
    }

    /**
     * Collapses a multi-line signature into a single line.
     */
    protected String compact(String text) {
        return text == null ? null : text.replaceAll("\\s+", " ").trim();
    }

    // ==================== Call Scanning ====================

    /**
     * Finds call expressions in the masked text between two offsets.
     *
     * <p>Names whose first segment is a keyword and names directly preceded by a
     * declaration keyword ({@code function foo(}) are skipped.
     *
     * @param source masked source
     * @param from start offset (inclusive)
     * @param to end offset (exclusive)
     * @param keywords control-flow keywords that look like calls ({@code if}, {@code while}, ...)
     * @param declarationKeywords keywords introducing declarations ({@code function}, {@code func}, ...)
     * @return call sites in source order
     */
    protected List<CallSite> findCallSites(SourceText source, int from, int to,
                                           Set<String> keywords, Set<String> declarationKeywords) {
        List<CallSite> calls = new ArrayList<>();
        String masked = source.masked();
        for (MatchResult match : findMatches(CALL_PATTERN, masked, from, to)) {
            String name = match.group(2).replaceAll("\\s+", "").replace("?.", ".");
            String first = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
            if (keywords.contains(first) || keywords.contains(name)) {
                continue;
            }
            if (precededByKeyword(masked, match.start(), declarationKeywords)) {
                continue;
            }
            calls.add(new CallSite(name, match.start(2), match.group(1) != null));
        }
        return calls;
    }

    private boolean precededByKeyword(String masked, int offset, Set<String> declarationKeywords) {
        int end = offset;
        while (end > 0 && Character.isWhitespace(masked.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && (Character.isLetterOrDigit(masked.charAt(start - 1)) || masked.charAt(start - 1) == '_')) {
            start--;
        }
        return start < end && declarationKeywords.contains(masked.substring(start, end));
    }

    // ==================== Blocks and Errors ====================

    /**
     * Finds the bracket closing {@code open}, falling back to the end of the region when the
     * bracket is never closed inside it.
     *
     * @param source masked source
     * @param open offset of the opening bracket
     * @param limit end of the region (exclusive)
     * @return offset of the closing bracket or the last offset of the region
     */
    protected static int closingOrEnd(SourceText source, int open, int limit) {
        int close = source.findClosing(open);
        return close < 0 || close > limit ? Math.max(open, limit - 1) : close;
    }

    protected static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Reports unbalanced brackets and unterminated literals as syntax errors.
     *
     * @param source masked source
     * @param from start of the checked region (inclusive)
     * @param to end of the checked region (exclusive)
     * @param context file context receiving the errors
     */
    protected void reportSyntaxErrors(SourceText source, int from, int to, FileContext context) {
        if (source.hasUnterminatedLiteral()) {
            context.result().addSyntaxError(source.unterminatedLine(),
                "Unterminated " + source.unterminatedDescription());
        }
        int unbalanced = source.findUnbalancedBracket(from, to);
        if (unbalanced >= 0) {
            context.result().addSyntaxError(source.lineOf(unbalanced),
                "Unbalanced bracket '" + source.masked().charAt(unbalanced) + "'");
        }
    }

    // ==================== Documentation ====================

    /**
     * Collects consecutive comment lines directly above a declaration.
     *
     * @param source source text
     * @param declarationLine 1-based line of the declaration
     * @param prefix comment prefix such as {@code "///"}
     * @return comment text without prefixes, or null if there is none
     */
    protected String precedingLineComment(SourceText source, int declarationLine, String prefix) {
        List<String> lines = new ArrayList<>();
        for (int line = declarationLine - 1; line >= 1; line--) {
            String text = source.line(line).trim();
            if (text.startsWith("@")) {
                continue;
            }
            if (!text.startsWith(prefix)) {
                break;
            }
            lines.add(0, text.substring(prefix.length()).trim());
        }
        return lines.isEmpty() ? null : String.join(" ", lines);
    }

    /**
     * Returns the JSDoc-style block comment ending directly above a declaration.
     *
     * @param source source text
     * @param declarationOffset offset of the declaration
     * @return comment text with leading stars removed, or null
     */
    protected String precedingBlockComment(SourceText source, int declarationOffset) {
        String content = source.content();
        int end = declarationOffset;
        while (end > 0 && Character.isWhitespace(content.charAt(end - 1))) {
            end--;
        }
        if (end < 2 || !content.startsWith("*/", end - 2)) {
            return null;
        }
        int start = content.lastIndexOf("/**", end - 2);
        if (start < 0) {
            return null;
        }
        String body = content.substring(start + 3, end - 2);
        StringBuilder text = new StringBuilder();
        for (String line : body.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("*")) {
                trimmed = trimmed.substring(1).trim();
            }
            if (trimmed.startsWith("@")) {
                break;
            }
            text.append(trimmed).append(' ');
        }
        return text.toString().trim();
    }
}
