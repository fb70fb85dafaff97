package com.codegraph.core.extractor.base;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Source text with comments and string literal contents blanked out.
 *
 * <p>The masked text has exactly the same length and line breaks as the original, so
 * offsets and line numbers found in one are valid in the other. Pattern-based extractors
 * match structure on the masked text, where brackets inside strings or comments can no
 * longer confuse bracket matching, and read names or literals back from the original.
 */
public final class SourceText {

    /**
     * Comment and string syntax of a language family.
     */
    public enum Syntax {
        /** Line and block comments; quotes {@code ' " `}; {@code """} blocks. */
        C_LIKE,
        /** {@code #} comments; quotes {@code ' "}; triple-quoted strings. */
        HASH
    }

    private final String content;
    private final String masked;
    private final int[] lineStarts;
    private int unterminatedOffset = -1;
    private String unterminatedWhat;

    private SourceText(String content, Syntax syntax) {
        this.content = content == null ? "" : content;
        this.masked = mask(this.content, syntax);
        this.lineStarts = computeLineStarts(this.content);
    }

    public static SourceText of(String content, Syntax syntax) {
        return new SourceText(content, syntax);
    }

    public String content() {
        return content;
    }

    public String masked() {
        return masked;
    }

    public int length() {
        return content.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the 1-based line number of an offset.
     *
     * @param offset character offset, clamped to the text
     * @return line number
     */
    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, content.length()));
        int index = Arrays.binarySearch(lineStarts, clamped);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the offset of the first character of a 1-based line.
     */
    public int offsetOfLine(int lineNumber) {
        if (lineNumber <= 1) {
            return 0;
        }
        if (lineNumber > lineStarts.length) {
            return content.length();
        }
        return lineStarts[lineNumber - 1];
    }

    /**
     * Returns the original text of a 1-based line, without its line break.
     */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lineStarts.length) {
            return "";
        }
        int start = lineStarts[lineNumber - 1];
        int end = lineNumber < lineStarts.length ? lineStarts[lineNumber] - 1 : content.length();
        String text = content.substring(start, Math.max(start, end));
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Returns true if the character at {@code offset} is code, not part of a comment or string.
     */
    public boolean isCode(int offset) {
        if (offset < 0 || offset >= content.length()) {
            return false;
        }
        char c = content.charAt(offset);
        return Character.isWhitespace(c) || masked.charAt(offset) == c;
    }

    /**
     * Returns true if a comment or string was still open at the end of the text.
     */
    public boolean hasUnterminatedLiteral() {
        return unterminatedOffset >= 0;
    }

    public int unterminatedLine() {
        return unterminatedOffset < 0 ? 0 : lineOf(unterminatedOffset);
    }

    public String unterminatedDescription() {
        return unterminatedWhat;
    }

    /**
     * Finds the bracket closing the one at {@code openOffset} in the masked text.
     *
     * @param openOffset offset of {@code (}, {@code [} or {@code {}
     * @return offset of the matching close bracket, or -1 if the text ends first
     */
    public int findClosing(int openOffset) {
        if (openOffset < 0 || openOffset >= masked.length()) {
            return -1;
        }
        char open = masked.charAt(openOffset);
        char close = closingOf(open);
        if (close == 0) {
            return -1;
        }
        int depth = 0;
        for (int i = openOffset; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the first bracket that is never closed or closes the wrong bracket.
     *
     * @param from start offset (inclusive)
     * @param to end offset (exclusive)
     * @return offset of the offending bracket, or -1 if the region is balanced
     */
    public int findUnbalancedBracket(int from, int to) {
        Deque<Integer> stack = new ArrayDeque<>();
        int end = Math.min(to, masked.length());
        for (int i = Math.max(0, from); i < end; i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                stack.push(i);
            } else if (c == ')' || c == ']' || c == '}') {
                if (stack.isEmpty()) {
                    return i;
                }
                int openAt = stack.pop();
                if (closingOf(masked.charAt(openAt)) != c) {
                    return openAt;
                }
            }
        }
        return stack.isEmpty() ? -1 : stack.peekLast();
    }

    /**
     * Computes the curly-brace nesting depth at every offset of the masked text.
     *
     * @return array where element {@code i} is the depth just before offset {@code i}
     */
    public int[] braceDepths() {
        int[] depths = new int[masked.length() + 1];
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            depths[i] = depth;
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
        }
        depths[masked.length()] = depth;
        return depths;
    }

    private static char closingOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> 0;
        };
    }

    private String mask(String text, Syntax syntax) {
        char[] out = text.toCharArray();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (syntax == Syntax.C_LIKE && c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                i = blankUntilLineEnd(out, text, i);
            } else if (syntax == Syntax.C_LIKE && c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    markUnterminated(i, "block comment");
                    blank(out, i, n);
                    i = n;
                } else {
                    blank(out, i, end + 2);
                    i = end + 2;
                }
            } else if (syntax == Syntax.HASH && c == '#') {
                i = blankUntilLineEnd(out, text, i);
            } else if (c == '"' && text.startsWith("\"\"\"", i)) {
                i = maskTripleQuoted(out, text, i, "\"\"\"");
            } else if (syntax == Syntax.HASH && c == '\'' && text.startsWith("'''", i)) {
                i = maskTripleQuoted(out, text, i, "'''");
            } else if (c == '"' || c == '\'' || (syntax == Syntax.C_LIKE && c == '`')) {
                i = maskQuoted(out, text, i, c);
            } else {
                i++;
            }
        }
        return new String(out);
    }

    private int blankUntilLineEnd(char[] out, String text, int from) {
        int end = text.indexOf('\n', from);
        if (end < 0) {
            end = text.length();
        }
        blank(out, from, end);
        return end;
    }

    private int maskTripleQuoted(char[] out, String text, int from, String delimiter) {
        int end = text.indexOf(delimiter, from + 3);
        while (end > 0 && isEscaped(text, end)) {
            end = text.indexOf(delimiter, end + 1);
        }
        if (end < 0) {
            markUnterminated(from, "triple-quoted string");
            blank(out, from + 3, text.length());
            return text.length();
        }
        blank(out, from + 3, end);
        return end + 3;
    }

    private int maskQuoted(char[] out, String text, int from, char quote) {
        int j = from + 1;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote) {
                break;
            }
            if (c == '\n' && quote != '`') {
                // Single-line literals end at the line break; apostrophes in prose are common.
                break;
            }
            j++;
        }
        if (j >= text.length()) {
            if (quote == '`') {
                markUnterminated(from, "template literal");
            }
            blank(out, from + 1, text.length());
            return text.length();
        }
        blank(out, from + 1, j);
        return text.charAt(j) == quote ? j + 1 : j;
    }

    private static boolean isEscaped(String text, int offset) {
        int backslashes = 0;
        for (int i = offset - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private void markUnterminated(int offset, String what) {
        if (unterminatedOffset < 0) {
            unterminatedOffset = offset;
            unterminatedWhat = what;
        }
    }

    private static void blank(char[] out, int from, int to) {
        for (int k = Math.max(0, from); k < Math.min(to, out.length); k++) {
            if (out[k] != '\n' && out[k] != '\r') {
                out[k] = ' ';
            }
        }
    }

    private static int[] computeLineStarts(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }
}
