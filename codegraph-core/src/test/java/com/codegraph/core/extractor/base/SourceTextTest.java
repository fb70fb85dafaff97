package com.codegraph.core.extractor.base;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SourceText}.
 */
class SourceTextTest {

    @Test
    void masked_withCommentsAndStrings_keepsLengthAndLineBreaks() {
        // Given: C-like source with a line comment, a block comment and a string
        String code = "call(\"a(b\"); // x()\n/* y(\n) */ z();";

        // When: Text is masked
        SourceText source = SourceText.of(code, SourceText.Syntax.C_LIKE);

        // Then: Only code survives, offsets are unchanged
        assertThat(source.masked()).hasSameSizeAs(code);
        assertThat(source.masked())
            .isEqualTo("call(\"   \");" + " ".repeat(7) + "\n" + " ".repeat(5) + "\n" + " ".repeat(5) + "z();");
        assertThat(source.masked().split("\n", -1)).hasSize(3);
    }

    @Test
    void masked_withHashSyntax_blanksHashComments() {
        SourceText source = SourceText.of("x = 1  # note\ny = '#'\n", SourceText.Syntax.HASH);

        assertThat(source.masked()).isEqualTo("x = 1" + " ".repeat(8) + "\ny = ' '\n");
        assertThat(source.hasUnterminatedLiteral()).isFalse();
    }

    @Test
    void hasUnterminatedLiteral_withOpenBlockComment_reportsLine() {
        SourceText source = SourceText.of("a();\n/* never closed\nb();", SourceText.Syntax.C_LIKE);

        assertThat(source.hasUnterminatedLiteral()).isTrue();
        assertThat(source.unterminatedLine()).isEqualTo(2);
        assertThat(source.unterminatedDescription()).isEqualTo("block comment");
    }

    @Test
    void lineOf_andOffsetOfLine_areConsistent() {
        SourceText source = SourceText.of("one\ntwo\r\nthree", SourceText.Syntax.C_LIKE);

        assertThat(source.lineCount()).isEqualTo(3);
        assertThat(source.offsetOfLine(2)).isEqualTo(4);
        assertThat(source.lineOf(4)).isEqualTo(2);
        assertThat(source.lineOf(0)).isEqualTo(1);
        assertThat(source.line(2)).isEqualTo("two");
        assertThat(source.line(3)).isEqualTo("three");
        assertThat(source.line(9)).isEmpty();
    }

    @Test
    void findClosing_ignoresBracketsInStrings() {
        String code = "f(a, \")\", g(b))";
        SourceText source = SourceText.of(code, SourceText.Syntax.C_LIKE);

        assertThat(source.findClosing(1)).isEqualTo(code.length() - 1);
        assertThat(source.findClosing(0)).isEqualTo(-1);
    }

    @Test
    void findUnbalancedBracket_returnsFirstUnclosedBracket() {
        String code = "a(b[c]{ d";
        SourceText source = SourceText.of(code, SourceText.Syntax.C_LIKE);

        assertThat(source.findUnbalancedBracket(0, code.length())).isEqualTo(1);
        assertThat(SourceText.of("x(y)", SourceText.Syntax.C_LIKE).findUnbalancedBracket(0, 4)).isEqualTo(-1);
    }

    @Test
    void braceDepths_tracksNesting() {
        SourceText source = SourceText.of("{a{b}}", SourceText.Syntax.C_LIKE);

        int[] depths = source.braceDepths();

        assertThat(depths).containsExactly(0, 1, 1, 2, 2, 1, 0);
    }

    @Test
    void isCode_distinguishesCodeFromComments() {
        SourceText source = SourceText.of("x // y", SourceText.Syntax.C_LIKE);

        assertThat(source.isCode(0)).isTrue();
        assertThat(source.isCode(5)).isFalse();
        assertThat(source.isCode(-1)).isFalse();
    }
}
