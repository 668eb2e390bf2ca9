package com.hybridlang.compiler.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CppTextTest {

    @Test
    void stripCommentsKeepsLineBreaks() {
        String code = "int a; /* one\ntwo */ int b; // tail\nint c;";
        String stripped = CppText.stripComments(code);
        assertThat(stripped).doesNotContain("one").doesNotContain("tail");
        assertThat(CppText.lineOf(stripped, stripped.indexOf("int c"))).isEqualTo(3);
    }

    @Test
    void matchingBraceSkipsStringLiterals() {
        String text = "{ auto s = \"}\"; { x(); } }";
        assertThat(CppText.findMatchingBrace(text, 0)).isEqualTo(text.length() - 1);
        assertThat(CppText.findMatchingBrace("{ {", 0)).isEqualTo(-1);
    }

    @Test
    void matchingParenHandlesNesting() {
        String text = "f(a, g(b), (c))";
        assertThat(CppText.findMatchingParen(text, 1)).isEqualTo(text.length() - 1);
    }

    @Test
    void splitArgumentsRespectsBrackets() {
        assertThat(CppText.splitArguments("worker, std::ref(v), [&]{ return a, b; }, std::pair<int, int>{1, 2}"))
                .containsExactly("worker", "std::ref(v)", "[&]{ return a, b; }", "std::pair<int, int>{1, 2}");
        assertThat(CppText.splitArguments("   ")).isEmpty();
    }

    @Test
    void splitTemplateArgsTracksAngles() {
        assertThat(CppText.splitTemplateArgs("std::map<K, V>, int"))
                .containsExactly("std::map<K, V>", " int");
    }

    @Test
    void blankBlocksKeepsNewlines() {
        String blanked = CppText.blankBlocks("a {\n b;\n} c");
        assertThat(blanked).startsWith("a ").endsWith(" c").doesNotContain("b");
        assertThat(blanked.split("\n", -1)).hasSize(3);
    }

    @Test
    void normalizeSpaceCollapsesWhitespace() {
        assertThat(CppText.normalizeSpace("  const \t int \n x ")).isEqualTo("const int x");
    }

    @Test
    void stripPreprocessorRemovesDirectives() {
        assertThat(CppText.stripPreprocessor("#include <thread>\nint x;")).doesNotContain("#include").contains("int x;");
    }
}
