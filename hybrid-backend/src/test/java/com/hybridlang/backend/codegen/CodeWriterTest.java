package com.hybridlang.backend.codegen;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeWriterTest {

    @Test
    void blockIndentsBody() {
        CodeWriter out = new CodeWriter("    ");
        out.open("fn a() {");
        out.line("let x = 1;");
        out.open("if x > 0 {");
        out.line("x;");
        out.close("}");
        out.close("}");

        assertThat(out.getOutput()).isEqualTo("fn a() {\n    let x = 1;\n    if x > 0 {\n        x;\n    }\n}\n");
    }

    @Test
    void appendJoinsPiecesOnOneLine() {
        CodeWriter out = new CodeWriter("\t");
        out.indent();
        out.append("a").append(" + ").append("b");
        out.newLine();

        assertThat(out.getOutput()).isEqualTo("\ta + b\n");
    }

    @Test
    void blankLineNeverDoublesOrLeads() {
        CodeWriter out = new CodeWriter("\t");
        out.blankLine();
        out.line("a");
        out.blankLine();
        out.blankLine();
        out.line("b");

        assertThat(out.getOutput()).isEqualTo("a\n\nb\n");
    }

    @Test
    void dedentStopsAtZero() {
        CodeWriter out = new CodeWriter("  ");
        out.dedent();
        out.line("top");

        assertThat(out.getOutput()).isEqualTo("top\n");
    }
}
