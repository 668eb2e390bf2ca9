package com.hybridlang.backend.codegen;

/**
 * 简单表达式的词法单元
 */
public final class ExprToken {

    public enum Kind {
        IDENTIFIER,
        /** {@code this->name} */
        MEMBER,
        NUMBER,
        BOOLEAN,
        OPERATOR,
        OPEN,
        CLOSE,
        COMMA
    }

    private final Kind kind;
    private final String text;

    public ExprToken(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean is(Kind kind, String text) {
        return this.kind == kind && this.text.equals(text);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
