package com.hybridlang.compiler.ir;

/**
 * 变量 / 字段
 */
public class Variable {
    private final String name;
    private final Type type;
    private boolean isStatic;
    private boolean isConst;
    private String initializer = "";

    public Variable(String name, Type type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public void setStatic(boolean isStatic) {
        this.isStatic = isStatic;
    }

    public boolean isConst() {
        return isConst;
    }

    public void setConst(boolean isConst) {
        this.isConst = isConst;
    }

    /** 原始初始化表达式文本，无初始化时为空串 */
    public String getInitializer() {
        return initializer;
    }

    public void setInitializer(String initializer) {
        this.initializer = initializer != null ? initializer : "";
    }

    public boolean hasInitializer() {
        return !initializer.isEmpty();
    }
}
