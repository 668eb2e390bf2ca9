package com.hybridlang.compiler.ir;

/**
 * 函数参数
 */
public class Parameter {
    private final String name;
    private final Type type;
    private final String defaultValue;  // 可选

    public Parameter(String name, Type type, String defaultValue) {
        this.name = name != null ? name : "";
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public Parameter(String name, Type type) {
        this(name, type, null);
    }

    /** 未命名参数返回空串 */
    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
