package com.hybridlang.compiler.ir;

/**
 * 非类型参数：{@code int N}、{@code size_t Size = 16}
 */
public class NonTypeParam extends TemplateParameter {
    private final Type paramType;
    private final String defaultValue;  // 可选

    public NonTypeParam(String name, Type paramType, String defaultValue) {
        super(name);
        this.paramType = paramType;
        this.defaultValue = defaultValue;
    }

    public Type getParamType() {
        return paramType;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R> R accept(TemplateParameterVisitor<R> visitor) {
        return visitor.visitNonTypeParam(this);
    }

    @Override
    public String toString() {
        return "NonTypeParam(" + name + ": " + paramType.getName()
                + (defaultValue != null ? " = " + defaultValue : "") + ")";
    }
}
