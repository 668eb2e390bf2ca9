package com.hybridlang.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型参数：{@code typename T} / {@code class T = int}
 */
public class TypeParam extends TemplateParameter {
    private final String defaultValue;  // 可选
    private final List<String> constraints = new ArrayList<String>();

    public TypeParam(String name, String defaultValue) {
        super(name);
        this.defaultValue = defaultValue;
    }

    public TypeParam(String name) {
        this(name, null);
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /** 约束名（concept），无约束时为空 */
    public List<String> getConstraints() {
        return constraints;
    }

    public void addConstraint(String constraint) {
        constraints.add(constraint);
    }

    @Override
    public <R> R accept(TemplateParameterVisitor<R> visitor) {
        return visitor.visitTypeParam(this);
    }

    @Override
    public String toString() {
        return "TypeParam(" + name + (defaultValue != null ? " = " + defaultValue : "") + ")";
    }
}
