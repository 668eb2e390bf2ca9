package com.hybridlang.compiler.ir;

/**
 * 模板模板参数：{@code template<typename> class Container}
 */
public class NestedTemplateParam extends TemplateParameter {

    public NestedTemplateParam(String name) {
        super(name);
    }

    @Override
    public <R> R accept(TemplateParameterVisitor<R> visitor) {
        return visitor.visitNestedTemplateParam(this);
    }

    @Override
    public String toString() {
        return "NestedTemplateParam(" + name + ")";
    }
}
