package com.hybridlang.compiler.ir;

/**
 * 模板参数基类。
 *
 * <p>三种变体：{@link TypeParam}、{@link NonTypeParam}、{@link NestedTemplateParam}。
 * 消费方通过 {@link TemplateParameterVisitor} 分派，新增变体时所有调用点都会编译失败。</p>
 */
public abstract class TemplateParameter {
    protected final String name;

    protected TemplateParameter(String name) {
        this.name = name != null ? name : "";
    }

    public String getName() {
        return name;
    }

    public abstract <R> R accept(TemplateParameterVisitor<R> visitor);
}
