package com.hybridlang.compiler.ir;

/**
 * 模板参数访问者
 */
public interface TemplateParameterVisitor<R> {

    R visitTypeParam(TypeParam param);

    R visitNonTypeParam(NonTypeParam param);

    R visitNestedTemplateParam(NestedTemplateParam param);
}
