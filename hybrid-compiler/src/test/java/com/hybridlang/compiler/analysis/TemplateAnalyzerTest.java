package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.NestedTemplateParam;
import com.hybridlang.compiler.ir.NonTypeParam;
import com.hybridlang.compiler.ir.TemplateParameter;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.ir.TypeParam;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 模板分析与泛型渲染测试
 */
class TemplateAnalyzerTest {

    private final TemplateAnalyzer analyzer = new TemplateAnalyzer();

    @Nested
    @DisplayName("模板形参解析")
    class ParameterTests {

        @Test
        @DisplayName("类型形参与带默认值的非类型形参")
        void testTypeAndNonType() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams("template<typename T, int N = 4>");

            assertEquals(2, params.size());
            assertTrue(params.get(0) instanceof TypeParam);
            assertEquals("T", params.get(0).getName());
            assertFalse(((TypeParam) params.get(0)).hasDefaultValue());

            NonTypeParam n = (NonTypeParam) params.get(1);
            assertEquals("N", n.getName());
            assertEquals("4", n.getDefaultValue());
            assertEquals(TypeKind.INTEGER, n.getParamType().getKind());
        }

        @Test
        @DisplayName("class 关键字、默认类型与变参包")
        void testClassKeywordAndPack() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams(
                    "template<class K, typename V = std::string, typename... Rest>");

            assertEquals(3, params.size());
            assertEquals("K", params.get(0).getName());
            assertEquals("std::string", ((TypeParam) params.get(1)).getDefaultValue());
            assertEquals("Rest", params.get(2).getName());
        }

        @Test
        @DisplayName("模板模板形参")
        void testNestedTemplate() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams(
                    "template<template<typename> class Container, typename T>");

            assertEquals(2, params.size());
            assertTrue(params.get(0) instanceof NestedTemplateParam);
            assertEquals("Container", params.get(0).getName());
        }

        @Test
        @DisplayName("空声明")
        void testEmpty() {
            assertTrue(analyzer.analyzeTemplateParams((String) null).isEmpty());
            assertTrue(analyzer.analyzeTemplateParams("template<>").isEmpty());
        }
    }

    @Nested
    @DisplayName("IR 标记")
    class ModuleTests {

        @Test
        @DisplayName("模板类字段与方法签名改标为 TEMPLATE_PARAM")
        void testRetagging() {
            IrModule ir = SourceParser.parseString("template<typename T>\n"
                    + "class Box {\n"
                    + "public:\n"
                    + "    T get() const { return value; }\n"
                    + "    void set(const T& v) { value = v; }\n"
                    + "private:\n"
                    + "    T value;\n"
                    + "};");
            analyzer.run(ir);
            ClassDecl box = ir.findClass("Box");

            assertTrue(box.isTemplate());
            assertEquals(1, box.getTemplateParameters().size());
            assertEquals(TypeKind.TEMPLATE_PARAM, box.findField("value").getType().getKind());

            Function get = box.getMethods().get(0);
            assertEquals(TypeKind.TEMPLATE_PARAM, get.getReturnType().getKind());
            Function set = box.getMethods().get(1);
            assertEquals(TypeKind.TEMPLATE_PARAM, set.getParameters().get(0).getType().getElementType().getKind());
        }

        @Test
        @DisplayName("全特化不带形参")
        void testFullSpecialization() {
            IrModule ir = SourceParser.parseString("template<>\nclass Box<int> { int v; };");
            analyzer.run(ir);
            ClassDecl box = ir.findClass("Box");

            assertTrue(box.getSpecialization().isSpecialization());
            assertFalse(box.getSpecialization().isPartial());
        }

        @Test
        @DisplayName("模板函数")
        void testTemplateFunction() {
            IrModule ir = SourceParser.parseString("template<typename T>\nT largest(T a, T b) { return a > b ? a : b; }");
            analyzer.run(ir);
            Function fn = ir.getFunctions().get(0);

            assertTrue(fn.isTemplate());
            assertEquals(TypeKind.TEMPLATE_PARAM, fn.getParameters().get(0).getType().getKind());
        }
    }

    @Nested
    @DisplayName("泛型渲染")
    class ConversionTests {

        @Test
        @DisplayName("Rust 泛型参数与 const 泛型")
        void testAlpha() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams("template<typename T, int N = 4>");
            assertEquals("<T, const N: usize>", TemplateConversion.toAlphaGenericBounds(params));
        }

        @Test
        @DisplayName("约束以 + 连接")
        void testAlphaConstraints() {
            TypeParam t = new TypeParam("T");
            t.addConstraint("Clone");
            t.addConstraint("Debug");
            assertEquals("<T: Clone + Debug>", TemplateConversion.toAlphaGenericBounds(
                    Collections.<TemplateParameter>singletonList(t)));
        }

        @Test
        @DisplayName("Go 类型参数丢弃非类型形参")
        void testBeta() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams("template<typename T, int N = 4>");
            assertEquals("[T any]", TemplateConversion.toBetaTypeParameters(params));
        }

        @Test
        @DisplayName("空列表得到空串")
        void testEmptyList() {
            List<TemplateParameter> none = Collections.emptyList();
            assertEquals("", TemplateConversion.toAlphaGenericBounds(none));
            assertEquals("", TemplateConversion.toBetaTypeParameters(none));
        }

        @Test
        @DisplayName("Go 侧形参全部被丢弃时得到空串")
        void testBetaAllDropped() {
            List<TemplateParameter> params = analyzer.analyzeTemplateParams("template<int N>");
            assertEquals("", TemplateConversion.toBetaTypeParameters(params));
            assertEquals("<const N: usize>", TemplateConversion.toAlphaGenericBounds(params));
        }

        @Test
        @DisplayName("const 泛型类型映射")
        void testConstType() {
            assertEquals("u32", TemplateConversion.alphaConstType("unsigned int"));
            assertEquals("bool", TemplateConversion.alphaConstType("bool"));
            assertEquals("usize", TemplateConversion.alphaConstType("int"));
        }
    }
}
