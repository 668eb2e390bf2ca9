package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.Parameter;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemplatePatternDetector 测试")
class TemplatePatternDetectorTest {

    private static IrModule analyze(String source) {
        return new TemplateAnalyzer().run(SourceParser.parseString(source));
    }

    @Test
    @DisplayName("带 push_back / size 的模板类是容器")
    void testContainerTemplate() {
        IrModule ir = analyze("template<typename T>\n"
                + "class Stack { public: void push_back(T v) {} private: std::vector<T> items; };\n"
                + "class Plain { public: int size() const { return 0; } };");

        assertThat(TemplatePatternDetector.isContainerTemplate(ir.findClass("Stack"))).isTrue();
        // 非模板类即使有 size() 也不算
        assertThat(TemplatePatternDetector.isContainerTemplate(ir.findClass("Plain"))).isFalse();
    }

    @Test
    @DisplayName("迭代器形参的模板函数是算法模板")
    void testAlgorithmTemplate() {
        IrModule ir = analyze("template<typename Iterator>\nvoid sortAll(Iterator first, Iterator last) {}\n"
                + "template<typename T>\nT identity(T value) { return value; }");

        assertThat(TemplatePatternDetector.isAlgorithmTemplate(ir.getFunctions().get(0))).isTrue();
        assertThat(TemplatePatternDetector.isAlgorithmTemplate(ir.getFunctions().get(1))).isFalse();
    }

    @Test
    @DisplayName("enable_if 出现在返回或形参类型里")
    void testSfinae() {
        Function byReturn = new Function("f", new Type(TypeKind.CLASS, "std::enable_if_t<true, int>"));
        assertThat(TemplatePatternDetector.hasSfinaePattern(byReturn)).isTrue();

        Function byParam = new Function("g", new Type(TypeKind.VOID, "void"));
        byParam.addParameter(new Parameter("tag", new Type(TypeKind.POINTER, "std::enable_if<true>::type*")));
        assertThat(TemplatePatternDetector.hasSfinaePattern(byParam)).isTrue();

        // 构造器没有返回类型
        Function ctor = new Function("C", null);
        assertThat(TemplatePatternDetector.hasSfinaePattern(ctor)).isFalse();
    }

    @Test
    @DisplayName("非模板类不是容器")
    void testNonTemplate() {
        ClassDecl cls = analyze("class A { public: void begin() {} };").findClass("A");
        assertThat(cls.isTemplate()).isFalse();
        assertThat(TemplatePatternDetector.isContainerTemplate(cls)).isFalse();
    }
}
