package com.hybridlang.compiler.parser;

import com.hybridlang.compiler.ir.PointerOwnership;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TypeParser 测试")
class TypeParserTest {

    private final TypeParser parser = new TypeParser();

    @Nested
    @DisplayName("内置类型")
    class BuiltinTests {

        @Test
        @DisplayName("整数与浮点")
        void testNumbers() {
            assertThat(parser.parse("int").getKind()).isEqualTo(TypeKind.INTEGER);
            assertThat(parser.parse("unsigned long long").getKind()).isEqualTo(TypeKind.INTEGER);
            assertThat(parser.parse("std::size_t").getKind()).isEqualTo(TypeKind.INTEGER);
            assertThat(parser.parse("double").getKind()).isEqualTo(TypeKind.FLOAT);
            assertThat(parser.parse("bool").getKind()).isEqualTo(TypeKind.BOOL);
        }

        @Test
        @DisplayName("空文本为 void")
        void testEmpty() {
            assertThat(parser.parse("  ").getKind()).isEqualTo(TypeKind.VOID);
        }

        @Test
        @DisplayName("const 修饰")
        void testConst() {
            Type t = parser.parse("const double");
            assertThat(t.getKind()).isEqualTo(TypeKind.FLOAT);
            assertThat(t.isConst()).isTrue();
        }
    }

    @Nested
    @DisplayName("指针与引用")
    class PointerTests {

        @Test
        @DisplayName("裸指针")
        void testRawPointer() {
            Type t = parser.parse("Node*");
            assertThat(t.getKind()).isEqualTo(TypeKind.POINTER);
            assertThat(t.getOwnership()).isEqualTo(PointerOwnership.RAW);
            assertThat(t.getElementType().getKind()).isEqualTo(TypeKind.CLASS);
            assertThat(t.getElementType().getName()).isEqualTo("Node");
        }

        @Test
        @DisplayName("智能指针的所有权")
        void testSmartPointers() {
            Type unique = parser.parse("std::unique_ptr<Widget>");
            assertThat(unique.getKind()).isEqualTo(TypeKind.POINTER);
            assertThat(unique.getOwnership()).isEqualTo(PointerOwnership.UNIQUE);
            assertThat(unique.isSmartPointer()).isTrue();

            Type shared = parser.parse("std::shared_ptr<Widget>");
            assertThat(shared.getOwnership()).isEqualTo(PointerOwnership.SHARED);
            assertThat(shared.getElementType().getName()).isEqualTo("Widget");
        }

        @Test
        @DisplayName("const 引用与右值引用")
        void testReferences() {
            Type ref = parser.parse("const std::string&");
            assertThat(ref.getKind()).isEqualTo(TypeKind.REFERENCE);
            assertThat(ref.isConst()).isTrue();
            assertThat(ref.getElementType().getKind()).isEqualTo(TypeKind.STD_STRING);

            Type rvalue = parser.parse("Buffer&&");
            assertThat(rvalue.getKind()).isEqualTo(TypeKind.REFERENCE);
            assertThat(rvalue.getElementType().getName()).isEqualTo("Buffer");
        }
    }

    @Nested
    @DisplayName("标准库模板")
    class TemplateTests {

        @Test
        @DisplayName("嵌套容器")
        void testNestedContainers() {
            Type t = parser.parse("std::map<std::string, std::vector<int>>");
            assertThat(t.getKind()).isEqualTo(TypeKind.STD_MAP);
            assertThat(t.getTemplateArgs()).hasSize(2);
            assertThat(t.getTemplateArg(0).getKind()).isEqualTo(TypeKind.STD_STRING);
            assertThat(t.getTemplateArg(1).getKind()).isEqualTo(TypeKind.STD_VECTOR);
            assertThat(t.getTemplateArg(1).getElementType().getKind()).isEqualTo(TypeKind.INTEGER);
            assertThat(t.getTemplateArg(2)).isNull();
        }

        @Test
        @DisplayName("并发与异步原语")
        void testConcurrencyTypes() {
            assertThat(parser.parse("std::mutex").getKind()).isEqualTo(TypeKind.MUTEX);
            assertThat(parser.parse("std::atomic<bool>").getKind()).isEqualTo(TypeKind.ATOMIC);
            assertThat(parser.parse("std::future<int>").getKind()).isEqualTo(TypeKind.FUTURE);
            assertThat(parser.parse("std::condition_variable").getKind()).isEqualTo(TypeKind.CONDITION_VARIABLE);
            assertThat(parser.parse("std::thread").getKind()).isEqualTo(TypeKind.THREAD);
        }

        @Test
        @DisplayName("不带 std:: 前缀的容器")
        void testUsingNamespace() {
            assertThat(parser.parse("vector<double>").getKind()).isEqualTo(TypeKind.STD_VECTOR);
        }

        @Test
        @DisplayName("用户模板类型去掉实参得到基础名")
        void testUserTemplate() {
            Type t = parser.parse("Stack<int>");
            assertThat(t.getKind()).isEqualTo(TypeKind.CLASS);
            assertThat(t.getBaseName()).isEqualTo("Stack");
        }

        @Test
        @DisplayName("数组")
        void testArray() {
            Type t = parser.parse("int[16]");
            assertThat(t.getKind()).isEqualTo(TypeKind.ARRAY);
            assertThat(t.getElementType().getKind()).isEqualTo(TypeKind.INTEGER);
        }
    }
}
