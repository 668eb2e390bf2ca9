package com.hybridlang.backend.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 简单函数体识别与表达式输出测试
 */
class SimpleBodyTest {

    private static final SimpleBody.NameResolver IDENTITY = (name, viaThis, isCall) -> name;

    @Nested
    @DisplayName("函数体识别")
    class ParseTests {

        @Test
        @DisplayName("成员赋值加 return")
        void testAssignmentsAndReturn() {
            SimpleBody body = SimpleBody.parse("this->x = a + 1; y -= 2; return x;");

            assertNotNull(body);
            assertEquals(2, body.getAssignments().size());
            SimpleBody.Assignment first = body.getAssignments().get(0);
            assertEquals("x", first.getTarget());
            assertEquals("=", first.getOperator());
            assertEquals(3, first.getValue().size());
            assertEquals("-=", body.getAssignments().get(1).getOperator());
            assertTrue(body.hasReturn());
            assertEquals(1, body.getReturnValue().size());
        }

        @Test
        @DisplayName("自增写成 += 1")
        void testIncrement() {
            SimpleBody body = SimpleBody.parse("count++; --level;");

            assertNotNull(body);
            assertEquals("+=", body.getAssignments().get(0).getOperator());
            assertEquals("1", body.getAssignments().get(0).getValue().get(0).getText());
            assertEquals("level", body.getAssignments().get(1).getTarget());
            assertEquals("-=", body.getAssignments().get(1).getOperator());
            assertFalse(body.hasReturn());
        }

        @Test
        @DisplayName("空 return 与空函数体")
        void testEmptyReturn() {
            SimpleBody body = SimpleBody.parse("return;");
            assertNotNull(body);
            assertTrue(body.hasReturn());
            assertTrue(body.getReturnValue().isEmpty());

            SimpleBody empty = SimpleBody.parse("   ");
            assertNotNull(empty);
            assertTrue(empty.getAssignments().isEmpty());
            assertFalse(empty.hasReturn());
        }

        @Test
        @DisplayName("不可转换的写法返回 null")
        void testRejected() {
            assertNull(SimpleBody.parse("int y = 3;"));
            assertNull(SimpleBody.parse("p->x = 1;"));
            assertNull(SimpleBody.parse("return \"text\";"));
            assertNull(SimpleBody.parse("return a; b = 1;"));
            assertNull(SimpleBody.parse("if (a) { b = 1; }"));
            assertNull(SimpleBody.parse("x = 1"));
            assertNull(SimpleBody.parse(null));
        }
    }

    @Nested
    @DisplayName("表达式输出")
    class RenderTests {

        @Test
        @DisplayName("二元运算符两侧留空格，一元运算符紧贴")
        void testOperators() {
            List<ExprToken> tokens = SimpleBody.parseExpression("a+-b*(c - 1)");
            assertEquals("a + -b * (c - 1)", SimpleBody.render(tokens, IDENTITY, false));
        }

        @Test
        @DisplayName("浮点上下文中整数补 .0")
        void testFloatContext() {
            assertEquals("x * 2.0", SimpleBody.render(SimpleBody.parseExpression("x * 2"), IDENTITY, true));
            assertEquals("x * 2", SimpleBody.render(SimpleBody.parseExpression("x * 2"), IDENTITY, false));
            assertEquals("1.5", SimpleBody.render(SimpleBody.parseExpression("1.5f"), IDENTITY, true));
            assertEquals("0.5", SimpleBody.render(SimpleBody.parseExpression(".5"), IDENTITY, false));
        }

        @Test
        @DisplayName("调用与实参")
        void testCall() {
            List<ExprToken> tokens = SimpleBody.parseExpression("f(a,b)");
            assertEquals("f(a, b)", SimpleBody.render(tokens, IDENTITY, false));
        }

        @Test
        @DisplayName("解析回调收到 this 与调用标记")
        void testResolverFlags() {
            List<ExprToken> tokens = SimpleBody.parseExpression("this->size + count()");
            String rendered = SimpleBody.render(tokens, (name, viaThis, isCall) -> {
                if (viaThis) return "self." + name;
                return isCall ? "self." + name : name;
            }, false);
            assertEquals("self.size + self.count()", rendered);
        }

        @Test
        @DisplayName("无法解析的标识符使整个表达式失败")
        void testUnresolved() {
            List<ExprToken> tokens = SimpleBody.parseExpression("a + b");
            assertNull(SimpleBody.render(tokens, (name, viaThis, isCall) -> "a".equals(name) ? name : null, false));
        }

        @Test
        @DisplayName("顶层逗号不是表达式")
        void testTopLevelComma() {
            assertNull(SimpleBody.parseExpression("a, b"));
            assertNull(SimpleBody.parseExpression("(a"));
        }
    }
}
