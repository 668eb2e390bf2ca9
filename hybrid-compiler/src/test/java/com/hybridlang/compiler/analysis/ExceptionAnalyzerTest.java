package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.TryCatchBlock;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExceptionAnalyzer 测试")
class ExceptionAnalyzerTest {

    private final ExceptionAnalyzer analyzer = new ExceptionAnalyzer();

    private static Function function(String name, String body) {
        Function fn = new Function(name, new Type(TypeKind.VOID, "void"));
        fn.setBody(body);
        return fn;
    }

    private Function find(IrModule ir, String name) {
        for (Function f : ir.getAllFunctions()) {
            if (f.getName().equals(name)) return f;
        }
        throw new AssertionError("no function " + name);
    }

    @Nested
    @DisplayName("throw 表达式")
    class ThrowTests {

        @Test
        @DisplayName("抛出的类型被记录")
        void testThrowType() {
            Function fn = function("check", "if (x < 0) throw std::invalid_argument(\"negative\");");
            analyzer.analyze(fn);

            assertThat(fn.mayThrow()).isTrue();
            assertThat(fn.isFallible()).isTrue();
            assertThat(fn.getExceptionSpec().canThrow()).isTrue();
            assertThat(fn.getExceptionSpec().getThrowTypes()).containsExactly("std::invalid_argument");
        }

        @Test
        @DisplayName("noexcept 函数不可能抛出")
        void testNoexcept() {
            Function fn = function("quiet", "throw 1;");
            fn.getExceptionSpec().setNoexcept(true);
            analyzer.analyze(fn);

            assertThat(fn.mayThrow()).isFalse();
        }

        @Test
        @DisplayName("没有函数体")
        void testPrototype() {
            Function fn = new Function("proto", new Type(TypeKind.VOID, "void"));
            analyzer.analyze(fn);
            assertThat(fn.mayThrow()).isFalse();
            assertThat(fn.getTryCatchBlocks()).isEmpty();
        }
    }

    @Nested
    @DisplayName("try / catch")
    class TryCatchTests {

        @Test
        @DisplayName("捕获子句按顺序记录")
        void testCatchClauses() {
            Function fn = function("load",
                    "try { parse(); } catch (const ParseError& e) { log(e); } catch (...) { recover(); }");
            analyzer.analyze(fn);

            assertThat(fn.getTryCatchBlocks()).hasSize(1);
            TryCatchBlock block = fn.getTryCatchBlocks().get(0);
            assertThat(block.getTryBody()).contains("parse();");
            assertThat(block.getCatchClauses()).hasSize(2);
            assertThat(block.getCatchClauses().get(0).getExceptionType()).isEqualTo("ParseError");
            assertThat(block.getCatchClauses().get(0).getExceptionVar()).isEqualTo("e");
            assertThat(block.getCatchClauses().get(0).getHandlerBody()).contains("log(e);");
            assertThat(block.hasCatchAll()).isTrue();
            assertThat(fn.isFallible()).isTrue();
        }

        @Test
        @DisplayName("被接住的 throw 不逃出函数")
        void testCaughtThrow() {
            Function fn = function("safe",
                    "try { throw std::runtime_error(\"x\"); } catch (const std::exception& e) { }");
            analyzer.analyze(fn);

            assertThat(fn.mayThrow()).isFalse();
            assertThat(fn.getExceptionSpec().getThrowTypes()).containsExactly("std::runtime_error");
        }

        @Test
        @DisplayName("catch 的类型与 throw 不匹配时仍会逃出")
        void testUnmatchedCatch() {
            Function fn = function("partial",
                    "try { throw IoError(); } catch (const ParseError& e) { }");
            analyzer.analyze(fn);
            assertThat(fn.mayThrow()).isTrue();
        }

        @Test
        @DisplayName("catch 中重新抛出")
        void testRethrow() {
            Function fn = function("relay", "try { work(); } catch (...) { throw; }");
            analyzer.analyze(fn);

            assertThat(fn.getExceptionSpec().getThrowTypes()).isEmpty();
            assertThat(fn.mayThrow()).isTrue();
        }

        @Test
        @DisplayName("catch 声明拆分")
        void testSplitCatchDeclaration() {
            assertThat(ExceptionAnalyzer.splitCatchDeclaration("const std::exception& e"))
                    .containsExactly("std::exception", "e");
            assertThat(ExceptionAnalyzer.splitCatchDeclaration("..."))
                    .containsExactly("...", "");
            assertThat(ExceptionAnalyzer.splitCatchDeclaration("Error*"))
                    .containsExactly("Error", "");
        }
    }

    @Nested
    @DisplayName("跨函数传播")
    class PropagationTests {

        @Test
        @DisplayName("调用可能抛出的函数也可能抛出")
        void testTransitive() {
            IrModule ir = SourceParser.parseString(
                    "void risky(int x) { if (x < 0) throw std::runtime_error(\"neg\"); }\n"
                    + "void middle() { risky(1); }\n"
                    + "void top() { middle(); }\n"
                    + "void guarded() { try { risky(2); } catch (...) { } }\n");
            analyzer.run(ir);

            assertThat(find(ir, "risky").mayThrow()).isTrue();
            assertThat(find(ir, "middle").mayThrow()).isTrue();
            assertThat(find(ir, "top").mayThrow()).isTrue();
            assertThat(find(ir, "guarded").mayThrow()).isFalse();
            assertThat(find(ir, "guarded").isFallible()).isTrue();
        }

        @Test
        @DisplayName("方法之间也会传播")
        void testMethods() {
            IrModule ir = SourceParser.parseString("class Account {\n"
                    + "public:\n"
                    + "    void withdraw(int amount) { if (amount > balance) throw InsufficientFunds(); balance -= amount; }\n"
                    + "    void close() { withdraw(balance); }\n"
                    + "private:\n"
                    + "    int balance;\n"
                    + "};");
            analyzer.run(ir);

            assertThat(find(ir, "withdraw").getExceptionSpec().getThrowTypes()).containsExactly("InsufficientFunds");
            assertThat(find(ir, "close").mayThrow()).isTrue();
        }
    }
}
