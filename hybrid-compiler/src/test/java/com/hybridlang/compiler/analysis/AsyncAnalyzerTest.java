package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.AsyncOperation;
import com.hybridlang.compiler.ir.AsyncTaskInfo;
import com.hybridlang.compiler.ir.CoroutineInfo;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.FutureInfo;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 协程与异步分析测试
 */
class AsyncAnalyzerTest {

    private final AsyncAnalyzer analyzer = new AsyncAnalyzer();

    private Function analyzed(String body) {
        Function fn = new Function("f", new Type(TypeKind.CLASS, "Task<int>"));
        fn.setBody(body);
        analyzer.analyze(fn);
        return fn;
    }

    // ============ 协程 ============

    @Nested
    @DisplayName("协程关键字")
    class CoroutineTests {

        @Test
        @DisplayName("co_await 绑定与 co_return")
        void testAwaitAndReturn() {
            Function fn = analyzed("int a = co_await fetch(1);\nco_return a + 1;");
            CoroutineInfo info = fn.getCoroutineInfo();

            assertTrue(info.isCoroutine());
            assertFalse(info.isGenerator());
            assertTrue(info.usesSuspend());
            assertTrue(info.usesReturn());
            assertEquals(2, info.getOperations().size());

            AsyncOperation await = info.getOperations().get(0);
            assertEquals(AsyncOperation.Kind.SUSPEND, await.getKind());
            assertEquals("fetch(1)", await.getExpression());
            assertEquals("a", await.getBinding());
            assertEquals(1, await.getLine());

            AsyncOperation ret = info.getOperations().get(1);
            assertEquals("a + 1", ret.getExpression());
            assertEquals(2, ret.getLine());
            assertTrue(fn.isAsync());
        }

        @Test
        @DisplayName("co_yield 即生成器")
        void testGenerator() {
            Function fn = analyzed("for (int i = 0; i < n; ++i) { co_yield i * i; }");

            assertTrue(fn.getCoroutineInfo().isGenerator());
            assertTrue(fn.getCoroutineInfo().isCoroutine());
            assertTrue(fn.getCoroutineInfo().usesYield());
            assertEquals("i * i", fn.getCoroutineInfo().getOperations().get(0).getExpression());
        }

        @Test
        @DisplayName("空 co_return")
        void testEmptyReturn() {
            Function fn = analyzed("co_await sleep_for(10);\nco_return;");
            assertEquals("", fn.getCoroutineInfo().getOperations().get(1).getExpression());
            assertFalse(fn.getCoroutineInfo().getOperations().get(0).hasBinding());
        }

        @Test
        @DisplayName("没有关键字时保持默认")
        void testPlainFunction() {
            Function fn = analyzed("return compute(3);");

            assertFalse(fn.getCoroutineInfo().isCoroutine());
            assertFalse(fn.getCoroutineInfo().isGenerator());
            assertTrue(fn.getCoroutineInfo().getOperations().isEmpty());
            assertFalse(fn.isAsync());
        }

        @Test
        @DisplayName("重复分析不会累积")
        void testIdempotent() {
            Function fn = analyzed("co_yield 1;");
            analyzer.analyze(fn);
            assertEquals(1, fn.getCoroutineInfo().getOperations().size());
        }
    }

    // ============ future / promise ============

    @Nested
    @DisplayName("future 与 promise")
    class FutureTests {

        @Test
        @DisplayName("future 与 promise 按声明顺序配对")
        void testPairing() {
            Function fn = analyzed("std::promise<int> p;\n"
                    + "std::future<int> f = p.get_future();\n"
                    + "std::shared_future<std::string> s = other.share();\n");

            assertEquals(2, fn.getFutures().size());
            FutureInfo first = fn.getFutures().get(0);
            assertEquals("f", first.getFutureVar());
            assertEquals(TypeKind.INTEGER, first.getValueType().getKind());
            assertEquals("p", first.getPromiseVar());
            assertFalse(first.isShared());

            FutureInfo second = fn.getFutures().get(1);
            assertTrue(second.isShared());
            assertFalse(second.hasPromise());
            assertTrue(fn.isAsync());
        }
    }

    // ============ std::async ============

    @Nested
    @DisplayName("std::async")
    class AsyncTaskTests {

        @Test
        @DisplayName("赋值给 future 的任务")
        void testAssignedTask() {
            Function fn = analyzed("std::future<int> r = std::async(std::launch::async, compute, 7, 8);\nreturn r.get();");

            assertEquals(1, fn.getAsyncTasks().size());
            AsyncTaskInfo task = fn.getAsyncTasks().get(0);
            assertEquals("r", task.getTaskVar());
            assertEquals("compute", task.getFunctionName());
            assertEquals(2, task.getArguments().size());
            assertEquals(TypeKind.INTEGER, task.getResultType().getKind());
            assertFalse(task.isDetached());
        }

        @Test
        @DisplayName("auto 绑定时结果类型未知")
        void testAutoTask() {
            Function fn = analyzed("auto job = std::async(load, path);");
            AsyncTaskInfo task = fn.getAsyncTasks().get(0);

            assertEquals("job", task.getTaskVar());
            assertTrue(task.hasTaskVar());
            assertNull(task.getResultType());
        }

        @Test
        @DisplayName("不绑定变量的任务视为 detached")
        void testDetachedTask() {
            Function fn = analyzed("std::async(std::launch::async, ping);");
            AsyncTaskInfo task = fn.getAsyncTasks().get(0);

            assertTrue(task.isDetached());
            assertEquals("", task.getTaskVar());
            assertFalse(task.hasTaskVar());
            assertEquals("ping", task.getFunctionName());
        }
    }
}
