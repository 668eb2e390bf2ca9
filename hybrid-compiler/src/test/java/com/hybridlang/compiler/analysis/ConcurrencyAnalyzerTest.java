package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.AtomicInfo;
import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.ConditionVariableInfo;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.ir.LockInfo;
import com.hybridlang.compiler.ir.MutexInfo;
import com.hybridlang.compiler.ir.ThreadInfo;
import com.hybridlang.compiler.ir.Type;
import com.hybridlang.compiler.ir.TypeKind;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConcurrencyAnalyzer 测试")
class ConcurrencyAnalyzerTest {

    private ConcurrencyAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ConcurrencyAnalyzer();
    }

    private Function analyzed(String body) {
        Function fn = new Function("run", new Type(TypeKind.VOID, "void"));
        fn.setBody(body);
        analyzer.analyze(fn, null);
        return fn;
    }

    @Nested
    @DisplayName("线程")
    class ThreadTests {

        @Test
        @DisplayName("具名线程")
        void testNamedThread() {
            Function fn = analyzed("std::thread t(worker, 1, std::ref(data));\nt.join();");

            assertThat(fn.getThreads()).hasSize(1);
            ThreadInfo t = fn.getThreads().get(0);
            assertThat(t.getThreadVar()).isEqualTo("t");
            assertThat(t.getTargetFunction()).isEqualTo("worker");
            assertThat(t.getArguments()).containsExactly("1", "std::ref(data)");
            assertThat(t.isJoinable()).isTrue();
            assertThat(fn.usesConcurrency()).isTrue();
        }

        @Test
        @DisplayName("detach 的线程")
        void testDetached() {
            Function fn = analyzed("std::thread bg(flush);\nbg.detach();\nstd::thread(report, 3).detach();");

            assertThat(fn.getThreads()).hasSize(2);
            assertThat(fn.getThreads().get(0).isDetached()).isTrue();
            assertThat(fn.getThreads().get(1).getThreadVar()).isEmpty();
            assertThat(fn.getThreads().get(1).isDetached()).isTrue();
        }

        @Test
        @DisplayName("线程池 emplace_back")
        void testPool() {
            Function fn = analyzed("std::vector<std::thread> workers;\n"
                    + "for (int i = 0; i < 4; ++i) { workers.emplace_back(task, i); }\n"
                    + "for (auto& w : workers) w.join();");

            assertThat(fn.getThreads()).hasSize(1);
            assertThat(fn.getThreads().get(0).getThreadVar()).isEqualTo("workers");
            assertThat(fn.getThreads().get(0).getTargetFunction()).isEqualTo("task");
        }

        @Test
        @DisplayName("默认构造的线程对象不记录")
        void testEmptyThread() {
            Function fn = analyzed("std::thread idle;");
            assertThat(fn.getThreads()).isEmpty();
        }
    }

    @Nested
    @DisplayName("互斥量与锁")
    class LockTests {

        @Test
        @DisplayName("局部互斥量与锁作用域")
        void testLocalMutexAndLock() {
            Function fn = analyzed("std::mutex m;\n"
                    + "{\n"
                    + "    std::lock_guard<std::mutex> guard(m);\n"
                    + "    total += 1;\n"
                    + "}\n"
                    + "done();");

            assertThat(fn.getMutexes()).hasSize(1);
            assertThat(fn.getMutexes().get(0).getMutexVar()).isEqualTo("m");
            assertThat(fn.getMutexes().get(0).getKind()).isEqualTo(MutexInfo.Kind.PLAIN);

            assertThat(fn.getLocks()).hasSize(1);
            LockInfo lock = fn.getLocks().get(0);
            assertThat(lock.getKind()).isEqualTo(LockInfo.Kind.GUARD);
            assertThat(lock.getLockVar()).isEqualTo("guard");
            assertThat(lock.getMutexVar()).isEqualTo("m");
            assertThat(lock.getScopeBody()).isEqualTo("total += 1;");
        }

        @Test
        @DisplayName("共享锁与种类推断")
        void testSharedLock() {
            Function fn = analyzed("std::shared_mutex rw;\nstd::shared_lock<std::shared_mutex> r(rw);\nread();");

            assertThat(fn.getMutexes().get(0).getKind()).isEqualTo(MutexInfo.Kind.SHARED);
            assertThat(fn.getLocks().get(0).getKind()).isEqualTo(LockInfo.Kind.SHARED);
        }
    }

    @Nested
    @DisplayName("原子变量")
    class AtomicTests {

        @Test
        @DisplayName("运算符归一为 fetch_add / fetch_sub")
        void testOperators() {
            assertThat(ConcurrencyAnalyzer.atomicOperations("hits++; --hits; hits += 2; hits.load();", "hits"))
                    .containsExactly("fetch_add", "fetch_sub", "load");
        }

        @Test
        @DisplayName("赋值视为 store")
        void testStore() {
            assertThat(ConcurrencyAnalyzer.atomicOperations("ready = true; if (ready == false) {}", "ready"))
                    .containsExactly("store");
        }

        @Test
        @DisplayName("局部原子变量")
        void testLocalAtomic() {
            Function fn = analyzed("std::atomic<int> counter{0};\ncounter.fetch_add(1);");

            assertThat(fn.getAtomics()).hasSize(1);
            AtomicInfo a = fn.getAtomics().get(0);
            assertThat(a.getVariable()).isEqualTo("counter");
            assertThat(a.getValueType().getKind()).isEqualTo(TypeKind.INTEGER);
            assertThat(a.getOperations()).containsExactly("fetch_add");
        }
    }

    @Nested
    @DisplayName("类级汇总")
    class ClassTests {

        private static final String QUEUE = "class WorkQueue {\n"
                + "public:\n"
                + "    void push(int v) {\n"
                + "        std::lock_guard<std::mutex> lock(mtx);\n"
                + "        items.push_back(v);\n"
                + "        pending++;\n"
                + "        cv.notify_all();\n"
                + "    }\n"
                + "    int pop() {\n"
                + "        std::unique_lock<std::mutex> lock(mtx);\n"
                + "        cv.wait(lock, [this] { return !items.empty(); });\n"
                + "        pending--;\n"
                + "        int v = items.front();\n"
                + "        return v;\n"
                + "    }\n"
                + "private:\n"
                + "    std::mutex mtx;\n"
                + "    std::condition_variable cv;\n"
                + "    std::atomic<int> pending;\n"
                + "    std::vector<int> items;\n"
                + "};";

        @Test
        @DisplayName("字段原语与方法操作")
        void testClassPrimitives() {
            IrModule ir = SourceParser.parseString(QUEUE);
            analyzer.run(ir);
            ClassDecl queue = ir.findClass("WorkQueue");

            assertThat(queue.getMutexes()).hasSize(1);
            assertThat(queue.getMutexes().get(0).getMutexVar()).isEqualTo("mtx");
            assertThat(queue.getMutexes().get(0).getProtectedType()).isEqualTo("std::vector<int>");

            assertThat(queue.getAtomics()).hasSize(1);
            assertThat(queue.getAtomics().get(0).getOperations()).containsExactly("fetch_add", "fetch_sub");

            assertThat(queue.getConditionVariables()).hasSize(1);
            ConditionVariableInfo cv = queue.getConditionVariables().get(0);
            assertThat(cv.getAssociatedMutex()).isEqualTo("mtx");
            assertThat(cv.getWaitConditions()).isEqualTo(Arrays.asList("!items.empty()"));
            assertThat(cv.isNotifiesAll()).isTrue();
        }

        @Test
        @DisplayName("方法级描述")
        void testMethodDescriptors() {
            IrModule ir = SourceParser.parseString(QUEUE);
            analyzer.run(ir);
            Function pop = ir.findClass("WorkQueue").getMethods().get(1);

            assertThat(pop.getLocks()).hasSize(1);
            assertThat(pop.getLocks().get(0).getKind()).isEqualTo(LockInfo.Kind.UNIQUE);
            assertThat(pop.getConditionVariables()).hasSize(1);
            assertThat(pop.getConditionVariables().get(0).isNotifiesAll()).isFalse();
            assertThat(pop.getAtomics().get(0).getOperations()).containsExactly("fetch_sub");
            assertThat(ir.findClass("WorkQueue").isThreadSafe()).isFalse();
        }
    }
}
