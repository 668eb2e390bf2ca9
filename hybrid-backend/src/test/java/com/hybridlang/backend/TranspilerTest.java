package com.hybridlang.backend;

import com.hybridlang.compiler.analysis.IrPass;
import com.hybridlang.compiler.analysis.PassPipeline;
import com.hybridlang.compiler.ir.IrModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 转译器门面测试：文件读写、批量模式与输出路径
 */
class TranspilerTest {

    private static final String SHAPES = "class Shape {\n"
            + "public:\n"
            + "    virtual double area() const = 0;\n"
            + "};\n"
            + "struct Point { int x; int y; };\n";

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("单文件转译")
    class SingleFileTests {

        @Test
        @DisplayName("默认输出到同名 .rs 文件")
        void testRustOutput() throws IOException {
            Path input = write("shapes.cpp", SHAPES);
            Transpiler transpiler = new Transpiler();

            assertTrue(transpiler.transpile(input));
            assertNull(transpiler.getLastError());

            Path output = dir.resolve("shapes.rs");
            assertTrue(Files.exists(output));
            String rust = read(output);
            assertTrue(rust.contains("pub trait Shape {"));
            assertTrue(rust.contains("pub struct Point {"));
            assertFalse(Files.exists(dir.resolve("shapes_test.rs")));
            assertFalse(Files.exists(dir.resolve("shapes.ir.json")));
        }

        @Test
        @DisplayName("显式输出路径与 Go 目标")
        void testExplicitGoOutput() throws IOException {
            Path input = write("shapes.cpp", SHAPES);
            Path output = dir.resolve("out.go");
            TranspilerOptions options = new TranspilerOptions();
            options.setTarget(TargetProfile.GO);
            options.setOutputPath(output);
            options.setGoPackage("geometry");

            assertTrue(new Transpiler(options).transpile(input));

            String go = read(output);
            assertTrue(go.contains("package geometry"));
            assertTrue(go.contains("type Shape interface {"));
            assertFalse(Files.exists(dir.resolve("shapes.go")));
        }

        @Test
        @DisplayName("测试骨架与 IR JSON 写到旁边")
        void testSideOutputs() throws IOException {
            Path input = write("shapes.cpp", SHAPES);
            TranspilerOptions options = new TranspilerOptions();
            options.setGenerateTests(true);
            options.setEmitIrJson(true);

            assertTrue(new Transpiler(options).transpile(input));

            assertTrue(read(dir.resolve("shapes_test.rs")).contains("#[cfg(test)]"));
            String ir = read(dir.resolve("shapes.ir.json"));
            assertTrue(ir.contains("\"classes\""));
            assertTrue(ir.contains("\"Point\""));
        }

        @Test
        @DisplayName("输入不存在时失败且不创建输出")
        void testMissingInput() {
            Path input = dir.resolve("missing.cpp");
            Transpiler transpiler = new Transpiler();

            assertFalse(transpiler.transpile(input));
            assertTrue(transpiler.getLastError().startsWith("Failed to parse input file: "));
            assertFalse(Files.exists(dir.resolve("missing.rs")));
        }

        @Test
        @DisplayName("输出目录不可写时报告路径")
        void testUnwritableOutput() throws IOException {
            Path input = write("shapes.cpp", SHAPES);
            TranspilerOptions options = new TranspilerOptions();
            options.setOutputPath(dir.resolve("no-such-dir").resolve("shapes.rs"));
            Transpiler transpiler = new Transpiler(options);

            assertFalse(transpiler.transpile(input));
            assertTrue(transpiler.getLastError().startsWith("Failed to open output file: "));
        }

        @Test
        @DisplayName("测试骨架写不出去时主输出也不落盘")
        void testNoPartialOutput() throws IOException {
            Path input = write("a.cpp", "void f() {}");
            Files.createDirectory(dir.resolve("a_test.rs"));
            TranspilerOptions options = new TranspilerOptions();
            options.setGenerateTests(true);
            Transpiler transpiler = new Transpiler(options);

            assertFalse(transpiler.transpile(input));
            assertTrue(transpiler.getLastError().startsWith("Failed to open output file: "));
            assertTrue(transpiler.getLastError().contains("a_test.rs"));
            assertFalse(Files.exists(dir.resolve("a.rs")));
            assertTrue(Files.isDirectory(dir.resolve("a_test.rs")));
        }

        @Test
        @DisplayName("失败时保留已有的输出文件内容，且不留下临时文件")
        void testExistingOutputKept() throws IOException {
            Path input = write("a.cpp", "void f() {}");
            Path existing = write("a.rs", "// previous");
            Files.createDirectory(dir.resolve("a.ir.json"));
            TranspilerOptions options = new TranspilerOptions();
            options.setEmitIrJson(true);

            assertFalse(new Transpiler(options).transpile(input));
            assertEquals("// previous", read(existing));
            try (Stream<Path> entries = Files.list(dir)) {
                assertEquals(0, entries.filter(p -> p.getFileName().toString().endsWith(".tmp")).count());
            }
        }

        @Test
        @DisplayName("分析阶段的运行时异常转成失败结果")
        void testPassFailure() throws IOException {
            PassPipeline pipeline = new PassPipeline();
            pipeline.addPass(new IrPass() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public IrModule run(IrModule module) {
                    throw new IllegalStateException("boom");
                }
            });
            Transpiler transpiler = new Transpiler(new TranspilerOptions(), pipeline);

            assertFalse(transpiler.transpile(write("a.cpp", "void f() {}")));
            assertNotNull(transpiler.getLastError());
            assertTrue(transpiler.getLastError().contains("boom"));
            assertFalse(Files.exists(dir.resolve("a.rs")));
        }

        @Test
        @DisplayName("成功的调用清空上一次的错误")
        void testErrorCleared() throws IOException {
            Transpiler transpiler = new Transpiler();
            assertFalse(transpiler.transpile(dir.resolve("missing.cpp")));
            assertNotNull(transpiler.getLastError());

            assertTrue(transpiler.transpile(write("ok.cpp", "void f() {}")));
            assertNull(transpiler.getLastError());
        }

        @Test
        @DisplayName("未选择目标时报告生成器未初始化")
        void testNoTarget() throws IOException {
            TranspilerOptions options = new TranspilerOptions();
            options.setTarget(null);
            Transpiler transpiler = new Transpiler(options);

            assertFalse(transpiler.transpile(write("a.cpp", "void f() {}")));
            assertEquals("Code generator not initialized", transpiler.getLastError());
        }
    }

    @Nested
    @DisplayName("批量转译")
    class BatchTests {

        @Test
        @DisplayName("全部成功")
        void testAllSucceed() throws IOException {
            Path a = write("a.cpp", "void a() {}");
            Path b = write("b.cpp", "void b() {}");

            assertTrue(new Transpiler().transpileBatch(Arrays.asList(a, b)));
            assertTrue(Files.exists(dir.resolve("a.rs")));
            assertTrue(Files.exists(dir.resolve("b.rs")));
        }

        @Test
        @DisplayName("遇到第一个失败即停止")
        void testStopsAtFirstFailure() throws IOException {
            Path a = write("a.cpp", "void a() {}");
            Path missing = dir.resolve("missing.cpp");
            Path c = write("c.cpp", "void c() {}");
            Transpiler transpiler = new Transpiler();

            assertFalse(transpiler.transpileBatch(Arrays.asList(a, missing, c)));
            assertTrue(Files.exists(dir.resolve("a.rs")));
            assertFalse(Files.exists(dir.resolve("c.rs")));
            assertTrue(transpiler.getLastError().contains("missing.cpp"));
        }
    }

    @Nested
    @DisplayName("源码接口与输出路径")
    class SourceAndPathTests {

        @Test
        @DisplayName("转译源码字符串")
        void testTranspileSource() {
            String rust = new Transpiler().transpileSource("struct Point { int x; };");
            assertTrue(rust.contains("pub struct Point {"));
        }

        @Test
        @DisplayName("导出 IR")
        void testDumpIr() {
            String json = new Transpiler().dumpIr("void f() noexcept {}");
            assertTrue(json.contains("\"functions\""));
            assertTrue(json.contains("\"noexcept\": true"));
        }

        @Test
        @DisplayName("自定义 Pass 管线")
        void testCustomPipeline() {
            PassPipeline empty = new PassPipeline();
            Transpiler transpiler = new Transpiler(new TranspilerOptions(), empty);
            assertSame(empty, transpiler.getPipeline());
            assertTrue(transpiler.transpileSource("void f() {}").contains("pub fn f() {}"));
        }

        @Test
        @DisplayName("输出路径推导")
        void testDerivePaths() {
            Path input = Paths.get("src", "shapes.cpp");

            assertEquals(Paths.get("src", "shapes.rs"), Transpiler.deriveOutputPath(input, TargetProfile.RUST));
            assertEquals(Paths.get("src", "shapes.go"), Transpiler.deriveOutputPath(input, TargetProfile.GO));
            assertEquals(Paths.get("src", "shapes_test.go"), Transpiler.deriveTestPath(Paths.get("src", "shapes.go")));
            assertEquals(Paths.get("src", "shapes.ir.json"), Transpiler.deriveIrPath(Paths.get("src", "shapes.rs")));
        }

        @Test
        @DisplayName("选项被复制，外部修改不影响转译器")
        void testOptionsCopied() {
            TranspilerOptions options = new TranspilerOptions();
            Transpiler transpiler = new Transpiler(options);
            options.setTarget(TargetProfile.GO);

            assertEquals(TargetProfile.RUST, transpiler.getOptions().getTarget());
        }
    }
}
