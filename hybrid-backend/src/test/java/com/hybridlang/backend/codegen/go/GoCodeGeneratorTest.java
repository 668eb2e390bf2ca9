package com.hybridlang.backend.codegen.go;

import com.hybridlang.backend.TranspilerOptions;
import com.hybridlang.compiler.analysis.PassPipeline;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Go 代码生成测试
 */
class GoCodeGeneratorTest {

    private static final String POINT = "class Point {\n"
            + "public:\n"
            + "    int x;\n"
            + "    int getX() const { return x; }\n"
            + "    void setX(int v) { x = v; }\n"
            + "};\n";

    private static IrModule analyze(String source) {
        return PassPipeline.createDefault().execute(SourceParser.parseString(source));
    }

    private static String generate(String source) {
        return new GoCodeGenerator(new TranspilerOptions()).generate(analyze(source));
    }

    @Test
    @DisplayName("文件头与包名")
    void testHeader() {
        String go = generate("void noop() {}");
        assertThat(go).startsWith("// Code generated by hybrid-transpiler from C++ source. DO NOT EDIT.\n");
        assertThat(go).contains("package main");

        TranspilerOptions options = new TranspilerOptions();
        options.setGoPackage("shapes");
        assertThat(new GoCodeGenerator(options).generate(analyze("void noop() {}"))).contains("package shapes");
    }

    @Test
    @DisplayName("同一 IR 两次生成结果相同")
    void testDeterministic() {
        GoCodeGenerator generator = new GoCodeGenerator(new TranspilerOptions());
        IrModule module = analyze(POINT + "void worker(int id) {}\nvoid run() { std::thread t(worker, 1); t.join(); }");

        assertThat(generator.generate(module)).isEqualTo(generator.generate(module));
    }

    @Nested
    @DisplayName("类")
    class ClassTests {

        @Test
        @DisplayName("结构体、构造函数与指针接收者方法")
        void testStruct() {
            String go = generate(POINT);

            assertThat(go).contains("type Point struct {");
            assertThat(go).contains("X int");
            assertThat(go).contains("func NewPoint() *Point {");
            assertThat(go).contains("func (p *Point) GetX() int {");
            assertThat(go).contains("return p.X");
            assertThat(go).contains("func (p *Point) SetX(v int) {");
            assertThat(go).contains("p.X = v");
        }

        @Test
        @DisplayName("私有成员不导出")
        void testPrivateMembers() {
            String go = generate("class Counter {\n"
                    + "public:\n"
                    + "    int get() const { return count; }\n"
                    + "private:\n"
                    + "    int count;\n"
                    + "};\n");

            assertThat(go).contains("count int");
            assertThat(go).contains("return c.count");
        }

        @Test
        @DisplayName("纯虚类生成 interface 与实现断言")
        void testInterface() {
            String go = generate("class Shape {\n"
                    + "public:\n"
                    + "    virtual double area() const = 0;\n"
                    + "};\n"
                    + "class Circle : public Shape {\n"
                    + "public:\n"
                    + "    double area() const override { return r * r; }\n"
                    + "private:\n"
                    + "    double r;\n"
                    + "};\n");

            assertThat(go).contains("type Shape interface {");
            assertThat(go).contains("Area() float64");
            assertThat(go).contains("func (c *Circle) Area() float64 {");
            assertThat(go).contains("var _ Shape = (*Circle)(nil)");
            assertThat(go).doesNotContain("type Shape struct");
        }
    }

    @Nested
    @DisplayName("错误与枚举")
    class ErrorAndEnumTests {

        @Test
        @DisplayName("可能抛出的函数返回 error")
        void testErrorResult() {
            String go = generate("int parse(int v) { if (v < 0) throw std::runtime_error(\"neg\"); return v; }");

            assertThat(go).contains("type RuntimeError struct {");
            assertThat(go).contains("func (e *RuntimeError) Error() string {");
            assertThat(go).contains("func parse(v int) (int, error) {");
        }

        @Test
        @DisplayName("枚举：隐式值用 iota，显式值逐项写出")
        void testEnums() {
            String go = generate("enum Mode { A, B };\nenum class Color { Red, Green = 5, Blue };");

            assertThat(go).contains("type Mode int");
            assertThat(go).contains("ModeA Mode = iota");
            assertThat(go).contains("ColorRed Color = 0");
            assertThat(go).contains("ColorGreen Color = 5");
            assertThat(go).contains("ColorBlue Color = 6");
        }

        @Test
        @DisplayName("常量全局变量")
        void testConstGlobal() {
            assertThat(generate("const int MAX_SIZE = 64;")).contains("const MAX_SIZE int = 64");
        }
    }

    @Nested
    @DisplayName("并发")
    class ConcurrencyTests {

        @Test
        @DisplayName("命名线程变成 goroutine 加完成通道")
        void testThread() {
            String go = generate("void worker(int id) {}\nvoid run() { std::thread t(worker, 1); t.join(); }");

            assertThat(go).contains("tDone := make(chan struct{})");
            assertThat(go).contains("go func() {");
            assertThat(go).contains("<-tDone");
        }

        @Test
        @DisplayName("未在本单元定义的被调函数仍然接收通道结果")
        void testAwaitUnknownCallee() {
            String go = generate("Task<int> compute() { int a = co_await fetch(1); co_return a; }");

            assertThat(go).contains("a := <-fetch(1)");
            assertThat(go).contains("result <- a");
            assertThat(go).doesNotContain("// co_await");
            assertThat(go).doesNotContain("// co_return");
        }

        @Test
        @DisplayName("32 位原子整数映射为 atomic.Int32")
        void testAtomicWidth() {
            String go = generate("class C {\n"
                    + "public:\n"
                    + "    int get() const { return 0; }\n"
                    + "private:\n"
                    + "    std::atomic<int> n;\n"
                    + "};\n");

            assertThat(go).contains("n atomic.Int32");
            assertThat(go).contains("\"sync/atomic\"");
            assertThat(go).doesNotContain("atomic.Int64");
        }

        @Test
        @DisplayName("裸指针形参的 nil 检查")
        void testNilCheck() {
            assertThat(generate("void touch(int* p) { *p = 1; }")).contains("if p == nil {");
        }
    }

    @Test
    @DisplayName("泛型结构体与容器提示")
    void testContainerTemplate() {
        String go = generate("template<typename T>\n"
                + "class Stack {\n"
                + "public:\n"
                + "    int size() const { return 0; }\n"
                + "private:\n"
                + "    std::vector<T> items;\n"
                + "};\n");

        assertThat(go).contains("// container template: Len() mirrors size()");
        assertThat(go).contains("type Stack[T any] struct {");
        assertThat(go).contains("items []T");
    }

    @Test
    @DisplayName("只有非类型形参的模板不留下空的类型参数列表")
    void testNonTypeOnlyTemplate() {
        String go = generate("template<int N>\n"
                + "struct Buf {\n"
                + "    int data[N];\n"
                + "    int size() const { return N; }\n"
                + "};\n"
                + "template<int N>\n"
                + "int twice() { return N * 2; }\n");

        assertThat(go).contains("type Buf struct {");
        assertThat(go).contains("func (b *Buf) Size() int {");
        assertThat(go).contains("func twice() int {");
        assertThat(go).doesNotContain("Buf[]");
        assertThat(go).doesNotContain("twice[]");
    }

    @Test
    @DisplayName("方法模板的类型形参退化为 any")
    void testMethodTemplate() {
        String go = generate("class Box {\n"
                + "public:\n"
                + "    template<typename U>\n"
                + "    void put(U value) {}\n"
                + "};\n");

        assertThat(go).contains("// type parameters [U any] erased to any");
        assertThat(go).contains("func (b *Box) Put(value any) {");
    }

    @Test
    @DisplayName("测试骨架")
    void testScaffold() {
        String tests = new GoCodeGenerator(new TranspilerOptions()).generateTests(analyze(POINT + "int main() { return 0; }"));

        assertThat(tests).contains("import \"testing\"");
        assertThat(tests).contains("func TestPointGetX(t *testing.T) {");
        assertThat(tests).contains("t.Skip(\"not yet written\")");
        assertThat(tests).doesNotContain("TestMain");
    }
}
