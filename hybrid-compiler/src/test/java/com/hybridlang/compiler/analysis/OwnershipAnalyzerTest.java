package com.hybridlang.compiler.analysis;

import com.hybridlang.compiler.ir.ClassDecl;
import com.hybridlang.compiler.ir.Function;
import com.hybridlang.compiler.ir.IrModule;
import com.hybridlang.compiler.parser.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OwnershipAnalyzer 测试")
class OwnershipAnalyzerTest {

    private Function analyzedFree(String source) {
        IrModule ir = SourceParser.parseString(source);
        new OwnershipAnalyzer().run(ir);
        return ir.getFunctions().get(0);
    }

    @Test
    @DisplayName("按值传入的 unique_ptr 被移动")
    void testUniquePtrMoved() {
        Function fn = analyzedFree("void adopt(std::unique_ptr<Node> node) { keep(node.get()); }");
        assertThat(fn.getMovedParams()).containsExactly("node");
        assertThat(fn.isMoved("node")).isTrue();
        assertThat(fn.getBorrowedParams()).isEmpty();
    }

    @Test
    @DisplayName("std::move 的形参被移动")
    void testStdMove() {
        Function fn = analyzedFree("void sink(std::vector<int> data) { store(std::move(data)); }");
        assertThat(fn.getMovedParams()).containsExactly("data");
    }

    @Test
    @DisplayName("引用与裸指针被借用，基本类型两者都不是")
    void testBorrowed() {
        Function fn = analyzedFree("int sum(const std::vector<int>& xs, Node* head, int bias) { return bias; }");
        assertThat(fn.getBorrowedParams()).containsExactly("xs", "head");
        assertThat(fn.getMovedParams()).isEmpty();
        assertThat(fn.isBorrowed("bias")).isFalse();
        assertThat(fn.isMoved("bias")).isFalse();
    }

    @Test
    @DisplayName("按值传入后放进容器或原样返回视为移动")
    void testEscaping() {
        Function pushed = analyzedFree("void add(std::string name) { names.push_back(name); }");
        assertThat(pushed.getMovedParams()).containsExactly("name");

        Function returned = analyzedFree("std::string echo(std::string s) { return s; }");
        assertThat(returned.getMovedParams()).containsExactly("s");

        Function read = analyzedFree("size_t length(std::string s) { return s.size(); }");
        assertThat(read.getMovedParams()).isEmpty();
        assertThat(read.getBorrowedParams()).containsExactly("s");
    }

    @Test
    @DisplayName("构造器初始化列表中存入成员")
    void testMemberInitializer() {
        IrModule ir = SourceParser.parseString(
                "class Person { public: Person(std::string n) : name(n) {} private: std::string name; };");
        new OwnershipAnalyzer().run(ir);
        ClassDecl person = ir.findClass("Person");
        assertThat(person.getMethods().get(0).getMovedParams()).containsExactly("n");
    }
}
