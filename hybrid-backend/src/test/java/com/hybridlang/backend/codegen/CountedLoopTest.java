package com.hybridlang.backend.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CountedLoop 测试")
class CountedLoopTest {

    @Test
    @DisplayName("前置自增的半开循环")
    void testExclusive() {
        CountedLoop loop = CountedLoop.match("\n  for (int i = 0; i < n; ++i) { co_yield i * 2; }\n");

        assertThat(loop).isNotNull();
        assertThat(loop.getVariable()).isEqualTo("i");
        assertThat(loop.getFrom()).isEqualTo("0");
        assertThat(loop.getTo()).isEqualTo("n");
        assertThat(loop.isInclusive()).isFalse();
        assertThat(loop.getBody().trim()).isEqualTo("co_yield i * 2;");
    }

    @Test
    @DisplayName("后置自增的闭区间循环")
    void testInclusive() {
        CountedLoop loop = CountedLoop.match("for (size_t k = 1; k <= limit; k++) { if (k) { co_yield k; } }");

        assertThat(loop).isNotNull();
        assertThat(loop.isInclusive()).isTrue();
        assertThat(loop.getBody()).contains("if (k) { co_yield k; }");
    }

    @Test
    @DisplayName("不是整个函数体或变量不一致时不匹配")
    void testRejected() {
        assertThat(CountedLoop.match("for (int i = 0; i < n; ++i) { co_yield i; } co_yield -1;")).isNull();
        assertThat(CountedLoop.match("int x = 0; for (int i = 0; i < n; ++i) { co_yield i; }")).isNull();
        assertThat(CountedLoop.match("for (int i = 0; j < n; ++i) { co_yield i; }")).isNull();
        assertThat(CountedLoop.match("for (int i = 0; i < n; i += 2) { co_yield i; }")).isNull();
        assertThat(CountedLoop.match(null)).isNull();
    }
}
