package com.hybridlang.backend.codegen;

import com.hybridlang.backend.TargetProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NameSanitizer 测试")
class NameSanitizerTest {

    @Test
    @DisplayName("保留字追加下划线")
    void testKeywords() {
        assertThat(NameSanitizer.sanitize("type", TargetProfile.RUST)).isEqualTo("type_");
        assertThat(NameSanitizer.sanitize("self", TargetProfile.RUST)).isEqualTo("self_");
        assertThat(NameSanitizer.sanitize("len", TargetProfile.GO)).isEqualTo("len_");
        assertThat(NameSanitizer.sanitize("range", TargetProfile.GO)).isEqualTo("range_");
        // 各自只避开本目标的保留字
        assertThat(NameSanitizer.sanitize("len", TargetProfile.RUST)).isEqualTo("len");
        assertThat(NameSanitizer.sanitize("fn", TargetProfile.GO)).isEqualTo("fn");
    }

    @Test
    @DisplayName("非法字符与数字开头")
    void testIllegalCharacters() {
        assertThat(NameSanitizer.sanitize("a-b", TargetProfile.RUST)).isEqualTo("a_b");
        assertThat(NameSanitizer.sanitize("9lives", TargetProfile.GO)).isEqualTo("_9lives");
        assertThat(NameSanitizer.sanitize("", TargetProfile.RUST)).isEqualTo("_");
    }

    @Test
    @DisplayName("snake_case 转换")
    void testSnakeCase() {
        assertThat(NameSanitizer.toSnakeCase("getArea")).isEqualTo("get_area");
        assertThat(NameSanitizer.toSnakeCase("HTTPServer")).isEqualTo("http_server");
        assertThat(NameSanitizer.toSnakeCase("already_snake")).isEqualTo("already_snake");
        assertThat(NameSanitizer.toSnakeCase("value2Go")).isEqualTo("value2_go");
    }

    @Test
    @DisplayName("首字母大小写")
    void testCapitalize() {
        assertThat(NameSanitizer.capitalize("area")).isEqualTo("Area");
        assertThat(NameSanitizer.decapitalize("Area")).isEqualTo("area");
        assertThat(NameSanitizer.capitalize("")).isEmpty();
        assertThat(NameSanitizer.isReserved("match", TargetProfile.RUST)).isTrue();
        assertThat(NameSanitizer.isReserved("match", TargetProfile.GO)).isFalse();
    }
}
