package rib.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 内置方法目录测试
 */
class BuiltinMethodTest {

    @Test
    @DisplayName("按接收者和方法名查找")
    void testFind() {
        assertThat(BuiltinMethod.find("Prefix", "len")).isEqualTo(BuiltinMethod.PREFIX_LEN);
        assertThat(BuiltinMethod.find("List", "contains").getParameterType(0)).isEqualTo(BuiltinMethod.ELEMENT);
        assertThat(BuiltinMethod.find("Prefix", "nope")).isNull();
    }

    @Test
    @DisplayName("空 AS 路径的起源为 AS0")
    void testEmptyPathOrigin() {
        RibValue origin = BuiltinMethod.AS_PATH_ORIGIN.invoke(RibAsPath.EMPTY, new RibValue[0]);
        assertThat(origin).isEqualTo(RibAsn.ZERO);
    }

    @Test
    @DisplayName("前缀长度")
    void testPrefixLen() {
        RibValue len = BuiltinMethod.PREFIX_LEN.invoke(RibPrefix.parse("10.0.0.0/26"), new RibValue[0]);
        assertThat(len).isEqualTo(RibInt.of(26));
    }

    @Test
    @DisplayName("Java 值转换")
    void testFromJava() {
        assertThat(RibValue.fromJava(5)).isEqualTo(RibInt.of(5));
        assertThat(RibValue.fromJava("x")).isEqualTo(RibString.of("x"));
        assertThat(RibValue.fromJava(java.util.Arrays.asList(1L, 2L)))
                .isEqualTo(RibList.of(RibInt.of(1), RibInt.of(2)));
    }
}
