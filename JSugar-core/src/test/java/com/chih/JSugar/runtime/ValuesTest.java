package com.chih.JSugar.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Values 测试")
class ValuesTest {

    @Test
    @DisplayName("空值判断")
    void testIsEmpty() {
        assertThat(Values.isEmpty(null)).isTrue();
        assertThat(Values.isEmpty("")).isTrue();
        assertThat(Values.isEmpty(List.of())).isTrue();
        assertThat(Values.isEmpty(Map.of())).isTrue();
        assertThat(Values.isEmpty(new int[0])).isTrue();
        assertThat(Values.isEmpty(Optional.empty())).isTrue();
        assertThat(Values.isEmpty(false)).isTrue();

        assertThat(Values.isEmpty(" ")).isFalse();
        assertThat(Values.isEmpty(List.of(1))).isFalse();
        assertThat(Values.isEmpty(0)).isFalse();
    }

    @Test
    @DisplayName("isSet 与 truthy")
    void testIsSetAndTruthy() {
        assertThat(Values.isSet(null)).isFalse();
        assertThat(Values.isSet("")).isTrue();
        assertThat(Values.truthy(Boolean.TRUE)).isTrue();
        assertThat(Values.truthy(Boolean.FALSE)).isFalse();
        assertThat(Values.truthy("x")).isTrue();
        assertThat(Values.truthy(List.of())).isFalse();
    }
}
