package com.chih.JSugar.core.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DirectivePrefixHelper 测试")
class DirectivePrefixHelperTest {

    @Test
    @DisplayName("识别与剥离指令前缀")
    void testPrefixHandling() {
        DirectivePrefixHelper helper = new DirectivePrefixHelper("x");

        assertThat(helper.isDirective("x:if")).isTrue();
        assertThat(helper.isDirective("s:if")).isFalse();
        assertThat(helper.isDirective(null)).isFalse();
        assertThat(helper.stripPrefix("x:foreach")).isEqualTo("foreach");
        assertThat(helper.stripPrefix("class")).isEqualTo("class");
        assertThat(helper.buildName("text")).isEqualTo("x:text");
        assertThat(helper.getElementPrefix()).isEqualTo("x-");
    }

    @Test
    @DisplayName("只有带前缀的保留名才是继承类属性")
    void testInheritanceAttributes() {
        DirectivePrefixHelper helper = new DirectivePrefixHelper("s");

        assertThat(helper.isInheritanceAttribute("s:block")).isTrue();
        assertThat(helper.isInheritanceAttribute("s:extends")).isTrue();
        assertThat(helper.isInheritanceAttribute("s:if")).isFalse();
        assertThat(helper.isInheritanceAttribute("with")).isFalse();
    }

    @Test
    @DisplayName("自定义元素前缀")
    void testElementPrefix() {
        DirectivePrefixHelper helper = new DirectivePrefixHelper("s", "sugar-");

        assertThat(helper.hasElementPrefix("sugar-ifblock")).isTrue();
        assertThat(helper.stripElementPrefix("sugar-ifblock")).isEqualTo("ifblock");
        assertThat(helper.stripElementPrefix("div")).isEqualTo("div");
    }
}
