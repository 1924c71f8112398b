package com.chih.JSugar.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HtmlTags 测试")
class HtmlTagsTest {

    @Test
    @DisplayName("合法标签名去掉首尾空白后返回")
    void testValidTagName() {
        assertThat(HtmlTags.validateTagName("h2")).isEqualTo("h2");
        assertThat(HtmlTags.validateTagName("  section ")).isEqualTo("section");
        assertThat(HtmlTags.validateTagName(new StringBuilder("Article"))).isEqualTo("Article");
    }

    @Test
    @DisplayName("空标签名")
    void testEmptyTagName() {
        assertThatThrownBy(() -> HtmlTags.validateTagName(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Tag name cannot be empty");
        assertThatThrownBy(() -> HtmlTags.validateTagName("   "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Tag name cannot be empty");
    }

    @Test
    @DisplayName("包含非字母数字字符的标签名")
    void testInvalidTagName() {
        assertThatThrownBy(() -> HtmlTags.validateTagName("1div"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid tag name: \"1div\"");
        assertThatThrownBy(() -> HtmlTags.validateTagName("div onclick=x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must start with a letter");
        assertThatThrownBy(() -> HtmlTags.validateTagName("my-tag"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("禁止动态输出的标签，不区分大小写")
    void testForbiddenTagName() {
        assertThatThrownBy(() -> HtmlTags.validateTagName("script"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Forbidden tag name: \"script\". This tag cannot be used dynamically.");
        assertThatThrownBy(() -> HtmlTags.validateTagName("IFrame"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Forbidden tag name: \"IFrame\"");
    }
}
