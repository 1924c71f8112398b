package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.directive.impl.IfDirective;
import com.chih.JSugar.core.directive.impl.SpreadDirective;
import com.chih.JSugar.core.directive.impl.TagDirective;
import com.chih.JSugar.core.exception.JSugarException;
import com.chih.JSugar.core.exception.UnknownDirectiveException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DirectiveRegistry 测试")
class DirectiveRegistryTest {

    @Test
    @DisplayName("默认注册表包含全部内置指令，延迟实例化后缓存")
    void testDefaults() {
        DirectiveRegistry registry = DirectiveRegistry.withDefaults();

        assertThat(registry.names()).contains("if", "elseif", "else", "foreach", "forelse", "switch", "case",
                "default", "try", "finally", "class", "spread", "attr", "text", "html", "slot", "ifblock", "tag",
                "ifcontent", "nowrap");
        assertThat(registry.get("if")).isInstanceOf(IfDirective.class);
        assertThat(registry.get("if")).isSameAs(registry.get("if"));
        assertThat(registry.get("attr")).isInstanceOf(SpreadDirective.class);
        assertThat(registry.get("tag")).isInstanceOf(TagDirective.class);
        assertThat(registry.get("ifcontent").getType()).isEqualTo(DirectiveType.CONTROL_FLOW);
        assertThat(registry.get("nowrap").removesContentWrapper()).isTrue();
    }

    @Test
    @DisplayName("按类别筛选")
    void testGetByType() {
        DirectiveRegistry registry = DirectiveRegistry.withDefaults();

        assertThat(registry.getByType(DirectiveType.CONTENT)).containsOnlyKeys("text", "html");
        assertThat(registry.getByType(DirectiveType.PASS_THROUGH)).containsOnlyKeys("slot", "bind", "raw");
        assertThat(registry.getByType(DirectiveType.ATTRIBUTE))
                .containsOnlyKeys("class", "spread", "attr", "checked", "selected", "disabled", "tag", "nowrap");
    }

    @Test
    @DisplayName("未注册的名称抛出带建议的异常")
    void testUnknownDirective() {
        DirectiveRegistry registry = DirectiveRegistry.withDefaults();

        assertThatThrownBy(() -> registry.get("fi"))
                .isInstanceOf(UnknownDirectiveException.class)
                .hasMessage("Unknown directive \"fi\". Did you mean \"if\"?")
                .satisfies(e -> assertThat(((UnknownDirectiveException) e).getSuggestion()).isEqualTo("if"));

        assertThatThrownBy(() -> registry.get("nothinglikeit"))
                .isInstanceOf(UnknownDirectiveException.class)
                .hasMessage("Unknown directive \"nothinglikeit\"");
    }

    @Test
    @DisplayName("覆盖已注册的指令")
    void testOverride() {
        DirectiveRegistry registry = DirectiveRegistry.withDefaults();
        DirectiveCompiler custom = mock(DirectiveCompiler.class);
        when(custom.getType()).thenReturn(DirectiveType.CONTROL_FLOW);

        registry.register("if", custom);

        assertThat(registry.get("if")).isSameAs(custom);
    }

    @Test
    @DisplayName("无法实例化的实现类")
    void testInstantiationFailure() {
        DirectiveRegistry registry = DirectiveRegistry.empty().register("broken", NoDefaultConstructor.class);

        assertThat(registry.has("broken")).isTrue();
        assertThatThrownBy(() -> registry.get("broken"))
                .isInstanceOf(JSugarException.class)
                .hasMessageContaining("no-arg constructor");
    }

    @Test
    @DisplayName("非法参数")
    void testInvalidRegistration() {
        DirectiveRegistry registry = DirectiveRegistry.empty();

        assertThatThrownBy(() -> registry.register("", mock(DirectiveCompiler.class)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("x", (DirectiveCompiler) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    public static class NoDefaultConstructor extends IfDirective {
        public NoDefaultConstructor(String ignored) {
        }
    }
}
