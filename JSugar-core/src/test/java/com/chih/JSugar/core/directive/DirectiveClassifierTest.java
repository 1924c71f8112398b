package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.exception.UnknownDirectiveException;
import com.chih.JSugar.core.support.DirectivePrefixHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.chih.JSugar.core.AstFixtures.attr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DirectiveClassifier 测试")
class DirectiveClassifierTest {

    private final DirectiveClassifier classifier =
            new DirectiveClassifier(DirectiveRegistry.withDefaults(), new DirectivePrefixHelper("s"));

    @Test
    @DisplayName("指令属性分类")
    void testClassification() {
        assertThat(classifier.isDirectiveAttribute("s:if")).isTrue();
        assertThat(classifier.isDirectiveAttribute("class")).isFalse();
        assertThat(classifier.isDirectiveAttribute("s:block", true)).isTrue();
        assertThat(classifier.isDirectiveAttribute("s:block", false)).isFalse();

        assertThat(classifier.isControlFlowDirectiveAttribute("s:foreach")).isTrue();
        assertThat(classifier.isControlFlowDirectiveAttribute("s:text")).isFalse();

        assertThat(classifier.isNonPassThroughDirectiveAttribute("s:slot", true)).isFalse();
        assertThat(classifier.isNonPassThroughDirectiveAttribute("s:class", true)).isTrue();
        assertThat(classifier.isNonPassThroughDirectiveAttribute("s:unknown", true)).isTrue();
        assertThat(classifier.isPassThrough("raw")).isTrue();
    }

    @Test
    @DisplayName("能力查询")
    void testCapabilities() {
        assertThat(classifier.pairingFollowers("if")).containsExactly("elseif", "else");
        assertThat(classifier.pairingFollowers("else")).isEmpty();
        assertThat(classifier.pairingFollowers("missing")).isEmpty();
        assertThat(classifier.isElementClaiming("ifblock")).isTrue();
        assertThat(classifier.isElementClaiming("if")).isFalse();
        assertThat(classifier.elementExpressionAttribute("ifblock")).isEqualTo("name");
        assertThat(classifier.elementExpressionAttribute("missing")).isNull();
        assertThat(classifier.compilerForAttribute("s:nope", true)).isEmpty();
    }

    @Test
    @DisplayName("未知指令：建议与定位到指令名的列号")
    void testValidateUnknownDirective() {
        AttributeNode attribute = attr("s:fi", "x", 3, 10);
        CompilationContext context = new CompilationContext("page.html", "");

        assertThatThrownBy(() -> classifier.validateDirectiveAttribute(attribute, context, true))
                .isInstanceOf(UnknownDirectiveException.class)
                .hasMessage("Unknown directive \"fi\". Did you mean \"if\"? (template: page.html line:3 column:12)");
    }

    @Test
    @DisplayName("已知指令与非指令属性通过校验")
    void testValidateKnownDirective() {
        CompilationContext context = new CompilationContext("page.html", "");

        classifier.validateDirectiveAttribute(attr("s:if", "x"), context, true);
        classifier.validateDirectiveAttribute(attr("href", "x"), context, true);
    }

    @Test
    @DisplayName("距离相同时继承类保留名优先")
    void testSuggestPrefersInheritanceNamesOnTie() {
        DirectiveCompiler click = mock(DirectiveCompiler.class);
        when(click.getType()).thenReturn(DirectiveType.ATTRIBUTE);
        DirectiveClassifier custom = new DirectiveClassifier(
                DirectiveRegistry.empty().register("click", click), new DirectivePrefixHelper("s"));

        assertThat(custom.suggest("blick")).isEqualTo("block");
        assertThat(custom.suggest("clic")).isEqualTo("click");
        assertThat(custom.suggest("zzzzzz")).isNull();
    }

    @Test
    @DisplayName("与任一候选完全相同（大小写不敏感）时不给建议")
    void testExactMatchSuppressesSuggestion() {
        assertThat(classifier.suggest("with")).isNull();
        assertThat(classifier.suggest("block")).isNull();
        assertThat(classifier.suggest("BLOCK")).isNull();
        assertThat(classifier.suggest("Foreach")).isNull();
    }

    @Test
    @DisplayName("建议距离可配置")
    void testSuggestionDistance() {
        DirectiveClassifier strict = new DirectiveClassifier(DirectiveRegistry.withDefaults(),
                new DirectivePrefixHelper("s"), 1);

        assertThat(strict.suggest("fi")).isNull();
        assertThat(strict.suggest("iff")).isEqualTo("if");
        assertThat(classifier.suggest("fi")).isEqualTo("if");
    }
}
