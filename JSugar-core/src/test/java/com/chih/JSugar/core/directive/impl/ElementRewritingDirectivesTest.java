package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.HostCodeNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.chih.JSugar.core.AstFixtures.attr;
import static com.chih.JSugar.core.AstFixtures.attrs;
import static com.chih.JSugar.core.AstFixtures.directive;
import static com.chih.JSugar.core.AstFixtures.element;
import static com.chih.JSugar.core.AstFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * tag / ifcontent / nowrap 的代码生成
 */
@DisplayName("元素改写指令测试")
class ElementRewritingDirectivesTest {

    private final CompilationContext context = new CompilationContext("page.html", "");

    @Test
    @DisplayName("ifcontent 捕获子节点输出，非空时输出外层元素")
    void testIfContentWithElement() {
        // Given
        DirectiveNode node = new DirectiveNode("ifcontent", "true", List.of(text("body")), 3, 5);
        node.setElement(element("div", attrs(attr("class", "card"))));

        // When
        List<Node> result = new IfContentDirective().compile(node, context);

        // Then
        assertThat(ControlFlowDirectivesTest.render(result)).containsExactly(
                "startCapture();", "body", "String __content_3_5 = endCapture();",
                "if (!__content_3_5.isBlank()) {", "ElementNode", "}");
        ElementNode wrapper = (ElementNode) result.get(4);
        assertThat(wrapper.getTag()).isEqualTo("div");
        OutputNode captured = (OutputNode) wrapper.getChildren().get(0);
        assertThat(captured.getExpression()).isEqualTo("__content_3_5");
        assertThat(captured.isEscape()).isFalse();
        assertThat(captured.getContext()).isEqualTo(OutputContext.RAW);
    }

    @Test
    @DisplayName("ifcontent 自闭合元素不放入捕获内容")
    void testIfContentSelfClosing() {
        DirectiveNode node = directive("ifcontent", "true", text("x"));
        node.setElement(new ElementNode("hr", new ArrayList<>(), new ArrayList<>(), true, 1, 1));

        List<Node> result = new IfContentDirective().compile(node, context);

        ElementNode wrapper = (ElementNode) result.get(4);
        assertThat(wrapper.isSelfClosing()).isTrue();
        assertThat(wrapper.getChildren()).isEmpty();
    }

    @Test
    @DisplayName("ifcontent 没有外层元素时只输出捕获内容")
    void testIfContentWithoutElement() {
        DirectiveNode node = directive("ifcontent", "true", text("x"));

        List<Node> result = new IfContentDirective().compile(node, context);

        assertThat(ControlFlowDirectivesTest.render(result)).containsExactly(
                "startCapture();", "x", "String __content_1_1 = endCapture();",
                "if (!__content_1_1.isBlank()) {", "OutputNode", "}");
    }

    @Test
    @DisplayName("tag 单独编译时只生成标签名校验")
    void testTagCompile() {
        DirectiveNode node = new DirectiveNode("tag", " level ", List.of(), 2, 7);

        List<Node> result = new TagDirective().compile(node, context);

        assertThat(result).hasSize(1);
        assertThat(((HostCodeNode) result.get(0)).getCode())
                .isEqualTo("String __tag_2_7 = com.chih.JSugar.runtime.HtmlTags.validateTagName(level);");
    }

    @Test
    @DisplayName("nowrap 去掉包裹，只保留子节点")
    void testNoWrap() {
        NoWrapDirective noWrap = new NoWrapDirective();
        DirectiveNode node = directive("nowrap", "true", text("a"), text("b"));

        assertThat(noWrap.getType()).isEqualTo(DirectiveType.ATTRIBUTE);
        assertThat(noWrap.removesContentWrapper()).isTrue();
        assertThat(ControlFlowDirectivesTest.render(noWrap.compile(node, context))).containsExactly("a", "b");
    }
}
