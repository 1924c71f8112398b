package com.chih.JSugar.core.compiler;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.ast.TextNode;
import com.chih.JSugar.core.exception.SyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.chih.JSugar.core.AstFixtures.attr;
import static com.chih.JSugar.core.AstFixtures.attrs;
import static com.chih.JSugar.core.AstFixtures.doc;
import static com.chih.JSugar.core.AstFixtures.element;
import static com.chih.JSugar.core.AstFixtures.output;
import static com.chih.JSugar.core.AstFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CompilationContext 测试")
class CompilationContextTest {

    @Test
    @DisplayName("为整棵树和属性值中的输出标记模板路径")
    void testStampTemplatePath() {
        // Given
        OutputNode inAttribute = output("url");
        OutputNode inParts = output("id");
        AttributeNode href = new AttributeNode("href", AttributeValue.output(inAttribute), 1, 1);
        AttributeNode mixed = new AttributeNode("class", AttributeValue.parts(List.of("a-", inParts)), 1, 1);
        TextNode nested = text("x");
        ElementNode link = element("a", attrs(href, mixed, attr("id", "home")), element("b", nested));
        DocumentNode document = doc(link);

        // When
        new CompilationContext("pages/home.html", "").stampTemplatePath(document);

        // Then
        assertThat(document.getTemplatePath()).isEqualTo("pages/home.html");
        assertThat(nested.getTemplatePath()).isEqualTo("pages/home.html");
        assertThat(href.getTemplatePath()).isEqualTo("pages/home.html");
        assertThat(inAttribute.getTemplatePath()).isEqualTo("pages/home.html");
        assertThat(inParts.getTemplatePath()).isEqualTo("pages/home.html");
    }

    @Test
    @DisplayName("节点自带的模板路径优先于编译路径")
    void testNodePathPreferred() {
        CompilationContext context = new CompilationContext("layout.html", "");
        TextNode included = new TextNode("x", 3, 5);
        included.setTemplatePath("partials/nav.html");

        SyntaxException fromNode = context.syntaxErrorForNode("bad", included);
        SyntaxException fromContext = context.syntaxError("worse", 1, 2);

        assertThat(fromNode.getMessage()).isEqualTo("bad (template: partials/nav.html line:3 column:5)");
        assertThat(fromContext.getMessage()).isEqualTo("worse (template: layout.html line:1 column:2)");
    }

    @Test
    @DisplayName("属性错误使用属性位置")
    void testAttributeError() {
        CompilationContext context = new CompilationContext("page.html", "<div>", true);

        SyntaxException error = context.syntaxErrorForAttribute("nope", attr("x", "y", 7, 11));

        assertThat(error.getTemplateLine()).isEqualTo(7);
        assertThat(error.getTemplateColumn()).isEqualTo(11);
        assertThat(context.isDebug()).isTrue();
        assertThat(context.getSource()).isEqualTo("<div>");
    }

    @Test
    @DisplayName("调试模式下语法错误附带源码片段，消息不变")
    void testDebugSnippet() {
        // Given
        CompilationContext debug = new CompilationContext("page.html", "<div>\n  <p s:fi=\"x\">\n</div>", true);
        CompilationContext plain = new CompilationContext("page.html", "<div>\n  <p s:fi=\"x\">\n</div>");

        // When
        SyntaxException withSnippet = debug.syntaxError("bad", 2, 6);
        SyntaxException withoutSnippet = plain.syntaxError("bad", 2, 6);

        // Then
        assertThat(withSnippet.getSnippet()).contains(" 2 |   <p s:fi=\"x\">").contains("^");
        assertThat(withSnippet.getMessage()).isEqualTo("bad (template: page.html line:2 column:6)");
        assertThat(withoutSnippet.getSnippet()).isNull();
        assertThat(debug.syntaxError("no location", null, null).getSnippet()).isNull();
    }
}
