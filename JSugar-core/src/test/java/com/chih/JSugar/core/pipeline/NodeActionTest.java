package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.exception.SyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.chih.JSugar.core.AstFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NodeAction 测试")
class NodeActionTest {

    @Test
    @DisplayName("四种结果互斥")
    void testKinds() {
        assertThat(NodeAction.none().isNone()).isTrue();
        assertThat(NodeAction.skipChildren().isSkipChildren()).isTrue();
        assertThat(NodeAction.skipChildren().isNone()).isFalse();

        NodeAction replace = NodeAction.replace(text("a"));
        assertThat(replace.isReplacement()).isTrue();
        assertThat(replace.isRestart()).isFalse();
        assertThat(replace.getReplacement()).hasSize(1);

        NodeAction failure = NodeAction.fail(new SyntaxException("x"));
        assertThat(failure.isFailure()).isTrue();
        assertThat(failure.isReplacement()).isFalse();
    }

    @Test
    @DisplayName("空列表替换是合法的删除操作")
    void testEmptyReplacement() {
        NodeAction action = NodeAction.replace(List.of(), true);

        assertThat(action.isReplacement()).isTrue();
        assertThat(action.isRestart()).isTrue();
        assertThat(action.getReplacement()).isEmpty();
    }

    @Test
    @DisplayName("替换列表被复制，之后修改原列表不影响结果")
    void testReplacementIsCopied() {
        List<Node> nodes = new ArrayList<>();
        nodes.add(text("a"));
        NodeAction action = NodeAction.replace(nodes);

        nodes.add(text("b"));

        assertThat(action.getReplacement()).hasSize(1);
    }

    @Test
    @DisplayName("null 参数被拒绝")
    void testNullArguments() {
        assertThatThrownBy(() -> NodeAction.replace((List<Node>) null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeAction.fail(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
