package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.TextNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.exception.SyntaxException;
import com.chih.JSugar.core.exception.TemplateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.chih.JSugar.core.AstFixtures.doc;
import static com.chih.JSugar.core.AstFixtures.element;
import static com.chih.JSugar.core.AstFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AstPipeline 遍历语义测试
 */
@DisplayName("AstPipeline 测试")
class AstPipelineTest {

    private CompilationContext context;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        context = new CompilationContext("page.html", "");
        calls = new ArrayList<>();
    }

    @Test
    @DisplayName("按优先级执行，优先级相同时按注册顺序")
    void testPassOrdering() {
        // Given
        AstPipeline pipeline = new AstPipeline()
                .addPass(recorder("late"), 50)
                .addPass(recorder("first"), 10)
                .addPass(recorder("second"), 10);

        // When
        pipeline.execute(doc(), context);

        // Then
        assertThat(calls).containsExactly(
                "first:before:DocumentNode", "second:before:DocumentNode", "late:before:DocumentNode",
                "first:after:DocumentNode", "second:after:DocumentNode", "late:after:DocumentNode");
        assertThat(pipeline.getPasses()).hasSize(3);
    }

    @Test
    @DisplayName("子节点在父节点的 before 与 after 之间遍历")
    void testChildrenVisitedBetweenHooks() {
        // Given
        AstPipeline pipeline = new AstPipeline().addPass(recorder("p"));

        // When
        pipeline.execute(doc(element("div", text("a"))), context);

        // Then
        assertThat(calls).containsExactly(
                "p:before:DocumentNode", "p:before:ElementNode", "p:before:TextNode",
                "p:after:TextNode", "p:after:ElementNode", "p:after:DocumentNode");
    }

    @Test
    @DisplayName("普通替换从下一个 Pass 继续，替换节点不再经过产生它的 Pass")
    void testReplacementContinuesWithNextPass() {
        // Given
        List<String> seenByReplacer = new ArrayList<>();
        List<String> seenByNext = new ArrayList<>();
        AstPass replacer = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode t) {
                    seenByReplacer.add(t.getContent());
                    if ("a".equals(t.getContent())) {
                        return NodeAction.replace(text("b"), text("c"));
                    }
                }
                return NodeAction.none();
            }
        };
        AstPass next = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode t) {
                    seenByNext.add(t.getContent());
                }
                return NodeAction.none();
            }
        };
        AstPipeline pipeline = new AstPipeline().addPass(replacer, 1).addPass(next, 2);

        // When
        DocumentNode result = pipeline.execute(doc(text("a")), context);

        // Then
        assertThat(seenByReplacer).containsExactly("a");
        assertThat(seenByNext).containsExactly("b", "c");
        assertThat(result.getChildren()).extracting(n -> ((TextNode) n).getContent()).containsExactly("b", "c");
    }

    @Test
    @DisplayName("restart 替换从同一个 Pass 重新开始")
    void testRestartReplacementRevisitsSamePass() {
        // Given
        List<String> seen = new ArrayList<>();
        AstPass replacer = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode t) {
                    seen.add(t.getContent());
                    if ("a".equals(t.getContent())) {
                        return NodeAction.replace(List.of(text("b")), true);
                    }
                }
                return NodeAction.none();
            }
        };

        // When
        DocumentNode result = new AstPipeline().addPass(replacer).execute(doc(text("a")), context);

        // Then
        assertThat(seen).containsExactly("a", "b");
        assertThat(((TextNode) result.getChildren().get(0)).getContent()).isEqualTo("b");
    }

    @Test
    @DisplayName("after 钩子的空替换会移除节点")
    void testEmptyReplacementRemovesNode() {
        // Given
        AstPass remover = new AstPass() {
            @Override
            public NodeAction after(Node node, PipelineContext ctx) {
                if (node instanceof TextNode t && "drop".equals(t.getContent())) {
                    return NodeAction.replace(List.of());
                }
                return NodeAction.none();
            }
        };

        // When
        DocumentNode result = new AstPipeline().addPass(remover)
                .execute(doc(text("keep"), text("drop"), text("tail")), context);

        // Then
        assertThat(result.getChildren()).extracting(n -> ((TextNode) n).getContent())
                .containsExactly("keep", "tail");
    }

    @Test
    @DisplayName("skipChildren 不下降到子节点，但 after 钩子仍然执行")
    void testSkipChildrenStillRunsAfterHooks() {
        // Given
        AstPass skipper = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                return node instanceof ElementNode ? NodeAction.skipChildren() : NodeAction.none();
            }
        };
        AstPipeline pipeline = new AstPipeline().addPass(skipper, 1).addPass(recorder("r"), 2);

        // When
        pipeline.execute(doc(element("pre", text("hidden"))), context);

        // Then
        assertThat(calls).contains("r:before:ElementNode", "r:after:ElementNode");
        assertThat(calls).noneMatch(call -> call.endsWith("TextNode"));
    }

    @Test
    @DisplayName("钩子可以通过 PipelineContext 获取父节点与位置")
    void testContextExposesParentAndIndex() {
        // Given
        List<String> positions = new ArrayList<>();
        AstPass observer = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode t) {
                    positions.add(t.getContent() + "@" + ctx.index() + ":" + ctx.parent().getClass().getSimpleName());
                }
                return NodeAction.none();
            }
        };

        // When
        new AstPipeline().addPass(observer).execute(doc(element("p", text("x"), text("y"))), context);

        // Then
        assertThat(positions).containsExactly("x@0:ElementNode", "y@1:ElementNode");
    }

    @Test
    @DisplayName("fail 结果终止遍历并附加节点位置")
    void testFailureCarriesNodeLocation() {
        // Given
        AstPass failing = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode) {
                    return NodeAction.fail(new SyntaxException("boom"));
                }
                return NodeAction.none();
            }
        };
        List<String> afterFailure = new ArrayList<>();
        AstPass observer = new AstPass() {
            @Override
            public NodeAction after(Node node, PipelineContext ctx) {
                afterFailure.add(node.getClass().getSimpleName());
                return NodeAction.none();
            }
        };

        // When
        PipelineResult result = new AstPipeline().addPass(failing, 1).addPass(observer, 2)
                .run(doc(new TextNode("x", 3, 4)), context);

        // Then
        assertThat(result.isSuccess()).isFalse();
        TemplateException error = result.getError();
        assertThat(error.getRawMessage()).isEqualTo("boom");
        assertThat(error.getTemplatePath()).isEqualTo("page.html");
        assertThat(error.getTemplateLine()).isEqualTo(3);
        assertThat(error.getTemplateColumn()).isEqualTo(4);
        assertThat(afterFailure).isEmpty();
        assertThatThrownBy(result::getDocument).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("钩子抛出的模板异常等同于 fail，已有位置不会被覆盖")
    void testThrownTemplateExceptionBecomesFailure() {
        // Given
        AstPass throwing = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof TextNode) {
                    throw new SyntaxException("located").withLocation("other.html", 7, 2);
                }
                return NodeAction.none();
            }
        };
        AstPipeline pipeline = new AstPipeline().addPass(throwing);

        // When / Then
        assertThatThrownBy(() -> pipeline.execute(doc(text("x")), context))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("located (template: other.html line:7 column:2)");
    }

    @Test
    @DisplayName("结果不是单个文档节点时抛出 IllegalStateException")
    void testNonDocumentResultIsRejected() {
        // Given
        AstPass broken = new AstPass() {
            @Override
            public NodeAction after(Node node, PipelineContext ctx) {
                return node instanceof DocumentNode ? NodeAction.replace(List.of()) : NodeAction.none();
            }
        };

        // When / Then
        assertThatThrownBy(() -> new AstPipeline().addPass(broken).run(doc(), context))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("single DocumentNode");
    }

    @Test
    @DisplayName("遍历状态每次执行都是新的")
    void testTraversalStateIsFreshPerRun() {
        // Given
        StateKey<Integer> counter = StateKey.named("counter");
        List<Integer> firstSeen = new ArrayList<>();
        AstPass counting = new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                if (node instanceof DocumentNode) {
                    firstSeen.add(ctx.state().getOrDefault(counter, 0));
                }
                ctx.state().put(counter, ctx.state().getOrDefault(counter, 0) + 1);
                return NodeAction.none();
            }
        };
        AstPipeline pipeline = new AstPipeline().addPass(counting);

        // When
        pipeline.execute(doc(text("a"), text("b")), context);
        pipeline.execute(doc(text("a")), context);

        // Then
        assertThat(firstSeen).containsExactly(0, 0);
    }

    @Test
    @DisplayName("注册 null Pass 抛出异常")
    void testNullPassRejected() {
        assertThatThrownBy(() -> new AstPipeline().addPass(null, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private AstPass recorder(String name) {
        return new AstPass() {
            @Override
            public NodeAction before(Node node, PipelineContext ctx) {
                calls.add(name + ":before:" + node.getClass().getSimpleName());
                return NodeAction.none();
            }

            @Override
            public NodeAction after(Node node, PipelineContext ctx) {
                calls.add(name + ":after:" + node.getClass().getSimpleName());
                return NodeAction.none();
            }
        };
    }
}
