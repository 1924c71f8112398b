package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.ParentNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.exception.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 单次遍历执行全部 Pass
 * <p>
 * 优先级小的 Pass 先执行，优先级相同时按注册顺序执行。对每个节点：
 * </p>
 * <ol>
 *     <li>从起始 Pass 开始依次调用 before；遇到第一个替换时停止，并在原位置遍历替换节点
 *     （restart 时从同一个 Pass 开始，否则从下一个 Pass 开始）</li>
 *     <li>没有替换且没有跳过子节点时，遍历子节点（每个子节点从第 0 个 Pass 开始）并写回</li>
 *     <li>从起始 Pass 开始依次调用 after，替换语义同上</li>
 *     <li>都没有替换时，结果就是原节点</li>
 * </ol>
 * <p>
 * 钩子返回 {@link NodeAction#fail} 或抛出 {@link TemplateException} 都会立即终止遍历，
 * 错误作为值逐层返回，由 {@link #run} 包装成 {@link PipelineResult}。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public class AstPipeline {

    private static final Logger log = LoggerFactory.getLogger(AstPipeline.class);

    private final List<PassEntry> entries = new ArrayList<>();
    private int sequence;

    private volatile List<AstPass> sortedPasses = List.of();

    /**
     * 注册 Pass，可链式调用
     */
    public synchronized AstPipeline addPass(AstPass pass, int priority) {
        if (pass == null) {
            throw new IllegalArgumentException("pass must not be null");
        }
        entries.add(new PassEntry(pass, priority, sequence++));

        List<PassEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(PassEntry::priority).thenComparingInt(PassEntry::sequence));

        List<AstPass> passes = new ArrayList<>(sorted.size());
        for (PassEntry entry : sorted) {
            passes.add(entry.pass());
        }
        this.sortedPasses = List.copyOf(passes);

        if (log.isDebugEnabled()) {
            log.debug("Registered pass {} at priority {}, order now: {}",
                    pass.getClass().getSimpleName(), priority, describe(sorted));
        }
        return this;
    }

    public AstPipeline addPass(AstPass pass) {
        return addPass(pass, 0);
    }

    /**
     * @return 按执行顺序排列的 Pass
     */
    public List<AstPass> getPasses() {
        return sortedPasses;
    }

    /**
     * 执行管线，失败时抛出第一个错误
     */
    public DocumentNode execute(DocumentNode document, CompilationContext compilation) {
        return run(document, compilation).orElseThrow();
    }

    /**
     * 执行管线，把错误作为结果值返回
     *
     * @throws IllegalStateException 结果不是恰好一个文档节点（自定义 Pass 的缺陷）
     */
    public PipelineResult run(DocumentNode document, CompilationContext compilation) {
        Walk walk = new Walk(sortedPasses, compilation, new TraversalState());
        Outcome outcome = walk.visit(document, null, 0, 0);

        if (outcome.error != null) {
            return PipelineResult.failure(outcome.error);
        }

        if (outcome.nodes.size() != 1 || !(outcome.nodes.get(0) instanceof DocumentNode)) {
            throw new IllegalStateException("Pipeline must return a single DocumentNode, got "
                    + outcome.nodes.size() + " node(s)");
        }

        return PipelineResult.success((DocumentNode) outcome.nodes.get(0));
    }

    private static String describe(List<PassEntry> entries) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(entries.get(i).pass().getClass().getSimpleName())
                    .append('@').append(entries.get(i).priority());
        }
        return sb.append(']').toString();
    }

    private record PassEntry(AstPass pass, int priority, int sequence) {
    }

    /**
     * 单节点的遍历结果：节点列表或错误
     */
    private static final class Outcome {
        private final List<Node> nodes;
        private final TemplateException error;

        private Outcome(List<Node> nodes, TemplateException error) {
            this.nodes = nodes;
            this.error = error;
        }

        static Outcome of(List<Node> nodes) {
            return new Outcome(nodes, null);
        }

        static Outcome failed(TemplateException error) {
            return new Outcome(List.of(), error);
        }
    }

    /**
     * 一次 execute 的遍历过程，持有本次执行的 Pass 快照与状态
     */
    private static final class Walk {
        private final List<AstPass> passes;
        private final CompilationContext compilation;
        private final TraversalState state;

        Walk(List<AstPass> passes, CompilationContext compilation, TraversalState state) {
            this.passes = passes;
            this.compilation = compilation;
            this.state = state;
        }

        Outcome visit(Node node, Node parent, int index, int startPass) {
            node.setParent(parent);
            PipelineContext context = new PipelineContext(compilation, parent, index, state);
            boolean skipChildren = false;

            for (int i = startPass; i < passes.size(); i++) {
                NodeAction action = invoke(passes.get(i), node, context, true);
                if (action.isFailure()) {
                    return Outcome.failed(locate(action.getError(), node));
                }
                if (action.isReplacement()) {
                    return visitReplacement(action.getReplacement(), parent, index, action.isRestart() ? i : i + 1);
                }
                if (action.isSkipChildren()) {
                    skipChildren = true;
                }
            }

            if (!skipChildren && node instanceof ParentNode) {
                ParentNode composite = (ParentNode) node;
                Outcome children = visitChildren(composite.getChildren(), node);
                if (children.error != null) {
                    return children;
                }
                composite.setChildren(children.nodes);
            }

            // skip-children only limits descent, after hooks still run
            for (int i = startPass; i < passes.size(); i++) {
                NodeAction action = invoke(passes.get(i), node, context, false);
                if (action.isFailure()) {
                    return Outcome.failed(locate(action.getError(), node));
                }
                if (action.isReplacement()) {
                    return visitReplacement(action.getReplacement(), parent, index, action.isRestart() ? i : i + 1);
                }
            }

            List<Node> result = new ArrayList<>(1);
            result.add(node);
            return Outcome.of(result);
        }

        private Outcome visitChildren(List<Node> children, Node parent) {
            List<Node> result = new ArrayList<>(children.size());
            // iterate over a snapshot, passes may rewrite the live list of siblings
            List<Node> snapshot = new ArrayList<>(children);
            for (int i = 0; i < snapshot.size(); i++) {
                Outcome outcome = visit(snapshot.get(i), parent, i, 0);
                if (outcome.error != null) {
                    return outcome;
                }
                result.addAll(outcome.nodes);
            }
            return Outcome.of(result);
        }

        private Outcome visitReplacement(List<Node> replacement, Node parent, int index, int startPass) {
            List<Node> result = new ArrayList<>(replacement.size());
            for (int offset = 0; offset < replacement.size(); offset++) {
                Outcome outcome = visit(replacement.get(offset), parent, index + offset, startPass);
                if (outcome.error != null) {
                    return outcome;
                }
                result.addAll(outcome.nodes);
            }
            return Outcome.of(result);
        }

        private NodeAction invoke(AstPass pass, Node node, PipelineContext context, boolean before) {
            try {
                NodeAction action = before ? pass.before(node, context) : pass.after(node, context);
                return action != null ? action : NodeAction.none();
            } catch (TemplateException e) {
                return NodeAction.fail(e);
            }
        }

        private TemplateException locate(TemplateException error, Node node) {
            if (!error.hasLocation()) {
                String path = node.getTemplatePath() != null
                        ? node.getTemplatePath()
                        : compilation != null ? compilation.getTemplatePath() : null;
                error.withLocation(path, node.getLine(), node.getColumn());
            }
            return compilation != null ? compilation.withSnippet(error) : error;
        }
    }
}
