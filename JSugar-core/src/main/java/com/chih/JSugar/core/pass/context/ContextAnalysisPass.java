package com.chih.JSugar.core.pass.context;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.NodeAction;
import com.chih.JSugar.core.pipeline.PipelineContext;
import com.chih.JSugar.core.pipeline.StateKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 上下文分析：为每个输出节点确定转义上下文
 * <ul>
 *     <li>属性值中的输出（单个输出或混合值中的每个输出）一律为 HTML_ATTRIBUTE</li>
 *     <li>元素体中的输出按最近的 script/style 祖先决定，否则为 HTML</li>
 *     <li>关闭转义的输出以及已经固定为 JSON 系列上下文的输出保持不变</li>
 * </ul>
 * 标签栈沿着已解析的元素树结构维护，进入元素时压栈，离开时弹栈。
 * 栈保存在遍历状态中，同一个实例可以被并发编译共享。
 *
 * @author lizhiyuan
 * @since 2026/01/16
 */
public class ContextAnalysisPass implements AstPass {

    private static final StateKey<Deque<AnalysisContext>> STACK = StateKey.named("context-analysis.stack");

    @Override
    public NodeAction before(Node node, PipelineContext context) {
        if (node instanceof DocumentNode) {
            Deque<AnalysisContext> stack = new ArrayDeque<>();
            stack.push(AnalysisContext.empty());
            context.state().put(STACK, stack);
            return NodeAction.none();
        }

        if (node instanceof ElementNode element) {
            updateAttributeContexts(element);
            Deque<AnalysisContext> stack = stack(context);
            stack.push(stack.peek().push(element.getTag()));
            return NodeAction.none();
        }

        if (node instanceof OutputNode output) {
            OutputNode updated = updateOutputNode(output, stack(context).peek().determineContext());
            return updated == output ? NodeAction.none() : NodeAction.replace(updated);
        }

        return NodeAction.none();
    }

    @Override
    public NodeAction after(Node node, PipelineContext context) {
        if (node instanceof ElementNode) {
            Deque<AnalysisContext> stack = stack(context);
            if (stack.size() > 1) {
                stack.pop();
            }
        }
        return NodeAction.none();
    }

    private Deque<AnalysisContext> stack(PipelineContext context) {
        // a pipeline may be executed on a subtree without a DocumentNode root visit
        return context.state().computeIfAbsent(STACK, () -> {
            Deque<AnalysisContext> stack = new ArrayDeque<>();
            stack.push(AnalysisContext.empty());
            return stack;
        });
    }

    private void updateAttributeContexts(ElementNode element) {
        for (AttributeNode attribute : element.getAttributes()) {
            AttributeValue value = attribute.getValue();
            if (value.isOutput()) {
                OutputNode updated = updateOutputNode(value.getOutput(), OutputContext.HTML_ATTRIBUTE);
                if (updated != value.getOutput()) {
                    attribute.setValue(AttributeValue.output(updated));
                }
                continue;
            }

            if (!value.isParts()) {
                continue;
            }

            boolean changed = false;
            List<Object> parts = new ArrayList<>(value.getParts());
            for (int i = 0; i < parts.size(); i++) {
                if (parts.get(i) instanceof OutputNode output) {
                    OutputNode updated = updateOutputNode(output, OutputContext.HTML_ATTRIBUTE);
                    if (updated != output) {
                        parts.set(i, updated);
                        changed = true;
                    }
                }
            }
            if (changed) {
                attribute.setValue(AttributeValue.parts(parts));
            }
        }
    }

    /**
     * @return 新节点；无需改写时返回原节点
     */
    private OutputNode updateOutputNode(OutputNode node, OutputContext target) {
        if (!node.isEscape() || node.getContext().isJsonFamily()) {
            return node;
        }
        if (node.getContext() == target) {
            return node;
        }
        return node.withContext(target);
    }
}
