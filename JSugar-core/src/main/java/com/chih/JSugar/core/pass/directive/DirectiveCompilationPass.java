package com.chih.JSugar.core.pass.directive;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.directive.DirectiveCompiler;
import com.chih.JSugar.core.directive.DirectiveRegistry;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.NodeAction;
import com.chih.JSugar.core.pipeline.PipelineContext;

import java.util.List;

/**
 * 指令编译：子节点处理完成后，把指令节点替换为其编译结果
 * <p>
 * 已被配对消费的后继指令直接移除。编译结果从本 Pass 重新开始遍历，
 * 以便其中新产生的指令节点也能被编译。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/16
 */
public class DirectiveCompilationPass implements AstPass {

    private final DirectiveRegistry registry;

    public DirectiveCompilationPass(DirectiveRegistry registry) {
        this.registry = registry;
    }

    @Override
    public NodeAction after(Node node, PipelineContext context) {
        if (!(node instanceof DirectiveNode directive)) {
            return NodeAction.none();
        }

        if (directive.isConsumedByPairing()) {
            return NodeAction.replace(List.of());
        }

        if (!registry.has(directive.getName())) {
            // extraction validates names, reaching here means a pass produced an unregistered directive
            throw new IllegalStateException("No compiler registered for directive \"" + directive.getName() + "\"");
        }

        DirectiveCompiler compiler = registry.get(directive.getName());
        return NodeAction.replace(compiler.compile(directive, context.compilation()), true);
    }
}
