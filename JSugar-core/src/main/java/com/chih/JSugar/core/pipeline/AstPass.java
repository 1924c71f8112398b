package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.Node;

/**
 * 编译阶段（Pass）
 * <p>
 * 每个节点在一次遍历中依次调用 {@link #before} 与 {@link #after}。
 * 遍历期间的可变状态必须放在 {@link PipelineContext#state()} 中，不能放在 Pass 实例字段上，
 * 这样同一个 Pass 实例可以被多个线程的编译共享。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public interface AstPass {

    /**
     * 进入节点时调用（子节点处理之前）
     */
    default NodeAction before(Node node, PipelineContext context) {
        return NodeAction.none();
    }

    /**
     * 离开节点时调用（子节点已处理并写回之后）
     */
    default NodeAction after(Node node, PipelineContext context) {
        return NodeAction.none();
    }
}
