package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;

/**
 * 传递给钩子的访问上下文：编译上下文、父节点、在父节点中的位置以及本次遍历的状态
 */
public final class PipelineContext {

    private final CompilationContext compilation;
    private final Node parent;
    private final int index;
    private final TraversalState state;

    public PipelineContext(CompilationContext compilation, Node parent, int index, TraversalState state) {
        this.compilation = compilation;
        this.parent = parent;
        this.index = index;
        this.state = state;
    }

    public CompilationContext compilation() {
        return compilation;
    }

    /**
     * @return 父节点，根节点为 null
     */
    public Node parent() {
        return parent;
    }

    public int index() {
        return index;
    }

    public TraversalState state() {
        return state;
    }
}
