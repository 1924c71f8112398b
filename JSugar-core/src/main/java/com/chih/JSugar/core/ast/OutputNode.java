package com.chih.JSugar.core.ast;

import java.util.List;

/**
 * 待输出的动态表达式。不可变，改写上下文时生成新节点。
 */
public final class OutputNode extends Node {

    private final String expression;
    private final boolean escape;
    private final OutputContext context;
    private final List<String> pipes;

    public OutputNode(String expression, boolean escape, OutputContext context, int line, int column) {
        this(expression, escape, context, List.of(), line, column);
    }

    public OutputNode(String expression, boolean escape, OutputContext context, List<String> pipes,
                      int line, int column) {
        super(line, column);
        this.expression = expression;
        this.escape = escape;
        this.context = context;
        this.pipes = pipes == null ? List.of() : List.copyOf(pipes);
    }

    public String getExpression() {
        return expression;
    }

    public boolean isEscape() {
        return escape;
    }

    public OutputContext getContext() {
        return context;
    }

    /**
     * @return 管道变换链（按书写顺序），没有时为空列表
     */
    public List<String> getPipes() {
        return pipes;
    }

    /**
     * 复制为指定上下文的新节点，保留模板路径
     */
    public OutputNode withContext(OutputContext newContext) {
        OutputNode copy = new OutputNode(expression, escape, newContext, pipes, getLine(), getColumn());
        copy.inheritTemplatePathFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        return "OutputNode{expression='" + expression + "', escape=" + escape + ", context=" + context + '}';
    }
}
