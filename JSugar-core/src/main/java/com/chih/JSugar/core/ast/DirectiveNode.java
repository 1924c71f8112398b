package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 提取后的结构化指令（{@code prefix:name="expr"}）
 * <p>
 * 配对阶段会把后继指令链接到 {@link #getPairedSibling()}（非拥有引用），
 * 并把后继标记为 {@link #isConsumedByPairing()}。被消费的指令不会被单独编译，
 * 它的内容只能通过领头指令的编译器访问。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public final class DirectiveNode extends Node implements ParentNode {

    private final String name;
    private final String expression;
    private List<Node> children;

    private DirectiveNode pairedSibling;
    private boolean consumedByPairing;

    /**
     * 指令所在元素的标签与属性（不含子节点），供需要重建外层元素的指令使用
     */
    private ElementNode element;

    public DirectiveNode(String name, String expression, List<Node> children, int line, int column) {
        super(line, column);
        this.name = name;
        this.expression = expression;
        this.children = new ArrayList<>(children);
    }

    public String getName() {
        return name;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public void setChildren(List<Node> children) {
        this.children = new ArrayList<>(children);
    }

    public DirectiveNode getPairedSibling() {
        return pairedSibling;
    }

    public void setPairedSibling(DirectiveNode pairedSibling) {
        this.pairedSibling = pairedSibling;
    }

    public boolean isConsumedByPairing() {
        return consumedByPairing;
    }

    public void markConsumedByPairing() {
        this.consumedByPairing = true;
    }

    public ElementNode getElement() {
        return element;
    }

    public void setElement(ElementNode element) {
        this.element = element;
    }

    @Override
    public String toString() {
        return "DirectiveNode{name='" + name + "', expression='" + expression + "'}";
    }
}
