package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 尚未解析的自定义元素引用（{@code <s-name>}），name 不含元素前缀
 */
public final class ComponentNode extends Node implements AttributedNode {

    private final String name;
    private List<AttributeNode> attributes;
    private List<Node> children;

    public ComponentNode(String name, List<AttributeNode> attributes, List<Node> children, int line, int column) {
        super(line, column);
        this.name = name;
        this.attributes = new ArrayList<>(attributes);
        this.children = new ArrayList<>(children);
    }

    public String getName() {
        return name;
    }

    @Override
    public List<AttributeNode> getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(List<AttributeNode> attributes) {
        this.attributes = new ArrayList<>(attributes);
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public void setChildren(List<Node> children) {
        this.children = new ArrayList<>(children);
    }
}
