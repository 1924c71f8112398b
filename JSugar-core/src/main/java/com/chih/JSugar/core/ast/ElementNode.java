package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 普通 HTML 标签
 */
public final class ElementNode extends Node implements AttributedNode {

    private final String tag;
    private final boolean selfClosing;
    private List<AttributeNode> attributes;
    private List<Node> children;

    /**
     * 动态标签表达式（s:tag），为 null 时输出字面标签名
     */
    private String dynamicTag;

    public ElementNode(String tag, List<AttributeNode> attributes, List<Node> children,
                       boolean selfClosing, int line, int column) {
        super(line, column);
        this.tag = tag;
        this.selfClosing = selfClosing;
        this.attributes = new ArrayList<>(attributes);
        this.children = new ArrayList<>(children);
    }

    public String getTag() {
        return tag;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    public String getDynamicTag() {
        return dynamicTag;
    }

    public void setDynamicTag(String dynamicTag) {
        this.dynamicTag = dynamicTag;
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

    @Override
    public String toString() {
        return "ElementNode{tag='" + tag + "', attributes=" + attributes.size()
                + ", children=" + children.size() + '}';
    }
}
