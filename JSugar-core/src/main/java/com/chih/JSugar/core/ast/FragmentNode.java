package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 透明分组（不输出任何标签），对应 {@code <s-template>}
 */
public final class FragmentNode extends Node implements AttributedNode {

    private List<AttributeNode> attributes;
    private List<Node> children;

    public FragmentNode(List<AttributeNode> attributes, List<Node> children, int line, int column) {
        super(line, column);
        this.attributes = new ArrayList<>(attributes);
        this.children = new ArrayList<>(children);
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
