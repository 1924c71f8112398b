package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 顶层编译单元，每次编译恰好一个，是遍历的根
 */
public final class DocumentNode extends Node implements ParentNode {

    private List<Node> children;

    public DocumentNode(List<Node> children) {
        super(1, 1);
        this.children = new ArrayList<>(children);
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
