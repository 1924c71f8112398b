package com.chih.JSugar.core.ast;

import java.util.List;

/**
 * 复制复合节点，替换属性或子节点，保留源码位置、模板路径和标签信息
 */
public final class NodeCloner {

    private NodeCloner() {
    }

    public static ElementNode withAttributesAndChildren(ElementNode node, List<AttributeNode> attributes,
                                                        List<Node> children) {
        ElementNode copy = new ElementNode(node.getTag(), attributes, children, node.isSelfClosing(),
                node.getLine(), node.getColumn());
        copy.setDynamicTag(node.getDynamicTag());
        copy.inheritTemplatePathFrom(node);
        return copy;
    }

    public static ElementNode withChildren(ElementNode node, List<Node> children) {
        return withAttributesAndChildren(node, node.getAttributes(), children);
    }

    public static FragmentNode withAttributesAndChildren(FragmentNode node, List<AttributeNode> attributes,
                                                         List<Node> children) {
        FragmentNode copy = new FragmentNode(attributes, children, node.getLine(), node.getColumn());
        copy.inheritTemplatePathFrom(node);
        return copy;
    }

    public static ComponentNode withAttributesAndChildren(ComponentNode node, List<AttributeNode> attributes,
                                                          List<Node> children) {
        ComponentNode copy = new ComponentNode(node.getName(), attributes, children, node.getLine(), node.getColumn());
        copy.inheritTemplatePathFrom(node);
        return copy;
    }
}
