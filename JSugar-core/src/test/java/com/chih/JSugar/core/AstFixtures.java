package com.chih.JSugar.core;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.ComponentNode;
import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.FragmentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.ast.TextNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用的节点树构造工具，位置默认为 1:1
 */
public final class AstFixtures {

    private AstFixtures() {
    }

    public static DocumentNode doc(Node... children) {
        return new DocumentNode(list(children));
    }

    public static ElementNode element(String tag, List<AttributeNode> attributes, Node... children) {
        return new ElementNode(tag, new ArrayList<>(attributes), list(children), false, 1, 1);
    }

    public static ElementNode element(String tag, Node... children) {
        return element(tag, List.of(), children);
    }

    public static ComponentNode component(String name, List<AttributeNode> attributes, Node... children) {
        return new ComponentNode(name, new ArrayList<>(attributes), list(children), 1, 1);
    }

    public static FragmentNode fragment(List<AttributeNode> attributes, Node... children) {
        return new FragmentNode(new ArrayList<>(attributes), list(children), 1, 1);
    }

    public static DirectiveNode directive(String name, String expression, Node... children) {
        return new DirectiveNode(name, expression, list(children), 1, 1);
    }

    public static TextNode text(String content) {
        return new TextNode(content, 1, 1);
    }

    public static OutputNode output(String expression) {
        return new OutputNode(expression, true, OutputContext.HTML, 1, 1);
    }

    public static AttributeNode attr(String name, String value) {
        return new AttributeNode(name, AttributeValue.staticValue(value), 1, 1);
    }

    public static AttributeNode attr(String name, String value, int line, int column) {
        return new AttributeNode(name, AttributeValue.staticValue(value), line, column);
    }

    public static AttributeNode flag(String name) {
        return new AttributeNode(name, AttributeValue.booleanValue(), 1, 1);
    }

    public static AttributeNode dynamic(String name, String expression) {
        return new AttributeNode(name, AttributeValue.output(output(expression)), 1, 1);
    }

    public static List<AttributeNode> attrs(AttributeNode... attributes) {
        return Arrays.asList(attributes);
    }

    private static List<Node> list(Node... nodes) {
        return new ArrayList<>(Arrays.asList(nodes));
    }
}
