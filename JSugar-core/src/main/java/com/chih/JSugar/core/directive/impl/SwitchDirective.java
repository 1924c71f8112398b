package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.FragmentNode;
import com.chih.JSugar.core.ast.HostCodeNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.NodeCloner;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.ArrayList;
import java.util.List;

/**
 * switch / case / default
 * <p>
 * case 与 default 在 switch 之前编译（子节点先于父节点完成），各自生成一个透明片段：
 * {@code case X: { ... break; }}。switch 编译时只接受这些分支片段和空白文本，
 * 当 switch 包裹单个元素时，switch 语句放在该元素内部，元素只输出一次。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/15
 */
public class SwitchDirective extends AbstractDirectiveCompiler {

    private static final String CASE_PREFIX = "case ";
    private static final String DEFAULT_LABEL = "default: {";

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        switch (node.getName()) {
            case "case":
                return List.of(compileCase(node, context));
            case "default":
                return List.of(compileDefault(node, context));
            default:
                return compileSwitch(node, context);
        }
    }

    private List<Node> compileSwitch(DirectiveNode node, CompilationContext context) {
        String subject = requireExpression(node, context);

        ElementNode wrapper = null;
        List<Node> body = node.getChildren();
        List<Node> significant = withoutBlankText(body);
        if (significant.size() == 1 && significant.get(0) instanceof ElementNode element) {
            wrapper = element;
            body = element.getChildren();
        }

        List<Node> branches = withoutBlankText(body);
        int defaults = 0;
        for (Node branch : branches) {
            if (!isBranch(branch)) {
                throw context.syntaxErrorForNode(
                        "Switch directive can only contain case and default branches", branch);
            }
            if (isDefaultBranch(branch) && ++defaults > 1) {
                throw context.syntaxErrorForNode("Switch directive can only have one default case", branch);
            }
        }
        if (branches.isEmpty()) {
            throw context.syntaxErrorForNode("Switch directive must contain at least one case or default", node);
        }

        List<Node> statement = new ArrayList<>(branches.size() + 2);
        statement.add(code("switch (" + subject + ") {", node));
        statement.addAll(branches);
        statement.add(code("}", node));

        if (wrapper != null) {
            return List.of(NodeCloner.withChildren(wrapper, statement));
        }
        return statement;
    }

    private Node compileCase(DirectiveNode node, CompilationContext context) {
        requireEnclosingSwitch(node, context);
        String value = node.getExpression() == null ? "" : node.getExpression().trim();
        if (value.isEmpty()) {
            throw context.syntaxErrorForNode("Case directive requires a value expression", node);
        }

        List<Node> parts = new ArrayList<>();
        parts.add(code(CASE_PREFIX + value + ": {", node));
        parts.addAll(node.getChildren());
        parts.add(code("break;", node));
        parts.add(code("}", node));
        return fragment(node, parts);
    }

    private Node compileDefault(DirectiveNode node, CompilationContext context) {
        requireEnclosingSwitch(node, context);
        List<Node> parts = new ArrayList<>();
        parts.add(code(DEFAULT_LABEL, node));
        parts.addAll(node.getChildren());
        parts.add(code("}", node));
        return fragment(node, parts);
    }

    /**
     * case/default 必须是 switch 的子节点，或 switch 所包裹元素的子节点
     */
    private void requireEnclosingSwitch(DirectiveNode node, CompilationContext context) {
        Node parent = node.getParent();
        if (parent instanceof ElementNode) {
            parent = parent.getParent();
        }
        if (!(parent instanceof DirectiveNode directive) || !"switch".equals(directive.getName())) {
            throw context.syntaxErrorForNode("The \"" + node.getName()
                    + "\" directive must be placed directly inside a switch directive", node);
        }
    }

    private FragmentNode fragment(DirectiveNode origin, List<Node> children) {
        FragmentNode fragment = new FragmentNode(List.of(), children, origin.getLine(), origin.getColumn());
        fragment.inheritTemplatePathFrom(origin);
        return fragment;
    }

    private static boolean isBranch(Node node) {
        return node instanceof FragmentNode fragment
                && fragment.getAttributes().isEmpty()
                && !fragment.getChildren().isEmpty()
                && fragment.getChildren().get(0) instanceof HostCodeNode label
                && (label.getCode().startsWith(CASE_PREFIX) || label.getCode().equals(DEFAULT_LABEL));
    }

    private static boolean isDefaultBranch(Node node) {
        return ((HostCodeNode) ((FragmentNode) node).getChildren().get(0)).getCode().equals(DEFAULT_LABEL);
    }

    private static List<Node> withoutBlankText(List<Node> nodes) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (!isBlankText(node)) {
                result.add(node);
            }
        }
        return result;
    }
}
