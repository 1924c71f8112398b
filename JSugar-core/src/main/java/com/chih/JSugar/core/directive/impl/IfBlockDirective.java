package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;
import com.chih.JSugar.core.directive.ElementClaim;
import com.chih.JSugar.core.support.AttributeHelper;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 子模板定义了指定 block 时渲染，可以写成 {@code <s-ifblock name="sidebar">}
 * <p>
 * 裸名称（如 {@code sidebar}）按字符串字面量处理，其他内容按表达式原样使用。
 * 生成代码调用宿主模板基类提供的 {@code hasBlock(String)}。
 * </p>
 */
public class IfBlockDirective extends AbstractDirectiveCompiler {

    private static final Pattern BARE_NAME = Pattern.compile("[a-zA-Z0-9_.:-]+");

    @Override
    public DirectiveType getType() {
        return DirectiveType.CONTROL_FLOW;
    }

    @Override
    public Optional<ElementClaim> getElementClaim() {
        return Optional.of(ElementClaim.withExpressionAttribute("name"));
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return wrap(node, "if (hasBlock(" + normalize(requireExpression(node, context)) + ")) {", "}");
    }

    private String normalize(String expression) {
        if (BARE_NAME.matcher(expression).matches() && !Character.isDigit(expression.charAt(0))) {
            return AttributeHelper.javaLiteral(expression);
        }
        return expression;
    }
}
