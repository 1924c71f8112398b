package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.exception.UnknownDirectiveException;
import com.chih.JSugar.core.support.DidYouMean;
import com.chih.JSugar.core.support.DirectivePrefixHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 指令分类查询，供各个指令阶段共享
 *
 * @author lizhiyuan
 * @since 2026/01/14
 */
public class DirectiveClassifier {

    private final DirectiveRegistry registry;
    private final DirectivePrefixHelper prefixHelper;
    private final int suggestionDistance;

    public DirectiveClassifier(DirectiveRegistry registry, DirectivePrefixHelper prefixHelper) {
        this(registry, prefixHelper, DidYouMean.DEFAULT_MAX_DISTANCE);
    }

    public DirectiveClassifier(DirectiveRegistry registry, DirectivePrefixHelper prefixHelper, int suggestionDistance) {
        this.registry = registry;
        this.prefixHelper = prefixHelper;
        this.suggestionDistance = suggestionDistance;
    }

    public DirectivePrefixHelper getPrefixHelper() {
        return prefixHelper;
    }

    public boolean isPassThrough(String name) {
        return registry.has(name) && registry.get(name).getType() == DirectiveType.PASS_THROUGH;
    }

    /**
     * @return 指令声明的后继名称，未注册或不配对时为空列表
     */
    public List<String> pairingFollowers(String name) {
        if (!registry.has(name)) {
            return List.of();
        }
        return registry.get(name).getPairingDirectives();
    }

    public boolean isElementClaiming(String name) {
        return registry.has(name) && registry.get(name).getElementClaim().isPresent();
    }

    /**
     * @return 认领元素的表达式属性名，没有时为 null
     */
    public String elementExpressionAttribute(String name) {
        if (!registry.has(name)) {
            return null;
        }
        return registry.get(name).getElementClaim().map(ElementClaim::expressionAttribute).orElse(null);
    }

    public boolean isDirectiveAttribute(String attributeName) {
        return isDirectiveAttribute(attributeName, true);
    }

    /**
     * @param allowInheritanceAttributes 为 false 时继承类属性（s:block 等）不算指令属性
     */
    public boolean isDirectiveAttribute(String attributeName, boolean allowInheritanceAttributes) {
        if (!prefixHelper.isDirective(attributeName)) {
            return false;
        }
        return allowInheritanceAttributes || !prefixHelper.isInheritanceAttribute(attributeName);
    }

    /**
     * @return 去掉前缀的指令名，不是指令属性时为 null
     */
    public String directiveName(String attributeName, boolean allowInheritanceAttributes) {
        if (!isDirectiveAttribute(attributeName, allowInheritanceAttributes)) {
            return null;
        }
        return prefixHelper.stripPrefix(attributeName);
    }

    public Optional<DirectiveCompiler> compilerForAttribute(String attributeName, boolean allowInheritanceAttributes) {
        String name = directiveName(attributeName, allowInheritanceAttributes);
        if (name == null || !registry.has(name)) {
            return Optional.empty();
        }
        return Optional.of(registry.get(name));
    }

    /**
     * 未知指令也算作非透传，后续提取时会报错
     */
    public boolean isNonPassThroughDirectiveAttribute(String attributeName, boolean allowInheritanceAttributes) {
        if (!isDirectiveAttribute(attributeName, allowInheritanceAttributes)) {
            return false;
        }
        return compilerForAttribute(attributeName, allowInheritanceAttributes)
                .map(compiler -> compiler.getType() != DirectiveType.PASS_THROUGH)
                .orElse(true);
    }

    public boolean isControlFlowDirectiveAttribute(String attributeName) {
        return compilerForAttribute(attributeName, true)
                .map(compiler -> compiler.getType() == DirectiveType.CONTROL_FLOW)
                .orElse(false);
    }

    /**
     * 校验指令属性名已注册，否则抛出带建议的未知指令错误，列号指向指令名本身
     */
    public void validateDirectiveAttribute(AttributeNode attribute, CompilationContext context,
                                           boolean allowInheritanceAttributes) {
        String name = directiveName(attribute.getName(), allowInheritanceAttributes);
        if (name == null || registry.has(name)) {
            return;
        }

        String path = attribute.getTemplatePath() != null ? attribute.getTemplatePath() : context.getTemplatePath();
        int column = attribute.getColumn() + prefixHelper.getDirectiveSeparator().length();
        throw context.withSnippet(new UnknownDirectiveException(name, suggest(name))
                .withLocation(path, attribute.getLine(), column));
    }

    /**
     * 同时在继承类保留名和已注册指令中查找建议；输入与任一候选相同时不给建议，距离相同时保留名优先
     */
    public String suggest(String name) {
        List<String> candidates = new ArrayList<>(prefixHelper.inheritanceDirectiveNames());
        candidates.addAll(registry.names());
        return DidYouMean.suggest(name, candidates, suggestionDistance);
    }
}
