package com.chih.JSugar.core.pass.directive;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.ComponentNode;
import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.FragmentNode;
import com.chih.JSugar.core.ast.HostCodeNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.NodeCloner;
import com.chih.JSugar.core.ast.OutputContext;
import com.chih.JSugar.core.ast.OutputNode;
import com.chih.JSugar.core.ast.ParentNode;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.AttributeMergePolicy;
import com.chih.JSugar.core.directive.DirectiveClassifier;
import com.chih.JSugar.core.directive.DirectiveCompiler;
import com.chih.JSugar.core.directive.DirectiveRegistry;
import com.chih.JSugar.core.directive.ElementExtraction;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.NodeAction;
import com.chih.JSugar.core.pipeline.PipelineContext;
import com.chih.JSugar.core.support.AttributeHelper;
import com.chih.JSugar.core.support.DirectivePrefixHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 指令提取：把带有指令属性的元素、组件、片段改写为 {@link DirectiveNode} 结构
 * <ul>
 *     <li>元素：{@code Directive(控制流)[Element(剩余属性)[Directive(内容)[子节点]]]}</li>
 *     <li>带自定义元素提取的指令（s:tag、s:ifcontent）自行改写元素，属性类的先执行，控制流最后包裹</li>
 *     <li>带 s:nowrap 时内容指令直接输出，不保留元素</li>
 *     <li>组件：控制流指令包裹组件，不允许内容指令</li>
 *     <li>片段：只允许控制流与内容指令（以及继承类属性），指令直接包裹子节点</li>
 * </ul>
 * 属性类指令在这里直接编译为属性输出。透传指令与继承类属性留在节点上，由后续阶段处理。
 * <p>
 * 进入节点时会先改写它的直接子节点，保证配对阶段能看到兄弟指令节点。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/16
 */
public class DirectiveExtractionPass implements AstPass {

    private final DirectiveRegistry registry;
    private final DirectiveClassifier classifier;
    private final DirectivePrefixHelper prefixHelper;
    private final String fragmentElement;

    public DirectiveExtractionPass(DirectiveRegistry registry, DirectiveClassifier classifier) {
        this(registry, classifier, classifier.getPrefixHelper().getElementPrefix() + "template");
    }

    /**
     * @param fragmentElement 片段元素名，只用于错误信息
     */
    public DirectiveExtractionPass(DirectiveRegistry registry, DirectiveClassifier classifier,
                                   String fragmentElement) {
        this.registry = registry;
        this.classifier = classifier;
        this.prefixHelper = classifier.getPrefixHelper();
        this.fragmentElement = fragmentElement;
    }

    @Override
    public NodeAction before(Node node, PipelineContext context) {
        CompilationContext compilation = context.compilation();
        preTransformChildren(node, compilation);

        Node transformed = transform(node, compilation);
        return transformed == null ? NodeAction.none() : NodeAction.replace(transformed);
    }

    private void preTransformChildren(Node node, CompilationContext compilation) {
        if (!(node instanceof ParentNode parent)) {
            return;
        }

        List<Node> children = parent.getChildren();
        boolean changed = false;
        List<Node> result = new ArrayList<>(children.size());
        for (Node child : children) {
            Node transformed = transform(child, compilation);
            if (transformed != null) {
                result.add(transformed);
                changed = true;
            } else {
                result.add(child);
            }
        }
        if (changed) {
            parent.setChildren(result);
        }
    }

    /**
     * @return 改写后的节点，不需要改写时为 null
     */
    private Node transform(Node node, CompilationContext compilation) {
        if (node instanceof ElementNode element && hasDirectiveAttribute(element.getAttributes(), true)) {
            return elementToDirective(element, compilation);
        }
        if (node instanceof ComponentNode component && hasDirectiveAttribute(component.getAttributes(), true)) {
            return componentToDirective(component, compilation);
        }
        if (node instanceof FragmentNode fragment && hasDirectiveAttribute(fragment.getAttributes(), false)) {
            return fragmentToDirective(fragment, compilation);
        }
        return null;
    }

    private boolean hasDirectiveAttribute(List<AttributeNode> attributes, boolean allowInheritanceAttributes) {
        for (AttributeNode attribute : attributes) {
            if (classifier.isNonPassThroughDirectiveAttribute(attribute.getName(), allowInheritanceAttributes)) {
                return true;
            }
        }
        return false;
    }

    private Extracted extract(List<AttributeNode> attributes, CompilationContext compilation) {
        Extracted extracted = new Extracted();
        List<AttributeNode> plain = new ArrayList<>();
        for (AttributeNode attribute : attributes) {
            if (!prefixHelper.isDirective(attribute.getName())) {
                plain.add(attribute);
            }
        }
        List<String> explicitNames = AttributeHelper.collectNamedAttributeNames(plain);

        for (AttributeNode attribute : attributes) {
            if (!prefixHelper.isDirective(attribute.getName()) || prefixHelper.isInheritanceAttribute(attribute.getName())) {
                extracted.remaining.add(attribute);
                continue;
            }

            String name = prefixHelper.stripPrefix(attribute.getName());
            classifier.validateDirectiveAttribute(attribute, compilation, true);
            String expression = directiveExpression(attribute, compilation);

            DirectiveCompiler compiler = registry.get(name);
            if (compiler.removesContentWrapper()) {
                extracted.noWrap = new Found(name, expression, attribute, compiler);
                continue;
            }

            switch (compiler.getType()) {
                case PASS_THROUGH:
                    extracted.remaining.add(attribute);
                    break;
                case CONTROL_FLOW:
                    if (extracted.controlFlow != null) {
                        throw compilation.syntaxErrorForAttribute(String.format(
                                "Only one control flow directive allowed per element. Nest elements to combine "
                                        + "directives. Example: <div %1$s:if=\"condition\"><div %1$s:foreach=\"item : items\">"
                                        + "...</div></div>", prefixHelper.getPrefix()), attribute);
                    }
                    extracted.controlFlow = new Found(name, expression, attribute, compiler);
                    break;
                case CONTENT:
                    if (extracted.content != null) {
                        throw compilation.syntaxErrorForAttribute(String.format(
                                "Only one content directive allowed per element. Use either %1$s:text or %1$s:html, "
                                        + "not both.", prefixHelper.getPrefix()), attribute);
                    }
                    extracted.content = new Found(name, expression, attribute, compiler);
                    break;
                case ATTRIBUTE:
                    if (compiler.getElementExtraction().isPresent()) {
                        extracted.elementRewrites.add(new Found(name, expression, attribute, compiler));
                    } else {
                        compileAttributeDirective(compiler, name, expression, attribute, extracted.remaining,
                                explicitNames, compilation);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled directive type: " + compiler.getType());
            }
        }

        if (extracted.noWrap != null && extracted.content == null) {
            throw compilation.syntaxErrorForAttribute(String.format(
                    "The %1$s:%2$s directive requires a content directive like %1$s:text or %1$s:html on the same "
                            + "element.", prefixHelper.getPrefix(), extracted.noWrap.name()), extracted.noWrap.attribute());
        }

        return extracted;
    }

    private String directiveExpression(AttributeNode attribute, CompilationContext compilation) {
        AttributeValue value = attribute.getValue();
        if (value.isBoolean()) {
            return "true";
        }
        if (value.isStatic()) {
            return value.getStaticValue();
        }
        throw compilation.syntaxErrorForAttribute("Directive attributes cannot contain dynamic output expressions",
                attribute);
    }

    private Node elementToDirective(ElementNode node, CompilationContext compilation) {
        Extracted directives = extract(node.getAttributes(), compilation);
        if (directives.noWrap != null) {
            return contentWithoutWrapper(node, directives, compilation);
        }

        List<Node> children = node.getChildren();
        if (directives.content != null) {
            children = List.of(directive(directives.content, children, node));
        }

        Node current = NodeCloner.withAttributesAndChildren(node, directives.remaining, children);
        List<Node> prefix = new ArrayList<>();
        for (Found rewrite : directives.elementRewrites) {
            if (!(current instanceof ElementNode element)) {
                break;
            }
            ElementExtraction extraction = rewrite.compiler().getElementExtraction().orElseThrow();
            current = collectPrefix(extraction.extract(element, rewrite.expression(), compilation), prefix);
        }

        if (directives.controlFlow == null) {
            return withPrefix(prefix, current, node);
        }

        Optional<ElementExtraction> extraction = directives.controlFlow.compiler().getElementExtraction();
        if (extraction.isPresent() && current instanceof ElementNode element) {
            return withPrefix(prefix, extraction.get().extract(element, directives.controlFlow.expression(),
                    compilation), node);
        }

        List<Node> wrapped = new ArrayList<>(prefix);
        wrapped.add(current);
        return directive(directives.controlFlow, wrapped, node);
    }

    private Node contentWithoutWrapper(ElementNode node, Extracted directives, CompilationContext compilation) {
        if (!directives.remaining.isEmpty() || !directives.elementRewrites.isEmpty()) {
            throw compilation.syntaxErrorForNode(
                    "Content directives without a wrapper cannot include other attributes.", node);
        }

        DirectiveNode content = directive(directives.content, List.of(), node);
        if (directives.controlFlow != null) {
            return directive(directives.controlFlow, List.of(content), node);
        }
        return content;
    }

    /**
     * 无属性片段中的非元素子节点收集为前置节点
     *
     * @return 片段中的元素；片段里没有元素或结果不是片段时返回结果本身
     */
    private Node collectPrefix(Node result, List<Node> prefix) {
        if (!(result instanceof FragmentNode fragment) || !fragment.getAttributes().isEmpty()) {
            return result;
        }

        ElementNode element = null;
        List<Node> others = new ArrayList<>();
        for (Node child : fragment.getChildren()) {
            if (child instanceof ElementNode candidate) {
                element = candidate;
            } else {
                others.add(child);
            }
        }
        if (element == null) {
            return result;
        }
        prefix.addAll(others);
        return element;
    }

    private Node withPrefix(List<Node> prefix, Node node, Node origin) {
        if (prefix.isEmpty()) {
            return node;
        }

        List<Node> children = new ArrayList<>(prefix);
        children.add(node);
        FragmentNode fragment = new FragmentNode(List.of(), children, origin.getLine(), origin.getColumn());
        fragment.inheritTemplatePathFrom(origin);
        return fragment;
    }

    private Node componentToDirective(ComponentNode node, CompilationContext compilation) {
        Extracted directives = extract(node.getAttributes(), compilation);
        if (directives.content != null) {
            throw compilation.syntaxErrorForAttribute(String.format(
                    "Components cannot have content directives like %s:%s.", prefixHelper.getPrefix(),
                    directives.content.name()), directives.content.attribute());
        }
        if (!directives.elementRewrites.isEmpty()) {
            Found rewrite = directives.elementRewrites.get(0);
            throw compilation.syntaxErrorForAttribute(String.format(
                    "Components cannot have element directives like %s:%s.", prefixHelper.getPrefix(),
                    rewrite.name()), rewrite.attribute());
        }

        ComponentNode component = NodeCloner.withAttributesAndChildren(node, directives.remaining, node.getChildren());
        if (directives.controlFlow != null) {
            return directive(directives.controlFlow, List.of(component), node);
        }
        return component;
    }

    private Node fragmentToDirective(FragmentNode node, CompilationContext compilation) {
        List<AttributeNode> inheritanceAttributes = new ArrayList<>();
        List<AttributeNode> passThrough = new ArrayList<>();
        Found controlFlow = null;
        Found content = null;

        for (AttributeNode attribute : node.getAttributes()) {
            if (prefixHelper.isInheritanceAttribute(attribute.getName())) {
                inheritanceAttributes.add(attribute);
                continue;
            }
            if (!prefixHelper.isDirective(attribute.getName())) {
                throw compilation.syntaxErrorForAttribute(String.format(
                        "<%s> cannot have regular HTML attributes. Found: %s. Only %s: directives and template "
                                + "inheritance attributes (%s:block, %s:include, etc.) are allowed.",
                        fragmentElement, attribute.getName(), prefixHelper.getPrefix(), prefixHelper.getPrefix(),
                        prefixHelper.getPrefix()), attribute);
            }

            String name = prefixHelper.stripPrefix(attribute.getName());
            classifier.validateDirectiveAttribute(attribute, compilation, false);
            String expression = directiveExpression(attribute, compilation);

            DirectiveCompiler compiler = registry.get(name);
            switch (compiler.getType()) {
                case PASS_THROUGH:
                    passThrough.add(attribute);
                    break;
                case CONTROL_FLOW:
                    if (controlFlow != null) {
                        throw compilation.syntaxErrorForAttribute(
                                "Only one control flow directive allowed per element.", attribute);
                    }
                    controlFlow = new Found(name, expression, attribute, compiler);
                    break;
                case CONTENT:
                    if (content != null) {
                        throw compilation.syntaxErrorForAttribute(
                                "Only one content directive allowed per element.", attribute);
                    }
                    content = new Found(name, expression, attribute, compiler);
                    break;
                case ATTRIBUTE:
                    throw compilation.syntaxErrorForAttribute(String.format(
                            "<%s> cannot have attribute directives like %s:%s. Only control flow and content "
                                    + "directives are allowed.", fragmentElement, prefixHelper.getPrefix(), name),
                            attribute);
                default:
                    throw new IllegalStateException("Unhandled directive type: " + compiler.getType());
            }
        }

        List<Node> children = node.getChildren();
        if (content != null) {
            children = List.of(directive(content, children, node));
        }

        Node result;
        if (controlFlow != null) {
            result = directive(controlFlow, children, node);
        } else if (content != null) {
            result = children.get(0);
        } else {
            return null;
        }

        List<AttributeNode> kept = new ArrayList<>(inheritanceAttributes);
        kept.addAll(passThrough);
        if (kept.isEmpty()) {
            return result;
        }

        FragmentNode wrapper = new FragmentNode(kept, List.of(result), node.getLine(), node.getColumn());
        wrapper.inheritTemplatePathFrom(node);
        return wrapper;
    }

    /**
     * 编译属性指令并写入剩余属性列表：命名形式按合并策略合并到已有属性，其余形式作为展开属性追加。
     * 展开属性排除元素上显式声明的属性名
     */
    private void compileAttributeDirective(DirectiveCompiler compiler, String name, String expression,
                                           AttributeNode attribute, List<AttributeNode> remaining,
                                           List<String> explicitNames, CompilationContext compilation) {
        DirectiveNode directive = new DirectiveNode(name, expression, List.of(), attribute.getLine(), attribute.getColumn());
        directive.setTemplatePath(attribute.getTemplatePath());

        Optional<AttributeMergePolicy> policy = compiler.getAttributeMergePolicy();

        for (Node compiled : compiler.compile(directive, compilation)) {
            if (!(compiled instanceof HostCodeNode code)) {
                continue;
            }

            Optional<AttributeHelper.NamedAttribute> named = AttributeHelper.parseNamedAttribute(code.getCode());
            if (named.isPresent()) {
                String attributeName = named.get().name();
                AttributeNode incoming = attributeOutput(attributeName, named.get().expression(), attribute);

                int existingIndex = AttributeHelper.findAttributeIndex(remaining, attributeName);
                if (existingIndex >= 0 && policy.isPresent() && policy.get().mergesInto(attributeName)) {
                    AttributeNode existing = remaining.get(existingIndex);
                    String merged = policy.get().merge(AttributeHelper.toExpression(existing.getValue()),
                            named.get().expression());
                    AttributeNode replacement = attributeOutput(attributeName, merged, attribute);
                    remaining.set(existingIndex, relocate(replacement, existing));
                    continue;
                }

                remaining.add(incoming);
                continue;
            }

            String spread = code.getCode().trim();
            if (policy.isPresent() && policy.get().getMode() == AttributeMergePolicy.Mode.EXCLUDE_NAMED) {
                spread = policy.get().exclude(expression.trim(), explicitNames);
            }
            remaining.add(attributeOutput("", spread, attribute));
        }
    }

    private AttributeNode attributeOutput(String name, String expression, AttributeNode origin) {
        // escaping is already handled by the runtime helper
        OutputNode output = new OutputNode(expression, false, OutputContext.HTML_ATTRIBUTE,
                origin.getLine(), origin.getColumn());
        output.inheritTemplatePathFrom(origin);

        AttributeNode attribute = new AttributeNode(name, AttributeValue.output(output), origin.getLine(),
                origin.getColumn());
        attribute.setTemplatePath(origin.getTemplatePath());
        return attribute;
    }

    private AttributeNode relocate(AttributeNode attribute, AttributeNode position) {
        AttributeNode moved = new AttributeNode(attribute.getName(), attribute.getValue(), position.getLine(),
                position.getColumn());
        moved.setTemplatePath(position.getTemplatePath());
        return moved;
    }

    private DirectiveNode directive(Found found, List<Node> children, Node origin) {
        DirectiveNode directive = new DirectiveNode(found.name(), found.expression(), children,
                origin.getLine(), origin.getColumn());
        directive.inheritTemplatePathFrom(origin);
        return directive;
    }

    private record Found(String name, String expression, AttributeNode attribute, DirectiveCompiler compiler) {
    }

    private static final class Extracted {
        private Found controlFlow;
        private Found content;
        private Found noWrap;
        private final List<Found> elementRewrites = new ArrayList<>();
        private final List<AttributeNode> remaining = new ArrayList<>();
    }
}
