package com.chih.JSugar.core.support;

import java.util.List;

/**
 * 指令前缀处理：识别 {@code prefix:name} 属性、剥离前缀、识别自定义元素前缀和继承类属性
 */
public final class DirectivePrefixHelper {

    /**
     * 由继承/组合阶段处理的保留名称，指令阶段原样保留
     */
    public static final List<String> INHERITANCE_DIRECTIVE_NAMES =
            List.of("block", "append", "prepend", "extends", "include", "with");

    private final String prefix;
    private final String directiveSeparator;
    private final String elementPrefix;

    public DirectivePrefixHelper(String prefix) {
        this(prefix, prefix + "-");
    }

    public DirectivePrefixHelper(String prefix, String elementPrefix) {
        this.prefix = prefix;
        this.directiveSeparator = prefix + ":";
        this.elementPrefix = elementPrefix;
    }

    public boolean isDirective(String attributeName) {
        return attributeName != null && attributeName.startsWith(directiveSeparator);
    }

    public String stripPrefix(String attributeName) {
        if (isDirective(attributeName)) {
            return attributeName.substring(directiveSeparator.length());
        }
        return attributeName;
    }

    public String buildName(String name) {
        return directiveSeparator + name;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getDirectiveSeparator() {
        return directiveSeparator;
    }

    public String getElementPrefix() {
        return elementPrefix;
    }

    public boolean hasElementPrefix(String name) {
        return name != null && name.startsWith(elementPrefix);
    }

    public String stripElementPrefix(String name) {
        if (hasElementPrefix(name)) {
            return name.substring(elementPrefix.length());
        }
        return name;
    }

    /**
     * @param name 带前缀的属性名，如 {@code s:block}
     */
    public boolean isInheritanceAttribute(String name) {
        return isDirective(name) && INHERITANCE_DIRECTIVE_NAMES.contains(stripPrefix(name));
    }

    public List<String> inheritanceDirectiveNames() {
        return INHERITANCE_DIRECTIVE_NAMES;
    }
}
