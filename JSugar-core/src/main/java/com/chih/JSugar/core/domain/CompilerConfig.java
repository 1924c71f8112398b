package com.chih.JSugar.core.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * 编译器配置
 * <p>
 * 对应 {@code jsugar-default.yaml} 或用户提供的 YAML/JSON 配置文件，
 * 决定指令属性前缀、自定义元素前缀、片段元素名、调试模式以及 "Did you mean" 建议距离。
 * 开启 debug 后，语法错误会附带模板源码片段。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public class CompilerConfig implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 指令属性前缀，{@code s} 对应 {@code s:if}
     */
    private String directivePrefix = "s";

    /**
     * 自定义元素前缀，为 null 时取 directivePrefix + "-"
     */
    private String elementPrefix;

    /**
     * 片段元素名，为 null 时取 elementPrefix + "template"
     */
    private String fragmentElement;

    private boolean debug;

    /**
     * "Did you mean" 建议的最大编辑距离
     */
    private int suggestionDistance = 2;

    /**
     * 无参构造函数 (Jackson 反序列化必须)
     */
    public CompilerConfig() {
    }

    /**
     * 以指定前缀创建默认配置
     */
    public static CompilerConfig withPrefix(String prefix) {
        CompilerConfig config = new CompilerConfig();
        config.setDirectivePrefix(prefix);
        return config;
    }

    /**
     * 验证当前配置是否合法
     */
    public void validate() {
        if (directivePrefix == null || directivePrefix.trim().isEmpty()) {
            throw new IllegalArgumentException("Directive prefix cannot be empty");
        }
        if (!directivePrefix.matches("[A-Za-z][A-Za-z0-9_-]*")) {
            throw new IllegalArgumentException("Invalid directive prefix: " + directivePrefix);
        }
        if (elementPrefix != null && elementPrefix.trim().isEmpty()) {
            throw new IllegalArgumentException("Element prefix cannot be blank");
        }
        if (fragmentElement != null && fragmentElement.trim().isEmpty()) {
            throw new IllegalArgumentException("Fragment element cannot be blank");
        }
        if (suggestionDistance < 0) {
            throw new IllegalArgumentException("Suggestion distance must not be negative: " + suggestionDistance);
        }
    }

    public String getDirectivePrefix() {
        return directivePrefix;
    }

    public void setDirectivePrefix(String directivePrefix) {
        this.directivePrefix = directivePrefix;
    }

    public String getElementPrefix() {
        return elementPrefix != null ? elementPrefix : directivePrefix + "-";
    }

    public void setElementPrefix(String elementPrefix) {
        this.elementPrefix = elementPrefix;
    }

    public String getFragmentElement() {
        return fragmentElement != null ? fragmentElement : getElementPrefix() + "template";
    }

    public void setFragmentElement(String fragmentElement) {
        this.fragmentElement = fragmentElement;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public int getSuggestionDistance() {
        return suggestionDistance;
    }

    public void setSuggestionDistance(int suggestionDistance) {
        this.suggestionDistance = suggestionDistance;
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "directivePrefix='" + directivePrefix + '\'' +
                ", elementPrefix='" + getElementPrefix() + '\'' +
                ", fragmentElement='" + getFragmentElement() + '\'' +
                ", debug=" + debug +
                '}';
    }

    @Override
    public final boolean equals(Object o) {
        if (!(o instanceof CompilerConfig that)) {
            return false;
        }
        return debug == that.debug && suggestionDistance == that.suggestionDistance
                && Objects.equals(directivePrefix, that.directivePrefix)
                && Objects.equals(getElementPrefix(), that.getElementPrefix())
                && Objects.equals(getFragmentElement(), that.getFragmentElement());
    }

    @Override
    public int hashCode() {
        return Objects.hash(directivePrefix, getElementPrefix(), getFragmentElement(), debug,
                suggestionDistance);
    }
}
