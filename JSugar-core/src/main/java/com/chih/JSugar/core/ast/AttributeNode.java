package com.chih.JSugar.core.ast;

/**
 * 元素、片段或组件上的属性。不是树节点，不参与遍历，但带有自己的源码位置。
 * <p>
 * 指令提取阶段可以合成空名称的属性，表示"展开"形式的运行时属性片段。
 * </p>
 */
public final class AttributeNode {

    private final String name;
    private AttributeValue value;
    private final int line;
    private final int column;
    private String templatePath;

    public AttributeNode(String name, AttributeValue value, int line, int column) {
        this.name = name;
        this.value = value;
        this.line = line;
        this.column = column;
    }

    public String getName() {
        return name;
    }

    public AttributeValue getValue() {
        return value;
    }

    public void setValue(AttributeValue value) {
        this.value = value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public void setTemplatePath(String templatePath) {
        this.templatePath = templatePath;
    }

    /**
     * 空名称表示运行时展开的属性片段
     */
    public boolean isSpread() {
        return name == null || name.isEmpty();
    }

    @Override
    public String toString() {
        return "AttributeNode{" + name + '=' + value + '}';
    }
}
