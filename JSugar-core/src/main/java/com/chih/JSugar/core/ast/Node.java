package com.chih.JSugar.core.ast;

/**
 * AST 节点基类
 * <p>
 * 节点类型是封闭的集合（sealed），遍历时可以对所有变体做穷举判断。
 * 所有节点共享源码位置（行、列）、可选的模板路径（用于跨 include/继承文件的诊断），
 * 以及由遍历器在每次放置时设置的父节点引用。
 * </p>
 * <p>
 * 父节点引用只用于查找（兄弟节点搜索、诊断），不表示所有权。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public abstract sealed class Node
        permits DocumentNode, ElementNode, FragmentNode, ComponentNode, DirectiveNode,
                OutputNode, TextNode, RawBodyNode, HostCodeNode {

    private final int line;
    private final int column;
    private String templatePath;

    // lookup only, never ownership
    private Node parent;

    protected Node(int line, int column) {
        this.line = line;
        this.column = column;
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
     * 从来源节点继承模板路径（合成节点保留原始诊断位置）
     */
    public void inheritTemplatePathFrom(Node origin) {
        if (origin != null && origin.templatePath != null) {
            this.templatePath = origin.templatePath;
        }
    }

    public void inheritTemplatePathFrom(AttributeNode origin) {
        if (origin != null && origin.getTemplatePath() != null) {
            this.templatePath = origin.getTemplatePath();
        }
    }

    public Node getParent() {
        return parent;
    }

    public void setParent(Node parent) {
        this.parent = parent;
    }
}
