package com.chih.JSugar.core.ast;

/**
 * 字面文本
 */
public final class TextNode extends Node {

    private final String content;

    public TextNode(String content, int line, int column) {
        super(line, column);
        this.content = content;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "TextNode{content='" + content + "'}";
    }
}
