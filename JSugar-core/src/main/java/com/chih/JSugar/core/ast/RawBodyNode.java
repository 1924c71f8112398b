package com.chih.JSugar.core.ast;

/**
 * 不解析的原样区域（跳过解析的作用域内）
 */
public final class RawBodyNode extends Node {

    private final String content;

    public RawBodyNode(String content, int line, int column) {
        super(line, column);
        this.content = content;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "RawBodyNode{content='" + content + "'}";
    }
}
