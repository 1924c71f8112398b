package com.chih.JSugar.core.ast;

/**
 * 直接透传的宿主语言代码块
 */
public final class HostCodeNode extends Node {

    private final String code;

    public HostCodeNode(String code, int line, int column) {
        super(line, column);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "HostCodeNode{code='" + code + "'}";
    }
}
