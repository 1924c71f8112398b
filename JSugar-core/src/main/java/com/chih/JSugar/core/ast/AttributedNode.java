package com.chih.JSugar.core.ast;

import java.util.List;

/**
 * 携带属性列表的节点（元素、片段、组件）
 */
public interface AttributedNode extends ParentNode {

    List<AttributeNode> getAttributes();

    void setAttributes(List<AttributeNode> attributes);
}
