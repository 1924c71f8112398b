package com.chih.JSugar.core.directive.impl;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;
import com.chih.JSugar.core.directive.DirectiveType;

import java.util.List;

/**
 * 内容修饰：{@code <span s:text="title" s:nowrap>} 只输出内容，不输出 span 本身
 * <p>
 * 必须与 s:text / s:html 同时使用，元素上不能再有其他属性。提取阶段直接处理，不会生成独立的指令节点。
 * </p>
 */
public class NoWrapDirective extends AbstractDirectiveCompiler {

    @Override
    public DirectiveType getType() {
        return DirectiveType.ATTRIBUTE;
    }

    @Override
    public boolean removesContentWrapper() {
        return true;
    }

    @Override
    public List<Node> compile(DirectiveNode node, CompilationContext context) {
        return node.getChildren();
    }
}
