package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.ast.ElementNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;

/**
 * 自定义元素提取：指令出现在元素上时，由指令自己决定如何改写该元素
 * <p>
 * 传入的元素已经去掉了指令属性，属性类指令已编译，内容指令已包进子节点。
 * 返回的 {@code FragmentNode}（无属性）中，{@link ElementNode} 之外的子节点视为前置节点，
 * 元素会继续交给后面的指令处理。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
@FunctionalInterface
public interface ElementExtraction {

    Node extract(ElementNode element, String expression, CompilationContext context);
}
