package com.chih.JSugar.core.directive;

/**
 * 元素认领能力：指令可以写成专用的自定义元素 {@code <s-name expr="...">}
 *
 * @param expressionAttribute 承载指令表达式的属性名，为 null 表示元素不接受表达式
 */
public record ElementClaim(String expressionAttribute) {

    public static ElementClaim withoutExpression() {
        return new ElementClaim(null);
    }

    public static ElementClaim withExpressionAttribute(String attribute) {
        return new ElementClaim(attribute);
    }
}
