package com.chih.JSugar.core.directive;

/**
 * 指令类别
 */
public enum DirectiveType {
    /**
     * 包裹元素的控制结构（条件、循环等），每个元素最多一个
     */
    CONTROL_FLOW,
    /**
     * 编译为内联属性输出
     */
    ATTRIBUTE,
    /**
     * 替换元素内容，每个元素最多一个
     */
    CONTENT,
    /**
     * 由其他阶段处理，指令阶段原样保留
     */
    PASS_THROUGH
}
