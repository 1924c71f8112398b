package com.chih.JSugar.core.pipeline;

/**
 * 常用的 Pass 优先级区间（从小到大执行），后面的区间可以依赖前面区间已建立的不变量
 */
public final class PassPriority {

    public static final int PRE_EXTRACTION = 10;
    public static final int ELEMENT_ROUTING = 15;
    public static final int DIRECTIVE_EXTRACTION = 20;
    public static final int DIRECTIVE_PAIRING = 25;
    public static final int DIRECTIVE_COMPILATION = 30;
    public static final int INHERITANCE_RESOLUTION = 35;
    public static final int HOST_CODE_NORMALIZATION = 40;
    public static final int CONTEXT_ANALYSIS = 50;

    private PassPriority() {
    }
}
