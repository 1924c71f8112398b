package com.chih.JSugar.core.pass.context;

import com.chih.JSugar.core.ast.OutputContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 不可变的已打开标签栈（小写标签名），push/pop 返回新实例
 */
public final class AnalysisContext {

    private static final AnalysisContext EMPTY = new AnalysisContext(List.of());

    private final List<String> elementStack;

    private AnalysisContext(List<String> elementStack) {
        this.elementStack = elementStack;
    }

    public static AnalysisContext empty() {
        return EMPTY;
    }

    public AnalysisContext push(String tag) {
        List<String> stack = new ArrayList<>(elementStack);
        stack.add(tag.toLowerCase(Locale.ROOT));
        return new AnalysisContext(Collections.unmodifiableList(stack));
    }

    /**
     * 移除最后一个同名标签
     */
    public AnalysisContext pop(String tag) {
        String name = tag.toLowerCase(Locale.ROOT);
        List<String> stack = new ArrayList<>(elementStack);
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i).equals(name)) {
                stack.remove(i);
                break;
            }
        }
        return new AnalysisContext(Collections.unmodifiableList(stack));
    }

    /**
     * 最近的 script 祖先 -> JAVASCRIPT，最近的 style 祖先 -> CSS，否则 HTML
     */
    public OutputContext determineContext() {
        for (int i = elementStack.size() - 1; i >= 0; i--) {
            String tag = elementStack.get(i);
            if ("script".equals(tag)) {
                return OutputContext.JAVASCRIPT;
            }
            if ("style".equals(tag)) {
                return OutputContext.CSS;
            }
        }
        return OutputContext.HTML;
    }

    public List<String> getElementStack() {
        return elementStack;
    }
}
