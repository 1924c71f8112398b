package com.chih.JSugar.core.directive;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;

/**
 * 属性指令与元素上已有属性的合并策略
 * <ul>
 *     <li>MERGE_NAMED：编译结果与同名的已有属性合并为一个表达式（例如 class）</li>
 *     <li>EXCLUDE_NAMED：展开属性时排除元素上已经显式声明的属性名</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/01/14
 */
public final class AttributeMergePolicy {

    public enum Mode {
        MERGE_NAMED,
        EXCLUDE_NAMED
    }

    private final Mode mode;
    private final String targetAttribute;
    private final BinaryOperator<String> combiner;
    private final BiFunction<String, List<String>, String> excluder;

    private AttributeMergePolicy(Mode mode, String targetAttribute, BinaryOperator<String> combiner,
                                 BiFunction<String, List<String>, String> excluder) {
        this.mode = mode;
        this.targetAttribute = targetAttribute;
        this.combiner = combiner;
        this.excluder = excluder;
    }

    /**
     * @param targetAttribute 合并目标属性名
     * @param combiner        (已有属性表达式, 新表达式) -> 合并后的表达式
     */
    public static AttributeMergePolicy mergeNamed(String targetAttribute, BinaryOperator<String> combiner) {
        if (targetAttribute == null || targetAttribute.isEmpty()) {
            throw new IllegalArgumentException("merge target attribute must not be empty");
        }
        return new AttributeMergePolicy(Mode.MERGE_NAMED, targetAttribute, combiner, null);
    }

    /**
     * @param excluder (指令源表达式, 需要排除的属性名) -> 展开表达式
     */
    public static AttributeMergePolicy excludeNamed(BiFunction<String, List<String>, String> excluder) {
        return new AttributeMergePolicy(Mode.EXCLUDE_NAMED, null, null, excluder);
    }

    public Mode getMode() {
        return mode;
    }

    public String getTargetAttribute() {
        return targetAttribute;
    }

    public boolean mergesInto(String attributeName) {
        return mode == Mode.MERGE_NAMED && targetAttribute.equals(attributeName);
    }

    public String merge(String existingExpression, String incomingExpression) {
        if (mode != Mode.MERGE_NAMED) {
            throw new IllegalStateException("merge() requires a MERGE_NAMED policy");
        }
        return combiner.apply(existingExpression, incomingExpression);
    }

    public String exclude(String sourceExpression, List<String> excludedNames) {
        if (mode != Mode.EXCLUDE_NAMED) {
            throw new IllegalStateException("exclude() requires an EXCLUDE_NAMED policy");
        }
        return excluder.apply(sourceExpression, excludedNames);
    }
}
