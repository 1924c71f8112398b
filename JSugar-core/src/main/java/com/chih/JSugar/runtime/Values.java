package com.chih.JSugar.runtime;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 生成代码使用的值判断工具
 */
public final class Values {

    private Values() {
    }

    /**
     * null、空字符串、空集合、空 Map、空数组、空 Optional 以及 false 都视为空
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (value instanceof Boolean bool) {
            return !bool;
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    public static boolean isSet(Object value) {
        return value != null;
    }

    /**
     * 条件求值：Boolean 按值，其它按非空判断
     */
    public static boolean truthy(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return !isEmpty(value);
    }
}
