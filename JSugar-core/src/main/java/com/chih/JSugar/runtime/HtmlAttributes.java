package com.chih.JSugar.runtime;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 生成代码使用的属性输出工具，返回值已经转义，可以直接写入标签内
 */
public final class HtmlAttributes {

    private HtmlAttributes() {
    }

    /**
     * 拼接 class 名称
     * <ul>
     *     <li>字符串按原样保留（去除首尾空白）</li>
     *     <li>集合与数组逐项展开</li>
     *     <li>Map 中值为真的键被保留，例如 {@code Map.of("active", true)}</li>
     * </ul>
     */
    public static String classNames(Object value) {
        Set<String> names = new LinkedHashSet<>();
        collectClassNames(value, names);
        return escape(String.join(" ", names));
    }

    /**
     * 把属性 Map 展开为 {@code name="value"} 序列；值为 false 或 null 的属性被省略，值为 true 时输出布尔属性
     */
    public static String spread(Map<String, ?> attributes, String... excluded) {
        if (attributes == null || attributes.isEmpty()) {
            return "";
        }

        Set<String> skip = new HashSet<>(Arrays.asList(excluded));
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            if (name == null || name.isEmpty() || skip.contains(name) || value == null || Boolean.FALSE.equals(value)) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            if (Boolean.TRUE.equals(value)) {
                out.append(escape(name));
            } else {
                out.append(escape(name)).append("=\"").append(escape(String.valueOf(value))).append('"');
            }
        }
        return out.toString();
    }

    /**
     * 条件成立时输出布尔属性名，否则输出空串
     */
    public static String booleanAttribute(String name, boolean condition) {
        return condition ? name : "";
    }

    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                case '\'':
                    out.append("&#39;");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }

    private static void collectClassNames(Object value, Set<String> names) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null && Values.truthy(entry.getValue())) {
                    addNames(String.valueOf(entry.getKey()), names);
                }
            }
            return;
        }
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                collectClassNames(item, names);
            }
            return;
        }
        if (value instanceof Object[] array) {
            for (Object item : array) {
                collectClassNames(item, names);
            }
            return;
        }
        addNames(String.valueOf(value), names);
    }

    private static void addNames(String raw, Set<String> names) {
        for (String name : raw.trim().split("\\s+")) {
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
    }
}
