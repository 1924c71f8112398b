package com.chih.JSugar.core.support;

import com.chih.JSugar.core.ast.AttributeNode;
import com.chih.JSugar.core.ast.AttributeValue;
import com.chih.JSugar.core.ast.OutputNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 属性列表与属性值表达式的辅助方法
 */
public final class AttributeHelper {

    /**
     * 属性指令编译结果中的命名属性形式：{@code name="expression"}
     */
    private static final Pattern NAMED_ATTRIBUTE = Pattern.compile("^([a-zA-Z][a-zA-Z0-9:_.-]*)=\"(.+)\"$",
            Pattern.DOTALL);

    private AttributeHelper() {
    }

    public record NamedAttribute(String name, String expression) {
    }

    /**
     * 解析 {@code name="expression"}，不匹配时为空（表示展开形式）
     */
    public static Optional<NamedAttribute> parseNamedAttribute(String code) {
        if (code == null) {
            return Optional.empty();
        }
        Matcher matcher = NAMED_ATTRIBUTE.matcher(code.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new NamedAttribute(matcher.group(1), matcher.group(2).trim()));
    }

    /**
     * @return 同名属性的下标，找不到时为 -1
     */
    public static int findAttributeIndex(List<AttributeNode> attributes, String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (name.equals(attributes.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 收集显式命名的属性名（去重、保序），展开形式的属性不计入
     */
    public static List<String> collectNamedAttributeNames(List<AttributeNode> attributes) {
        Set<String> names = new LinkedHashSet<>();
        for (AttributeNode attribute : attributes) {
            if (!attribute.isSpread()) {
                names.add(attribute.getName());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * 把属性值转换为宿主语言（Java）表达式
     */
    public static String toExpression(AttributeValue value) {
        if (value.isBoolean()) {
            return "\"\"";
        }
        if (value.isStatic()) {
            return javaLiteral(value.getStaticValue());
        }
        if (value.isOutput()) {
            return value.getOutput().getExpression();
        }

        List<String> terms = new ArrayList<>();
        for (Object part : value.getParts()) {
            if (part instanceof OutputNode output) {
                terms.add("String.valueOf(" + output.getExpression() + ")");
            } else {
                terms.add(javaLiteral((String) part));
            }
        }
        if (terms.isEmpty()) {
            return "\"\"";
        }
        return String.join(" + ", terms);
    }

    public static String javaLiteral(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    out.append("\\\"");
                    break;
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.append('"').toString();
    }
}
