package com.chih.JSugar.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 属性值，四种形态互斥：
 * <ul>
 *     <li>布尔属性（无值，如 {@code disabled}）</li>
 *     <li>静态文本</li>
 *     <li>单个输出表达式</li>
 *     <li>文本与输出表达式交错的片段序列</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public final class AttributeValue {

    private enum Kind { BOOLEAN, STATIC, OUTPUT, PARTS }

    private static final AttributeValue BOOLEAN_VALUE = new AttributeValue(Kind.BOOLEAN, null, null, List.of());

    private final Kind kind;
    private final String staticValue;
    private final OutputNode output;
    private final List<Object> parts;

    private AttributeValue(Kind kind, String staticValue, OutputNode output, List<Object> parts) {
        this.kind = kind;
        this.staticValue = staticValue;
        this.output = output;
        this.parts = parts;
    }

    public static AttributeValue booleanValue() {
        return BOOLEAN_VALUE;
    }

    public static AttributeValue staticValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("static attribute value must not be null");
        }
        return new AttributeValue(Kind.STATIC, value, null, List.of());
    }

    public static AttributeValue output(OutputNode output) {
        if (output == null) {
            throw new IllegalArgumentException("output attribute value must not be null");
        }
        return new AttributeValue(Kind.OUTPUT, null, output, List.of());
    }

    /**
     * @param parts 只允许 {@link String} 与 {@link OutputNode}
     */
    public static AttributeValue parts(List<?> parts) {
        List<Object> copy = new ArrayList<>(parts.size());
        for (Object part : parts) {
            if (!(part instanceof String) && !(part instanceof OutputNode)) {
                throw new IllegalArgumentException("attribute part must be text or output, got: "
                        + (part == null ? "null" : part.getClass().getSimpleName()));
            }
            copy.add(part);
        }
        return new AttributeValue(Kind.PARTS, null, null, Collections.unmodifiableList(copy));
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isStatic() {
        return kind == Kind.STATIC;
    }

    public boolean isOutput() {
        return kind == Kind.OUTPUT;
    }

    public boolean isParts() {
        return kind == Kind.PARTS;
    }

    public String getStaticValue() {
        return staticValue;
    }

    public OutputNode getOutput() {
        return output;
    }

    public List<Object> getParts() {
        return parts;
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOOLEAN:
                return "<boolean>";
            case STATIC:
                return '"' + staticValue + '"';
            case OUTPUT:
                return "{{ " + output.getExpression() + " }}";
            default:
                return "parts" + parts;
        }
    }
}
