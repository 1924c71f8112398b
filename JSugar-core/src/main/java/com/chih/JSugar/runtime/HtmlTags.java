package com.chih.JSugar.runtime;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 动态标签名校验，生成代码在输出 s:tag 元素之前调用
 */
public final class HtmlTags {

    private static final Pattern TAG_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9]*");

    private static final Set<String> FORBIDDEN_TAGS = Set.of(
            "script", "style", "iframe", "object", "embed", "applet",
            "form", "input", "textarea", "button", "select"
    );

    private HtmlTags() {
    }

    /**
     * @return 去除首尾空白后的标签名
     * @throws IllegalArgumentException 标签名为空、包含非字母数字字符，或属于禁止动态输出的标签
     */
    public static String validateTagName(Object value) {
        String tagName = value == null ? "" : String.valueOf(value).trim();
        if (tagName.isEmpty()) {
            throw new IllegalArgumentException("Tag name cannot be empty");
        }
        if (!TAG_NAME.matcher(tagName).matches()) {
            throw new IllegalArgumentException("Invalid tag name: \"" + tagName
                    + "\". Tag names must start with a letter and contain only alphanumeric characters.");
        }
        if (FORBIDDEN_TAGS.contains(tagName.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Forbidden tag name: \"" + tagName
                    + "\". This tag cannot be used dynamically.");
        }
        return tagName;
    }
}
