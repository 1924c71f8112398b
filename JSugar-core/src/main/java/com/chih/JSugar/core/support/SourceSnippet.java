package com.chih.JSugar.core.support;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成错误位置附近的模板源码片段：
 * <pre>
 *  2 | &lt;ul&gt;
 *  3 |   &lt;li s:forech="item : items"&gt;
 *            ^
 *  4 | &lt;/ul&gt;
 * </pre>
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public final class SourceSnippet {

    public static final int DEFAULT_CONTEXT_LINES = 2;

    private SourceSnippet() {
    }

    public static String generate(String source, int line, int column) {
        return generate(source, line, column, DEFAULT_CONTEXT_LINES);
    }

    /**
     * @param line        出错行（从 1 开始）
     * @param column      出错列（从 1 开始），小于 1 时不输出指示符
     * @param contextLines 前后各显示的行数
     * @return 片段文本；源码为空、行号越界或出错行为空白时返回空串
     */
    public static String generate(String source, int line, int column, int contextLines) {
        if (source == null || source.isBlank() || line < 1) {
            return "";
        }

        String[] lines = source.split("\n", -1);
        if (line > lines.length || lines[line - 1].isBlank()) {
            return "";
        }

        int startLine = Math.max(1, line - contextLines);
        int endLine = Math.min(lines.length, line + contextLines);
        int padding = Math.max(2, String.valueOf(endLine).length());

        List<String> result = new ArrayList<>();
        for (int i = startLine; i <= endLine; i++) {
            result.add(String.format("%" + padding + "d | %s", i, lines[i - 1]));
            if (i == line && column > 0) {
                result.add(" ".repeat(padding + 3 + column - 1) + "^");
            }
        }
        return String.join("\n", result);
    }
}
