package org.treesketch.tree.format;

import java.util.Locale;

/**
 * 文本输出风格。
 */
public enum FormatStyle {
    MARKDOWN,
    ASCII;

    /**
     * 宽松解析风格名称（忽略大小写）；为空时返回 {@code defaultStyle}。
     */
    public static FormatStyle parse(String value, FormatStyle defaultStyle) {
        if (value == null || value.isBlank()) {
            return defaultStyle;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (FormatStyle style : values()) {
            if (style.name().equals(normalized)) {
                return style;
            }
        }
        throw new IllegalArgumentException("不支持的输出风格：" + value + "（可选 markdown/ascii）");
    }
}
