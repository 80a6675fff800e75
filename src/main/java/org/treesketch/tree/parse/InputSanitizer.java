package org.treesketch.tree.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 输入清洗：去掉注释与纯装饰行。
 * <p>
 * 规则（逐行）：
 * <ul>
 *   <li>去掉首尾空白后以 {@code #} 开头：整行丢弃。</li>
 *   <li>否则从第一个 {@code #} 起截掉行尾注释。</li>
 *   <li>剩余内容为空，或不含任何字母/数字/{@code _}/{@code .}/{@code -}/{@code /}：丢弃（例如只剩 {@code │} 的装饰行）。</li>
 * </ul>
 * 保留下来的行原样（含缩进）用换行符拼接。不会失败，最坏情况返回空字符串。
 */
public final class InputSanitizer {

    static final String COMMENT_MARKER = "#";

    private static final Pattern CONTENT = Pattern.compile("[\\p{L}\\p{N}_.\\-/]");

    private InputSanitizer() {
    }

    public static String sanitize(String raw) {
        return String.join("\n", sanitizeLines(raw));
    }

    public static List<String> sanitizeLines(String raw) {
        List<String> result = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return result;
        }
        for (String line : splitLines(raw)) {
            String stripped = stripComment(line);
            if (stripped == null) {
                continue;
            }
            String trimmed = stripped.trim();
            if (trimmed.isEmpty() || !CONTENT.matcher(trimmed).find()) {
                continue;
            }
            result.add(stripped);
        }
        return result;
    }

    /**
     * 按 \n / \r\n 拆行（保留行内容的前导空白）。
     */
    static List<String> splitLines(String text) {
        return List.of(text.split("\\r?\\n", -1));
    }

    private static String stripComment(String line) {
        if (line.trim().startsWith(COMMENT_MARKER)) {
            return null;
        }
        int commentIndex = line.indexOf(COMMENT_MARKER);
        return commentIndex >= 0 ? line.substring(0, commentIndex) : line;
    }
}
