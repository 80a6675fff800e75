package org.treesketch.tree.parse;

import java.util.List;
import java.util.function.Predicate;

/**
 * 输入格式检测：按优先级依次匹配规则，命中第一条即返回。
 * <ol>
 *   <li>出现任意制表符（├ └ │ ─）：ASCII。混合输入只要出现一个制表符就走 ASCII 解析。</li>
 *   <li>任一非空行去掉首尾空白后以 {@code -} 开头：MARKDOWN。</li>
 *   <li>存在任意非空行：MARKDOWN（裸行视为隐式列表）。</li>
 * </ol>
 * 全部未命中时返回 {@link InputFormat#UNKNOWN}。新增格式时在列表中插入规则即可，不影响已有规则的顺序。
 */
public final class FormatDetector {

    static final String BOX_DRAWING_CHARS = "├└│─";
    static final String BULLET_MARKER = "-";

    private static final List<Rule> RULES = List.of(
            new Rule(InputFormat.ASCII, FormatDetector::containsBoxDrawing),
            new Rule(InputFormat.MARKDOWN, text -> nonBlankLines(text).stream().anyMatch(line -> line.trim().startsWith(BULLET_MARKER))),
            new Rule(InputFormat.MARKDOWN, text -> !nonBlankLines(text).isEmpty())
    );

    private FormatDetector() {
    }

    public static InputFormat detect(String sanitized) {
        if (sanitized == null) {
            return InputFormat.UNKNOWN;
        }
        for (Rule rule : RULES) {
            if (rule.matches().test(sanitized)) {
                return rule.format();
            }
        }
        return InputFormat.UNKNOWN;
    }

    static boolean containsBoxDrawing(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (BOX_DRAWING_CHARS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static List<String> nonBlankLines(String text) {
        return InputSanitizer.splitLines(text).stream().filter(line -> !line.isBlank()).toList();
    }

    private record Rule(InputFormat format, Predicate<String> matches) {
    }
}
