package org.treesketch.tree.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 列表格式解析器。
 * <p>
 * 输入形如：
 * <pre>
 * - src/
 *   - index.ts
 * - package.json
 * </pre>
 * 规则：
 * <ul>
 *   <li>前导空白宽度决定嵌套：弹出栈中缩进宽度 {@code >=} 当前行的目录，剩下的栈顶即父目录。</li>
 *   <li>{@code -} 可省略（容忍轻微的格式漂移），此时按同样的规则取名称。</li>
 *   <li>末尾 {@code /} 表示目录。</li>
 *   <li>单行无法解析时跳过；只有整体结果为空才失败。</li>
 * </ul>
 */
public class MarkdownTreeParser {

    private static final Logger log = LoggerFactory.getLogger(MarkdownTreeParser.class);

    /** 约定每级缩进两个空格；奇数宽度按整除向下取整，不做校验 */
    static final int SPACES_PER_LEVEL = 2;

    private static final Pattern BULLET_LINE = Pattern.compile("^(\\s*)-\\s*(.+)$");
    private static final Pattern PLAIN_LINE = Pattern.compile("^(\\s*)(.+)$");

    private final NodeIdGenerator idGenerator;

    public MarkdownTreeParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public ParseOutcome parse(String sanitized) {
        try {
            ForestAssembler assembler = new ForestAssembler(idGenerator);
            for (String line : InputSanitizer.splitLines(sanitized == null ? "" : sanitized)) {
                if (line.isBlank()) {
                    continue;
                }
                Matcher matcher = BULLET_LINE.matcher(line);
                if (!matcher.matches()) {
                    matcher = PLAIN_LINE.matcher(line);
                    if (!matcher.matches()) {
                        continue;
                    }
                }
                int indent = matcher.group(1).length();
                EntryName entry = EntryName.of(matcher.group(2));
                if (entry == null) {
                    continue;
                }
                assembler.attach(entry.name(), entry.kind(), indent, indent / SPACES_PER_LEVEL);
            }
            if (assembler.isEmpty()) {
                return ParseOutcome.rejected(DirectoryStructureParser.NO_STRUCTURE_FOUND);
            }
            return ParseOutcome.parsed(assembler.build());
        } catch (RuntimeException e) {
            log.warn("markdown tree parsing failed", e);
            return ParseOutcome.rejected("Failed to parse markdown format: " + DirectoryStructureParser.describe(e));
        }
    }
}
