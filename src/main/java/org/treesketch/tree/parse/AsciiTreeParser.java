package org.treesketch.tree.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesketch.tree.NodeKind;

/**
 * ASCII 树格式解析器（{@code tree} 命令风格）。
 * <p>
 * 输入形如：
 * <pre>
 * project/
 * ├── src/
 * │   └── index.ts
 * └── package.json
 * </pre>
 * 行首前缀由以下记号组成：
 * <ul>
 *   <li>{@code ├──}（中间项）/ {@code └──}（末项）：连接符，之后的内容即名称，扫描到此为止。</li>
 *   <li>{@code │   } / 四个空格：续行块，每个代表一层嵌套，层级 + 1。</li>
 * </ul>
 * 第一条内容行若没有连接符且以 {@code /} 结尾，视为隐式根目录：以哨兵层级入栈，后续所有行都挂在它下面。
 */
public class AsciiTreeParser {

    private static final Logger log = LoggerFactory.getLogger(AsciiTreeParser.class);

    static final String BRANCH = "├──";
    static final String CORNER = "└──";
    static final String VERTICAL_CONTINUATION = "│   ";
    static final String BLANK_CONTINUATION = "    ";

    /** 低于任何真实层级，保证隐式根目录不会被弹出 */
    static final int ROOT_SENTINEL_LEVEL = -1;

    private final NodeIdGenerator idGenerator;

    public AsciiTreeParser(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    public ParseOutcome parse(String sanitized) {
        try {
            ForestAssembler assembler = new ForestAssembler(idGenerator);
            boolean firstLine = true;
            for (String rawLine : InputSanitizer.splitLines(sanitized == null ? "" : sanitized)) {
                if (rawLine.isBlank()) {
                    continue;
                }
                boolean isFirst = firstLine;
                firstLine = false;

                // tree 命令在部分环境下用不换行空格填充续行块
                LinePrefix prefix = scanPrefix(rawLine.replace('\u00a0', ' '));
                EntryName entry = EntryName.of(prefix.remainder());
                if (entry == null) {
                    continue;
                }
                if (isFirst && !prefix.connector() && entry.kind() == NodeKind.FOLDER) {
                    assembler.openRoot(entry.name(), ROOT_SENTINEL_LEVEL);
                    continue;
                }
                assembler.attach(entry.name(), entry.kind(), prefix.level(), prefix.level());
            }
            if (assembler.isEmpty()) {
                return ParseOutcome.rejected(DirectoryStructureParser.NO_STRUCTURE_FOUND);
            }
            return ParseOutcome.parsed(assembler.build());
        } catch (RuntimeException e) {
            log.warn("ascii tree parsing failed", e);
            return ParseOutcome.rejected("Failed to parse ASCII format: " + DirectoryStructureParser.describe(e));
        }
    }

    /**
     * 扫描行首前缀：累计续行块层级，遇到连接符即停止，其后内容为名称。
     */
    static LinePrefix scanPrefix(String line) {
        int pos = 0;
        int level = 0;
        while (pos < line.length()) {
            if (line.startsWith(BRANCH, pos)) {
                return new LinePrefix(level, true, line.substring(pos + BRANCH.length()));
            }
            if (line.startsWith(CORNER, pos)) {
                return new LinePrefix(level, true, line.substring(pos + CORNER.length()));
            }
            if (line.startsWith(VERTICAL_CONTINUATION, pos)) {
                level++;
                pos += VERTICAL_CONTINUATION.length();
                continue;
            }
            if (line.startsWith(BLANK_CONTINUATION, pos)) {
                level++;
                pos += BLANK_CONTINUATION.length();
                continue;
            }
            break;
        }
        return new LinePrefix(level, false, line.substring(pos));
    }

    /**
     * @param level     续行块数量
     * @param connector 是否找到连接符
     * @param remainder 前缀之后的剩余文本（未去空白）
     */
    record LinePrefix(int level, boolean connector, String remainder) {
    }
}
