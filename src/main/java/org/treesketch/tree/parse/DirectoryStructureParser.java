package org.treesketch.tree.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 目录结构文本解析入口：清洗 -> 格式检测 -> 按格式分派到对应解析器。
 * <p>
 * 所有失败都以 {@link ParseOutcome.Rejected} 返回，不抛异常：
 * <ul>
 *   <li>输入为空 / 只有注释或空白 / 无法识别格式：输入被拒绝。</li>
 *   <li>格式可识别但一个节点也没解析出来：{@link #NO_STRUCTURE_FOUND}。</li>
 *   <li>解析器内部异常：在解析器边界捕获并包装为带格式前缀的原因。</li>
 * </ul>
 */
public class DirectoryStructureParser {

    private static final Logger log = LoggerFactory.getLogger(DirectoryStructureParser.class);

    public static final String EMPTY_INPUT = "Input is empty. Please provide a directory structure.";
    public static final String ONLY_COMMENTS =
            "Input contains only comments or whitespace. Please provide a valid directory structure.";
    public static final String UNKNOWN_FORMAT =
            "Unable to detect input format. Please use markdown (- folder/) or ASCII (├── folder/) format.";
    public static final String NO_STRUCTURE_FOUND = "No valid directory structure found in input";

    private final MarkdownTreeParser markdownParser;
    private final AsciiTreeParser asciiParser;

    public DirectoryStructureParser(NodeIdGenerator idGenerator) {
        this(new MarkdownTreeParser(idGenerator), new AsciiTreeParser(idGenerator));
    }

    public DirectoryStructureParser(MarkdownTreeParser markdownParser, AsciiTreeParser asciiParser) {
        this.markdownParser = markdownParser;
        this.asciiParser = asciiParser;
    }

    public ParseOutcome parse(String input) {
        return parseWithReport(input).outcome();
    }

    public ParseReport parseWithReport(String input) {
        if (input == null || input.isBlank()) {
            return new ParseReport(InputFormat.UNKNOWN, 0, 0, ParseOutcome.rejected(EMPTY_INPUT));
        }

        List<String> lines = InputSanitizer.sanitizeLines(input);
        int dropped = countNonBlankLines(input) - lines.size();
        String sanitized = String.join("\n", lines);
        if (sanitized.isBlank()) {
            return new ParseReport(InputFormat.UNKNOWN, 0, dropped, ParseOutcome.rejected(ONLY_COMMENTS));
        }

        InputFormat format = FormatDetector.detect(sanitized);
        log.debug("detected directory structure format: {} ({} lines, {} dropped)", format, lines.size(), dropped);
        ParseOutcome outcome = switch (format) {
            case MARKDOWN -> markdownParser.parse(sanitized);
            case ASCII -> asciiParser.parse(sanitized);
            case UNKNOWN -> ParseOutcome.rejected(UNKNOWN_FORMAT);
        };
        return new ParseReport(format, lines.size(), dropped, outcome);
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }

    private static int countNonBlankLines(String input) {
        int count = 0;
        for (String line : InputSanitizer.splitLines(input)) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
