package org.treesketch.tree.parse;

/**
 * 解析入口的完整返回：检测到的格式、清洗后实际参与解析的行数以及解析结果。
 *
 * @param format         检测到的格式（输入为空时为 {@link InputFormat#UNKNOWN}）
 * @param sanitizedLines 清洗后剩余的行数
 * @param droppedLines   被当作注释/装饰行丢弃的非空行数
 * @param outcome        解析结果
 */
public record ParseReport(InputFormat format, int sanitizedLines, int droppedLines, ParseOutcome outcome) {
}
