package org.treesketch.tree.dto;

import java.util.List;

/**
 * {@code tree_parse} 的返回结果。
 *
 * @param success        是否解析成功（失败时当前目录树保持不变）
 * @param format         检测到的输入格式（MARKDOWN/ASCII/UNKNOWN）
 * @param error          失败原因（成功时为 null）
 * @param sanitizedLines 清洗后参与解析的行数
 * @param droppedLines   被当作注释/装饰行丢弃的行数
 * @param tree           解析成功后的目录树快照（失败时为 null）
 * @param warnings       非致命提示
 */
public record TreeParseResult(
        boolean success,
        String format,
        String error,
        int sanitizedLines,
        int droppedLines,
        TreeSnapshotResult tree,
        List<String> warnings
) {
}
