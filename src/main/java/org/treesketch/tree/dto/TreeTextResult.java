package org.treesketch.tree.dto;

/**
 * {@code tree_format} 的返回结果。
 *
 * @param style       输出风格
 * @param visibleOnly 是否只输出展开的节点
 * @param lineCount   行数
 * @param text        渲染后的文本
 */
public record TreeTextResult(
        String style,
        boolean visibleOnly,
        int lineCount,
        String text
) {
}
