package org.treesketch.tree.dto;

/**
 * 编辑类工具（展开/折叠、重命名、删除、选中）的返回结果。
 *
 * @param action  动作名称
 * @param id      目标节点 id
 * @param matched 目标节点在编辑前是否存在（不存在时本次编辑为无操作）
 * @param tree    编辑后的快照
 */
public record TreeEditResult(
        String action,
        String id,
        boolean matched,
        TreeSnapshotResult tree
) {
}
