package org.treesketch.tree.dto;

import org.treesketch.tree.TreeNode;
import org.treesketch.tree.TreeStateStore;

import java.util.List;

/**
 * 当前目录树快照。
 *
 * @param revision   快照版本号（每次编辑自增）
 * @param selectedId 当前选中的节点 id（未选中为 null）
 * @param nodeCount  节点总数（含所有层级）
 * @param nodes      顶层节点列表（递归包含子节点）
 */
public record TreeSnapshotResult(
        long revision,
        String selectedId,
        int nodeCount,
        List<TreeNode> nodes
) {

    public static TreeSnapshotResult of(TreeStateStore.Snapshot snapshot) {
        return new TreeSnapshotResult(
                snapshot.revision(),
                snapshot.state().selectedId(),
                snapshot.state().nodeCount(),
                snapshot.state().forest()
        );
    }
}
