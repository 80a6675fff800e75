package org.treesketch.tree;

import java.util.List;

/**
 * 目录树状态快照：森林 + 当前选中节点。
 * <p>
 * 快照本身不可变；每次编辑都会产生新的 {@link TreeState}。
 *
 * @param forest     顶层节点列表（按输入顺序）
 * @param selectedId 当前选中的节点 id（可为 null）
 */
public record TreeState(List<TreeNode> forest, String selectedId) {

    public static final TreeState EMPTY = new TreeState(List.of(), null);

    public TreeState {
        forest = forest == null ? List.of() : List.copyOf(forest);
    }

    public TreeState withForest(List<TreeNode> newForest) {
        return new TreeState(newForest, selectedId);
    }

    public TreeState withSelectedId(String newSelectedId) {
        return new TreeState(forest, newSelectedId);
    }

    public int nodeCount() {
        int count = 0;
        for (TreeNode root : forest) {
            count += root.subtreeSize();
        }
        return count;
    }
}
