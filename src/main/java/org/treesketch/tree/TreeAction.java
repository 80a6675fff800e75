package org.treesketch.tree;

import java.util.List;

/**
 * 作用于 {@link TreeStateEngine} 的编辑动作。
 */
public sealed interface TreeAction
        permits TreeAction.ReplaceForest, TreeAction.ToggleExpand, TreeAction.Rename, TreeAction.Delete, TreeAction.Select {

    /**
     * 整体替换森林（解析成功后使用），同时清空选中状态。
     */
    record ReplaceForest(List<TreeNode> forest) implements TreeAction {
        public ReplaceForest {
            forest = forest == null ? List.of() : List.copyOf(forest);
        }
    }

    record ToggleExpand(String id) implements TreeAction {
    }

    record Rename(String id, String name) implements TreeAction {
    }

    record Delete(String id) implements TreeAction {
    }

    /**
     * @param id 选中的节点 id；null 表示取消选中
     */
    record Select(String id) implements TreeAction {
    }
}
