package org.treesketch.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * 目录树状态机（纯函数）。
 * <p>
 * {@link #apply(TreeState, TreeAction)} 根据动作从旧快照推导出新快照：
 * <ul>
 *   <li>不修改旧快照，不产生副作用；未受影响的子树直接复用原实例。</li>
 *   <li>按 id 精确匹配节点（深度优先遍历整片森林）；找不到 id 时视为无操作，不抛异常。</li>
 *   <li>id 重复属于调用方违反前置条件，这里不做处理。</li>
 * </ul>
 */
public final class TreeStateEngine {

    private TreeStateEngine() {
    }

    public static TreeState apply(TreeState state, TreeAction action) {
        Objects.requireNonNull(action, "action");
        TreeState current = state == null ? TreeState.EMPTY : state;

        if (action instanceof TreeAction.ReplaceForest replace) {
            // 节点身份整体变化，旧的选中项不再有效
            return new TreeState(replace.forest(), null);
        }
        if (action instanceof TreeAction.ToggleExpand toggle) {
            return current.withForest(toggleExpand(current.forest(), toggle.id()));
        }
        if (action instanceof TreeAction.Rename rename) {
            return current.withForest(rename(current.forest(), rename.id(), rename.name()));
        }
        if (action instanceof TreeAction.Delete delete) {
            List<TreeNode> forest = delete(current.forest(), delete.id());
            String selectedId = Objects.equals(current.selectedId(), delete.id()) ? null : current.selectedId();
            return new TreeState(forest, selectedId);
        }
        if (action instanceof TreeAction.Select select) {
            return current.withSelectedId(select.id());
        }
        throw new IllegalArgumentException("不支持的动作类型：" + action.getClass().getName());
    }

    /**
     * 切换目录的展开状态；id 不存在或属于文件时返回原森林。
     */
    public static List<TreeNode> toggleExpand(List<TreeNode> forest, String id) {
        return transform(forest, id, node -> node.isFolder() ? node.withExpanded(!node.expanded()) : node);
    }

    /**
     * 重命名节点（不区分文件/目录，不校验名称是否为空）。
     */
    public static List<TreeNode> rename(List<TreeNode> forest, String id, String name) {
        return transform(forest, id, node -> node.withName(name));
    }

    /**
     * 删除节点及其整棵子树（无论位于哪一层）。
     */
    public static List<TreeNode> delete(List<TreeNode> forest, String id) {
        if (id == null) {
            return forest;
        }
        List<TreeNode> result = new ArrayList<>(forest.size());
        boolean changed = false;
        for (TreeNode node : forest) {
            if (id.equals(node.id())) {
                changed = true;
                continue;
            }
            if (node.isFolder()) {
                List<TreeNode> children = delete(node.children(), id);
                if (children != node.children()) {
                    node = node.withChildren(children);
                    changed = true;
                }
            }
            result.add(node);
        }
        return changed ? List.copyOf(result) : forest;
    }

    /**
     * 按 id 查找节点（深度优先）；找不到返回 null。
     */
    public static TreeNode findById(List<TreeNode> forest, String id) {
        if (forest == null || id == null) {
            return null;
        }
        for (TreeNode node : forest) {
            if (id.equals(node.id())) {
                return node;
            }
            if (node.isFolder()) {
                TreeNode found = findById(node.children(), id);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * 对 id 匹配的节点应用 {@code change}，其余节点保持原样。
     * <p>
     * 某一层没有任何变化时返回同一个列表实例，调用方据此判断子树是否需要重建。
     */
    private static List<TreeNode> transform(List<TreeNode> forest, String id, UnaryOperator<TreeNode> change) {
        if (id == null) {
            return forest;
        }
        List<TreeNode> result = null;
        for (int i = 0; i < forest.size(); i++) {
            TreeNode node = forest.get(i);
            TreeNode updated;
            if (id.equals(node.id())) {
                updated = change.apply(node);
            } else if (node.isFolder()) {
                List<TreeNode> children = transform(node.children(), id, change);
                updated = children == node.children() ? node : node.withChildren(children);
            } else {
                updated = node;
            }
            if (updated != node && result == null) {
                result = new ArrayList<>(forest);
            }
            if (result != null) {
                result.set(i, updated);
            }
        }
        return result == null ? forest : List.copyOf(result);
    }
}
