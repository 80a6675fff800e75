package org.treesketch.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * 目录树节点（不可变）。
 * <p>
 * 约束：
 * <ul>
 *   <li>{@code id} 在同一片森林内唯一，创建后不再变化。</li>
 *   <li>文件节点的 {@code children} 恒为 null；目录节点的 {@code children} 非 null（可为空列表）。</li>
 *   <li>{@code depth} 为非负整数：顶层节点为 0，子节点为父节点 + 1。</li>
 *   <li>{@code expanded} 只对目录有意义，默认 true。</li>
 * </ul>
 * 所有“修改”都通过 {@code withXxx} 返回新实例，原实例保持不变，便于多个读者安全共享同一快照。
 *
 * @param id       唯一标识
 * @param name     显示名称（目录名不含末尾的 /）
 * @param kind     节点类型
 * @param children 子节点（仅目录）
 * @param expanded 是否展开（仅目录）
 * @param depth    深度
 */
public record TreeNode(
        String id,
        String name,
        NodeKind kind,
        List<TreeNode> children,
        boolean expanded,
        int depth
) {

    public TreeNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (depth < 0) {
            throw new IllegalArgumentException("节点深度不能为负数：" + depth);
        }
        if (kind == NodeKind.FILE) {
            if (children != null) {
                throw new IllegalArgumentException("文件节点不能包含子节点：" + name);
            }
        } else {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    public static TreeNode file(String id, String name, int depth) {
        return new TreeNode(id, name, NodeKind.FILE, null, true, depth);
    }

    public static TreeNode folder(String id, String name, int depth, List<TreeNode> children) {
        return new TreeNode(id, name, NodeKind.FOLDER, children, true, depth);
    }

    @JsonIgnore
    public boolean isFolder() {
        return kind == NodeKind.FOLDER;
    }

    public TreeNode withName(String newName) {
        return new TreeNode(id, newName, kind, children, expanded, depth);
    }

    public TreeNode withExpanded(boolean newExpanded) {
        return new TreeNode(id, name, kind, children, newExpanded, depth);
    }

    public TreeNode withChildren(List<TreeNode> newChildren) {
        return new TreeNode(id, name, kind, newChildren, expanded, depth);
    }

    public TreeNode withDepth(int newDepth) {
        return new TreeNode(id, name, kind, children, expanded, newDepth);
    }

    /**
     * 以当前节点为根的子树节点总数（含自身）。
     */
    public int subtreeSize() {
        int size = 1;
        if (children != null) {
            for (TreeNode child : children) {
                size += child.subtreeSize();
            }
        }
        return size;
    }
}
