package org.treesketch.tree.parse;

import org.treesketch.tree.NodeKind;
import org.treesketch.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 两种解析器共用的建树逻辑：按嵌套键把节点挂到父目录或顶层，最后一次性冻结为不可变森林并规范化深度。
 * <p>
 * 非线程安全：每次解析新建一个实例。
 */
final class ForestAssembler {

    private final NodeIdGenerator idGenerator;
    private final List<Draft> roots = new ArrayList<>();
    private final NestingStack<Draft> stack = new NestingStack<>();

    ForestAssembler(NodeIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * 追加一个节点：先按 {@code key} 找父目录，再挂载；目录节点随后入栈。
     *
     * @param provisionalDepth 由源文本推算的临时深度，{@link #build()} 时统一规范化
     */
    void attach(String name, NodeKind kind, int key, int provisionalDepth) {
        Draft node = new Draft(idGenerator.nextId(), name, kind, Math.max(0, provisionalDepth));
        Draft parent = stack.resolveParent(key);
        if (parent == null) {
            roots.add(node);
        } else {
            parent.children.add(node);
        }
        if (kind == NodeKind.FOLDER) {
            stack.push(node, key);
        }
    }

    /**
     * 追加一个顶层目录并以哨兵键入栈，使后续所有行都嵌套在它之下。
     */
    void openRoot(String name, int sentinelKey) {
        Draft node = new Draft(idGenerator.nextId(), name, NodeKind.FOLDER, 0);
        roots.add(node);
        stack.push(node, sentinelKey);
    }

    boolean isEmpty() {
        return roots.isEmpty();
    }

    List<TreeNode> build() {
        List<TreeNode> forest = new ArrayList<>(roots.size());
        for (Draft root : roots) {
            forest.add(root.freeze());
        }
        return normalizeDepths(forest);
    }

    /**
     * 深度规范化：顶层节点深度为 0，子节点为父节点 + 1。
     * <p>
     * 源文本推算的临时深度（缩进宽度 / 2、连接符层级）在缩进不规整或存在隐式根目录时会与实际层级不一致，
     * 例如单根目录时根自身占用深度 0，其子树需要整体下移一层。这里统一按父子关系重新推导，只在不一致时重建节点。
     */
    static List<TreeNode> normalizeDepths(List<TreeNode> forest) {
        List<TreeNode> result = new ArrayList<>(forest.size());
        for (TreeNode node : forest) {
            result.add(normalize(node, 0));
        }
        return List.copyOf(result);
    }

    private static TreeNode normalize(TreeNode node, int depth) {
        TreeNode adjusted = node.depth() == depth ? node : node.withDepth(depth);
        if (!adjusted.isFolder() || adjusted.children().isEmpty()) {
            return adjusted;
        }
        List<TreeNode> children = new ArrayList<>(adjusted.children().size());
        for (TreeNode child : adjusted.children()) {
            children.add(normalize(child, depth + 1));
        }
        return adjusted.withChildren(children);
    }

    /**
     * 可变的建树草稿节点，仅在解析过程中使用。
     */
    private static final class Draft {
        private final String id;
        private final String name;
        private final NodeKind kind;
        private final int depth;
        private final List<Draft> children = new ArrayList<>();

        private Draft(String id, String name, NodeKind kind, int depth) {
            this.id = id;
            this.name = name;
            this.kind = kind;
            this.depth = depth;
        }

        private TreeNode freeze() {
            if (kind == NodeKind.FILE) {
                return TreeNode.file(id, name, depth);
            }
            List<TreeNode> frozen = new ArrayList<>(children.size());
            for (Draft child : children) {
                frozen.add(child.freeze());
            }
            return TreeNode.folder(id, name, depth, frozen);
        }
    }
}
