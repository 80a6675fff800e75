package org.treesketch.tree.format;

import org.treesketch.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 把目录树渲染回文本（Markdown 列表或 ASCII 树），输出可直接再次解析。
 * <p>
 * ASCII 风格下只有一个顶层节点时，根节点单独成行（{@code project/}），其子节点作为第一层连接符输出；
 * 多个顶层节点时每个顶层节点都带连接符。
 */
public final class TreeTextFormatter {

    public static final String BRANCH = "├── ";
    public static final String CORNER = "└── ";
    public static final String VERTICAL = "│   ";
    public static final String BLANK = "    ";
    public static final String BULLET = "- ";

    private TreeTextFormatter() {
    }

    public static String format(List<TreeNode> forest, FormatStyle style, String indent) {
        if (forest == null || forest.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        if (style == FormatStyle.ASCII) {
            formatAscii(forest, lines);
        } else {
            for (TreeNode node : forest) {
                formatMarkdown(node, "", indent == null ? "  " : indent, lines);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * 只渲染可见节点：折叠的目录不输出其子节点。
     */
    public static String formatVisible(List<TreeNode> forest, FormatStyle style, String indent) {
        if (forest == null) {
            return "";
        }
        List<TreeNode> visible = new ArrayList<>(forest.size());
        for (TreeNode node : forest) {
            visible.add(visibleCopy(node));
        }
        return format(visible, style, indent);
    }

    private static TreeNode visibleCopy(TreeNode node) {
        if (!node.isFolder()) {
            return node;
        }
        if (!node.expanded()) {
            return node.withChildren(List.of());
        }
        List<TreeNode> children = new ArrayList<>(node.children().size());
        for (TreeNode child : node.children()) {
            children.add(visibleCopy(child));
        }
        return node.withChildren(children);
    }

    private static void formatMarkdown(TreeNode node, String currentIndent, String indent, List<String> lines) {
        lines.add(currentIndent + BULLET + label(node));
        if (node.isFolder()) {
            for (TreeNode child : node.children()) {
                formatMarkdown(child, currentIndent + indent, indent, lines);
            }
        }
    }

    private static void formatAscii(List<TreeNode> forest, List<String> lines) {
        if (forest.size() == 1) {
            TreeNode root = forest.get(0);
            lines.add(label(root));
            if (root.isFolder()) {
                appendAsciiChildren(root.children(), "", lines);
            }
            return;
        }
        appendAsciiChildren(forest, "", lines);
    }

    private static void appendAsciiChildren(List<TreeNode> nodes, String prefix, List<String> lines) {
        for (int i = 0; i < nodes.size(); i++) {
            TreeNode node = nodes.get(i);
            boolean last = i == nodes.size() - 1;
            lines.add(prefix + (last ? CORNER : BRANCH) + label(node));
            if (node.isFolder() && !node.children().isEmpty()) {
                appendAsciiChildren(node.children(), prefix + (last ? BLANK : VERTICAL), lines);
            }
        }
    }

    private static String label(TreeNode node) {
        return node.isFolder() ? node.name() + "/" : node.name();
    }
}
