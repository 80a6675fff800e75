package org.treesketch.tree.dto;

import org.treesketch.tree.TreeNode;

/**
 * @param id    查询的节点 id
 * @param found 是否找到
 * @param node  节点（含子树；未找到为 null）
 */
public record TreeNodeLookupResult(String id, boolean found, TreeNode node) {
}
