package org.treesketch.tree;

/**
 * 节点类型：文件或目录。创建后不可变更。
 */
public enum NodeKind {
    FILE,
    FOLDER
}
