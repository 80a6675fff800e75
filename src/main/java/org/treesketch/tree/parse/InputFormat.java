package org.treesketch.tree.parse;

/**
 * 输入格式。
 */
public enum InputFormat {
    /** 缩进的 {@code -} 列表 */
    MARKDOWN,
    /** 制表符画出的 ASCII 树（├── / └── / │） */
    ASCII,
    UNKNOWN
}
