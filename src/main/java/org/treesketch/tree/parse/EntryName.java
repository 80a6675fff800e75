package org.treesketch.tree.parse;

import org.treesketch.tree.NodeKind;

/**
 * 一行中解析出的条目名称：末尾 {@code /} 表示目录，存储时去掉。
 *
 * @param name 名称（非空）
 * @param kind 类型
 */
record EntryName(String name, NodeKind kind) {

    static final String FOLDER_SUFFIX = "/";

    /**
     * @return 去掉 {@code /} 后名称为空时返回 null（该行跳过）
     */
    static EntryName of(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.endsWith(FOLDER_SUFFIX)) {
            String name = trimmed.substring(0, trimmed.length() - FOLDER_SUFFIX.length()).trim();
            return name.isEmpty() ? null : new EntryName(name, NodeKind.FOLDER);
        }
        return new EntryName(trimmed, NodeKind.FILE);
    }
}
