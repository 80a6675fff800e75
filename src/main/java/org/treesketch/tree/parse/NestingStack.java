package org.treesketch.tree.parse;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 解析时“当前打开的目录”栈。
 * <p>
 * 每个条目记录节点及其嵌套键（Markdown 为缩进宽度，ASCII 为连接符层级）。
 * 新行到来时先 {@link #resolveParent(int)}：弹出所有键不小于当前键的条目，剩下的栈顶即父节点。
 * 按宽度比较而不是按层级比较，因此缩进宽度不统一但单调的输入也能正确嵌套。
 *
 * @param <T> 节点类型
 */
final class NestingStack<T> {

    private final Deque<Entry<T>> entries = new ArrayDeque<>();

    /**
     * 弹出键 {@code >= key} 的条目并返回新的栈顶节点；栈空时返回 null（即应挂到顶层）。
     */
    T resolveParent(int key) {
        while (!entries.isEmpty() && entries.peek().key() >= key) {
            entries.pop();
        }
        Entry<T> top = entries.peek();
        return top == null ? null : top.node();
    }

    void push(T node, int key) {
        entries.push(new Entry<>(node, key));
    }

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    private record Entry<T>(T node, int key) {
    }
}
