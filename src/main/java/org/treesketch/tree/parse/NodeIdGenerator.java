package org.treesketch.tree.parse;

/**
 * 节点 id 生成器。
 * <p>
 * 解析器通过构造参数注入，测试时可替换为确定性的计数器（{@link SequentialNodeIdGenerator}）。
 * 实现必须保证同一实例生成的 id 互不重复。
 */
@FunctionalInterface
public interface NodeIdGenerator {

    String nextId();
}
