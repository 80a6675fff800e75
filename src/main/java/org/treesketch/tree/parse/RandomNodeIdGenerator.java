package org.treesketch.tree.parse;

import java.util.UUID;

/**
 * 基于随机 UUID 的 id 生成器（默认实现），形如 {@code node-3f2a...}。
 */
public class RandomNodeIdGenerator implements NodeIdGenerator {

    private final String prefix;

    public RandomNodeIdGenerator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public String nextId() {
        return prefix + UUID.randomUUID();
    }
}
