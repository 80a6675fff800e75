package org.treesketch.tree.parse;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 递增计数的 id 生成器：{@code node-1}、{@code node-2}……
 * <p>
 * 计数器不会重置，因此多次解析之间 id 也不会复用。
 */
public class SequentialNodeIdGenerator implements NodeIdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong(0);

    public SequentialNodeIdGenerator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public String nextId() {
        return prefix + counter.incrementAndGet();
    }
}
