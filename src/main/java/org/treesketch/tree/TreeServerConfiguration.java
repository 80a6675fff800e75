package org.treesketch.tree;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.treesketch.tree.parse.DirectoryStructureParser;
import org.treesketch.tree.parse.NodeIdGenerator;
import org.treesketch.tree.parse.RandomNodeIdGenerator;
import org.treesketch.tree.parse.SequentialNodeIdGenerator;

/**
 * 目录树 MCP 服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>按 {@link TreeServerProperties#getIdStrategy()} 选择 id 生成器，并注入到解析入口。</li>
 *   <li>状态只保存在进程内存中，不引入任何数据库/外部依赖。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class TreeServerConfiguration {

    @Bean
    public NodeIdGenerator nodeIdGenerator(TreeServerProperties properties) {
        return switch (properties.getIdStrategy()) {
            case SEQUENTIAL -> new SequentialNodeIdGenerator(properties.getIdPrefix());
            case RANDOM -> new RandomNodeIdGenerator(properties.getIdPrefix());
        };
    }

    @Bean
    public DirectoryStructureParser directoryStructureParser(NodeIdGenerator nodeIdGenerator) {
        return new DirectoryStructureParser(nodeIdGenerator);
    }

    @Bean
    public TreeStateStore treeStateStore() {
        return new TreeStateStore();
    }
}
