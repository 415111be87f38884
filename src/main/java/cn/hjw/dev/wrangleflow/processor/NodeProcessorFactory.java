package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.config.NodeConfig;

/**
 * 处理器构造函数
 */
@FunctionalInterface
public interface NodeProcessorFactory {

    NodeProcessor create(String nodeId, NodeConfig config);
}
