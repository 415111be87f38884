package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.config.AnalyzeConfig;
import cn.hjw.dev.wrangleflow.config.ExportConfig;
import cn.hjw.dev.wrangleflow.config.SourceConfig;
import cn.hjw.dev.wrangleflow.config.TransformConfig;
import cn.hjw.dev.wrangleflow.config.VisualizeConfig;
import cn.hjw.dev.wrangleflow.exception.NodeConfigurationError;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.model.WorkflowNode;
import cn.hjw.dev.wrangleflow.processor.builtin.AnalyzeProcessor;
import cn.hjw.dev.wrangleflow.processor.builtin.DataSourceProcessor;
import cn.hjw.dev.wrangleflow.processor.builtin.ExportProcessor;
import cn.hjw.dev.wrangleflow.processor.builtin.TransformProcessor;
import cn.hjw.dev.wrangleflow.processor.builtin.VisualizeProcessor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点类型 -> 处理器构造函数
 * 启动时构建一次，之后只读；通过构造参数注入执行器，不使用全局静态表
 */
@Slf4j
public final class NodeProcessorRegistry {

    private final Map<NodeKind, NodeProcessorFactory> factories;

    private NodeProcessorRegistry(Map<NodeKind, NodeProcessorFactory> factories) {
        this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
    }

    /**
     * 内置五种处理器
     */
    public static NodeProcessorRegistry defaults() {
        return builder()
                .register(NodeKind.SOURCE, (id, cfg) -> new DataSourceProcessor(id, (SourceConfig) cfg))
                .register(NodeKind.TRANSFORM, (id, cfg) -> new TransformProcessor(id, (TransformConfig) cfg))
                .register(NodeKind.ANALYZE, (id, cfg) -> new AnalyzeProcessor(id, (AnalyzeConfig) cfg))
                .register(NodeKind.VISUALIZE, (id, cfg) -> new VisualizeProcessor(id, (VisualizeConfig) cfg))
                .register(NodeKind.EXPORT, (id, cfg) -> new ExportProcessor(id, (ExportConfig) cfg))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 为节点创建处理器；配置了重试时包一层 {@link RetryingNodeProcessor}
     * @throws NodeConfigurationError 节点类型未注册或配置与类型不匹配
     */
    public NodeProcessor create(WorkflowNode node) {
        NodeProcessorFactory factory = factories.get(node.getKind());
        if (factory == null) {
            throw new NodeConfigurationError("No processor registered for node type: " + node.getKind().getType(),
                    node.getId(), node.getKind(), List.of("unregistered node kind: " + node.getKind()));
        }
        NodeProcessor processor;
        try {
            processor = factory.create(node.getId(), node.getConfig());
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new NodeConfigurationError("Invalid configuration for node " + node.getId() + ": " + e.getMessage(),
                    node.getId(), node.getKind(), node.getKind().getType(), List.of(String.valueOf(e.getMessage())), e);
        }
        if (node.getConfig().getRetry() != null && node.getConfig().getRetry().isEnabled()) {
            return new RetryingNodeProcessor(processor, node.getConfig().getRetry());
        }
        return processor;
    }

    public boolean supports(NodeKind kind) {
        return factories.containsKey(kind);
    }

    public Set<NodeKind> getRegisteredKinds() {
        return factories.keySet();
    }

    public static class Builder {
        private final Map<NodeKind, NodeProcessorFactory> factories = new EnumMap<>(NodeKind.class);

        public Builder register(NodeKind kind, NodeProcessorFactory factory) {
            factories.put(kind, factory);
            log.debug("Registered processor factory for node type {}", kind.getType());
            return this;
        }

        public NodeProcessorRegistry build() {
            return new NodeProcessorRegistry(factories);
        }
    }
}
