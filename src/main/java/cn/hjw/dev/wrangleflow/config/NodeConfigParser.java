package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.exception.NodeConfigurationError;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.model.WorkflowNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 原始节点 data -> 强类型配置
 * 在图编译阶段执行，配置错误在运行前就暴露出来
 */
@Slf4j
@RequiredArgsConstructor
public class NodeConfigParser {

    private static final Map<NodeKind, Class<? extends AbstractNodeConfig>> CONFIG_TYPES = new EnumMap<>(NodeKind.class);

    static {
        CONFIG_TYPES.put(NodeKind.SOURCE, SourceConfig.class);
        CONFIG_TYPES.put(NodeKind.TRANSFORM, TransformConfig.class);
        CONFIG_TYPES.put(NodeKind.ANALYZE, AnalyzeConfig.class);
        CONFIG_TYPES.put(NodeKind.VISUALIZE, VisualizeConfig.class);
        CONFIG_TYPES.put(NodeKind.EXPORT, ExportConfig.class);
    }

    private final ObjectMapper objectMapper;

    public NodeConfigParser() {
        this(JsonMappers.defaultMapper());
    }

    public WorkflowNode parse(NodeDefinition definition) {
        String nodeId = definition.getId();
        NodeKind kind = NodeKind.fromType(definition.getType())
                .orElseThrow(() -> NodeConfigurationError.unknownType(nodeId, definition.getType()));

        AbstractNodeConfig config;
        try {
            config = objectMapper.convertValue(definition.getData(), CONFIG_TYPES.get(kind));
        } catch (IllegalArgumentException e) {
            log.warn("Node [{}] has malformed {} config: {}", nodeId, kind.getType(), e.getMessage());
            throw new NodeConfigurationError("Malformed configuration for node " + nodeId,
                    nodeId, kind, kind.getType(), List.of(e.getMessage()), e);
        }
        config.attachRaw(definition.getData());

        List<String> errors = new ArrayList<>(config.validate());
        RetryPolicy retry = config.getRetry();
        if (retry.getMaxRetries() < 0 || retry.getMaxRetries() > RetryPolicy.MAX_RETRIES_CAP) {
            errors.add("retry.max_retries must be between 0 and " + RetryPolicy.MAX_RETRIES_CAP);
        }
        if (retry.getBackoffMs() < 0) {
            errors.add("retry.backoff_ms must not be negative");
        }
        if (!errors.isEmpty()) {
            throw new NodeConfigurationError("Invalid configuration for node " + nodeId + ": " + errors,
                    nodeId, kind, errors);
        }
        return new WorkflowNode(nodeId, kind, config);
    }
}
