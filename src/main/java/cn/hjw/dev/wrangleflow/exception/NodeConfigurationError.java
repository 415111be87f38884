package cn.hjw.dev.wrangleflow.exception;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 节点配置异常：未注册的节点类型或者配置格式错误
 */
@Getter
public class NodeConfigurationError extends NodeExecutionError {

    private final List<String> configErrors;

    // 节点类型无法识别时 nodeKind 为 null，原始类型名保留在这里
    private final String rawType;

    public NodeConfigurationError(String message, String nodeId, NodeKind nodeKind, List<String> configErrors) {
        this(message, nodeId, nodeKind, nodeKind == null ? null : nodeKind.getType(), configErrors, null);
    }

    public NodeConfigurationError(String message, String nodeId, NodeKind nodeKind, String rawType,
                                  List<String> configErrors, Throwable cause) {
        super(message, nodeId, nodeKind, Map.of("config_errors", List.copyOf(configErrors)), cause);
        this.configErrors = List.copyOf(configErrors);
        this.rawType = rawType;
    }

    public static NodeConfigurationError unknownType(String nodeId, String rawType) {
        return new NodeConfigurationError("No processor registered for node type: " + rawType + " (node " + nodeId + ")",
                nodeId, null, rawType, List.of("unknown node type: " + rawType), null);
    }
}
