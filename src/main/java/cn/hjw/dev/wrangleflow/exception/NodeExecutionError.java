package cn.hjw.dev.wrangleflow.exception;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.Getter;

import java.util.Map;

/**
 * 节点级异常
 * 处理器内部抛出的任何异常在离开执行器边界前都会被包装成它
 */
@Getter
public class NodeExecutionError extends WorkflowExecutionError {

    private final NodeKind nodeKind;

    public NodeExecutionError(String message, String nodeId, NodeKind nodeKind) {
        this(message, nodeId, nodeKind, null, null);
    }

    public NodeExecutionError(String message, String nodeId, NodeKind nodeKind, Throwable cause) {
        this(message, nodeId, nodeKind, null, cause);
    }

    public NodeExecutionError(String message, String nodeId, NodeKind nodeKind,
                              Map<String, Object> details, Throwable cause) {
        super(message, null, null, nodeId, details, cause);
        this.nodeKind = nodeKind;
    }

    @Override
    public String toString() {
        String base = super.toString();
        return nodeKind == null ? base : base + " (Node Type: " + nodeKind.getType() + ")";
    }
}
