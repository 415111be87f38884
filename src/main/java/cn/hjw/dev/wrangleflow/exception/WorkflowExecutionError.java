package cn.hjw.dev.wrangleflow.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行级异常
 * 环检测失败、续跑策略判定为致命失败时抛出；节点级异常也继承自它
 */
@Getter
public class WorkflowExecutionError extends RuntimeException {

    private final String workflowId;
    private final String executionId;
    private final String nodeId;
    private final Map<String, Object> details;

    // 环检测失败时的最短环，首尾相同，如 [A, B, A]
    private final List<String> cycle;

    public WorkflowExecutionError(String message) {
        this(message, null, null, null, null, null, null);
    }

    public WorkflowExecutionError(String message, String workflowId) {
        this(message, workflowId, null, null, null, null, null);
    }

    public WorkflowExecutionError(String message, String workflowId, String executionId,
                                  String nodeId, Map<String, Object> details, Throwable cause) {
        this(message, workflowId, executionId, nodeId, details, null, cause);
    }

    protected WorkflowExecutionError(String message, String workflowId, String executionId, String nodeId,
                                     Map<String, Object> details, List<String> cycle, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.nodeId = nodeId;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    public static WorkflowExecutionError cycleDetected(String workflowId, List<String> cycle) {
        return new WorkflowExecutionError("Workflow contains a cycle: " + cycle,
                workflowId, null, null, Map.of("cycle", cycle), cycle, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(": ").append(getMessage());
        if (workflowId != null) {
            sb.append(" (Workflow ID: ").append(workflowId).append(')');
        }
        if (nodeId != null) {
            sb.append(" (Node ID: ").append(nodeId).append(')');
        }
        return sb.toString();
    }
}
