package cn.hjw.dev.wrangleflow.engine;

import cn.hjw.dev.wrangleflow.executor.ExecutionStatus;
import cn.hjw.dev.wrangleflow.executor.NodeError;
import cn.hjw.dev.wrangleflow.executor.NodeStatus;
import cn.hjw.dev.wrangleflow.executor.NodeStatusView;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 状态查询应答，序列化为 snake_case JSON
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionStatusResponse {

    private final String executionId;
    private final String workflowId;
    private final String status;
    private final Double progress;
    private final Instant startTime;
    private final Instant endTime;
    private final Double executionTimeSeconds;
    private final String currentNode;
    private final List<String> executedNodes;
    private final List<String> failedNodes;
    private final Map<String, NodeStatusEntry> nodeStatuses;
    private final String message;

    public static ExecutionStatusResponse from(ExecutionStatus status) {
        Map<String, NodeStatusEntry> nodes = new LinkedHashMap<>();
        status.getNodeStatuses().forEach((nodeId, view) -> nodes.put(nodeId, NodeStatusEntry.from(view)));
        return ExecutionStatusResponse.builder()
                .executionId(status.getExecutionId())
                .workflowId(status.getWorkflowId())
                .status(status.getStatus().getValue())
                .progress(status.getProgress())
                .startTime(status.getStartTime())
                .endTime(status.getEndTime())
                .executionTimeSeconds(status.getExecutionTimeSeconds())
                .currentNode(status.getCurrentNodeId())
                .executedNodes(status.getExecutedNodes())
                .failedNodes(status.getFailedNodes())
                .nodeStatuses(nodes)
                .build();
    }

    public static ExecutionStatusResponse notFound(String executionId) {
        return ExecutionStatusResponse.builder()
                .executionId(executionId)
                .status(OperationResponse.NOT_FOUND)
                .message("Execution not found: " + executionId)
                .build();
    }

    @JsonIgnore
    public boolean isNotFound() {
        return OperationResponse.NOT_FOUND.equals(status);
    }

    /**
     * 节点状态: {status, progress, agent_id?, result?, error?}
     */
    @Getter
    @Builder
    @ToString
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class NodeStatusEntry {
        private final String status;
        private final double progress;
        private final String nodeType;
        // 规划阶段建议的 worker
        private final String agentId;
        private final Map<String, Object> result;
        private final NodeError error;

        static NodeStatusEntry from(NodeStatusView view) {
            Map<String, Object> result = null;
            if (view.getStatus() == NodeStatus.COMPLETED) {
                result = new LinkedHashMap<>();
                result.put("outputs", view.getOutputs());
                result.put("start_time", view.getStartTime());
                result.put("end_time", view.getEndTime());
            }
            return NodeStatusEntry.builder()
                    .status(view.getStatus().getValue())
                    .progress(view.getProgress())
                    .nodeType(view.getNodeType())
                    .agentId(view.getWorkerId())
                    .result(result)
                    .error(view.getError())
                    .build();
        }
    }
}
