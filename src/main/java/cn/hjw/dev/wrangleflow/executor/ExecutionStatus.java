package cn.hjw.dev.wrangleflow.executor;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 运行状态快照，getStatus 每次返回新对象
 */
@Getter
@Builder
@ToString
public class ExecutionStatus {

    private final String executionId;
    private final String workflowId;
    private final RunStatus status;
    private final double progress;
    private final String currentNodeId;
    private final Instant startTime;
    private final Instant endTime;
    private final Double executionTimeSeconds;
    private final List<String> executedNodes;
    private final List<String> failedNodes;
    private final Map<String, NodeStatusView> nodeStatuses;
}
