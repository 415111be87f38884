package cn.hjw.dev.wrangleflow.executor;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * 节点状态快照
 */
@Getter
@Builder
@ToString
public class NodeStatusView {

    private final String nodeType;
    private final NodeStatus status;
    private final double progress;
    private final String message;
    private final String workerId;
    private final Instant startTime;
    private final Instant endTime;
    // 已存入 DataStore 的 dataId
    private final List<String> outputs;
    private final NodeError error;
}
