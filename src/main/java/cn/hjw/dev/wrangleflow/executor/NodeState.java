package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个节点的运行时状态
 * 协调线程和工作线程都会写，所有状态变更都加锁；状态只向后推进，进度只增不减
 */
@Getter
public class NodeState {

    private final String nodeId;
    private final NodeKind kind;

    private NodeStatus status = NodeStatus.PENDING;
    private double progress;
    private String message;
    private Instant startTime;
    private Instant endTime;
    private String workerId;
    private NodeError error;
    private List<String> outputs = List.of();

    public NodeState(String nodeId, NodeKind kind) {
        this.nodeId = nodeId;
        this.kind = kind;
    }

    public synchronized NodeStatus getStatus() {
        return status;
    }

    public synchronized double getProgress() {
        return progress;
    }

    synchronized void assign(String workerId) {
        if (advance(NodeStatus.ASSIGNED)) {
            this.workerId = workerId;
        }
    }

    synchronized void start() {
        if (advance(NodeStatus.RUNNING)) {
            this.startTime = Instant.now();
        }
    }

    /**
     * @return 进度是否有变化
     */
    synchronized boolean updateProgress(double value, String message) {
        double clamped = Math.max(0, Math.min(100, value));
        if (clamped < progress || status.isTerminal()) {
            return false;
        }
        this.progress = clamped;
        this.message = message;
        return true;
    }

    synchronized void complete(List<String> outputs) {
        if (advance(NodeStatus.COMPLETED)) {
            this.progress = 100;
            this.endTime = Instant.now();
            this.outputs = new ArrayList<>(outputs);
        }
    }

    synchronized void fail(NodeError error) {
        if (advance(NodeStatus.FAILED)) {
            this.endTime = Instant.now();
            this.error = error;
        }
    }

    synchronized NodeStatusView snapshot() {
        return NodeStatusView.builder()
                .nodeType(kind.getType())
                .status(status)
                .progress(progress)
                .message(message)
                .workerId(workerId)
                .startTime(startTime)
                .endTime(endTime)
                .outputs(List.copyOf(outputs))
                .error(error)
                .build();
    }

    private boolean advance(NodeStatus next) {
        if (status.isTerminal() || next.ordinal() < status.ordinal()) {
            return false;
        }
        this.status = next;
        return true;
    }
}
