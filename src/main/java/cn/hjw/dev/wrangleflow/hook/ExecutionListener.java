package cn.hjw.dev.wrangleflow.hook;

import cn.hjw.dev.wrangleflow.executor.NodeStatus;
import cn.hjw.dev.wrangleflow.executor.RunStatus;

/**
 * 执行进度回调
 * 回调在执行线程上同步触发，实现方不应阻塞
 */
public interface ExecutionListener {

    /**
     * 运行状态变化
     * @param executionId 运行ID
     * @param status      新状态
     * @param progress    当前整体进度 [0,100]
     */
    default void onRunStatusChanged(String executionId, RunStatus status, double progress) {
    }

    /**
     * 节点进度变化
     * @param executionId 运行ID
     * @param nodeId      节点ID
     * @param status      节点状态
     * @param progress    节点进度 [0,100]
     * @param message     进度说明
     */
    default void onNodeProgress(String executionId, String nodeId, NodeStatus status, double progress, String message) {
    }
}
