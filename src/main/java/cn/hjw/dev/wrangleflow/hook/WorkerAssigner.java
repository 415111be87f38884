package cn.hjw.dev.wrangleflow.hook;

import cn.hjw.dev.wrangleflow.model.WorkflowNode;

import java.util.Optional;

/**
 * 规划阶段为节点标注建议的 worker
 * 只作展示用，不影响调度和正确性
 */
@FunctionalInterface
public interface WorkerAssigner {

    Optional<String> assign(WorkflowNode node);
}
