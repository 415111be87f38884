package cn.hjw.dev.wrangleflow.compile;

import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import cn.hjw.dev.wrangleflow.model.WorkflowGraph;
import cn.hjw.dev.wrangleflow.model.WorkflowNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 编译产物：图 + 拓扑序 + 依赖关系
 */
@Getter
@RequiredArgsConstructor
public class ExecutionPlan {

    private final WorkflowGraph graph;

    // 拓扑序，每条边的 source 都排在 target 之前
    private final List<String> topologicalOrder;

    // 节点依赖关系: Key=NodeId, Value=上游节点 (去重，按边声明顺序)
    private final Map<String, List<String>> nodeParentsMap;

    // Key=NodeId, Value=下游节点
    private final Map<String, List<String>> nodeChildrenMap;

    public String getWorkflowId() {
        return graph.getWorkflowId();
    }

    public WorkflowNode getNode(String nodeId) {
        return graph.getNode(nodeId);
    }

    public List<String> getParents(String nodeId) {
        return nodeParentsMap.getOrDefault(nodeId, List.of());
    }

    public List<String> getChildren(String nodeId) {
        return nodeChildrenMap.getOrDefault(nodeId, List.of());
    }

    public List<WorkflowEdge> getEdges() {
        return graph.getEdges();
    }

    public int size() {
        return topologicalOrder.size();
    }
}
