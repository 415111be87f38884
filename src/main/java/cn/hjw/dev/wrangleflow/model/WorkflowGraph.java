package cn.hjw.dev.wrangleflow.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 校验通过的工作流图：无环，且每条边的端点都存在
 * 节点按声明顺序保存
 */
@Getter
public class WorkflowGraph {

    private final String workflowId;
    private final Map<String, WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;

    public WorkflowGraph(String workflowId, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        this.workflowId = workflowId;
        Map<String, WorkflowNode> byId = new LinkedHashMap<>();
        nodes.forEach(n -> byId.put(n.getId(), n));
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(edges);
    }

    public WorkflowNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public List<String> getNodeIds() {
        return List.copyOf(nodes.keySet());
    }

    public List<WorkflowEdge> incomingEdges(String nodeId) {
        return edges.stream().filter(e -> e.getTarget().equals(nodeId)).collect(Collectors.toList());
    }

    public List<WorkflowEdge> outgoingEdges(String nodeId) {
        return edges.stream().filter(e -> e.getSource().equals(nodeId)).collect(Collectors.toList());
    }
}
