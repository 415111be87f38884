package cn.hjw.dev.wrangleflow.compile;

import cn.hjw.dev.wrangleflow.config.NodeConfigParser;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import cn.hjw.dev.wrangleflow.model.WorkflowGraph;
import cn.hjw.dev.wrangleflow.model.WorkflowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;

/**
 * 图构建与校验
 * 无副作用：相同输入总是得到相同的校验结果和拓扑序
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowCompiler {

    private final NodeConfigParser configParser;

    public WorkflowCompiler() {
        this(new NodeConfigParser());
    }

    /**
     * 构建并编译为执行计划
     * @param workflowId 工作流ID
     * @param nodes      原始节点定义
     * @param edges      边
     * @return 执行计划
     * @throws WorkflowExecutionError 边引用了不存在的节点、节点ID重复或存在环
     */
    public ExecutionPlan compile(String workflowId, List<NodeDefinition> nodes, List<WorkflowEdge> edges) {
        return compile(build(workflowId, nodes, edges));
    }

    /**
     * 原始定义 -> 校验过的图 (节点配置在这里完成解析)
     */
    public WorkflowGraph build(String workflowId, List<NodeDefinition> nodes, List<WorkflowEdge> edges) {
        List<WorkflowNode> parsed = new ArrayList<>();
        for (NodeDefinition definition : nodes) {
            if (StringUtils.isBlank(definition.getId())) {
                throw new WorkflowExecutionError("Node definition without id: " + definition, workflowId);
            }
            parsed.add(configParser.parse(definition));
        }
        return validate(new WorkflowGraph(workflowId, parsed, edges), parsed);
    }

    public ExecutionPlan compile(WorkflowGraph graph) {
        Map<String, List<String>> parents = new LinkedHashMap<>();
        Map<String, List<String>> children = new LinkedHashMap<>();
        List<String> order = topologicalOrder(graph, parents, children);
        if (order.size() != graph.getNodes().size()) {
            // build() 已经拦截环，直接 new 出来的图才会走到这里
            throw WorkflowExecutionError.cycleDetected(graph.getWorkflowId(), findShortestCycle(graph, order));
        }
        log.info("Workflow [{}] compiled: {} nodes, {} edges, order {}",
                graph.getWorkflowId(), order.size(), graph.getEdges().size(), order);
        return new ExecutionPlan(graph, Collections.unmodifiableList(order),
                Collections.unmodifiableMap(parents), Collections.unmodifiableMap(children));
    }

    private WorkflowGraph validate(WorkflowGraph graph, List<WorkflowNode> declared) {
        String workflowId = graph.getWorkflowId();

        // 1. 节点ID唯一
        Set<String> seen = new HashSet<>();
        for (WorkflowNode node : declared) {
            if (!seen.add(node.getId())) {
                throw new WorkflowExecutionError("Duplicate node id: " + node.getId(), workflowId);
            }
        }

        // 2. 边的两端必须存在
        for (WorkflowEdge edge : graph.getEdges()) {
            if (!seen.contains(edge.getSource())) {
                throw new WorkflowExecutionError("Edge " + edge.describe() + " references unknown source node: "
                        + edge.getSource(), workflowId);
            }
            if (!seen.contains(edge.getTarget())) {
                throw new WorkflowExecutionError("Edge " + edge.describe() + " references unknown target node: "
                        + edge.getTarget(), workflowId);
            }
        }

        // 3. 环检测
        List<String> order = topologicalOrder(graph, new HashMap<>(), new HashMap<>());
        if (order.size() != graph.getNodes().size()) {
            List<String> cycle = findShortestCycle(graph, order);
            log.warn("Workflow [{}] rejected, cycle detected: {}", workflowId, cycle);
            throw WorkflowExecutionError.cycleDetected(workflowId, cycle);
        }
        return graph;
    }

    /**
     * Kahn 算法；多个节点同时就绪时按声明顺序出队，保证结果稳定
     * 存在环时返回的列表比节点数少
     */
    private List<String> topologicalOrder(WorkflowGraph graph,
                                          Map<String, List<String>> parentsOut,
                                          Map<String, List<String>> childrenOut) {
        List<String> nodeIds = graph.getNodeIds();
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Set<String>> parents = new LinkedHashMap<>();
        Map<String, Set<String>> children = new LinkedHashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            String id = nodeIds.get(i);
            declarationIndex.put(id, i);
            inDegree.put(id, 0);
            parents.put(id, new LinkedHashSet<>());
            children.put(id, new LinkedHashSet<>());
        }

        // 同一对节点之间可能有多条边 (不同 handle)，依赖只记一次
        for (WorkflowEdge edge : graph.getEdges()) {
            if (children.get(edge.getSource()).add(edge.getTarget())) {
                parents.get(edge.getTarget()).add(edge.getSource());
                inDegree.merge(edge.getTarget(), 1, Integer::sum);
            }
        }

        Queue<String> queue = new PriorityQueue<>(Comparator.comparing(declarationIndex::get));
        inDegree.forEach((k, v) -> {
            if (v == 0) queue.offer(k);
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String node = queue.poll();
            order.add(node);
            for (String child : children.get(node)) {
                int remaining = inDegree.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(child);
                }
            }
        }

        parents.forEach((k, v) -> parentsOut.put(k, List.copyOf(v)));
        children.forEach((k, v) -> childrenOut.put(k, List.copyOf(v)));
        return order;
    }

    /**
     * 在 Kahn 排不出来的节点里找最短环
     * 对每个剩余节点做一次 BFS 回到自身，取最短的；长度相同时取声明顺序靠前的起点
     * @return 首尾相同的环，如 [A, B, A]
     */
    private List<String> findShortestCycle(WorkflowGraph graph, List<String> sorted) {
        Set<String> sortedSet = new HashSet<>(sorted);
        List<String> remaining = new ArrayList<>();
        for (String id : graph.getNodeIds()) {
            if (!sortedSet.contains(id)) {
                remaining.add(id);
            }
        }
        Set<String> candidates = new HashSet<>(remaining);

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (WorkflowEdge edge : graph.getEdges()) {
            if (candidates.contains(edge.getSource()) && candidates.contains(edge.getTarget())) {
                List<String> next = adjacency.computeIfAbsent(edge.getSource(), k -> new ArrayList<>());
                if (!next.contains(edge.getTarget())) {
                    next.add(edge.getTarget());
                }
            }
        }

        List<String> best = null;
        for (String start : remaining) {
            List<String> cycle = shortestCycleThrough(start, adjacency);
            if (cycle != null && (best == null || cycle.size() < best.size())) {
                best = cycle;
            }
        }
        return best != null ? best : remaining;
    }

    private List<String> shortestCycleThrough(String start, Map<String, List<String>> adjacency) {
        Map<String, String> previous = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.offer(start);
        Set<String> visited = new HashSet<>();
        visited.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (next.equals(start)) {
                    LinkedList<String> path = new LinkedList<>();
                    path.addFirst(start);
                    String step = current;
                    while (step != null) {
                        path.addFirst(step);
                        step = previous.get(step);
                    }
                    return new ArrayList<>(path);
                }
                if (visited.add(next)) {
                    previous.put(next, current);
                    queue.offer(next);
                }
            }
        }
        return null;
    }
}
