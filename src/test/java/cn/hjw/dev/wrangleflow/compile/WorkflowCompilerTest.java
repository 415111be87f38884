package cn.hjw.dev.wrangleflow.compile;

import cn.hjw.dev.wrangleflow.exception.NodeConfigurationError;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class WorkflowCompilerTest {

    private final WorkflowCompiler compiler = new WorkflowCompiler();

    private static NodeDefinition analysis(String id) {
        return NodeDefinition.of(id, NodeKind.ANALYZE, Map.of());
    }

    /**
     * 场景: 菱形 A -> (B, C) -> D，声明顺序为 D, C, B, A
     * 预期: 每条边 source 在 target 之前；B 和 C 同时就绪时按声明顺序 (C 先)
     */
    @Test
    public void testTopologicalOrderRespectsEdges() {
        List<NodeDefinition> nodes = List.of(analysis("D"), analysis("C"), analysis("B"), analysis("A"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("A", "B"), WorkflowEdge.of("A", "C"),
                WorkflowEdge.of("B", "D"), WorkflowEdge.of("C", "D"));

        ExecutionPlan plan = compiler.compile("wf-diamond", nodes, edges);
        List<String> order = plan.getTopologicalOrder();
        log.info("order: {}", order);

        for (WorkflowEdge edge : edges) {
            Assertions.assertTrue(order.indexOf(edge.getSource()) < order.indexOf(edge.getTarget()),
                    "边 " + edge.describe() + " 的顺序不对");
        }
        Assertions.assertEquals(List.of("A", "C", "B", "D"), order);
        Assertions.assertEquals(List.of("B", "C"), plan.getParents("D").stream().sorted().collect(Collectors.toList()));
        Assertions.assertEquals(List.of("B", "C"), plan.getChildren("A"));
    }

    /**
     * 场景: 同一对节点之间有两条不同 handle 的边
     * 预期: 依赖只记一次，可以正常排序
     */
    @Test
    public void testParallelEdgesCountedOnce() {
        List<NodeDefinition> nodes = List.of(analysis("A"), analysis("B"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("A", "default", "B", "default"),
                WorkflowEdge.of("A", "result", "B", "extra"));

        ExecutionPlan plan = compiler.compile("wf-multi", nodes, edges);
        Assertions.assertEquals(List.of("A", "B"), plan.getTopologicalOrder());
        Assertions.assertEquals(List.of("A"), plan.getParents("B"));
    }

    /**
     * 场景: A -> B -> C -> A，外加 A -> B 的捷径环 B -> A
     * 预期: 报告最短环 [A, B, A]，重复编译得到相同结果
     */
    @Test
    public void testCycleRejectedWithShortestCycle() {
        List<NodeDefinition> nodes = List.of(analysis("A"), analysis("B"), analysis("C"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("A", "B"), WorkflowEdge.of("B", "C"),
                WorkflowEdge.of("C", "A"), WorkflowEdge.of("B", "A"));

        WorkflowExecutionError first = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf-cycle", nodes, edges));
        WorkflowExecutionError second = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf-cycle", nodes, edges));

        Assertions.assertEquals(List.of("A", "B", "A"), first.getCycle());
        Assertions.assertEquals(first.getCycle(), second.getCycle());
        Assertions.assertEquals(first.getMessage(), second.getMessage());
        Assertions.assertEquals("wf-cycle", first.getWorkflowId());
    }

    /**
     * 场景: 自环 A -> A
     * 预期: 环为 [A, A]
     */
    @Test
    public void testSelfLoop() {
        WorkflowExecutionError error = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf-self", List.of(analysis("A")), List.of(WorkflowEdge.of("A", "A"))));
        Assertions.assertEquals(List.of("A", "A"), error.getCycle());
    }

    /**
     * 场景: 环之外还有挂在环下游的节点
     * 预期: 只报告环本身
     */
    @Test
    public void testCycleWithDownstreamNodes() {
        List<NodeDefinition> nodes = List.of(analysis("X"), analysis("A"), analysis("B"), analysis("Y"));
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("X", "A"), WorkflowEdge.of("A", "B"),
                WorkflowEdge.of("B", "A"), WorkflowEdge.of("B", "Y"));

        WorkflowExecutionError error = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf", nodes, edges));
        Assertions.assertEquals(List.of("A", "B", "A"), error.getCycle());
    }

    @Test
    public void testDanglingEdgeRejected() {
        WorkflowExecutionError error = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf", List.of(analysis("A")), List.of(WorkflowEdge.of("A", "ghost"))));
        Assertions.assertTrue(error.getMessage().contains("ghost"));
        Assertions.assertTrue(error.getMessage().contains("target"));
    }

    @Test
    public void testDuplicateNodeIdRejected() {
        WorkflowExecutionError error = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> compiler.compile("wf", List.of(analysis("A"), analysis("A")), List.of()));
        Assertions.assertTrue(error.getMessage().contains("Duplicate node id"));
    }

    /**
     * 场景: 未知节点类型
     * 预期: 编译阶段失败，异常里带原始类型名
     */
    @Test
    public void testUnknownNodeTypeRejectedAtBuildTime() {
        NodeDefinition unknown = NodeDefinition.of("m", "machine_learning", Map.of());
        NodeConfigurationError error = Assertions.assertThrows(NodeConfigurationError.class,
                () -> compiler.compile("wf", List.of(unknown), List.of()));
        Assertions.assertEquals("m", error.getNodeId());
        Assertions.assertEquals("machine_learning", error.getRawType());
        Assertions.assertNull(error.getNodeKind());
    }

    /**
     * 场景: 较长的链，声明顺序打乱
     * 预期: 结果只取决于输入，多次编译一致
     */
    @Test
    public void testDeterministicOrder() {
        List<NodeDefinition> nodes = new ArrayList<>();
        List<WorkflowEdge> edges = new ArrayList<>();
        for (int i = 9; i >= 0; i--) {
            nodes.add(analysis("n" + i));
        }
        for (int i = 0; i < 9; i += 2) {
            edges.add(WorkflowEdge.of("n" + i, "n" + (i + 1)));
        }
        List<String> first = compiler.compile("wf", nodes, edges).getTopologicalOrder();
        for (int round = 0; round < 5; round++) {
            Assertions.assertEquals(first, compiler.compile("wf", nodes, edges).getTopologicalOrder());
        }
        Assertions.assertEquals(10, first.size());
    }
}
