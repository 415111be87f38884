package cn.hjw.dev.wrangleflow.engine;

import cn.hjw.dev.wrangleflow.compile.WorkflowCompiler;
import cn.hjw.dev.wrangleflow.config.ExecutionConfig;
import cn.hjw.dev.wrangleflow.config.JsonMappers;
import cn.hjw.dev.wrangleflow.config.SourceConfig;
import cn.hjw.dev.wrangleflow.config.TransformConfig;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.processor.NodeProcessorRegistry;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import cn.hjw.dev.wrangleflow.processor.builtin.DataSourceProcessor;
import cn.hjw.dev.wrangleflow.processor.builtin.TransformProcessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class WorkflowOrchestratorTest {

    private static final String LINEAR = "{"
            + "\"workflow_id\": \"wf-linear\","
            + "\"nodes\": ["
            + "  {\"id\": \"A\", \"type\": \"data_source\", \"data\": {\"source_type\": \"inline\", \"data\": [{\"a\": 1}, {\"a\": 2}]}},"
            + "  {\"id\": \"B\", \"type\": \"data_transformation\", \"data\": {\"transformation_type\": \"arithmetic\","
            + "     \"input_column\": \"a\", \"operation\": \"add\", \"operand\": 1}}"
            + "],"
            + "\"edges\": [{\"id\": \"e1\", \"source\": \"A\", \"target\": \"B\", \"sourceHandle\": \"default\", \"targetHandle\": \"default\"}]"
            + "}";

    private final ObjectMapper mapper = JsonMappers.defaultMapper();

    @TempDir
    Path cacheDir;

    private ExecutionConfig baseConfig;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        baseConfig = ExecutionConfig.builder().cacheDir(cacheDir).build();
        orchestrator = new WorkflowOrchestrator(new WorkflowCompiler(), NodeProcessorRegistry.defaults(), baseConfig);
    }

    @AfterEach
    public void tearDown() {
        orchestrator.close();
    }

    /**
     * B 依赖 A 且 B 一定失败 (列不存在)，D 依赖 B
     */
    private static String failingWorkflow(String workflowConfig) {
        return "{"
                + "\"nodes\": ["
                + workflowConfig
                + "  {\"id\": \"A\", \"type\": \"source\", \"data\": {\"source_type\": \"inline\", \"data\": [{\"a\": 1}]}},"
                + "  {\"id\": \"B\", \"type\": \"transform\", \"data\": {\"transformation_type\": \"filter_columns\", \"columns\": [\"zzz\"]}},"
                + "  {\"id\": \"C\", \"type\": \"export\", \"data\": {\"export_type\": \"memory\"}},"
                + "  {\"id\": \"D\", \"type\": \"export\", \"data\": {\"export_type\": \"memory\"}}"
                + "],"
                + "\"edges\": [{\"source\": \"A\", \"target\": \"B\"}, {\"source\": \"A\", \"target\": \"C\"},"
                + "  {\"source\": \"B\", \"target\": \"D\"}]"
                + "}";
    }

    /**
     * 场景: 提交 JSON 报文，等待执行结束
     * 预期: 状态 completed，结果可按节点读取，应答序列化为 snake_case
     */
    @Test
    public void testSubmitAndQuery() throws Exception {
        OperationResponse submitted = orchestrator.submit(LINEAR);
        Assertions.assertEquals("started", submitted.getStatus());
        Assertions.assertEquals("Workflow execution started", submitted.getMessage());

        ExecutionStatusResponse status = orchestrator.awaitExecution(submitted.getExecutionId(), 10, TimeUnit.SECONDS);
        Assertions.assertEquals("completed", status.getStatus());
        Assertions.assertEquals("wf-linear", status.getWorkflowId());
        Assertions.assertEquals(100.0, status.getProgress(), 1e-9);
        Assertions.assertEquals(List.of("A", "B"), status.getExecutedNodes());
        Assertions.assertEquals("completed", status.getNodeStatuses().get("B").getStatus());

        DataTable result = (DataTable) orchestrator.getExecutor(submitted.getExecutionId()).orElseThrow()
                .getNodeResult("B");
        Assertions.assertEquals(DataTable.of(List.of(Map.of("a", 2), Map.of("a", 3))), result);

        Map<String, Object> json = mapper.readValue(mapper.writeValueAsString(status),
                new TypeReference<Map<String, Object>>() {
                });
        Assertions.assertEquals(submitted.getExecutionId(), json.get("execution_id"));
        Assertions.assertTrue(json.containsKey("node_statuses"));
        Assertions.assertTrue(json.containsKey("execution_time_seconds"));
        Assertions.assertFalse(json.containsKey("executionId"));
        Assertions.assertFalse(json.containsKey("message"));
        @SuppressWarnings("unchecked")
        Map<String, Object> nodeB = (Map<String, Object>) ((Map<String, Object>) json.get("node_statuses")).get("B");
        Assertions.assertEquals("data_transformation", nodeB.get("node_type"));
        Assertions.assertTrue(nodeB.containsKey("result"));
    }

    @Test
    public void testUnknownExecution() {
        Assertions.assertTrue(orchestrator.getExecutionStatus("missing").isNotFound());
        Assertions.assertEquals("not_found", orchestrator.stopExecution("missing").getStatus());
        Assertions.assertEquals("not_found", orchestrator.pauseExecution("missing").getStatus());
        Assertions.assertEquals("not_found", orchestrator.resumeExecution("missing").getStatus());
        Assertions.assertTrue(orchestrator.getExecutionStatus(null).isNotFound());
        Assertions.assertFalse(orchestrator.removeExecution("missing"));
    }

    /**
     * 场景: 图里有环 / 执行模式不合法
     * 预期: 提交时同步抛出异常，不会创建运行
     */
    @Test
    public void testInvalidSubmissionRejected() {
        String cyclic = "{\"nodes\": ["
                + "{\"id\": \"A\", \"type\": \"export\", \"data\": {\"export_type\": \"memory\"}},"
                + "{\"id\": \"B\", \"type\": \"export\", \"data\": {\"export_type\": \"memory\"}}],"
                + "\"edges\": [{\"source\": \"A\", \"target\": \"B\"}, {\"source\": \"B\", \"target\": \"A\"}]}";
        WorkflowExecutionError cycle = Assertions.assertThrows(WorkflowExecutionError.class,
                () -> orchestrator.submit(cyclic));
        Assertions.assertEquals(List.of("A", "B", "A"), cycle.getCycle());

        Assertions.assertThrows(WorkflowExecutionError.class,
                () -> orchestrator.submit("{\"nodes\": [], \"edges\": [], \"execution_mode\": \"turbo\"}"));
        Assertions.assertThrows(WorkflowExecutionError.class, () -> orchestrator.submit("{not json"));
    }

    @Test
    public void testStopOnErrorByDefault() throws Exception {
        OperationResponse submitted = orchestrator.submit(failingWorkflow(""));
        ExecutionStatusResponse status = orchestrator.awaitExecution(submitted.getExecutionId(), 10, TimeUnit.SECONDS);

        Assertions.assertEquals("failed", status.getStatus());
        Assertions.assertEquals(List.of("B"), status.getFailedNodes());
        Assertions.assertEquals("DataValidationError", status.getNodeStatuses().get("B").getError().getType());
        Assertions.assertNotEquals("completed", status.getNodeStatuses().get("D").getStatus());
    }

    /**
     * 场景: workflow_config 伪节点设置 stop_on_error=false
     * 预期: 伪节点不参与执行；B、D 失败，其余完成，状态 completed_with_errors
     */
    @Test
    public void testWorkflowConfigNode() throws Exception {
        OperationResponse submitted = orchestrator.submit(failingWorkflow(
                "{\"id\": \"workflow_config\", \"type\": \"config\", \"data\": {\"stop_on_error\": false}},"));
        ExecutionStatusResponse status = orchestrator.awaitExecution(submitted.getExecutionId(), 10, TimeUnit.SECONDS);

        Assertions.assertEquals("completed_with_errors", status.getStatus());
        Assertions.assertEquals(List.of("B", "D"), status.getFailedNodes());
        Assertions.assertEquals(List.of("A", "C"), status.getExecutedNodes());
        Assertions.assertFalse(status.getNodeStatuses().containsKey("workflow_config"));
    }

    /**
     * 场景: 数据源节点执行期间暂停，之后恢复
     * 预期: 数据源执行完后停在 paused，恢复后跑完剩余节点
     */
    @Test
    public void testPauseAndResume() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WorkflowOrchestrator gated = gatedOrchestrator(started, release);
        try {
            String executionId = gated.submit(LINEAR).getExecutionId();
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));

            Assertions.assertEquals("paused", gated.pauseExecution(executionId).getStatus());
            release.countDown();
            ExecutionStatusResponse paused = gated.awaitExecution(executionId, 10, TimeUnit.SECONDS);
            Assertions.assertEquals("paused", paused.getStatus());
            Assertions.assertEquals(List.of("A"), paused.getExecutedNodes());

            Assertions.assertEquals("running", gated.resumeExecution(executionId).getStatus());
            ExecutionStatusResponse done = gated.awaitExecution(executionId, 10, TimeUnit.SECONDS);
            Assertions.assertEquals("completed", done.getStatus());

            OperationResponse again = gated.resumeExecution(executionId);
            Assertions.assertEquals("Workflow is not paused", again.getMessage());
            Assertions.assertEquals("completed", again.getStatus());

            Assertions.assertTrue(gated.removeExecution(executionId));
            Assertions.assertTrue(gated.getExecutionStatus(executionId).isNotFound());
        } finally {
            release.countDown();
            gated.close();
        }
    }

    @Test
    public void testStop() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WorkflowOrchestrator gated = gatedOrchestrator(started, release);
        try {
            String executionId = gated.submit(LINEAR).getExecutionId();
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            Assertions.assertThrows(IllegalStateException.class, () -> gated.removeExecution(executionId));

            OperationResponse stopped = gated.stopExecution(executionId);
            Assertions.assertEquals("stopped", stopped.getStatus());
            release.countDown();

            ExecutionStatusResponse status = gated.awaitExecution(executionId, 10, TimeUnit.SECONDS);
            Assertions.assertEquals("stopped", status.getStatus());
            Assertions.assertEquals(List.of("A"), status.getExecutedNodes());
            Assertions.assertNotNull(status.getEndTime());

            Assertions.assertEquals("Workflow execution already finished", gated.stopExecution(executionId).getMessage());
        } finally {
            release.countDown();
            gated.close();
        }
    }

    /**
     * 数据源节点开始后阻塞，直到 release 放行
     */
    private WorkflowOrchestrator gatedOrchestrator(CountDownLatch started, CountDownLatch release) {
        NodeProcessorRegistry registry = NodeProcessorRegistry.builder()
                .register(NodeKind.SOURCE, (id, cfg) -> new DataSourceProcessor(id, (SourceConfig) cfg) {
                    @Override
                    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception {
                        started.countDown();
                        Assertions.assertTrue(release.await(10, TimeUnit.SECONDS), "gate for " + id + " never released");
                        return super.execute(inputs, progress);
                    }
                })
                .register(NodeKind.TRANSFORM, (id, cfg) -> new TransformProcessor(id, (TransformConfig) cfg))
                .build();
        return new WorkflowOrchestrator(new WorkflowCompiler(), registry, baseConfig);
    }
}
