package cn.hjw.dev.wrangleflow.engine;

import cn.hjw.dev.wrangleflow.config.ExecutionMode;
import cn.hjw.dev.wrangleflow.config.JsonMappers;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 解析提交报文
 * 兼容旧版前端：id 为 workflow_config 的伪节点只携带运行参数 (stop_on_error / execution_mode / max_parallel_nodes)，不参与执行
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowDefinitionReader {

    public static final String WORKFLOW_CONFIG_NODE_ID = "workflow_config";

    private final ObjectMapper objectMapper;

    public WorkflowDefinitionReader() {
        this(JsonMappers.defaultMapper());
    }

    public WorkflowSubmission read(String json) {
        try {
            return normalize(objectMapper.readValue(json, WorkflowSubmission.class));
        } catch (JsonProcessingException e) {
            throw new WorkflowExecutionError("Invalid workflow payload: " + e.getOriginalMessage(),
                    null, null, null, Map.of(), e);
        }
    }

    public WorkflowSubmission read(InputStream in) throws IOException {
        return normalize(objectMapper.readValue(in, WorkflowSubmission.class));
    }

    public WorkflowSubmission read(Map<String, Object> payload) {
        try {
            return normalize(objectMapper.convertValue(payload, WorkflowSubmission.class));
        } catch (IllegalArgumentException e) {
            throw new WorkflowExecutionError("Invalid workflow payload: " + e.getMessage(),
                    null, null, null, Map.of(), e);
        }
    }

    WorkflowSubmission normalize(WorkflowSubmission submission) {
        List<NodeDefinition> nodes = submission.getNodes() == null ? List.of() : submission.getNodes();
        List<NodeDefinition> executable = new ArrayList<>(nodes.size());
        Boolean stopOnError = submission.getStopOnError();
        String executionMode = submission.getExecutionMode();
        Integer maxParallelNodes = submission.getMaxParallelNodes();
        for (NodeDefinition node : nodes) {
            if (!WORKFLOW_CONFIG_NODE_ID.equals(node.getId())) {
                executable.add(node);
                continue;
            }
            // 报文顶层显式给出的值优先
            Map<String, Object> data = node.getData();
            if (stopOnError == null && data.get("stop_on_error") instanceof Boolean) {
                stopOnError = (Boolean) data.get("stop_on_error");
            }
            if (executionMode == null && data.get("execution_mode") instanceof String) {
                executionMode = (String) data.get("execution_mode");
            }
            if (maxParallelNodes == null && data.get("max_parallel_nodes") instanceof Number) {
                maxParallelNodes = ((Number) data.get("max_parallel_nodes")).intValue();
            }
            log.debug("Workflow {} uses workflow_config node {}", submission.getWorkflowId(), data);
        }

        // 提前校验 execution_mode，避免提交后才失败
        try {
            ExecutionMode.fromValue(executionMode);
        } catch (IllegalArgumentException e) {
            throw new WorkflowExecutionError(e.getMessage(), submission.getWorkflowId());
        }
        return submission.toBuilder()
                .nodes(executable)
                .edges(submission.getEdges() == null ? List.of() : submission.getEdges())
                .stopOnError(stopOnError)
                .executionMode(executionMode)
                .maxParallelNodes(maxParallelNodes)
                .build();
    }
}
