package cn.hjw.dev.wrangleflow.engine;

import cn.hjw.dev.wrangleflow.config.ExecutionConfig;
import cn.hjw.dev.wrangleflow.config.ExecutionMode;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流提交报文
 * {workflow_id?, nodes, edges, execution_mode, stop_on_error?, max_parallel_nodes?}
 */
@Getter
@Builder(toBuilder = true)
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowSubmission {

    private String workflowId;

    @Builder.Default
    private List<NodeDefinition> nodes = new ArrayList<>();

    @Builder.Default
    private List<WorkflowEdge> edges = new ArrayList<>();

    // 为空时按 sequential
    private String executionMode;

    // 为空时取默认值 true
    private Boolean stopOnError;

    // 为空时按 execution_mode 取默认并发数
    private Integer maxParallelNodes;

    /**
     * 在基础配置上叠加报文里的运行参数
     */
    public ExecutionConfig toExecutionConfig(ExecutionConfig base) {
        ExecutionMode mode = ExecutionMode.fromValue(executionMode);
        ExecutionConfig.ExecutionConfigBuilder builder = base.toBuilder()
                .maxParallelNodes(maxParallelNodes != null ? maxParallelNodes : mode.getDefaultParallelism());
        if (stopOnError != null) {
            builder.stopOnError(stopOnError);
        }
        return builder.build();
    }
}
