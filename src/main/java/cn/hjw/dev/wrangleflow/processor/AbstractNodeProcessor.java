package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.config.NodeConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 处理器基类：通用的输入/输出名校验
 * 类型、结构等更细的校验由具体处理器覆盖
 * @param <C> 节点配置类型
 */
@Getter
public abstract class AbstractNodeProcessor<C extends NodeConfig> implements NodeProcessor {

    public static final String DEFAULT = "default";

    private final String nodeId;
    private final C config;

    protected AbstractNodeProcessor(String nodeId, C config) {
        this.nodeId = nodeId;
        this.config = config;
    }

    @Override
    public NodeKind getKind() {
        return config.getKind();
    }

    @Override
    public List<String> requiredInputs() {
        return List.of();
    }

    @Override
    public List<String> expectedOutputs() {
        return List.of(DEFAULT);
    }

    @Override
    public void validateInputs(Map<String, Object> inputs) {
        List<String> missing = requiredInputs().stream()
                .filter(name -> !inputs.containsKey(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DataValidationError("Missing required inputs: " + String.join(", ", missing),
                    nodeId, getKind(),
                    missing.stream().map(m -> "missing required input: " + m).collect(Collectors.toList()));
        }
    }

    @Override
    public void validateOutputs(ProcessorResult result) {
        List<String> missing = expectedOutputs().stream()
                .filter(name -> result == null || !result.has(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DataValidationError("Missing expected outputs: " + String.join(", ", missing),
                    nodeId, getKind(),
                    missing.stream().map(m -> "missing expected output: " + m).collect(Collectors.toList()));
        }
    }

    /**
     * 取表格输入，类型不符视为校验失败
     */
    protected DataTable requireTable(Map<String, Object> inputs, String name) {
        Object value = inputs.get(name);
        if (value == null) {
            throw new NodeExecutionError("No input data provided under '" + name + "'", nodeId, getKind());
        }
        if (!(value instanceof DataTable)) {
            throw new DataValidationError("Input data is not a table: " + value.getClass().getSimpleName(),
                    nodeId, getKind(),
                    List.of("input '" + name + "' expected DataTable, got " + value.getClass().getName()));
        }
        return (DataTable) value;
    }

    protected NodeExecutionError failure(String message) {
        return new NodeExecutionError(message, nodeId, getKind());
    }
}
