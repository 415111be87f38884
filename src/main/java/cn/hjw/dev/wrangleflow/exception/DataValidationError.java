package cn.hjw.dev.wrangleflow.exception;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 数据校验异常：缺少必需输入、缺少声明的输出、数据规则不满足等
 */
@Getter
public class DataValidationError extends NodeExecutionError {

    private final List<String> validationErrors;

    public DataValidationError(String message, String nodeId, NodeKind nodeKind, List<String> validationErrors) {
        super(message, nodeId, nodeKind, Map.of("validation_errors", List.copyOf(validationErrors)), null);
        this.validationErrors = List.copyOf(validationErrors);
    }
}
