package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.exception.NodeConfigurationError;
import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 节点失败的结构化描述，随状态一起返回
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeError {

    private final String type;
    private final String message;
    private final String nodeType;
    private final List<String> validationErrors;

    public static NodeError from(NodeExecutionError e) {
        List<String> errors = null;
        String nodeType = e.getNodeKind() == null ? null : e.getNodeKind().getType();
        if (e instanceof DataValidationError) {
            errors = ((DataValidationError) e).getValidationErrors();
        } else if (e instanceof NodeConfigurationError) {
            errors = ((NodeConfigurationError) e).getConfigErrors();
            nodeType = ((NodeConfigurationError) e).getRawType();
        }
        return NodeError.builder()
                .type(e.getClass().getSimpleName())
                .message(e.getMessage())
                .nodeType(nodeType)
                .validationErrors(errors)
                .build();
    }
}
