package cn.hjw.dev.wrangleflow.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 提交、停止、暂停、恢复的应答: {execution_id, status, message}
 */
@Getter
@ToString
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OperationResponse {

    public static final String NOT_FOUND = "not_found";

    private final String executionId;
    private final String status;
    private final String message;

    public static OperationResponse notFound(String executionId) {
        return new OperationResponse(executionId, NOT_FOUND, "Execution not found: " + executionId);
    }

    @JsonIgnore
    public boolean isNotFound() {
        return NOT_FOUND.equals(status);
    }
}
