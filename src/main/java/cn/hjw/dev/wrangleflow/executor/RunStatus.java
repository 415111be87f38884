package cn.hjw.dev.wrangleflow.executor;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 运行状态
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    INITIALIZED("initialized"),
    PLANNING("planning"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    COMPLETED_WITH_ERRORS("completed_with_errors"),
    FAILED("failed"),
    STOPPED("stopped");

    @JsonValue
    private final String value;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == FAILED || this == STOPPED;
    }
}
