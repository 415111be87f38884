package cn.hjw.dev.wrangleflow.executor;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 节点状态，只能向后推进：pending -> assigned -> running -> completed | failed
 */
@Getter
@RequiredArgsConstructor
public enum NodeStatus {

    PENDING("pending"),
    ASSIGNED("assigned"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    @JsonValue
    private final String value;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
