package cn.hjw.dev.wrangleflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * 有向边: source -> target
 * 同时决定执行顺序和数据路由 (sourceHandle 的输出放到 target 的 targetHandle 输入上)
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowEdge {

    public static final String DEFAULT_HANDLE = "default";

    private final String id;
    private final String source;
    private final String target;
    private final String sourceHandle;
    private final String targetHandle;

    @Builder
    @JsonCreator
    public WorkflowEdge(@JsonProperty("id") String id,
                        @JsonProperty("source") String source,
                        @JsonProperty("target") String target,
                        @JsonProperty("sourceHandle") String sourceHandle,
                        @JsonProperty("targetHandle") String targetHandle) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.sourceHandle = StringUtils.defaultIfBlank(sourceHandle, DEFAULT_HANDLE);
        this.targetHandle = StringUtils.defaultIfBlank(targetHandle, DEFAULT_HANDLE);
    }

    public static WorkflowEdge of(String source, String target) {
        return new WorkflowEdge(null, source, target, null, null);
    }

    public static WorkflowEdge of(String source, String sourceHandle, String target, String targetHandle) {
        return new WorkflowEdge(null, source, target, sourceHandle, targetHandle);
    }

    @JsonIgnore
    public String sourceDataId() {
        return source + ":" + sourceHandle;
    }

    @JsonIgnore
    public String describe() {
        return StringUtils.isNotBlank(id) ? id : source + "->" + target;
    }
}
