package cn.hjw.dev.wrangleflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 提交报文中的原始节点: {id, type, data}
 * 编译阶段会被解析成带类型配置的 {@link WorkflowNode}
 */
@Getter
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeDefinition {

    private final String id;
    private final String type;
    private final Map<String, Object> data;

    @JsonCreator
    public NodeDefinition(@JsonProperty("id") String id,
                          @JsonProperty("type") String type,
                          @JsonProperty("data") Map<String, Object> data) {
        this.id = id;
        this.type = type;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static NodeDefinition of(String id, String type, Map<String, Object> data) {
        return new NodeDefinition(id, type, data);
    }

    public static NodeDefinition of(String id, NodeKind kind, Map<String, Object> data) {
        return new NodeDefinition(id, kind.getType(), data);
    }
}
