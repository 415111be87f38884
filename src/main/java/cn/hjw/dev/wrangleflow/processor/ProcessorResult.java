package cn.hjw.dev.wrangleflow.processor;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处理器返回的命名输出，接受前会按 expectedOutputs 校验
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProcessorResult {

    private final Map<String, Object> outputs;

    private ProcessorResult(Map<String, Object> outputs) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static ProcessorResult of(Map<String, Object> outputs) {
        return new ProcessorResult(outputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Object get(String outputName) {
        return outputs.get(outputName);
    }

    public boolean has(String outputName) {
        return outputs.containsKey(outputName);
    }

    public static class Builder {
        private final Map<String, Object> outputs = new LinkedHashMap<>();

        public Builder output(String name, Object value) {
            outputs.put(name, value);
            return this;
        }

        public ProcessorResult build() {
            return new ProcessorResult(outputs);
        }
    }
}
