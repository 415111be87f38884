package cn.hjw.dev.wrangleflow.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class AbstractNodeConfig implements NodeConfig {

    @JsonIgnore
    private Map<String, Object> raw = Map.of();

    private RetryPolicy retry = RetryPolicy.none();

    /**
     * 取值是否在允许集合内，null 视为不合法 (Set.of 不接受 null 查询)
     */
    protected static boolean oneOf(Set<String> allowed, String value) {
        return value != null && allowed.contains(value);
    }

    void attachRaw(Map<String, Object> raw) {
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        if (this.retry == null) {
            this.retry = RetryPolicy.none();
        }
    }
}
