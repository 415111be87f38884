package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.exception.NodeConfigurationError;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 节点重试配置，对应节点 data 里的 retry: {max_retries, backoff_ms}
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetryPolicy {

    public static final int MAX_RETRIES_CAP = 10;

    // --- 重试配置 ---
    private int maxRetries = 0;

    private long backoffMs = 0;

    public static RetryPolicy none() {
        return new RetryPolicy();
    }

    public static RetryPolicy of(int maxRetries, long backoffMs) {
        return new RetryPolicy(maxRetries, backoffMs);
    }

    @JsonIgnore
    public boolean isEnabled() {
        return maxRetries > 0;
    }

    /**
     * 首次执行加上重试的总次数
     */
    @JsonIgnore
    public int getTotalAttempts() {
        return maxRetries + 1;
    }

    /**
     * 数据校验和配置错误换一次执行结果也一样，不重试
     */
    public boolean isRetryable(Throwable error) {
        return !(error instanceof DataValidationError) && !(error instanceof NodeConfigurationError);
    }
}
