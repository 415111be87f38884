package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.hook.ExecutionListener;
import cn.hjw.dev.wrangleflow.hook.WorkerAssigner;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;

/**
 * 单次运行的配置
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ExecutionConfig {

    public static final long DEFAULT_MEMORY_THRESHOLD_BYTES = 10L * 1024 * 1024;

    // --- 失败策略 ---
    @Builder.Default
    private boolean stopOnError = true;

    // --- 并发配置 ---
    // 1 表示严格串行；大于 1 时依赖已满足的节点可以并发执行
    @Builder.Default
    private int maxParallelNodes = 1;

    // 外部传入的线程池，不传则每次运行内部创建并在结束后关闭
    private ExecutorService threadPool;

    // --- 中间结果缓存 ---
    @Builder.Default
    private Path cacheDir = Paths.get(System.getProperty("java.io.tmpdir"), "workflow_cache");

    @Builder.Default
    private long memoryThresholdBytes = DEFAULT_MEMORY_THRESHOLD_BYTES;

    // --- 扩展点 ---
    private WorkerAssigner workerAssigner;

    private ExecutionListener listener;

    @Builder.Default
    private ObjectMapper objectMapper = JsonMappers.defaultMapper();

    public static ExecutionConfig defaults() {
        return ExecutionConfig.builder().build();
    }

    public static ExecutionConfig forMode(ExecutionMode mode) {
        return ExecutionConfig.builder().maxParallelNodes(mode.getDefaultParallelism()).build();
    }

    public boolean isParallel() {
        return maxParallelNodes > 1;
    }
}
