package cn.hjw.dev.wrangleflow.engine;

import cn.hjw.dev.wrangleflow.compile.ExecutionPlan;
import cn.hjw.dev.wrangleflow.compile.WorkflowCompiler;
import cn.hjw.dev.wrangleflow.config.ExecutionConfig;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.executor.ExecutionStatus;
import cn.hjw.dev.wrangleflow.executor.RunStatus;
import cn.hjw.dev.wrangleflow.executor.WorkflowExecutor;
import cn.hjw.dev.wrangleflow.processor.NodeProcessorRegistry;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 进程内的编排入口
 * 提交时同步完成编译校验，执行放到后台线程；之后按 executionId 查询状态、停止、暂停、恢复
 * 运行记录 (连同它的 DataStore 缓存) 不会自动淘汰，结束后仍可查询状态和结果；
 * 调用方需要在不再关心某次运行时调用 {@link #removeExecution(String)} 释放它
 */
@Slf4j
public class WorkflowOrchestrator implements AutoCloseable {

    private final WorkflowCompiler compiler;
    private final NodeProcessorRegistry registry;
    private final ExecutionConfig baseConfig;
    private final WorkflowDefinitionReader reader;
    private final ExecutorService runner;

    // 只在 removeExecution 时移除
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    public WorkflowOrchestrator() {
        this(new WorkflowCompiler(), NodeProcessorRegistry.defaults(), ExecutionConfig.defaults());
    }

    public WorkflowOrchestrator(WorkflowCompiler compiler, NodeProcessorRegistry registry, ExecutionConfig baseConfig) {
        this.compiler = compiler;
        this.registry = registry;
        this.baseConfig = baseConfig;
        this.reader = new WorkflowDefinitionReader(baseConfig.getObjectMapper());
        this.runner = Executors.newCachedThreadPool(new BasicThreadFactory.Builder()
                .namingPattern("wrangleflow-run-%d")
                .daemon(true)
                .build());
    }

    /**
     * 提交 JSON 报文
     */
    public OperationResponse submit(String json) {
        return submit(reader.read(json));
    }

    /**
     * 编译并在后台开始执行
     * @return status 为 started 的应答，带新的 executionId
     * @throws WorkflowExecutionError 图校验失败 (环、悬空边、重复ID、未知节点类型等)
     */
    public OperationResponse submit(WorkflowSubmission submission) {
        WorkflowSubmission normalized = reader.normalize(submission);
        String workflowId = StringUtils.defaultIfBlank(normalized.getWorkflowId(), UUID.randomUUID().toString());
        ExecutionPlan plan = compiler.compile(workflowId, normalized.getNodes(), normalized.getEdges());

        String executionId = UUID.randomUUID().toString();
        ExecutionConfig config = normalized.toExecutionConfig(baseConfig);
        WorkflowExecutor executor = new WorkflowExecutor(executionId, plan, registry, config);
        Execution execution = new Execution(executor);
        executions.put(executionId, execution);

        execution.track(CompletableFuture.supplyAsync(executor::execute, runner));
        log.info("Workflow {} submitted as execution {} (max_parallel_nodes: {}, stop_on_error: {})",
                workflowId, executionId, config.getMaxParallelNodes(), config.isStopOnError());
        return new OperationResponse(executionId, "started", "Workflow execution started");
    }

    public ExecutionStatusResponse getExecutionStatus(String executionId) {
        return findExecution(executionId)
                .map(e -> ExecutionStatusResponse.from(e.getExecutor().getStatus()))
                .orElseGet(() -> ExecutionStatusResponse.notFound(executionId));
    }

    public OperationResponse stopExecution(String executionId) {
        Optional<Execution> execution = findExecution(executionId);
        if (execution.isEmpty()) {
            return OperationResponse.notFound(executionId);
        }
        WorkflowExecutor executor = execution.get().getExecutor();
        if (!executor.stop()) {
            return new OperationResponse(executionId, executor.getRunStatus().getValue(),
                    "Workflow execution already finished");
        }
        return new OperationResponse(executionId, RunStatus.STOPPED.getValue(), "Workflow execution stopped");
    }

    public OperationResponse pauseExecution(String executionId) {
        Optional<Execution> execution = findExecution(executionId);
        if (execution.isEmpty()) {
            return OperationResponse.notFound(executionId);
        }
        WorkflowExecutor executor = execution.get().getExecutor();
        if (!executor.pause()) {
            return new OperationResponse(executionId, executor.getRunStatus().getValue(),
                    "Workflow execution already finished");
        }
        return new OperationResponse(executionId, RunStatus.PAUSED.getValue(), "Workflow execution paused");
    }

    public OperationResponse resumeExecution(String executionId) {
        Optional<Execution> execution = findExecution(executionId);
        if (execution.isEmpty()) {
            return OperationResponse.notFound(executionId);
        }
        WorkflowExecutor executor = execution.get().getExecutor();
        synchronized (execution.get()) {
            if (executor.getRunStatus() != RunStatus.PAUSED || !execution.get().isIdle()) {
                return new OperationResponse(executionId, executor.getRunStatus().getValue(), "Workflow is not paused");
            }
            execution.get().track(CompletableFuture.supplyAsync(executor::resume, runner));
        }
        return new OperationResponse(executionId, RunStatus.RUNNING.getValue(), "Workflow execution resumed");
    }

    /**
     * 等待当前这一段执行结束 (完成、失败、暂停或停止)
     */
    public ExecutionStatusResponse awaitExecution(String executionId, long timeout, TimeUnit unit)
            throws InterruptedException, TimeoutException {
        Optional<Execution> execution = findExecution(executionId);
        if (execution.isEmpty()) {
            return ExecutionStatusResponse.notFound(executionId);
        }
        try {
            execution.get().getRunning().get(timeout, unit);
        } catch (ExecutionException e) {
            // 失败原因已经记录在节点状态里
            log.debug("Execution {} ended with error: {}", executionId, e.getCause().getMessage());
        }
        return getExecutionStatus(executionId);
    }

    public Optional<WorkflowExecutor> getExecutor(String executionId) {
        return findExecution(executionId).map(Execution::getExecutor);
    }

    /**
     * 移除一次运行并清理它的缓存；运行中的不能移除
     */
    public boolean removeExecution(String executionId) {
        Execution execution = executions.get(executionId);
        if (execution == null) {
            return false;
        }
        if (!execution.isIdle()) {
            throw new IllegalStateException("Execution " + executionId + " is still running");
        }
        executions.remove(executionId);
        execution.getExecutor().clearCache();
        return true;
    }

    @Override
    public void close() {
        runner.shutdownNow();
        log.info("Workflow orchestrator closed ({} executions tracked)", executions.size());
    }

    private Optional<Execution> findExecution(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(executions.get(executionId));
    }

    @Getter
    @RequiredArgsConstructor
    private static class Execution {
        private final WorkflowExecutor executor;
        private volatile CompletableFuture<ExecutionStatus> running = CompletableFuture.completedFuture(null);

        void track(CompletableFuture<ExecutionStatus> future) {
            String executionId = executor.getExecutionId();
            this.running = future.whenComplete((status, error) -> {
                if (error != null) {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.error("Execution {} failed: {}", executionId, cause.getMessage());
                }
            });
        }

        boolean isIdle() {
            return running.isDone();
        }
    }
}
