package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.compile.ExecutionPlan;
import cn.hjw.dev.wrangleflow.config.ExecutionConfig;
import cn.hjw.dev.wrangleflow.exception.ArtifactStorageException;
import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import cn.hjw.dev.wrangleflow.exception.WorkflowExecutionError;
import cn.hjw.dev.wrangleflow.hook.ExecutionListener;
import cn.hjw.dev.wrangleflow.model.WorkflowNode;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.NodeProcessor;
import cn.hjw.dev.wrangleflow.processor.NodeProcessorRegistry;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.store.DataStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单次运行的执行器
 * 协调线程按拓扑序派发依赖已满足的节点：maxParallelNodes 为 1 时在调用线程上逐个执行，
 * 大于 1 时提交到线程池，同时最多 maxParallelNodes 个；节点输出统一由协调线程写入 DataStore
 * 暂停/停止只在派发前检查，已经开始的节点总会执行完
 */
@Slf4j
public class WorkflowExecutor {

    @Getter
    private final String executionId;
    @Getter
    private final ExecutionPlan plan;
    private final NodeProcessorRegistry registry;
    private final ExecutionConfig config;
    @Getter
    private final DataStore dataStore;
    private final NodeProcessInvoker invoker = new NodeProcessInvoker();
    private final ContinuationPolicy continuationPolicy;

    // 声明顺序
    private final Map<String, NodeState> nodeStates = new LinkedHashMap<>();
    private final Set<String> executedNodes = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<String> failedNodes = Collections.synchronizedSet(new LinkedHashSet<>());

    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    private volatile RunStatus status = RunStatus.INITIALIZED;
    private volatile String currentNodeId;
    private volatile Instant startTime;
    private volatile Instant endTime;

    public WorkflowExecutor(String executionId, ExecutionPlan plan, NodeProcessorRegistry registry,
                            ExecutionConfig config) {
        this(executionId, plan, registry, config, new DataStore(executionId, config));
    }

    public WorkflowExecutor(String executionId, ExecutionPlan plan, NodeProcessorRegistry registry,
                            ExecutionConfig config, DataStore dataStore) {
        this.executionId = executionId;
        this.plan = plan;
        this.registry = registry;
        this.config = config;
        this.dataStore = dataStore;
        this.continuationPolicy = new ContinuationPolicy(plan, config.isStopOnError());
        plan.getGraph().getNodes().values()
                .forEach(n -> nodeStates.put(n.getId(), new NodeState(n.getId(), n.getKind())));
    }

    /**
     * 开始执行，只能调用一次
     * @return 本次调用结束时的状态 (completed / completed_with_errors / paused / stopped)
     * @throws WorkflowExecutionError 节点失败且续跑策略判定为致命
     */
    public ExecutionStatus execute() {
        synchronized (this) {
            if (status != RunStatus.INITIALIZED) {
                throw new IllegalStateException("Execution " + executionId + " has already been started (status: "
                        + status.getValue() + ")");
            }
            startTime = Instant.now();
            transition(RunStatus.PLANNING);
        }
        log.info("Execution order for workflow {}: {}", plan.getWorkflowId(), plan.getTopologicalOrder());

        for (String nodeId : plan.getTopologicalOrder()) {
            NodeState state = nodeStates.get(nodeId);
            state.assign(assignWorker(plan.getNode(nodeId)));
            notifyNode(state);
        }

        synchronized (this) {
            if (status.isTerminal()) {
                // 规划期间被 stop
                return getStatus();
            }
            transition(RunStatus.RUNNING);
        }
        return run();
    }

    /**
     * 从暂停处继续，已执行和已失败的节点不会重跑
     */
    public ExecutionStatus resume() {
        synchronized (this) {
            if (status != RunStatus.PAUSED) {
                throw new IllegalStateException("Execution " + executionId + " is not paused (status: "
                        + status.getValue() + ")");
            }
            pauseRequested.set(false);
            transition(RunStatus.RUNNING);
        }
        log.info("Resuming workflow {} (execution {})", plan.getWorkflowId(), executionId);
        return run();
    }

    /**
     * 请求暂停，在下一次派发前生效
     * @return 运行已结束时返回 false
     */
    public synchronized boolean pause() {
        if (status.isTerminal()) {
            return false;
        }
        pauseRequested.set(true);
        log.info("Workflow {} paused (execution {})", plan.getWorkflowId(), executionId);
        return true;
    }

    /**
     * 请求停止；未在运行 (初始化或暂停) 时立即进入 stopped，停止后不能再 resume
     * @return 运行已结束，或所有节点都已结束只差收尾时返回 false
     */
    public synchronized boolean stop() {
        if (status.isTerminal() || (status == RunStatus.RUNNING && allNodesFinished())) {
            return false;
        }
        stopRequested.set(true);
        if (status == RunStatus.INITIALIZED || status == RunStatus.PAUSED) {
            endTime = Instant.now();
            transition(RunStatus.STOPPED);
        }
        log.info("Workflow {} stop requested (execution {})", plan.getWorkflowId(), executionId);
        return true;
    }

    public ExecutionStatus getStatus() {
        Map<String, NodeStatusView> nodes = new LinkedHashMap<>();
        double total = 0;
        for (NodeState state : nodeStates.values()) {
            NodeStatusView view = state.snapshot();
            nodes.put(state.getNodeId(), view);
            total += view.getProgress();
        }
        double progress = nodeStates.isEmpty() ? 0 : Math.max(0, Math.min(100, total / nodeStates.size()));

        Instant start = startTime;
        Instant end = endTime;
        Double elapsed = null;
        if (start != null) {
            elapsed = Duration.between(start, end != null ? end : Instant.now()).toMillis() / 1000.0;
        }
        List<String> executed;
        synchronized (executedNodes) {
            executed = new ArrayList<>(executedNodes);
        }
        List<String> failed;
        synchronized (failedNodes) {
            failed = new ArrayList<>(failedNodes);
        }
        return ExecutionStatus.builder()
                .executionId(executionId)
                .workflowId(plan.getWorkflowId())
                .status(status)
                .progress(progress)
                .currentNodeId(currentNodeId)
                .startTime(start)
                .endTime(end)
                .executionTimeSeconds(elapsed)
                .executedNodes(executed)
                .failedNodes(failed)
                .nodeStatuses(nodes)
                .build();
    }

    public RunStatus getRunStatus() {
        return status;
    }

    /**
     * 读取节点输出
     * @throws cn.hjw.dev.wrangleflow.exception.ArtifactNotFoundException 输出不存在
     */
    public Object getNodeResult(String nodeId, String outputName) {
        return dataStore.get(nodeId, outputName);
    }

    public Object getNodeResult(String nodeId) {
        return getNodeResult(nodeId, AbstractNodeProcessor.DEFAULT);
    }

    public void clearCache() {
        dataStore.clear();
    }

    public void clearCache(Collection<String> nodeIds) {
        dataStore.clear(nodeIds);
    }

    // --- 调度循环 ---

    private ExecutionStatus run() {
        List<String> order = plan.getTopologicalOrder();
        int parallelism = Math.max(1, config.getMaxParallelNodes());

        ExecutorService ownPool = null;
        Executor executor;
        if (parallelism == 1) {
            executor = Runnable::run;
        } else if (config.getThreadPool() != null) {
            executor = config.getThreadPool();
        } else {
            ownPool = Executors.newFixedThreadPool(parallelism, new BasicThreadFactory.Builder()
                    .namingPattern("wrangleflow-" + executionId + "-%d")
                    .daemon(true)
                    .build());
            executor = ownPool;
        }

        CompletionService<ProcessorResult> completion = new ExecutorCompletionService<>(executor);
        Map<Future<ProcessorResult>, String> inFlight = new LinkedHashMap<>();
        NodeExecutionError fatal = null;
        try {
            while (true) {
                if (fatal == null) {
                    for (String nodeId : order) {
                        if (inFlight.size() >= parallelism || pauseRequested.get() || stopRequested.get()) {
                            break;
                        }
                        if (isFinished(nodeId) || inFlight.containsValue(nodeId) || !isReady(nodeId)) {
                            continue;
                        }
                        currentNodeId = nodeId;
                        inFlight.put(completion.submit(nodeTask(nodeId)), nodeId);
                    }
                }
                if (inFlight.isEmpty()) {
                    break;
                }

                Future<ProcessorResult> done = completion.take();
                String nodeId = inFlight.remove(done);
                NodeExecutionError error = complete(nodeId, done);
                if (error != null && fatal == null
                        && continuationPolicy.isFatal(nodeId, executedNodes, failedNodes, new LinkedHashSet<>(inFlight.values()))) {
                    fatal = error;
                    log.error("Workflow {} stops dispatching: node {} failed and has pending dependents",
                            plan.getWorkflowId(), nodeId);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
            log.warn("Execution {} interrupted, {} node(s) still in flight", executionId, inFlight.size());
        } finally {
            if (ownPool != null) {
                ownPool.shutdown();
            }
        }
        return finish(fatal);
    }

    private Callable<ProcessorResult> nodeTask(String nodeId) {
        WorkflowNode node = plan.getNode(nodeId);
        NodeState state = nodeStates.get(nodeId);
        return () -> {
            state.start();
            notifyNode(state);
            log.info("Executing node {} of type {}", nodeId, node.getKind().getType());

            Map<String, Object> inputs = dataStore.getNodeInputs(nodeId, plan.getGraph().incomingEdges(nodeId));
            NodeProcessor processor = registry.create(node);
            return invoker.process(processor, inputs, (progress, message) -> {
                if (state.updateProgress(progress, message)) {
                    notifyNode(state);
                }
            });
        };
    }

    /**
     * 处理一个结束的节点：成功则写入输出，失败则记录错误
     * @return 节点失败时返回对应异常
     */
    private NodeExecutionError complete(String nodeId, Future<ProcessorResult> done) {
        NodeState state = nodeStates.get(nodeId);
        WorkflowNode node = plan.getNode(nodeId);
        NodeExecutionError error;
        try {
            ProcessorResult result = done.get();
            List<String> dataIds = new ArrayList<>();
            result.getOutputs().forEach((name, value) -> dataIds.add(dataStore.store(nodeId, name, value)));
            state.complete(dataIds);
            executedNodes.add(nodeId);
            notifyNode(state);
            log.info("Node {} completed with outputs {}", nodeId, result.getOutputs().keySet());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = extractRealCause(e);
            error = cause instanceof NodeExecutionError
                    ? (NodeExecutionError) cause
                    : new NodeExecutionError("Error processing node: " + cause.getMessage(), nodeId, node.getKind(), cause);
        } catch (ArtifactStorageException e) {
            error = new NodeExecutionError("Failed to store outputs of node " + nodeId + ": " + e.getMessage(),
                    nodeId, node.getKind(), e);
        } catch (InterruptedException e) {
            // done 已经完成，get 不会阻塞
            Thread.currentThread().interrupt();
            error = new NodeExecutionError("Interrupted while collecting node result", nodeId, node.getKind(), e);
        } catch (RuntimeException e) {
            // 存储或收尾阶段的意外异常也只让这个节点失败，不能带出调度循环
            log.error("Unexpected error while completing node {}", nodeId, e);
            error = new NodeExecutionError("Error processing node: " + e.getMessage(), nodeId, node.getKind(), e);
        }
        state.fail(NodeError.from(error));
        failedNodes.add(nodeId);
        notifyNode(state);
        log.error("Error executing node {}: {}", nodeId, error.getMessage());
        return error;
    }

    private ExecutionStatus finish(NodeExecutionError fatal) {
        synchronized (this) {
            if (fatal != null) {
                endTime = Instant.now();
                transition(RunStatus.FAILED);
            } else if (allNodesFinished()) {
                // 最后一个节点结束后才到的 stop 不改变自然完成的结果
                endTime = Instant.now();
                transition(failedNodes.isEmpty() ? RunStatus.COMPLETED : RunStatus.COMPLETED_WITH_ERRORS);
            } else if (stopRequested.get()) {
                endTime = Instant.now();
                transition(RunStatus.STOPPED);
            } else {
                transition(RunStatus.PAUSED);
            }
        }
        ExecutionStatus snapshot = getStatus();
        log.info("Workflow {} execution {} finished as {} in {}s (executed: {}, failed: {})",
                plan.getWorkflowId(), executionId, snapshot.getStatus().getValue(),
                snapshot.getExecutionTimeSeconds(), snapshot.getExecutedNodes(), snapshot.getFailedNodes());

        if (fatal != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", fatal.getMessage());
            details.put("failed_nodes", snapshot.getFailedNodes());
            throw new WorkflowExecutionError("Workflow execution stopped due to error in node "
                    + fatal.getNodeId() + ": " + fatal.getMessage(),
                    plan.getWorkflowId(), executionId, fatal.getNodeId(), details, fatal);
        }
        return snapshot;
    }

    private boolean allNodesFinished() {
        return executedNodes.size() + failedNodes.size() >= nodeStates.size();
    }

    private boolean isFinished(String nodeId) {
        return executedNodes.contains(nodeId) || failedNodes.contains(nodeId);
    }

    /**
     * 上游全部结束 (成功或失败) 即可派发；上游失败时由输入校验决定结果
     */
    private boolean isReady(String nodeId) {
        return plan.getParents(nodeId).stream().allMatch(this::isFinished);
    }

    private String assignWorker(WorkflowNode node) {
        if (config.getWorkerAssigner() == null) {
            return null;
        }
        try {
            return config.getWorkerAssigner().assign(node).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Worker assignment failed for node {}: {}", node.getId(), e.getMessage());
            return null;
        }
    }

    private void transition(RunStatus next) {
        if (status.isTerminal()) {
            return;
        }
        log.debug("Execution {} status {} -> {}", executionId, status.getValue(), next.getValue());
        status = next;
        ExecutionListener listener = config.getListener();
        if (listener != null) {
            double progress = getStatus().getProgress();
            notifySafely(() -> listener.onRunStatusChanged(executionId, next, progress));
        }
    }

    private void notifyNode(NodeState state) {
        ExecutionListener listener = config.getListener();
        if (listener != null) {
            NodeStatusView view = state.snapshot();
            notifySafely(() -> listener.onNodeProgress(executionId, state.getNodeId(), view.getStatus(),
                    view.getProgress(), view.getMessage()));
        }
    }

    private void notifySafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Execution listener failed for execution {}: {}", executionId, e.getMessage(), e);
        }
    }

    /**
     * 剥离包装异常，取得处理器抛出的原始异常
     */
    private static Throwable extractRealCause(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException || cause instanceof ExecutionException) {
            Throwable next = cause.getCause();
            if (next == null) {
                break;
            }
            cause = next;
        }
        return cause;
    }
}
