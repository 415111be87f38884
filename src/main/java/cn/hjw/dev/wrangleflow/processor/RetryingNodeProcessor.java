package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.config.RetryPolicy;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 按节点的 RetryPolicy 重试 execute 阶段，哪些异常可以重试由策略决定
 * 每次重试前上报一条进度消息，进度值保持不变
 */
@Slf4j
@RequiredArgsConstructor
public class RetryingNodeProcessor implements NodeProcessor {

    private final NodeProcessor delegate;
    private final RetryPolicy policy;

    @Override
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception {
        int totalAttempts = policy.getTotalAttempts();
        // 记住处理器已经报到的进度，重试提示不能让进度回退
        double[] reached = {0};
        ProgressReporter tracking = (value, message) -> {
            reached[0] = Math.max(reached[0], value);
            progress.report(value, message);
        };

        for (int attempt = 1; ; attempt++) {
            try {
                return delegate.execute(inputs, tracking);
            } catch (Exception e) {
                if (!policy.isRetryable(e) || attempt >= totalAttempts) {
                    if (attempt > 1) {
                        log.error("Node [{}] gave up after {} attempts: {}", delegate.getNodeId(), attempt, e.getMessage());
                    }
                    throw e;
                }
                log.warn("Node [{}] attempt {}/{} failed: {}", delegate.getNodeId(), attempt, totalAttempts, e.getMessage());
                progress.report(reached[0], "Retrying after failure (attempt " + (attempt + 1) + " of " + totalAttempts + ")");
                pauseBeforeRetry();
            }
        }
    }

    private void pauseBeforeRetry() throws InterruptedException {
        if (policy.getBackoffMs() > 0) {
            TimeUnit.MILLISECONDS.sleep(policy.getBackoffMs());
        }
    }

    @Override
    public String getNodeId() {
        return delegate.getNodeId();
    }

    @Override
    public NodeKind getKind() {
        return delegate.getKind();
    }

    @Override
    public List<String> requiredInputs() {
        return delegate.requiredInputs();
    }

    @Override
    public List<String> expectedOutputs() {
        return delegate.expectedOutputs();
    }

    @Override
    public void validateInputs(Map<String, Object> inputs) {
        delegate.validateInputs(inputs);
    }

    @Override
    public void validateOutputs(ProcessorResult result) {
        delegate.validateOutputs(result);
    }

    NodeProcessor getDelegate() {
        return delegate;
    }
}
