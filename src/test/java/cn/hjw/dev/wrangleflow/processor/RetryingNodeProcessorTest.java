package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.config.RetryPolicy;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class RetryingNodeProcessorTest {

    /**
     * 执行前 failures 次抛出 failure，之后返回 ok
     */
    private static class FlakyProcessor implements NodeProcessor {
        private final AtomicInteger calls = new AtomicInteger();
        private final int failures;
        private final Exception failure;

        FlakyProcessor(int failures, Exception failure) {
            this.failures = failures;
            this.failure = failure;
        }

        @Override
        public String getNodeId() {
            return "flaky";
        }

        @Override
        public NodeKind getKind() {
            return NodeKind.SOURCE;
        }

        @Override
        public List<String> requiredInputs() {
            return List.of();
        }

        @Override
        public List<String> expectedOutputs() {
            return List.of("default");
        }

        @Override
        public void validateInputs(Map<String, Object> inputs) {
        }

        @Override
        public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception {
            if (calls.incrementAndGet() <= failures) {
                throw failure;
            }
            return ProcessorResult.builder().output("default", "ok").build();
        }

        @Override
        public void validateOutputs(ProcessorResult result) {
        }
    }

    /**
     * 场景: 前两次执行抛出 IOException，max_retries=2
     * 预期: 第三次成功，共调用 3 次
     */
    @Test
    public void testTransientFailureRecovers() throws Exception {
        FlakyProcessor flaky = new FlakyProcessor(2, new IOException("connection reset"));
        RetryingNodeProcessor processor = new RetryingNodeProcessor(flaky, RetryPolicy.of(2, 1));

        ProcessorResult result = processor.execute(Map.of(), ProgressReporter.NOOP);
        Assertions.assertEquals("ok", result.get("default"));
        Assertions.assertEquals(3, flaky.calls.get());
    }

    @Test
    public void testRetriesExhausted() {
        FlakyProcessor flaky = new FlakyProcessor(5, new IOException("connection reset"));
        RetryingNodeProcessor processor = new RetryingNodeProcessor(flaky, RetryPolicy.of(2, 0));

        IOException error = Assertions.assertThrows(IOException.class,
                () -> processor.execute(Map.of(), ProgressReporter.NOOP));
        Assertions.assertEquals("connection reset", error.getMessage());
        Assertions.assertEquals(3, flaky.calls.get());
    }

    /**
     * 场景: 数据校验失败
     * 预期: 确定性错误不重试
     */
    @Test
    public void testValidationErrorIsNotRetried() {
        DataValidationError invalid = new DataValidationError("bad data", "flaky", NodeKind.SOURCE, List.of("bad"));
        FlakyProcessor flaky = new FlakyProcessor(5, invalid);
        RetryingNodeProcessor processor = new RetryingNodeProcessor(flaky, RetryPolicy.of(3, 0));

        Assertions.assertSame(invalid, Assertions.assertThrows(DataValidationError.class,
                () -> processor.execute(Map.of(), ProgressReporter.NOOP)));
        Assertions.assertEquals(1, flaky.calls.get());
    }

    @Test
    public void testDelegatesMetadata() {
        FlakyProcessor flaky = new FlakyProcessor(0, null);
        RetryingNodeProcessor processor = new RetryingNodeProcessor(flaky, RetryPolicy.of(1, 0));
        Assertions.assertEquals("flaky", processor.getNodeId());
        Assertions.assertEquals(NodeKind.SOURCE, processor.getKind());
        Assertions.assertEquals(List.of("default"), processor.expectedOutputs());
        Assertions.assertSame(flaky, processor.getDelegate());
    }

    /**
     * 场景: 第一次执行先报到 40 再失败，max_retries=1
     * 预期: 重试前上报一条提示，进度值停在 40 不回退；策略把 IOException 视为可重试
     */
    @Test
    public void testRetryReportsAttemptWithoutRegressingProgress() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        FlakyProcessor flaky = new FlakyProcessor(1, new IOException("timeout")) {
            @Override
            public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception {
                if (calls.incrementAndGet() == 1) {
                    progress.report(40, "Half way");
                }
                return super.execute(inputs, progress);
            }
        };
        RetryPolicy policy = RetryPolicy.of(1, 0);
        RetryingNodeProcessor processor = new RetryingNodeProcessor(flaky, policy);
        List<String> reports = new ArrayList<>();

        processor.execute(Map.of(), (value, message) -> reports.add(value + ":" + message));

        Assertions.assertEquals(List.of("40.0:Half way", "40.0:Retrying after failure (attempt 2 of 2)"), reports);
        Assertions.assertEquals(2, policy.getTotalAttempts());
        Assertions.assertTrue(policy.isRetryable(new IOException("timeout")));
    }
}
