package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class NodeProcessInvokerTest {

    private final NodeProcessInvoker invoker = new NodeProcessInvoker();

    private static ScriptedProcessor processor(String id, ScriptedProcessor.Body body, String... inputs) {
        return new ScriptedProcessor(id, (ScriptedProcessor.Script) ScriptedProcessor.node(id, body, inputs).getConfig());
    }

    /**
     * 场景: 正常执行
     * 预期: 进度依次经过 0/10/处理器自报/80/100
     */
    @Test
    public void testProgressCheckpoints() {
        List<Double> progress = new ArrayList<>();
        ProcessorResult result = invoker.process(processor("n", in -> "done"), Map.of(),
                (value, message) -> progress.add(value));

        Assertions.assertEquals("done", result.get("default"));
        Assertions.assertEquals(List.of(0.0, 10.0, 50.0, 80.0, 100.0), progress);
    }

    @Test
    public void testUnexpectedErrorIsWrapped() {
        NodeExecutionError error = Assertions.assertThrows(NodeExecutionError.class,
                () -> invoker.process(processor("n", in -> {
                    throw new ArithmeticException("overflow");
                }), Map.of(), (value, message) -> {
                }));
        Assertions.assertEquals("Error processing node: overflow", error.getMessage());
        Assertions.assertEquals("n", error.getNodeId());
        Assertions.assertEquals(NodeKind.TRANSFORM, error.getNodeKind());
        Assertions.assertTrue(error.getCause() instanceof ArithmeticException);
    }

    /**
     * 场景: 缺少必需输入
     * 预期: 校验异常原样抛出，处理器不会被执行
     */
    @Test
    public void testValidationErrorPassesThrough() {
        List<String> calls = new ArrayList<>();
        DataValidationError error = Assertions.assertThrows(DataValidationError.class,
                () -> invoker.process(processor("n", in -> calls.add("executed"), "default"), Map.of(),
                        (value, message) -> {
                        }));
        Assertions.assertEquals(List.of("missing required input: default"), error.getValidationErrors());
        Assertions.assertTrue(calls.isEmpty());
    }

    @Test
    public void testInterruptRestoresFlag() {
        try {
            NodeExecutionError error = Assertions.assertThrows(NodeExecutionError.class,
                    () -> invoker.process(processor("n", in -> {
                        throw new InterruptedException("cancelled");
                    }), Map.of(), (value, message) -> {
                    }));
            Assertions.assertEquals("Node processing interrupted", error.getMessage());
            Assertions.assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
