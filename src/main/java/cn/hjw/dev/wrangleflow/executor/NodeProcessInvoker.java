package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import cn.hjw.dev.wrangleflow.processor.NodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 通用的节点处理流程：校验输入 -> 执行 -> 校验输出
 * 进度检查点固定为 0 / 10 / 80 / 100，处理器自己上报的进度应落在 10 和 80 之间
 */
@Slf4j
public class NodeProcessInvoker {

    public ProcessorResult process(NodeProcessor processor, Map<String, Object> inputs, ProgressReporter progress) {
        String nodeId = processor.getNodeId();
        try {
            progress.report(0, "Starting node processing");
            processor.validateInputs(inputs);
            progress.report(10, "Input validation complete");

            ProcessorResult result = processor.execute(inputs, progress);
            if (result == null) {
                // 没有声明输出的汇聚节点允许返回 null，按空输出处理
                result = ProcessorResult.of(Map.of());
            }
            progress.report(80, "Processing complete");

            processor.validateOutputs(result);
            progress.report(100, "Node processing complete");
            return result;
        } catch (NodeExecutionError e) {
            log.error("Node [{}] failed: {}", nodeId, e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionError("Node processing interrupted", nodeId, processor.getKind(), e);
        } catch (Exception e) {
            log.error("Node [{}] failed with unexpected error", nodeId, e);
            throw new NodeExecutionError("Error processing node: " + e.getMessage(), nodeId, processor.getKind(), e);
        }
    }
}
