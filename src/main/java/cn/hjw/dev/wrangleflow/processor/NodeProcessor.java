package cn.hjw.dev.wrangleflow.processor;

import cn.hjw.dev.wrangleflow.model.NodeKind;

import java.util.List;
import java.util.Map;

/**
 * 节点处理器
 * 每次调用无状态；生命周期固定为 校验输入 -> 执行 -> 校验输出，由执行器的 NodeProcessInvoker 串起来
 */
public interface NodeProcessor {

    String getNodeId();

    NodeKind getKind();

    /**
     * 必需的输入名 (targetHandle)
     */
    List<String> requiredInputs();

    /**
     * 必须产出的输出名
     */
    List<String> expectedOutputs();

    /**
     * 校验输入
     * @param inputs 按 targetHandle 组织的上游数据
     * @throws cn.hjw.dev.wrangleflow.exception.DataValidationError 校验失败
     */
    void validateInputs(Map<String, Object> inputs);

    /**
     * 执行节点逻辑
     * @param inputs   上游数据
     * @param progress 进度上报 (执行阶段应落在 10~80 之间)
     * @return 命名输出
     * @throws Exception 执行异常，统一由执行器包装
     */
    ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception;

    /**
     * 校验输出
     * @throws cn.hjw.dev.wrangleflow.exception.DataValidationError 缺少声明的输出
     */
    void validateOutputs(ProcessorResult result);
}
