package cn.hjw.dev.wrangleflow.executor;

import cn.hjw.dev.wrangleflow.compile.ExecutionPlan;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * 节点失败后是否终止整次运行
 * stopOnError 为 true 时，只要失败节点还有尚未开始的直接下游就判定为致命；
 * 已执行、已失败、正在执行的下游不计入
 */
@RequiredArgsConstructor
public class ContinuationPolicy {

    private final ExecutionPlan plan;
    private final boolean stopOnError;

    public boolean isFatal(String failedNodeId, Set<String> executed, Set<String> failed, Set<String> inFlight) {
        if (!stopOnError) {
            return false;
        }
        return plan.getChildren(failedNodeId).stream()
                .anyMatch(child -> !executed.contains(child) && !failed.contains(child) && !inFlight.contains(child));
    }
}
