package cn.hjw.dev.wrangleflow.model;

import cn.hjw.dev.wrangleflow.config.NodeConfig;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 编译后的节点，运行开始后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class WorkflowNode {

    private final String id;
    private final NodeKind kind;
    private final NodeConfig config;
}
