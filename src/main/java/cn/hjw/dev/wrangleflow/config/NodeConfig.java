package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * 按节点类型区分的强类型配置
 * 由 {@link NodeConfigParser} 在编译阶段从原始 data 构建并校验
 */
public interface NodeConfig {

    @JsonIgnore
    NodeKind getKind();

    /**
     * 原始配置 (只读)
     */
    Map<String, Object> getRaw();

    RetryPolicy getRetry();

    /**
     * 校验配置
     * @return 错误列表，空表示合法
     */
    List<String> validate();
}
