package cn.hjw.dev.wrangleflow.processor;

/**
 * 节点进度上报
 */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NOOP = (progress, message) -> {
    };

    /**
     * @param progress 进度 [0,100]
     * @param message  进度说明
     */
    void report(double progress, String message);
}
