package cn.hjw.dev.wrangleflow.exception;

import lombok.Getter;

/**
 * 中间结果落盘或回读失败
 */
@Getter
public class ArtifactStorageException extends RuntimeException {

    private final String dataId;

    public ArtifactStorageException(String message, String dataId, Exception cause) {
        super(message, cause);
        this.dataId = dataId;
    }
}
