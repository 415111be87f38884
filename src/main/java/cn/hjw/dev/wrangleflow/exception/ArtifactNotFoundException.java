package cn.hjw.dev.wrangleflow.exception;

import lombok.Getter;

@Getter
public class ArtifactNotFoundException extends RuntimeException {

    private final String dataId;

    public ArtifactNotFoundException(String dataId) {
        super("Data with ID " + dataId + " not found in cache");
        this.dataId = dataId;
    }
}
