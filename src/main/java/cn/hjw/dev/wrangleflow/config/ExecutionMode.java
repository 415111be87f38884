package cn.hjw.dev.wrangleflow.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum ExecutionMode {

    SEQUENTIAL("sequential", 1),
    PARALLEL("parallel", 4);

    private final String value;
    private final int defaultParallelism;

    public static ExecutionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SEQUENTIAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExecutionMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported execution_mode: " + value);
    }
}
