package cn.hjw.dev.wrangleflow.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 节点类型 (封闭集合)
 */
@Getter
@RequiredArgsConstructor
public enum NodeKind {

    SOURCE("data_source", List.of("source", "datasource")),
    TRANSFORM("data_transformation", List.of("transform", "transformation")),
    ANALYZE("analysis", List.of("analyze", "analyse")),
    VISUALIZE("visualization", List.of("visualize", "visualisation")),
    EXPORT("export", List.of());

    // 提交报文里的类型标识
    private final String type;
    private final List<String> aliases;

    public static Optional<NodeKind> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.type.equals(normalized)
                        || k.name().toLowerCase(Locale.ROOT).equals(normalized)
                        || k.aliases.contains(normalized))
                .findFirst();
    }
}
