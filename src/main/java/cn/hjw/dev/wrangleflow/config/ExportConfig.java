package cn.hjw.dev.wrangleflow.config;

import cn.hjw.dev.wrangleflow.model.NodeKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExportConfig extends AbstractNodeConfig {

    public static final Set<String> EXPORT_TYPES = Set.of("memory", "csv", "json");

    private String exportType = "csv";
    private String outputPath;
    private String delimiter = ",";
    private boolean header = true;

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPORT;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!oneOf(EXPORT_TYPES, exportType)) {
            errors.add("Unsupported export type: " + exportType);
        } else if (!"memory".equals(exportType) && StringUtils.isBlank(outputPath)) {
            errors.add("output_path is required for " + exportType + " exports");
        }
        if (delimiter == null || delimiter.length() != 1) {
            errors.add("delimiter must be a single character");
        }
        return errors;
    }
}
