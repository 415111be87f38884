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
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 数据源节点配置
 */
@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceConfig extends AbstractNodeConfig {

    public static final Set<String> SOURCE_TYPES = Set.of("inline", "file", "uploaded");
    public static final Set<String> FILE_TYPES = Set.of("csv", "json");
    public static final Set<String> RULE_TYPES = Set.of("no_nulls", "unique", "range", "regex");

    private String sourceType = "file";
    private String sourcePath;
    private String fileType = "csv";
    private String delimiter = ",";

    // inline 数据，未配置时从输入 data 读取
    private List<Map<String, Object>> data;

    private Map<String, String> columnRename;
    private List<String> columnsToKeep;
    private Integer rowLimit;

    private boolean validateSchema;
    private ExpectedSchema expectedSchema;
    private boolean validateData;
    private List<ValidationRule> validationRules;

    @Override
    public NodeKind getKind() {
        return NodeKind.SOURCE;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!oneOf(SOURCE_TYPES, sourceType)) {
            errors.add("Unsupported source type: " + sourceType);
        }
        if ("file".equals(sourceType) && StringUtils.isBlank(sourcePath)) {
            errors.add("source_path is required for file sources");
        }
        if (!oneOf(FILE_TYPES, fileType)) {
            errors.add("Unsupported file type: " + fileType);
        }
        if (delimiter == null || delimiter.length() != 1) {
            errors.add("delimiter must be a single character");
        }
        if (rowLimit != null && rowLimit < 0) {
            errors.add("row_limit must not be negative");
        }
        if (validationRules != null) {
            for (ValidationRule rule : validationRules) {
                if (!oneOf(RULE_TYPES, rule.getType())) {
                    errors.add("Unsupported validation rule: " + rule.getType());
                } else if ("regex".equals(rule.getType())) {
                    try {
                        Pattern.compile(StringUtils.defaultString(rule.getPattern()));
                    } catch (PatternSyntaxException e) {
                        errors.add("Invalid regex for column " + rule.getColumn() + ": " + e.getDescription());
                    }
                }
                if (StringUtils.isBlank(rule.getColumn())) {
                    errors.add("Validation rule " + rule.getType() + " has no column");
                }
            }
        }
        return errors;
    }

    /**
     * 该配置下节点需要的输入
     */
    public List<String> requiredInputs() {
        if ("uploaded".equals(sourceType)) {
            return List.of("file_path");
        }
        if ("inline".equals(sourceType) && data == null) {
            return List.of("data");
        }
        return List.of();
    }

    @Getter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ExpectedSchema {
        private List<String> requiredColumns;
    }

    @Getter
    @ToString
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ValidationRule {
        private String type;
        private String column;
        private Double min;
        private Double max;
        private String pattern;
    }
}
