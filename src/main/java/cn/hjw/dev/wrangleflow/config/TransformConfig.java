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

/**
 * 数据转换节点配置，不同 transformation_type 使用不同字段
 */
@Getter
@ToString
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransformConfig extends AbstractNodeConfig {

    public static final Set<String> TRANSFORMATION_TYPES = Set.of("filter_rows", "filter_columns",
            "rename_columns", "sort", "arithmetic", "handle_missing", "aggregate", "join");
    public static final Set<String> FILTER_OPERATORS = Set.of("==", "!=", ">", ">=", "<", "<=",
            "in", "not in", "contains");
    public static final Set<String> OPERATIONS = Set.of("add", "subtract", "multiply", "divide");
    public static final Set<String> MISSING_STRATEGIES = Set.of("drop", "fill_value", "fill_mean");
    public static final Set<String> AGGREGATIONS = Set.of("sum", "mean", "count", "min", "max");
    public static final Set<String> JOIN_TYPES = Set.of("inner", "left");

    private String transformationType;

    // filter_rows
    private String filterColumn;
    private String filterOperator = "==";
    private Object filterValue;

    // filter_columns / handle_missing
    private List<String> columns;

    // rename_columns
    private Map<String, String> renameMap;

    // sort
    private List<String> sortColumns;
    private boolean ascending = true;

    // arithmetic
    private String inputColumn;
    private String operation;
    private Double operand;
    private String outputColumn;

    // handle_missing
    private String strategy = "drop";
    private Object fillValue;

    // aggregate
    private List<String> groupBy;
    private Map<String, String> aggregations;

    // join
    private List<String> joinOn;
    private String joinHow = "inner";

    private boolean dropNa;

    @Override
    public NodeKind getKind() {
        return NodeKind.TRANSFORM;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!oneOf(TRANSFORMATION_TYPES, transformationType)) {
            errors.add("Unsupported transformation type: " + transformationType);
            return errors;
        }
        switch (transformationType) {
            case "filter_rows":
                if (StringUtils.isBlank(filterColumn)) {
                    errors.add("filter_column is required");
                }
                if (!oneOf(FILTER_OPERATORS, filterOperator)) {
                    errors.add("Unsupported filter operator: " + filterOperator);
                }
                break;
            case "filter_columns":
                if (columns == null || columns.isEmpty()) {
                    errors.add("columns is required");
                }
                break;
            case "rename_columns":
                if (renameMap == null || renameMap.isEmpty()) {
                    errors.add("rename_map is required");
                }
                break;
            case "sort":
                if (sortColumns == null || sortColumns.isEmpty()) {
                    errors.add("sort_columns is required");
                }
                break;
            case "arithmetic":
                if (StringUtils.isBlank(inputColumn)) {
                    errors.add("input_column is required");
                }
                if (!oneOf(OPERATIONS, operation)) {
                    errors.add("Unsupported operation: " + operation);
                }
                if (operand == null) {
                    errors.add("operand is required");
                }
                break;
            case "handle_missing":
                if (!oneOf(MISSING_STRATEGIES, strategy)) {
                    errors.add("Unsupported missing value strategy: " + strategy);
                }
                if ("fill_value".equals(strategy) && fillValue == null) {
                    errors.add("fill_value is required for strategy fill_value");
                }
                break;
            case "aggregate":
                if (aggregations == null || aggregations.isEmpty()) {
                    errors.add("aggregations is required");
                } else {
                    aggregations.forEach((column, fn) -> {
                        if (!oneOf(AGGREGATIONS, fn)) {
                            errors.add("Unsupported aggregation " + fn + " for column " + column);
                        }
                    });
                }
                break;
            case "join":
                if (joinOn == null || joinOn.isEmpty()) {
                    errors.add("join_on is required");
                }
                if (!oneOf(JOIN_TYPES, joinHow)) {
                    errors.add("Unsupported join type: " + joinHow);
                }
                break;
            default:
                break;
        }
        return errors;
    }

    public String resolveOutputColumn() {
        return StringUtils.defaultIfBlank(outputColumn, inputColumn);
    }
}
