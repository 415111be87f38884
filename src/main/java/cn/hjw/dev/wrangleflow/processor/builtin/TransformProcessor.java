package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.TransformConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 数据转换节点，按 transformation_type 对 default 输入做一次转换
 * join 额外需要 right 输入
 */
@Slf4j
public class TransformProcessor extends AbstractNodeProcessor<TransformConfig> {

    public static final String PROFILE = "profile";
    public static final String RIGHT = "right";

    public TransformProcessor(String nodeId, TransformConfig config) {
        super(nodeId, config);
    }

    @Override
    public List<String> requiredInputs() {
        if ("join".equals(getConfig().getTransformationType())) {
            return List.of(DEFAULT, RIGHT);
        }
        return List.of(DEFAULT);
    }

    @Override
    public List<String> expectedOutputs() {
        return List.of(DEFAULT, PROFILE);
    }

    @Override
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) {
        TransformConfig config = getConfig();
        DataTable input = requireTable(inputs, DEFAULT);
        progress.report(20, "Applying " + config.getTransformationType());

        DataTable output;
        switch (config.getTransformationType()) {
            case "filter_rows":
                output = filterRows(input);
                break;
            case "filter_columns":
                requireColumns(input, config.getColumns());
                output = TableOps.selectColumns(input, config.getColumns());
                break;
            case "rename_columns":
                requireColumns(input, new ArrayList<>(config.getRenameMap().keySet()));
                output = TableOps.renameColumns(input, config.getRenameMap());
                break;
            case "sort":
                output = sort(input);
                break;
            case "arithmetic":
                output = arithmetic(input);
                break;
            case "handle_missing":
                output = handleMissing(input);
                break;
            case "aggregate":
                output = aggregate(input);
                break;
            case "join":
                output = join(input, requireTable(inputs, RIGHT));
                break;
            default:
                throw failure("Unsupported transformation type: " + config.getTransformationType());
        }
        progress.report(60, "Transformation applied");

        if (config.isDropNa()) {
            output = TableOps.dropNullRows(output, output.getColumns());
        }
        log.info("Node [{}] {}: {} rows -> {} rows", getNodeId(), config.getTransformationType(),
                input.getRowCount(), output.getRowCount());
        progress.report(75, "Generated data profile");

        return ProcessorResult.builder()
                .output(DEFAULT, output)
                .output(PROFILE, TableProfiler.profile(output))
                .build();
    }

    private void requireColumns(DataTable table, List<String> columns) {
        List<String> missing = columns.stream().filter(c -> !table.hasColumn(c)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DataValidationError("Columns not found: " + missing, getNodeId(), getKind(),
                    missing.stream().map(c -> "column not found: " + c).collect(Collectors.toList()));
        }
    }

    private DataTable filterRows(DataTable table) {
        TransformConfig config = getConfig();
        String column = config.getFilterColumn();
        requireColumns(table, List.of(column));
        List<Map<String, Object>> rows = table.getRows().stream()
                .filter(r -> matches(r.get(column), config.getFilterOperator(), config.getFilterValue()))
                .collect(Collectors.toList());
        return table.withRows(rows);
    }

    static boolean matches(Object cell, String operator, Object value) {
        switch (operator) {
            case "==":
                return Values.looselyEquals(cell, value);
            case "!=":
                return !Values.looselyEquals(cell, value);
            case ">":
                return cell != null && Values.compare(cell, value) > 0;
            case ">=":
                return cell != null && Values.compare(cell, value) >= 0;
            case "<":
                return cell != null && Values.compare(cell, value) < 0;
            case "<=":
                return cell != null && Values.compare(cell, value) <= 0;
            case "in":
                return asCollection(value).stream().anyMatch(v -> Values.looselyEquals(cell, v));
            case "not in":
                return asCollection(value).stream().noneMatch(v -> Values.looselyEquals(cell, v));
            case "contains":
                return cell != null && value != null && String.valueOf(cell).contains(String.valueOf(value));
            default:
                throw new IllegalArgumentException("Unsupported filter operator: " + operator);
        }
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        return value == null ? List.of() : List.of(value);
    }

    private DataTable sort(DataTable table) {
        TransformConfig config = getConfig();
        requireColumns(table, config.getSortColumns());
        int direction = config.isAscending() ? 1 : -1;
        Comparator<Map<String, Object>> comparator = null;
        for (String column : config.getSortColumns()) {
            Comparator<Map<String, Object>> byColumn = (r1, r2) -> {
                Object a = r1.get(column);
                Object b = r2.get(column);
                // 空值不论升降序都排在最后
                if (a == null || b == null) {
                    return Values.compare(a, b);
                }
                return direction * Values.compare(a, b);
            };
            comparator = comparator == null ? byColumn : comparator.thenComparing(byColumn);
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.getRows());
        rows.sort(comparator);
        return table.withRows(rows);
    }

    private DataTable arithmetic(DataTable table) {
        TransformConfig config = getConfig();
        String input = config.getInputColumn();
        String output = config.resolveOutputColumn();
        requireColumns(table, List.of(input));

        List<Map<String, Object>> rows = new ArrayList<>(table.getRowCount());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> updated = new LinkedHashMap<>(row);
            updated.put(output, apply(row.get(input), config.getOperation(), config.getOperand()));
            rows.add(updated);
        }
        List<String> columns = new ArrayList<>(table.getColumns());
        if (!columns.contains(output)) {
            columns.add(output);
        }
        return table.withRows(columns, rows);
    }

    /**
     * 整数列和整数操作数做加减乘时结果仍是整数，除法一律得到浮点
     */
    private Object apply(Object cell, String operation, double operand) {
        if (cell == null) {
            return null;
        }
        Double value = Values.toDouble(cell);
        if (value == null) {
            throw new DataValidationError("Non-numeric value in column " + getConfig().getInputColumn() + ": " + cell,
                    getNodeId(), getKind(), List.of("non-numeric value: " + cell));
        }
        boolean wholeOperand = operand == Math.rint(operand) && !Double.isInfinite(operand)
                && Math.abs(operand) <= Long.MAX_VALUE;
        if (Values.isIntegral(cell) && wholeOperand && !"divide".equals(operation)) {
            long a = ((Number) cell).longValue();
            long b = (long) operand;
            try {
                long result;
                switch (operation) {
                    case "add":
                        result = Math.addExact(a, b);
                        break;
                    case "subtract":
                        result = Math.subtractExact(a, b);
                        break;
                    default:
                        result = Math.multiplyExact(a, b);
                        break;
                }
                if (cell instanceof Integer && result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
                    return (int) result;
                }
                return result;
            } catch (ArithmeticException overflow) {
                log.debug("Node [{}] integer overflow on {}, falling back to double", getNodeId(), operation);
            }
        }
        switch (operation) {
            case "add":
                return value + operand;
            case "subtract":
                return value - operand;
            case "multiply":
                return value * operand;
            case "divide":
                if (operand == 0) {
                    throw failure("Division by zero in arithmetic on column " + getConfig().getInputColumn());
                }
                return value / operand;
            default:
                throw failure("Unsupported operation: " + operation);
        }
    }

    private DataTable handleMissing(DataTable table) {
        TransformConfig config = getConfig();
        List<String> columns = config.getColumns() == null || config.getColumns().isEmpty()
                ? table.getColumns() : config.getColumns();
        requireColumns(table, columns);

        switch (config.getStrategy()) {
            case "drop":
                return TableOps.dropNullRows(table, columns);
            case "fill_value":
                return fill(table, columns, column -> config.getFillValue());
            case "fill_mean":
                Map<String, Object> means = new LinkedHashMap<>();
                for (String column : columns) {
                    Double mean = Values.mean(Values.numbers(table.columnValues(column)));
                    if (mean == null) {
                        log.debug("Node [{}] column {} has no numeric values, skipping fill_mean", getNodeId(), column);
                    }
                    means.put(column, mean);
                }
                return fill(table, columns, means::get);
            default:
                throw failure("Unsupported missing value strategy: " + config.getStrategy());
        }
    }

    private static DataTable fill(DataTable table, List<String> columns,
                                  Function<String, Object> filler) {
        List<Map<String, Object>> rows = new ArrayList<>(table.getRowCount());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> filled = new LinkedHashMap<>(row);
            for (String column : columns) {
                if (filled.get(column) == null) {
                    filled.put(column, filler.apply(column));
                }
            }
            rows.add(filled);
        }
        return table.withRows(rows);
    }

    private DataTable aggregate(DataTable table) {
        TransformConfig config = getConfig();
        List<String> groupBy = config.getGroupBy() == null ? List.of() : config.getGroupBy();
        requireColumns(table, groupBy);
        requireColumns(table, new ArrayList<>(config.getAggregations().keySet()));

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : table.getRows()) {
            List<Object> key = new ArrayList<>(groupBy.size());
            for (String column : groupBy) {
                key.add(Values.normalizeKey(row.get(column)));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<String> columns = new ArrayList<>(groupBy);
        config.getAggregations().keySet().stream().filter(c -> !columns.contains(c)).forEach(columns::add);

        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        for (List<Map<String, Object>> members : groups.values()) {
            Map<String, Object> out = new LinkedHashMap<>();
            Map<String, Object> first = members.get(0);
            for (String column : groupBy) {
                out.put(column, first.get(column));
            }
            config.getAggregations().forEach((column, fn) -> out.put(column, aggregateColumn(members, column, fn)));
            rows.add(out);
        }
        return new DataTable(columns, rows);
    }

    private Object aggregateColumn(List<Map<String, Object>> rows, String column, String fn) {
        List<Object> values = rows.stream().map(r -> r.get(column)).filter(v -> v != null).collect(Collectors.toList());
        switch (fn) {
            case "count":
                return (long) values.size();
            case "sum":
                if (values.stream().allMatch(Values::isIntegral)) {
                    return values.stream().mapToLong(v -> ((Number) v).longValue()).sum();
                }
                return Values.numbers(values).stream().mapToDouble(Double::doubleValue).sum();
            case "mean":
                return Values.mean(Values.numbers(values));
            case "min":
                return values.stream().min(Values.NATURAL_ORDER).orElse(null);
            case "max":
                return values.stream().max(Values.NATURAL_ORDER).orElse(null);
            default:
                throw failure("Unsupported aggregation: " + fn);
        }
    }

    private DataTable join(DataTable left, DataTable right) {
        TransformConfig config = getConfig();
        List<String> keys = config.getJoinOn();
        requireColumns(left, keys);
        List<String> missingRight = keys.stream().filter(k -> !right.hasColumn(k)).collect(Collectors.toList());
        if (!missingRight.isEmpty()) {
            throw new DataValidationError("Join columns not found in right input: " + missingRight, getNodeId(),
                    getKind(), missingRight.stream().map(c -> "right column not found: " + c).collect(Collectors.toList()));
        }

        // 右表非键列，与左表重名的加 _right 后缀
        Map<String, String> rightColumns = new LinkedHashMap<>();
        for (String column : right.getColumns()) {
            if (!keys.contains(column)) {
                rightColumns.put(column, left.hasColumn(column) ? column + "_right" : column);
            }
        }
        List<String> columns = new ArrayList<>(left.getColumns());
        columns.addAll(rightColumns.values());

        Map<List<Object>, List<Map<String, Object>>> index = new LinkedHashMap<>();
        for (Map<String, Object> row : right.getRows()) {
            List<Object> key = joinKey(row, keys);
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        boolean leftJoin = "left".equals(config.getJoinHow());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : left.getRows()) {
            List<Object> key = joinKey(row, keys);
            List<Map<String, Object>> matches = key == null ? List.of() : index.getOrDefault(key, List.of());
            if (matches.isEmpty()) {
                if (leftJoin) {
                    Map<String, Object> out = new LinkedHashMap<>(row);
                    rightColumns.values().forEach(c -> out.put(c, null));
                    rows.add(out);
                }
                continue;
            }
            for (Map<String, Object> match : matches) {
                Map<String, Object> out = new LinkedHashMap<>(row);
                rightColumns.forEach((source, target) -> out.put(target, match.get(source)));
                rows.add(out);
            }
        }
        return new DataTable(columns, rows);
    }

    private static List<Object> joinKey(Map<String, Object> row, List<String> keys) {
        List<Object> key = new ArrayList<>(keys.size());
        for (String column : keys) {
            Object value = row.get(column);
            if (value == null) {
                return null;
            }
            key.add(Values.normalizeKey(value));
        }
        return key;
    }
}
