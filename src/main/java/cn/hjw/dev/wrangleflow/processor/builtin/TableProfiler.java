package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.model.DataTable;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 生成表格概况，作为数据源和转换节点的 profile 输出
 */
final class TableProfiler {

    private TableProfiler() {
    }

    static Map<String, Object> profile(DataTable table) {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("row_count", table.getRowCount());
        profile.put("column_count", table.getColumnCount());
        profile.put("columns", table.getColumns());

        Map<String, Object> types = new LinkedHashMap<>();
        Map<String, Object> missing = new LinkedHashMap<>();
        Map<String, Object> unique = new LinkedHashMap<>();
        for (String column : table.getColumns()) {
            List<Object> values = table.columnValues(column);
            types.put(column, inferType(values));
            missing.put(column, values.stream().filter(Objects::isNull).count());
            unique.put(column, new HashSet<>(values).stream().filter(Objects::nonNull).count());
        }
        profile.put("dtypes", types);
        profile.put("missing_values", missing);
        profile.put("unique_values", unique);

        Map<String, Object> numeric = new LinkedHashMap<>();
        for (String column : table.getNumericColumns()) {
            List<Double> numbers = Values.numbers(table.columnValues(column));
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("mean", Values.mean(numbers));
            stats.put("median", Values.median(numbers));
            stats.put("std", Values.std(numbers));
            stats.put("min", Values.min(numbers));
            stats.put("max", Values.max(numbers));
            numeric.put(column, stats);
        }
        profile.put("numeric_summary", numeric);
        return profile;
    }

    private static String inferType(List<Object> values) {
        String type = null;
        for (Object v : values) {
            if (v == null) {
                continue;
            }
            String current;
            if (Values.isIntegral(v)) {
                current = "integer";
            } else if (v instanceof Number) {
                current = "float";
            } else if (v instanceof Boolean) {
                current = "boolean";
            } else {
                current = "string";
            }
            if (type == null) {
                type = current;
            } else if (!type.equals(current)) {
                if (isNumericType(type) && isNumericType(current)) {
                    type = "float";
                } else {
                    return "mixed";
                }
            }
        }
        return type == null ? "empty" : type;
    }

    private static boolean isNumericType(String type) {
        return "integer".equals(type) || "float".equals(type);
    }
}
