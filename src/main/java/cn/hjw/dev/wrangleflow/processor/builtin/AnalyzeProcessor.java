package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.AnalyzeConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 分析节点：描述性统计或 Pearson 相关系数矩阵
 * default 原样透传输入表，结果放在 result
 */
@Slf4j
public class AnalyzeProcessor extends AbstractNodeProcessor<AnalyzeConfig> {

    public static final String RESULT = "result";

    public AnalyzeProcessor(String nodeId, AnalyzeConfig config) {
        super(nodeId, config);
    }

    @Override
    public List<String> requiredInputs() {
        return List.of(DEFAULT);
    }

    @Override
    public List<String> expectedOutputs() {
        return List.of(DEFAULT, RESULT);
    }

    @Override
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) {
        DataTable table = requireTable(inputs, DEFAULT);
        List<String> columns = resolveColumns(table);
        progress.report(30, "Analyzing " + columns.size() + " columns");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("analysis_type", getConfig().getAnalysisType());
        result.put("row_count", table.getRowCount());
        result.put("columns", columns);
        if ("correlation".equals(getConfig().getAnalysisType())) {
            result.put("correlation_matrix", correlation(table, columns));
        } else {
            result.put("statistics", statistics(table, columns));
        }
        progress.report(75, "Analysis complete");
        log.info("Node [{}] {} analysis over {} columns", getNodeId(), getConfig().getAnalysisType(), columns.size());

        return ProcessorResult.builder()
                .output(DEFAULT, table)
                .output(RESULT, result)
                .build();
    }

    /**
     * 未指定列时取全部数值列；指定的列必须存在且为数值列
     */
    private List<String> resolveColumns(DataTable table) {
        List<String> numeric = table.getNumericColumns();
        List<String> requested = getConfig().getColumns();
        if (requested == null || requested.isEmpty()) {
            return numeric;
        }
        List<String> errors = new ArrayList<>();
        for (String column : requested) {
            if (!table.hasColumn(column)) {
                errors.add("column not found: " + column);
            } else if (!numeric.contains(column)) {
                errors.add("column is not numeric: " + column);
            }
        }
        if (!errors.isEmpty()) {
            throw new DataValidationError("Invalid analysis columns", getNodeId(), getKind(), errors);
        }
        return requested;
    }

    private Map<String, Object> statistics(DataTable table, List<String> columns) {
        Map<String, Object> statistics = new LinkedHashMap<>();
        for (String column : columns) {
            List<Object> raw = table.columnValues(column);
            List<Double> values = Values.numbers(raw);
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("count", values.size());
            stats.put("missing", raw.size() - values.size());
            stats.put("mean", Values.mean(values));
            stats.put("std", Values.std(values));
            stats.put("min", Values.min(values));
            stats.put("max", Values.max(values));
            stats.put("median", Values.median(values));
            statistics.put(column, stats);
        }
        return statistics;
    }

    private Map<String, Object> correlation(DataTable table, List<String> columns) {
        if (columns.size() < 2) {
            throw new DataValidationError("Correlation requires at least two numeric columns", getNodeId(), getKind(),
                    List.of("numeric columns available: " + columns));
        }
        Map<String, Object> matrix = new LinkedHashMap<>();
        for (String a : columns) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String b : columns) {
                row.put(b, a.equals(b) ? Double.valueOf(1.0) : pearson(table, a, b));
            }
            matrix.put(a, row);
        }
        return matrix;
    }

    /**
     * 只用两列都有值的行；方差为 0 时无定义，返回 null
     */
    static Double pearson(DataTable table, String a, String b) {
        List<double[]> pairs = table.getRows().stream()
                .map(r -> new Double[]{Values.toDouble(r.get(a)), Values.toDouble(r.get(b))})
                .filter(p -> p[0] != null && p[1] != null)
                .map(p -> new double[]{p[0], p[1]})
                .collect(Collectors.toList());
        int n = pairs.size();
        if (n < 2) {
            return null;
        }
        double meanA = pairs.stream().mapToDouble(p -> p[0]).average().orElse(0);
        double meanB = pairs.stream().mapToDouble(p -> p[1]).average().orElse(0);
        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (double[] p : pairs) {
            double da = p[0] - meanA;
            double db = p[1] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }
        if (varA == 0 || varB == 0) {
            return null;
        }
        return cov / Math.sqrt(varA * varB);
    }
}
