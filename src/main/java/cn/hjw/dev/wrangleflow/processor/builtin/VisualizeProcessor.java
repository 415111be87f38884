package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.VisualizeConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 可视化节点
 * 不负责渲染，只产出与渲染器无关的图表描述 (image) 和元信息 (metadata)
 */
@Slf4j
public class VisualizeProcessor extends AbstractNodeProcessor<VisualizeConfig> {

    public static final String IMAGE = "image";
    public static final String METADATA = "metadata";

    public VisualizeProcessor(String nodeId, VisualizeConfig config) {
        super(nodeId, config);
    }

    @Override
    public List<String> requiredInputs() {
        return List.of(DEFAULT);
    }

    @Override
    public List<String> expectedOutputs() {
        return List.of(DEFAULT, IMAGE, METADATA);
    }

    @Override
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) {
        VisualizeConfig config = getConfig();
        DataTable table = requireTable(inputs, DEFAULT);
        checkColumns(table);
        progress.report(30, "Building " + config.getVisualizationType() + " chart");

        List<Map<String, Object>> series;
        switch (config.getVisualizationType()) {
            case "bar":
            case "pie":
                series = categories(table);
                break;
            case "line":
                series = points(table, true);
                break;
            case "scatter":
                series = points(table, false);
                break;
            case "histogram":
                series = histogram(table);
                break;
            default:
                throw failure("Unsupported visualization type: " + config.getVisualizationType());
        }
        progress.report(70, "Chart data prepared");

        String title = StringUtils.defaultIfBlank(config.getTitle(), defaultTitle());
        Map<String, Object> image = new LinkedHashMap<>();
        image.put("chart_type", config.getVisualizationType());
        image.put("title", title);
        image.put("x_column", config.getXColumn());
        image.put("y_column", config.getYColumn());
        image.put("series", series);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("chart_type", config.getVisualizationType());
        metadata.put("title", title);
        metadata.put("x_column", config.getXColumn());
        metadata.put("y_column", config.getYColumn());
        metadata.put("row_count", table.getRowCount());
        metadata.put("point_count", series.size());
        log.info("Node [{}] built {} chart with {} points", getNodeId(), config.getVisualizationType(), series.size());

        return ProcessorResult.builder()
                .output(DEFAULT, table)
                .output(IMAGE, image)
                .output(METADATA, metadata)
                .build();
    }

    private void checkColumns(DataTable table) {
        VisualizeConfig config = getConfig();
        List<String> errors = new ArrayList<>();
        if (!table.hasColumn(config.getXColumn())) {
            errors.add("column not found: " + config.getXColumn());
        }
        if (StringUtils.isNotBlank(config.getYColumn()) && !table.hasColumn(config.getYColumn())) {
            errors.add("column not found: " + config.getYColumn());
        }
        if ("histogram".equals(config.getVisualizationType()) && errors.isEmpty()
                && !table.getNumericColumns().contains(config.getXColumn())) {
            errors.add("histogram column is not numeric: " + config.getXColumn());
        }
        if (!errors.isEmpty()) {
            throw new DataValidationError("Invalid chart columns", getNodeId(), getKind(), errors);
        }
    }

    /**
     * bar/pie：按 x 分类；有 y 时对 y 求和，否则计数
     */
    private List<Map<String, Object>> categories(DataTable table) {
        String x = getConfig().getXColumn();
        String y = getConfig().getYColumn();
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Map<String, Object> row : table.getRows()) {
            String label = String.valueOf(row.get(x));
            double increment;
            if (StringUtils.isBlank(y)) {
                increment = 1;
            } else {
                Double value = Values.toDouble(row.get(y));
                increment = value == null ? 0 : value;
            }
            totals.merge(label, increment, Double::sum);
        }
        List<Map<String, Object>> series = new ArrayList<>();
        totals.forEach((label, value) -> {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("label", label);
            point.put("value", value);
            series.add(point);
        });
        return series;
    }

    private List<Map<String, Object>> points(DataTable table, boolean sortByX) {
        String x = getConfig().getXColumn();
        String y = getConfig().getYColumn();
        List<Map<String, Object>> series = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            if (row.get(x) == null || row.get(y) == null) {
                continue;
            }
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("x", row.get(x));
            point.put("y", row.get(y));
            series.add(point);
        }
        if (sortByX) {
            series.sort((a, b) -> Values.compare(a.get("x"), b.get("x")));
        }
        return series;
    }

    /**
     * 等宽分箱，最后一个箱包含右端点
     */
    private List<Map<String, Object>> histogram(DataTable table) {
        List<Double> values = Values.numbers(table.columnValues(getConfig().getXColumn()));
        List<Map<String, Object>> series = new ArrayList<>();
        if (values.isEmpty()) {
            return series;
        }
        int bins = getConfig().getBins();
        double min = Values.min(values);
        double max = Values.max(values);
        double width = max > min ? (max - min) / bins : 1.0;
        long[] counts = new long[bins];
        for (double v : values) {
            int bin = (int) ((v - min) / width);
            counts[Math.min(Math.max(bin, 0), bins - 1)]++;
        }
        for (int i = 0; i < bins; i++) {
            Map<String, Object> bucket = new LinkedHashMap<>();
            bucket.put("bin_start", min + i * width);
            bucket.put("bin_end", min + (i + 1) * width);
            bucket.put("count", counts[i]);
            series.add(bucket);
        }
        return series;
    }

    private String defaultTitle() {
        VisualizeConfig config = getConfig();
        if (StringUtils.isBlank(config.getYColumn())) {
            return StringUtils.capitalize(config.getVisualizationType()) + " of " + config.getXColumn();
        }
        return StringUtils.capitalize(config.getVisualizationType()) + " of " + config.getYColumn()
                + " by " + config.getXColumn();
    }
}
