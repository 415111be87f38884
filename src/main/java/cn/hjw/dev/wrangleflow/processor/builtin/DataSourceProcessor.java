package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.JsonMappers;
import cn.hjw.dev.wrangleflow.config.SourceConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 数据源节点：加载 inline 数据或 CSV/JSON 文件，做列整理和数据校验
 */
@Slf4j
public class DataSourceProcessor extends AbstractNodeProcessor<SourceConfig> {

    public static final String PROFILE = "profile";

    private static final ObjectMapper JSON = JsonMappers.defaultMapper();
    private static final CsvMapper CSV = new CsvMapper();

    public DataSourceProcessor(String nodeId, SourceConfig config) {
        super(nodeId, config);
    }

    @Override
    public List<String> requiredInputs() {
        return getConfig().requiredInputs();
    }

    @Override
    public List<String> expectedOutputs() {
        return List.of(DEFAULT, PROFILE);
    }

    @Override
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws Exception {
        SourceConfig config = getConfig();
        progress.report(20, "Loading data from " + config.getSourceType() + " source");

        DataTable table = load(inputs);
        log.info("Node [{}] loaded {} rows, {} columns", getNodeId(), table.getRowCount(), table.getColumnCount());
        progress.report(40, "Loaded " + table.getRowCount() + " rows");

        table = postProcess(table);
        progress.report(60, "Applied column operations");

        if (config.isValidateSchema()) {
            validateSchema(table);
        }
        if (config.isValidateData()) {
            validateData(table);
        }
        progress.report(75, "Validation complete");

        return ProcessorResult.builder()
                .output(DEFAULT, table)
                .output(PROFILE, TableProfiler.profile(table))
                .build();
    }

    private DataTable load(Map<String, Object> inputs) throws IOException {
        SourceConfig config = getConfig();
        switch (config.getSourceType()) {
            case "inline":
                if (config.getData() != null) {
                    return DataTable.of(config.getData());
                }
                return fromInput(inputs.get("data"));
            case "uploaded":
                Object path = inputs.get("file_path");
                if (!(path instanceof String) || StringUtils.isBlank((String) path)) {
                    throw failure("Uploaded source requires a file_path input");
                }
                return readFile((String) path);
            case "file":
                return readFile(config.getSourcePath());
            default:
                throw failure("Unsupported source type: " + config.getSourceType());
        }
    }

    @SuppressWarnings("unchecked")
    private DataTable fromInput(Object data) {
        if (data instanceof DataTable) {
            return (DataTable) data;
        }
        if (data instanceof List) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Object row : (List<Object>) data) {
                if (!(row instanceof Map)) {
                    throw new DataValidationError("Inline data must be a list of records", getNodeId(), getKind(),
                            List.of("unexpected row type: " + (row == null ? "null" : row.getClass().getName())));
                }
                rows.add((Map<String, Object>) row);
            }
            return DataTable.of(rows);
        }
        throw new DataValidationError("Inline data must be a list of records", getNodeId(), getKind(),
                List.of("unexpected data type: " + (data == null ? "null" : data.getClass().getName())));
    }

    private DataTable readFile(String path) throws IOException {
        File file = new File(path);
        if (!file.isFile()) {
            throw failure("File not found: " + path);
        }
        String fileType = getConfig().getFileType();
        String extension = FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
        if ("json".equals(extension)) {
            fileType = "json";
        }
        log.debug("Node [{}] reading {} file {}", getNodeId(), fileType, path);
        if ("json".equals(fileType)) {
            List<Map<String, Object>> rows = JSON.readValue(file, new TypeReference<List<Map<String, Object>>>() {
            });
            return DataTable.of(rows);
        }
        return readCsv(file);
    }

    private DataTable readCsv(File file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(getConfig().getDelimiter().charAt(0));
        List<Map<String, String>> raw;
        try (MappingIterator<Map<String, String>> it = CSV.readerFor(new TypeReference<Map<String, String>>() {
        }).with(schema).readValues(file)) {
            raw = it.readAll();
        }
        List<String> columns = new ArrayList<>();
        raw.forEach(r -> r.keySet().stream().filter(k -> !columns.contains(k)).forEach(columns::add));

        // CSV 里全是文本，按列推断数值类型
        Map<String, Class<?>> columnTypes = new LinkedHashMap<>();
        for (String column : columns) {
            columnTypes.put(column, inferCsvType(raw, column));
        }
        List<Map<String, Object>> rows = new ArrayList<>(raw.size());
        for (Map<String, String> r : raw) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, convertCsvValue(r.get(column), columnTypes.get(column)));
            }
            rows.add(row);
        }
        return new DataTable(columns, rows);
    }

    private static Class<?> inferCsvType(List<Map<String, String>> rows, String column) {
        boolean allLong = true;
        for (Map<String, String> row : rows) {
            String v = StringUtils.trimToNull(row.get(column));
            if (v == null) {
                continue;
            }
            if (!NumberUtils.isCreatable(v)) {
                return String.class;
            }
            if (!isLong(v)) {
                allLong = false;
            }
        }
        return allLong ? Long.class : Double.class;
    }

    private static boolean isLong(String v) {
        try {
            Long.parseLong(v);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static Object convertCsvValue(String value, Class<?> type) {
        String v = StringUtils.trimToNull(value);
        if (v == null) {
            return null;
        }
        if (type == Long.class) {
            return Long.parseLong(v);
        }
        if (type == Double.class) {
            return NumberUtils.createNumber(v).doubleValue();
        }
        return value;
    }

    private DataTable postProcess(DataTable loaded) {
        SourceConfig config = getConfig();
        DataTable table = loaded;
        if (config.getColumnRename() != null && !config.getColumnRename().isEmpty()) {
            table = TableOps.renameColumns(table, config.getColumnRename());
        }
        if (config.getColumnsToKeep() != null && !config.getColumnsToKeep().isEmpty()) {
            List<String> present = table.getColumns();
            List<String> missing = config.getColumnsToKeep().stream()
                    .filter(c -> !present.contains(c))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new DataValidationError("Columns not found: " + missing, getNodeId(), getKind(),
                        missing.stream().map(c -> "column not found: " + c).collect(Collectors.toList()));
            }
            table = TableOps.selectColumns(table, config.getColumnsToKeep());
        }
        if (config.getRowLimit() != null && config.getRowLimit() < table.getRowCount()) {
            table = table.withRows(table.getRows().subList(0, config.getRowLimit()));
        }
        return table;
    }

    private void validateSchema(DataTable table) {
        SourceConfig.ExpectedSchema schema = getConfig().getExpectedSchema();
        if (schema == null || schema.getRequiredColumns() == null) {
            return;
        }
        List<String> errors = schema.getRequiredColumns().stream()
                .filter(c -> !table.hasColumn(c))
                .map(c -> "missing required column: " + c)
                .collect(Collectors.toList());
        if (!errors.isEmpty()) {
            throw new DataValidationError("Schema validation failed", getNodeId(), getKind(), errors);
        }
    }

    private void validateData(DataTable table) {
        List<SourceConfig.ValidationRule> rules = getConfig().getValidationRules();
        if (rules == null || rules.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        for (SourceConfig.ValidationRule rule : rules) {
            String column = rule.getColumn();
            if (!table.hasColumn(column)) {
                errors.add(rule.getType() + ": column not found: " + column);
                continue;
            }
            List<Object> values = table.columnValues(column);
            switch (rule.getType()) {
                case "no_nulls":
                    long nulls = values.stream().filter(v -> v == null).count();
                    if (nulls > 0) {
                        errors.add("no_nulls: column " + column + " has " + nulls + " null values");
                    }
                    break;
                case "unique":
                    Set<Object> seen = new HashSet<>();
                    long duplicates = values.stream().filter(v -> v != null && !seen.add(Values.normalizeKey(v))).count();
                    if (duplicates > 0) {
                        errors.add("unique: column " + column + " has " + duplicates + " duplicate values");
                    }
                    break;
                case "range":
                    long outOfRange = values.stream().filter(v -> v != null && !inRange(v, rule)).count();
                    if (outOfRange > 0) {
                        errors.add("range: column " + column + " has " + outOfRange + " values outside ["
                                + rule.getMin() + ", " + rule.getMax() + "]");
                    }
                    break;
                case "regex":
                    Pattern pattern = Pattern.compile(StringUtils.defaultString(rule.getPattern()));
                    long mismatched = values.stream()
                            .filter(v -> v != null && !pattern.matcher(String.valueOf(v)).matches())
                            .count();
                    if (mismatched > 0) {
                        errors.add("regex: column " + column + " has " + mismatched + " values not matching "
                                + rule.getPattern());
                    }
                    break;
                default:
                    errors.add("unsupported validation rule: " + rule.getType());
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Node [{}] data validation failed: {}", getNodeId(), errors);
            throw new DataValidationError("Data validation failed", getNodeId(), getKind(), errors);
        }
    }

    private static boolean inRange(Object value, SourceConfig.ValidationRule rule) {
        Double d = Values.toDouble(value);
        if (d == null) {
            return false;
        }
        return (rule.getMin() == null || d >= rule.getMin()) && (rule.getMax() == null || d <= rule.getMax());
    }
}
