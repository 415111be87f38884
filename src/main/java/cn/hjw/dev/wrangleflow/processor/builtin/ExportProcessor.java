package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.ExportConfig;
import cn.hjw.dev.wrangleflow.config.JsonMappers;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.processor.AbstractNodeProcessor;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 导出节点：memory 只汇报，csv/json 写到 output_path
 */
@Slf4j
public class ExportProcessor extends AbstractNodeProcessor<ExportConfig> {

    public static final String RESULT = "result";

    private static final ObjectMapper JSON = JsonMappers.defaultMapper();
    private static final CsvMapper CSV = new CsvMapper();

    public ExportProcessor(String nodeId, ExportConfig config) {
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
    public ProcessorResult execute(Map<String, Object> inputs, ProgressReporter progress) throws IOException {
        ExportConfig config = getConfig();
        DataTable table = requireTable(inputs, DEFAULT);
        progress.report(30, "Exporting " + table.getRowCount() + " rows as " + config.getExportType());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("export_type", config.getExportType());
        result.put("row_count", table.getRowCount());
        result.put("column_count", table.getColumnCount());

        switch (config.getExportType()) {
            case "memory":
                break;
            case "csv":
                result.put("path", writeCsv(table, new File(config.getOutputPath())));
                break;
            case "json":
                result.put("path", writeJson(table, new File(config.getOutputPath())));
                break;
            default:
                throw failure("Unsupported export type: " + config.getExportType());
        }
        progress.report(75, "Export complete");
        log.info("Node [{}] exported {} rows ({})", getNodeId(), table.getRowCount(), config.getExportType());

        return ProcessorResult.builder()
                .output(DEFAULT, table)
                .output(RESULT, result)
                .build();
    }

    private String writeCsv(DataTable table, File file) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder()
                .setColumnSeparator(getConfig().getDelimiter().charAt(0))
                .setUseHeader(getConfig().isHeader());
        table.getColumns().forEach(builder::addColumn);
        FileUtils.forceMkdirParent(file);
        try (SequenceWriter writer = CSV.writerFor(Map.class).with(builder.build()).writeValues(file)) {
            writer.writeAll(table.getRows());
        }
        return file.getAbsolutePath();
    }

    private String writeJson(DataTable table, File file) throws IOException {
        FileUtils.forceMkdirParent(file);
        JSON.writerWithDefaultPrettyPrinter().writeValue(file, table.getRows());
        return file.getAbsolutePath();
    }
}
