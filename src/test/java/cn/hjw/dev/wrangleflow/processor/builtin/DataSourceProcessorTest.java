package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.config.NodeConfigParser;
import cn.hjw.dev.wrangleflow.config.SourceConfig;
import cn.hjw.dev.wrangleflow.exception.DataValidationError;
import cn.hjw.dev.wrangleflow.exception.NodeExecutionError;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.model.NodeDefinition;
import cn.hjw.dev.wrangleflow.model.NodeKind;
import cn.hjw.dev.wrangleflow.processor.ProcessorResult;
import cn.hjw.dev.wrangleflow.processor.ProgressReporter;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class DataSourceProcessorTest {

    private final NodeConfigParser parser = new NodeConfigParser();

    @TempDir
    Path tempDir;

    private DataSourceProcessor source(Map<String, Object> data) {
        return new DataSourceProcessor("src", (SourceConfig) parser.parse(
                NodeDefinition.of("src", NodeKind.SOURCE, data)).getConfig());
    }

    private static ProcessorResult run(DataSourceProcessor processor, Map<String, Object> inputs) throws Exception {
        processor.validateInputs(inputs);
        ProcessorResult result = processor.execute(inputs, ProgressReporter.NOOP);
        processor.validateOutputs(result);
        return result;
    }

    private static List<Map<String, Object>> records() {
        return List.of(
                Map.of("id", 1, "name", "ann", "score", 3.5),
                Map.of("id", 2, "name", "bob", "score", 4.0),
                Map.of("id", 3, "name", "cid", "score", 2.0));
    }

    @Test
    public void testInlineData() throws Exception {
        DataSourceProcessor processor = source(Map.of("source_type", "inline", "data", records()));
        Assertions.assertTrue(processor.requiredInputs().isEmpty());

        ProcessorResult result = run(processor, Map.of());
        DataTable table = (DataTable) result.get("default");
        Assertions.assertEquals(3, table.getRowCount());
        Assertions.assertEquals(3, table.getColumnCount());
        Assertions.assertTrue(result.has("profile"));
    }

    /**
     * 场景: inline 类型但没有配置 data
     * 预期: 需要 data 输入，缺失时输入校验失败
     */
    @Test
    public void testInlineDataFromInput() throws Exception {
        DataSourceProcessor processor = source(Map.of("source_type", "inline"));
        Assertions.assertEquals(List.of("data"), processor.requiredInputs());

        DataValidationError error = Assertions.assertThrows(DataValidationError.class,
                () -> processor.validateInputs(Map.of()));
        Assertions.assertEquals(List.of("missing required input: data"), error.getValidationErrors());

        DataTable table = (DataTable) run(processor, Map.of("data", records())).get("default");
        Assertions.assertEquals(Arrays.asList("ann", "bob", "cid"), table.columnValues("name"));
    }

    /**
     * 场景: 读取 CSV，一列整数、一列文本、一列带小数和空值
     * 预期: 整数列为 Long，小数列为 Double，空单元格为 null
     */
    @Test
    public void testCsvFile() throws Exception {
        File csv = tempDir.resolve("people.csv").toFile();
        FileUtils.writeStringToFile(csv, "id,name,score\n1,ann,3.5\n2,bob,\n3,cid,4\n", StandardCharsets.UTF_8);

        DataTable table = (DataTable) run(source(Map.of("source_type", "file", "source_path", csv.getPath())),
                Map.of()).get("default");

        Assertions.assertEquals(List.of("id", "name", "score"), table.getColumns());
        Assertions.assertEquals(Arrays.asList(1L, 2L, 3L), table.columnValues("id"));
        Assertions.assertEquals(Arrays.asList(3.5, null, 4.0), table.columnValues("score"));
        Assertions.assertEquals("bob", table.getRows().get(1).get("name"));
    }

    @Test
    public void testUploadedJsonWithColumnOperations() throws Exception {
        File json = tempDir.resolve("upload.json").toFile();
        FileUtils.writeStringToFile(json,
                "[{\"id\":1,\"name\":\"ann\"},{\"id\":2,\"name\":\"bob\"},{\"id\":3,\"name\":\"cid\"}]",
                StandardCharsets.UTF_8);

        Map<String, Object> config = new HashMap<>();
        config.put("source_type", "uploaded");
        config.put("column_rename", Map.of("name", "person"));
        config.put("columns_to_keep", List.of("person"));
        config.put("row_limit", 2);
        DataSourceProcessor processor = source(config);
        Assertions.assertEquals(List.of("file_path"), processor.requiredInputs());

        DataTable table = (DataTable) run(processor, Map.of("file_path", json.getPath())).get("default");
        Assertions.assertEquals(List.of("person"), table.getColumns());
        Assertions.assertEquals(Arrays.asList("ann", "bob"), table.columnValues("person"));
    }

    @Test
    public void testMissingFileFails() {
        DataSourceProcessor processor = source(Map.of("source_type", "file",
                "source_path", tempDir.resolve("absent.csv").toString()));
        NodeExecutionError error = Assertions.assertThrows(NodeExecutionError.class, () -> run(processor, Map.of()));
        Assertions.assertTrue(error.getMessage().startsWith("File not found"));
        Assertions.assertEquals("src", error.getNodeId());
    }

    @Test
    public void testSchemaValidation() {
        Map<String, Object> config = new HashMap<>();
        config.put("source_type", "inline");
        config.put("data", records());
        config.put("validate_schema", true);
        config.put("expected_schema", Map.of("required_columns", List.of("id", "email")));

        DataValidationError error = Assertions.assertThrows(DataValidationError.class,
                () -> run(source(config), Map.of()));
        Assertions.assertEquals(List.of("missing required column: email"), error.getValidationErrors());
    }

    /**
     * 场景: 多条数据规则同时不满足
     * 预期: 一次性报告全部违反的规则
     */
    @Test
    public void testDataValidationCollectsAllViolations() {
        List<Map<String, Object>> rows = new ArrayList<>(records());
        Map<String, Object> broken = new HashMap<>();
        broken.put("id", 3);
        broken.put("name", null);
        broken.put("score", 9.5);
        rows.add(broken);

        Map<String, Object> config = new HashMap<>();
        config.put("source_type", "inline");
        config.put("data", rows);
        config.put("validate_data", true);
        config.put("validation_rules", List.of(
                Map.of("type", "no_nulls", "column", "name"),
                Map.of("type", "unique", "column", "id"),
                Map.of("type", "range", "column", "score", "min", 0, "max", 5),
                Map.of("type", "regex", "column", "name", "pattern", "[a-z]+")));

        DataValidationError error = Assertions.assertThrows(DataValidationError.class,
                () -> run(source(config), Map.of()));
        Assertions.assertEquals(List.of(
                "no_nulls: column name has 1 null values",
                "unique: column id has 1 duplicate values",
                "range: column score has 1 values outside [0.0, 5.0]"), error.getValidationErrors());
    }

    @Test
    public void testValidDataPasses() throws Exception {
        Map<String, Object> config = new HashMap<>();
        config.put("source_type", "inline");
        config.put("data", records());
        config.put("validate_data", true);
        config.put("validation_rules", List.of(
                Map.of("type", "unique", "column", "id"),
                Map.of("type", "regex", "column", "name", "pattern", "[a-z]{3}")));

        DataTable table = (DataTable) run(source(config), Map.of()).get("default");
        Assertions.assertEquals(3, table.getRowCount());
    }
}
