package cn.hjw.dev.wrangleflow.store;

import cn.hjw.dev.wrangleflow.exception.ArtifactNotFoundException;
import cn.hjw.dev.wrangleflow.model.DataTable;
import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@SuppressWarnings("unchecked")
public class DataStoreTest {

    @TempDir
    Path cacheDir;

    private static DataTable table(int rows) {
        List<Map<String, Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", (long) i);
            row.put("name", "row-" + i);
            row.put("score", i * 1.5);
            row.put("small", i);
            data.add(row);
        }
        return DataTable.of(data);
    }

    /**
     * 场景: 阈值 1KB，存一张小表和一张大表
     * 预期: 小表常驻内存，大表落盘；两者读回都与原值相等 (包括 Long / Integer / Double 类型)
     */
    @Test
    public void testStoreRoundTripAcrossThreshold() {
        DataStore store = new DataStore("exec-1", cacheDir, 1024);
        DataTable small = table(1);
        DataTable large = table(200);

        String smallId = store.store("src", "default", small);
        String largeId = store.store("big", "default", large);

        Assertions.assertEquals("src:default", smallId);
        Assertions.assertFalse(store.isSpilled(smallId));
        Assertions.assertTrue(store.isSpilled(largeId));
        Assertions.assertTrue(Files.exists(cacheDir.resolve("exec-1").resolve("big_default.ser")));

        Assertions.assertEquals(small, store.get(smallId));
        DataTable loaded = (DataTable) store.get(largeId);
        Assertions.assertEquals(large, loaded);
        Assertions.assertEquals(Long.class, loaded.getRows().get(5).get("id").getClass());
        Assertions.assertEquals(Integer.class, loaded.getRows().get(5).get("small").getClass());
    }

    /**
     * 场景: 字符串很长但只有一个元素
     * 预期: 按内容字节估算，而不是按元素个数，所以会落盘
     */
    @Test
    public void testSizeEstimateUsesPayloadBytes() {
        DataStore store = new DataStore("exec-2", cacheDir, 1024);
        String text = "x".repeat(4096);

        String dataId = store.store("n", "text", text);
        Assertions.assertTrue(store.isSpilled(dataId));
        Assertions.assertEquals(text, store.get(dataId));
    }

    /**
     * 场景: 同一个 dataId 先落盘，再写入一个小值
     * 预期: 读到新值，旧文件被删除
     */
    @Test
    public void testReplaceSpilledEntry() {
        DataStore store = new DataStore("exec-3", cacheDir, 1024);
        store.store("n", "default", table(200));
        Path file = cacheDir.resolve("exec-3").resolve("n_default.ser");
        Assertions.assertTrue(Files.exists(file));

        store.store("n", "default", "tiny");
        Assertions.assertEquals("tiny", store.get("n", "default"));
        Assertions.assertFalse(store.isSpilled("n:default"));
        Assertions.assertFalse(Files.exists(file));
    }

    @Test
    public void testMissingArtifact() {
        DataStore store = new DataStore("exec-4", cacheDir, 1024);
        ArtifactNotFoundException e = Assertions.assertThrows(ArtifactNotFoundException.class,
                () -> store.get("nope:default"));
        Assertions.assertTrue(e.getMessage().contains("nope:default"));
    }

    /**
     * 场景: B 有两条入边，其中一条的上游没有数据
     * 预期: 有数据的按 targetHandle 放好，缺失的 key 不出现
     */
    @Test
    public void testGetNodeInputsSkipsMissingUpstream() {
        DataStore store = new DataStore("exec-5", cacheDir, 1024);
        store.store("A", "result", 42);
        List<WorkflowEdge> edges = List.of(
                WorkflowEdge.of("A", "result", "B", "left"),
                WorkflowEdge.of("C", "default", "B", "right"),
                WorkflowEdge.of("A", "result", "D", "default"));

        Map<String, Object> inputs = store.getNodeInputs("B", edges);
        Assertions.assertEquals(Map.of("left", 42), inputs);
    }

    /**
     * 场景: 清理单个节点两次，然后清理全部两次
     * 预期: 重复清理不报错；落盘文件和运行目录都被删除
     */
    @Test
    public void testClearIsIdempotent() {
        DataStore store = new DataStore("exec/6", cacheDir, 1024);
        store.store("a", "default", table(200));
        store.store("a", "profile", Map.of("rows", 200));
        store.store("b", "default", "keep");
        Path runDir = cacheDir.resolve("exec_6");
        Assertions.assertTrue(Files.isDirectory(runDir));

        store.clear(List.of("a"));
        store.clear(List.of("a"));
        Assertions.assertFalse(store.contains("a:default"));
        Assertions.assertFalse(store.contains("a:profile"));
        Assertions.assertFalse(Files.exists(runDir.resolve("a_default.ser")));
        Assertions.assertEquals(List.of("b:default"), store.dataIds());

        store.clear();
        store.clear();
        Assertions.assertTrue(store.dataIds().isEmpty());
        Assertions.assertFalse(Files.exists(runDir));
    }

    /**
     * 场景: 节点 ID 是另一个节点 ID 的前缀 (a 和 ab)
     * 预期: 清理 a 不影响 ab
     */
    @Test
    public void testClearByNodeUsesExactNodeId() {
        DataStore store = new DataStore("exec-7", cacheDir, 1024);
        store.store("a", "default", 1);
        store.store("ab", "default", 2);

        store.clear(List.of("a"));
        Assertions.assertFalse(store.contains("a:default"));
        Assertions.assertEquals(2, store.get("ab:default"));
    }

    /**
     * 场景: 存入可变的 List 和嵌套 Map 后，生产方继续修改原对象，消费方尝试修改读到的值
     * 预期: 已存数据不受生产方影响；读到的值是只读的，再次读取内容不变
     */
    @Test
    public void testStoredContainersAreWriteOnce() {
        DataStore store = new DataStore("exec-8", cacheDir, 1024 * 1024);
        List<Integer> numbers = new ArrayList<>(List.of(1, 2));
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("tags", new ArrayList<>(List.of("a")));
        store.store("A", "default", numbers);
        store.store("A", "result", summary);

        numbers.add(99);
        ((List<String>) summary.get("tags")).add("b");
        summary.put("extra", 1);

        List<?> read = (List<?>) store.get("A:default");
        Assertions.assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) read).add(100));
        Map<?, ?> readSummary = (Map<?, ?>) store.get("A:result");
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> ((List<Object>) readSummary.get("tags")).add("c"));

        Assertions.assertEquals(List.of(1, 2), store.get("A:default"));
        Assertions.assertEquals(Map.of("tags", List.of("a")), store.get("A:result"));
    }
}
