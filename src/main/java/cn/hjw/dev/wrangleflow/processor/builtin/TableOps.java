package cn.hjw.dev.wrangleflow.processor.builtin;

import cn.hjw.dev.wrangleflow.model.DataTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据源和转换节点共用的列操作
 */
final class TableOps {

    private TableOps() {
    }

    /**
     * 列重命名，未出现在映射里的列保持原名和原位置
     */
    static DataTable renameColumns(DataTable table, Map<String, String> renameMap) {
        List<String> columns = new ArrayList<>();
        for (String column : table.getColumns()) {
            columns.add(renameMap.getOrDefault(column, column));
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.getRowCount());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> renamed = new LinkedHashMap<>();
            row.forEach((k, v) -> renamed.put(renameMap.getOrDefault(k, k), v));
            rows.add(renamed);
        }
        return table.withRows(columns, rows);
    }

    /**
     * 按给定顺序保留列
     */
    static DataTable selectColumns(DataTable table, List<String> columns) {
        List<Map<String, Object>> rows = new ArrayList<>(table.getRowCount());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> selected = new LinkedHashMap<>();
            for (String column : columns) {
                selected.put(column, row.get(column));
            }
            rows.add(selected);
        }
        return table.withRows(columns, rows);
    }

    /**
     * 去掉任一列为空的行
     */
    static DataTable dropNullRows(DataTable table, List<String> columns) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            boolean complete = true;
            for (String column : columns) {
                if (row.get(column) == null) {
                    complete = false;
                    break;
                }
            }
            if (complete) {
                rows.add(row);
            }
        }
        return table.withRows(rows);
    }
}
