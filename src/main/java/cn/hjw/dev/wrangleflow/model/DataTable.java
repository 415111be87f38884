package cn.hjw.dev.wrangleflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 表格型中间结果 (节点之间传递的主要数据载体)
 * 不可变：所有变换都返回新表；单元格的值需要可序列化，才能在超过内存阈值时落盘
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataTable implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    @JsonCreator
    public DataTable(@JsonProperty("columns") List<String> columns,
                     @JsonProperty("rows") List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
        this.columns = columns != null ? List.copyOf(columns) : List.copyOf(collectColumns(copy));
    }

    /**
     * 按行构建，列顺序取各行 key 首次出现的顺序
     */
    public static DataTable of(List<? extends Map<String, ?>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, ?> row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return new DataTable(null, copy);
    }

    public static DataTable empty() {
        return new DataTable(List.of(), List.of());
    }

    private static Set<String> collectColumns(List<Map<String, Object>> rows) {
        Set<String> names = new LinkedHashSet<>();
        rows.forEach(r -> names.addAll(r.keySet()));
        return names;
    }

    @JsonIgnore
    public int getRowCount() {
        return rows.size();
    }

    @JsonIgnore
    public int getColumnCount() {
        return columns.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<Object> columnValues(String column) {
        return rows.stream().map(r -> r.get(column)).collect(Collectors.toList());
    }

    /**
     * 数值列：所有非空值都是 Number 且至少有一个非空值
     */
    @JsonIgnore
    public List<String> getNumericColumns() {
        List<String> numeric = new ArrayList<>();
        for (String column : columns) {
            boolean seen = false;
            boolean allNumbers = true;
            for (Map<String, Object> row : rows) {
                Object v = row.get(column);
                if (v == null) {
                    continue;
                }
                seen = true;
                if (!(v instanceof Number)) {
                    allNumbers = false;
                    break;
                }
            }
            if (seen && allNumbers) {
                numeric.add(column);
            }
        }
        return numeric;
    }

    public DataTable withRows(List<? extends Map<String, ?>> newRows) {
        return withRows(columns, newRows);
    }

    public DataTable withRows(List<String> newColumns, List<? extends Map<String, ?>> newRows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, ?> row : newRows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return new DataTable(newColumns, copy);
    }
}
