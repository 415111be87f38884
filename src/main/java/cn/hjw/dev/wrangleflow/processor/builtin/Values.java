package cn.hjw.dev.wrangleflow.processor.builtin;

import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 单元格取值工具：数值识别、跨类型比较、汇总统计
 */
final class Values {

    /**
     * 比较顺序：都能当数值时按数值比，否则按字符串比；null 排最后
     */
    static final Comparator<Object> NATURAL_ORDER = Values::compare;

    private Values() {
    }

    /**
     * Number 直接取值，字符串可解析成数值时也算；其余返回 null
     */
    static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if (NumberUtils.isCreatable(s)) {
                return NumberUtils.createDouble(s);
            }
        }
        return null;
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    static int compare(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        Double da = toDouble(a);
        Double db = toDouble(b);
        if (da != null && db != null) {
            return Double.compare(da, db);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    /**
     * 宽松相等：1 和 1.0 以及 "1" 视为相等
     */
    static boolean looselyEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        Double da = toDouble(a);
        Double db = toDouble(b);
        if (da != null && db != null) {
            return da.doubleValue() == db.doubleValue();
        }
        return Objects.equals(String.valueOf(a), String.valueOf(b));
    }

    /**
     * join / group by 使用的归一化键：数值统一成 Double
     */
    static Object normalizeKey(Object value) {
        Double d = value instanceof Number ? ((Number) value).doubleValue() : null;
        return d != null ? d : value;
    }

    static List<Double> numbers(List<Object> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object v : values) {
            Double d = toDouble(v);
            if (d != null && !d.isNaN()) {
                numbers.add(d);
            }
        }
        return numbers;
    }

    static Double mean(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * 样本标准差 (n-1)，少于两个值时为 null
     */
    static Double std(List<Double> values) {
        if (values.size() < 2) {
            return null;
        }
        double mean = mean(values);
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / (values.size() - 1));
    }

    static Double median(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    static Double min(List<Double> values) {
        return values.isEmpty() ? null : Collections.min(values);
    }

    static Double max(List<Double> values) {
        return values.isEmpty() ? null : Collections.max(values);
    }
}
