package cn.hjw.dev.wrangleflow.store;

import cn.hjw.dev.wrangleflow.model.DataTable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * 估算载荷占用的字节数
 * 按内容估算而不是按元素个数：一行长文本和一行整数的开销差别很大
 */
public class PayloadSizeEstimator {

    private static final long REFERENCE = 8;
    private static final long OBJECT_HEADER = 16;
    private static final long BOXED_SCALAR = 16;
    private static final long STRING_OVERHEAD = 40;
    private static final long MAP_ENTRY_OVERHEAD = 32;
    private static final long COLLECTION_OVERHEAD = 24;
    private static final long UNKNOWN_OBJECT = 64;

    public long estimate(Object payload) {
        if (payload == null) {
            return REFERENCE;
        }
        if (payload instanceof CharSequence) {
            return STRING_OVERHEAD + 2L * ((CharSequence) payload).length();
        }
        if (payload instanceof BigDecimal) {
            return OBJECT_HEADER * 2 + ((BigDecimal) payload).unscaledValue().bitLength() / 8 + 8;
        }
        if (payload instanceof BigInteger) {
            return OBJECT_HEADER * 2 + ((BigInteger) payload).bitLength() / 8 + 8;
        }
        if (payload instanceof Number || payload instanceof Boolean || payload instanceof Character) {
            return BOXED_SCALAR;
        }
        if (payload instanceof DataTable) {
            DataTable table = (DataTable) payload;
            return estimate(table.getColumns()) + estimate(table.getRows());
        }
        if (payload instanceof Map) {
            long size = OBJECT_HEADER * 3;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) payload).entrySet()) {
                size += MAP_ENTRY_OVERHEAD + estimate(entry.getKey()) + estimate(entry.getValue());
            }
            return size;
        }
        if (payload instanceof Collection) {
            long size = COLLECTION_OVERHEAD;
            for (Object element : (Collection<?>) payload) {
                size += REFERENCE + estimate(element);
            }
            return size;
        }
        if (payload instanceof Object[]) {
            long size = OBJECT_HEADER;
            for (Object element : (Object[]) payload) {
                size += REFERENCE + estimate(element);
            }
            return size;
        }
        if (payload instanceof byte[]) {
            return OBJECT_HEADER + ((byte[]) payload).length;
        }
        if (payload instanceof char[]) {
            return OBJECT_HEADER + 2L * ((char[]) payload).length;
        }
        if (payload instanceof int[]) {
            return OBJECT_HEADER + 4L * ((int[]) payload).length;
        }
        if (payload instanceof long[]) {
            return OBJECT_HEADER + 8L * ((long[]) payload).length;
        }
        if (payload instanceof double[]) {
            return OBJECT_HEADER + 8L * ((double[]) payload).length;
        }
        return UNKNOWN_OBJECT;
    }
}
