package rib.runtime;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record 值
 *
 * <p>字段按名称排序存放，下标与编译期的字段布局一致。
 * 相等性只比较字段名和字段值，记录类型名仅用于展示。</p>
 */
public final class RibRecord extends RibValue {

    private final String typeName;
    private final String[] fieldNames;
    private final RibValue[] values;

    /**
     * @param typeName   声明的类型名，匿名记录为 null
     * @param fieldNames 已排序的字段名
     * @param values     与字段名一一对应的值
     */
    public RibRecord(String typeName, String[] fieldNames, RibValue[] values) {
        if (fieldNames.length != values.length) {
            throw new IllegalArgumentException("Record field count " + fieldNames.length
                    + " does not match value count " + values.length);
        }
        this.typeName = typeName;
        this.fieldNames = fieldNames.clone();
        this.values = values.clone();
    }

    /**
     * 按字段名构造记录（字段顺序无关，内部自动排序）
     */
    public static RibRecord of(String typeName, Map<String, ? extends RibValue> fields) {
        String[] names = fields.keySet().toArray(new String[0]);
        Arrays.sort(names);
        RibValue[] values = new RibValue[names.length];
        for (int i = 0; i < names.length; i++) {
            values[i] = fields.get(names[i]);
        }
        return new RibRecord(typeName, names, values);
    }

    public String getRecordTypeName() {
        return typeName;
    }

    public int getFieldCount() {
        return values.length;
    }

    public String getFieldName(int index) {
        return fieldNames[index];
    }

    public RibValue get(int index) {
        return values[index];
    }

    /** 按名称取字段，不存在时返回 null */
    public RibValue get(String name) {
        int index = Arrays.binarySearch(fieldNames, name);
        return index >= 0 ? values[index] : null;
    }

    @Override
    public String getTypeName() {
        return typeName != null ? typeName : "Record";
    }

    @Override
    public Object toJavaValue() {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (int i = 0; i < values.length; i++) {
            result.put(fieldNames[i], values[i].toJavaValue());
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RibRecord)) return false;
        RibRecord other = (RibRecord) o;
        return Arrays.equals(other.fieldNames, fieldNames) && Arrays.equals(other.values, values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(fieldNames) * 31 + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (typeName != null) sb.append(typeName).append(' ');
        sb.append('{');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(fieldNames[i]).append(": ").append(values[i]);
        }
        return sb.append('}').toString();
    }
}
