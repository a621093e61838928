package com.riblang.ir.ir;

import java.util.Arrays;

/**
 * 记录构造的布局：类型名（匿名记录为 null）与排序后的字段名。
 */
public final class RecordShape {

    private final String typeName;
    private final String[] fieldNames;

    public RecordShape(String typeName, String[] fieldNames) {
        this.typeName = typeName;
        this.fieldNames = fieldNames.clone();
    }

    public String getTypeName() { return typeName; }

    public int getFieldCount() { return fieldNames.length; }

    public String getFieldName(int index) { return fieldNames[index]; }

    public String[] getFieldNames() { return fieldNames.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordShape)) return false;
        RecordShape that = (RecordShape) o;
        return (typeName == null ? that.typeName == null : typeName.equals(that.typeName))
                && Arrays.equals(fieldNames, that.fieldNames);
    }

    @Override
    public int hashCode() {
        return (typeName != null ? typeName.hashCode() : 0) * 31 + Arrays.hashCode(fieldNames);
    }

    @Override
    public String toString() {
        return (typeName != null ? typeName : "record") + "{" + String.join(", ", fieldNames) + "}";
    }
}
