package com.riblang.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 记录类型
 *
 * <p>字段按名称排序，排序后的下标即运行时字段布局。相等性只比较字段名和字段类型，
 * 声明名称仅用于展示。</p>
 */
public final class RecordType extends RibType {

    /**
     * 记录字段
     */
    public static final class Field {
        private final String name;
        private final RibType type;

        public Field(String name, RibType type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public RibType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Field)) return false;
            Field that = (Field) o;
            return name.equals(that.name) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 31 + type.hashCode();
        }
    }

    private final String name;               // 匿名记录为 null
    private final List<Field> fields;

    public RecordType(String name, List<Field> fields) {
        List<Field> sorted = new ArrayList<Field>(fields);
        sorted.sort(Comparator.comparing(Field::getName));
        this.name = name;
        this.fields = Collections.unmodifiableList(sorted);
    }

    public String getName() {
        return name;
    }

    public List<Field> getFields() {
        return fields;
    }

    /** 字段下标，不存在时返回 -1 */
    public int indexOf(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    public Field getField(String fieldName) {
        int index = indexOf(fieldName);
        return index >= 0 ? fields.get(index) : null;
    }

    /** 排序后的字段名数组 */
    public String[] fieldNames() {
        String[] names = new String[fields.size()];
        for (int i = 0; i < names.length; i++) {
            names[i] = fields.get(i).getName();
        }
        return names;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        if (name != null) {
            return name;
        }
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(fields.get(i).getName()).append(": ").append(fields.get(i).getType().toDisplayString());
        }
        return sb.append('}').toString();
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitRecord(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordType)) return false;
        return fields.equals(((RecordType) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }
}
