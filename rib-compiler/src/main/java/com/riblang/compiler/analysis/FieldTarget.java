package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.host.ExternalMember;

/**
 * 成员访问表达式的解析结果
 */
public final class FieldTarget {

    public enum Kind {
        RECORD_FIELD,     // 记录字段，按排序后的下标读取
        EXTERNAL_FIELD,   // 宿主类型字段，经外部调用读取
        ENUM_VARIANT      // 无负载变体 Enum.Variant
    }

    private final Kind kind;
    private final RecordType recordType;
    private final int fieldIndex;
    private final ExternalMember external;
    private final EnumType enumType;
    private final EnumType.Variant variant;

    private FieldTarget(Kind kind, RecordType recordType, int fieldIndex, ExternalMember external,
                        EnumType enumType, EnumType.Variant variant) {
        this.kind = kind;
        this.recordType = recordType;
        this.fieldIndex = fieldIndex;
        this.external = external;
        this.enumType = enumType;
        this.variant = variant;
    }

    public static FieldTarget recordField(RecordType recordType, int fieldIndex) {
        return new FieldTarget(Kind.RECORD_FIELD, recordType, fieldIndex, null, null, null);
    }

    public static FieldTarget externalField(ExternalMember member) {
        return new FieldTarget(Kind.EXTERNAL_FIELD, null, -1, member, null, null);
    }

    public static FieldTarget enumVariant(EnumType enumType, EnumType.Variant variant) {
        return new FieldTarget(Kind.ENUM_VARIANT, null, -1, null, enumType, variant);
    }

    public Kind getKind() { return kind; }
    public RecordType getRecordType() { return recordType; }
    public int getFieldIndex() { return fieldIndex; }
    public ExternalMember getExternal() { return external; }
    public EnumType getEnumType() { return enumType; }
    public EnumType.Variant getVariant() { return variant; }
}
