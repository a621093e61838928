package com.riblang.compiler.analysis.types;

/**
 * Unit 类型：无有效值的表达式（语句、无 else 的 if 等）
 */
public final class UnitType extends RibType {

    public static final UnitType INSTANCE = new UnitType();

    private UnitType() {
    }

    @Override
    public String getTypeName() {
        return "Unit";
    }

    @Override
    public String toDisplayString() {
        return "Unit";
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitUnit(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnitType;
    }

    @Override
    public int hashCode() {
        return 1;
    }
}
