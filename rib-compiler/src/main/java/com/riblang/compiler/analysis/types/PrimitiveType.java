package com.riblang.compiler.analysis.types;

/**
 * 原始类型: Bool, Int, String, Bytes, Prefix, IpAddr, Asn, Community, AsPath
 */
public final class PrimitiveType extends RibType {

    private final String name;

    PrimitiveType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getTypeName() {
        return name;
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return name.equals(((PrimitiveType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
