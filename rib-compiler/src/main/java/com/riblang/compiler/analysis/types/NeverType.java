package com.riblang.compiler.analysis.types;

/**
 * Never 类型：终止动作（accept / reject / return / abort）的类型，可赋给任何类型
 */
public final class NeverType extends RibType {

    public static final NeverType INSTANCE = new NeverType();

    private NeverType() {
    }

    @Override
    public String getTypeName() {
        return "Never";
    }

    @Override
    public String toDisplayString() {
        return "Never";
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitNever(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NeverType;
    }

    @Override
    public int hashCode() {
        return 2;
    }
}
