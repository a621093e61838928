package com.riblang.compiler.analysis.types;

import java.util.Collections;
import java.util.List;

/**
 * 函数类型：(P1, P2, ...) -> R
 */
public final class FunctionType extends RibType {

    private final List<RibType> paramTypes;
    private final RibType returnType;

    public FunctionType(List<RibType> paramTypes, RibType returnType) {
        this.paramTypes = Collections.unmodifiableList(paramTypes);
        this.returnType = returnType;
    }

    public List<RibType> getParamTypes() {
        return paramTypes;
    }

    public RibType getReturnType() {
        return returnType;
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        return sb.append(") -> ").append(returnType.toDisplayString()).toString();
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return paramTypes.equals(that.paramTypes) && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return paramTypes.hashCode() * 31 + returnType.hashCode();
    }
}
