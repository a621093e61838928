package com.riblang.compiler.analysis.types;

/**
 * 错误类型：类型检查出错时的占位符，与任何类型兼容，用于抑制级联诊断。
 */
public final class ErrorType extends RibType {

    public static final ErrorType INSTANCE = new ErrorType();

    private ErrorType() {
    }

    @Override
    public String getTypeName() {
        return null;
    }

    @Override
    public String toDisplayString() {
        return "<error>";
    }

    @Override
    public <R> R accept(RibTypeVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorType;
    }

    @Override
    public int hashCode() {
        return -1;
    }
}
