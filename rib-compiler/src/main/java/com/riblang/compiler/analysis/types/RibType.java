package com.riblang.compiler.analysis.types;

/**
 * 类型表示基类
 *
 * <p>基础类型、记录、枚举、列表按结构比较；外部类型按名称比较。</p>
 */
public abstract class RibType {

    /**
     * 返回类型的简单名称（如 "Int"、"List"、记录名），用于内置方法查找。
     * 匿名记录、函数类型和错误类型返回 null。
     */
    public abstract String getTypeName();

    /** 人类可读的类型名，用于诊断消息 */
    public abstract String toDisplayString();

    /** 接受 RibTypeVisitor 进行类型分派 */
    public abstract <R> R accept(RibTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
