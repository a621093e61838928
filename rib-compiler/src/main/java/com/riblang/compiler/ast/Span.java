package com.riblang.compiler.ast;

import java.util.Objects;

/**
 * 源码区间（半开区间 [start, end)，按字符偏移计）
 */
public final class Span {

    private final int start;
    private final int end;
    private final String unitId;

    public Span(int start, int end, String unitId) {
        if (end < start) {
            throw new IllegalArgumentException("Span end " + end + " before start " + start);
        }
        this.start = start;
        this.end = end;
        this.unitId = unitId;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getUnitId() {
        return unitId;
    }

    public int length() {
        return end - start;
    }

    /** 覆盖 this 与 other 的最小区间 */
    public Span to(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end), unitId);
    }

    /** 截取源码中对应的文本 */
    public String slice(String source) {
        return source.substring(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return start == span.start && end == span.end && Objects.equals(unitId, span.unitId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, unitId);
    }

    @Override
    public String toString() {
        return unitId + "[" + start + ".." + end + ")";
    }
}
