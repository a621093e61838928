package com.riblang.compiler.diagnostic;

import com.riblang.compiler.ast.Span;

/**
 * 诊断标注：源码区间 + 说明文字
 */
public final class Label {

    private final Span span;
    private final String text;

    public Label(Span span, String text) {
        this.span = span;
        this.text = text;
    }

    public Span getSpan() {
        return span;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return span + " " + text;
    }
}
