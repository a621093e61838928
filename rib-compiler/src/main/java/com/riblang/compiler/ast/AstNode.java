package com.riblang.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final Span span;

    protected AstNode(Span span) {
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
