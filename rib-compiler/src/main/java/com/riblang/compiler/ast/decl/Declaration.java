package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;
    protected final Span nameSpan;

    protected Declaration(Span span, String name, Span nameSpan) {
        super(span);
        this.name = name;
        this.nameSpan = nameSpan;
    }

    public String getName() {
        return name;
    }

    /** 名称所在区间（诊断定位用） */
    public Span getNameSpan() {
        return nameSpan;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
