package com.riblang.compiler.ast.stmt;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(Span span) {
        super(span);
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
