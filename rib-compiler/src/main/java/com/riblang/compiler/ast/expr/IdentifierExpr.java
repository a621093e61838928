package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 标识符引用
 */
public class IdentifierExpr extends Expression {
    private final String name;

    public IdentifierExpr(Span span, String name) {
        super(span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifierExpr(this, context);
    }
}
