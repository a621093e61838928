package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import rib.runtime.RibValue;

/**
 * 字面量表达式
 */
public class LiteralExpr extends Expression {
    private final RibValue value;

    public LiteralExpr(Span span, RibValue value) {
        super(span);
        this.value = value;
    }

    public RibValue getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteralExpr(this, context);
    }
}
