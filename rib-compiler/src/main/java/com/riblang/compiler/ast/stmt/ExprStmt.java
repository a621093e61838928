package com.riblang.compiler.ast.stmt;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public class ExprStmt extends Statement {
    private final Expression expression;

    public ExprStmt(Span span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExprStmt(this, context);
    }
}
