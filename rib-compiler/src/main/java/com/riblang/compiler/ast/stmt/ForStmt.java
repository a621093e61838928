package com.riblang.compiler.ast.stmt;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.Expression;

/**
 * 有限集合遍历：{@code for x in list { ... }}
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Span variableSpan;
    private final Expression iterable;
    private final BlockExpr body;

    public ForStmt(Span span, String variable, Span variableSpan, Expression iterable, BlockExpr body) {
        super(span);
        this.variable = variable;
        this.variableSpan = variableSpan;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Span getVariableSpan() {
        return variableSpan;
    }

    public Expression getIterable() {
        return iterable;
    }

    public BlockExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
