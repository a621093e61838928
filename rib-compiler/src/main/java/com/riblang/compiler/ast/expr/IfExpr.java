package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 条件表达式：{@code if cond { ... } else { ... }}
 */
public class IfExpr extends Expression {
    private final Expression condition;
    private final BlockExpr thenBranch;
    private final Expression elseBranch;     // BlockExpr / IfExpr，可选

    public IfExpr(Span span, Expression condition, BlockExpr thenBranch, Expression elseBranch) {
        super(span);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public BlockExpr getThenBranch() {
        return thenBranch;
    }

    public Expression getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfExpr(this, context);
    }
}
