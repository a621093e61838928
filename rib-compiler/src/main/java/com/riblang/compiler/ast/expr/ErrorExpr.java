package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 占位表达式：替代词法错误 token，诊断已由词法分析器报告
 */
public class ErrorExpr extends Expression {

    public ErrorExpr(Span span) {
        super(span);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitErrorExpr(this, context);
    }
}
