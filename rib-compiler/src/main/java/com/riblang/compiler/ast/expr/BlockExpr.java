package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 块表达式：语句序列 + 可选的尾表达式（块的值）
 */
public class BlockExpr extends Expression {
    private final List<Statement> statements;
    private final Expression tail;           // 可选
    private final boolean recovered;         // 块内有语句解析失败并被跳过

    public BlockExpr(Span span, List<Statement> statements, Expression tail) {
        this(span, statements, tail, false);
    }

    public BlockExpr(Span span, List<Statement> statements, Expression tail, boolean recovered) {
        super(span);
        this.statements = Collections.unmodifiableList(statements);
        this.tail = tail;
        this.recovered = recovered;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Expression getTail() {
        return tail;
    }

    public boolean isRecovered() {
        return recovered;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpr(this, context);
    }
}
