package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 成员访问：{@code target.name}
 *
 * <p>可能是记录字段、外部类型字段，或无负载的枚举变体（{@code Status.Up}），
 * 具体含义由类型检查决定。</p>
 */
public class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String name;
    private final Span nameSpan;

    public FieldAccessExpr(Span span, Expression target, String name, Span nameSpan) {
        super(span);
        this.target = target;
        this.name = name;
        this.nameSpan = nameSpan;
    }

    public Expression getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    public Span getNameSpan() {
        return nameSpan;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccessExpr(this, context);
    }
}
