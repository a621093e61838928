package com.riblang.compiler.ast.stmt;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.Expression;
import com.riblang.compiler.ast.type.TypeRef;

/**
 * 局部变量绑定：{@code let name: Type = expr;}
 */
public class LetStmt extends Statement {
    private final String name;
    private final Span nameSpan;
    private final TypeRef type;              // 可选
    private final Expression initializer;

    public LetStmt(Span span, String name, Span nameSpan, TypeRef type, Expression initializer) {
        super(span);
        this.name = name;
        this.nameSpan = nameSpan;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public Span getNameSpan() {
        return nameSpan;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}
