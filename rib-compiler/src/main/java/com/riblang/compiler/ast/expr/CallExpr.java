package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 调用表达式
 *
 * <p>callee 为标识符时是函数调用；为 {@link FieldAccessExpr} 时是方法调用
 * 或带负载的枚举变体构造。</p>
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(Span span, Expression callee, List<Expression> arguments) {
        super(span);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
