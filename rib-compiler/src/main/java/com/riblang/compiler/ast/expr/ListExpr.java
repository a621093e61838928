package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 列表字面量：{@code [a, b, c]}
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;

    public ListExpr(Span span, List<Expression> elements) {
        super(span);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }
}
