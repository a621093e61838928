package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明：{@code function name(params) -> Type { ... }}
 */
public class FunctionDecl extends Declaration {
    private final List<Parameter> params;
    private final TypeRef returnType;            // 可选，默认 Unit
    private final BlockExpr body;

    public FunctionDecl(Span span, String name, Span nameSpan, List<Parameter> params,
                        TypeRef returnType, BlockExpr body) {
        super(span, name, nameSpan);
        this.params = Collections.unmodifiableList(params);
        this.returnType = returnType;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public BlockExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
