package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 过滤器声明：{@code filter name(route: Route) { ... }}
 * 或 {@code filtermap name(route: Route) -> Out { ... }}
 */
public class FilterDecl extends Declaration {

    public enum Kind {
        FILTER("filter"),
        FILTER_MAP("filtermap");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;
    private final List<Parameter> params;
    private final TypeRef outputType;            // 仅 filtermap，可选
    private final BlockExpr body;

    public FilterDecl(Span span, Kind kind, String name, Span nameSpan, List<Parameter> params,
                      TypeRef outputType, BlockExpr body) {
        super(span, name, nameSpan);
        this.kind = kind;
        this.params = Collections.unmodifiableList(params);
        this.outputType = outputType;
        this.body = body;
    }

    public Kind getKind() {
        return kind;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getOutputType() {
        return outputType;
    }

    public BlockExpr getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFilterDecl(this, context);
    }
}
