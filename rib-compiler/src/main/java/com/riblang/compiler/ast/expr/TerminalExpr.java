package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 终止动作：{@code accept [e]}、{@code reject}、{@code return [e]}、{@code abort e}
 *
 * <p>类型恒为 Never。</p>
 */
public class TerminalExpr extends Expression {

    public enum Kind {
        ACCEPT("accept"),
        REJECT("reject"),
        RETURN("return"),
        ABORT("abort");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;
    private final Expression value;          // 可选

    public TerminalExpr(Span span, Kind kind, Expression value) {
        super(span);
        this.kind = kind;
        this.value = value;
    }

    public Kind getKind() {
        return kind;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTerminalExpr(this, context);
    }
}
