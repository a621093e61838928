package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 模式匹配：{@code match expr { Variant(x) if guard => body, _ => body }}
 */
public class MatchExpr extends Expression {
    private final Expression scrutinee;
    private final List<Arm> arms;
    private final boolean recovered;   // 有分支解析失败被丢弃，不做穷尽性检查

    public MatchExpr(Span span, Expression scrutinee, List<Arm> arms) {
        this(span, scrutinee, arms, false);
    }

    public MatchExpr(Span span, Expression scrutinee, List<Arm> arms, boolean recovered) {
        super(span);
        this.scrutinee = scrutinee;
        this.arms = Collections.unmodifiableList(arms);
        this.recovered = recovered;
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<Arm> getArms() {
        return arms;
    }

    public boolean isRecovered() {
        return recovered;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchExpr(this, context);
    }

    /**
     * 匹配分支
     */
    public static class Arm extends AstNode {
        private final String variant;            // 通配符 _ 时为 null
        private final Span patternSpan;
        private final List<Binding> bindings;
        private final Expression guard;          // 可选
        private final Expression body;

        public Arm(Span span, String variant, Span patternSpan, List<Binding> bindings,
                   Expression guard, Expression body) {
            super(span);
            this.variant = variant;
            this.patternSpan = patternSpan;
            this.bindings = Collections.unmodifiableList(bindings);
            this.guard = guard;
            this.body = body;
        }

        public String getVariant() {
            return variant;
        }

        public boolean isWildcard() {
            return variant == null;
        }

        public Span getPatternSpan() {
            return patternSpan;
        }

        public List<Binding> getBindings() {
            return bindings;
        }

        public Expression getGuard() {
            return guard;
        }

        public Expression getBody() {
            return body;
        }
    }

    /**
     * 负载绑定名
     */
    public static class Binding extends AstNode {
        private final String name;

        public Binding(Span span, String name) {
            super(span);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }
}
