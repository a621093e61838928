package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 记录构造：{@code Name { f: e }} 或匿名的 {@code { f: e }}
 */
public class RecordExpr extends Expression {
    private final String typeName;           // 匿名记录为 null
    private final List<FieldInit> fields;

    public RecordExpr(Span span, String typeName, List<FieldInit> fields) {
        super(span);
        this.typeName = typeName;
        this.fields = Collections.unmodifiableList(fields);
    }

    public String getTypeName() {
        return typeName;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRecordExpr(this, context);
    }

    /**
     * 字段初始化项
     */
    public static class FieldInit extends AstNode {
        private final String name;
        private final Expression value;

        public FieldInit(Span span, String name, Expression value) {
            super(span);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
