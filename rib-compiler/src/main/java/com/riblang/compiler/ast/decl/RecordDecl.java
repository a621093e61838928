package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 记录类型声明：{@code type Name { field: Type, ... }}
 */
public class RecordDecl extends Declaration {
    private final List<Parameter> fields;

    public RecordDecl(Span span, String name, Span nameSpan, List<Parameter> fields) {
        super(span, name, nameSpan);
        this.fields = Collections.unmodifiableList(fields);
    }

    public List<Parameter> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRecordDecl(this, context);
    }
}
