package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.type.TypeRef;

/**
 * 参数或记录字段声明：{@code name: Type}
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;

    public Parameter(Span span, String name, TypeRef type) {
        super(span);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }
}
