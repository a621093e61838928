package com.riblang.compiler.ast.type;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.Span;

import java.util.Collections;
import java.util.List;

/**
 * 源码中的类型引用，例如 {@code Int}、{@code List<Community>}
 */
public class TypeRef extends AstNode {
    private final String name;
    private final List<TypeRef> typeArgs;

    public TypeRef(Span span, String name, List<TypeRef> typeArgs) {
        super(span);
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(typeArgs);
    }

    public TypeRef(Span span, String name) {
        this(span, name, Collections.<TypeRef>emptyList());
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i));
        }
        return sb.append('>').toString();
    }
}
