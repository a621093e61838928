package com.riblang.compiler.ast.decl;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 枚举声明：{@code enum Name { A, B(Int), ... }}
 */
public class EnumDecl extends Declaration {
    private final List<Variant> variants;

    public EnumDecl(Span span, String name, Span nameSpan, List<Variant> variants) {
        super(span, name, nameSpan);
        this.variants = Collections.unmodifiableList(variants);
    }

    public List<Variant> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    /**
     * 枚举变体
     */
    public static class Variant extends AstNode {
        private final String name;
        private final List<TypeRef> payload;

        public Variant(Span span, String name, List<TypeRef> payload) {
            super(span);
            this.name = name;
            this.payload = Collections.unmodifiableList(payload);
        }

        public String getName() {
            return name;
        }

        public List<TypeRef> getPayload() {
            return payload;
        }
    }
}
