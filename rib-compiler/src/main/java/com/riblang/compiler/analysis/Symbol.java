package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.Span;

/**
 * 符号表中的符号
 *
 * <p>按身份比较：同名的两次声明是两个不同符号。</p>
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final RibType type;
    private final Span span;              // 声明名称位置
    private final AstNode declaration;    // 声明的 AST 节点
    private boolean used;

    public Symbol(String name, SymbolKind kind, RibType type, Span span, AstNode declaration) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.span = span;
        this.declaration = declaration;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public RibType getType() { return type; }
    public Span getSpan() { return span; }
    public AstNode getDeclaration() { return declaration; }

    public boolean isUsed() { return used; }
    public void markUsed() { this.used = true; }

    /** 以下划线开头的名称不参与未使用检查 */
    public boolean isIgnored() {
        return name.startsWith("_");
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name + ": " + type.toDisplayString();
    }
}
