package com.riblang.compiler.ast;

import com.riblang.compiler.ast.decl.Declaration;

import java.util.Collections;
import java.util.List;

/**
 * 编译单元的根节点
 */
public class SourceFile extends AstNode {
    private final String unitId;
    private final List<Declaration> declarations;

    public SourceFile(Span span, String unitId, List<Declaration> declarations) {
        super(span);
        this.unitId = unitId;
        this.declarations = Collections.unmodifiableList(declarations);
    }

    public String getUnitId() {
        return unitId;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }
}
