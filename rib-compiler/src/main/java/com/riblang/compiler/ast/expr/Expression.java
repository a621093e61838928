package com.riblang.compiler.ast.expr;

import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.Span;

/**
 * 表达式基类
 *
 * <p>类型信息不写回节点，由类型检查结果的旁表记录。</p>
 */
public abstract class Expression extends AstNode {

    protected Expression(Span span) {
        super(span);
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
