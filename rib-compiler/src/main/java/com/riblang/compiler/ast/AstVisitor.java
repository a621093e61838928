package com.riblang.compiler.ast;

import com.riblang.compiler.ast.decl.EnumDecl;
import com.riblang.compiler.ast.decl.FilterDecl;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.decl.RecordDecl;
import com.riblang.compiler.ast.expr.BinaryExpr;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.ErrorExpr;
import com.riblang.compiler.ast.expr.FieldAccessExpr;
import com.riblang.compiler.ast.expr.IdentifierExpr;
import com.riblang.compiler.ast.expr.IfExpr;
import com.riblang.compiler.ast.expr.ListExpr;
import com.riblang.compiler.ast.expr.LiteralExpr;
import com.riblang.compiler.ast.expr.MatchExpr;
import com.riblang.compiler.ast.expr.RecordExpr;
import com.riblang.compiler.ast.expr.TerminalExpr;
import com.riblang.compiler.ast.expr.UnaryExpr;
import com.riblang.compiler.ast.stmt.ExprStmt;
import com.riblang.compiler.ast.stmt.ForStmt;
import com.riblang.compiler.ast.stmt.LetStmt;

/**
 * AST 访问者
 *
 * <p>没有默认实现：新增节点种类时，所有访问者都必须显式处理。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitRecordDecl(RecordDecl node, C context);

    R visitEnumDecl(EnumDecl node, C context);

    R visitFunctionDecl(FunctionDecl node, C context);

    R visitFilterDecl(FilterDecl node, C context);

    // ============ 语句 ============

    R visitLetStmt(LetStmt node, C context);

    R visitExprStmt(ExprStmt node, C context);

    R visitForStmt(ForStmt node, C context);

    // ============ 表达式 ============

    R visitLiteralExpr(LiteralExpr node, C context);

    R visitIdentifierExpr(IdentifierExpr node, C context);

    R visitBinaryExpr(BinaryExpr node, C context);

    R visitUnaryExpr(UnaryExpr node, C context);

    R visitFieldAccessExpr(FieldAccessExpr node, C context);

    R visitCallExpr(CallExpr node, C context);

    R visitRecordExpr(RecordExpr node, C context);

    R visitListExpr(ListExpr node, C context);

    R visitBlockExpr(BlockExpr node, C context);

    R visitIfExpr(IfExpr node, C context);

    R visitMatchExpr(MatchExpr node, C context);

    R visitTerminalExpr(TerminalExpr node, C context);

    R visitErrorExpr(ErrorExpr node, C context);
}
