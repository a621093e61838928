package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.ast.AstNode;
import com.riblang.compiler.ast.SourceFile;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.Expression;
import com.riblang.compiler.ast.expr.FieldAccessExpr;
import com.riblang.compiler.ast.expr.IdentifierExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型检查结果：AST + 旁路表
 *
 * <p>所有表以节点身份为键。检查通过（无错误诊断）时，每个表达式都有确定的非错误类型，
 * 每个标识符、调用和成员访问都有解析结果，供 IR 降级直接使用。</p>
 */
public final class TypedProgram {

    private final SourceFile sourceFile;
    private final Map<Expression, RibType> exprTypes = new IdentityHashMap<Expression, RibType>();
    private final Map<IdentifierExpr, Symbol> references = new IdentityHashMap<IdentifierExpr, Symbol>();
    private final Map<AstNode, Symbol> declarations = new IdentityHashMap<AstNode, Symbol>();
    private final Map<CallExpr, CallTarget> calls = new IdentityHashMap<CallExpr, CallTarget>();
    private final Map<FieldAccessExpr, FieldTarget> fields = new IdentityHashMap<FieldAccessExpr, FieldTarget>();
    private final List<Symbol> callables = new ArrayList<Symbol>();

    TypedProgram(SourceFile sourceFile) {
        this.sourceFile = sourceFile;
    }

    public SourceFile getSourceFile() {
        return sourceFile;
    }

    // ============ 查询 ============

    public RibType typeOf(Expression expr) {
        RibType type = exprTypes.get(expr);
        if (type == null) {
            throw new IllegalStateException("Expression at " + expr.getSpan() + " has no type");
        }
        return type;
    }

    /** 标识符引用的符号 */
    public Symbol symbolOf(IdentifierExpr expr) {
        return references.get(expr);
    }

    /** 声明节点（LetStmt、ForStmt、Parameter、MatchExpr.Binding、函数/类型声明）对应的符号 */
    public Symbol declaredSymbol(AstNode node) {
        return declarations.get(node);
    }

    public CallTarget callTarget(CallExpr expr) {
        return calls.get(expr);
    }

    public FieldTarget fieldTarget(FieldAccessExpr expr) {
        return fields.get(expr);
    }

    /** 按源码顺序返回所有 function / filter 符号 */
    public List<Symbol> getCallables() {
        return Collections.unmodifiableList(callables);
    }

    public Symbol callableOf(Declaration decl) {
        return declarations.get(decl);
    }

    // ============ 记录（供 TypeChecker 使用） ============

    void recordType(Expression expr, RibType type) {
        exprTypes.put(expr, type);
    }

    void recordReference(IdentifierExpr expr, Symbol symbol) {
        references.put(expr, symbol);
    }

    void recordDeclaration(AstNode node, Symbol symbol) {
        declarations.put(node, symbol);
        if (symbol.getKind().isCallable()) {
            callables.add(symbol);
        }
    }

    void recordCall(CallExpr expr, CallTarget target) {
        calls.put(expr, target);
    }

    void recordField(FieldAccessExpr expr, FieldTarget target) {
        fields.put(expr, target);
    }
}
