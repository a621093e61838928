package com.riblang.compiler.analysis;

import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.ExternalType;
import com.riblang.compiler.analysis.types.FunctionType;
import com.riblang.compiler.analysis.types.ListType;
import com.riblang.compiler.analysis.types.NeverType;
import com.riblang.compiler.analysis.types.PrimitiveType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.analysis.types.RibTypes;
import com.riblang.compiler.analysis.types.TypeCompatibility;
import com.riblang.compiler.ast.AstVisitor;
import com.riblang.compiler.ast.SourceFile;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.ast.decl.EnumDecl;
import com.riblang.compiler.ast.decl.FilterDecl;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.decl.Parameter;
import com.riblang.compiler.ast.decl.RecordDecl;
import com.riblang.compiler.ast.expr.BinaryExpr;
import com.riblang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.ErrorExpr;
import com.riblang.compiler.ast.expr.Expression;
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
import com.riblang.compiler.ast.stmt.Statement;
import com.riblang.compiler.diagnostic.Diagnostic;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.host.ExternalMember;
import com.riblang.compiler.host.ExternalTypeTable;
import rib.runtime.BuiltinMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 名称解析与类型检查
 *
 * <p>分四步：登记并解析类型声明；登记 function / filter 签名；逐个检查函数体；
 * 最后检测递归调用并报告未使用的类型。访问方法的上下文参数是期望类型（可为 null），
 * 只用于推断列表、记录字面量和分支；是否匹配由使用处检查并报告。</p>
 *
 * <p>类型为 {@link RibTypes#ERROR} 的表达式已经报告过诊断，后续检查对它一律放行，
 * 一个根因只产生一条诊断。</p>
 */
public final class TypeChecker implements AstVisitor<RibType, RibType> {

    private final Diagnostics diagnostics;
    private final ExternalTypeTable typeTable;
    private final TypeResolver typeResolver;
    private final ScopeArena scopes = new ScopeArena();
    private final CallGraph callGraph = new CallGraph();
    private final Map<Declaration, Symbol> callableSymbols = new IdentityHashMap<Declaration, Symbol>();
    private TypedProgram program;

    // 当前正在检查的函数
    private String currentCallable;
    private FilterDecl.Kind currentFilterKind;   // function 中为 null
    private RibType currentReturnType;           // function 返回类型或 filtermap 输出类型

    public TypeChecker(Diagnostics diagnostics, ExternalTypeTable typeTable) {
        this.diagnostics = diagnostics;
        this.typeTable = typeTable;
        this.typeResolver = new TypeResolver(diagnostics, typeTable);
    }

    /** 检查入口 */
    public TypedProgram check(SourceFile file) {
        program = new TypedProgram(file);

        for (Declaration decl : file.getDeclarations()) {
            if (decl instanceof RecordDecl || decl instanceof EnumDecl) {
                typeResolver.declare(decl);
            }
        }
        typeResolver.resolveAll();

        for (Declaration decl : file.getDeclarations()) {
            if (decl instanceof FunctionDecl || decl instanceof FilterDecl) {
                declareCallable(decl);
            }
        }

        for (Declaration decl : file.getDeclarations()) {
            decl.accept(this, null);
        }

        for (CallGraph.Cycle cycle : callGraph.findCycles()) {
            StringBuilder path = new StringBuilder();
            for (String member : cycle.members) {
                path.append(member).append(" -> ");
            }
            path.append(cycle.members.get(0));
            diagnostics.error(DiagnosticKind.RECURSIVE_CALL, cycle.span,
                    "Recursive call cycle is not allowed: " + path);
        }

        typeResolver.reportUnused();
        for (Symbol symbol : typeResolver.typeSymbols()) {
            program.recordDeclaration(symbol.getDeclaration(), symbol);
        }
        return program;
    }

    // ============ 声明 ============

    private void declareCallable(Declaration decl) {
        List<Parameter> params;
        RibType returnType;
        SymbolKind kind;
        if (decl instanceof FunctionDecl) {
            FunctionDecl fn = (FunctionDecl) decl;
            params = fn.getParams();
            returnType = fn.getReturnType() != null ? typeResolver.resolve(fn.getReturnType(), null) : RibTypes.UNIT;
            kind = SymbolKind.FUNCTION;
        } else {
            FilterDecl filter = (FilterDecl) decl;
            params = filter.getParams();
            returnType = filter.getOutputType() != null
                    ? typeResolver.resolve(filter.getOutputType(), null) : RibTypes.UNIT;
            kind = SymbolKind.FILTER;
        }
        List<RibType> paramTypes = new ArrayList<RibType>();
        for (Parameter param : params) {
            paramTypes.add(typeResolver.resolve(param.getType(), null));
        }
        Symbol symbol = new Symbol(decl.getName(), kind, new FunctionType(paramTypes, returnType),
                decl.getNameSpan(), decl);
        callableSymbols.put(decl, symbol);

        Symbol previous = scopes.global().resolveLocal(decl.getName());
        if (previous != null) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                            "Duplicate definition of '" + decl.getName() + "'", decl.getNameSpan())
                    .withLabel(previous.getSpan(), "first defined here"));
            return;
        }
        if (typeTable.findFunction(decl.getName()) != null) {
            diagnostics.error(DiagnosticKind.DUPLICATE_DEFINITION, decl.getNameSpan(),
                    "Function '" + decl.getName() + "' is already registered by the host");
            return;
        }
        scopes.define(symbol);
        program.recordDeclaration(decl, symbol);
    }

    @Override
    public RibType visitRecordDecl(RecordDecl node, RibType expected) {
        return RibTypes.UNIT;
    }

    @Override
    public RibType visitEnumDecl(EnumDecl node, RibType expected) {
        return RibTypes.UNIT;
    }

    @Override
    public RibType visitFunctionDecl(FunctionDecl node, RibType expected) {
        FunctionType signature = (FunctionType) callableSymbols.get(node).getType();
        int mark = enterCallable(node.getName(), null, signature, node.getParams());

        RibType bodyType = check(node.getBody(), signature.getReturnType());
        if (!TypeCompatibility.isAssignable(signature.getReturnType(), bodyType)) {
            mismatch(resultSpan(node.getBody()), signature.getReturnType(), bodyType);
        }

        exitCallable(mark);
        return RibTypes.UNIT;
    }

    @Override
    public RibType visitFilterDecl(FilterDecl node, RibType expected) {
        FunctionType signature = (FunctionType) callableSymbols.get(node).getType();
        int mark = enterCallable(node.getName(), node.getKind(), signature, node.getParams());

        RibType bodyType = check(node.getBody(), null);
        if (!(bodyType instanceof NeverType) && !TypeCompatibility.isError(bodyType)) {
            diagnostics.error(DiagnosticKind.MISSING_TERMINAL, node.getNameSpan(),
                    node.getKind().getKeyword() + " '" + node.getName()
                            + "' can finish without 'accept' or 'reject'");
        }

        exitCallable(mark);
        return RibTypes.UNIT;
    }

    private int enterCallable(String name, FilterDecl.Kind filterKind, FunctionType signature,
                              List<Parameter> params) {
        currentCallable = name;
        currentFilterKind = filterKind;
        currentReturnType = signature.getReturnType();
        callGraph.addNode(name);

        int mark = scopes.mark();
        scopes.push(Scope.ScopeType.FUNCTION);
        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            Symbol symbol = new Symbol(param.getName(), SymbolKind.PARAMETER, signature.getParamTypes().get(i),
                    param.getSpan(), param);
            defineLocal(symbol);
            program.recordDeclaration(param, symbol);
        }
        return mark;
    }

    private void exitCallable(int mark) {
        closeScope(scopes.pop());
        scopes.release(mark);
        currentCallable = null;
        currentFilterKind = null;
        currentReturnType = null;
    }

    // ============ 语句 ============

    @Override
    public RibType visitLetStmt(LetStmt node, RibType expected) {
        RibType declaredType = node.getType() != null ? typeResolver.resolve(node.getType(), null) : null;
        RibType initType = declaredType != null
                ? expect(node.getInitializer(), declaredType)
                : check(node.getInitializer(), null);
        Symbol symbol = new Symbol(node.getName(), SymbolKind.LOCAL,
                declaredType != null ? declaredType : initType, node.getNameSpan(), node);
        scopes.define(symbol);
        program.recordDeclaration(node, symbol);
        return initType instanceof NeverType ? RibTypes.NEVER : RibTypes.UNIT;
    }

    @Override
    public RibType visitExprStmt(ExprStmt node, RibType expected) {
        return check(node.getExpression(), null);
    }

    @Override
    public RibType visitForStmt(ForStmt node, RibType expected) {
        RibType iterable = check(node.getIterable(), null);
        RibType element;
        if (iterable instanceof ListType) {
            element = ((ListType) iterable).getElementType();
        } else if (iterable.equals(RibTypes.AS_PATH)) {
            element = RibTypes.ASN;
        } else if (TypeCompatibility.isError(iterable)) {
            element = RibTypes.ERROR;
        } else {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getIterable().getSpan(),
                    "Cannot iterate over '" + iterable.toDisplayString() + "'");
            element = RibTypes.ERROR;
        }

        scopes.push(Scope.ScopeType.LOOP);
        Symbol variable = new Symbol(node.getVariable(), SymbolKind.LOOP_VARIABLE, element,
                node.getVariableSpan(), node);
        scopes.define(variable);
        program.recordDeclaration(node, variable);
        check(node.getBody(), null);
        closeScope(scopes.pop());
        // 循环可能一次都不执行，不会发散
        return RibTypes.UNIT;
    }

    // ============ 表达式 ============

    @Override
    public RibType visitLiteralExpr(LiteralExpr node, RibType expected) {
        RibType type = RibTypes.builtin(node.getValue().getTypeName());
        if (type == null) {
            throw new IllegalStateException("Unexpected literal value " + node.getValue());
        }
        return type;
    }

    @Override
    public RibType visitIdentifierExpr(IdentifierExpr node, RibType expected) {
        String name = node.getName();
        Symbol symbol = scopes.resolve(name);
        if (symbol == null) {
            if (typeTable.findFunction(name) != null) {
                diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                        "Function '" + name + "' cannot be used as a value");
            } else if (typeResolver.isTypeName(name)) {
                diagnostics.error(DiagnosticKind.UNDEFINED_SYMBOL, node.getSpan(),
                        "'" + name + "' is a type, not a value");
            } else {
                diagnostics.error(DiagnosticKind.UNDEFINED_SYMBOL, node.getSpan(),
                        "Undefined symbol '" + name + "'");
            }
            return RibTypes.ERROR;
        }
        symbol.markUsed();
        program.recordReference(node, symbol);
        if (symbol.getKind().isCallable()) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Function '" + name + "' cannot be used as a value");
            return RibTypes.ERROR;
        }
        return symbol.getType();
    }

    @Override
    public RibType visitBinaryExpr(BinaryExpr node, RibType expected) {
        BinaryOp op = node.getOperator();
        switch (op) {
            case AND:
            case OR:
                operand(op, node.getLeft(), RibTypes.BOOL);
                operand(op, node.getRight(), RibTypes.BOOL);
                return RibTypes.BOOL;
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
                operand(op, node.getLeft(), RibTypes.INT);
                operand(op, node.getRight(), RibTypes.INT);
                return RibTypes.INT;
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE:
                checkComparison(node);
                return RibTypes.BOOL;
            case IN:
            case NOT_IN:
                checkMembership(node);
                return RibTypes.BOOL;
            default:
                throw new IllegalStateException("Unknown operator " + op);
        }
    }

    private void operand(BinaryOp op, Expression expr, RibType required) {
        RibType actual = check(expr, required);
        if (!TypeCompatibility.isAssignable(required, actual)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, resultSpan(expr),
                    "Operator '" + op.toSourceString() + "' expects '" + required.toDisplayString()
                            + "', found '" + actual.toDisplayString() + "'");
        }
    }

    private void checkComparison(BinaryExpr node) {
        BinaryOp op = node.getOperator();
        RibType left = check(node.getLeft(), null);
        RibType right = check(node.getRight(), hint(left));
        if (TypeCompatibility.isError(left) || TypeCompatibility.isError(right)) {
            return;
        }
        RibType joined = TypeCompatibility.join(left, right);
        if (joined == null) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Cannot compare '" + left.toDisplayString() + "' with '" + right.toDisplayString() + "'");
            return;
        }
        if (joined instanceof NeverType) {
            return;
        }
        boolean equality = op == BinaryOp.EQ || op == BinaryOp.NE;
        if (equality && !TypeCompatibility.supportsEquality(joined)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Type '" + joined.toDisplayString() + "' does not support equality");
        } else if (!equality && !TypeCompatibility.isOrdered(joined)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Operator '" + op.toSourceString() + "' is not defined for '" + joined.toDisplayString() + "'");
        }
    }

    private void checkMembership(BinaryExpr node) {
        RibType left = check(node.getLeft(), null);
        RibType right = check(node.getRight(), hint(left) != null ? new ListType(left) : null);
        if (TypeCompatibility.isError(left) || TypeCompatibility.isError(right)) {
            return;
        }
        boolean valid;
        if (right instanceof ListType) {
            valid = TypeCompatibility.isAssignable(((ListType) right).getElementType(), left);
        } else if (right.equals(RibTypes.PREFIX)) {
            valid = left.equals(RibTypes.IP_ADDR) || left.equals(RibTypes.PREFIX);
        } else if (right.equals(RibTypes.AS_PATH)) {
            valid = left.equals(RibTypes.ASN);
        } else {
            valid = right instanceof NeverType;
        }
        if (!valid && !(left instanceof NeverType)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Operator '" + node.getOperator().toSourceString() + "' is not defined for '"
                            + left.toDisplayString() + "' and '" + right.toDisplayString() + "'");
        }
    }

    @Override
    public RibType visitUnaryExpr(UnaryExpr node, RibType expected) {
        RibType required = node.getOperator() == UnaryExpr.UnaryOp.NOT ? RibTypes.BOOL : RibTypes.INT;
        RibType actual = check(node.getOperand(), required);
        if (!TypeCompatibility.isAssignable(required, actual)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, resultSpan(node.getOperand()),
                    "Operator '" + node.getOperator().toSourceString() + "' expects '"
                            + required.toDisplayString() + "', found '" + actual.toDisplayString() + "'");
        }
        return required;
    }

    @Override
    public RibType visitFieldAccessExpr(FieldAccessExpr node, RibType expected) {
        EnumType enumType = enumTypeReference(node.getTarget());
        if (enumType != null) {
            EnumType.Variant variant = enumType.findVariant(node.getName());
            if (variant == null) {
                undefinedVariant(enumType, node.getName(), node.getNameSpan());
                return RibTypes.ERROR;
            }
            if (!variant.getPayload().isEmpty()) {
                diagnostics.error(DiagnosticKind.ARITY_MISMATCH, node.getSpan(),
                        "Variant '" + enumType.getName() + "." + variant.getName() + "' expects "
                                + variant.getPayload().size() + " payload value(s)");
            }
            program.recordField(node, FieldTarget.enumVariant(enumType, variant));
            return enumType;
        }

        RibType target = check(node.getTarget(), null);
        String name = node.getName();
        if (TypeCompatibility.isError(target)) {
            return RibTypes.ERROR;
        }
        if (target instanceof RecordType) {
            RecordType record = (RecordType) target;
            int index = record.indexOf(name);
            if (index >= 0) {
                program.recordField(node, FieldTarget.recordField(record, index));
                return record.getFields().get(index).getType();
            }
        } else if (target instanceof ExternalType) {
            ExternalMember field = typeTable.findField(((ExternalType) target).getName(), name);
            if (field != null) {
                program.recordField(node, FieldTarget.externalField(field));
                return field.getReturnType();
            }
        }
        if (hasMethod(target, name)) {
            diagnostics.error(DiagnosticKind.UNDEFINED_FIELD, node.getNameSpan(),
                    "'" + name + "' is a method of '" + target.toDisplayString() + "'; call it as " + name + "()");
        } else {
            diagnostics.error(DiagnosticKind.UNDEFINED_FIELD, node.getNameSpan(),
                    "Type '" + target.toDisplayString() + "' has no field '" + name + "'");
        }
        return RibTypes.ERROR;
    }

    @Override
    public RibType visitCallExpr(CallExpr node, RibType expected) {
        Expression callee = node.getCallee();
        if (callee instanceof IdentifierExpr) {
            return checkFunctionCall(node, (IdentifierExpr) callee);
        }
        if (callee instanceof FieldAccessExpr) {
            return checkMethodCall(node, (FieldAccessExpr) callee);
        }
        RibType type = check(callee, null);
        if (!TypeCompatibility.isError(type)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, callee.getSpan(),
                    "Expression of type '" + type.toDisplayString() + "' is not callable");
        }
        checkLoosely(node.getArguments());
        return RibTypes.ERROR;
    }

    private RibType checkFunctionCall(CallExpr node, IdentifierExpr callee) {
        String name = callee.getName();
        Symbol symbol = scopes.resolve(name);
        if (symbol != null) {
            symbol.markUsed();
            program.recordReference(callee, symbol);
            program.recordType(callee, symbol.getType());
            if (symbol.getKind() == SymbolKind.FUNCTION) {
                FunctionType signature = (FunctionType) symbol.getType();
                checkArguments(node, signature.getParamTypes(), "Function '" + name + "'");
                callGraph.addEdge(currentCallable, name, node.getSpan());
                program.recordCall(node, CallTarget.function(symbol, signature.getReturnType()));
                return signature.getReturnType();
            }
            if (symbol.getKind() == SymbolKind.FILTER) {
                diagnostics.error(DiagnosticKind.ENTRY_POINT_CALL, callee.getSpan(),
                        "Filter '" + name + "' is an entry point and cannot be called");
            } else if (!TypeCompatibility.isError(symbol.getType())) {
                diagnostics.error(DiagnosticKind.TYPE_MISMATCH, callee.getSpan(),
                        "'" + name + "' of type '" + symbol.getType().toDisplayString() + "' is not callable");
            }
            checkLoosely(node.getArguments());
            return RibTypes.ERROR;
        }
        ExternalMember function = typeTable.findFunction(name);
        if (function != null) {
            program.recordType(callee, new FunctionType(function.getParamTypes(), function.getReturnType()));
            checkArguments(node, function.getParamTypes(), "Function '" + name + "'");
            program.recordCall(node, CallTarget.external(function));
            return function.getReturnType();
        }
        program.recordType(callee, RibTypes.ERROR);
        diagnostics.error(DiagnosticKind.UNDEFINED_SYMBOL, callee.getSpan(), "Undefined function '" + name + "'");
        checkLoosely(node.getArguments());
        return RibTypes.ERROR;
    }

    private RibType checkMethodCall(CallExpr node, FieldAccessExpr callee) {
        String name = callee.getName();
        EnumType enumType = enumTypeReference(callee.getTarget());
        if (enumType != null) {
            EnumType.Variant variant = enumType.findVariant(name);
            if (variant == null) {
                program.recordType(callee, RibTypes.ERROR);
                undefinedVariant(enumType, name, callee.getNameSpan());
                checkLoosely(node.getArguments());
                return RibTypes.ERROR;
            }
            program.recordType(callee, new FunctionType(variant.getPayload(), enumType));
            checkArguments(node, variant.getPayload(), "Variant '" + enumType.getName() + "." + name + "'");
            program.recordCall(node, CallTarget.variant(enumType, variant));
            return enumType;
        }

        RibType receiver = check(callee.getTarget(), null);
        if (TypeCompatibility.isError(receiver)) {
            program.recordType(callee, RibTypes.ERROR);
            checkLoosely(node.getArguments());
            return RibTypes.ERROR;
        }
        if (receiver instanceof ExternalType) {
            ExternalMember method = typeTable.findMethod(((ExternalType) receiver).getName(), name);
            if (method != null) {
                program.recordType(callee, new FunctionType(method.getParamTypes(), method.getReturnType()));
                checkArguments(node, method.getParamTypes(), "Method '" + method.getSymbol() + "'");
                program.recordCall(node, CallTarget.external(method));
                return method.getReturnType();
            }
        } else {
            BuiltinMethod builtin = findBuiltin(receiver, name);
            if (builtin != null) {
                RibType element = receiver instanceof ListType ? ((ListType) receiver).getElementType() : null;
                List<RibType> params = new ArrayList<RibType>();
                for (int i = 0; i < builtin.getParameterCount(); i++) {
                    params.add(builtinType(builtin.getParameterType(i), element));
                }
                RibType returnType = builtinType(builtin.getReturnType(), element);
                program.recordType(callee, new FunctionType(params, returnType));
                checkArguments(node, params, "Method '" + receiver.toDisplayString() + "." + name + "'");
                program.recordCall(node, CallTarget.builtin(builtin, returnType));
                return returnType;
            }
        }
        program.recordType(callee, RibTypes.ERROR);
        if (receiver instanceof ExternalType
                && typeTable.findField(((ExternalType) receiver).getName(), name) != null) {
            diagnostics.error(DiagnosticKind.UNDEFINED_METHOD, callee.getNameSpan(),
                    "'" + name + "' is a field of '" + receiver.toDisplayString() + "', not a method");
        } else {
            diagnostics.error(DiagnosticKind.UNDEFINED_METHOD, callee.getNameSpan(),
                    "Type '" + receiver.toDisplayString() + "' has no method '" + name + "'");
        }
        checkLoosely(node.getArguments());
        return RibTypes.ERROR;
    }

    private void checkArguments(CallExpr node, List<RibType> params, String what) {
        List<Expression> args = node.getArguments();
        if (args.size() != params.size()) {
            diagnostics.error(DiagnosticKind.ARITY_MISMATCH, node.getSpan(),
                    what + " expects " + params.size() + " argument(s), found " + args.size());
            checkLoosely(args);
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            expect(args.get(i), params.get(i));
        }
    }

    @Override
    public RibType visitRecordExpr(RecordExpr node, RibType expected) {
        if (node.getTypeName() != null) {
            RibType named = typeResolver.findNamed(node.getTypeName());
            if (named == null) {
                diagnostics.error(DiagnosticKind.UNDEFINED_TYPE, node.getSpan(),
                        "Undefined type '" + node.getTypeName() + "'");
                checkFieldsLoosely(node);
                return RibTypes.ERROR;
            }
            if (!(named instanceof RecordType)) {
                diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                        "Type '" + node.getTypeName() + "' is not a record type");
                checkFieldsLoosely(node);
                return RibTypes.ERROR;
            }
            return checkRecordAgainst(node, (RecordType) named);
        }
        if (expected instanceof RecordType) {
            return checkRecordAgainst(node, (RecordType) expected);
        }

        // 匿名记录：按字段推断
        Set<String> seen = new HashSet<String>();
        List<RecordType.Field> fields = new ArrayList<RecordType.Field>();
        for (RecordExpr.FieldInit init : node.getFields()) {
            RibType type = check(init.getValue(), null);
            if (!seen.add(init.getName())) {
                duplicateField(init);
                continue;
            }
            fields.add(new RecordType.Field(init.getName(), type));
        }
        return new RecordType(null, fields);
    }

    private RibType checkRecordAgainst(RecordExpr node, RecordType target) {
        Set<String> seen = new HashSet<String>();
        for (RecordExpr.FieldInit init : node.getFields()) {
            RecordType.Field field = target.getField(init.getName());
            if (field == null) {
                diagnostics.error(DiagnosticKind.UNDEFINED_FIELD, init.getSpan(),
                        "Type '" + target.toDisplayString() + "' has no field '" + init.getName() + "'");
                check(init.getValue(), null);
                continue;
            }
            if (!seen.add(init.getName())) {
                duplicateField(init);
                check(init.getValue(), null);
                continue;
            }
            expect(init.getValue(), field.getType());
        }
        List<String> missing = new ArrayList<String>();
        for (RecordType.Field field : target.getFields()) {
            if (!seen.contains(field.getName())) {
                missing.add(field.getName());
            }
        }
        if (!missing.isEmpty()) {
            diagnostics.error(DiagnosticKind.MISSING_FIELD, node.getSpan(),
                    "Missing field(s) " + String.join(", ", missing) + " in '" + target.toDisplayString() + "'");
        }
        return target;
    }

    private void duplicateField(RecordExpr.FieldInit init) {
        diagnostics.error(DiagnosticKind.DUPLICATE_DEFINITION, init.getSpan(),
                "Duplicate field '" + init.getName() + "'");
    }

    private void checkFieldsLoosely(RecordExpr node) {
        for (RecordExpr.FieldInit init : node.getFields()) {
            check(init.getValue(), null);
        }
    }

    @Override
    public RibType visitListExpr(ListExpr node, RibType expected) {
        if (expected instanceof ListType) {
            RibType element = ((ListType) expected).getElementType();
            for (Expression e : node.getElements()) {
                expect(e, element);
            }
            return expected;
        }
        if (node.getElements().isEmpty()) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getSpan(),
                    "Cannot infer the element type of an empty list; add a type annotation");
            return RibTypes.ERROR;
        }
        RibType element = null;
        for (Expression e : node.getElements()) {
            RibType type = check(e, element);
            if (element == null) {
                element = type;
                continue;
            }
            RibType joined = TypeCompatibility.join(element, type);
            if (joined == null) {
                mismatch(resultSpan(e), element, type);
            } else {
                element = joined;
            }
        }
        return TypeCompatibility.isError(element) ? RibTypes.ERROR : new ListType(element);
    }

    @Override
    public RibType visitBlockExpr(BlockExpr node, RibType expected) {
        scopes.push(Scope.ScopeType.BLOCK);
        boolean diverged = false;
        boolean warned = false;
        for (Statement stmt : node.getStatements()) {
            if (diverged && !warned) {
                diagnostics.warning(DiagnosticKind.UNREACHABLE_CODE, stmt.getSpan(), "Unreachable code");
                warned = true;
            }
            if (stmt.accept(this, null) instanceof NeverType) {
                diverged = true;
            }
        }
        RibType result = diverged ? RibTypes.NEVER : RibTypes.UNIT;
        if (node.getTail() != null) {
            if (diverged && !warned) {
                diagnostics.warning(DiagnosticKind.UNREACHABLE_CODE, node.getTail().getSpan(), "Unreachable code");
            }
            RibType tail = check(node.getTail(), expected);
            if (!diverged) {
                result = tail;
            }
        }
        closeScope(scopes.pop());
        // 块内已报告过语法错误，它的值类型不可信
        return node.isRecovered() ? RibTypes.ERROR : result;
    }

    @Override
    public RibType visitIfExpr(IfExpr node, RibType expected) {
        expect(node.getCondition(), RibTypes.BOOL);
        if (!node.hasElse()) {
            RibType thenType = check(node.getThenBranch(), RibTypes.UNIT);
            if (!TypeCompatibility.isAssignable(RibTypes.UNIT, thenType)) {
                mismatch(resultSpan(node.getThenBranch()), RibTypes.UNIT, thenType);
            }
            return RibTypes.UNIT;
        }
        RibType thenType = check(node.getThenBranch(), expected);
        RibType elseType = check(node.getElseBranch(), expected);
        RibType joined = TypeCompatibility.join(thenType, elseType);
        if (joined == null) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, resultSpan(node.getElseBranch()),
                    "if and else branches have incompatible types '" + thenType.toDisplayString()
                            + "' and '" + elseType.toDisplayString() + "'");
            return RibTypes.ERROR;
        }
        return joined;
    }

    @Override
    public RibType visitMatchExpr(MatchExpr node, RibType expected) {
        RibType scrutinee = check(node.getScrutinee(), null);
        EnumType enumType = null;
        if (scrutinee instanceof EnumType) {
            enumType = (EnumType) scrutinee;
        } else if (!TypeCompatibility.isError(scrutinee)) {
            diagnostics.error(DiagnosticKind.TYPE_MISMATCH, node.getScrutinee().getSpan(),
                    "match requires an enum value, found '" + scrutinee.toDisplayString() + "'");
        }

        Set<String> covered = new HashSet<String>();
        boolean wildcardSeen = false;
        boolean incompatible = false;
        RibType result = RibTypes.NEVER;
        for (MatchExpr.Arm arm : node.getArms()) {
            scopes.push(Scope.ScopeType.ARM);
            EnumType.Variant variant = null;
            if (enumType != null) {
                if (arm.isWildcard()) {
                    if (wildcardSeen || covered.size() == enumType.getVariants().size()) {
                        diagnostics.warning(DiagnosticKind.UNREACHABLE_PATTERN, arm.getPatternSpan(),
                                "Unreachable pattern: all variants are already covered");
                    }
                } else {
                    variant = enumType.findVariant(arm.getVariant());
                    if (variant == null) {
                        undefinedVariant(enumType, arm.getVariant(), arm.getPatternSpan());
                    } else if (wildcardSeen || covered.contains(variant.getName())) {
                        diagnostics.warning(DiagnosticKind.UNREACHABLE_PATTERN, arm.getPatternSpan(),
                                "Unreachable pattern: variant '" + variant.getName() + "' is already covered");
                    }
                }
            }
            defineBindings(arm, enumType, variant);
            if (arm.getGuard() != null) {
                expect(arm.getGuard(), RibTypes.BOOL);
            }
            RibType armType = check(arm.getBody(), expected);
            closeScope(scopes.pop());

            if (arm.getGuard() == null) {
                if (arm.isWildcard()) {
                    wildcardSeen = true;
                } else if (variant != null) {
                    covered.add(variant.getName());
                }
            }
            if (!incompatible) {
                RibType joined = TypeCompatibility.join(result, armType);
                if (joined == null) {
                    diagnostics.error(DiagnosticKind.TYPE_MISMATCH, resultSpan(arm.getBody()),
                            "match arms have incompatible types '" + result.toDisplayString()
                                    + "' and '" + armType.toDisplayString() + "'");
                    incompatible = true;
                    result = RibTypes.ERROR;
                } else {
                    result = joined;
                }
            }
        }

        if (enumType == null || node.isRecovered()) {
            return RibTypes.ERROR;
        }
        if (!wildcardSeen) {
            List<String> missing = new ArrayList<String>();
            for (EnumType.Variant v : enumType.getVariants()) {
                if (!covered.contains(v.getName())) {
                    missing.add(v.getName());
                }
            }
            if (!missing.isEmpty()) {
                diagnostics.error(DiagnosticKind.NON_EXHAUSTIVE_MATCH, node.getSpan(),
                        "Non-exhaustive match on '" + enumType.getName() + "': missing variant(s) "
                                + String.join(", ", missing));
            }
        }
        return result;
    }

    private void defineBindings(MatchExpr.Arm arm, EnumType enumType, EnumType.Variant variant) {
        List<RibType> payload = variant != null ? variant.getPayload() : Collections.<RibType>emptyList();
        if (variant != null && arm.getBindings().size() != payload.size()) {
            diagnostics.error(DiagnosticKind.ARITY_MISMATCH, arm.getPatternSpan(),
                    "Variant '" + enumType.getName() + "." + variant.getName() + "' has " + payload.size()
                            + " payload value(s), found " + arm.getBindings().size() + " binding(s)");
        }
        Map<String, Span> seen = new HashMap<String, Span>();
        for (int i = 0; i < arm.getBindings().size(); i++) {
            MatchExpr.Binding binding = arm.getBindings().get(i);
            Span first = seen.get(binding.getName());
            if (first != null) {
                diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                                "Duplicate binding '" + binding.getName() + "'", binding.getSpan())
                        .withLabel(first, "first bound here"));
                continue;
            }
            seen.put(binding.getName(), binding.getSpan());
            RibType type = i < payload.size() ? payload.get(i) : RibTypes.ERROR;
            Symbol symbol = new Symbol(binding.getName(), SymbolKind.PATTERN_BINDING, type, binding.getSpan(), binding);
            scopes.define(symbol);
            program.recordDeclaration(binding, symbol);
        }
    }

    @Override
    public RibType visitErrorExpr(ErrorExpr node, RibType expected) {
        return RibTypes.ERROR;
    }

    @Override
    public RibType visitTerminalExpr(TerminalExpr node, RibType expected) {
        Expression value = node.getValue();
        switch (node.getKind()) {
            case ACCEPT:
                if (currentFilterKind == null) {
                    invalidTerminal(node, "'accept' is only allowed in a filter");
                    checkValueLoosely(value);
                } else if (currentFilterKind == FilterDecl.Kind.FILTER) {
                    if (value != null) {
                        invalidTerminal(node, "'accept' in a filter takes no value; use filtermap to produce output");
                        check(value, null);
                    }
                } else if (value == null) {
                    if (!TypeCompatibility.isAssignable(currentReturnType, RibTypes.UNIT)) {
                        invalidTerminal(node, "'accept' in filtermap '" + currentCallable + "' needs a value of type '"
                                + currentReturnType.toDisplayString() + "'");
                    }
                } else {
                    expect(value, currentReturnType);
                }
                break;
            case REJECT:
                if (currentFilterKind == null) {
                    invalidTerminal(node, "'reject' is only allowed in a filter");
                }
                break;
            case RETURN:
                if (currentFilterKind != null) {
                    invalidTerminal(node, "'return' is not allowed in a filter; use 'accept' or 'reject'");
                    checkValueLoosely(value);
                } else if (value == null) {
                    if (!TypeCompatibility.isAssignable(currentReturnType, RibTypes.UNIT)) {
                        mismatch(node.getSpan(), currentReturnType, RibTypes.UNIT);
                    }
                } else {
                    expect(value, currentReturnType);
                }
                break;
            case ABORT:
                expect(value, RibTypes.STRING);
                break;
            default:
                throw new IllegalStateException("Unknown terminal " + node.getKind());
        }
        return RibTypes.NEVER;
    }

    private void invalidTerminal(TerminalExpr node, String message) {
        diagnostics.error(DiagnosticKind.INVALID_TERMINAL, node.getSpan(), message);
    }

    private void checkValueLoosely(Expression value) {
        if (value != null) {
            check(value, null);
        }
    }

    // ============ 辅助方法 ============

    /** 检查表达式并记录类型 */
    private RibType check(Expression expr, RibType expected) {
        RibType type = expr.accept(this, expected);
        program.recordType(expr, type);
        return type;
    }

    /** 检查表达式，类型不可赋给 expected 时报告 TYPE_MISMATCH */
    private RibType expect(Expression expr, RibType expected) {
        RibType type = check(expr, expected);
        if (!TypeCompatibility.isAssignable(expected, type)) {
            mismatch(resultSpan(expr), expected, type);
        }
        return type;
    }

    private void checkLoosely(List<Expression> exprs) {
        for (Expression e : exprs) {
            check(e, null);
        }
    }

    private void mismatch(Span span, RibType expected, RibType actual) {
        diagnostics.error(DiagnosticKind.TYPE_MISMATCH, span,
                "Expected '" + expected.toDisplayString() + "', found '" + actual.toDisplayString() + "'");
    }

    private void undefinedVariant(EnumType enumType, String name, Span span) {
        diagnostics.error(DiagnosticKind.UNDEFINED_VARIANT, span,
                "Enum '" + enumType.getName() + "' has no variant '" + name + "'");
    }

    /** 块的值来自尾表达式，类型错误指向尾表达式 */
    private Span resultSpan(Expression expr) {
        if (expr instanceof BlockExpr && ((BlockExpr) expr).getTail() != null) {
            return resultSpan(((BlockExpr) expr).getTail());
        }
        return expr.getSpan();
    }

    /** 用作推断提示的类型：错误类型和 Never 不提供信息 */
    private static RibType hint(RibType type) {
        if (TypeCompatibility.isError(type) || type instanceof NeverType) {
            return null;
        }
        return type;
    }

    /**
     * {@code Color.Red} 中的 {@code Color}：不是值，而是枚举类型名
     */
    private EnumType enumTypeReference(Expression target) {
        if (!(target instanceof IdentifierExpr)) {
            return null;
        }
        String name = ((IdentifierExpr) target).getName();
        if (scopes.resolve(name) != null) {
            return null;
        }
        RibType type = typeResolver.findNamed(name);
        if (type instanceof EnumType) {
            program.recordType(target, type);
            return (EnumType) type;
        }
        return null;
    }

    private BuiltinMethod findBuiltin(RibType receiver, String name) {
        if (receiver instanceof ListType) {
            return BuiltinMethod.find(RibTypes.LIST, name);
        }
        if (receiver instanceof PrimitiveType) {
            return BuiltinMethod.find(receiver.getTypeName(), name);
        }
        return null;
    }

    private boolean hasMethod(RibType receiver, String name) {
        if (receiver instanceof ExternalType) {
            return typeTable.findMethod(((ExternalType) receiver).getName(), name) != null;
        }
        return findBuiltin(receiver, name) != null;
    }

    private static RibType builtinType(String name, RibType element) {
        if (BuiltinMethod.ELEMENT.equals(name)) {
            return element;
        }
        RibType type = RibTypes.builtin(name);
        if (type == null) {
            throw new IllegalStateException("Unknown builtin signature type " + name);
        }
        return type;
    }

    private void defineLocal(Symbol symbol) {
        Symbol previous = scopes.current().resolveLocal(symbol.getName());
        if (previous != null) {
            diagnostics.report(Diagnostic.error(DiagnosticKind.DUPLICATE_DEFINITION,
                            "Duplicate parameter '" + symbol.getName() + "'", symbol.getSpan())
                    .withLabel(previous.getSpan(), "first defined here"));
            return;
        }
        scopes.define(symbol);
    }

    /** 作用域结束时报告未使用的局部声明 */
    private void closeScope(Scope scope) {
        for (Symbol symbol : scope.getDeclared()) {
            if (symbol.getKind().isWarnedWhenUnused() && !symbol.isUsed() && !symbol.isIgnored()) {
                String what = symbol.getKind() == SymbolKind.PATTERN_BINDING ? "binding" : "variable";
                diagnostics.warning(DiagnosticKind.UNUSED_DECLARATION, symbol.getSpan(),
                        "Unused " + what + " '" + symbol.getName() + "'");
            }
        }
    }
}
