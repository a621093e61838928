package com.riblang.ir.lowering;

import com.riblang.compiler.analysis.CallTarget;
import com.riblang.compiler.analysis.FieldTarget;
import com.riblang.compiler.analysis.Symbol;
import com.riblang.compiler.analysis.TypedProgram;
import com.riblang.compiler.analysis.types.EnumType;
import com.riblang.compiler.analysis.types.FunctionType;
import com.riblang.compiler.analysis.types.ListType;
import com.riblang.compiler.analysis.types.RecordType;
import com.riblang.compiler.analysis.types.RibType;
import com.riblang.compiler.analysis.types.RibTypes;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.ast.decl.FilterDecl;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.decl.Parameter;
import com.riblang.compiler.ast.expr.BinaryExpr;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.CallExpr;
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
import com.riblang.compiler.host.ExternalMember;
import com.riblang.ir.ir.BasicBlock;
import com.riblang.ir.ir.BinaryOp;
import com.riblang.ir.ir.IrBuilder;
import com.riblang.ir.ir.IrFunction;
import com.riblang.ir.ir.IrModule;
import com.riblang.ir.ir.IrTerminator;
import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.UnaryOp;
import com.riblang.ir.ir.VariantShape;
import rib.runtime.RibBool;
import rib.runtime.RibInt;
import rib.runtime.RibUnit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 类型检查后的 AST → IR 降级。
 * 将结构化控制流（if、match、for、短路运算、终止表达式）转换为 CFG（BasicBlock + Terminator）。
 *
 * <p>要求输入的 TypedProgram 没有错误诊断：所有类型、符号和调用目标都已解析。
 * 子表达式按从左到右的顺序降级到新的临时槽位；分支的值通过 MOVE 写入共享的结果槽位。</p>
 */
public class IrLowering {

    private final TypedProgram program;

    private IrBuilder builder;
    private Map<Symbol, Integer> slots;

    public IrLowering(TypedProgram program) {
        this.program = program;
    }

    public IrModule lower() {
        IrModule module = new IrModule(program.getSourceFile().getUnitId());
        for (Declaration decl : program.getSourceFile().getDeclarations()) {
            if (decl instanceof FunctionDecl) {
                FunctionDecl fn = (FunctionDecl) decl;
                module.addFunction(lowerCallable(decl, IrFunction.Kind.FUNCTION, fn.getParams(), fn.getBody()));
            } else if (decl instanceof FilterDecl) {
                FilterDecl filter = (FilterDecl) decl;
                IrFunction.Kind kind = filter.getKind() == FilterDecl.Kind.FILTER_MAP
                        ? IrFunction.Kind.FILTER_MAP : IrFunction.Kind.FILTER;
                module.addFunction(lowerCallable(decl, kind, filter.getParams(), filter.getBody()));
            }
        }
        return module;
    }

    // ============ 函数 ============

    private IrFunction lowerCallable(Declaration decl, IrFunction.Kind kind, List<Parameter> params, BlockExpr body) {
        FunctionType signature = (FunctionType) program.callableOf(decl).getType();
        List<String> paramNames = new ArrayList<>();
        for (Parameter param : params) {
            paramNames.add(param.getName());
        }
        IrFunction function = new IrFunction(decl.getName(), kind, paramNames,
                signature.getParamTypes(), signature.getReturnType());
        builder = new IrBuilder(function);
        slots = new IdentityHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            slots.put(program.declaredSymbol(params.get(i)), i);
        }

        int value = lowerBlock(body);
        if (kind == IrFunction.Kind.FUNCTION) {
            builder.terminate(new IrTerminator.Return(body.getSpan(), value));
        } else {
            // filter 体的类型为 Never，末尾不可达
            builder.terminate(new IrTerminator.Unreachable(body.getSpan()));
        }
        builder = null;
        slots = null;
        return function;
    }

    // ============ 语句 ============

    private int lowerBlock(BlockExpr block) {
        for (Statement stmt : block.getStatements()) {
            lowerStatement(stmt);
        }
        if (block.getTail() != null) {
            return lowerExpr(block.getTail());
        }
        return unit(block.getSpan());
    }

    private void lowerStatement(Statement stmt) {
        if (stmt instanceof LetStmt) {
            LetStmt let = (LetStmt) stmt;
            int value = lowerExpr(let.getInitializer());
            int local = builder.newLocal(let.getName());
            builder.emitMove(local, value, let.getSpan());
            slots.put(program.declaredSymbol(let), local);
        } else if (stmt instanceof ExprStmt) {
            lowerExpr(((ExprStmt) stmt).getExpression());
        } else if (stmt instanceof ForStmt) {
            lowerFor((ForStmt) stmt);
        } else {
            throw new IllegalStateException("Unknown statement " + stmt.getClass().getSimpleName());
        }
    }

    /**
     * for x in xs { body }：
     * <pre>
     *   %coll = xs; %i = 0; goto head
     *   head: iter_next %coll[%i] -> %x ? body : exit
     *   body: ...; goto head
     *   exit:
     * </pre>
     */
    private void lowerFor(ForStmt node) {
        Span loc = node.getSpan();
        int collection = lowerExpr(node.getIterable());
        int index = builder.emitConst(RibInt.ZERO, loc);
        int variable = builder.newLocal(node.getVariable());
        slots.put(program.declaredSymbol(node), variable);

        BasicBlock headBlock = builder.newBlock();
        BasicBlock bodyBlock = builder.newBlock();
        BasicBlock exitBlock = builder.newBlock();
        builder.emitGoto(headBlock.getId(), loc);

        builder.switchToBlock(headBlock);
        builder.terminate(new IrTerminator.IterNext(loc, collection, index, variable,
                bodyBlock.getId(), exitBlock.getId()));

        builder.switchToBlock(bodyBlock);
        lowerBlock(node.getBody());
        builder.emitGoto(headBlock.getId(), loc);

        builder.switchToBlock(exitBlock);
    }

    // ============ 表达式 ============

    private int lowerExpr(Expression expr) {
        if (expr instanceof LiteralExpr) {
            return builder.emitConst(((LiteralExpr) expr).getValue(), expr.getSpan());
        }
        if (expr instanceof IdentifierExpr) {
            return lowerIdentifier((IdentifierExpr) expr);
        }
        if (expr instanceof BinaryExpr) {
            return lowerBinary((BinaryExpr) expr);
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            int operand = lowerExpr(unary.getOperand());
            UnaryOp op = unary.getOperator() == UnaryExpr.UnaryOp.NOT ? UnaryOp.NOT : UnaryOp.NEG;
            return builder.emitUnary(op, operand, expr.getSpan());
        }
        if (expr instanceof FieldAccessExpr) {
            return lowerFieldAccess((FieldAccessExpr) expr);
        }
        if (expr instanceof CallExpr) {
            return lowerCall((CallExpr) expr);
        }
        if (expr instanceof RecordExpr) {
            return lowerRecord((RecordExpr) expr);
        }
        if (expr instanceof ListExpr) {
            List<Expression> elements = ((ListExpr) expr).getElements();
            return builder.emitNewList(lowerAll(elements, -1), expr.getSpan());
        }
        if (expr instanceof BlockExpr) {
            return lowerBlock((BlockExpr) expr);
        }
        if (expr instanceof IfExpr) {
            return lowerIf((IfExpr) expr);
        }
        if (expr instanceof MatchExpr) {
            return lowerMatch((MatchExpr) expr);
        }
        if (expr instanceof TerminalExpr) {
            return lowerTerminal((TerminalExpr) expr);
        }
        throw new IllegalStateException("Unknown expression " + expr.getClass().getSimpleName());
    }

    private int lowerIdentifier(IdentifierExpr expr) {
        Symbol symbol = program.symbolOf(expr);
        Integer slot = symbol != null ? slots.get(symbol) : null;
        if (slot == null) {
            throw new IllegalStateException("Unresolved identifier '" + expr.getName() + "' at " + expr.getSpan());
        }
        return slot;
    }

    private int lowerBinary(BinaryExpr expr) {
        BinaryExpr.BinaryOp op = expr.getOperator();
        if (op == BinaryExpr.BinaryOp.AND || op == BinaryExpr.BinaryOp.OR) {
            return lowerShortCircuit(expr, op == BinaryExpr.BinaryOp.AND);
        }
        Span loc = expr.getSpan();
        int left = lowerExpr(expr.getLeft());
        int right = lowerExpr(expr.getRight());
        switch (op) {
            case ADD: return builder.emitBinary(BinaryOp.ADD, left, right, loc);
            case SUB: return builder.emitBinary(BinaryOp.SUB, left, right, loc);
            case MUL: return builder.emitBinary(BinaryOp.MUL, left, right, loc);
            case DIV: return builder.emitBinary(BinaryOp.DIV, left, right, loc);
            case MOD: return builder.emitBinary(BinaryOp.MOD, left, right, loc);
            case EQ: return builder.emitBinary(BinaryOp.EQ, left, right, loc);
            case NE: return builder.emitBinary(BinaryOp.NE, left, right, loc);
            case LT: return builder.emitBinary(BinaryOp.LT, left, right, loc);
            case LE: return builder.emitBinary(BinaryOp.LE, left, right, loc);
            case GT: return builder.emitBinary(BinaryOp.GT, left, right, loc);
            case GE: return builder.emitBinary(BinaryOp.GE, left, right, loc);
            case IN:
                return builder.emitBinary(membershipOp(expr), left, right, loc);
            case NOT_IN:
                int contains = builder.emitBinary(membershipOp(expr), left, right, loc);
                return builder.emitUnary(UnaryOp.NOT, contains, loc);
            default:
                throw new IllegalStateException("Unknown operator " + op);
        }
    }

    /** 按右操作数类型选择包含运算 */
    private BinaryOp membershipOp(BinaryExpr expr) {
        RibType right = program.typeOf(expr.getRight());
        if (right.equals(RibTypes.PREFIX)) {
            return program.typeOf(expr.getLeft()).equals(RibTypes.PREFIX)
                    ? BinaryOp.PREFIX_COVERED : BinaryOp.PREFIX_CONTAINS;
        }
        if (right.equals(RibTypes.AS_PATH)) {
            return BinaryOp.AS_PATH_CONTAINS;
        }
        // List，或已发散（Never）的右操作数
        return BinaryOp.LIST_CONTAINS;
    }

    /**
     * a &amp;&amp; b / a || b：右操作数只在需要它的分支里求值。
     */
    private int lowerShortCircuit(BinaryExpr expr, boolean isAnd) {
        Span loc = expr.getSpan();
        int left = lowerExpr(expr.getLeft());
        int result = builder.newTemp();

        BasicBlock rhsBlock = builder.newBlock();
        BasicBlock shortBlock = builder.newBlock();
        BasicBlock mergeBlock = builder.newBlock();
        if (isAnd) {
            builder.emitBranch(left, rhsBlock.getId(), shortBlock.getId(), loc);
        } else {
            builder.emitBranch(left, shortBlock.getId(), rhsBlock.getId(), loc);
        }

        builder.switchToBlock(rhsBlock);
        int right = lowerExpr(expr.getRight());
        builder.emitMove(result, right, loc);
        builder.emitGoto(mergeBlock.getId(), loc);

        builder.switchToBlock(shortBlock);
        builder.emitMove(result, builder.emitConst(RibBool.of(!isAnd), loc), loc);
        builder.emitGoto(mergeBlock.getId(), loc);

        builder.switchToBlock(mergeBlock);
        return result;
    }

    private int lowerFieldAccess(FieldAccessExpr expr) {
        FieldTarget target = program.fieldTarget(expr);
        Span loc = expr.getSpan();
        switch (target.getKind()) {
            case RECORD_FIELD:
                return builder.emitGetField(lowerExpr(expr.getTarget()), target.getFieldIndex(), loc);
            case EXTERNAL_FIELD:
                int receiver = lowerExpr(expr.getTarget());
                return builder.emitCallExternal(target.getExternal(), new int[]{receiver}, loc);
            case ENUM_VARIANT:
                return builder.emitNewVariant(variantShape(target.getEnumType(), target.getVariant()),
                        new int[0], loc);
            default:
                throw new IllegalStateException("Unknown field target " + target.getKind());
        }
    }

    private int lowerCall(CallExpr expr) {
        CallTarget target = program.callTarget(expr);
        Span loc = expr.getSpan();
        List<Expression> args = expr.getArguments();
        switch (target.getKind()) {
            case FUNCTION:
                return builder.emitCall(target.getFunction().getName(), lowerAll(args, -1), loc);
            case VARIANT:
                return builder.emitNewVariant(variantShape(target.getEnumType(), target.getVariant()),
                        lowerAll(args, -1), loc);
            case EXTERNAL:
                ExternalMember member = target.getExternal();
                return builder.emitCallExternal(member, lowerWithReceiver(expr, target), loc);
            case BUILTIN:
                return builder.emitCallBuiltin(target.getBuiltin(), lowerWithReceiver(expr, target), loc);
            default:
                throw new IllegalStateException("Unknown call target " + target.getKind());
        }
    }

    /** 接收者（若有）先于参数求值，并作为第一个操作数 */
    private int[] lowerWithReceiver(CallExpr expr, CallTarget target) {
        if (!target.hasReceiver()) {
            return lowerAll(expr.getArguments(), -1);
        }
        int receiver = lowerExpr(((FieldAccessExpr) expr.getCallee()).getTarget());
        return lowerAll(expr.getArguments(), receiver);
    }

    private int[] lowerAll(List<Expression> exprs, int leading) {
        int offset = leading >= 0 ? 1 : 0;
        int[] result = new int[exprs.size() + offset];
        if (leading >= 0) {
            result[0] = leading;
        }
        for (int i = 0; i < exprs.size(); i++) {
            result[i + offset] = lowerExpr(exprs.get(i));
        }
        return result;
    }

    /**
     * 字段值按源码顺序求值，再按字段名排序作为操作数。
     */
    private int lowerRecord(RecordExpr expr) {
        RecordType type = (RecordType) program.typeOf(expr);
        int[] fields = new int[type.getFields().size()];
        Arrays.fill(fields, -1);
        for (RecordExpr.FieldInit init : expr.getFields()) {
            fields[type.indexOf(init.getName())] = lowerExpr(init.getValue());
        }
        return builder.emitNewRecord(new RecordShape(type.getName(), type.fieldNames()), fields, expr.getSpan());
    }

    private int lowerIf(IfExpr node) {
        Span loc = node.getSpan();
        int cond = lowerExpr(node.getCondition());

        BasicBlock thenBlock = builder.newBlock();
        BasicBlock elseBlock = node.hasElse() ? builder.newBlock() : null;
        BasicBlock mergeBlock = builder.newBlock();

        if (!node.hasElse()) {
            builder.emitBranch(cond, thenBlock.getId(), mergeBlock.getId(), loc);
            builder.switchToBlock(thenBlock);
            lowerBlock(node.getThenBranch());
            builder.emitGoto(mergeBlock.getId(), loc);
            builder.switchToBlock(mergeBlock);
            return unit(loc);
        }

        int result = builder.newTemp();
        builder.emitBranch(cond, thenBlock.getId(), elseBlock.getId(), loc);

        builder.switchToBlock(thenBlock);
        builder.emitMove(result, lowerBlock(node.getThenBranch()), loc);
        builder.emitGoto(mergeBlock.getId(), loc);

        builder.switchToBlock(elseBlock);
        builder.emitMove(result, lowerExpr(node.getElseBranch()), loc);
        builder.emitGoto(mergeBlock.getId(), loc);

        builder.switchToBlock(mergeBlock);
        return result;
    }

    private int lowerMatch(MatchExpr node) {
        int scrutinee = lowerExpr(node.getScrutinee());
        EnumType enumType = (EnumType) program.typeOf(node.getScrutinee());
        int result = builder.newTemp();
        BasicBlock mergeBlock = builder.newBlock();

        boolean guarded = false;
        for (MatchExpr.Arm arm : node.getArms()) {
            guarded |= arm.getGuard() != null;
        }
        if (guarded) {
            lowerMatchChain(node, enumType, scrutinee, result, mergeBlock);
        } else {
            lowerMatchSwitch(node, enumType, scrutinee, result, mergeBlock);
        }
        builder.switchToBlock(mergeBlock);
        return result;
    }

    /**
     * 无守卫：按 tag 直接分派，每个变体跳到第一个覆盖它的分支。
     */
    private void lowerMatchSwitch(MatchExpr node, EnumType enumType, int scrutinee, int result,
                                  BasicBlock mergeBlock) {
        int[] targets = new int[enumType.getVariants().size()];
        Arrays.fill(targets, -1);
        List<BasicBlock> armBlocks = new ArrayList<>();
        for (MatchExpr.Arm arm : node.getArms()) {
            BasicBlock armBlock = builder.newBlock();
            armBlocks.add(armBlock);
            for (EnumType.Variant variant : enumType.getVariants()) {
                boolean covers = arm.isWildcard() || variant.getName().equals(arm.getVariant());
                if (covers && targets[variant.getTag()] < 0) {
                    targets[variant.getTag()] = armBlock.getId();
                }
            }
        }
        BasicBlock fallback = null;
        for (int i = 0; i < targets.length; i++) {
            if (targets[i] < 0) {
                if (fallback == null) {
                    fallback = builder.newBlock();
                }
                targets[i] = fallback.getId();
            }
        }
        builder.terminate(new IrTerminator.Switch(node.getSpan(), scrutinee, targets));

        for (int i = 0; i < armBlocks.size(); i++) {
            builder.switchToBlock(armBlocks.get(i));
            lowerArmBody(node.getArms().get(i), scrutinee, result, mergeBlock);
        }
        if (fallback != null) {
            builder.switchToBlock(fallback);
            builder.terminate(new IrTerminator.Unreachable(node.getSpan()));
        }
    }

    /**
     * 有守卫：依次测试每个分支的变体和守卫，失败时落到下一个分支。
     */
    private void lowerMatchChain(MatchExpr node, EnumType enumType, int scrutinee, int result,
                                 BasicBlock mergeBlock) {
        for (MatchExpr.Arm arm : node.getArms()) {
            Span loc = arm.getSpan();
            BasicBlock next = null;
            if (!arm.isWildcard()) {
                int tag = enumType.findVariant(arm.getVariant()).getTag();
                int test = builder.emitIsVariant(scrutinee, tag, arm.getPatternSpan());
                BasicBlock bind = builder.newBlock();
                next = builder.newBlock();
                builder.emitBranch(test, bind.getId(), next.getId(), loc);
                builder.switchToBlock(bind);
            }
            bindPayload(arm, scrutinee);
            if (arm.getGuard() != null) {
                int guard = lowerExpr(arm.getGuard());
                BasicBlock body = builder.newBlock();
                if (next == null) {
                    next = builder.newBlock();
                }
                builder.emitBranch(guard, body.getId(), next.getId(), loc);
                builder.switchToBlock(body);
            }
            int value = lowerExpr(arm.getBody());
            builder.emitMove(result, value, loc);
            builder.emitGoto(mergeBlock.getId(), loc);
            // 无条件分支之后的分支不可达
            builder.switchToBlock(next != null ? next : builder.newBlock());
        }
        builder.terminate(new IrTerminator.Unreachable(node.getSpan()));
    }

    private void lowerArmBody(MatchExpr.Arm arm, int scrutinee, int result, BasicBlock mergeBlock) {
        bindPayload(arm, scrutinee);
        int value = lowerExpr(arm.getBody());
        builder.emitMove(result, value, arm.getSpan());
        builder.emitGoto(mergeBlock.getId(), arm.getSpan());
    }

    private void bindPayload(MatchExpr.Arm arm, int scrutinee) {
        List<MatchExpr.Binding> bindings = arm.getBindings();
        for (int i = 0; i < bindings.size(); i++) {
            MatchExpr.Binding binding = bindings.get(i);
            int payload = builder.emitGetPayload(scrutinee, i, binding.getSpan());
            int local = builder.newLocal(binding.getName());
            builder.emitMove(local, payload, binding.getSpan());
            slots.put(program.declaredSymbol(binding), local);
        }
    }

    /**
     * 终止表达式结束当前块；之后的代码落在一个没有前驱的新块里。
     */
    private int lowerTerminal(TerminalExpr node) {
        Span loc = node.getSpan();
        Expression value = node.getValue();
        switch (node.getKind()) {
            case ACCEPT:
                int output = value != null ? lowerExpr(value) : unit(loc);
                builder.terminate(new IrTerminator.Accept(loc, output));
                break;
            case REJECT:
                builder.terminate(new IrTerminator.Reject(loc));
                break;
            case RETURN:
                int returned = value != null ? lowerExpr(value) : unit(loc);
                builder.terminate(new IrTerminator.Return(loc, returned));
                break;
            case ABORT:
                builder.terminate(new IrTerminator.Abort(loc, lowerExpr(value)));
                break;
            default:
                throw new IllegalStateException("Unknown terminal " + node.getKind());
        }
        builder.switchToBlock(builder.newBlock());
        return unit(loc);
    }

    // ============ 辅助方法 ============

    private int unit(Span loc) {
        return builder.emitConst(RibUnit.UNIT, loc);
    }

    private static VariantShape variantShape(EnumType enumType, EnumType.Variant variant) {
        return new VariantShape(enumType.getName(), variant.getName(), variant.getTag(), variant.getPayload().size());
    }
}
