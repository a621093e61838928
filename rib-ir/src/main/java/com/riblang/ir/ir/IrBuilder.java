package com.riblang.ir.ir;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.host.ExternalMember;
import rib.runtime.BuiltinMethod;
import rib.runtime.RibValue;

/**
 * IR 构建辅助类。
 * 封装创建指令、基本块、槽位的便捷方法。
 */
public class IrBuilder {

    private static final int[] NO_OPERANDS = new int[0];

    private final IrFunction function;
    private BasicBlock currentBlock;
    private int tempCounter;

    public IrBuilder(IrFunction function) {
        this.function = function;
        this.currentBlock = function.newBlock(); // entry block
    }

    public IrFunction getFunction() { return function; }
    public BasicBlock getCurrentBlock() { return currentBlock; }

    // ========== 基本块操作 ==========

    public BasicBlock newBlock() {
        return function.newBlock();
    }

    public void switchToBlock(BasicBlock block) {
        this.currentBlock = block;
    }

    public boolean isTerminated() {
        return currentBlock.hasTerminator();
    }

    // ========== 槽位 ==========

    public int newLocal(String name) {
        return function.newLocal(name);
    }

    public int newTemp() {
        return function.newLocal("$t" + tempCounter++);
    }

    // ========== 指令发射 ==========

    private int emit(IrOp op, int[] operands, Object extra, Span loc) {
        int dest = newTemp();
        currentBlock.addInstruction(new IrInst(op, dest, operands, extra, loc));
        return dest;
    }

    public int emitConst(RibValue value, Span loc) {
        return emit(IrOp.CONST, NO_OPERANDS, value, loc);
    }

    public void emitMove(int dest, int src, Span loc) {
        currentBlock.addInstruction(new IrInst(IrOp.MOVE, dest, new int[]{src}, null, loc));
    }

    public int emitBinary(BinaryOp op, int left, int right, Span loc) {
        return emit(IrOp.BINARY, new int[]{left, right}, op, loc);
    }

    public int emitUnary(UnaryOp op, int operand, Span loc) {
        return emit(IrOp.UNARY, new int[]{operand}, op, loc);
    }

    public int emitNewRecord(RecordShape shape, int[] fields, Span loc) {
        return emit(IrOp.NEW_RECORD, fields, shape, loc);
    }

    public int emitGetField(int record, int index, Span loc) {
        return emit(IrOp.GET_FIELD, new int[]{record}, index, loc);
    }

    public int emitNewVariant(VariantShape shape, int[] payload, Span loc) {
        return emit(IrOp.NEW_VARIANT, payload, shape, loc);
    }

    public int emitIsVariant(int value, int tag, Span loc) {
        return emit(IrOp.IS_VARIANT, new int[]{value}, tag, loc);
    }

    public int emitGetPayload(int value, int index, Span loc) {
        return emit(IrOp.GET_PAYLOAD, new int[]{value}, index, loc);
    }

    public int emitNewList(int[] elements, Span loc) {
        return emit(IrOp.NEW_LIST, elements, null, loc);
    }

    public int emitCall(String function, int[] args, Span loc) {
        return emit(IrOp.CALL, args, function, loc);
    }

    public int emitCallExternal(ExternalMember member, int[] args, Span loc) {
        return emit(IrOp.CALL_EXT, args, member, loc);
    }

    public int emitCallBuiltin(BuiltinMethod method, int[] args, Span loc) {
        return emit(IrOp.CALL_BUILTIN, args, method, loc);
    }

    // ========== 终止指令 ==========

    public void terminate(IrTerminator terminator) {
        if (currentBlock.hasTerminator()) {
            throw new IllegalStateException("Block B" + currentBlock.getId() + " is already terminated");
        }
        currentBlock.setTerminator(terminator);
    }

    public void emitGoto(int target, Span loc) {
        terminate(new IrTerminator.Goto(loc, target));
    }

    public void emitBranch(int condition, int thenBlock, int elseBlock, Span loc) {
        terminate(new IrTerminator.Branch(loc, condition, thenBlock, elseBlock));
    }
}
