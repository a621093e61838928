package com.riblang.ir.ir;

import com.riblang.compiler.ast.Span;

/**
 * IR 指令（三地址形式，操作数均为槽位下标）。
 */
public class IrInst {

    private final IrOp op;
    private final int dest;            // 目标槽位
    private final int[] operands;      // 操作数槽位
    private final Object extra;        // 常量、字段下标、调用目标等
    private final Span location;

    public IrInst(IrOp op, int dest, int[] operands, Object extra, Span location) {
        this.op = op;
        this.dest = dest;
        this.operands = operands;
        this.extra = extra;
        this.location = location;
    }

    public IrOp getOp() { return op; }
    public int getDest() { return dest; }
    public int[] getOperands() { return operands; }
    public Object getExtra() { return extra; }
    public Span getLocation() { return location; }

    public int operand(int n) {
        return operands[n];
    }

    @SuppressWarnings("unchecked")
    public <T> T extraAs() {
        return (T) extra;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('%').append(dest).append(" = ").append(op.name());
        for (int i = 0; i < operands.length; i++) {
            sb.append(i == 0 ? " %" : ", %").append(operands[i]);
        }
        if (extra != null) sb.append(" [").append(extra).append(']');
        return sb.toString();
    }
}
