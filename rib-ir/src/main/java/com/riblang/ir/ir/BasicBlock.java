package com.riblang.ir.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * IR 基本块。
 */
public class BasicBlock {

    private final int id;
    private final List<IrInst> instructions;
    private IrTerminator terminator;

    public BasicBlock(int id) {
        this.id = id;
        this.instructions = new ArrayList<>();
    }

    public int getId() { return id; }

    public List<IrInst> getInstructions() { return instructions; }

    public void addInstruction(IrInst inst) {
        instructions.add(inst);
    }

    public IrTerminator getTerminator() { return terminator; }

    public void setTerminator(IrTerminator terminator) {
        this.terminator = terminator;
    }

    public boolean hasTerminator() {
        return terminator != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("B").append(id).append(":\n");
        for (IrInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        if (terminator != null) {
            sb.append("  ").append(terminator).append('\n');
        }
        return sb.toString();
    }
}
