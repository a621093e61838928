package com.riblang.ir.bytecode;

import java.util.Arrays;

/**
 * 一条字节码指令。
 */
public final class Instruction {

    private final Opcode opcode;
    private final int[] operands;

    public Instruction(Opcode opcode, int... operands) {
        this.opcode = opcode;
        this.operands = operands;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public int operand(int n) {
        return operands[n];
    }

    public int getOperandCount() {
        return operands.length;
    }

    public int[] getOperands() {
        return operands.clone();
    }

    public int stackEffect() {
        return opcode.stackEffect(operands);
    }

    public int pops() {
        return opcode.pops(operands);
    }

    /** 跳转目标（用于回填） */
    Instruction withOperand(int n, int value) {
        int[] copy = operands.clone();
        copy[n] = value;
        return new Instruction(opcode, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return opcode == that.opcode && Arrays.equals(operands, that.operands);
    }

    @Override
    public int hashCode() {
        return opcode.hashCode() * 31 + Arrays.hashCode(operands);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(opcode.name());
        for (int operand : operands) {
            sb.append(' ').append(operand);
        }
        return sb.toString();
    }
}
