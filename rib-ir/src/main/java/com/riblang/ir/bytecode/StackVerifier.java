package com.riblang.ir.bytecode;

import com.riblang.ir.ir.RecordShape;
import com.riblang.ir.ir.VariantShape;
import rib.runtime.BuiltinMethod;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * 字节码栈校验器。
 *
 * <p>对每个函数沿所有可达控制路径模拟操作数栈深度，证明：</p>
 * <ul>
 *   <li>任何指令执行后栈深度都不为负；</li>
 *   <li>同一指令在所有路径上的入口深度一致，从而存在一个静态最大深度；</li>
 *   <li>控制转移发生在深度 0，退出指令（RETURN/ACCEPT/REJECT/ABORT）执行前深度为 1；</li>
 *   <li>普通跳转只能向前，回跳只能经 LOOP 到达 ITER_NEXT；</li>
 *   <li>所有操作数（常量、槽位、布局、调用目标）都在范围内。</li>
 * </ul>
 */
public class StackVerifier {

    private static final int BUILTIN_COUNT = BuiltinMethod.values().length;

    /**
     * 校验整个 Program。
     *
     * @return 每个函数的最大栈深度（与函数列表一一对应）
     * @throws VerifyException 校验失败
     */
    public int[] verify(Program program) {
        int[] maxStacks = new int[program.getFunctions().size()];
        for (int i = 0; i < maxStacks.length; i++) {
            CompiledFunction function = program.getFunction(i);
            maxStacks[i] = verifyFunction(program, function);
            if (function.getMaxStack() >= 0 && function.getMaxStack() != maxStacks[i]) {
                throw new VerifyException(function.getName(), 0, "declared max stack " + function.getMaxStack()
                        + " does not match verified depth " + maxStacks[i]);
            }
        }
        return maxStacks;
    }

    private int verifyFunction(Program program, CompiledFunction function) {
        String name = function.getName();
        int length = function.getCodeLength();
        if (length == 0) {
            throw new VerifyException(name, 0, "empty code");
        }
        if (function.getSlotCount() < function.getParamCount()) {
            throw new VerifyException(name, 0, "slot count " + function.getSlotCount()
                    + " is smaller than parameter count " + function.getParamCount());
        }

        int[] depths = new int[length];
        Arrays.fill(depths, -1);
        Deque<Integer> worklist = new ArrayDeque<>();
        depths[0] = 0;
        worklist.push(0);
        int max = 0;

        while (!worklist.isEmpty()) {
            int pc = worklist.pop();
            int depth = depths[pc];
            Instruction inst = function.getInstruction(pc);
            Opcode op = inst.getOpcode();
            checkOperands(program, function, inst, pc);

            if (depth < inst.pops()) {
                throw new VerifyException(name, pc, op + " needs " + inst.pops() + " value(s), stack has " + depth);
            }
            int after = depth + inst.stackEffect();
            max = Math.max(max, Math.max(depth, after));

            if (op.isExit()) {
                if (depth != 1) {
                    throw new VerifyException(name, pc, op + " at stack depth " + depth + ", expected 1");
                }
                continue;
            }
            if (op == Opcode.TRAP) {
                continue;
            }
            if (op.isTransfer() && after != 0) {
                throw new VerifyException(name, pc, op + " leaves stack depth " + after + ", expected 0");
            }
            switch (op) {
                case JUMP:
                    flow(function, depths, worklist, pc, forward(function, pc, inst.operand(0)), after);
                    break;
                case JUMP_IF_FALSE:
                    flow(function, depths, worklist, pc, forward(function, pc, inst.operand(0)), after);
                    flow(function, depths, worklist, pc, pc + 1, after);
                    break;
                case SWITCH:
                    for (int i = 0; i < inst.getOperandCount(); i++) {
                        flow(function, depths, worklist, pc, forward(function, pc, inst.operand(i)), after);
                    }
                    break;
                case ITER_NEXT:
                    flow(function, depths, worklist, pc, forward(function, pc, inst.operand(3)), after);
                    flow(function, depths, worklist, pc, pc + 1, after);
                    break;
                case LOOP:
                    int target = inst.operand(0);
                    if (target < 0 || target > pc || function.getInstruction(target).getOpcode() != Opcode.ITER_NEXT) {
                        throw new VerifyException(name, pc, "LOOP must jump back to an ITER_NEXT, found target " + target);
                    }
                    flow(function, depths, worklist, pc, target, after);
                    break;
                default:
                    flow(function, depths, worklist, pc, pc + 1, after);
                    break;
            }
        }
        return max;
    }

    private static int forward(CompiledFunction function, int pc, int target) {
        if (target <= pc) {
            throw new VerifyException(function.getName(), pc, "backward jump to " + target + " outside LOOP");
        }
        return target;
    }

    private static void flow(CompiledFunction function, int[] depths, Deque<Integer> worklist,
                             int pc, int target, int depth) {
        if (target < 0 || target >= depths.length) {
            throw new VerifyException(function.getName(), pc, "control falls outside the code (target " + target + ")");
        }
        if (depths[target] < 0) {
            depths[target] = depth;
            worklist.push(target);
        } else if (depths[target] != depth) {
            throw new VerifyException(function.getName(), pc, "inconsistent stack depth at " + target
                    + ": " + depths[target] + " vs " + depth);
        }
    }

    private static void checkOperands(Program program, CompiledFunction function, Instruction inst, int pc) {
        Opcode op = inst.getOpcode();
        String name = function.getName();
        if (op.getOperandCount() == Opcode.VARIABLE) {
            if (inst.getOperandCount() == 0) {
                throw new VerifyException(name, pc, op + " without targets");
            }
        } else if (inst.getOperandCount() != op.getOperandCount()) {
            throw new VerifyException(name, pc, op + " expects " + op.getOperandCount()
                    + " operand(s), found " + inst.getOperandCount());
        }
        switch (op) {
            case CONST:
                range(name, pc, "constant", inst.operand(0), program.getConstants().size());
                break;
            case LOAD:
            case STORE:
                range(name, pc, "slot", inst.operand(0), function.getSlotCount());
                break;
            case ITER_NEXT:
                for (int i = 0; i < 3; i++) {
                    range(name, pc, "slot", inst.operand(i), function.getSlotCount());
                }
                break;
            case NEW_RECORD: {
                range(name, pc, "record shape", inst.operand(0), program.getRecordShapes().size());
                RecordShape shape = program.getRecordShapes().get(inst.operand(0));
                count(name, pc, inst.operand(1), shape.getFieldCount());
                break;
            }
            case NEW_VARIANT: {
                range(name, pc, "variant shape", inst.operand(0), program.getVariantShapes().size());
                VariantShape shape = program.getVariantShapes().get(inst.operand(0));
                count(name, pc, inst.operand(1), shape.getPayloadSize());
                break;
            }
            case GET_FIELD:
            case IS_VARIANT:
            case GET_PAYLOAD:
            case NEW_LIST:
                if (inst.operand(0) < 0) {
                    throw new VerifyException(name, pc, op + " with negative operand " + inst.operand(0));
                }
                break;
            case CALL: {
                range(name, pc, "function", inst.operand(0), program.getFunctions().size());
                CompiledFunction callee = program.getFunction(inst.operand(0));
                if (callee.isEntryPoint()) {
                    throw new VerifyException(name, pc, "call to entry point '" + callee.getName() + "'");
                }
                count(name, pc, inst.operand(1), callee.getParamCount());
                break;
            }
            case CALL_EXT:
                range(name, pc, "external", inst.operand(0), program.getExternals().size());
                count(name, pc, inst.operand(1), program.getExternals().get(inst.operand(0)).getArity());
                break;
            case CALL_BUILTIN:
                range(name, pc, "builtin", inst.operand(0), BUILTIN_COUNT);
                count(name, pc, inst.operand(1), BuiltinMethod.values()[inst.operand(0)].getParameterCount() + 1);
                break;
            default:
                break;
        }
    }

    private static void range(String function, int pc, String what, int index, int size) {
        if (index < 0 || index >= size) {
            throw new VerifyException(function, pc, what + " index " + index + " out of range [0, " + size + ")");
        }
    }

    private static void count(String function, int pc, int actual, int expected) {
        if (actual != expected) {
            throw new VerifyException(function, pc, "argument count " + actual + ", expected " + expected);
        }
    }
}
