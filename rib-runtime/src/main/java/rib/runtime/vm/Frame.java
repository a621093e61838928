package rib.runtime.vm;

import com.riblang.ir.bytecode.CompiledFunction;
import rib.runtime.RibValue;

/**
 * 函数调用帧：槽位、按校验深度分配的操作数栈和程序计数器。每次调用新建，不跨调用复用。
 */
final class Frame {

    final CompiledFunction function;
    final RibValue[] slots;
    private final RibValue[] stack;
    private int sp;
    int pc;
    /** 本帧实际达到的最大栈深度 */
    private int observedMax;

    Frame(CompiledFunction function, RibValue[] args) {
        this.function = function;
        this.slots = new RibValue[function.getSlotCount()];
        System.arraycopy(args, 0, slots, 0, args.length);
        this.stack = new RibValue[Math.max(function.getMaxStack(), 0)];
    }

    void push(RibValue value) {
        stack[sp++] = value;
        if (sp > observedMax) {
            observedMax = sp;
        }
    }

    RibValue pop() {
        RibValue value = stack[--sp];
        stack[sp] = null;
        return value;
    }

    /** 按入栈顺序弹出 n 个值 */
    RibValue[] popN(int n) {
        RibValue[] values = new RibValue[n];
        for (int i = n - 1; i >= 0; i--) {
            values[i] = pop();
        }
        return values;
    }

    RibValue load(int slot) {
        RibValue value = slots[slot];
        if (value == null) {
            throw new IllegalStateException("Read of unassigned slot " + slot);
        }
        return value;
    }

    int getObservedMax() {
        return observedMax;
    }

    int getStackCapacity() {
        return stack.length;
    }
}
