package com.riblang.ir.bytecode;

/**
 * 字节码操作码。
 *
 * <p>每个操作码有静态已知的出栈数和入栈数；出栈数为 {@link #COUNTED} 的操作码
 * 从最后一个操作数读取出栈个数（参数个数、字段个数）。跳转目标为函数内的绝对指令下标。</p>
 */
public enum Opcode {

    // ===== 常量与槽位 =====
    CONST(1, 0, 1),             // 常量池下标
    LOAD(1, 0, 1),              // 槽位
    STORE(1, 1, 0),             // 槽位

    // ===== 运算 =====
    ADD(0, 2, 1),
    SUB(0, 2, 1),
    MUL(0, 2, 1),
    DIV(0, 2, 1),
    MOD(0, 2, 1),
    EQ(0, 2, 1),
    NE(0, 2, 1),
    LT(0, 2, 1),
    LE(0, 2, 1),
    GT(0, 2, 1),
    GE(0, 2, 1),
    LIST_CONTAINS(0, 2, 1),     // elem, list
    PREFIX_CONTAINS(0, 2, 1),   // ip, prefix
    PREFIX_COVERED(0, 2, 1),    // prefix, prefix
    AS_PATH_CONTAINS(0, 2, 1),  // asn, path
    NEG(0, 1, 1),
    NOT(0, 1, 1),

    // ===== 复合值 =====
    NEW_RECORD(2, Opcode.COUNTED, 1),   // 记录布局下标, 字段数
    GET_FIELD(1, 1, 1),                 // 字段下标
    NEW_VARIANT(2, Opcode.COUNTED, 1),  // 变体布局下标, 负载数
    IS_VARIANT(1, 1, 1),                // tag
    GET_PAYLOAD(1, 1, 1),               // 负载下标
    NEW_LIST(1, Opcode.COUNTED, 1),     // 元素数

    // ===== 调用 =====
    CALL(2, Opcode.COUNTED, 1),         // 函数下标, 参数数
    CALL_EXT(2, Opcode.COUNTED, 1),     // 外部调用表下标, 参数数（含接收者）
    CALL_BUILTIN(2, Opcode.COUNTED, 1), // 内置方法序号, 参数数（含接收者）

    // ===== 控制流 =====
    JUMP(1, 0, 0),                      // 目标（只能向前）
    JUMP_IF_FALSE(1, 1, 0),             // 目标（只能向前）
    SWITCH(Opcode.VARIABLE, 1, 0),      // 每个 tag 一个目标
    ITER_NEXT(4, 0, 0),                 // 集合槽位, 下标槽位, 变量槽位, 退出目标
    LOOP(1, 0, 0),                      // 回跳目标（必须是 ITER_NEXT）

    // ===== 退出 =====
    RETURN(0, 1, 0),
    ACCEPT(0, 1, 0),
    REJECT(0, 1, 0),
    ABORT(0, 1, 0),
    TRAP(0, 0, 0);                      // 不可达

    /** 操作数个数可变 */
    public static final int VARIABLE = -1;
    /** 出栈个数由最后一个操作数给出 */
    public static final int COUNTED = -1;

    private final int operandCount;
    private final int pops;
    private final int pushes;

    Opcode(int operandCount, int pops, int pushes) {
        this.operandCount = operandCount;
        this.pops = pops;
        this.pushes = pushes;
    }

    public int getOperandCount() {
        return operandCount;
    }

    public int pops(int[] operands) {
        return pops == COUNTED ? operands[operands.length - 1] : pops;
    }

    public int getPushes() {
        return pushes;
    }

    /** 净栈效果 */
    public int stackEffect(int[] operands) {
        return pushes - pops(operands);
    }

    public boolean isExit() {
        return this == RETURN || this == ACCEPT || this == REJECT || this == ABORT;
    }

    public boolean isTransfer() {
        return this == JUMP || this == JUMP_IF_FALSE || this == SWITCH || this == ITER_NEXT || this == LOOP;
    }
}
