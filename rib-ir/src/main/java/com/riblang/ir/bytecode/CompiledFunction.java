package com.riblang.ir.bytecode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译后的函数：指令序列、槽位数和经校验的最大栈深度。参数占用槽位 0..n-1。
 */
public final class CompiledFunction {

    public enum Kind {
        FUNCTION,
        FILTER,
        FILTER_MAP
    }

    private final String name;
    private final Kind kind;
    private final List<String> paramNames;
    private final List<String> paramTypes;
    private final String returnType;
    private final int slotCount;
    private final int maxStack;
    private final Instruction[] code;

    public CompiledFunction(String name, Kind kind, List<String> paramNames, List<String> paramTypes,
                            String returnType, int slotCount, int maxStack, Instruction[] code) {
        this.name = name;
        this.kind = kind;
        this.paramNames = Collections.unmodifiableList(new ArrayList<>(paramNames));
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.returnType = returnType;
        this.slotCount = slotCount;
        this.maxStack = maxStack;
        this.code = code.clone();
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    public List<String> getParamNames() { return paramNames; }
    public List<String> getParamTypes() { return paramTypes; }
    public String getReturnType() { return returnType; }
    public int getSlotCount() { return slotCount; }

    /** 校验得到的最大操作数栈深度；未校验时为 -1 */
    public int getMaxStack() { return maxStack; }

    public int getParamCount() {
        return paramNames.size();
    }

    public int getCodeLength() {
        return code.length;
    }

    public Instruction getInstruction(int pc) {
        return code[pc];
    }

    public boolean isEntryPoint() {
        return kind != Kind.FUNCTION;
    }

    CompiledFunction withMaxStack(int verifiedMaxStack) {
        return new CompiledFunction(name, kind, paramNames, paramTypes, returnType, slotCount,
                verifiedMaxStack, code);
    }
}
