package com.riblang.ir.bytecode;

/**
 * 字节码校验失败。属于编译器缺陷，报告为 InternalError 诊断。
 */
public class VerifyException extends RuntimeException {

    private final String function;
    private final int pc;

    public VerifyException(String function, int pc, String message) {
        super("Verification failed in '" + function + "' at " + pc + ": " + message);
        this.function = function;
        this.pc = pc;
    }

    public String getFunction() {
        return function;
    }

    public int getPc() {
        return pc;
    }
}
