package com.riblang.ir.ir;

/**
 * 函数内的槽位：参数、命名局部变量或临时值。
 */
public class IrLocal {

    private final int index;
    private final String name;

    public IrLocal(int index, String name) {
        this.index = index;
        this.name = name;
    }

    public int getIndex() { return index; }
    public String getName() { return name; }

    public boolean isTemp() {
        return name.startsWith("$");
    }

    @Override
    public String toString() {
        return "%" + index + " " + name;
    }
}
