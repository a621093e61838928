package com.riblang.ir.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个编译单元的 IR，函数按声明顺序排列。
 */
public class IrModule {

    private final String unitId;
    private final List<IrFunction> functions = new ArrayList<>();

    public IrModule(String unitId) {
        this.unitId = unitId;
    }

    public String getUnitId() { return unitId; }

    public List<IrFunction> getFunctions() { return functions; }

    public void addFunction(IrFunction function) {
        functions.add(function);
    }

    public IrFunction findFunction(String name) {
        for (IrFunction function : functions) {
            if (function.getName().equals(name)) return function;
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (IrFunction function : functions) {
            sb.append(function);
        }
        return sb.toString();
    }
}
