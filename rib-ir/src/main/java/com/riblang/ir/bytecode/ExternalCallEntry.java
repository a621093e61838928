package com.riblang.ir.bytecode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部调用表的一项：宿主符号名及其声明的签名。
 *
 * <p>在虚拟机 attach 时按符号名绑定到具体的宿主函数。参数类型包含接收者。</p>
 */
public final class ExternalCallEntry {

    private final String symbol;
    private final String kind;
    private final List<String> paramTypes;
    private final String returnType;

    public ExternalCallEntry(String symbol, String kind, List<String> paramTypes, String returnType) {
        this.symbol = symbol;
        this.kind = kind;
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.returnType = returnType;
    }

    public String getSymbol() { return symbol; }

    /** FIELD / METHOD / FUNCTION */
    public String getKind() { return kind; }

    public List<String> getParamTypes() { return paramTypes; }

    public String getReturnType() { return returnType; }

    public int getArity() {
        return paramTypes.size();
    }

    @Override
    public String toString() {
        return symbol + "(" + String.join(", ", paramTypes) + ") -> " + returnType;
    }
}
