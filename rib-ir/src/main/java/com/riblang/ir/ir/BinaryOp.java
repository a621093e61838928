package com.riblang.ir.ir;

/**
 * IR 二元运算。
 *
 * <p>{@code in} 按右操作数类型拆分为四种包含运算；{@code &&}、{@code ||}
 * 在降级时展开为分支，不出现在 IR 中。</p>
 */
public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    LIST_CONTAINS("in.list"),
    PREFIX_CONTAINS("in.prefix"),
    PREFIX_COVERED("in.covered"),
    AS_PATH_CONTAINS("in.as_path");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
