package com.riblang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    LOCAL,              // let 局部变量
    PARAMETER,          // 函数 / filter 参数
    LOOP_VARIABLE,      // for 循环变量
    PATTERN_BINDING,    // match 分支负载绑定
    FUNCTION,           // function 声明
    FILTER,             // filter / filtermap 声明
    RECORD_TYPE,        // type 声明
    ENUM_TYPE;          // enum 声明

    /** 未使用时是否报告警告 */
    public boolean isWarnedWhenUnused() {
        switch (this) {
            case LOCAL:
            case LOOP_VARIABLE:
            case PATTERN_BINDING:
            case RECORD_TYPE:
            case ENUM_TYPE:
                return true;
            default:
                return false;
        }
    }

    public boolean isCallable() {
        return this == FUNCTION || this == FILTER;
    }

    public boolean isType() {
        return this == RECORD_TYPE || this == ENUM_TYPE;
    }
}
