package com.riblang.ir.ir;

/**
 * IR 一元运算。
 */
public enum UnaryOp {
    NEG,
    NOT
}
