package com.riblang.ir.ir;

/**
 * IR 指令操作码。
 *
 * <p>除 {@link #MOVE} 外，结果都写入一个新的临时槽位。</p>
 */
public enum IrOp {
    CONST,          // extra: RibValue
    MOVE,           // dest = operands[0]
    BINARY,         // extra: BinaryOp
    UNARY,          // extra: UnaryOp
    NEW_RECORD,     // 操作数按字段名排序；extra: RecordShape
    GET_FIELD,      // extra: 字段下标
    NEW_VARIANT,    // extra: VariantShape
    IS_VARIANT,     // extra: 变体 tag
    GET_PAYLOAD,    // extra: 负载下标
    NEW_LIST,
    CALL,           // extra: 用户函数名
    CALL_EXT,       // extra: ExternalMember
    CALL_BUILTIN    // operands[0] 为接收者；extra: BuiltinMethod
}
