package com.riblang.compiler.analysis.types;

/**
 * RibType 访问者接口，用于替代 instanceof 分派。
 */
public interface RibTypeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitUnit(UnitType type);
    R visitNever(NeverType type);
    R visitRecord(RecordType type);
    R visitEnum(EnumType type);
    R visitList(ListType type);
    R visitFunction(FunctionType type);
    R visitExternal(ExternalType type);
    R visitError(ErrorType type);
}
