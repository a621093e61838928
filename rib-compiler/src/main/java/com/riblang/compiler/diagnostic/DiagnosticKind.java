package com.riblang.compiler.diagnostic;

/**
 * 诊断种类
 */
public enum DiagnosticKind {

    // 词法
    UNEXPECTED_CHARACTER("UnexpectedCharacter"),
    UNTERMINATED_STRING("UnterminatedString"),
    INVALID_LITERAL("InvalidLiteral"),

    // 语法
    UNEXPECTED_TOKEN("UnexpectedToken"),
    NESTING_TOO_DEEP("NestingTooDeep"),

    // 名称解析
    UNDEFINED_SYMBOL("UndefinedSymbol"),
    UNDEFINED_TYPE("UndefinedType"),
    UNDEFINED_FIELD("UndefinedField"),
    UNDEFINED_METHOD("UndefinedMethod"),
    UNDEFINED_VARIANT("UndefinedVariant"),
    DUPLICATE_DEFINITION("DuplicateDefinition"),

    // 类型检查
    TYPE_MISMATCH("TypeMismatch"),
    ARITY_MISMATCH("ArityMismatch"),
    MISSING_FIELD("MissingField"),
    NON_EXHAUSTIVE_MATCH("NonExhaustiveMatch"),
    UNREACHABLE_PATTERN("UnreachablePattern"),
    UNREACHABLE_CODE("UnreachableCode"),
    MISSING_TERMINAL("MissingTerminal"),
    INVALID_TERMINAL("InvalidTerminal"),
    ENTRY_POINT_CALL("EntryPointCall"),
    RECURSIVE_CALL("RecursiveCall"),
    RECURSIVE_TYPE("RecursiveType"),
    UNUSED_DECLARATION("UnusedDeclaration"),

    // 编译器内部错误（校验失败等）
    INTERNAL_ERROR("InternalError");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
