package com.riblang.compiler.lexer;

/**
 * RibLang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL("integer literal"),
    STRING_LITERAL("string literal"),
    ASN_LITERAL("ASN literal"),
    IP_LITERAL("IP address literal"),
    PREFIX_LITERAL("prefix literal"),
    COMMUNITY_LITERAL("community literal"),

    // === 标识符 ===
    IDENTIFIER("identifier"),

    // === 关键词 - 声明 ===
    KW_TYPE("'type'"),
    KW_ENUM("'enum'"),
    KW_FUNCTION("'function'"),
    KW_FILTER("'filter'"),
    KW_FILTERMAP("'filtermap'"),
    KW_LET("'let'"),

    // === 关键词 - 控制流 ===
    KW_IF("'if'"),
    KW_ELSE("'else'"),
    KW_MATCH("'match'"),
    KW_FOR("'for'"),
    KW_IN("'in'"),
    KW_NOT("'not'"),

    // === 关键词 - 终止动作 ===
    KW_ACCEPT("'accept'"),
    KW_REJECT("'reject'"),
    KW_RETURN("'return'"),
    KW_ABORT("'abort'"),

    KW_TRUE("'true'"),
    KW_FALSE("'false'"),

    // === 分隔符 ===
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    COMMA("','"),
    SEMICOLON("';'"),
    COLON("':'"),
    DOT("'.'"),
    ARROW("'->'"),
    FAT_ARROW("'=>'"),
    ASSIGN("'='"),

    // === 运算符 ===
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    PERCENT("'%'"),
    EQ("'=='"),
    NE("'!='"),
    LT("'<'"),
    LE("'<='"),
    GT("'>'"),
    GE("'>='"),
    AND("'&&'"),
    OR("'||'"),
    BANG("'!'"),

    // === 特殊 ===
    ERROR("invalid token"),
    EOF("end of file");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /** 用于错误信息的描述，例如 {@code ';'} 或 {@code identifier} */
    public String describe() {
        return description;
    }
}
