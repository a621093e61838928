package com.riblang.compiler.lexer;

import com.riblang.compiler.ast.Span;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final Span span;

    public Token(TokenType type, String lexeme, Object literal, Span span) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.span = span;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 字面量 token 的运行时值（RibValue），其余为 null */
    public Object getLiteral() {
        return literal;
    }

    public Span getSpan() {
        return span;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /** 用于错误信息的描述 */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of file";
        }
        return "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %s", type, lexeme, literal, span);
        }
        return String.format("%s(%s) at %s", type, lexeme, span);
    }
}
