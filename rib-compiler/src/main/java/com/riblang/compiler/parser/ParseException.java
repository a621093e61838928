package com.riblang.compiler.parser;

import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.lexer.Token;
import com.riblang.compiler.lexer.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * 解析异常（仅在解析器内部传播，由恢复逻辑转换为诊断）
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final Set<TokenType> expected;
    private final String expectedDescription;
    private final DiagnosticKind kind;
    private final String detail;

    public ParseException(Token token, Set<TokenType> expected) {
        this(token, expected, null);
    }

    /**
     * 非 token 期望类错误（如嵌套过深），直接使用给定消息
     */
    public ParseException(Token token, DiagnosticKind kind, String detail) {
        super();
        this.token = token;
        this.expected = Collections.emptySet();
        this.expectedDescription = null;
        this.kind = kind;
        this.detail = detail;
    }

    /**
     * @param expectedDescription 期望内容的概括描述（如 "expression"），为 null 时列出期望 token 集合
     */
    public ParseException(Token token, Set<TokenType> expected, String expectedDescription) {
        super();
        this.token = token;
        this.expected = expected.isEmpty()
                ? Collections.<TokenType>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(expected));
        this.expectedDescription = expectedDescription;
        this.kind = DiagnosticKind.UNEXPECTED_TOKEN;
        this.detail = null;
    }

    public Token getToken() {
        return token;
    }

    public Set<TokenType> getExpected() {
        return expected;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        if (detail != null) {
            return detail;
        }
        StringBuilder sb = new StringBuilder("Expected ");
        if (expectedDescription != null) {
            sb.append(expectedDescription);
        } else {
            Iterator<TokenType> it = expected.iterator();
            int index = 0;
            while (it.hasNext()) {
                TokenType type = it.next();
                if (index > 0) {
                    sb.append(it.hasNext() ? ", " : " or ");
                }
                sb.append(type.describe());
                index++;
            }
        }
        sb.append(", found ").append(token.describe());
        return sb.toString();
    }
}
