package com.riblang.compiler.lexer;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import rib.runtime.RibAsn;
import rib.runtime.RibCommunity;
import rib.runtime.RibInt;
import rib.runtime.RibIpAddr;
import rib.runtime.RibPrefix;
import rib.runtime.RibString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * RibLang 词法分析器
 *
 * <p>惰性产出 token：{@link #nextToken()} 供语法分析器逐个拉取，
 * 遇到无法识别的字符时产出 {@link TokenType#ERROR} 并记录诊断后继续扫描。
 * 作为 {@link Iterable} 时每次迭代都从头开始，且不会重复报告诊断。</p>
 */
public class Lexer implements Iterable<Token> {
    private final String source;
    private final String unitId;
    private final Diagnostics diagnostics;
    private final Scanner primary;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("type", TokenType.KW_TYPE);
        map.put("enum", TokenType.KW_ENUM);
        map.put("function", TokenType.KW_FUNCTION);
        map.put("filter", TokenType.KW_FILTER);
        map.put("filtermap", TokenType.KW_FILTERMAP);
        map.put("let", TokenType.KW_LET);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("match", TokenType.KW_MATCH);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("not", TokenType.KW_NOT);

        // 终止动作
        map.put("accept", TokenType.KW_ACCEPT);
        map.put("reject", TokenType.KW_REJECT);
        map.put("return", TokenType.KW_RETURN);
        map.put("abort", TokenType.KW_ABORT);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String unitId, Diagnostics diagnostics) {
        this.source = source;
        this.unitId = unitId;
        this.diagnostics = diagnostics;
        this.primary = new Scanner(true);
    }

    public Lexer(String source, String unitId) {
        this(source, unitId, new Diagnostics());
    }

    /**
     * 获取下一个 Token（流式接口），到达末尾后持续返回 EOF
     */
    public Token nextToken() {
        return primary.next();
    }

    /**
     * 扫描剩余全部源码，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = primary.next();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    /**
     * 从头重新扫描（包含最后的 EOF），不报告诊断
     */
    @Override
    public Iterator<Token> iterator() {
        final Scanner replay = new Scanner(false);
        return new Iterator<Token>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public Token next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                Token token = replay.next();
                done = token.getType() == TokenType.EOF;
                return token;
            }
        };
    }

    public String getUnitId() {
        return unitId;
    }

    /**
     * 单次扫描的游标状态
     */
    private final class Scanner {
        private final boolean report;
        private int start = 0;
        private int current = 0;

        Scanner(boolean report) {
            this.report = report;
        }

        Token next() {
            skipTrivia();
            if (isAtEnd()) {
                return new Token(TokenType.EOF, "", null, new Span(current, current, unitId));
            }
            start = current;
            return scanToken();
        }

        private void skipTrivia() {
            while (!isAtEnd()) {
                char c = peek();
                if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                    advance();
                } else if (c == '/' && peekNext() == '/') {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (c == '/' && peekNext() == '*') {
                    blockComment();
                } else {
                    break;
                }
            }
        }

        private void blockComment() {
            int commentStart = current;
            advance();
            advance();
            int depth = 1;
            while (!isAtEnd() && depth > 0) {
                if (peek() == '/' && peekNext() == '*') {
                    advance();
                    advance();
                    depth++;
                } else if (peek() == '*' && peekNext() == '/') {
                    advance();
                    advance();
                    depth--;
                } else {
                    advance();
                }
            }
            if (depth > 0) {
                report(DiagnosticKind.UNEXPECTED_CHARACTER, commentStart, current, "Unterminated block comment");
            }
        }

        private Token scanToken() {
            char c = advance();
            switch (c) {
                // 单字符 Token
                case '(': return token(TokenType.LPAREN);
                case ')': return token(TokenType.RPAREN);
                case '{': return token(TokenType.LBRACE);
                case '}': return token(TokenType.RBRACE);
                case '[': return token(TokenType.LBRACKET);
                case ']': return token(TokenType.RBRACKET);
                case ',': return token(TokenType.COMMA);
                case ';': return token(TokenType.SEMICOLON);
                case '.': return token(TokenType.DOT);
                case '+': return token(TokenType.PLUS);
                case '*': return token(TokenType.STAR);
                case '/': return token(TokenType.SLASH);
                case '%': return token(TokenType.PERCENT);

                // 可能是多字符的 Token
                case ':':
                    if (peek() == ':') {
                        // ::1 形式的 IPv6 地址
                        return colonAddress();
                    }
                    return token(TokenType.COLON);
                case '-':
                    return token(match('>') ? TokenType.ARROW : TokenType.MINUS);
                case '=':
                    if (match('=')) return token(TokenType.EQ);
                    if (match('>')) return token(TokenType.FAT_ARROW);
                    return token(TokenType.ASSIGN);
                case '!':
                    return token(match('=') ? TokenType.NE : TokenType.BANG);
                case '<':
                    return token(match('=') ? TokenType.LE : TokenType.LT);
                case '>':
                    return token(match('=') ? TokenType.GE : TokenType.GT);
                case '&':
                    if (match('&')) return token(TokenType.AND);
                    return error(DiagnosticKind.UNEXPECTED_CHARACTER, "Unexpected character '&'. Did you mean '&&'?");
                case '|':
                    if (match('|')) return token(TokenType.OR);
                    return error(DiagnosticKind.UNEXPECTED_CHARACTER, "Unexpected character '|'. Did you mean '||'?");

                // 字符串
                case '"':
                    return string();

                default:
                    if (isDigit(c)) {
                        return number();
                    } else if (isAlpha(c)) {
                        return identifier();
                    }
                    // 连续的非法字符合并为一个错误 token
                    while (!isAtEnd() && isUnrecognized(peek())) advance();
                    return error(DiagnosticKind.UNEXPECTED_CHARACTER,
                            "Unexpected character sequence '" + source.substring(start, current) + "'");
            }
        }

        // === 字符串 ===

        private Token string() {
            StringBuilder sb = new StringBuilder();
            while (!isAtEnd() && peek() != '"' && peek() != '\n') {
                char c = advance();
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '0': sb.append('\0'); break;
                    case '"': sb.append('"'); break;
                    case '\\': sb.append('\\'); break;
                    default:
                        report(DiagnosticKind.INVALID_LITERAL, current - 2, current, "Unknown escape sequence '\\" + escaped + "'");
                        sb.append(escaped);
                        break;
                }
            }
            if (isAtEnd() || peek() != '"') {
                return error(DiagnosticKind.UNTERMINATED_STRING, "Unterminated string literal");
            }
            advance(); // 闭合的 "
            return token(TokenType.STRING_LITERAL, RibString.of(sb.toString()));
        }

        // === 数字与网络字面量 ===

        private Token number() {
            if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X') && isHexDigit(peekNext())) {
                advance();
                while (isHexDigit(peek())) advance();
                try {
                    long value = Long.parseLong(source.substring(start + 2, current), 16);
                    return token(TokenType.INT_LITERAL, RibInt.of(value));
                } catch (NumberFormatException e) {
                    return error(DiagnosticKind.INVALID_LITERAL, "Integer literal out of range");
                }
            }
            while (isDigit(peek())) advance();

            if (peek() == '.' && isDigit(peekNext())) {
                return dottedAddress();
            }
            if (peek() == ':' && (isHexDigit(peekNext()) || peekNext() == ':')) {
                return colonAddress();
            }

            try {
                return token(TokenType.INT_LITERAL, RibInt.of(Long.parseLong(source.substring(start, current))));
            } catch (NumberFormatException e) {
                return error(DiagnosticKind.INVALID_LITERAL, "Integer literal out of range");
            }
        }

        /** IPv4 地址或前缀 */
        private Token dottedAddress() {
            while (isDigit(peek()) || (peek() == '.' && isDigit(peekNext()))) advance();
            return addressOrPrefix();
        }

        /** IPv6 地址、前缀或标准 community */
        private Token colonAddress() {
            while (isHexDigit(peek()) || peek() == ':') advance();
            String text = source.substring(start, current);
            if (isCommunity(text)) {
                try {
                    return token(TokenType.COMMUNITY_LITERAL, RibCommunity.parse(text));
                } catch (IllegalArgumentException e) {
                    return error(DiagnosticKind.INVALID_LITERAL, e.getMessage());
                }
            }
            return addressOrPrefix();
        }

        private Token addressOrPrefix() {
            boolean prefix = peek() == '/' && isDigit(peekNext());
            if (prefix) {
                advance();
                while (isDigit(peek())) advance();
            }
            String text = source.substring(start, current);
            try {
                if (prefix) {
                    return token(TokenType.PREFIX_LITERAL, RibPrefix.parse(text));
                }
                return token(TokenType.IP_LITERAL, RibIpAddr.parse(text));
            } catch (IllegalArgumentException e) {
                return error(DiagnosticKind.INVALID_LITERAL, e.getMessage());
            }
        }

        private boolean isCommunity(String text) {
            int colon = text.indexOf(':');
            if (colon <= 0 || colon != text.lastIndexOf(':') || colon == text.length() - 1) {
                return false;
            }
            for (int i = 0; i < text.length(); i++) {
                if (i != colon && !isDigit(text.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        // === 标识符 ===

        private Token identifier() {
            while (isAlphaNumeric(peek())) advance();
            String text = source.substring(start, current);

            // fe80::1、dead:beef::/32 形式的 IPv6 地址
            if (peek() == ':' && isHexText(text) && isIpv6Tail(current)) {
                return colonAddress();
            }

            TokenType type = KEYWORDS.get(text);
            if (type != null) {
                return token(type);
            }
            if (isAsnText(text)) {
                try {
                    return token(TokenType.ASN_LITERAL, RibAsn.parse(text));
                } catch (IllegalArgumentException e) {
                    return error(DiagnosticKind.INVALID_LITERAL, e.getMessage());
                }
            }
            return token(TokenType.IDENTIFIER);
        }

        private boolean isAsnText(String text) {
            if (text.length() < 3 || !text.startsWith("AS")) return false;
            for (int i = 2; i < text.length(); i++) {
                if (!isDigit(text.charAt(i))) return false;
            }
            return true;
        }

        /**
         * 以字母开头的十六进制组后面的冒号串是否构成 IPv6 地址：
         * 含 "::"，或连同首组恰好 8 组。{a:b} 这类记录字段不受影响。
         */
        private boolean isIpv6Tail(int from) {
            int end = from;
            while (end < source.length() && (isHexDigit(source.charAt(end)) || source.charAt(end) == ':')) {
                end++;
            }
            String tail = source.substring(from, end);
            if (tail.contains("::")) {
                return true;
            }
            int groups = 1;
            for (int i = 0; i < tail.length(); i++) {
                if (tail.charAt(i) == ':') groups++;
            }
            return groups == 8 && !tail.endsWith(":");
        }

        private boolean isHexText(String text) {
            if (text.length() > 4) return false;
            for (int i = 0; i < text.length(); i++) {
                if (!isHexDigit(text.charAt(i))) return false;
            }
            return true;
        }

        // === Token 构造 ===

        private Token token(TokenType type) {
            return token(type, null);
        }

        private Token token(TokenType type, Object literal) {
            return new Token(type, source.substring(start, current), literal, new Span(start, current, unitId));
        }

        private Token error(DiagnosticKind kind, String message) {
            report(kind, start, current, message);
            return token(TokenType.ERROR);
        }

        private void report(DiagnosticKind kind, int from, int to, String message) {
            if (report) {
                diagnostics.error(kind, new Span(from, to, unitId), message);
            }
        }

        // === 辅助方法 ===

        private boolean isAtEnd() {
            return current >= source.length();
        }

        private char advance() {
            return source.charAt(current++);
        }

        private boolean match(char expected) {
            if (isAtEnd()) return false;
            if (source.charAt(current) != expected) return false;
            current++;
            return true;
        }

        private char peek() {
            if (isAtEnd()) return '\0';
            return source.charAt(current);
        }

        private char peekNext() {
            if (current + 1 >= source.length()) return '\0';
            return source.charAt(current + 1);
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isUnrecognized(char c) {
        return !isAlphaNumeric(c) && " \t\r\n()[]{},;:.+-*/%=!<>&|\"".indexOf(c) < 0;
    }
}
