package com.riblang.compiler.parser;

import com.riblang.compiler.ast.SourceFile;
import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.diagnostic.DiagnosticKind;
import com.riblang.compiler.diagnostic.Diagnostics;
import com.riblang.compiler.lexer.Lexer;
import com.riblang.compiler.lexer.Token;
import com.riblang.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;

import static com.riblang.compiler.lexer.TokenType.*;

/**
 * RibLang 语法分析器（递归下降）
 *
 * <p>出错时记录诊断并同步到下一个语句或声明边界，单次调用可报告多个独立错误，
 * 并总是返回尽力构造的 AST。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    /** 声明起始关键字，也是顶层错误恢复的同步点 */
    static final EnumSet<TokenType> DECLARATION_START =
            EnumSet.of(KW_TYPE, KW_ENUM, KW_FUNCTION, KW_FILTER, KW_FILTERMAP);

    final Lexer lexer;
    final String unitId;
    private final Diagnostics diagnostics;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲
    private final Deque<Token> replayQueue = new ArrayDeque<Token>(); // 回放队列
    private int errorCount;

    // mark/reset 回溯支持
    private final List<Token> markRecordBuffer = new ArrayList<Token>(8);
    private boolean marking;
    private Token markedPrevious;

    /** if / match / for 头部表达式中禁止记录字面量（否则与块的 '{' 冲突） */
    boolean noRecordLiteral;

    /** 表达式、块与类型的最大嵌套层数，后续阶段按树深递归 */
    static final int MAX_NESTING = 256;
    private int nesting;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, Diagnostics diagnostics) {
        this.lexer = lexer;
        this.unitId = lexer.getUnitId();
        this.diagnostics = diagnostics;
        advance();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else if (!replayQueue.isEmpty()) {
            current = replayQueue.poll();
        } else {
            current = lexer.nextToken();
        }
        // 回溯模式下记录消费的 token
        if (marking && previous != null) {
            markRecordBuffer.add(previous);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = !replayQueue.isEmpty() ? replayQueue.poll() : lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 标记当前位置，用于回溯
     */
    void mark() {
        markRecordBuffer.clear();
        marking = true;
        markedPrevious = previous;
    }

    /**
     * 回溯到标记的位置
     */
    void reset() {
        if (nextToken != null) {
            replayQueue.addFirst(nextToken);
            nextToken = null;
        }
        replayQueue.addFirst(current);
        for (int i = markRecordBuffer.size() - 1; i >= 0; i--) {
            replayQueue.addFirst(markRecordBuffer.get(i));
        }
        current = replayQueue.poll();
        previous = markedPrevious;
        marking = false;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则抛出解析异常
     */
    Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(current, EnumSet.of(type));
    }

    /**
     * 期望多个 token 之一
     */
    ParseException unexpected(TokenType first, TokenType... rest) {
        return new ParseException(current, EnumSet.of(first, rest));
    }

    ParseException unexpected(String description) {
        return new ParseException(current, EnumSet.noneOf(TokenType.class), description);
    }

    /**
     * 从 start 到上一个已消费 token 末尾的区间
     */
    Span spanFrom(Span start) {
        int end = previous != null ? previous.getSpan().getEnd() : start.getEnd();
        return new Span(start.getStart(), Math.max(end, start.getEnd()), unitId);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    boolean isDeclarationStart() {
        return DECLARATION_START.contains(current.getType());
    }

    /**
     * 进入一层嵌套，超过 {@link #MAX_NESTING} 时抛出；必须与 {@link #exitNesting()} 成对调用
     */
    void enterNesting() {
        if (++nesting > MAX_NESTING) {
            nesting--;
            throw new ParseException(current, DiagnosticKind.NESTING_TOO_DEEP,
                    "Nesting exceeds " + MAX_NESTING + " levels");
        }
    }

    void exitNesting() {
        nesting--;
    }

    void exitNesting(int levels) {
        nesting -= levels;
    }

    /**
     * 将解析异常记录为诊断。
     * 落在词法错误 token 上的语法错误不再报告，词法分析器已报告过根因。
     */
    void report(ParseException e) {
        errorCount++;
        if (e.getKind() == DiagnosticKind.UNEXPECTED_TOKEN && e.getToken().getType() == ERROR) {
            return;
        }
        diagnostics.error(e.getKind(), e.getToken().getSpan(), e.getMessage());
    }

    // ============ 程序解析 ============

    /**
     * 解析整个编译单元
     */
    public ParseResult parse() {
        Span start = current.getSpan();
        List<Declaration> declarations = new ArrayList<Declaration>();
        while (!isAtEnd()) {
            try {
                declarations.add(declParser.parseDeclaration());
            } catch (ParseException e) {
                report(e);
                synchronizeDeclaration();
            }
        }
        SourceFile file = new SourceFile(new Span(start.getStart(), current.getSpan().getEnd(), unitId),
                unitId, declarations);
        return new ParseResult(file, errorCount);
    }

    /**
     * 顶层错误恢复：跳过 token 直到下一个声明起始点
     */
    private void synchronizeDeclaration() {
        // 出错位置本身是声明关键字时（如缺少 '}'），从它重新开始
        if (!isDeclarationStart()) {
            advance();
        }
        while (!isAtEnd() && !isDeclarationStart()) {
            advance();
        }
    }

    /**
     * 语句级错误恢复：跳到当前嵌套层级的 ';' 之后，或停在 '}'、let、for、声明关键字之前
     */
    void synchronizeStatement() {
        Token start = current;
        int depth = 0;
        while (!isAtEnd()) {
            if (depth == 0) {
                if (check(SEMICOLON)) {
                    advance();
                    return;
                }
                if (check(RBRACE) || checkAny(KW_LET, KW_FOR) || isDeclarationStart()) {
                    if (current == start && !check(RBRACE) && !isDeclarationStart()) {
                        // 保证前进，避免在同一 token 上反复报错
                        advance();
                        continue;
                    }
                    return;
                }
            }
            if (check(LBRACE)) {
                depth++;
            } else if (check(RBRACE)) {
                depth--;
            }
            advance();
        }
    }
}
