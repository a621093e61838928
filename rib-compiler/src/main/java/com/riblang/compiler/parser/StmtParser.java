package com.riblang.compiler.parser;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.Expression;
import com.riblang.compiler.ast.expr.IfExpr;
import com.riblang.compiler.ast.expr.MatchExpr;
import com.riblang.compiler.ast.stmt.ExprStmt;
import com.riblang.compiler.ast.stmt.ForStmt;
import com.riblang.compiler.ast.stmt.LetStmt;
import com.riblang.compiler.ast.stmt.Statement;
import com.riblang.compiler.ast.type.TypeRef;
import com.riblang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.riblang.compiler.lexer.TokenType.*;

/**
 * 块与语句解析
 */
class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * { stmt* expr? }
     *
     * <p>单条语句出错时在块内恢复，继续解析后续语句，并把块标记为已恢复。</p>
     */
    BlockExpr parseBlock() {
        parser.enterNesting();
        try {
            return parseBlockBody();
        } finally {
            parser.exitNesting();
        }
    }

    private BlockExpr parseBlockBody() {
        Span start = parser.expect(LBRACE).getSpan();
        boolean savedNoRecord = parser.noRecordLiteral;
        parser.noRecordLiteral = false;
        List<Statement> statements = new ArrayList<Statement>();
        Expression tail = null;
        boolean recovered = false;
        try {
            while (!parser.check(RBRACE) && !parser.isAtEnd() && !parser.isDeclarationStart()) {
                try {
                    if (tail != null) {
                        // 尾表达式之后只能是 '}'
                        throw parser.unexpected(SEMICOLON, RBRACE);
                    }
                    if (parser.check(KW_LET)) {
                        statements.add(parseLet());
                        continue;
                    }
                    if (parser.check(KW_FOR)) {
                        statements.add(parseFor());
                        continue;
                    }
                    Expression expr = parser.exprParser.parseExpression();
                    if (parser.match(SEMICOLON)) {
                        statements.add(new ExprStmt(parser.spanFrom(expr.getSpan()), expr));
                    } else if (parser.check(RBRACE)) {
                        tail = expr;
                    } else if (isBlockLike(expr)) {
                        statements.add(new ExprStmt(expr.getSpan(), expr));
                    } else {
                        throw parser.unexpected(SEMICOLON, RBRACE);
                    }
                } catch (ParseException e) {
                    parser.report(e);
                    parser.synchronizeStatement();
                    tail = null;
                    recovered = true;
                }
            }
            parser.expect(RBRACE);
        } finally {
            parser.noRecordLiteral = savedNoRecord;
        }
        return new BlockExpr(parser.spanFrom(start), statements, tail, recovered);
    }

    /**
     * let name (: Type)? = expr;
     */
    private LetStmt parseLet() {
        Span start = parser.advance().getSpan();
        Token name = parser.expect(IDENTIFIER);
        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parser.typeParser.parseType();
        }
        parser.expect(ASSIGN);
        Expression init = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON);
        return new LetStmt(parser.spanFrom(start), name.getLexeme(), name.getSpan(), type, init);
    }

    /**
     * for name in expr { ... }
     */
    private ForStmt parseFor() {
        Span start = parser.advance().getSpan();
        Token name = parser.expect(IDENTIFIER);
        parser.expect(KW_IN);
        Expression iterable = parser.exprParser.parseHeadExpression();
        BlockExpr body = parseBlock();
        return new ForStmt(parser.spanFrom(start), name.getLexeme(), name.getSpan(), iterable, body);
    }

    private boolean isBlockLike(Expression expr) {
        return expr instanceof IfExpr || expr instanceof MatchExpr || expr instanceof BlockExpr;
    }
}
