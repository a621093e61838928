package com.riblang.compiler.parser;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.expr.BinaryExpr;
import com.riblang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.expr.CallExpr;
import com.riblang.compiler.ast.expr.ErrorExpr;
import com.riblang.compiler.ast.expr.Expression;
import com.riblang.compiler.ast.expr.FieldAccessExpr;
import com.riblang.compiler.ast.expr.IdentifierExpr;
import com.riblang.compiler.ast.expr.IfExpr;
import com.riblang.compiler.ast.expr.ListExpr;
import com.riblang.compiler.ast.expr.LiteralExpr;
import com.riblang.compiler.ast.expr.MatchExpr;
import com.riblang.compiler.ast.expr.RecordExpr;
import com.riblang.compiler.ast.expr.TerminalExpr;
import com.riblang.compiler.ast.expr.UnaryExpr;
import com.riblang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.riblang.compiler.lexer.Token;
import com.riblang.compiler.lexer.TokenType;
import rib.runtime.RibBool;
import rib.runtime.RibValue;

import java.util.ArrayList;
import java.util.List;

import static com.riblang.compiler.lexer.TokenType.*;

/**
 * 表达式解析
 *
 * <p>优先级从低到高：{@code ||}、{@code &&}、比较（含 in / not in，不可结合）、
 * 加减、乘除模、一元、后缀（成员访问与调用）。</p>
 *
 * <p>左结合的运算链虽然循环解析，但每个运算符都使树加深一层，同样计入嵌套深度。</p>
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseOr();
    }

    /**
     * 解析 if / match / for 的头部表达式（不允许记录字面量）
     */
    Expression parseHeadExpression() {
        boolean saved = parser.noRecordLiteral;
        parser.noRecordLiteral = true;
        try {
            return parseExpression();
        } finally {
            parser.noRecordLiteral = saved;
        }
    }

    // ============ 二元运算 ============

    private Expression parseOr() {
        Expression left = parseAnd();
        int levels = 0;
        try {
            while (parser.match(OR)) {
                parser.enterNesting();
                levels++;
                Expression right = parseAnd();
                left = new BinaryExpr(left.getSpan().to(right.getSpan()), left, BinaryOp.OR, right);
            }
        } finally {
            parser.exitNesting(levels);
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseComparison();
        int levels = 0;
        try {
            while (parser.match(AND)) {
                parser.enterNesting();
                levels++;
                Expression right = parseComparison();
                left = new BinaryExpr(left.getSpan().to(right.getSpan()), left, BinaryOp.AND, right);
            }
        } finally {
            parser.exitNesting(levels);
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        BinaryOp op = comparisonOperator();
        if (op == null) {
            return left;
        }
        Expression right = parseAdditive();
        return new BinaryExpr(left.getSpan().to(right.getSpan()), left, op, right);
    }

    /** 识别并消费比较运算符；不是比较运算符时返回 null */
    private BinaryOp comparisonOperator() {
        BinaryOp op;
        switch (parser.current.getType()) {
            case EQ: op = BinaryOp.EQ; break;
            case NE: op = BinaryOp.NE; break;
            case LT: op = BinaryOp.LT; break;
            case LE: op = BinaryOp.LE; break;
            case GT: op = BinaryOp.GT; break;
            case GE: op = BinaryOp.GE; break;
            case KW_IN: op = BinaryOp.IN; break;
            case KW_NOT:
                if (parser.peek().getType() != KW_IN) {
                    return null;
                }
                parser.advance();
                op = BinaryOp.NOT_IN;
                break;
            default:
                return null;
        }
        parser.advance();
        return op;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        int levels = 0;
        try {
            while (parser.checkAny(PLUS, MINUS)) {
                BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
                parser.enterNesting();
                levels++;
                Expression right = parseMultiplicative();
                left = new BinaryExpr(left.getSpan().to(right.getSpan()), left, op, right);
            }
        } finally {
            parser.exitNesting(levels);
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        int levels = 0;
        try {
            while (parser.checkAny(STAR, SLASH, PERCENT)) {
                Token token = parser.advance();
                BinaryOp op = token.is(STAR) ? BinaryOp.MUL : token.is(SLASH) ? BinaryOp.DIV : BinaryOp.MOD;
                parser.enterNesting();
                levels++;
                Expression right = parseUnary();
                left = new BinaryExpr(left.getSpan().to(right.getSpan()), left, op, right);
            }
        } finally {
            parser.exitNesting(levels);
        }
        return left;
    }

    private Expression parseUnary() {
        if (parser.checkAny(BANG, MINUS)) {
            Token token = parser.advance();
            parser.enterNesting();
            try {
                Expression operand = parseUnary();
                UnaryOp op = token.is(BANG) ? UnaryOp.NOT : UnaryOp.NEG;
                return new UnaryExpr(token.getSpan().to(operand.getSpan()), op, operand);
            } finally {
                parser.exitNesting();
            }
        }
        return parsePostfix();
    }

    // ============ 后缀 ============

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        int levels = 0;
        try {
            while (true) {
                if (parser.match(DOT)) {
                    parser.enterNesting();
                    levels++;
                    Token name = parser.expect(IDENTIFIER);
                    expr = new FieldAccessExpr(expr.getSpan().to(name.getSpan()), expr, name.getLexeme(), name.getSpan());
                } else if (parser.check(LPAREN)) {
                    parser.enterNesting();
                    levels++;
                    List<Expression> args = parseArguments(LPAREN, RPAREN);
                    expr = new CallExpr(parser.spanFrom(expr.getSpan()), expr, args);
                } else {
                    return expr;
                }
            }
        } finally {
            parser.exitNesting(levels);
        }
    }

    private List<Expression> parseArguments(TokenType open, TokenType close) {
        parser.expect(open);
        boolean saved = parser.noRecordLiteral;
        parser.noRecordLiteral = false;
        List<Expression> args = new ArrayList<Expression>();
        try {
            while (!parser.check(close)) {
                args.add(parseExpression());
                if (!parser.match(COMMA)) break;
            }
            parser.expect(close);
        } finally {
            parser.noRecordLiteral = saved;
        }
        return args;
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        Token token = parser.current;
        switch (token.getType()) {
            case ERROR:
                // 词法错误已报告，用占位节点代替，避免连锁诊断
                parser.advance();
                return new ErrorExpr(token.getSpan());
            case INT_LITERAL:
            case STRING_LITERAL:
            case ASN_LITERAL:
            case IP_LITERAL:
            case PREFIX_LITERAL:
            case COMMUNITY_LITERAL:
                parser.advance();
                return new LiteralExpr(token.getSpan(), (RibValue) token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return new LiteralExpr(token.getSpan(), RibBool.TRUE);
            case KW_FALSE:
                parser.advance();
                return new LiteralExpr(token.getSpan(), RibBool.FALSE);
            case IDENTIFIER:
                parser.advance();
                if (parser.check(LBRACE) && !parser.noRecordLiteral) {
                    return parseRecord(token);
                }
                return new IdentifierExpr(token.getSpan(), token.getLexeme());
            case LBRACE:
                if (parser.noRecordLiteral) {
                    throw parser.unexpected("expression");
                }
                return parseRecord(null);
            case LPAREN: {
                parser.advance();
                parser.enterNesting();
                boolean saved = parser.noRecordLiteral;
                parser.noRecordLiteral = false;
                try {
                    Expression inner = parseExpression();
                    parser.expect(RPAREN);
                    return inner;
                } finally {
                    parser.noRecordLiteral = saved;
                    parser.exitNesting();
                }
            }
            case LBRACKET: {
                parser.enterNesting();
                try {
                    List<Expression> elements = parseArguments(LBRACKET, RBRACKET);
                    return new ListExpr(parser.spanFrom(token.getSpan()), elements);
                } finally {
                    parser.exitNesting();
                }
            }
            case KW_IF:
                return parseIf();
            case KW_MATCH:
                return parseMatch();
            case KW_ACCEPT:
            case KW_REJECT:
            case KW_RETURN:
            case KW_ABORT:
                return parseTerminal();
            default:
                throw parser.unexpected("expression");
        }
    }

    /**
     * Name { f: e, ... } 或 { f: e, ... }
     */
    private Expression parseRecord(Token typeName) {
        parser.enterNesting();
        try {
            Token open = parser.expect(LBRACE);
            List<RecordExpr.FieldInit> fields = new ArrayList<RecordExpr.FieldInit>();
            while (!parser.check(RBRACE)) {
                Token name = parser.expect(IDENTIFIER);
                parser.expect(COLON);
                Expression value = parseExpression();
                fields.add(new RecordExpr.FieldInit(name.getSpan().to(value.getSpan()), name.getLexeme(), value));
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RBRACE);
            Span start = typeName != null ? typeName.getSpan() : open.getSpan();
            return new RecordExpr(parser.spanFrom(start), typeName != null ? typeName.getLexeme() : null, fields);
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * if cond { ... } (else (if ... | { ... }))?
     */
    private IfExpr parseIf() {
        parser.enterNesting();
        try {
            Span start = parser.expect(KW_IF).getSpan();
            Expression condition = parseHeadExpression();
            BlockExpr thenBranch = parser.stmtParser.parseBlock();
            Expression elseBranch = null;
            if (parser.match(KW_ELSE)) {
                elseBranch = parser.check(KW_IF) ? parseIf() : parser.stmtParser.parseBlock();
            }
            return new IfExpr(parser.spanFrom(start), condition, thenBranch, elseBranch);
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * match expr { Variant(a, b) if guard => body, _ => body }
     *
     * <p>单个分支出错时跳到下一个分支继续解析，整个 match 标记为已恢复。</p>
     */
    private MatchExpr parseMatch() {
        parser.enterNesting();
        try {
            Span start = parser.expect(KW_MATCH).getSpan();
            Expression scrutinee = parseHeadExpression();
            parser.expect(LBRACE);
            List<MatchExpr.Arm> arms = new ArrayList<MatchExpr.Arm>();
            boolean recovered = false;
            while (!parser.check(RBRACE) && !parser.isAtEnd() && !parser.isDeclarationStart()) {
                try {
                    arms.add(parseArm());
                } catch (ParseException e) {
                    parser.report(e);
                    skipArm();
                    recovered = true;
                }
            }
            parser.expect(RBRACE);
            return new MatchExpr(parser.spanFrom(start), scrutinee, arms, recovered);
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * 跳到当前嵌套层级的下一个 ','（消费）或 '}'（不消费）
     */
    private void skipArm() {
        int depth = 0;
        while (!parser.isAtEnd()) {
            if (depth == 0) {
                if (parser.check(RBRACE) || parser.isDeclarationStart()) {
                    return;
                }
                if (parser.match(COMMA)) {
                    return;
                }
            }
            if (parser.checkAny(LBRACE, LPAREN, LBRACKET)) {
                depth++;
            } else if (depth > 0 && parser.checkAny(RBRACE, RPAREN, RBRACKET)) {
                depth--;
            }
            parser.advance();
        }
    }

    private MatchExpr.Arm parseArm() {
        Token pattern = parser.expect(IDENTIFIER);
        String variant = "_".equals(pattern.getLexeme()) ? null : pattern.getLexeme();
        List<MatchExpr.Binding> bindings = new ArrayList<MatchExpr.Binding>();
        if (variant != null && parser.match(LPAREN)) {
            while (!parser.check(RPAREN)) {
                Token binding = parser.expect(IDENTIFIER);
                bindings.add(new MatchExpr.Binding(binding.getSpan(), binding.getLexeme()));
                if (!parser.match(COMMA)) break;
            }
            parser.expect(RPAREN);
        }
        Span patternSpan = parser.spanFrom(pattern.getSpan());
        Expression guard = null;
        if (parser.match(KW_IF)) {
            guard = parseHeadExpression();
        }
        parser.expect(FAT_ARROW);
        Expression body;
        if (parser.check(LBRACE)) {
            body = parser.stmtParser.parseBlock();
            parser.match(COMMA);
        } else {
            body = parseExpression();
            if (!parser.match(COMMA) && !parser.check(RBRACE)) {
                throw parser.unexpected(COMMA, RBRACE);
            }
        }
        return new MatchExpr.Arm(parser.spanFrom(pattern.getSpan()), variant, patternSpan, bindings, guard, body);
    }

    /**
     * accept [expr] | reject | return [expr] | abort expr
     */
    private TerminalExpr parseTerminal() {
        parser.enterNesting();
        try {
            return parseTerminalBody();
        } finally {
            parser.exitNesting();
        }
    }

    private TerminalExpr parseTerminalBody() {
        Token keyword = parser.advance();
        TerminalExpr.Kind kind;
        switch (keyword.getType()) {
            case KW_ACCEPT: kind = TerminalExpr.Kind.ACCEPT; break;
            case KW_REJECT: kind = TerminalExpr.Kind.REJECT; break;
            case KW_RETURN: kind = TerminalExpr.Kind.RETURN; break;
            default: kind = TerminalExpr.Kind.ABORT; break;
        }
        Expression value = null;
        if (kind == TerminalExpr.Kind.ABORT) {
            value = parseExpression();
        } else if (kind != TerminalExpr.Kind.REJECT && canStartExpression()) {
            value = parseExpression();
        }
        Span span = value != null ? keyword.getSpan().to(value.getSpan()) : keyword.getSpan();
        return new TerminalExpr(span, kind, value);
    }

    private boolean canStartExpression() {
        switch (parser.current.getType()) {
            case INT_LITERAL:
            case STRING_LITERAL:
            case ASN_LITERAL:
            case IP_LITERAL:
            case PREFIX_LITERAL:
            case COMMUNITY_LITERAL:
            case IDENTIFIER:
            case KW_TRUE:
            case KW_FALSE:
            case LPAREN:
            case LBRACKET:
            case BANG:
            case MINUS:
            case KW_IF:
            case KW_MATCH:
                return true;
            case LBRACE:
                return !parser.noRecordLiteral;
            default:
                return false;
        }
    }
}
