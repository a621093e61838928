package com.riblang.compiler.parser;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.decl.Declaration;
import com.riblang.compiler.ast.decl.EnumDecl;
import com.riblang.compiler.ast.decl.FilterDecl;
import com.riblang.compiler.ast.decl.FunctionDecl;
import com.riblang.compiler.ast.decl.Parameter;
import com.riblang.compiler.ast.decl.RecordDecl;
import com.riblang.compiler.ast.expr.BlockExpr;
import com.riblang.compiler.ast.type.TypeRef;
import com.riblang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.riblang.compiler.lexer.TokenType.*;

/**
 * 顶层声明解析
 */
class DeclParser {

    private final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    Declaration parseDeclaration() {
        switch (parser.current.getType()) {
            case KW_TYPE:
                return parseRecord();
            case KW_ENUM:
                return parseEnum();
            case KW_FUNCTION:
                return parseFunction();
            case KW_FILTER:
            case KW_FILTERMAP:
                return parseFilter();
            default:
                throw parser.unexpected(KW_TYPE, KW_ENUM, KW_FUNCTION, KW_FILTER, KW_FILTERMAP);
        }
    }

    /**
     * type Name { field: Type, ... }
     */
    private RecordDecl parseRecord() {
        Span start = parser.advance().getSpan();
        Token name = parser.expect(IDENTIFIER);
        parser.expect(LBRACE);
        List<Parameter> fields = new ArrayList<Parameter>();
        while (!parser.check(RBRACE)) {
            fields.add(parseParameter());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE);
        return new RecordDecl(parser.spanFrom(start), name.getLexeme(), name.getSpan(), fields);
    }

    /**
     * enum Name { A, B(Int, String), ... }
     */
    private EnumDecl parseEnum() {
        Span start = parser.advance().getSpan();
        Token name = parser.expect(IDENTIFIER);
        parser.expect(LBRACE);
        List<EnumDecl.Variant> variants = new ArrayList<EnumDecl.Variant>();
        while (!parser.check(RBRACE)) {
            Token variantName = parser.expect(IDENTIFIER);
            List<TypeRef> payload = new ArrayList<TypeRef>();
            if (parser.match(LPAREN)) {
                do {
                    payload.add(parser.typeParser.parseType());
                } while (parser.match(COMMA));
                parser.expect(RPAREN);
            }
            variants.add(new EnumDecl.Variant(parser.spanFrom(variantName.getSpan()), variantName.getLexeme(), payload));
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RBRACE);
        return new EnumDecl(parser.spanFrom(start), name.getLexeme(), name.getSpan(), variants);
    }

    /**
     * function name(params) -> Type { ... }
     */
    private FunctionDecl parseFunction() {
        Span start = parser.advance().getSpan();
        Token name = parser.expect(IDENTIFIER);
        List<Parameter> params = parseParameterList();
        TypeRef returnType = null;
        if (parser.match(ARROW)) {
            returnType = parser.typeParser.parseType();
        }
        BlockExpr body = parser.stmtParser.parseBlock();
        return new FunctionDecl(parser.spanFrom(start), name.getLexeme(), name.getSpan(), params, returnType, body);
    }

    /**
     * filter name(params) { ... } / filtermap name(params) -> Out { ... }
     */
    private FilterDecl parseFilter() {
        Token keyword = parser.advance();
        FilterDecl.Kind kind = keyword.is(KW_FILTERMAP) ? FilterDecl.Kind.FILTER_MAP : FilterDecl.Kind.FILTER;
        Token name = parser.expect(IDENTIFIER);
        List<Parameter> params = parseParameterList();
        TypeRef outputType = null;
        if (parser.check(ARROW)) {
            if (kind == FilterDecl.Kind.FILTER) {
                // 普通 filter 不产生输出值
                throw parser.unexpected(LBRACE);
            }
            parser.advance();
            outputType = parser.typeParser.parseType();
        }
        BlockExpr body = parser.stmtParser.parseBlock();
        return new FilterDecl(parser.spanFrom(keyword.getSpan()), kind, name.getLexeme(), name.getSpan(),
                params, outputType, body);
    }

    private List<Parameter> parseParameterList() {
        parser.expect(LPAREN);
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(RPAREN)) {
            params.add(parseParameter());
            if (!parser.match(COMMA)) break;
        }
        parser.expect(RPAREN);
        return params;
    }

    private Parameter parseParameter() {
        Token name = parser.expect(IDENTIFIER);
        parser.expect(COLON);
        TypeRef type = parser.typeParser.parseType();
        return new Parameter(parser.spanFrom(name.getSpan()), name.getLexeme(), type);
    }
}
