package com.riblang.compiler.parser;

import com.riblang.compiler.ast.Span;
import com.riblang.compiler.ast.type.TypeRef;
import com.riblang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.riblang.compiler.lexer.TokenType.*;

/**
 * 类型引用解析：{@code Name} 或 {@code Name<T, ...>}
 */
class TypeParser {

    private final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    TypeRef parseType() {
        parser.enterNesting();
        try {
            Token name = parser.expect(IDENTIFIER);
            List<TypeRef> args = new ArrayList<TypeRef>();
            if (parser.match(LT)) {
                do {
                    args.add(parseType());
                } while (parser.match(COMMA));
                parser.expect(GT);
            }
            Span span = parser.spanFrom(name.getSpan());
            return new TypeRef(span, name.getLexeme(), args);
        } finally {
            parser.exitNesting();
        }
    }
}
