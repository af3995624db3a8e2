package com.cypherlang.compiler.parser;

import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.type.ArrayType;
import com.cypherlang.compiler.ast.type.PrimitiveType;
import com.cypherlang.compiler.ast.type.SecretType;
import com.cypherlang.compiler.ast.type.TypeNode;
import com.cypherlang.compiler.lexer.Token;

import java.math.BigInteger;

import static com.cypherlang.compiler.lexer.TokenType.*;

/**
 * 类型语法：
 * <pre>
 * type := 'secret' '&lt;' type '&gt;'
 *       | primitiveKeyword ('[' NUMBER? ']')?
 * </pre>
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    boolean isTypeStart() {
        return parser.check(SECRET) || parser.current().getType().isTypeKeyword();
    }

    TypeNode parseType() {
        SourceLocation loc = parser.location();

        if (parser.match(SECRET)) {
            parser.expect(LESS_THAN, "Expected '<' after 'secret'");
            TypeNode inner = parseType();
            parser.expect(GREATER_THAN, "Expected '>' after secret inner type");
            return new SecretType(loc, inner);
        }

        if (!parser.current().getType().isTypeKeyword()) {
            throw parser.error("Expected type", "type");
        }

        PrimitiveType primitive = new PrimitiveType(loc, parser.advance().getLexeme());

        if (parser.match(LBRACKET)) {
            if (parser.check(NUMBER)) {
                int size = parseArraySize(parser.advance());
                parser.expect(RBRACKET, "Expected ']' after array size");
                return ArrayType.sized(loc, primitive, size);
            }
            parser.expect(RBRACKET, "Expected ']' after array size");
            return ArrayType.unbounded(loc, primitive);
        }

        return primitive;
    }

    private int parseArraySize(Token token) {
        BigInteger value = (BigInteger) token.getLiteral();
        if (value.bitLength() > 31) {
            throw new ParseException("Array size out of range", parser.fileName, token, "array size");
        }
        return value.intValue();
    }
}
