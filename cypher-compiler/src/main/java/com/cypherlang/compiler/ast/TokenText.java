package com.cypherlang.compiler.ast;

import com.cypherlang.compiler.lexer.Token;
import com.cypherlang.compiler.lexer.TokenType;

import java.util.List;

/**
 * 从一段 token 重建可读的源码文本
 */
public final class TokenText {

    private TokenText() {}

    public static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token token : tokens) {
            if (prev != null && needsSpace(prev.getType(), token.getType())) {
                sb.append(' ');
            }
            sb.append(token.getLexeme());
            prev = token;
        }
        return sb.toString();
    }

    private static boolean needsSpace(TokenType prev, TokenType next) {
        switch (next) {
            case SEMICOLON:
            case COMMA:
            case RPAREN:
            case RBRACKET:
            case DOT:
                return false;
            case LPAREN:
            case LBRACKET:
                // 调用或下标：f(x)、a[i]、require(c)
                if (prev == TokenType.IDENTIFIER || prev == TokenType.RPAREN
                        || prev == TokenType.RBRACKET || prev == TokenType.REQUIRE) {
                    return false;
                }
                break;
            default:
                break;
        }
        return prev != TokenType.LPAREN && prev != TokenType.LBRACKET
                && prev != TokenType.DOT && prev != TokenType.NOT;
    }
}
