package com.cypherlang.compiler.parser;

import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.RawStatement;
import com.cypherlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.cypherlang.compiler.lexer.TokenType.*;

/**
 * 划分语句和约束表达式的边界，不构建语法树。
 *
 * <p>语句结束于任何括号之外的 {@code ;}，或者语句打开的花括号块闭合且后面没有
 * {@code else}。表达式结束于任何括号之外的
 * {@code ;} 之前。</p>
 */
class BodyParser {

    final Parser parser;

    BodyParser(Parser parser) {
        this.parser = parser;
    }

    RawStatement parseStatement() {
        SourceLocation loc = parser.location();
        List<Token> tokens = new ArrayList<>();
        int depth = 0;

        while (true) {
            if (parser.isAtEnd()) {
                throw parser.error("Unterminated statement", "';'");
            }
            if (depth == 0 && parser.check(RBRACE)) {
                // 语句结束前外层函数体已闭合
                throw parser.error("Expected ';' after statement", "';'");
            }

            Token token = parser.advance();
            tokens.add(token);

            if (token.isOneOf(LPAREN, LBRACKET, LBRACE)) {
                depth++;
            } else if (token.isOneOf(RPAREN, RBRACKET, RBRACE)) {
                depth--;
                if (depth < 0) {
                    throw new ParseException("Unbalanced '" + token.getLexeme() + "'",
                            parser.fileName, token, "';'");
                }
                if (depth == 0 && token.is(RBRACE) && !parser.check(ELSE)) {
                    return new RawStatement(loc, tokens);
                }
            } else if (depth == 0 && token.is(SEMICOLON)) {
                return new RawStatement(loc, tokens);
            }
        }
    }

    RawExpression parseExpression() {
        SourceLocation loc = parser.location();
        List<Token> tokens = new ArrayList<>();
        int depth = 0;

        while (!(depth == 0 && parser.check(SEMICOLON))) {
            if (parser.isAtEnd()) {
                throw parser.error("Unterminated constraint expression", "';'");
            }
            if (depth == 0 && parser.checkAny(RBRACE, RPAREN, RBRACKET)) {
                throw parser.error("Expected ';' after constraint", "';'");
            }
            Token token = parser.advance();
            tokens.add(token);
            if (token.isOneOf(LPAREN, LBRACKET, LBRACE)) {
                depth++;
            } else if (token.isOneOf(RPAREN, RBRACKET, RBRACE)) {
                depth--;
            }
        }

        if (tokens.isEmpty()) {
            throw parser.error("Expected constraint expression", "expression");
        }
        return new RawExpression(loc, tokens);
    }
}
