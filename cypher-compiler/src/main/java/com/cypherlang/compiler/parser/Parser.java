package com.cypherlang.compiler.parser;

import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.decl.Contract;
import com.cypherlang.compiler.ast.decl.Program;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.RawStatement;
import com.cypherlang.compiler.ast.type.TypeNode;
import com.cypherlang.compiler.lexer.Token;
import com.cypherlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.cypherlang.compiler.lexer.TokenType.*;

/**
 * CypherLang 语法分析器（递归下降）。
 *
 * <p>只消费一次词法分析器的 token 列表，遇到第一个不匹配即失败，
 * 不做错误恢复。</p>
 */
public class Parser {

    private final List<Token> tokens;
    final String fileName;
    private int current = 0;
    private boolean parsed;

    // === 辅助字段 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final BodyParser bodyParser = new BodyParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
    }

    public Parser(List<Token> tokens) {
        this(tokens, "<input>");
    }

    // ============ 游标 ============

    Token current() {
        return tokens.get(current);
    }

    Token previous() {
        return tokens.get(current - 1);
    }

    /** 当前 token 的下一个，越界时为 EOF */
    Token peekNext() {
        return peek(1);
    }

    /** 向前 {@code distance} 个位置的 token，越界时为 EOF */
    Token peek(int distance) {
        return tokens.get(Math.min(current + distance, tokens.size() - 1));
    }

    Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望指定 token 类型，否则失败
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, type.name());
    }

    /**
     * 期望一个声明名。接受{@link TokenType#isSoftKeyword() 软关键词}，
     * 所以 {@code field commitment;} 声明的是名为 "commitment" 的变量。
     */
    String expectName(String message) {
        if (isNameToken(current())) {
            return advance().getLexeme();
        }
        if (current().getType().isKeyword()) {
            throw error(message + ", '" + current().getLexeme() + "' is a reserved word", "IDENTIFIER");
        }
        throw error(message, "IDENTIFIER");
    }

    static boolean isNameToken(Token token) {
        return token.is(IDENTIFIER) || token.getType().isSoftKeyword();
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, fileName, current(), expected);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    SourceLocation location() {
        return SourceLocation.of(fileName, current());
    }

    // ============ 程序 ============

    /**
     * 解析整个 token 列表。
     *
     * @throws ParseException 遇到第一个语法错误时
     */
    public Program parse() {
        if (parsed) {
            throw new IllegalStateException("Parser for " + fileName + " has already been used");
        }
        parsed = true;

        SourceLocation loc = location();
        List<Contract> contracts = new ArrayList<>();
        while (!isAtEnd()) {
            if (!check(CONTRACT)) {
                throw error("Expected contract declaration", "CONTRACT");
            }
            contracts.add(declParser.parseContract());
        }
        return new Program(loc, contracts);
    }

    // ============ 委托 ============

    TypeNode parseType() { return typeParser.parseType(); }

    boolean isTypeStart() { return typeParser.isTypeStart(); }

    RawStatement parseStatement() { return bodyParser.parseStatement(); }

    RawExpression parseExpression() { return bodyParser.parseExpression(); }
}
