package com.cypherlang.compiler.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CypherLang 词法分析器。
 *
 * <p>单次正向扫描源码，第一个词法错误以 {@link LexException} 中止扫描。
 * 每个实例只能扫描一次。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean scanned;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明与修饰符
        map.put("contract", TokenType.CONTRACT);
        map.put("function", TokenType.FUNCTION);
        map.put("circuit", TokenType.CIRCUIT);
        map.put("modifier", TokenType.MODIFIER);
        map.put("private", TokenType.PRIVATE);
        map.put("public", TokenType.PUBLIC);
        map.put("pure", TokenType.PURE);
        map.put("view", TokenType.VIEW);
        map.put("mpc", TokenType.MPC);

        // 类型
        map.put("field", TokenType.FIELD);
        map.put("uint256", TokenType.UINT256);
        map.put("bytes32", TokenType.BYTES32);
        map.put("bool", TokenType.BOOL);
        map.put("address", TokenType.ADDRESS);
        map.put("hash", TokenType.HASH);
        map.put("signature", TokenType.SIGNATURE);
        map.put("proof", TokenType.PROOF);
        map.put("commitment", TokenType.COMMITMENT);
        map.put("secret", TokenType.SECRET);
        map.put("witness", TokenType.WITNESS);
        map.put("constraint", TokenType.CONSTRAINT);

        // 控制流
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("while", TokenType.WHILE);
        map.put("return", TokenType.RETURN);
        map.put("require", TokenType.REQUIRE);

        // 布尔字面量
        map.put("true", TokenType.BOOLEAN);
        map.put("false", TokenType.BOOLEAN);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 所有保留字 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 一次调用完成整个源码的词法分析。
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * 扫描源码，返回以 {@link TokenType#EOF} 结尾的 token 列表。
     *
     * @throws LexException 遇到第一个词法错误时
     * @throws IllegalStateException 该 lexer 已经扫描过
     */
    public List<Token> scanTokens() {
        if (scanned) {
            throw new IllegalStateException("Lexer for " + fileName + " has already been used");
        }
        scanned = true;

        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return Collections.unmodifiableList(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.MULTIPLY); break;
            case '%': addToken(TokenType.MODULO); break;
            case '<': addToken(TokenType.LESS_THAN); break;
            case '>': addToken(TokenType.GREATER_THAN); break;

            case '-':
                addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQUAL : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NOT_EQUAL : TokenType.NOT);
                break;

            case '&':
                if (!match('&')) {
                    throw error("Unexpected character '&'. Did you mean '&&'?");
                }
                addToken(TokenType.AND);
                break;

            case '|':
                if (!match('|')) {
                    throw error("Unexpected character '|'. Did you mean '||'?");
                }
                addToken(TokenType.OR);
                break;

            case '/':
                if (match('/')) {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.DIVIDE);
                }
                break;

            // 空白
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                newLine();
                break;

            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number(c);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
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

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === 构造 token ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    private LexException error(String message) {
        return new LexException(message, fileName, startLine, startColumn);
    }

    // === 复合 token ===

    private void string(char quote) {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') {
                newLine();
                value.append(c);
            } else if (c == '\\') {
                if (isAtEnd()) break;
                char escaped = advance();
                if (escaped == '\n') newLine();
                value.append(unescape(escaped));
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string");
        }

        advance(); // 右引号
        addToken(TokenType.STRING, value.toString());
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 't':  return '\t';
            case 'r':  return '\r';
            default:   return c;   // \\ \" \' 和未知转义映射为自身
        }
    }

    private void number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance(); // 'x'
            while (isHexDigit(peek())) advance();
            String digits = source.substring(start + 2, current);
            if (digits.isEmpty()) {
                throw error("Malformed hex literal '" + source.substring(start, current) + "'");
            }
            addToken(TokenType.NUMBER, new BigInteger(digits, 16));
            return;
        }

        while (isDigit(peek())) advance();
        addToken(TokenType.NUMBER, new BigInteger(source.substring(start, current)));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.IDENTIFIER);
        } else if (type == TokenType.BOOLEAN) {
            addToken(type, Boolean.valueOf(text));
        } else {
            addToken(type);
        }
    }

    /** 块注释不嵌套；未闭合的块注释延续到输入末尾。 */
    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
    }
}
