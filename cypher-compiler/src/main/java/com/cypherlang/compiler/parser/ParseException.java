package com.cypherlang.compiler.parser;

import com.cypherlang.compiler.CompilationException;
import com.cypherlang.compiler.lexer.Token;

/**
 * 语法错误。解析在第一个错误处停止。
 */
public class ParseException extends CompilationException {
    private final transient Token token;
    private final String expected;

    public ParseException(String message, String fileName, Token token, String expected) {
        super(message, fileName, token.getLine(), token.getColumn());
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    /** 解析器期望的语法结构 */
    public String getExpected() {
        return expected;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getRawMessage());
        sb.append(" at line ").append(token.getLine());
        sb.append(", column ").append(token.getColumn());
        sb.append(" (found ").append(token.getType());
        if (!token.getLexeme().isEmpty()) {
            sb.append(" '").append(token.getLexeme()).append('\'');
        }
        sb.append(')');
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
