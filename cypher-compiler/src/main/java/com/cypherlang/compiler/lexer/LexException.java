package com.cypherlang.compiler.lexer;

import com.cypherlang.compiler.CompilationException;

/**
 * 词法错误：意外字符、未结束的字符串或格式错误的字面量。
 */
public class LexException extends CompilationException {

    public LexException(String message, String fileName, int line, int column) {
        super(message, fileName, line, column);
    }

    @Override
    public String getMessage() {
        return String.format("[%s:%d:%d] Lexer error: %s",
                getFileName(), getLine(), getColumn(), getRawMessage());
    }
}
