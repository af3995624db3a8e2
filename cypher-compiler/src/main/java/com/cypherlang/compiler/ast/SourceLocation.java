package com.cypherlang.compiler.ast;

import com.cypherlang.compiler.lexer.Token;

/**
 * 节点的源码位置
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    public SourceLocation(String file, int line, int column, int offset) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public static SourceLocation of(String file, Token token) {
        return new SourceLocation(file, token.getLine(), token.getColumn(), token.getOffset());
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
