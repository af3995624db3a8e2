package com.cypherlang.compiler;

/**
 * 编译流水线所有错误的基类。
 *
 * <p>每个阶段要么返回完整结果，要么抛出某个子类；
 * 任何阶段都不会吞掉前一阶段的错误。</p>
 */
public abstract class CompilationException extends RuntimeException {
    private final String fileName;
    private final int line;
    private final int column;

    protected CompilationException(String message, String fileName, int line, int column) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    /** 源码行号（从 1 开始），没有源码位置时为 0 */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 不带位置修饰的消息 */
    public String getRawMessage() {
        return super.getMessage();
    }
}
