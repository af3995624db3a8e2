package com.cypherlang.compiler.codegen;

/**
 * 带缩进跟踪的输出缓冲区。
 *
 * <p>每次编译调用一个 writer，不在调用之间共享。</p>
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 追加文本，位于行首时先缩进
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    public CodeWriter newLine() {
        output.append('\n');
        atLineStart = true;
        return this;
    }

    /** 追加一整行 */
    public CodeWriter line(String text) {
        return append(text).newLine();
    }

    /**
     * 追加空行，不会连续两个
     */
    public CodeWriter blankLine() {
        int len = output.length();
        if (len == 0 || (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n')) {
            return this;
        }
        if (output.charAt(len - 1) != '\n') {
            output.append('\n');
        }
        output.append('\n');
        atLineStart = true;
        return this;
    }

    /**
     * 按行原样追加预格式化文本，使用当前缩进
     */
    public CodeWriter block(String text) {
        String[] lines = text.split("\n", -1);
        int end = lines.length;
        if (end > 0 && lines[end - 1].isEmpty()) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            if (lines[i].isEmpty()) {
                newLine();
            } else {
                line(lines[i]);
            }
        }
        return this;
    }

    /**
     * 为 {@code text} 的每一行追加一行注释，使用给定前缀
     */
    public CodeWriter comment(String prefix, String text) {
        for (String part : text.split("\r?\n", -1)) {
            line(part.isEmpty() ? prefix.trim() : prefix + part);
        }
        return this;
    }

    public String getOutput() {
        return output.toString();
    }
}
