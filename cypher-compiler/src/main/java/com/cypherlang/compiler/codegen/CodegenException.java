package com.cypherlang.compiler.codegen;

import com.cypherlang.compiler.CompilationException;
import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 代码生成错误：严格模式下无法映射的类型，或与目标语言保留字、生成代码冲突的名字。
 */
public class CodegenException extends CompilationException {

    public CodegenException(String message, SourceLocation location) {
        super(message, location.getFile(), location.getLine(), location.getColumn());
    }

    @Override
    public String getMessage() {
        if (getLine() <= 0) {
            return getRawMessage();
        }
        return String.format("[%s:%d:%d] Codegen error: %s",
                getFileName(), getLine(), getColumn(), getRawMessage());
    }
}
