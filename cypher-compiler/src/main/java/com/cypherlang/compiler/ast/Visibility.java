package com.cypherlang.compiler.ast;

/**
 * 函数、状态变量或电路输入声明的可见性
 */
public enum Visibility {
    PUBLIC,
    PRIVATE;

    public String toSourceString() {
        return name().toLowerCase();
    }
}
