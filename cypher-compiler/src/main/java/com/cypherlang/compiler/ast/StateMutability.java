package com.cypherlang.compiler.ast;

/**
 * 函数状态可变性。{@link #MPC} 函数只能通过
 * 链下安全多方计算协议执行。
 */
public enum StateMutability {
    PURE,
    VIEW,
    MPC;

    public String toSourceString() {
        return name().toLowerCase();
    }
}
