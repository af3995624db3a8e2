package com.cypherlang.compiler.ast;

import com.cypherlang.compiler.lexer.TokenType;

/**
 * 源码中书写的函数修饰符关键词
 */
public enum Modifier {
    PUBLIC,
    PRIVATE,
    PURE,
    VIEW,
    MPC;

    public String toSourceString() {
        return name().toLowerCase();
    }

    public boolean isVisibility() {
        return this == PUBLIC || this == PRIVATE;
    }

    public Visibility toVisibility() {
        switch (this) {
            case PUBLIC:  return Visibility.PUBLIC;
            case PRIVATE: return Visibility.PRIVATE;
            default: throw new IllegalStateException(this + " is not a visibility modifier");
        }
    }

    public StateMutability toStateMutability() {
        switch (this) {
            case PURE: return StateMutability.PURE;
            case VIEW: return StateMutability.VIEW;
            case MPC:  return StateMutability.MPC;
            default: throw new IllegalStateException(this + " is not a mutability modifier");
        }
    }

    /** token 类型对应的修饰符，不是修饰符时返回 null */
    public static Modifier fromTokenType(TokenType type) {
        switch (type) {
            case PUBLIC:  return PUBLIC;
            case PRIVATE: return PRIVATE;
            case PURE:    return PURE;
            case VIEW:    return VIEW;
            case MPC:     return MPC;
            default:      return null;
        }
    }
}
