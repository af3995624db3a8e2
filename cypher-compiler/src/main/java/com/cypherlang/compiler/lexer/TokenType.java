package com.cypherlang.compiler.lexer;

/**
 * CypherLang Token 类型
 */
public enum TokenType {
    // === 字面量 ===
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOLEAN,

    // === 关键词 - 声明与修饰符 ===
    CONTRACT, FUNCTION, CIRCUIT, MODIFIER,
    PRIVATE, PUBLIC, PURE, VIEW, MPC,

    // === 关键词 - 类型 ===
    FIELD, UINT256, BYTES32, BOOL, ADDRESS,
    HASH, SIGNATURE, PROOF, COMMITMENT,
    SECRET, WITNESS, CONSTRAINT,

    // === 关键词 - 控制流 ===
    IF, ELSE, FOR, WHILE, RETURN, REQUIRE,

    // === 运算符 ===
    PLUS,           // +
    MINUS,          // -
    MULTIPLY,       // *
    DIVIDE,         // /
    MODULO,         // %
    ASSIGN,         // =
    EQUAL,          // ==
    NOT_EQUAL,      // !=
    LESS_THAN,      // <
    GREATER_THAN,   // >
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 分隔符 ===
    SEMICOLON,
    COMMA,
    DOT,
    ARROW,          // ->

    // === 括号 ===
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,

    // === 特殊 ===
    EOF;

    /**
     * 该类型是否由保留字产生
     */
    public boolean isKeyword() {
        return ordinal() >= CONTRACT.ordinal() && ordinal() <= REQUIRE.ordinal();
    }

    /**
     * 该关键词是否表示基本类型。
     * {@code witness} 算作基本类型；{@code secret} 是类型构造器，不算。
     */
    public boolean isTypeKeyword() {
        switch (this) {
            case FIELD:
            case UINT256:
            case BYTES32:
            case BOOL:
            case ADDRESS:
            case HASH:
            case SIGNATURE:
            case PROOF:
            case COMMITMENT:
            case WITNESS:
                return true;
            default:
                return false;
        }
    }

    /**
     * 该关键词是否也可用作声明名。
     * 同时是 Solidity 类型名的类型关键词以及 {@code proof} 仍是保留字。
     */
    public boolean isSoftKeyword() {
        switch (this) {
            case FIELD:
            case HASH:
            case SIGNATURE:
            case COMMITMENT:
            case WITNESS:
            case SECRET:
                return true;
            default:
                return false;
        }
    }

    /**
     * 该 token 是否可以出现在函数末尾的修饰符中
     */
    public boolean isFunctionModifier() {
        switch (this) {
            case PUBLIC:
            case PRIVATE:
            case PURE:
            case VIEW:
            case MPC:
                return true;
            default:
                return false;
        }
    }
}
