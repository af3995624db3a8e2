package com.cypherlang.compiler.ast.type;

/**
 * 三种类型变体的访问者，由后端类型映射器实现。
 */
public interface TypeNodeVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitSecret(SecretType type);
    R visitArray(ArrayType type);
}
