package com.cypherlang.compiler.ast.type;

import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 类型引用。变体是封闭集合：{@link PrimitiveType}、
 * {@link SecretType}、{@link ArrayType}。
 *
 * <p>相等性按结构比较，忽略源码位置。</p>
 */
public abstract class TypeNode {
    protected final SourceLocation location;

    protected TypeNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R> R accept(TypeNodeVisitor<R> visitor);

    /** CypherLang 源码中书写的类型 */
    public abstract String toSourceString();

    @Override
    public String toString() {
        return toSourceString();
    }
}
