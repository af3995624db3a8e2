package com.cypherlang.compiler.ast.type;

import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 秘密包装类型：{@code secret<T>}
 */
public final class SecretType extends TypeNode {
    private final TypeNode innerType;

    public SecretType(SourceLocation location, TypeNode innerType) {
        super(location);
        this.innerType = innerType;
    }

    public SecretType(TypeNode innerType) {
        this(SourceLocation.UNKNOWN, innerType);
    }

    public TypeNode getInnerType() {
        return innerType;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitSecret(this);
    }

    @Override
    public String toSourceString() {
        return "secret<" + innerType.toSourceString() + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretType)) return false;
        return innerType.equals(((SecretType) o).innerType);
    }

    @Override
    public int hashCode() {
        return 31 * innerType.hashCode() + 7;
    }
}
