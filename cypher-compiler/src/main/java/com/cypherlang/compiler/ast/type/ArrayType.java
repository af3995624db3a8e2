package com.cypherlang.compiler.ast.type;

import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 数组类型：{@code T[N]} 或不定长 {@code T[]}
 */
public final class ArrayType extends TypeNode {
    private static final int UNBOUNDED = -1;

    private final TypeNode elementType;
    private final int size;

    private ArrayType(SourceLocation location, TypeNode elementType, int size) {
        super(location);
        this.elementType = elementType;
        this.size = size;
    }

    public static ArrayType sized(SourceLocation location, TypeNode elementType, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Array size must not be negative: " + size);
        }
        return new ArrayType(location, elementType, size);
    }

    public static ArrayType unbounded(SourceLocation location, TypeNode elementType) {
        return new ArrayType(location, elementType, UNBOUNDED);
    }

    public TypeNode getElementType() {
        return elementType;
    }

    public boolean hasSize() {
        return size != UNBOUNDED;
    }

    /**
     * @throws IllegalStateException 数组不定长时
     */
    public int getSize() {
        if (!hasSize()) {
            throw new IllegalStateException("Unbounded array has no size");
        }
        return size;
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String toSourceString() {
        return elementType.toSourceString() + "[" + (hasSize() ? String.valueOf(size) : "") + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType other = (ArrayType) o;
        return size == other.size && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + size;
    }
}
