package com.cypherlang.compiler.ast.type;

import com.cypherlang.compiler.ast.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 基本类型，例如 {@code field} 或 {@code bytes32}。
 *
 * <p>解析器只产生 {@link #KNOWN_NAMES} 中的名字，但节点接受任意名字，
 * 这样以编程方式构建的 AST 可以携带后端
 * 不认识的名字。</p>
 */
public final class PrimitiveType extends TypeNode {

    public static final Set<String> KNOWN_NAMES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "field", "uint256", "bytes32", "bool", "address",
            "hash", "signature", "proof", "commitment", "witness")));

    private final String name;

    public PrimitiveType(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public PrimitiveType(String name) {
        this(SourceLocation.UNKNOWN, name);
    }

    public String getName() {
        return name;
    }

    public boolean isKnown() {
        return KNOWN_NAMES.contains(name);
    }

    @Override
    public <R> R accept(TypeNodeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public String toSourceString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return name.equals(((PrimitiveType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
