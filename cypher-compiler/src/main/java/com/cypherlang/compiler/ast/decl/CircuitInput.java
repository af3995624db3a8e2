package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.Visibility;
import com.cypherlang.compiler.ast.type.TypeNode;

/**
 * 电路输入：{@code (public|private) [witness] type name;}
 */
public class CircuitInput extends AstNode {
    private final String name;
    private final TypeNode type;
    private final Visibility visibility;
    private final boolean witness;

    public CircuitInput(SourceLocation location, String name, TypeNode type,
                        Visibility visibility, boolean witness) {
        super(location);
        this.name = name;
        this.type = type;
        this.visibility = visibility;
        this.witness = witness;
    }

    public CircuitInput(String name, TypeNode type, Visibility visibility) {
        this(SourceLocation.UNKNOWN, name, type, visibility, false);
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    /** 源码中是否标记了 {@code witness} */
    public boolean isWitness() {
        return witness;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCircuitInput(this, context);
    }
}
