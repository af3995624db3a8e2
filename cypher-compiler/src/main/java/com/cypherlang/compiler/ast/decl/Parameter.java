package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.type.TypeNode;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeNode type;

    public Parameter(SourceLocation location, String name, TypeNode type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public Parameter(String name, TypeNode type) {
        this(SourceLocation.UNKNOWN, name, type);
    }

    public String getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
