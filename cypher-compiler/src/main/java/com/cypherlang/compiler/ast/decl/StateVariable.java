package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.Visibility;
import com.cypherlang.compiler.ast.type.TypeNode;

/**
 * 合约状态变量：{@code type name [public|private];}
 */
public class StateVariable extends Declaration {
    private final TypeNode type;
    private final Visibility visibility;

    public StateVariable(SourceLocation location, String name, TypeNode type, Visibility visibility) {
        super(location, name);
        this.type = type;
        this.visibility = visibility;
    }

    public StateVariable(String name, TypeNode type, Visibility visibility) {
        this(SourceLocation.UNKNOWN, name, type, visibility);
    }

    public TypeNode getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStateVariable(this, context);
    }
}
