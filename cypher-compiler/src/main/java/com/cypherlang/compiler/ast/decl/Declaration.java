package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 具名声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
