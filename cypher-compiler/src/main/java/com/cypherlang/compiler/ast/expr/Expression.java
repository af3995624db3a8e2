package com.cypherlang.compiler.ast.expr;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
