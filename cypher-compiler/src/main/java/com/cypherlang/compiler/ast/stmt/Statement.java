package com.cypherlang.compiler.ast.stmt;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
