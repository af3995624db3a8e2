package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.expr.Expression;

/**
 * 电路约束，包装一个布尔表达式
 */
public class Constraint extends AstNode {
    private final Expression expression;

    public Constraint(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Constraint(Expression expression) {
        this(SourceLocation.UNKNOWN, expression);
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstraint(this, context);
    }
}
