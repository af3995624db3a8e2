package com.cypherlang.compiler.ast;

import com.cypherlang.compiler.ast.decl.*;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.RawStatement;

/**
 * AST 访问者。
 *
 * <p>每种节点都有对应的抽象方法，代码生成器漏掉某种节点时无法编译。
 * 类型节点单独通过
 * {@link com.cypherlang.compiler.ast.type.TypeNodeVisitor} 分派。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitContract(Contract node, C ctx);

    R visitStateVariable(StateVariable node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitCircuit(Circuit node, C ctx);

    R visitCircuitInput(CircuitInput node, C ctx);

    R visitConstraint(Constraint node, C ctx);

    // ============ 占位节点 ============

    R visitRawStatement(RawStatement node, C ctx);

    R visitRawExpression(RawExpression node, C ctx);
}
