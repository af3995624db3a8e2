package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 合约声明
 */
public class Contract extends Declaration {
    private final List<FunctionDecl> functions;
    private final List<Circuit> circuits;
    private final List<StateVariable> stateVariables;

    public Contract(SourceLocation location, String name, List<FunctionDecl> functions,
                    List<Circuit> circuits, List<StateVariable> stateVariables) {
        super(location, name);
        this.functions = List.copyOf(functions);
        this.circuits = List.copyOf(circuits);
        this.stateVariables = List.copyOf(stateVariables);
    }

    public Contract(String name, List<FunctionDecl> functions,
                    List<Circuit> circuits, List<StateVariable> stateVariables) {
        this(SourceLocation.UNKNOWN, name, functions, circuits, stateVariables);
    }

    public List<FunctionDecl> getFunctions() {
        return functions;
    }

    public List<Circuit> getCircuits() {
        return circuits;
    }

    public List<StateVariable> getStateVariables() {
        return stateVariables;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContract(this, context);
    }
}
