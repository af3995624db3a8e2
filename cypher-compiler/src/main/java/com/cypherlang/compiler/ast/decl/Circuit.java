package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;
import com.cypherlang.compiler.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 零知识电路：带类型的输入加上对它们的约束
 */
public class Circuit extends Declaration {
    private final List<CircuitInput> inputs;
    private final List<Constraint> constraints;

    public Circuit(SourceLocation location, String name,
                   List<CircuitInput> inputs, List<Constraint> constraints) {
        super(location, name);
        this.inputs = List.copyOf(inputs);
        this.constraints = List.copyOf(constraints);
    }

    public Circuit(String name, List<CircuitInput> inputs, List<Constraint> constraints) {
        this(SourceLocation.UNKNOWN, name, inputs, constraints);
    }

    public List<CircuitInput> getInputs() {
        return inputs;
    }

    /**
     * 按声明顺序排列的公开输入，与验证器的公开信号
     * 一一对应。
     */
    public List<CircuitInput> getPublicInputs() {
        return filter(Visibility.PUBLIC);
    }

    public List<CircuitInput> getPrivateInputs() {
        return filter(Visibility.PRIVATE);
    }

    private List<CircuitInput> filter(Visibility visibility) {
        List<CircuitInput> result = new ArrayList<>();
        for (CircuitInput input : inputs) {
            if (input.getVisibility() == visibility) {
                result.add(input);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCircuit(this, context);
    }
}
