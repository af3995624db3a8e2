package com.cypherlang.compiler.ast.decl;

import com.cypherlang.compiler.ast.AstNode;
import com.cypherlang.compiler.ast.AstVisitor;
import com.cypherlang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 编译单元：一个源文件中的合约，按源码顺序
 */
public class Program extends AstNode {
    private final List<Contract> contracts;

    public Program(SourceLocation location, List<Contract> contracts) {
        super(location);
        this.contracts = List.copyOf(contracts);
    }

    public Program(List<Contract> contracts) {
        this(SourceLocation.UNKNOWN, contracts);
    }

    public static Program empty() {
        return new Program(Collections.emptyList());
    }

    public List<Contract> getContracts() {
        return contracts;
    }

    /** 所有合约中电路的总数 */
    public int getCircuitCount() {
        int count = 0;
        for (Contract contract : contracts) {
            count += contract.getCircuits().size();
        }
        return count;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
