package com.cypherlang.cli;

import com.cypherlang.compiler.ast.decl.Circuit;
import com.cypherlang.compiler.ast.decl.Contract;
import com.cypherlang.compiler.ast.decl.FunctionDecl;
import com.cypherlang.compiler.ast.decl.Program;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * 已解析程序的结构摘要，由 Gson 原样序列化
 */
public class ProgramReport {
    String file;
    int contractCount;
    int functionCount;
    int circuitCount;
    List<ContractReport> contracts = new ArrayList<>();

    static class ContractReport {
        String name;
        int stateVariables;
        int functions;
        int privateFunctions;
        int mpcFunctions;
        List<CircuitReport> circuits = new ArrayList<>();
    }

    static class CircuitReport {
        String name;
        int publicInputs;
        int privateInputs;
        int constraints;
    }

    public static ProgramReport of(String file, Program program) {
        ProgramReport report = new ProgramReport();
        report.file = file;
        for (Contract contract : program.getContracts()) {
            ContractReport c = new ContractReport();
            c.name = contract.getName();
            c.stateVariables = contract.getStateVariables().size();
            c.functions = contract.getFunctions().size();
            for (FunctionDecl function : contract.getFunctions()) {
                if (function.isMpc()) c.mpcFunctions++;
                if (function.isPrivate()) c.privateFunctions++;
            }
            for (Circuit circuit : contract.getCircuits()) {
                CircuitReport r = new CircuitReport();
                r.name = circuit.getName();
                r.publicInputs = circuit.getPublicInputs().size();
                r.privateInputs = circuit.getPrivateInputs().size();
                r.constraints = circuit.getConstraints().size();
                c.circuits.add(r);
            }
            report.contracts.add(c);
            report.functionCount += c.functions;
            report.circuitCount += c.circuits.size();
        }
        report.contractCount = report.contracts.size();
        return report;
    }

    void print(PrintWriter out) {
        out.println("Analysis of " + file);
        out.println("  contracts: " + contractCount + ", functions: " + functionCount
                + ", circuits: " + circuitCount);
        for (ContractReport c : contracts) {
            out.println();
            out.println("contract " + c.name);
            out.println("  state variables: " + c.stateVariables);
            out.println("  functions: " + c.functions + " (private: " + c.privateFunctions
                    + ", mpc: " + c.mpcFunctions + ")");
            for (CircuitReport r : c.circuits) {
                out.println("  circuit " + r.name + ": " + r.publicInputs + " public input(s), "
                        + r.privateInputs + " private input(s), " + r.constraints + " constraint(s)");
            }
        }
    }
}
