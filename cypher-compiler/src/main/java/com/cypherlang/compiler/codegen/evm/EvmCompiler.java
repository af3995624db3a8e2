package com.cypherlang.compiler.codegen.evm;

import com.cypherlang.compiler.ast.*;
import com.cypherlang.compiler.ast.decl.*;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.RawStatement;
import com.cypherlang.compiler.ast.stmt.Statement;
import com.cypherlang.compiler.codegen.CodeGenerator;
import com.cypherlang.compiler.codegen.CodeWriter;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.codegen.CodegenException;
import com.cypherlang.compiler.codegen.NameScope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Solidity 代码生成器。
 *
 * <p>每个合约生成一个导入 {@code CypherLib.sol} 的 Solidity 合约。
 * 每个电路生成一个验证密钥字段、构造器中对该密钥的加载，
 * 以及一个 {@code verify<Circuit>} 函数，其参数恰好是电路的
 * 公开输入加上 proof。</p>
 */
public class EvmCompiler implements AstVisitor<Void, CodeWriter>, CodeGenerator {

    static final String MPC_REVERT_REASON = "MPC functions must be called through secure computation protocol";

    private static final String LANGUAGE = "Solidity";
    private static final String LIBRARY_NAME = "CypherLib";
    private static final String PROOF_PARAM = "proof";
    private static final String SIGNALS_LOCAL = "publicInputs";

    private final CodegenConfig config;
    private final SolidityTypeMapper types;

    public EvmCompiler(CodegenConfig config) {
        this.config = config;
        this.types = new SolidityTypeMapper(config.isStrictTypes());
    }

    public EvmCompiler() {
        this(new CodegenConfig());
    }

    /**
     * 把程序编译为一个 Solidity 源文件
     */
    public String compile(Program program) {
        CodeWriter out = new CodeWriter(config.getIndentString());
        visitProgram(program, out);
        return out.getOutput();
    }

    @Override
    public Map<String, String> generate(Program program, String baseName) {
        String mainFile = baseName + ".sol";
        if (mainFile.equals(CypherLibrary.FILE_NAME)) {
            throw new CodegenException("Output file name " + mainFile + " clashes with the support library",
                    SourceLocation.UNKNOWN);
        }
        Map<String, String> artifacts = new LinkedHashMap<>();
        artifacts.put(mainFile, compile(program));
        artifacts.put(CypherLibrary.FILE_NAME, CypherLibrary.source());
        return artifacts;
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, CodeWriter out) {
        out.line("// SPDX-License-Identifier: Apache-2.0");
        out.line("pragma solidity " + config.getSolidityVersion() + ";");
        out.blankLine();
        out.line("import \"./" + CypherLibrary.FILE_NAME + "\";");

        NameScope contracts = new NameScope(LANGUAGE, "the source file", SolidityNames::isReserved);
        contracts.claim(LIBRARY_NAME, "the support library", SourceLocation.UNKNOWN);
        for (Contract contract : node.getContracts()) {
            contracts.declare(contract.getName(), "contract", contract.getLocation());
        }

        for (Contract contract : node.getContracts()) {
            out.blankLine();
            contract.accept(this, out);
        }
        return null;
    }

    @Override
    public Void visitContract(Contract node, CodeWriter out) {
        checkMemberNames(node);
        out.line("contract " + node.getName() + " {");
        out.indent();
        boolean gap = false;

        for (StateVariable variable : node.getStateVariables()) {
            variable.accept(this, out);
            gap = true;
        }

        // 每个电路一个验证密钥，部署时加载
        List<Circuit> circuits = node.getCircuits();
        if (!circuits.isEmpty()) {
            if (gap) out.blankLine();
            for (Circuit circuit : circuits) {
                out.line("CypherLib.VerifyingKey private " + verifyingKeyName(circuit) + ";");
            }
            out.blankLine();
            out.line("constructor() {");
            out.indent();
            for (Circuit circuit : circuits) {
                out.line(verifyingKeyName(circuit) + " = CypherLib.loadVerifyingKey(\"" + circuit.getName() + "\");");
            }
            out.dedent();
            out.line("}");
            gap = true;
        }

        for (FunctionDecl function : node.getFunctions()) {
            if (gap) out.blankLine();
            function.accept(this, out);
            gap = true;
        }

        for (Circuit circuit : circuits) {
            if (gap) out.blankLine();
            circuit.accept(this, out);
            gap = true;
        }

        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitStateVariable(StateVariable node, CodeWriter out) {
        String visibility = node.getVisibility() == Visibility.PUBLIC ? "public" : "internal";
        out.line(types.map(node.getType()) + " " + visibility + " " + node.getName() + ";");
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, CodeWriter out) {
        NameScope locals = new NameScope(LANGUAGE, "function '" + node.getName() + "'", SolidityNames::isReserved);
        for (Parameter param : node.getParams()) {
            locals.declare(param.getName(), "parameter", param.getLocation());
        }

        out.append("function ").append(node.getName()).append("(");
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) out.append(", ");
            params.get(i).accept(this, out);
        }
        out.append(")");

        // private 和 mpc 函数不能从合约外部调用
        boolean external = !node.isPrivate() && !node.isMpc();
        out.append(external ? " public" : " internal");
        StateMutability mutability = node.getStateMutability();
        if (mutability == StateMutability.PURE || mutability == StateMutability.VIEW) {
            out.append(" ").append(mutability.toSourceString());
        }
        if (node.hasReturnType()) {
            out.append(" returns (").append(types.mapParameter(node.getReturnType())).append(")");
        }
        out.line(" {");

        out.indent();
        if (node.isMpc()) {
            out.line("// mpc: executed off-chain by the MPC protocol");
            out.line("require(false, \"" + MPC_REVERT_REASON + "\");");
        } else if (!node.getBody().isEmpty()) {
            out.line("// Statements are not lowered to Solidity yet. Source:");
            for (Statement statement : node.getBody()) {
                statement.accept(this, out);
            }
        }
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, CodeWriter out) {
        out.append(types.mapParameter(node.getType())).append(" ").append(node.getName());
        return null;
    }

    /**
     * 生成 {@code verify<Circuit>}。公开输入按声明顺序打包进
     * 验证器所需的 {@code uint256[]} 信号数组。
     */
    @Override
    public Void visitCircuit(Circuit node, CodeWriter out) {
        List<CircuitInput> publicInputs = node.getPublicInputs();
        NameScope locals = new NameScope(LANGUAGE, "the verifier of circuit '" + node.getName() + "'",
                SolidityNames::isReserved);
        locals.claim(PROOF_PARAM, "the proof parameter", node.getLocation());
        locals.claim(SIGNALS_LOCAL, "the public signal array", node.getLocation());
        for (CircuitInput input : publicInputs) {
            locals.declare(input.getName(), "public input", input.getLocation());
        }

        out.line("/// @notice Verifies a Groth16 proof for circuit " + node.getName() + ".");
        if (!node.getConstraints().isEmpty()) {
            out.line("/// @dev Constraints:");
            for (Constraint constraint : node.getConstraints()) {
                constraint.accept(this, out);
            }
        }

        out.line("function " + verifierName(node) + "(");
        out.indent();
        List<String> params = new ArrayList<>();
        for (CircuitInput input : publicInputs) {
            CodeWriter param = new CodeWriter("");
            input.accept(this, param);
            params.add(param.getOutput());
        }
        params.add(LIBRARY_NAME + ".Proof memory " + PROOF_PARAM);
        for (int i = 0; i < params.size(); i++) {
            out.line(params.get(i) + (i < params.size() - 1 ? "," : ""));
        }
        out.dedent();
        out.line(") public view returns (bool) {");

        out.indent();
        out.line("uint256[] memory " + SIGNALS_LOCAL + " = new uint256[](" + publicInputs.size() + ");");
        for (int i = 0; i < publicInputs.size(); i++) {
            CircuitInput input = publicInputs.get(i);
            out.line(SIGNALS_LOCAL + "[" + i + "] = " + types.toPublicSignal(input.getType(), input.getName()) + ";");
        }
        out.line("return " + LIBRARY_NAME + ".verifyProof(" + verifyingKeyName(node) + ", "
                + PROOF_PARAM + ", " + SIGNALS_LOCAL + ");");
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitCircuitInput(CircuitInput node, CodeWriter out) {
        out.append(types.mapParameter(node.getType())).append(" ").append(node.getName());
        return null;
    }

    @Override
    public Void visitConstraint(Constraint node, CodeWriter out) {
        out.append("///   ");
        node.getExpression().accept(this, out);
        out.newLine();
        return null;
    }

    // ============ 占位节点 ============

    @Override
    public Void visitRawStatement(RawStatement node, CodeWriter out) {
        out.comment("// ", node.getText());
        return null;
    }

    @Override
    public Void visitRawExpression(RawExpression node, CodeWriter out) {
        out.append(node.getText().replace('\n', ' ').replace('\r', ' '));
        return null;
    }

    // ============ 命名 ============

    /**
     * 合约成员共用一个命名空间：状态变量、函数（允许重载）、生成的验证密钥字段与验证函数
     */
    private void checkMemberNames(Contract node) {
        NameScope members = new NameScope(LANGUAGE, "contract '" + node.getName() + "'", SolidityNames::isReserved);
        members.claim(node.getName(), "the contract itself", node.getLocation());
        for (Circuit circuit : node.getCircuits()) {
            String owner = "circuit " + circuit.getName();
            members.claim(verifyingKeyName(circuit), "the verifying key of " + owner, circuit.getLocation());
            members.claim(verifierName(circuit), "the verifier of " + owner, circuit.getLocation());
        }
        for (StateVariable variable : node.getStateVariables()) {
            members.declare(variable.getName(), "state variable", variable.getLocation());
        }
        Set<String> functions = new HashSet<>();
        for (FunctionDecl function : node.getFunctions()) {
            if (functions.add(function.getName())) {
                members.declare(function.getName(), "function", function.getLocation());
            }
        }
    }

    private static String verifyingKeyName(Circuit circuit) {
        return circuit.getName() + "_vk";
    }

    private static String verifierName(Circuit circuit) {
        return "verify" + circuit.getName();
    }
}
