package com.cypherlang.compiler.codegen.wasm;

import com.cypherlang.compiler.ast.*;
import com.cypherlang.compiler.ast.decl.*;
import com.cypherlang.compiler.ast.expr.RawExpression;
import com.cypherlang.compiler.ast.stmt.RawStatement;
import com.cypherlang.compiler.ast.stmt.Statement;
import com.cypherlang.compiler.codegen.CodeGenerator;
import com.cypherlang.compiler.codegen.CodeWriter;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.codegen.NameScope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * WebAssembly 目标。
 *
 * <p>生成一个 ES 模块：WebAssembly 文本模块 {@code CYPHER_WAT}，
 * 宿主运行时（{@code CryptoLibrary}、{@code CypherContract}、
 * {@code MPCProtocol}），以及每个合约一个包装类。包装方法把
 * {@code mpc} 函数路由到 {@code executeMPCFunction}，{@code private}
 * 函数路由到 {@code executePrivateFunction}，并为每个电路生成基于 snarkjs 的
 * {@code prove<Circuit>}/{@code verify<Circuit>} 方法对。</p>
 */
public class WasmCompiler implements AstVisitor<Void, CodeWriter>, CodeGenerator {

    private static final String INDENT = "  ";
    private static final String LANGUAGE = "JavaScript";

    private final JsTypeMapper types;

    public WasmCompiler(CodegenConfig config) {
        this.types = new JsTypeMapper(config.isStrictTypes());
    }

    public WasmCompiler() {
        this(new CodegenConfig());
    }

    /**
     * 把程序编译为一个 JavaScript 模块
     */
    public String compile(Program program) {
        CodeWriter out = new CodeWriter(INDENT);
        visitProgram(program, out);
        return out.getOutput();
    }

    @Override
    public Map<String, String> generate(Program program, String baseName) {
        Map<String, String> artifacts = new LinkedHashMap<>();
        artifacts.put(baseName + ".js", compile(program));
        return artifacts;
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, CodeWriter out) {
        NameScope bindings = new NameScope(LANGUAGE, "the module", JsNames::isReserved);
        for (String binding : JsNames.MODULE_BINDINGS) {
            bindings.claim(binding, "a runtime declaration", SourceLocation.UNKNOWN);
        }
        for (Contract contract : node.getContracts()) {
            bindings.declare(contract.getName(), "contract", contract.getLocation());
        }

        out.line("import * as snarkjs from 'snarkjs';");
        out.blankLine();

        out.line("/** WebAssembly text module. Assemble with wat2wasm and pass the binary to CryptoLibrary.init(). */");
        out.line("export const CYPHER_WAT = `");
        out.block(WasmRuntime.moduleText());
        out.line("`;");
        out.blankLine();

        out.block(WasmRuntime.runtimeText());
        out.blankLine();
        out.block(WasmRuntime.mpcText());

        for (Contract contract : node.getContracts()) {
            out.blankLine();
            contract.accept(this, out);
        }

        out.blankLine();
        out.line("export { CryptoLibrary, CypherContract, MPCProtocol };");
        return null;
    }

    @Override
    public Void visitContract(Contract node, CodeWriter out) {
        checkMethodNames(node);
        out.line("// Contract: " + node.getName());
        out.line("export class " + node.getName() + " extends CypherContract {");
        out.indent();

        out.line("constructor(options = {}) {");
        out.indent();
        out.line("super(options);");
        if (!node.getStateVariables().isEmpty()) {
            out.line("this.state = {");
            out.indent();
            for (StateVariable variable : node.getStateVariables()) {
                variable.accept(this, out);
            }
            out.dedent();
            out.line("};");
        }
        out.dedent();
        out.line("}");

        for (FunctionDecl function : node.getFunctions()) {
            out.blankLine();
            function.accept(this, out);
        }

        for (Circuit circuit : node.getCircuits()) {
            out.blankLine();
            circuit.accept(this, out);
        }

        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitStateVariable(StateVariable node, CodeWriter out) {
        out.line(node.getName() + ": null, // " + types.map(node.getType())
                + " (" + node.getType().toSourceString() + "), "
                + node.getVisibility().toSourceString());
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, CodeWriter out) {
        String returnType = node.hasReturnType() ? types.map(node.getReturnType()) : "void";
        boolean routed = node.isMpc() || node.isPrivate();
        NameScope locals = new NameScope(LANGUAGE, "method '" + node.getName() + "'", JsNames::isReserved);
        for (Parameter param : node.getParams()) {
            locals.declare(param.getName(), "parameter", param.getLocation());
        }

        out.line("/**");
        if (node.isMpc()) {
            out.line(" * mpc: evaluated jointly by the configured parties.");
        } else if (node.isPrivate()) {
            out.line(" * private: evaluated inside the secure enclave.");
        }
        for (Parameter param : node.getParams()) {
            param.accept(this, out);
        }
        out.line(" * @returns {" + (routed ? "Promise<" + returnType + ">" : returnType) + "}");
        out.line(" */");

        String args = joinParamNames(node.getParams());
        out.line(node.getName() + "(" + args + ") {");
        out.indent();
        if (node.isMpc()) {
            out.line("return this.executeMPCFunction('" + node.getName() + "', [" + args + "]);");
        } else if (node.isPrivate()) {
            out.line("return this.executePrivateFunction('" + node.getName() + "', [" + args + "]);");
        } else if (!node.getBody().isEmpty()) {
            out.line("// Statements are not lowered to JavaScript yet. Source:");
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
        out.line(" * @param {" + types.map(node.getType()) + "} " + node.getName());
        return null;
    }

    @Override
    public Void visitCircuit(Circuit node, CodeWriter out) {
        String name = node.getName();
        List<CircuitInput> publicInputs = node.getPublicInputs();

        // 证明
        out.line("/**");
        out.line(" * Generate a Groth16 proof for circuit " + name + ".");
        for (Constraint constraint : node.getConstraints()) {
            constraint.accept(this, out);
        }
        out.line(" * @param {" + recordType(node.getPrivateInputs()) + "} witness private inputs");
        out.line(" * @param {" + recordType(publicInputs) + "} publicInputs public inputs");
        out.line(" * @returns {Promise<{proof: Groth16Proof, publicSignals: string[]}>}");
        out.line(" */");
        out.line("async prove" + name + "(witness, publicInputs) {");
        out.indent();
        out.line("const input = Object.assign({}, publicInputs, witness);");
        out.line("const { proof, publicSignals } = await snarkjs.groth16.fullProve(");
        out.indent();
        out.line("input,");
        out.line("this.loadCircuitWasm('" + name + "'),");
        out.line("this.loadZKey('" + name + "')");
        out.dedent();
        out.line(");");
        out.line("return { proof, publicSignals };");
        out.dedent();
        out.line("}");
        out.blankLine();

        // 验证
        out.line("/**");
        out.line(" * Verify a Groth16 proof for circuit " + name + ".");
        out.line(" * Public signals, in order: " + (publicInputs.isEmpty() ? "none" : joinInputNames(publicInputs)));
        out.line(" * @param {Groth16Proof} proof");
        out.line(" * @param {string[]} publicSignals");
        out.line(" * @returns {Promise<boolean>}");
        out.line(" */");
        out.line("async verify" + name + "(proof, publicSignals) {");
        out.indent();
        out.line("if (publicSignals.length !== " + publicInputs.size() + ") {");
        out.indent();
        out.line("throw new Error(`" + name + " expects " + publicInputs.size()
                + " public signal(s), got ${publicSignals.length}`);");
        out.dedent();
        out.line("}");
        out.line("const vkey = await this.loadVerificationKey('" + name + "');");
        out.line("return snarkjs.groth16.verify(vkey, publicSignals, proof);");
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitCircuitInput(CircuitInput node, CodeWriter out) {
        out.append(node.getName()).append(": ").append(types.map(node.getType()));
        return null;
    }

    @Override
    public Void visitConstraint(Constraint node, CodeWriter out) {
        out.append(" * Constraint: ");
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
        // 保持 JSDoc 注释块闭合
        out.append(node.getText().replace("*/", "* /").replace('\n', ' ').replace('\r', ' '));
        return null;
    }

    // ============ 辅助方法 ============

    /**
     * 方法名不能覆盖 CypherContract 的成员；JS 没有重载，同名方法也视为冲突
     */
    private void checkMethodNames(Contract node) {
        NameScope methods = new NameScope(LANGUAGE, "class '" + node.getName() + "'", JsNames::isReserved);
        for (String member : JsNames.CONTRACT_MEMBERS) {
            methods.claim(member, "a CypherContract member", SourceLocation.UNKNOWN);
        }
        for (Circuit circuit : node.getCircuits()) {
            methods.claim("prove" + circuit.getName(), "the prover of circuit " + circuit.getName(),
                    circuit.getLocation());
            methods.claim("verify" + circuit.getName(), "the verifier of circuit " + circuit.getName(),
                    circuit.getLocation());
        }
        // 方法名可以是保留字
        for (FunctionDecl function : node.getFunctions()) {
            methods.claim(function.getName(), "function", function.getLocation());
        }
    }

    private String recordType(List<CircuitInput> inputs) {
        if (inputs.isEmpty()) {
            return "Object";
        }
        CodeWriter fields = new CodeWriter("");
        fields.append("{");
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) fields.append(", ");
            inputs.get(i).accept(this, fields);
        }
        fields.append("}");
        return fields.getOutput();
    }

    private static String joinParamNames(List<Parameter> params) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).getName());
        }
        return sb.toString();
    }

    private static String joinInputNames(List<CircuitInput> inputs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(inputs.get(i).getName());
        }
        return sb.toString();
    }
}
