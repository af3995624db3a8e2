package com.cypherlang.compiler.codegen.evm;

import com.cypherlang.compiler.ast.Visibility;
import com.cypherlang.compiler.ast.decl.*;
import com.cypherlang.compiler.ast.type.PrimitiveType;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.codegen.CodegenException;
import com.cypherlang.compiler.lexer.Lexer;
import com.cypherlang.compiler.parser.Parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Solidity 生成测试
 */
class EvmCompilerTest {

    private static final String KNOWLEDGE =
            "contract Vault {\n"
            + "    field balance public;\n"
            + "    circuit Knowledge {\n"
            + "        private witness field secret_value;\n"
            + "        public field commitment;\n"
            + "        constraint poseidon([secret_value]) == commitment;\n"
            + "    }\n"
            + "    function deposit(uint256 amount) -> uint256 public { return amount; }\n"
            + "}\n";

    private Program parse(String source) {
        return new Parser(new Lexer(source, "<test>").scanTokens(), "<test>").parse();
    }

    private String compile(String source) {
        return new EvmCompiler().compile(parse(source));
    }

    /** 函数头包含 {@code header} 的函数的各行，直到其右花括号 */
    private List<String> functionBody(String output, String header) {
        List<String> lines = Arrays.asList(output.split("\n"));
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(header)) {
                start = i;
                break;
            }
        }
        assertThat(start).as("function %s present", header).isGreaterThanOrEqualTo(0);
        List<String> body = new ArrayList<>();
        for (int i = start + 1; i < lines.size() && !lines.get(i).equals("    }"); i++) {
            body.add(lines.get(i).trim());
        }
        return body;
    }

    private int count(String haystack, String regex) {
        Matcher m = Pattern.compile(regex, Pattern.MULTILINE).matcher(haystack);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    // ============ 布局 ============

    @Nested
    @DisplayName("布局")
    class LayoutTests {

        @Test
        @DisplayName("单个状态变量的合约")
        void testMinimalContract() {
            assertThat(compile("contract C { field x public; }")).isEqualTo(
                    "// SPDX-License-Identifier: Apache-2.0\n"
                    + "pragma solidity ^0.8.19;\n"
                    + "\n"
                    + "import \"./CypherLib.sol\";\n"
                    + "\n"
                    + "contract C {\n"
                    + "    uint256 public x;\n"
                    + "}\n");
        }

        @Test
        @DisplayName("空程序只有文件头")
        void testEmptyProgram() {
            assertThat(new EvmCompiler().compile(Program.empty())).isEqualTo(
                    "// SPDX-License-Identifier: Apache-2.0\n"
                    + "pragma solidity ^0.8.19;\n"
                    + "\n"
                    + "import \"./CypherLib.sol\";\n");
        }

        @Test
        @DisplayName("多个合约共用一个文件头")
        void testMultipleContracts() {
            String out = compile("contract A {} contract B {}");
            assertThat(count(out, "SPDX-License-Identifier")).isEqualTo(1);
            assertThat(out).contains("contract A {\n}\n\ncontract B {\n}\n");
        }

        @Test
        @DisplayName("可配置的缩进与 pragma")
        void testConfig() {
            CodegenConfig config = new CodegenConfig();
            config.setIndentSize(2);
            config.setSolidityVersion("0.8.24");
            String out = new EvmCompiler(config).compile(parse("contract C { field x public; }"));
            assertThat(out).contains("pragma solidity 0.8.24;").contains("\n  uint256 public x;\n");
        }

        @Test
        @DisplayName("private 状态变量变为 internal")
        void testInternalState() {
            assertThat(compile("contract C { bytes32 root; address owner public; }"))
                    .contains("    bytes32 internal root;\n")
                    .contains("    address public owner;\n");
        }

        @Test
        @DisplayName("generate 返回合约文件和支持库")
        void testGenerate() {
            Map<String, String> artifacts = new EvmCompiler().generate(parse("contract C {}"), "main");
            assertThat(artifacts.keySet()).containsExactly("main.sol", "CypherLib.sol");
            assertThat(artifacts.get("CypherLib.sol")).isEqualTo(CypherLibrary.source());
        }

        @Test
        @DisplayName("主文件不能覆盖支持库")
        void testLibraryNameClash() {
            assertThatThrownBy(() -> new EvmCompiler().generate(Program.empty(), "CypherLib"))
                    .isInstanceOf(CodegenException.class)
                    .hasMessageContaining("CypherLib.sol");
        }
    }

    // ============ 电路 ============

    @Nested
    @DisplayName("电路")
    class CircuitTests {

        @Test
        @DisplayName("验证器签名：公开输入在前，proof 在后")
        void testVerifierSignature() {
            String out = compile(KNOWLEDGE);
            Pattern signature = Pattern.compile(
                    "function verifyKnowledge\\(\\s*uint256 commitment,\\s*CypherLib\\.Proof memory proof\\s*\\)"
                    + " public view returns \\(bool\\)");
            assertThat(signature.matcher(out).find()).as(out).isTrue();
            assertThat(out).doesNotContain("secret_value,");
        }

        @Test
        @DisplayName("验证密钥字段与构造器加载")
        void testVerifyingKey() {
            String out = compile(KNOWLEDGE);
            assertThat(out)
                    .contains("    CypherLib.VerifyingKey private Knowledge_vk;\n")
                    .contains("    constructor() {\n"
                            + "        Knowledge_vk = CypherLib.loadVerifyingKey(\"Knowledge\");\n"
                            + "    }\n");
        }

        @Test
        @DisplayName("公开输入按顺序打包")
        void testPublicInputPacking() {
            String out = compile(KNOWLEDGE);
            assertThat(functionBody(out, "function verifyKnowledge(")).containsSubsequence(
                    "uint256[] memory publicInputs = new uint256[](1);",
                    "publicInputs[0] = commitment;",
                    "return CypherLib.verifyProof(Knowledge_vk, proof, publicInputs);");
        }

        @Test
        @DisplayName("各种类型的公开输入都转换为 uint256")
        void testConversions() {
            String out = compile("contract C { circuit M {"
                    + " public bytes32 root; public address who; public bool flag;"
                    + " public hash h; public signature sig; public uint256[2] pair; } }");
            assertThat(out)
                    .contains("publicInputs[0] = uint256(root);")
                    .contains("publicInputs[1] = uint256(uint160(who));")
                    .contains("publicInputs[2] = (flag ? 1 : 0);")
                    .contains("publicInputs[3] = uint256(h);")
                    .contains("publicInputs[4] = uint256(keccak256(abi.encode(sig))) % CypherLib.SNARK_SCALAR_FIELD;")
                    .contains("publicInputs[5] = uint256(keccak256(abi.encode(pair))) % CypherLib.SNARK_SCALAR_FIELD;")
                    .contains("        bytes memory sig,\n")
                    .contains("        uint256[2] memory pair,\n");
        }

        @Test
        @DisplayName("没有公开输入的电路只接收 proof")
        void testNoPublicInputs() {
            String out = compile("contract C { circuit Hidden { private field s; constraint s == s; } }");
            assertThat(out).contains("    function verifyHidden(\n"
                    + "        CypherLib.Proof memory proof\n"
                    + "    ) public view returns (bool) {\n"
                    + "        uint256[] memory publicInputs = new uint256[](0);\n");
        }

        @Test
        @DisplayName("约束写在验证器的注释里")
        void testConstraintDocs() {
            assertThat(compile(KNOWLEDGE)).contains(
                    "    /// @notice Verifies a Groth16 proof for circuit Knowledge.\n"
                    + "    /// @dev Constraints:\n"
                    + "    ///   poseidon([secret_value]) == commitment\n"
                    + "    function verifyKnowledge(\n");
        }

        @Test
        @DisplayName("每个电路一个验证器，每个合约一个 contract")
        void testStructuralCounts() {
            String source = KNOWLEDGE
                    + "contract Voting { circuit Ballot { public field root; private field vote; }"
                    + " circuit Range { public uint256 max; } }\n"
                    + "contract Plain { function f() {} }";
            Program program = parse(source);
            String out = new EvmCompiler().compile(program);
            assertThat(count(out, "^contract \\w+ \\{")).isEqualTo(program.getContracts().size());
            assertThat(count(out, "function verify\\w+\\(")).isEqualTo(program.getCircuitCount());
            assertThat(count(out, "CypherLib.VerifyingKey private")).isEqualTo(3);
        }
    }

    // ============ 函数 ============

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("mpc 函数体只有 revert")
        void testMpcBody() {
            String out = compile("contract C { function tally(secret<uint256> v) -> uint256 mpc { return v + 1; } }");
            assertThat(out).contains("    function tally(uint256 v) internal returns (uint256) {\n");
            List<String> executable = new ArrayList<>();
            for (String line : functionBody(out, "function tally(")) {
                if (!line.startsWith("//")) executable.add(line);
            }
            assertThat(executable).containsExactly(
                    "require(false, \"MPC functions must be called through secure computation protocol\");");
        }

        @Test
        @DisplayName("可见性与可变性的顺序")
        void testModifiers() {
            String out = compile("contract C {"
                    + " function a() pure {}"
                    + " function b() -> bool view private {}"
                    + " function c(bytes32 h) public {} }");
            assertThat(out)
                    .contains("function a() public pure {")
                    .contains("function b() internal view returns (bool) {")
                    .contains("function c(bytes32 h) public {");
        }

        @Test
        @DisplayName("引用类型带 memory 位置")
        void testMemoryLocation() {
            String out = compile("contract C { function check(proof p, signature s, field[] xs) -> bytes32[4] view {} }");
            assertThat(out).contains(
                    "function check(CypherLib.Proof memory p, bytes memory s, uint256[] memory xs)"
                    + " public view returns (bytes32[4] memory) {");
        }

        @Test
        @DisplayName("函数体语句以注释列出")
        void testBodyComments() {
            String out = compile(KNOWLEDGE);
            assertThat(functionBody(out, "function deposit(")).containsExactly(
                    "// Statements are not lowered to Solidity yet. Source:",
                    "// return amount;");
        }

        @Test
        @DisplayName("空函数体保持为空")
        void testEmptyBody() {
            assertThat(compile("contract C { function f() {} }"))
                    .contains("    function f() public {\n    }\n");
        }
    }

    // ============ 类型 ============

    @Nested
    @DisplayName("类型回退")
    class TypeFallbackTests {

        private Program withStateType(String typeName) {
            StateVariable variable = new StateVariable("typo", new PrimitiveType(typeName), Visibility.PUBLIC);
            Contract contract = new Contract("C", Collections.<FunctionDecl>emptyList(),
                    Collections.<Circuit>emptyList(), Collections.singletonList(variable));
            return new Program(Collections.singletonList(contract));
        }

        @Test
        @DisplayName("未知类型回退为 uint256")
        void testFallback() {
            assertThat(new EvmCompiler().compile(withStateType("feild")))
                    .contains("    uint256 public typo;\n");
        }

        @Test
        @DisplayName("严格模式拒绝未知类型")
        void testStrict() {
            CodegenConfig config = new CodegenConfig();
            config.setStrictTypes(true);
            assertThatThrownBy(() -> new EvmCompiler(config).compile(withStateType("feild")))
                    .isInstanceOf(CodegenException.class)
                    .hasMessageContaining("Unsupported type 'feild' for target evm");
        }
    }

    @Nested
    @DisplayName("命名冲突")
    class NameTests {

        private void assertRejected(String source, String message) {
            assertThatThrownBy(() -> compile(source))
                    .isInstanceOf(CodegenException.class)
                    .hasMessageContaining(message);
        }

        @Test
        @DisplayName("公开输入不能与公开信号数组同名")
        void testSignalArrayClash() {
            assertRejected("contract C { circuit K { public field x; public field publicInputs; } }",
                    "Name 'publicInputs' of public input clashes with the public signal array"
                    + " in the verifier of circuit 'K'");
        }

        @Test
        @DisplayName("公开输入不能与 proof 参数同名")
        void testProofParameterClash() {
            CircuitInput input = new CircuitInput("proof", new PrimitiveType("field"), Visibility.PUBLIC);
            Circuit circuit = new Circuit("K", Collections.singletonList(input), Collections.<Constraint>emptyList());
            Contract contract = new Contract("C", Collections.<FunctionDecl>emptyList(),
                    Collections.singletonList(circuit), Collections.<StateVariable>emptyList());

            assertThatThrownBy(() -> new EvmCompiler().compile(new Program(Collections.singletonList(contract))))
                    .isInstanceOf(CodegenException.class)
                    .hasMessage("Name 'proof' of public input clashes with the proof parameter"
                            + " in the verifier of circuit 'K'");
        }

        @Test
        @DisplayName("状态变量不能与验证密钥字段同名")
        void testVerifyingKeyClash() {
            assertRejected("contract C { field K_vk; circuit K { public field x; } }",
                    "Name 'K_vk' of state variable clashes with the verifying key of circuit K in contract 'C'");
        }

        @Test
        @DisplayName("函数不能与生成的验证函数同名")
        void testVerifierClash() {
            assertRejected("contract C { circuit K { public field x; } function verifyK() {} }",
                    "Name 'verifyK' of function clashes with the verifier of circuit K in contract 'C'");
        }

        @Test
        @DisplayName("合约不能命名为 CypherLib")
        void testLibraryClash() {
            assertRejected("contract CypherLib {}",
                    "Name 'CypherLib' of contract clashes with the support library in the source file");
        }

        @Test
        @DisplayName("合约名不能重复")
        void testDuplicateContract() {
            assertRejected("contract A {} contract A {}", "Name 'A' of contract clashes with contract");
        }

        @Test
        @DisplayName("Solidity 保留字不能作为名字")
        void testSolidityReservedWords() {
            assertRejected("contract C { field string; }",
                    "'string' is a reserved word in Solidity and cannot name a state variable");
            assertRejected("contract C { function f(field uint8) {} }",
                    "'uint8' is a reserved word in Solidity and cannot name a parameter");
            assertRejected("contract C { function emit() {} }",
                    "'emit' is a reserved word in Solidity and cannot name a function");
            assertRejected("contract mapping {}",
                    "'mapping' is a reserved word in Solidity and cannot name a contract");
        }

        @Test
        @DisplayName("参数名不能重复")
        void testDuplicateParameter() {
            assertRejected("contract C { function f(field a, bool a) {} }",
                    "Name 'a' of parameter clashes with parameter in function 'f'");
        }

        @Test
        @DisplayName("函数可以重载")
        void testOverloading() {
            String out = compile("contract C { function f(field a) {} function f(bool b) {} }");
            assertThat(count(out, "^    function f\\(")).isEqualTo(2);
        }

        @Test
        @DisplayName("软关键字名字生成合法的 Solidity")
        void testSoftKeywordNames() {
            String out = compile("contract C { field commitment public; function f(hash signature) {} }");
            assertThat(out)
                    .contains("    uint256 public commitment;\n")
                    .contains("function f(bytes32 signature) public {");
        }
    }

    @Test
    @DisplayName("相同程序，相同输出")
    void testDeterministic() {
        Program program = parse(KNOWLEDGE);
        EvmCompiler compiler = new EvmCompiler();
        String first = compiler.compile(program);
        assertThat(compiler.compile(program)).isEqualTo(first);
        assertThat(new EvmCompiler().compile(parse(KNOWLEDGE))).isEqualTo(first);
    }
}
