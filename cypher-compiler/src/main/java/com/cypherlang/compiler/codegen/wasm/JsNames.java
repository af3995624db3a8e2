package com.cypherlang.compiler.codegen.wasm;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JavaScript（ES 模块，严格模式）保留字，以及运行时序言占用的名字
 */
final class JsNames {

    private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default",
            "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for",
            "function", "if", "implements", "import", "in", "instanceof", "interface", "let",
            "new", "null", "package", "private", "protected", "public", "return", "static",
            "super", "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
            "with", "yield", "arguments", "eval", "undefined", "NaN", "Infinity")));

    /** 模块顶层声明 */
    static final List<String> MODULE_BINDINGS = Collections.unmodifiableList(Arrays.asList(
            "snarkjs", "CYPHER_WAT", "SNARK_SCALAR_FIELD", "CryptoLibrary", "CypherContract",
            "MPCProtocol", "mod", "modInverse", "randomFieldElement"));

    /** CypherContract 的方法与实例字段 */
    static final List<String> CONTRACT_MEMBERS = Collections.unmodifiableList(Arrays.asList(
            "constructor", "executePrivateFunction", "executeMPCFunction", "loadCircuitWasm",
            "loadZKey", "loadVerificationKey", "memory", "cryptoLib", "artifactsPath", "parties",
            "enclave", "loadJson", "state"));

    private JsNames() {}

    static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }
}
