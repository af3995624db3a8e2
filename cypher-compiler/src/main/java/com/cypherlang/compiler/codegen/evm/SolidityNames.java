package com.cypherlang.compiler.codegen.evm;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Solidity 关键字、保留字与基本类型名
 */
final class SolidityNames {

    private static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            // 关键字
            "abstract", "address", "anonymous", "as", "assembly", "bool", "break", "byte", "bytes",
            "calldata", "catch", "constant", "constructor", "continue", "contract", "delete", "do",
            "else", "emit", "enum", "error", "event", "external", "fallback", "false", "for",
            "function", "global", "hex", "if", "immutable", "import", "indexed", "interface",
            "internal", "is", "library", "mapping", "memory", "modifier", "new", "override",
            "payable", "pragma", "private", "public", "pure", "receive", "return", "returns",
            "revert", "storage", "string", "struct", "super", "this", "throw", "true", "try",
            "type", "unchecked", "unicode", "using", "view", "virtual", "while",
            // 单位
            "wei", "gwei", "ether", "seconds", "minutes", "hours", "days", "weeks", "years",
            // 保留字
            "after", "alias", "apply", "auto", "case", "copyof", "default", "define", "final",
            "implements", "in", "inline", "let", "macro", "match", "mutable", "null", "of",
            "partial", "promise", "reference", "relocatable", "sealed", "sizeof", "static",
            "supports", "switch", "typedef", "typeof", "var")));

    // int8..int256、uint*、bytes1..bytes32、fixedMxN、ufixedMxN
    private static final Pattern ELEMENTARY_TYPE =
            Pattern.compile("(u?int|bytes)[0-9]+|u?fixed([0-9]+x[0-9]+)?");

    private SolidityNames() {}

    static boolean isReserved(String name) {
        return KEYWORDS.contains(name) || ELEMENTARY_TYPE.matcher(name).matches();
    }
}
