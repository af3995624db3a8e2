package com.cypherlang.compiler.codegen.evm;

import com.cypherlang.compiler.ast.type.ArrayType;
import com.cypherlang.compiler.ast.type.PrimitiveType;
import com.cypherlang.compiler.ast.type.SecretType;
import com.cypherlang.compiler.ast.type.TypeNode;
import com.cypherlang.compiler.ast.type.TypeNodeVisitor;
import com.cypherlang.compiler.codegen.CodegenException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 把 CypherLang 类型映射为 Solidity 类型。
 *
 * <p>{@code secret<T>} 与 {@code T} 映射相同：链上的值只会是
 * 同宽度的承诺或密文。</p>
 */
public class SolidityTypeMapper implements TypeNodeVisitor<String> {
    private static final Logger LOG = Logger.getLogger(SolidityTypeMapper.class.getName());

    static final String FALLBACK = "uint256";

    private static final Map<String, String> PRIMITIVES;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("field", "uint256");
        map.put("uint256", "uint256");
        map.put("bytes32", "bytes32");
        map.put("bool", "bool");
        map.put("address", "address");
        map.put("hash", "bytes32");
        map.put("signature", "bytes");
        map.put("proof", "CypherLib.Proof");
        map.put("commitment", "uint256");
        map.put("witness", "uint256");
        PRIMITIVES = Collections.unmodifiableMap(map);
    }

    private final boolean strict;

    public SolidityTypeMapper(boolean strict) {
        this.strict = strict;
    }

    public String map(TypeNode type) {
        return type.accept(this);
    }

    /**
     * 参数或返回值列表中的类型写法，引用类型
     * 带数据位置。
     */
    public String mapParameter(TypeNode type) {
        String mapped = map(type);
        return isReferenceType(mapped) ? mapped + " memory" : mapped;
    }

    /**
     * 把名为 {@code expr}、类型为 {@code type} 的值转换为
     * uint256 公开信号的表达式。
     */
    public String toPublicSignal(TypeNode type, String expr) {
        String mapped = map(type);
        switch (mapped) {
            case "uint256":
                return expr;
            case "bytes32":
                return "uint256(" + expr + ")";
            case "address":
                return "uint256(uint160(" + expr + "))";
            case "bool":
                return "(" + expr + " ? 1 : 0)";
            default:
                return "uint256(keccak256(abi.encode(" + expr + "))) % CypherLib.SNARK_SCALAR_FIELD";
        }
    }

    static boolean isReferenceType(String solidityType) {
        return solidityType.equals("bytes")
                || solidityType.equals("string")
                || solidityType.endsWith("]")
                || solidityType.startsWith("CypherLib.");
    }

    @Override
    public String visitPrimitive(PrimitiveType type) {
        String mapped = PRIMITIVES.get(type.getName());
        if (mapped != null) {
            return mapped;
        }
        if (strict) {
            throw new CodegenException("Unsupported type '" + type.getName() + "' for target evm",
                    type.getLocation());
        }
        LOG.warning("Unknown type '" + type.getName() + "' at " + type.getLocation()
                + ", falling back to " + FALLBACK);
        return FALLBACK;
    }

    @Override
    public String visitSecret(SecretType type) {
        return map(type.getInnerType());
    }

    @Override
    public String visitArray(ArrayType type) {
        String element = map(type.getElementType());
        return type.hasSize() ? element + "[" + type.getSize() + "]" : element + "[]";
    }
}
