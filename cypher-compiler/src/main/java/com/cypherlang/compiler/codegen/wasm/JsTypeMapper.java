package com.cypherlang.compiler.codegen.wasm;

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
 * 把 CypherLang 类型映射为 JavaScript 包装类的 JSDoc 类型
 */
public class JsTypeMapper implements TypeNodeVisitor<String> {
    private static final Logger LOG = Logger.getLogger(JsTypeMapper.class.getName());

    static final String FALLBACK = "bigint";

    private static final Map<String, String> PRIMITIVES;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("field", "bigint");
        map.put("uint256", "bigint");
        map.put("commitment", "bigint");
        map.put("witness", "bigint");
        map.put("bytes32", "string");
        map.put("hash", "string");
        map.put("bool", "boolean");
        map.put("address", "string");
        map.put("signature", "Uint8Array");
        map.put("proof", "Groth16Proof");
        PRIMITIVES = Collections.unmodifiableMap(map);
    }

    private final boolean strict;

    public JsTypeMapper(boolean strict) {
        this.strict = strict;
    }

    public String map(TypeNode type) {
        return type.accept(this);
    }

    @Override
    public String visitPrimitive(PrimitiveType type) {
        String mapped = PRIMITIVES.get(type.getName());
        if (mapped != null) {
            return mapped;
        }
        if (strict) {
            throw new CodegenException("Unsupported type '" + type.getName() + "' for target wasm",
                    type.getLocation());
        }
        LOG.warning("Unknown type '" + type.getName() + "' at " + type.getLocation()
                + ", falling back to " + FALLBACK);
        return FALLBACK;
    }

    // 保密性由路由钩子保证，与值的 JS 类型无关
    @Override
    public String visitSecret(SecretType type) {
        return map(type.getInnerType());
    }

    @Override
    public String visitArray(ArrayType type) {
        return "Array<" + map(type.getElementType()) + ">";
    }
}
