package com.cypherlang.compiler.compiler;

import com.cypherlang.compiler.codegen.CodeGenerator;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.codegen.evm.EvmCompiler;
import com.cypherlang.compiler.codegen.wasm.WasmCompiler;

/**
 * 编译目标
 */
public enum CompileTarget {
    EVM("evm", ".sol") {
        @Override
        public CodeGenerator newGenerator(CodegenConfig config) {
            return new EvmCompiler(config);
        }
    },
    WASM("wasm", ".js") {
        @Override
        public CodeGenerator newGenerator(CodegenConfig config) {
            return new WasmCompiler(config);
        }
    };

    private final String id;
    private final String extension;

    CompileTarget(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public String getId() {
        return id;
    }

    /** 主产物的扩展名，包含点号 */
    public String getExtension() {
        return extension;
    }

    public abstract CodeGenerator newGenerator(CodegenConfig config);

    /**
     * 按命令行名字解析目标，不区分大小写。
     *
     * @throws IllegalArgumentException 名字未知时
     */
    public static CompileTarget fromName(String name) {
        if (name != null) {
            for (CompileTarget target : values()) {
                if (target.id.equalsIgnoreCase(name.trim())) {
                    return target;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported target: " + name);
    }

    @Override
    public String toString() {
        return id;
    }
}
