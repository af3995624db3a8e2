package com.cypherlang.compiler.codegen.wasm;

import com.cypherlang.compiler.codegen.CodegenResources;

/**
 * WASM 目标输出中的固定部分，作为 classpath 资源打包
 */
final class WasmRuntime {

    private WasmRuntime() {}

    private static final class Holder {
        static final String MODULE = CodegenResources.load(WasmRuntime.class, "module.wat");
        static final String RUNTIME = CodegenResources.load(WasmRuntime.class, "runtime.js");
        static final String MPC = CodegenResources.load(WasmRuntime.class, "mpc.js");
    }

    /** 含 field、hash、signature 原语的 WebAssembly 文本模块 */
    static String moduleText() {
        return Holder.MODULE;
    }

    /** CryptoLibrary 与 CypherContract 基类 */
    static String runtimeText() {
        return Holder.RUNTIME;
    }

    /** MPCProtocol 运行框架 */
    static String mpcText() {
        return Holder.MPC;
    }
}
