package com.cypherlang.compiler.codegen.evm;

import com.cypherlang.compiler.codegen.CodegenResources;

/**
 * 每个生成的合约都导入的共享支持库 {@code CypherLib.sol}
 */
public final class CypherLibrary {

    public static final String FILE_NAME = "CypherLib.sol";

    private static volatile String source;

    private CypherLibrary() {}

    /** 库源码文本，每次编译都相同 */
    public static String source() {
        String s = source;
        if (s == null) {
            synchronized (CypherLibrary.class) {
                s = source;
                if (s == null) {
                    s = CodegenResources.load(CypherLibrary.class, FILE_NAME);
                    source = s;
                }
            }
        }
        return s;
    }
}
