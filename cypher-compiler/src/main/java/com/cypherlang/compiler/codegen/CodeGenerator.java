package com.cypherlang.compiler.codegen;

import com.cypherlang.compiler.ast.decl.Program;

import java.util.Map;

/**
 * 后端接口。
 *
 * <p>实现在两次调用之间不保留状态：同一程序总是产生
 * 逐字节相同的产物。</p>
 */
public interface CodeGenerator {

    /**
     * 为程序生成产物。
     *
     * @param program  已解析的程序
     * @param baseName 主产物的基础名，不含扩展名
     * @return 文件名到内容的映射，主产物在前
     */
    Map<String, String> generate(Program program, String baseName);
}
