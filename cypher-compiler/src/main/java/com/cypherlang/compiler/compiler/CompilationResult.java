package com.cypherlang.compiler.compiler;

import com.cypherlang.compiler.ast.decl.Program;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编译成功的输出：已解析的程序加上生成的文件
 */
public class CompilationResult {
    private final Program program;
    private final CompileTarget target;
    private final Map<String, String> artifacts;

    public CompilationResult(Program program, CompileTarget target, Map<String, String> artifacts) {
        if (artifacts.isEmpty()) {
            throw new IllegalArgumentException("A compilation produces at least one artifact");
        }
        this.program = program;
        this.target = target;
        this.artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public Program getProgram() {
        return program;
    }

    public CompileTarget getTarget() {
        return target;
    }

    /** 文件名到内容的映射，主产物在前 */
    public Map<String, String> getArtifacts() {
        return artifacts;
    }

    public String getMainFileName() {
        return artifacts.keySet().iterator().next();
    }

    public String getMainOutput() {
        return artifacts.get(getMainFileName());
    }
}
