package com.cypherlang.compiler.compiler;

import com.cypherlang.compiler.ast.decl.Program;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.lexer.Lexer;
import com.cypherlang.compiler.lexer.Token;
import com.cypherlang.compiler.parser.Parser;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译器入口：源码文本到目标产物。
 *
 * <p>流水线依次为词法分析、语法分析和一个后端。任何阶段失败都以
 * {@link com.cypherlang.compiler.CompilationException} 向上传播，
 * 不产生任何产物。实例不保存单次编译的状态，可在
 * 线程之间共享。</p>
 */
public class CypherCompiler {
    private static final Logger LOG = Logger.getLogger(CypherCompiler.class.getName());

    private final CodegenConfig config;

    public CypherCompiler(CodegenConfig config) {
        this.config = config;
    }

    public CypherCompiler() {
        this(new CodegenConfig());
    }

    public CodegenConfig getConfig() {
        return config;
    }

    /**
     * 只做词法和语法分析。
     */
    public Program parse(String source, String fileName) {
        long start = System.nanoTime();
        List<Token> tokens = new Lexer(source, fileName).scanTokens();
        long lexed = System.nanoTime();
        Program program = new Parser(tokens, fileName).parse();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s: %d tokens lexed in %.2f ms, %d contract(s) parsed in %.2f ms",
                    fileName, tokens.size(), (lexed - start) / 1e6,
                    program.getContracts().size(), (System.nanoTime() - lexed) / 1e6));
        }
        return program;
    }

    /**
     * 为目标编译一个源文件。
     *
     * @param source   源码文本
     * @param fileName 文件名，用于错误位置和产物命名
     * @param target   要运行的后端
     */
    public CompilationResult compile(String source, String fileName, CompileTarget target) {
        Program program = parse(source, fileName);
        return generate(program, baseName(fileName), target);
    }

    /**
     * 在已解析的程序上运行后端
     */
    public CompilationResult generate(Program program, String baseName, CompileTarget target) {
        long start = System.nanoTime();
        Map<String, String> artifacts = target.newGenerator(config).generate(program, baseName);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s: generated %s in %.2f ms",
                    baseName, artifacts.keySet(), (System.nanoTime() - start) / 1e6));
        }
        return new CompilationResult(program, target, artifacts);
    }

    /**
     * 去掉目录和扩展名的文件名；什么都不剩时为 {@code "output"}。
     */
    static String baseName(String fileName) {
        if (fileName == null) {
            return "output";
        }
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name.isEmpty() || name.startsWith("<") ? "output" : name;
    }
}
