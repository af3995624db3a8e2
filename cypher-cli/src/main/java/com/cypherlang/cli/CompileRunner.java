package com.cypherlang.cli;

import com.cypherlang.compiler.CompilationException;
import com.cypherlang.compiler.ast.decl.Program;
import com.cypherlang.compiler.codegen.CodegenConfig;
import com.cypherlang.compiler.compiler.CompilationResult;
import com.cypherlang.compiler.compiler.CompileTarget;
import com.cypherlang.compiler.compiler.CypherCompiler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * compile 和 analyze 命令的执行器。
 *
 * <p>每个方法都返回进程退出码：成功为 0，失败为 1。
 * 写出第一个文件之前编译已在内存中全部完成，
 * 编译失败时输出目录保持原样。</p>
 */
public class CompileRunner {
    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private static final String COMPILE = "Compilation";
    private static final String ANALYZE = "Analysis";

    private final CypherCompiler compiler;
    private final PrintWriter out;
    private final PrintWriter err;

    public CompileRunner(CodegenConfig config, PrintWriter out, PrintWriter err) {
        this.compiler = new CypherCompiler(config);
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件并把产物写入 {@code outputDir}
     */
    public int compileFile(Path file, String targetName, Path outputDir) {
        CompileTarget target;
        try {
            target = CompileTarget.fromName(targetName);
        } catch (IllegalArgumentException e) {
            return fail(COMPILE, e.getMessage());
        }

        String source = readSource(file, COMPILE);
        if (source == null) {
            return 1;
        }

        out.println("Compiling " + file + " to " + target + "...");
        CompilationResult result;
        try {
            result = compiler.compile(source, file.toString(), target);
        } catch (CompilationException e) {
            LOG.log(Level.FINE, "Compilation of " + file + " failed", e);
            return fail(COMPILE, e.getMessage());
        }

        try {
            writeArtifacts(result, outputDir);
        } catch (IOException e) {
            return fail(COMPILE, "cannot write output - " + e.getMessage());
        }

        out.println("Compiled successfully: " + outputDir.resolve(result.getMainFileName()));
        out.flush();
        return 0;
    }

    /**
     * 解析文件并打印结构报告
     */
    public int analyzeFile(Path file, boolean json) {
        String source = readSource(file, ANALYZE);
        if (source == null) {
            return 1;
        }

        Program program;
        try {
            program = compiler.parse(source, file.toString());
        } catch (CompilationException e) {
            return fail(ANALYZE, e.getMessage());
        }

        ProgramReport report = ProgramReport.of(file.toString(), program);
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(report));
        } else {
            report.print(out);
        }
        out.flush();
        return 0;
    }

    /**
     * 先把所有产物写入输出目录下的临时文件，再逐个移动到位。
     * 任一步失败时删除临时文件和本次已移动的产物，不留下不完整的输出。
     */
    private void writeArtifacts(CompilationResult result, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Map<Path, Path> staged = new LinkedHashMap<>();
        List<Path> moved = new ArrayList<>();
        try {
            for (Map.Entry<String, String> artifact : result.getArtifacts().entrySet()) {
                Path temp = Files.createTempFile(outputDir, "." + artifact.getKey() + ".", ".tmp");
                staged.put(temp, outputDir.resolve(artifact.getKey()));
                Files.write(temp, artifact.getValue().getBytes(StandardCharsets.UTF_8));
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Files.move(entry.getKey(), entry.getValue(), StandardCopyOption.REPLACE_EXISTING);
                moved.add(entry.getValue());
                LOG.fine("Wrote " + entry.getValue());
            }
        } catch (IOException e) {
            deleteAll(staged.keySet());
            deleteAll(moved);
            throw e;
        }

        for (Path path : moved) {
            if (!path.getFileName().toString().equals(result.getMainFileName())) {
                out.println("Generated library: " + path);
            }
        }
    }

    private static void deleteAll(Iterable<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Could not remove partial output " + path, e);
            }
        }
    }

    private String readSource(Path file, String action) {
        if (!Files.isRegularFile(file)) {
            fail(action, "file not found - " + file);
            return null;
        }
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            fail(action, "cannot read " + file + " - " + e.getMessage());
            return null;
        }
    }

    private int fail(String action, String message) {
        err.println(action + " failed: " + message);
        err.flush();
        out.flush();
        return 1;
    }
}
