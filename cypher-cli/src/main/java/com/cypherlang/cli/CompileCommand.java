package com.cypherlang.cli;

import com.cypherlang.compiler.codegen.CodegenConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：把源文件编译到一个目标
 */
@Command(name = "compile", description = "Compile CypherLang source to a target platform")
public class CompileCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Source file to compile")
    Path file;

    @Option(names = {"-t", "--target"}, defaultValue = "evm", description = "Compilation target: evm, wasm (default: evm)")
    String target;

    @Option(names = {"-o", "--output"}, defaultValue = "build", description = "Output directory (default: build)")
    Path outputDir;

    @Option(names = "--strict-types", description = "Fail on types the target cannot map instead of falling back")
    boolean strictTypes;

    @Option(names = "--indent-size", defaultValue = "4", description = "Indentation width of Solidity output (default: 4)")
    int indentSize;

    @Override
    public Integer call() {
        CodegenConfig config = new CodegenConfig();
        config.setStrictTypes(strictTypes);
        try {
            config.setIndentSize(indentSize);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
        CompileRunner runner = new CompileRunner(config,
                spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.compileFile(file, target, outputDir);
    }
}
