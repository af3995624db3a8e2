package com.cypherlang.cli;

import com.cypherlang.compiler.codegen.CodegenConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli analyze 子命令：输出源文件的结构报告
 */
@Command(name = "analyze", description = "Parse a source file and report its contracts, functions and circuits")
public class AnalyzeCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Source file to analyze")
    Path file;

    @Option(names = "--json", description = "Print the report as JSON")
    boolean json;

    @Override
    public Integer call() {
        CompileRunner runner = new CompileRunner(new CodegenConfig(),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.analyzeFile(file, json);
    }
}
