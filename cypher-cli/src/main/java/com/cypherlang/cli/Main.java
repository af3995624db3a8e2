package com.cypherlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * CypherLang 命令行入口（picocli）
 */
@Command(name = "cypher", version = "CypherLang v0.1.0",
         mixinStandardHelpOptions = true,
         description = "CypherLang - secure compute language for cryptography and smart contracts",
         subcommands = {CompileCommand.class, AnalyzeCommand.class})
public class Main implements Runnable {

    static final String LOGGER_ROOT = "com.cypherlang";

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log compiler stages to stderr")
    void setVerbose(boolean verbose) {
        Logger.getLogger(LOGGER_ROOT).setLevel(verbose ? Level.FINE : Level.INFO);
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand (compile, analyze)");
    }

    /**
     * 日志记录输出到 stderr 并逐条刷新，stdout 只承载命令输出
     */
    static void configureLogging() {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.ALL);
        rootLogger.addHandler(stderrHandler);
        Logger.getLogger(LOGGER_ROOT).setLevel(Level.INFO);
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
