package com.evalexpr.cli;

import evalexpr.runtime.interpreter.InterpreterConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * EvalExpr CLI 入口点（picocli）
 */
@Command(name = "evalexpr", version = "EvalExpr v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {TapeCommand.class},
         description = "Compile and run an EvalExpr program; without arguments start the REPL.")
public class Main implements Callable<Integer> {

    @Option(names = "-e", paramLabel = "EXPR", description = "执行命令行给出的表达式")
    String expression;

    @Option(names = "--cache-size", defaultValue = "256", paramLabel = "N",
            description = "编译缓存容量，0 表示不缓存（默认 256）")
    int cacheSize;

    @Option(names = {"-v", "--verbose"}, description = "输出编译与执行日志到 stderr")
    boolean verbose;

    @Parameters(arity = "0..1", paramLabel = "FILE", description = "源码文件")
    String file;

    @Override
    public Integer call() {
        LoggingSetup.configure(verbose);
        InterpreterConfig config = InterpreterConfig.builder()
                .compileCacheSize(cacheSize)
                .stdout(System.out)
                .build();

        if (expression != null) {
            return new ScriptRunner(config, System.out, System.err).runExpression(expression);
        }
        if (file != null) {
            return new ScriptRunner(config, System.out, System.err).runScript(file);
        }
        new ReplRunner(config, System.out, System.err).run();
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
