package com.evalexpr.cli;

import evalexpr.runtime.interpreter.InterpreterConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli tape 子命令：只编译，打印反汇编后的指令带
 */
@Command(name = "tape", description = "编译源码文件并打印指令带")
public class TapeCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "源码文件路径")
    String file;

    @Override
    public Integer call() {
        InterpreterConfig config = InterpreterConfig.builder().compileCacheSize(0).build();
        return new ScriptRunner(config, System.out, System.err).printTape(file);
    }
}
