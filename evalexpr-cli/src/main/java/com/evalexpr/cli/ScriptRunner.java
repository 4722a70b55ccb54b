package com.evalexpr.cli;

import com.evalexpr.compiler.CompileException;
import com.evalexpr.compiler.parser.ParseException;
import com.evalexpr.compiler.tape.Tape;
import evalexpr.runtime.ExprException;
import evalexpr.runtime.ExprValue;
import evalexpr.runtime.interpreter.ExprRuntimeException;
import evalexpr.runtime.interpreter.Interpreter;
import evalexpr.runtime.interpreter.InterpreterConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 脚本和表达式执行器
 *
 * <p>读取源码、调用解释器、把结果或故障写到控制台。所有方法返回进程退出码：
 * 成功为 0，任何故障为 1。</p>
 */
public class ScriptRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FAULT = 1;

    /** 递归下降编译器栈溢出时报告的故障 */
    static final String NESTING_FAULT = "Program nested too deeply";

    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    private final Interpreter interpreter;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(InterpreterConfig config, PrintStream out, PrintStream err) {
        this.interpreter = new Interpreter(config);
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件，打印最终值
     */
    public int runScript(String filePath) {
        String source = readSource(filePath);
        if (source == null) {
            return EXIT_FAULT;
        }
        return evaluate(source, filePath);
    }

    /**
     * 执行单个表达式
     */
    public int runExpression(String expression) {
        return evaluate(expression, "<cmdline>");
    }

    /**
     * 只编译，打印指令带
     */
    public int printTape(String filePath) {
        String source = readSource(filePath);
        if (source == null) {
            return EXIT_FAULT;
        }
        try {
            Tape tape = interpreter.compile(source, filePath);
            out.print(tape.disassemble());
            return EXIT_OK;
        } catch (CompileException e) {
            reportFault(e, source);
            return EXIT_FAULT;
        } catch (StackOverflowError e) {
            reportNestingFault(filePath);
            return EXIT_FAULT;
        }
    }

    private int evaluate(String source, String fileName) {
        try {
            ExprValue result = interpreter.eval(source, fileName);
            out.println(result);
            return EXIT_OK;
        } catch (CompileException | ExprRuntimeException e) {
            reportFault(e, source);
            return EXIT_FAULT;
        } catch (StackOverflowError e) {
            reportNestingFault(fileName);
            return EXIT_FAULT;
        }
    }

    private String readSource(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            err.println("Error: cannot read file - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot read file - " + filePath + " (" + e.getMessage() + ")");
            return null;
        }
    }

    private void reportNestingFault(String fileName) {
        LOG.fine(() -> "Stack overflow while running " + fileName);
        err.println(nestingFault(fileName));
    }

    static String nestingFault(String fileName) {
        return fileName + ": " + NESTING_FAULT;
    }

    private void reportFault(ExprException e, String source) {
        err.println(e.getMessage());
        if (e.hasLocation()) {
            int length = 1;
            if (e instanceof ParseException) {
                length = Math.max(1, ((ParseException) e).getToken().getLexeme().length());
            }
            printSourceLocation(err, source, e.getLine(), e.getColumn(), length);
        }
    }

    /**
     * 打印源码位置指示（源码行 + 下划线指针）
     */
    static void printSourceLocation(PrintStream err, String source, int line, int column, int length) {
        String[] lines = source.split("\n", -1);
        if (line >= 1 && line <= lines.length) {
            String lineText = lines[line - 1];
            String lineNum = String.valueOf(line);
            StringBuilder padding = new StringBuilder();
            for (int i = 0; i < lineNum.length(); i++) padding.append(' ');
            err.println(padding + " |");
            err.println(lineNum + " | " + lineText);
            StringBuilder pointer = new StringBuilder();
            pointer.append(padding).append(" | ");
            for (int i = 1; i < column; i++) pointer.append(' ');
            for (int i = 0; i < length; i++) pointer.append('^');
            err.println(pointer.toString());
        }
    }
}
