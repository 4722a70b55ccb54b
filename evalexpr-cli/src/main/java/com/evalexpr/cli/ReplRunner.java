package com.evalexpr.cli;

import com.evalexpr.compiler.CompileException;
import com.evalexpr.compiler.lexer.Lexer;
import com.evalexpr.compiler.lexer.LexerException;
import com.evalexpr.compiler.lexer.Token;
import com.evalexpr.compiler.lexer.TokenType;
import evalexpr.runtime.ExprValue;
import evalexpr.runtime.interpreter.Environment;
import evalexpr.runtime.interpreter.ExprRuntimeException;
import evalexpr.runtime.interpreter.Interpreter;
import evalexpr.runtime.interpreter.InterpreterConfig;
import evalexpr.runtime.interpreter.cache.CacheStats;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * jline REPL 交互模式
 *
 * <p>整个会话共享一个环境，每次输入单独编译后在该环境中运行。
 * 故障只打印，不结束会话。</p>
 */
public class ReplRunner {

    static final String REPL_FILE = "<repl>";

    private final Interpreter interpreter;
    private final PrintStream out;
    private final PrintStream err;
    private Environment env;

    private final StringBuilder multilineBuffer = new StringBuilder();

    public ReplRunner(InterpreterConfig config, PrintStream out, PrintStream err) {
        this.interpreter = new Interpreter(config);
        this.out = out;
        this.err = err;
        this.env = interpreter.newEnvironment();
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("EvalExpr v0.1.0");
        out.println("Type :help for help, :quit to exit");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            err.println("Terminal initialization failed: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(prompt());
                if (line == null || !handleLine(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                multilineBuffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        while (true) {
            try {
                out.print(prompt());
                out.flush();

                String line = reader.readLine();
                if (line == null || !handleLine(line)) break;
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                break;
            }
        }
    }

    private String prompt() {
        return multilineBuffer.length() > 0 ? "... " : "expr> ";
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean handleLine(String line) {
        boolean inMultiline = multilineBuffer.length() > 0;

        // REPL 命令
        if (!inMultiline && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            multilineBuffer.append(line, 0, line.length() - 1).append("\n");
            return true;
        }

        String source = multilineBuffer.toString() + line;

        // 未闭合的括号或 if/while 自动续行
        if (isIncomplete(source)) {
            multilineBuffer.append(line).append("\n");
            return true;
        }
        multilineBuffer.setLength(0);

        if (source.trim().isEmpty()) return true;

        evaluateAndPrint(source);
        return true;
    }

    /**
     * 括号或 if/while ... end 是否尚未闭合。词法错误按完整输入处理，交给编译器报告。
     */
    static boolean isIncomplete(String source) {
        int depth = 0;
        try {
            Lexer lexer = new Lexer(source, REPL_FILE);
            for (Token token = lexer.getToken(); !token.is(TokenType.EOF); token = lexer.next()) {
                if (token.isOneOf(TokenType.LPAREN, TokenType.KW_IF, TokenType.KW_WHILE)) {
                    depth++;
                } else if (token.isOneOf(TokenType.RPAREN, TokenType.KW_END)) {
                    depth--;
                }
            }
        } catch (LexerException e) {
            return false;
        }
        return depth > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":reset".equals(command)) {
            env = interpreter.newEnvironment();
            out.println("Environment reset");
            return true;
        }

        if (":env".equals(command)) {
            for (Map.Entry<String, ExprValue> entry : env.getUserBindings().entrySet()) {
                out.println(entry.getKey() + " = " + entry.getValue());
            }
            return true;
        }

        if (":stats".equals(command)) {
            CacheStats stats = interpreter.getCacheStats();
            out.println(stats != null ? stats.toString() : "Compile cache disabled");
            return true;
        }

        if (command.startsWith(":tape ")) {
            String source = command.substring(":tape ".length());
            try {
                out.print(interpreter.compile(source, REPL_FILE).disassemble());
            } catch (CompileException e) {
                err.println(e.getMessage());
            } catch (StackOverflowError e) {
                err.println(ScriptRunner.nestingFault(REPL_FILE));
            }
            return true;
        }

        out.println("Unknown command: " + command);
        out.println("Type :help for help");
        return true;
    }

    /**
     * 求值并打印结果
     */
    private void evaluateAndPrint(String source) {
        try {
            ExprValue result = interpreter.eval(source, REPL_FILE, env);
            out.println(result);
        } catch (CompileException | ExprRuntimeException e) {
            err.println(e.getMessage());
        } catch (StackOverflowError e) {
            err.println(ScriptRunner.nestingFault(REPL_FILE));
        }
    }

    Environment getEnvironment() {
        return env;
    }

    private void printReplHelp() {
        out.println("REPL commands:");
        out.println("  :help, :h         show this help");
        out.println("  :quit, :q, :exit  leave the REPL");
        out.println("  :reset            reset the environment");
        out.println("  :env              list user variables");
        out.println("  :stats            show compile cache statistics");
        out.println("  :tape <expr>      show the compiled tape of <expr>");
        out.println();
        out.println("Examples:");
        out.println("  x = 5; x + 1");
        out.println("  if x > 3 then print(x) else 0 end");
        out.println("  i = 0; while i < 3 do i = i + 1 end; i");
        out.println();
        out.println("A line ending in \\ or with an open '(', 'if' or 'while' continues on the next line.");
    }
}
