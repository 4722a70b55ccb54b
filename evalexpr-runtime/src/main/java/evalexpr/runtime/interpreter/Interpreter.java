package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.CompileException;
import com.evalexpr.compiler.TapeCompiler;
import com.evalexpr.compiler.tape.Tape;
import evalexpr.runtime.ExprValue;
import evalexpr.runtime.interpreter.cache.CacheStats;
import evalexpr.runtime.interpreter.cache.CompileCache;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * EvalExpr 解释器入口：编译并运行完整程序
 *
 * <p>编译出错时不执行任何指令；运行出错时不返回部分结果。
 * 两种故障都以异常形式交给调用方，进程退出策略由调用方决定。</p>
 */
public class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final CompileCache compileCache;
    private final VirtualMachine vm;

    public Interpreter() {
        this(InterpreterConfig.defaults());
    }

    public Interpreter(InterpreterConfig config) {
        this.compileCache = config.isCacheEnabled() ? new CompileCache(config.getCompileCacheSize()) : null;
        this.vm = new VirtualMachine(config.getStdout());
    }

    /**
     * 新建已注册内置绑定的环境
     */
    public Environment newEnvironment() {
        return Environment.withBuiltins();
    }

    /**
     * 编译源码（命中缓存时直接返回已有指令带）
     *
     * @throws CompileException 词法或语法错误
     */
    public Tape compile(String source, String fileName) {
        if (compileCache == null) {
            return doCompile(source, fileName);
        }
        return compileCache.get(fileName, source, src -> doCompile(src, fileName));
    }

    private Tape doCompile(String source, String fileName) {
        try {
            Tape tape = TapeCompiler.compile(source, fileName);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Compiled " + fileName + ": " + tape.size() + " instructions");
            }
            return tape;
        } catch (CompileException e) {
            LOG.log(Level.FINE, "Compilation failed: " + e.getMessage());
            throw e;
        }
    }

    /**
     * 在全新环境中编译并运行程序
     *
     * @param source 源码文本
     * @param fileName 显示用文件名
     * @return 程序的最终值
     * @throws CompileException 编译失败（程序不会执行）
     * @throws ExprRuntimeException 运行失败
     */
    public ExprValue eval(String source, String fileName) {
        return eval(source, fileName, newEnvironment());
    }

    /**
     * 在给定环境中编译并运行程序（REPL 会话复用同一环境）
     */
    public ExprValue eval(String source, String fileName, Environment env) {
        Tape tape = compile(source, fileName);
        return run(tape, env);
    }

    /**
     * 运行已编译的指令带
     */
    public ExprValue run(Tape tape, Environment env) {
        return vm.run(tape, env);
    }

    /**
     * 编译缓存统计，未启用缓存时返回 null
     */
    public CacheStats getCacheStats() {
        return compileCache != null ? compileCache.getStats() : null;
    }
}
