package evalexpr.runtime;

import java.io.PrintStream;

/**
 * 执行上下文接口，{@link ExprCallable#call} 的参数类型
 *
 * <p>由虚拟机实现，向宿主函数暴露它们需要的运行环境，
 * 使 runtime-api 模块不依赖虚拟机本身。</p>
 */
public interface ExecutionContext {

    /**
     * 内置输出函数写入的流
     */
    PrintStream getStdout();
}
