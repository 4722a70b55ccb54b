package evalexpr.runtime.interpreter;

import java.io.PrintStream;
import java.util.Objects;

/**
 * 解释器配置
 *
 * <p>使用示例：</p>
 * <pre>
 * InterpreterConfig config = InterpreterConfig.builder()
 *     .compileCacheSize(64)
 *     .stdout(capture)
 *     .build();
 * Interpreter interp = new Interpreter(config);
 * </pre>
 */
public final class InterpreterConfig {

    /** 默认编译缓存容量 */
    public static final int DEFAULT_COMPILE_CACHE_SIZE = 256;

    private final int compileCacheSize;   // 0=不缓存
    private final PrintStream stdout;

    private InterpreterConfig(Builder builder) {
        this.compileCacheSize = builder.compileCacheSize;
        this.stdout = builder.stdout;
    }

    public static InterpreterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getCompileCacheSize() {
        return compileCacheSize;
    }

    public PrintStream getStdout() {
        return stdout;
    }

    public boolean isCacheEnabled() {
        return compileCacheSize > 0;
    }

    @Override
    public String toString() {
        return "InterpreterConfig{compileCacheSize=" + compileCacheSize + "}";
    }

    public static final class Builder {
        private int compileCacheSize = DEFAULT_COMPILE_CACHE_SIZE;
        private PrintStream stdout = System.out;

        private Builder() {}

        public Builder compileCacheSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("compileCacheSize must not be negative: " + size);
            }
            this.compileCacheSize = size;
            return this;
        }

        public Builder stdout(PrintStream stdout) {
            this.stdout = Objects.requireNonNull(stdout, "stdout");
            return this;
        }

        public InterpreterConfig build() {
            return new InterpreterConfig(this);
        }
    }
}
