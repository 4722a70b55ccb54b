package evalexpr.runtime;

import java.util.List;

/**
 * 可调用值（宿主提供的函数）
 *
 * <p>参数以有序列表传入，返回值本身也是 {@link ExprValue}。</p>
 */
public abstract non-sealed class ExprCallable extends ExprValue {

    protected ExprCallable() {
    }

    /**
     * 获取函数名称
     */
    public abstract String getName();

    /**
     * 调用函数
     *
     * @param ctx 执行上下文
     * @param args 参数列表
     * @return 返回值
     */
    public abstract ExprValue call(ExecutionContext ctx, List<ExprValue> args);

    @Override
    public String getTypeName() {
        return "Function";
    }

    @Override
    public boolean valueEquals(ExprValue other) {
        return this == other;
    }
}
