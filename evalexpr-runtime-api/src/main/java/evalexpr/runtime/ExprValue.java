package evalexpr.runtime;

/**
 * EvalExpr 运行时值的基类
 *
 * <p>值域是封闭的：数字（整数 / 浮点）、布尔、空值、列表和可调用对象。
 * 只有 {@link ExprCallable} 允许在其它模块中扩展（宿主提供的原生函数）。</p>
 */
public abstract sealed class ExprValue
        permits ExprNumber, ExprBoolean, ExprNull, ExprList, ExprCallable {

    ExprValue() {
    }

    /**
     * 获取值的类型名称（用于错误消息）
     */
    public abstract String getTypeName();

    /**
     * 条件判断用的真值：只有 {@code FALSE} 和 {@code NONE} 为假
     */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isNull() {
        return false;
    }

    /**
     * 语言层面的 {@code ==}：跨类型可比较，整数与浮点按数值比较。
     *
     * <p>与 {@link Object#equals(Object)} 不同，后者是结构相等（区分 1 与 1.0），
     * 供指令带比较等场景使用。</p>
     */
    public abstract boolean valueEquals(ExprValue other);

    /**
     * 人类可读的表示（print 内置函数和 REPL 使用）
     */
    @Override
    public abstract String toString();
}
