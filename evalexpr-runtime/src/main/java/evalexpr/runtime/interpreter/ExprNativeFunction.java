package evalexpr.runtime.interpreter;

import evalexpr.runtime.ExecutionContext;
import evalexpr.runtime.ExprCallable;
import evalexpr.runtime.ExprValue;

import java.util.List;

/**
 * 原生（Java）函数
 */
public final class ExprNativeFunction extends ExprCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        ExprValue apply(ExecutionContext ctx, List<ExprValue> args);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    /**
     * @param arity 固定参数个数，-1 表示可变参数
     */
    public ExprNativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "<native fun " + name + ">";
    }

    /**
     * @throws OperandException 固定参数个数不符
     */
    @Override
    public ExprValue call(ExecutionContext ctx, List<ExprValue> args) {
        if (arity >= 0 && args.size() != arity) {
            throw new OperandException(getName() + "() takes " + arity + " argument(s) but "
                    + args.size() + " were given");
        }
        return function.apply(ctx, args);
    }

    // ============ 便捷工厂方法 ============

    public static ExprNativeFunction create(String name, NativeFunc1 func) {
        return new ExprNativeFunction(name, 1, (ctx, args) -> func.apply(args.get(0)));
    }

    public static ExprNativeFunction createVararg(String name, NativeFunc func) {
        return new ExprNativeFunction(name, -1, func);
    }

    @FunctionalInterface
    public interface NativeFunc1 {
        ExprValue apply(ExprValue arg1);
    }
}
