package evalexpr.runtime.interpreter;

import evalexpr.runtime.ExprDouble;
import evalexpr.runtime.ExprNull;
import evalexpr.runtime.ExprNumber;

import java.io.PrintStream;

/**
 * 内置常量与函数：{@code pi}、{@code e}、{@code sin}、{@code print}
 */
final class Builtins {

    private Builtins() {}

    static void register(Environment env) {
        // 数学常量
        env.define("pi", ExprDouble.of(Math.PI));
        env.define("e", ExprDouble.of(Math.E));

        // sin(x)
        env.define("sin", ExprNativeFunction.create("sin", (value) -> {
            if (!(value instanceof ExprNumber)) {
                throw new OperandException("sin() expects a number, got " + value.getTypeName());
            }
            return ExprDouble.of(Math.sin(((ExprNumber) value).asDouble()));
        }));

        // print(...) - 以空格分隔打印所有参数并换行
        env.define("print", ExprNativeFunction.createVararg("print", (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).toString());
            }
            PrintStream out = ctx.getStdout();
            out.println(sb.toString());
            return ExprNull.NULL;
        }));
    }
}
