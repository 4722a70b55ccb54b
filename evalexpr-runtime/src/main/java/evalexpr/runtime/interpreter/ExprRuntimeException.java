package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;
import evalexpr.runtime.ExprException;

/**
 * EvalExpr 运行时异常
 *
 * <p>位置取自出错指令所对应的源码 token。宿主函数内部抛出时可以不带位置，
 * 由虚拟机在调用点补上。</p>
 */
public class ExprRuntimeException extends ExprException {

    public ExprRuntimeException(String message) {
        super(message);
    }

    public ExprRuntimeException(String message, SourceLocation location) {
        super(message, location.getFile(), location.getLine(), location.getColumn());
    }
}
