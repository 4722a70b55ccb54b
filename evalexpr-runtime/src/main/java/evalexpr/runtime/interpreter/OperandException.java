package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;

/**
 * 操作数种类不符：对非数字做算术、调用非函数值、参数个数不符、除以零
 */
public class OperandException extends ExprRuntimeException {

    public OperandException(String message) {
        super(message);
    }

    public OperandException(String message, SourceLocation location) {
        super(message, location);
    }
}
