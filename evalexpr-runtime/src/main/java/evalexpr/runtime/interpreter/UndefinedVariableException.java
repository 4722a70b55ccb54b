package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;

/**
 * 读取了环境中没有绑定的变量
 */
public class UndefinedVariableException extends ExprRuntimeException {

    private final String name;

    public UndefinedVariableException(String name, SourceLocation location) {
        super("Undefined variable '" + name + "'", location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
