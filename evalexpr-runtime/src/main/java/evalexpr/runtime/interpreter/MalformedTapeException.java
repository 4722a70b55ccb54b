package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;

/**
 * 指令在当前栈状态下没有定义的效果（栈下溢、操作数种类不符、跳转越界等）。
 * 编译器产生的指令带不会触发它。
 */
public class MalformedTapeException extends ExprRuntimeException {

    private final int pc;

    public MalformedTapeException(String message, int pc, SourceLocation location) {
        super(message + " (pc=" + pc + ")", location);
        this.pc = pc;
    }

    public MalformedTapeException(String message, int pc) {
        super(message + " (pc=" + pc + ")");
        this.pc = pc;
    }

    /** 出错指令的下标 */
    public int getPc() {
        return pc;
    }
}
