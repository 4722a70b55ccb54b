package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;
import com.evalexpr.compiler.tape.BinaryOp;
import com.evalexpr.compiler.tape.Instruction;
import com.evalexpr.compiler.tape.Tape;
import evalexpr.runtime.ExecutionContext;
import evalexpr.runtime.ExprCallable;
import evalexpr.runtime.ExprList;
import evalexpr.runtime.ExprValue;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 栈式虚拟机
 *
 * <p>直接解释执行指令带（while + switch 循环），对语法一无所知。
 * 程序计数器从 0 开始，每步执行一条指令并加一；跳转成立时直接置为目标下标。
 * 计数器到达带长即停机，栈上唯一剩下的值就是程序结果。</p>
 *
 * <p>操作数栈上既有值，也有 {@code PUSH_VAR_NAME} 压入的变量名（仅作为赋值目标）。
 * 每次 {@link #run} 使用独立的栈；环境由调用方拥有并传入。</p>
 */
public final class VirtualMachine implements ExecutionContext {

    private static final Logger LOG = Logger.getLogger(VirtualMachine.class.getName());

    private final PrintStream stdout;

    public VirtualMachine(PrintStream stdout) {
        this.stdout = stdout;
    }

    public VirtualMachine() {
        this(System.out);
    }

    @Override
    public PrintStream getStdout() {
        return stdout;
    }

    /**
     * 执行指令带
     *
     * @param tape 指令带
     * @param env 变量环境（执行期间会被赋值修改）
     * @return 程序的最终值
     * @throws UndefinedVariableException 读取未绑定变量
     * @throws OperandException 操作数种类不符
     * @throws MalformedTapeException 指令带不完整或不自洽
     */
    public ExprValue run(Tape tape, Environment env) {
        List<Object> stack = new ArrayList<Object>();
        int size = tape.size();
        int pc = 0;
        long steps = 0;

        while (pc < size) {
            Instruction inst = tape.get(pc);
            SourceLocation loc = inst.getLocation();
            int next = pc + 1;
            steps++;

            switch (inst.getOp()) {
                case PUSH_CONST:
                    stack.add(inst.getConstant());
                    break;

                case LOAD_VAR: {
                    ExprValue value = env.lookup(inst.getName());
                    if (value == null) {
                        throw new UndefinedVariableException(inst.getName(), loc);
                    }
                    stack.add(value);
                    break;
                }

                case PUSH_VAR_NAME:
                    stack.add(new VarName(inst.getName()));
                    break;

                case NEGATE:
                    stack.add(BinaryOps.negate(popValue(stack, pc, loc), loc));
                    break;

                case BINARY: {
                    ExprValue right = popValue(stack, pc, loc);
                    ExprValue left = popValue(stack, pc, loc);
                    stack.add(binary(inst.getBinaryOp(), left, right, pc, loc));
                    break;
                }

                case ASSIGN: {
                    ExprValue value = popValue(stack, pc, loc);
                    Object target = pop(stack, pc, loc);
                    if (!(target instanceof VarName)) {
                        throw new MalformedTapeException("Assignment target is not a variable name", pc, loc);
                    }
                    env.define(((VarName) target).name, value);
                    stack.add(value);
                    break;
                }

                case DISCARD:
                    pop(stack, pc, loc);
                    break;

                case MAKE_EMPTY_LIST:
                    stack.add(ExprList.empty());
                    break;

                case JUMP_IF_FALSE: {
                    ExprValue condition = popValue(stack, pc, loc);
                    if (!condition.isTruthy()) {
                        next = checkTarget(inst.getTarget(), size, pc, loc);
                    }
                    break;
                }

                case JUMP:
                    next = checkTarget(inst.getTarget(), size, pc, loc);
                    break;

                default:
                    throw new MalformedTapeException("Unknown instruction " + inst, pc, loc);
            }
            pc = next;
        }

        if (stack.size() != 1) {
            throw new MalformedTapeException("Tape finished with " + stack.size()
                    + " values on the stack, expected 1", pc);
        }
        Object result = stack.get(0);
        if (!(result instanceof ExprValue)) {
            throw new MalformedTapeException("Tape finished with a variable name on the stack", pc);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Executed " + tape + " in " + steps + " steps");
        }
        return (ExprValue) result;
    }

    private ExprValue binary(BinaryOp op, ExprValue left, ExprValue right, int pc, SourceLocation loc) {
        switch (op) {
            case LIST_APPEND:
                if (!(left instanceof ExprList)) {
                    throw new MalformedTapeException("append expects a list, got " + left.getTypeName(), pc, loc);
                }
                return ((ExprList) left).append(right);

            case CALL:
                return call(left, right, pc, loc);

            default:
                return BinaryOps.apply(op, left, right, loc);
        }
    }

    private ExprValue call(ExprValue callee, ExprValue arguments, int pc, SourceLocation loc) {
        if (!(callee instanceof ExprCallable)) {
            throw new OperandException(callee.getTypeName() + " value is not callable", loc);
        }
        if (!(arguments instanceof ExprList)) {
            throw new MalformedTapeException("call expects an argument list, got "
                    + arguments.getTypeName(), pc, loc);
        }
        ExprCallable function = (ExprCallable) callee;
        try {
            return function.call(this, ((ExprList) arguments).getElements());
        } catch (OperandException e) {
            // 宿主函数抛出时没有源码位置，补上调用点
            if (!e.hasLocation()) {
                throw new OperandException(e.getRawMessage(), loc);
            }
            throw e;
        }
    }

    private static int checkTarget(int target, int size, int pc, SourceLocation loc) {
        if (target < 0 || target > size) {
            throw new MalformedTapeException("Jump target " + target + " outside tape of size " + size, pc, loc);
        }
        return target;
    }

    private static Object pop(List<Object> stack, int pc, SourceLocation loc) {
        if (stack.isEmpty()) {
            throw new MalformedTapeException("Operand stack underflow", pc, loc);
        }
        return stack.remove(stack.size() - 1);
    }

    private static ExprValue popValue(List<Object> stack, int pc, SourceLocation loc) {
        Object top = pop(stack, pc, loc);
        if (!(top instanceof ExprValue)) {
            throw new MalformedTapeException("Expected a value on the stack, found " + top, pc, loc);
        }
        return (ExprValue) top;
    }

    /**
     * {@code PUSH_VAR_NAME} 压入栈的赋值目标，不属于值域
     */
    private static final class VarName {
        final String name;

        VarName(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return "name '" + name + "'";
        }
    }
}
