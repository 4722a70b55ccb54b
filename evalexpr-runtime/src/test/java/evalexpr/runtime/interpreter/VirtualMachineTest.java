package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;
import com.evalexpr.compiler.tape.BinaryOp;
import com.evalexpr.compiler.tape.Instruction;
import com.evalexpr.compiler.tape.Tape;
import evalexpr.runtime.ExprBoolean;
import evalexpr.runtime.ExprDouble;
import evalexpr.runtime.ExprInt;
import evalexpr.runtime.ExprList;
import evalexpr.runtime.ExprNull;
import evalexpr.runtime.ExprValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 虚拟机单元测试：直接执行手工构造的指令带
 */
class VirtualMachineTest {

    private static final SourceLocation LOC = new SourceLocation("<test>", 1, 1);

    private VirtualMachine vm;
    private Environment env;

    @BeforeEach
    void setUp() {
        vm = new VirtualMachine(new PrintStream(new ByteArrayOutputStream()));
        env = Environment.withBuiltins();
    }

    private ExprValue run(Instruction... instructions) {
        return vm.run(new Tape("<test>", Arrays.asList(instructions)), env);
    }

    private static Instruction push(long value) {
        return Instruction.pushConst(ExprInt.of(value), LOC);
    }

    private static Instruction push(ExprValue value) {
        return Instruction.pushConst(value, LOC);
    }

    private MalformedTapeException malformed(Instruction... instructions) {
        return assertThrows(MalformedTapeException.class, () -> run(instructions));
    }

    @Nested
    @DisplayName("正常执行")
    class ExecutionTests {

        @Test
        @DisplayName("单个常量")
        void testSingleConstant() {
            assertEquals(ExprInt.of(1), run(push(1)));
        }

        @Test
        @DisplayName("二元运算弹出右、左操作数")
        void testBinaryOperandOrder() {
            assertEquals(ExprInt.of(7), run(push(10), push(3), Instruction.binary(BinaryOp.SUB, LOC)));
        }

        @Test
        @DisplayName("赋值写入环境并留下值")
        void testAssign() {
            ExprValue result = run(Instruction.pushVarName("x", LOC), push(5), Instruction.assign(LOC));
            assertEquals(ExprInt.of(5), result);
            assertEquals(ExprInt.of(5), env.lookup("x"));
        }

        @Test
        @DisplayName("条件为假时跳转")
        void testJumpTaken() {
            ExprValue result = run(push(ExprBoolean.FALSE), Instruction.jumpIfFalse(3, LOC), push(1), push(2));
            assertEquals(ExprInt.of(2), result);
        }

        @Test
        @DisplayName("条件为真时顺序执行")
        void testJumpNotTaken() {
            ExprValue result = run(push(ExprBoolean.TRUE), Instruction.jumpIfFalse(4, LOC),
                    push(1), Instruction.jump(5, LOC), push(2));
            assertEquals(ExprInt.of(1), result);
        }

        @Test
        @DisplayName("NONE 为假，0 为真")
        void testTruthiness() {
            assertEquals(ExprInt.of(2), run(push(ExprNull.NULL), Instruction.jumpIfFalse(3, LOC), push(1), push(2)));
            assertThrows(MalformedTapeException.class,
                    () -> run(push(0), Instruction.jumpIfFalse(3, LOC), push(1), push(2)));
        }

        @Test
        @DisplayName("跳到带尾即停机")
        void testJumpToEnd() {
            assertEquals(ExprInt.of(1), run(push(1), Instruction.jump(3, LOC), push(2)));
        }

        @Test
        @DisplayName("构造实参列表并调用")
        void testCall() {
            ExprValue result = run(Instruction.loadVar("sin", LOC), Instruction.makeEmptyList(LOC),
                    push(0), Instruction.binary(BinaryOp.LIST_APPEND, LOC), Instruction.binary(BinaryOp.CALL, LOC));
            assertEquals(0.0, ((ExprDouble) result).getValue(), 1e-12);
        }

        @Test
        @DisplayName("列表追加不修改原列表")
        void testAppend() {
            ExprValue result = run(Instruction.makeEmptyList(LOC), push(1), Instruction.binary(BinaryOp.LIST_APPEND, LOC),
                    push(2), Instruction.binary(BinaryOp.LIST_APPEND, LOC));
            assertEquals(ExprList.of(ExprInt.of(1), ExprInt.of(2)), result);
            assertEquals(0, ExprList.empty().size());
        }
    }

    @Nested
    @DisplayName("运行期故障")
    class FaultTests {

        @Test
        @DisplayName("未定义变量带位置")
        void testUndefinedVariable() {
            UndefinedVariableException e = assertThrows(UndefinedVariableException.class,
                    () -> run(Instruction.loadVar("nope", new SourceLocation("f", 2, 4))));
            assertEquals("nope", e.getName());
            assertEquals("f:2:4:Undefined variable 'nope'", e.getMessage());
        }

        @Test
        @DisplayName("调用非函数值")
        void testNotCallable() {
            OperandException e = assertThrows(OperandException.class,
                    () -> run(push(3), Instruction.makeEmptyList(LOC), Instruction.binary(BinaryOp.CALL, LOC)));
            assertEquals("Int value is not callable", e.getRawMessage());
        }
    }

    @Nested
    @DisplayName("畸形指令带")
    class MalformedTests {

        @Test
        @DisplayName("空指令带")
        void testEmptyTape() {
            assertTrue(malformed().getRawMessage().startsWith("Tape finished with 0 values"));
        }

        @Test
        @DisplayName("栈下溢")
        void testUnderflow() {
            MalformedTapeException e = malformed(Instruction.discard(LOC));
            assertEquals(0, e.getPc());
            assertTrue(e.getRawMessage().startsWith("Operand stack underflow"));
        }

        @Test
        @DisplayName("结束时栈上多于一个值")
        void testLeftoverValues() {
            assertTrue(malformed(push(1), push(2)).getRawMessage().startsWith("Tape finished with 2 values"));
        }

        @Test
        @DisplayName("赋值目标不是变量名")
        void testAssignWithoutName() {
            MalformedTapeException e = malformed(push(1), push(2), Instruction.assign(LOC));
            assertEquals(2, e.getPc());
        }

        @Test
        @DisplayName("变量名不能作为操作数")
        void testNameAsOperand() {
            malformed(Instruction.pushVarName("x", LOC), push(1), Instruction.binary(BinaryOp.ADD, LOC));
        }

        @Test
        @DisplayName("结束时栈顶是变量名")
        void testNameAsResult() {
            malformed(Instruction.pushVarName("x", LOC));
        }

        @Test
        @DisplayName("跳转目标越界")
        void testJumpOutOfRange() {
            malformed(push(1), Instruction.jump(99, LOC));
            malformed(push(1), Instruction.jump(-1, LOC));
        }

        @Test
        @DisplayName("向非列表追加")
        void testAppendToNonList() {
            malformed(push(1), push(2), Instruction.binary(BinaryOp.LIST_APPEND, LOC));
        }

        @Test
        @DisplayName("调用实参不是列表")
        void testCallWithoutList() {
            malformed(Instruction.loadVar("sin", LOC), push(1), Instruction.binary(BinaryOp.CALL, LOC));
        }
    }
}
