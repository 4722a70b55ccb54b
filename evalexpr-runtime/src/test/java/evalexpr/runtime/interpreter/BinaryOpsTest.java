package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;
import com.evalexpr.compiler.tape.BinaryOp;
import evalexpr.runtime.ExprBigInt;
import evalexpr.runtime.ExprBoolean;
import evalexpr.runtime.ExprDouble;
import evalexpr.runtime.ExprInt;
import evalexpr.runtime.ExprList;
import evalexpr.runtime.ExprNull;
import evalexpr.runtime.ExprValue;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryOpsTest {

    private static final SourceLocation LOC = new SourceLocation("<test>", 1, 3);

    private static ExprValue apply(BinaryOp op, ExprValue left, ExprValue right) {
        return BinaryOps.apply(op, left, right, LOC);
    }

    @Test
    void intArithmeticStaysInt() {
        assertThat(apply(BinaryOp.ADD, ExprInt.of(2), ExprInt.of(3))).isEqualTo(ExprInt.of(5));
        assertThat(apply(BinaryOp.MUL, ExprInt.of(-4), ExprInt.of(3))).isEqualTo(ExprInt.of(-12));
    }

    @Test
    void mixedArithmeticIsDouble() {
        assertThat(apply(BinaryOp.ADD, ExprInt.of(1), ExprDouble.of(0.5))).isEqualTo(ExprDouble.of(1.5));
        assertThat(apply(BinaryOp.SUB, ExprDouble.of(2.0), ExprInt.of(2))).isEqualTo(ExprDouble.of(0.0));
    }

    @Test
    void overflowSwitchesToArbitraryPrecision() {
        ExprValue sum = apply(BinaryOp.ADD, ExprInt.of(Long.MAX_VALUE), ExprInt.of(1));
        assertThat(sum).isEqualTo(ExprBigInt.of(new BigInteger("9223372036854775808")));
        assertThat(sum.toString()).isEqualTo("9223372036854775808");

        ExprValue product = apply(BinaryOp.MUL, ExprInt.of(Long.MAX_VALUE), ExprInt.of(2));
        assertThat(product.toString()).isEqualTo("18446744073709551614");
    }

    @Test
    void bigResultsFallBackToInt() {
        ExprValue big = apply(BinaryOp.ADD, ExprInt.of(Long.MAX_VALUE), ExprInt.of(1));
        assertThat(apply(BinaryOp.SUB, big, ExprInt.of(1))).isEqualTo(ExprInt.of(Long.MAX_VALUE));
    }

    @Test
    void bigIntMixedWithDouble() {
        ExprValue big = ExprBigInt.of(BigInteger.TEN.pow(20));
        assertThat(apply(BinaryOp.ADD, big, ExprDouble.of(0.5))).isEqualTo(ExprDouble.of(1.0E20));
        assertThat(apply(BinaryOp.DIV, big, ExprInt.of(4))).isEqualTo(ExprDouble.of(2.5E19));
    }

    @Test
    void mixedComparisonIsExact() {
        ExprInt odd = ExprInt.of(9007199254740993L);
        ExprDouble even = ExprDouble.of(9007199254740992.0);
        assertThat(apply(BinaryOp.EQ, odd, even)).isSameAs(ExprBoolean.FALSE);
        assertThat(apply(BinaryOp.GT, odd, even)).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.LT, even, odd)).isSameAs(ExprBoolean.TRUE);
    }

    @Test
    void infinityOrdersAgainstBigInt() {
        ExprValue big = ExprBigInt.of(BigInteger.TEN.pow(400));
        assertThat(apply(BinaryOp.LT, big, ExprDouble.of(Double.POSITIVE_INFINITY))).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.GT, big, ExprDouble.of(Double.NEGATIVE_INFINITY))).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.EQ, big, ExprDouble.of(Double.POSITIVE_INFINITY))).isSameAs(ExprBoolean.FALSE);
    }

    @Test
    void divisionIsAlwaysDouble() {
        assertThat(apply(BinaryOp.DIV, ExprInt.of(7), ExprInt.of(2))).isEqualTo(ExprDouble.of(3.5));
        assertThat(apply(BinaryOp.DIV, ExprInt.of(4), ExprInt.of(2))).isEqualTo(ExprDouble.of(2.0));
    }

    @Test
    void divisionByZero() {
        assertThatThrownBy(() -> apply(BinaryOp.DIV, ExprInt.of(1), ExprInt.of(0)))
                .isInstanceOf(OperandException.class)
                .hasMessage("<test>:1:3:Division by zero");
        assertThatThrownBy(() -> apply(BinaryOp.DIV, ExprDouble.of(1.0), ExprDouble.of(-0.0)))
                .isInstanceOf(OperandException.class);
    }

    @Test
    void relationalOperators() {
        assertThat(apply(BinaryOp.LT, ExprInt.of(1), ExprInt.of(2))).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.GE, ExprInt.of(1), ExprInt.of(2))).isSameAs(ExprBoolean.FALSE);
        assertThat(apply(BinaryOp.LE, ExprDouble.of(2.0), ExprInt.of(2))).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.GT, ExprDouble.of(Math.PI), ExprInt.of(3))).isSameAs(ExprBoolean.TRUE);
    }

    @Test
    void nanIsUnordered() {
        ExprDouble nan = ExprDouble.of(Double.NaN);
        assertThat(apply(BinaryOp.LT, nan, ExprInt.of(1))).isSameAs(ExprBoolean.FALSE);
        assertThat(apply(BinaryOp.GE, nan, ExprInt.of(1))).isSameAs(ExprBoolean.FALSE);
    }

    @Test
    void equalityAcrossKinds() {
        assertThat(apply(BinaryOp.EQ, ExprInt.of(1), ExprDouble.of(1.0))).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.EQ, ExprNull.NULL, ExprNull.NULL)).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.EQ, ExprInt.of(1), ExprBoolean.TRUE)).isSameAs(ExprBoolean.FALSE);
        assertThat(apply(BinaryOp.NE, ExprBoolean.TRUE, ExprBoolean.FALSE)).isSameAs(ExprBoolean.TRUE);
        assertThat(apply(BinaryOp.EQ, ExprList.of(ExprInt.of(1)), ExprList.of(ExprInt.of(1))))
                .isSameAs(ExprBoolean.TRUE);
    }

    @Test
    void unsupportedOperands() {
        assertThatThrownBy(() -> apply(BinaryOp.ADD, ExprInt.of(1), ExprBoolean.TRUE))
                .isInstanceOf(OperandException.class)
                .hasMessageContaining("Unsupported operand types for +: Int and Boolean");
        assertThatThrownBy(() -> apply(BinaryOp.LT, ExprNull.NULL, ExprInt.of(1)))
                .isInstanceOf(OperandException.class)
                .hasMessageContaining("for <: Null and Int");
    }

    @Test
    void negate() {
        assertThat(BinaryOps.negate(ExprInt.of(5), LOC)).isEqualTo(ExprInt.of(-5));
        assertThat(BinaryOps.negate(ExprDouble.of(2.5), LOC)).isEqualTo(ExprDouble.of(-2.5));
        assertThat(BinaryOps.negate(ExprInt.of(Long.MIN_VALUE), LOC).toString()).isEqualTo("9223372036854775808");
        assertThat(BinaryOps.negate(ExprBigInt.of(BigInteger.valueOf(Long.MIN_VALUE).negate()), LOC))
                .isEqualTo(ExprInt.of(Long.MIN_VALUE));
        assertThatThrownBy(() -> BinaryOps.negate(ExprNull.NULL, LOC))
                .isInstanceOf(OperandException.class)
                .hasMessageContaining("Bad operand type for unary -: Null");
    }

    @Test
    void listOperatorsAreNotHandledHere() {
        assertThatThrownBy(() -> apply(BinaryOp.CALL, ExprInt.of(1), ExprList.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
