package evalexpr.runtime.interpreter;

import com.evalexpr.compiler.SourceLocation;
import com.evalexpr.compiler.tape.BinaryOp;
import evalexpr.runtime.ExprBigInt;
import evalexpr.runtime.ExprBoolean;
import evalexpr.runtime.ExprDouble;
import evalexpr.runtime.ExprInt;
import evalexpr.runtime.ExprNumber;
import evalexpr.runtime.ExprValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.function.BinaryOperator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * 算术、关系与取负运算的统一实现。
 *
 * <p>整数与整数保持整数，溢出 64 位时改用任意精度；任一操作数为浮点则结果为浮点。
 * 整数与浮点的比较按精确数值进行。
 * 除法总是浮点除法。列表追加与调用由 {@link VirtualMachine} 处理。</p>
 */
public final class BinaryOps {

    private static final long MAX_EXACT_DOUBLE = 1L << 53;

    private BinaryOps() {}

    /**
     * 执行算术或关系运算
     *
     * @throws OperandException 操作数种类不支持该运算，或除以零
     */
    public static ExprValue apply(BinaryOp op, ExprValue left, ExprValue right, SourceLocation loc) {
        switch (op) {
            case ADD:
                return arithmetic(op, left, right, Math::addExact, BigInteger::add, (a, b) -> a + b, loc);
            case SUB:
                return arithmetic(op, left, right, Math::subtractExact, BigInteger::subtract, (a, b) -> a - b, loc);
            case MUL:
                return arithmetic(op, left, right, Math::multiplyExact, BigInteger::multiply, (a, b) -> a * b, loc);
            case DIV:
                return divide(left, right, loc);
            case LT:
            case LE:
            case GT:
            case GE:
                return ExprBoolean.of(order(op, left, right, loc));
            case EQ:
                return ExprBoolean.of(left.valueEquals(right));
            case NE:
                return ExprBoolean.of(!left.valueEquals(right));
            default:
                throw new IllegalArgumentException("Not an arithmetic or relational operator: " + op);
        }
    }

    /**
     * 取负
     *
     * @throws OperandException 操作数不是数字
     */
    public static ExprValue negate(ExprValue value, SourceLocation loc) {
        if (value instanceof ExprInt) {
            long v = ((ExprInt) value).getValue();
            if (v == Long.MIN_VALUE) {
                return ExprBigInt.of(BigInteger.valueOf(v).negate());
            }
            return ExprInt.of(-v);
        }
        if (value instanceof ExprBigInt) {
            return ExprBigInt.of(((ExprBigInt) value).getValue().negate());
        }
        if (value instanceof ExprDouble) {
            return ExprDouble.of(-((ExprDouble) value).getValue());
        }
        throw new OperandException("Bad operand type for unary -: " + value.getTypeName(), loc);
    }

    // ============ 数值类型提升 ============

    private static ExprValue arithmetic(BinaryOp op, ExprValue left, ExprValue right,
                                        LongBinaryOperator exactOp, BinaryOperator<BigInteger> bigOp,
                                        DoubleBinaryOperator doubleOp, SourceLocation loc) {
        requireNumbers(op, left, right, loc);
        ExprNumber l = (ExprNumber) left;
        ExprNumber r = (ExprNumber) right;
        if (l.isInteger() && r.isInteger()) {
            if (l instanceof ExprInt && r instanceof ExprInt) {
                long a = ((ExprInt) l).getValue();
                long b = ((ExprInt) r).getValue();
                try {
                    return ExprInt.of(exactOp.applyAsLong(a, b));
                } catch (ArithmeticException overflow) {
                    return ExprBigInt.of(bigOp.apply(BigInteger.valueOf(a), BigInteger.valueOf(b)));
                }
            }
            return ExprBigInt.of(bigOp.apply(toBigInteger(l), toBigInteger(r)));
        }
        return ExprDouble.of(doubleOp.applyAsDouble(l.asDouble(), r.asDouble()));
    }

    private static ExprValue divide(ExprValue left, ExprValue right, SourceLocation loc) {
        requireNumbers(BinaryOp.DIV, left, right, loc);
        ExprNumber l = (ExprNumber) left;
        ExprNumber r = (ExprNumber) right;
        if (l.isInteger() && r.isInteger()) {
            if (isZero(r)) {
                throw new OperandException("Division by zero", loc);
            }
            if (isExactDouble(l) && isExactDouble(r)) {
                return ExprDouble.of(l.asDouble() / r.asDouble());
            }
            BigDecimal quotient = new BigDecimal(toBigInteger(l))
                    .divide(new BigDecimal(toBigInteger(r)), MathContext.DECIMAL128);
            return ExprDouble.of(quotient.doubleValue());
        }
        double divisor = r.asDouble();
        if (divisor == 0.0) {
            throw new OperandException("Division by zero", loc);
        }
        return ExprDouble.of(l.asDouble() / divisor);
    }

    private static boolean order(BinaryOp op, ExprValue left, ExprValue right, SourceLocation loc) {
        requireNumbers(op, left, right, loc);
        ExprNumber l = (ExprNumber) left;
        ExprNumber r = (ExprNumber) right;
        // NaN 与任何数都无序
        if (l.isNaN() || r.isNaN()) {
            return false;
        }
        int c = ExprNumber.compare(l, r);
        switch (op) {
            case LT: return c < 0;
            case LE: return c <= 0;
            case GT: return c > 0;
            default: return c >= 0;
        }
    }

    private static BigInteger toBigInteger(ExprNumber n) {
        if (n instanceof ExprInt) {
            return ((ExprInt) n).toBigInteger();
        }
        return ((ExprBigInt) n).getValue();
    }

    private static boolean isZero(ExprNumber n) {
        return n instanceof ExprInt && ((ExprInt) n).getValue() == 0;
    }

    /** 整数能否无损转为 double（|v| <= 2^53） */
    private static boolean isExactDouble(ExprNumber n) {
        if (!(n instanceof ExprInt)) {
            return false;
        }
        long v = ((ExprInt) n).getValue();
        return v >= -MAX_EXACT_DOUBLE && v <= MAX_EXACT_DOUBLE;
    }

    private static void requireNumbers(BinaryOp op, ExprValue left, ExprValue right, SourceLocation loc) {
        if (!left.isNumber() || !right.isNumber()) {
            throw new OperandException("Unsupported operand types for " + op.getSymbol() + ": "
                    + left.getTypeName() + " and " + right.getTypeName(), loc);
        }
    }
}
