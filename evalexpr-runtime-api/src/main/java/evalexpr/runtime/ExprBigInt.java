package evalexpr.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 超出 64 位范围的整数值
 *
 * <p>语言层面只有一种整数：类型名同样是 {@code Int}。落回 64 位范围的结果
 * 总是以 {@link ExprInt} 表示，因此两种实例的取值范围不重叠。</p>
 */
public final class ExprBigInt extends ExprNumber {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    /**
     * 任意精度整数对应的值：能放进 64 位时返回 {@link ExprInt}
     */
    public static ExprNumber of(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return ExprInt.of(value.longValue());
        }
        return new ExprBigInt(value);
    }

    private final BigInteger value;

    private ExprBigInt(BigInteger value) {
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value.doubleValue();
    }

    @Override
    BigDecimal toBigDecimal() {
        return new BigDecimal(value);
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public String toString() {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExprBigInt && ((ExprBigInt) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
