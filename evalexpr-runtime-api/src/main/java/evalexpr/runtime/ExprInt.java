package evalexpr.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 整数值（64 位）
 */
public final class ExprInt extends ExprNumber {

    private static final ExprInt[] SMALL = new ExprInt[256];

    static {
        for (int i = 0; i < SMALL.length; i++) {
            SMALL[i] = new ExprInt(i - 128);
        }
    }

    /** 获取 ExprInt 实例，[-128, 127] 从缓存取 */
    public static ExprInt of(long value) {
        if (value >= -128 && value <= 127) {
            return SMALL[(int) value + 128];
        }
        return new ExprInt(value);
    }

    private final long value;

    private ExprInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    public BigInteger toBigInteger() {
        return BigInteger.valueOf(value);
    }

    @Override
    BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(value);
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExprInt && ((ExprInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
