package evalexpr.runtime;

import java.math.BigDecimal;

/**
 * 浮点值（64 位）
 */
public final class ExprDouble extends ExprNumber {

    private static final ExprDouble ZERO = new ExprDouble(0.0);
    private static final ExprDouble ONE = new ExprDouble(1.0);

    /** 获取 ExprDouble 实例，常见值从缓存取 */
    public static ExprDouble of(double value) {
        if (value == 0.0 && Double.doubleToRawLongBits(value) == 0L) return ZERO;
        if (value == 1.0) return ONE;
        return new ExprDouble(value);
    }

    private final double value;

    private ExprDouble(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean isInteger() {
        return false;
    }

    @Override
    public boolean isNaN() {
        return Double.isNaN(value);
    }

    @Override
    BigDecimal toBigDecimal() {
        return new BigDecimal(value);
    }

    @Override
    public String getTypeName() {
        return "Double";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExprDouble
                && Double.doubleToLongBits(((ExprDouble) o).value) == Double.doubleToLongBits(value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
