package evalexpr.runtime;

import java.math.BigDecimal;

/**
 * 数字值：整数（{@link ExprInt} 或超出 64 位的 {@link ExprBigInt}）或双精度浮点数
 */
public abstract sealed class ExprNumber extends ExprValue permits ExprInt, ExprBigInt, ExprDouble {

    ExprNumber() {
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    /** 是否为整数（任意精度） */
    public boolean isInteger() {
        return true;
    }

    public abstract double asDouble();

    /**
     * 精确的十进制值。只对有限值有意义，NaN 和无穷由 {@link ExprDouble} 单独处理。
     */
    abstract BigDecimal toBigDecimal();

    /**
     * 按数值精确比较，整数与浮点混合时不经过 double 舍入。
     *
     * <p>调用方需先排除 NaN（NaN 与任何数都无序）。</p>
     */
    public static int compare(ExprNumber a, ExprNumber b) {
        if (a instanceof ExprInt && b instanceof ExprInt) {
            return Long.compare(((ExprInt) a).getValue(), ((ExprInt) b).getValue());
        }
        int ra = infinityRank(a);
        int rb = infinityRank(b);
        if (ra != 0 || rb != 0) {
            return Integer.compare(ra, rb);
        }
        return a.toBigDecimal().compareTo(b.toBigDecimal());
    }

    private static int infinityRank(ExprNumber n) {
        if (n instanceof ExprDouble) {
            double v = ((ExprDouble) n).getValue();
            if (v == Double.POSITIVE_INFINITY) return 1;
            if (v == Double.NEGATIVE_INFINITY) return -1;
        }
        return 0;
    }

    /** 是否为 NaN */
    public boolean isNaN() {
        return false;
    }

    @Override
    public boolean valueEquals(ExprValue other) {
        if (!(other instanceof ExprNumber)) return false;
        ExprNumber that = (ExprNumber) other;
        if (isNaN() || that.isNaN()) return false;
        return compare(this, that) == 0;
    }
}
