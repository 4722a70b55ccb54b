package evalexpr.runtime;

/**
 * 布尔值
 */
public final class ExprBoolean extends ExprValue {

    /** true 常量 */
    public static final ExprBoolean TRUE = new ExprBoolean(true);

    /** false 常量 */
    public static final ExprBoolean FALSE = new ExprBoolean(false);

    private final boolean value;

    private ExprBoolean(boolean value) {
        this.value = value;
    }

    /**
     * 获取布尔值实例
     */
    public static ExprBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Boolean";
    }

    @Override
    public boolean isTruthy() {
        return value;
    }

    @Override
    public boolean valueEquals(ExprValue other) {
        return this == other;
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
