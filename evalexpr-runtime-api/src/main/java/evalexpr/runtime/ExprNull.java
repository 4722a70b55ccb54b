package evalexpr.runtime;

/**
 * 空值（源码中的 {@code NONE}）
 */
public final class ExprNull extends ExprValue {

    /** 唯一实例 */
    public static final ExprNull NULL = new ExprNull();

    private ExprNull() {
    }

    @Override
    public String getTypeName() {
        return "Null";
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public boolean valueEquals(ExprValue other) {
        return other == NULL;
    }

    @Override
    public String toString() {
        return "NONE";
    }
}
