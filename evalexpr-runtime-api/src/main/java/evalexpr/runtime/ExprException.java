package evalexpr.runtime;

/**
 * EvalExpr 基础异常（编译期与运行期故障的共同父类）。
 *
 * <p>所有故障都携带文件名与 1 起始的行列号，{@link #getMessage()} 统一渲染为
 * {@code <文件名>:<行>:<列>:<消息>}。行号为 0 表示位置未知，此时只输出消息本身。</p>
 */
public class ExprException extends RuntimeException {

    private final String fileName;
    private final int line;
    private final int column;

    public ExprException(String message) {
        this(message, null, 0, 0);
    }

    public ExprException(String message, String fileName, int line, int column) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public ExprException(String message, Throwable cause) {
        super(message, cause);
        this.fileName = null;
        this.line = 0;
        this.column = 0;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 是否带有源码位置 */
    public boolean hasLocation() {
        return line > 0;
    }

    /** 返回不含位置前缀的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (!hasLocation()) {
            return super.getMessage();
        }
        return (fileName != null ? fileName : "<input>") + ":" + line + ":" + column + ":" + super.getMessage();
    }
}
