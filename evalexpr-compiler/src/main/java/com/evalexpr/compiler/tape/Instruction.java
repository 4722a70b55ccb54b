package com.evalexpr.compiler.tape;

import com.evalexpr.compiler.SourceLocation;
import evalexpr.runtime.ExprValue;

import java.util.Objects;

/**
 * 指令带上的一条指令。
 *
 * <p>变体由 {@link OpCode} 区分；每种变体只使用与其相关的字段：
 * {@code PUSH_CONST} 用 constant，{@code LOAD_VAR}/{@code PUSH_VAR_NAME} 用 name，
 * {@code BINARY} 用 binaryOp，两种跳转用 target。实例不可变，回填目标时整体替换。</p>
 */
public final class Instruction {

    /** 尚未回填的跳转目标 */
    public static final int UNPATCHED = -1;

    private final OpCode op;
    private final ExprValue constant;
    private final String name;
    private final BinaryOp binaryOp;
    private final int target;
    private final SourceLocation location;

    private Instruction(OpCode op, ExprValue constant, String name, BinaryOp binaryOp,
                        int target, SourceLocation location) {
        this.op = op;
        this.constant = constant;
        this.name = name;
        this.binaryOp = binaryOp;
        this.target = target;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    // ========== 工厂方法 ==========

    public static Instruction pushConst(ExprValue value, SourceLocation loc) {
        return new Instruction(OpCode.PUSH_CONST, Objects.requireNonNull(value), null, null, 0, loc);
    }

    public static Instruction loadVar(String name, SourceLocation loc) {
        return new Instruction(OpCode.LOAD_VAR, null, Objects.requireNonNull(name), null, 0, loc);
    }

    public static Instruction pushVarName(String name, SourceLocation loc) {
        return new Instruction(OpCode.PUSH_VAR_NAME, null, Objects.requireNonNull(name), null, 0, loc);
    }

    public static Instruction negate(SourceLocation loc) {
        return new Instruction(OpCode.NEGATE, null, null, null, 0, loc);
    }

    public static Instruction binary(BinaryOp op, SourceLocation loc) {
        return new Instruction(OpCode.BINARY, null, null, Objects.requireNonNull(op), 0, loc);
    }

    public static Instruction assign(SourceLocation loc) {
        return new Instruction(OpCode.ASSIGN, null, null, null, 0, loc);
    }

    public static Instruction discard(SourceLocation loc) {
        return new Instruction(OpCode.DISCARD, null, null, null, 0, loc);
    }

    public static Instruction makeEmptyList(SourceLocation loc) {
        return new Instruction(OpCode.MAKE_EMPTY_LIST, null, null, null, 0, loc);
    }

    public static Instruction jumpIfFalse(int target, SourceLocation loc) {
        return new Instruction(OpCode.JUMP_IF_FALSE, null, null, null, target, loc);
    }

    public static Instruction jump(int target, SourceLocation loc) {
        return new Instruction(OpCode.JUMP, null, null, null, target, loc);
    }

    /**
     * 返回目标替换为 {@code newTarget} 的同类跳转指令
     */
    public Instruction withTarget(int newTarget) {
        if (!op.isJump()) {
            throw new IllegalStateException("Not a jump instruction: " + this);
        }
        return new Instruction(op, null, null, null, newTarget, location);
    }

    // ========== 访问器 ==========

    public OpCode getOp() { return op; }
    public ExprValue getConstant() { return constant; }
    public String getName() { return name; }
    public BinaryOp getBinaryOp() { return binaryOp; }
    public int getTarget() { return target; }
    public SourceLocation getLocation() { return location; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return op == that.op
                && target == that.target
                && binaryOp == that.binaryOp
                && Objects.equals(constant, that.constant)
                && Objects.equals(name, that.name)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, constant, name, binaryOp, target, location);
    }

    @Override
    public String toString() {
        switch (op) {
            case PUSH_CONST:
                return "PUSH_CONST " + constant;
            case LOAD_VAR:
            case PUSH_VAR_NAME:
                return op.name() + " " + name;
            case BINARY:
                return "BINARY " + binaryOp.getSymbol();
            case JUMP_IF_FALSE:
            case JUMP:
                return op.name() + " " + (target == UNPATCHED ? "?" : String.valueOf(target));
            default:
                return op.name();
        }
    }
}
