package com.evalexpr.compiler.tape;

import com.evalexpr.compiler.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * 指令带构建辅助类。
 *
 * <p>前向跳转先以 {@link Instruction#UNPATCHED} 作为目标发射，返回其下标；
 * 目的地确定后用 {@link #patch(int, int)} 按下标回填。</p>
 */
public class TapeBuilder {

    private final String fileName;
    private final List<Instruction> instructions = new ArrayList<Instruction>();

    public TapeBuilder(String fileName) {
        this.fileName = fileName;
    }

    /**
     * 追加一条指令
     *
     * @return 指令下标
     */
    public int emit(Instruction inst) {
        instructions.add(inst);
        return instructions.size() - 1;
    }

    /** 发射目标待定的条件跳转 */
    public int emitJumpIfFalse(SourceLocation loc) {
        return emit(Instruction.jumpIfFalse(Instruction.UNPATCHED, loc));
    }

    /** 发射目标待定的无条件跳转 */
    public int emitJump(SourceLocation loc) {
        return emit(Instruction.jump(Instruction.UNPATCHED, loc));
    }

    /**
     * 回填下标 {@code index} 处跳转指令的目标
     */
    public void patch(int index, int target) {
        Instruction jump = instructions.get(index);
        if (jump.getTarget() != Instruction.UNPATCHED) {
            throw new IllegalStateException("Jump at " + index + " already patched: " + jump);
        }
        instructions.set(index, jump.withTarget(target));
    }

    /** 把跳转回填到当前带尾 */
    public void patchHere(int index) {
        patch(index, size());
    }

    /** 当前带长，即下一条指令的下标 */
    public int size() {
        return instructions.size();
    }

    public Tape build() {
        for (int i = 0; i < instructions.size(); i++) {
            Instruction inst = instructions.get(i);
            if (inst.getOp().isJump() && inst.getTarget() == Instruction.UNPATCHED) {
                throw new IllegalStateException("Unpatched jump at " + i);
            }
        }
        return new Tape(fileName, instructions);
    }
}
