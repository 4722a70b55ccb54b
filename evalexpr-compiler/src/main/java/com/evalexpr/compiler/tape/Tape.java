package com.evalexpr.compiler.tape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译产物：线性指令带。下标即程序计数器的地址空间。
 */
public final class Tape {

    private final String fileName;
    private final List<Instruction> instructions;

    public Tape(String fileName, List<Instruction> instructions) {
        this.fileName = fileName;
        this.instructions = Collections.unmodifiableList(new ArrayList<Instruction>(instructions));
    }

    public String getFileName() {
        return fileName;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Instruction get(int pc) {
        return instructions.get(pc);
    }

    public int size() {
        return instructions.size();
    }

    /**
     * 反汇编：每行一条指令，格式为 {@code 下标  操作码  操作数}
     */
    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        int width = String.valueOf(Math.max(0, instructions.size() - 1)).length();
        for (int i = 0; i < instructions.size(); i++) {
            String index = String.valueOf(i);
            for (int pad = index.length(); pad < width; pad++) sb.append(' ');
            sb.append(index).append("  ").append(instructions.get(i)).append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tape)) return false;
        Tape that = (Tape) o;
        return instructions.equals(that.instructions)
                && (fileName == null ? that.fileName == null : fileName.equals(that.fileName));
    }

    @Override
    public int hashCode() {
        return 31 * instructions.hashCode() + (fileName != null ? fileName.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "Tape[" + fileName + ", " + instructions.size() + " instructions]";
    }
}
