package com.evalexpr.compiler.tape;

/**
 * 指令操作码。
 */
public enum OpCode {
    PUSH_CONST,      // push value
    LOAD_VAR,        // push env[name]
    PUSH_VAR_NAME,   // push name（赋值左侧）
    NEGATE,          // push -pop
    BINARY,          // right = pop, left = pop, push left op right
    ASSIGN,          // value = pop, name = pop, env[name] = value, push value
    DISCARD,         // pop
    MAKE_EMPTY_LIST, // push []
    JUMP_IF_FALSE,   // if !pop goto target
    JUMP;            // goto target

    /** 是否带跳转目标 */
    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_FALSE;
    }
}
