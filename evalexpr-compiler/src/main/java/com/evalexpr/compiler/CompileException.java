package com.evalexpr.compiler;

import evalexpr.runtime.ExprException;

/**
 * 编译期故障（词法或语法）。抛出后不会产生任何可执行的指令带。
 */
public abstract class CompileException extends ExprException {

    protected CompileException(String message, String fileName, int line, int column) {
        super(message, fileName, line, column);
    }
}
