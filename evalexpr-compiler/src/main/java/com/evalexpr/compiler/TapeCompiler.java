package com.evalexpr.compiler;

import com.evalexpr.compiler.lexer.Lexer;
import com.evalexpr.compiler.parser.Parser;
import com.evalexpr.compiler.tape.Tape;

/**
 * 编译入口：源码文本 → 指令带
 */
public final class TapeCompiler {

    private TapeCompiler() {}

    /**
     * 编译完整程序
     *
     * @param source 源码文本
     * @param fileName 显示用文件名（出现在错误消息中）
     * @throws CompileException 词法或语法错误
     */
    public static Tape compile(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName);
        return new Parser(lexer, fileName).parseProgram();
    }
}
