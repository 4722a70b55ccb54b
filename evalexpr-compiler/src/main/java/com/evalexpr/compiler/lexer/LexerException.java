package com.evalexpr.compiler.lexer;

import com.evalexpr.compiler.CompileException;

/**
 * 词法错误：无法识别的字符序列
 */
public class LexerException extends CompileException {

    private final String snippet;

    public LexerException(String message, String snippet, String fileName, int line, int column) {
        super(message, fileName, line, column);
        this.snippet = snippet;
    }

    /** 出错位置开始的源码片段 */
    public String getSnippet() {
        return snippet;
    }
}
