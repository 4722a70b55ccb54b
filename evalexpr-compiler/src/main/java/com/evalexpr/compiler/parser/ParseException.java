package com.evalexpr.compiler.parser;

import com.evalexpr.compiler.CompileException;
import com.evalexpr.compiler.lexer.Token;

/**
 * 语法错误：当前 token 无法延续产生式，或缺少期望的 token
 */
public class ParseException extends CompileException {
    private final Token token;
    private final String expected;

    public ParseException(String message, String fileName, Token token, String expected) {
        super(message, fileName, token.getLine(), token.getColumn());
        this.token = token;
        this.expected = expected;
    }

    /** 出错时的当前 token */
    public Token getToken() {
        return token;
    }

    /** 期望内容的描述 */
    public String getExpected() {
        return expected;
    }
}
