package com.evalexpr.compiler.lexer;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * EvalExpr 词法分析器
 *
 * <p>按需拉取：任意时刻只持有一个"当前 token"，{@link #next()} 前进到下一个。
 * 构造时即读取第一个 token。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int current = 0;
    private int line = 1;
    private int column = 1;

    private Token token;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("then", TokenType.KW_THEN);
        map.put("else", TokenType.KW_ELSE);
        map.put("end", TokenType.KW_END);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);

        // 值
        map.put("TRUE", TokenType.KW_TRUE);
        map.put("FALSE", TokenType.KW_FALSE);
        map.put("NONE", TokenType.KW_NONE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /**
     * @throws LexerException 第一个 token 无法识别
     */
    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        next();
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 当前 token
     */
    public Token getToken() {
        return token;
    }

    /**
     * 跳过当前 token，读取下一个
     *
     * @return 新的当前 token
     * @throws LexerException 遇到无法识别的字符
     */
    public Token next() {
        skipWhitespace();

        if (isAtEnd()) {
            token = new Token(TokenType.EOF, "", null, line, column);
            return token;
        }

        int startLine = line;
        int startColumn = column;
        int start = current;
        char c = peek();

        if (Character.isLetter(c)) {
            identifier(start, startLine, startColumn);
        } else if (isDigit(c)) {
            number(start, startLine, startColumn);
        } else {
            operator(c, start, startLine, startColumn);
        }
        return token;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private void identifier(int start, int startLine, int startColumn) {
        while (!isAtEnd() && Character.isLetterOrDigit(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        token = new Token(type, text, null, startLine, startColumn);
    }

    private void number(int start, int startLine, int startColumn) {
        advanceDigits();

        // 小数部分（至多一个小数点，不支持指数）
        if (peek() == '.') {
            advance();
            advanceDigits();
            String text = source.substring(start, current);
            token = new Token(TokenType.FLOAT_LITERAL, text, Double.parseDouble(text),
                    startLine, startColumn);
            return;
        }

        // 整数不限位数：超出 64 位的字面量以 BigInteger 保存
        String text = source.substring(start, current);
        Object literal = text.length() < 19 ? (Object) Long.parseLong(text) : parseLargeInteger(text);
        token = new Token(TokenType.INT_LITERAL, text, literal, startLine, startColumn);
    }

    private void operator(char c, int start, int startLine, int startColumn) {
        TokenType type;
        char next = peekNext();

        // 双字符操作符优先于其单字符前缀
        if (c == '<' && next == '=') type = TokenType.LE;
        else if (c == '>' && next == '=') type = TokenType.GE;
        else if (c == '=' && next == '=') type = TokenType.EQ;
        else if (c == '!' && next == '=') type = TokenType.NE;
        else type = null;

        if (type != null) {
            advance();
            advance();
        } else {
            switch (c) {
                case '+': type = TokenType.PLUS; break;
                case '-': type = TokenType.MINUS; break;
                case '*': type = TokenType.MUL; break;
                case '/': type = TokenType.DIV; break;
                case '(': type = TokenType.LPAREN; break;
                case ')': type = TokenType.RPAREN; break;
                case '=': type = TokenType.ASSIGN; break;
                case ';': type = TokenType.SEMICOLON; break;
                case ',': type = TokenType.COMMA; break;
                case '<': type = TokenType.LT; break;
                case '>': type = TokenType.GT; break;
                default:
                    throw error();
            }
            advance();
        }
        token = new Token(type, source.substring(start, current), null, startLine, startColumn);
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void advance() {
        if (source.charAt(current) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        current++;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static Object parseLargeInteger(String text) {
        BigInteger value = new BigInteger(text);
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void advanceDigits() {
        while (isDigit(peek())) advance();
    }

    private LexerException error() {
        String snippet = source.substring(current, Math.min(current + 3, source.length()));
        return new LexerException("Bad string '" + snippet + "...'", snippet, fileName, line, column);
    }
}
