package com.evalexpr.compiler.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** 数字字面量的值（{@link Long}、超出 64 位时为 {@link java.math.BigInteger}，浮点为 {@link Double}），其它 token 为 null */
    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /**
     * 错误消息中的描述，如 {@code identifier 'x'}、{@code number 3.5}、{@code '+'}
     */
    public String describe() {
        switch (type) {
            case IDENTIFIER:
                return "identifier '" + lexeme + "'";
            case INT_LITERAL:
            case FLOAT_LITERAL:
                return "number " + lexeme;
            default:
                return type.describe();
        }
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }
}
