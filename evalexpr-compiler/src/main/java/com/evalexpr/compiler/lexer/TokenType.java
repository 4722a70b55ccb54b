package com.evalexpr.compiler.lexer;

/**
 * EvalExpr 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL("number"),
    FLOAT_LITERAL("number"),

    // === 标识符 ===
    IDENTIFIER("identifier"),

    // === 关键词 ===
    KW_IF("if"), KW_THEN("then"), KW_ELSE("else"), KW_END("end"),
    KW_WHILE("while"), KW_DO("do"),
    KW_TRUE("TRUE"), KW_FALSE("FALSE"), KW_NONE("NONE"),

    // === 操作符 - 算术 ===
    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    DIV("/"),

    // === 操作符 - 比较 ===
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),

    // === 操作符 - 赋值 ===
    ASSIGN("="),

    // === 分隔符 ===
    LPAREN("("),
    RPAREN(")"),
    COMMA(","),
    SEMICOLON(";"),

    // === 特殊 ===
    EOF("end of input");

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * 用于错误消息的显示文本，如 {@code ')'}、{@code 'then'}、{@code end of input}
     */
    public String describe() {
        switch (this) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case IDENTIFIER:
            case EOF:
                return text;
            default:
                return "'" + text + "'";
        }
    }

    /**
     * 是否为关系操作符
     */
    public boolean isRelationalOp() {
        switch (this) {
            case LT:
            case GT:
            case LE:
            case GE:
            case EQ:
            case NE:
                return true;
            default:
                return false;
        }
    }
}
