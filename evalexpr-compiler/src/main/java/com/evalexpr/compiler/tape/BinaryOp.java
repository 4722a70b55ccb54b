package com.evalexpr.compiler.tape;

import com.evalexpr.compiler.lexer.TokenType;

/**
 * 二元组合运算。左操作数先入栈。
 */
public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    EQ("=="),
    NE("!="),
    LIST_APPEND("append"),
    CALL("call");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }


    /**
     * 操作符 token → 二元运算
     */
    public static BinaryOp fromToken(TokenType type) {
        switch (type) {
            case PLUS:  return ADD;
            case MINUS: return SUB;
            case MUL:   return MUL;
            case DIV:   return DIV;
            case LT:    return LT;
            case LE:    return LE;
            case GT:    return GT;
            case GE:    return GE;
            case EQ:    return EQ;
            case NE:    return NE;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + type);
        }
    }
}
