package com.evalexpr.compiler.parser;

import com.evalexpr.compiler.SourceLocation;
import com.evalexpr.compiler.lexer.Lexer;
import com.evalexpr.compiler.lexer.Token;
import com.evalexpr.compiler.lexer.TokenType;
import com.evalexpr.compiler.tape.BinaryOp;
import com.evalexpr.compiler.tape.Instruction;
import com.evalexpr.compiler.tape.Tape;
import com.evalexpr.compiler.tape.TapeBuilder;
import evalexpr.runtime.ExprBigInt;
import evalexpr.runtime.ExprBoolean;
import evalexpr.runtime.ExprDouble;
import evalexpr.runtime.ExprInt;
import evalexpr.runtime.ExprNull;
import evalexpr.runtime.ExprValue;

import java.math.BigInteger;

import static com.evalexpr.compiler.lexer.TokenType.*;

/**
 * EvalExpr 语法分析器（递归下降，单遍）
 *
 * <p>不构建语法树：每个产生式在识别的同时直接向指令带发射指令。
 * 只有 if / while 的前向跳转需要回填。</p>
 *
 * <pre>
 * program    := exprlist END
 * exprlist   := expr { ';' expr }
 * expr       := arexpr [ relop arexpr ]
 * arexpr     := [ '+' | '-' ] term { ('+'|'-') term }
 * term       := factor { ('*'|'/') factor }
 * factor     := primary { args } | NUMBER | '(' exprlist ')'
 * primary    := IDENT [ '=' expr ] | valkeyword | statement
 * valkeyword := TRUE | FALSE | NONE
 * statement  := if_stmt | while_stmt
 * if_stmt    := 'if' expr 'then' exprlist [ 'else' exprlist ] 'end'
 * while_stmt := 'while' expr 'do' exprlist 'end'
 * args       := '(' [ expr { ',' expr } ] ')'
 * </pre>
 */
public class Parser {

    static final String FACTOR_EXPECTED =
            "number, identifier, TRUE, FALSE, NONE, 'if', 'while' or '('";

    private final Lexer lexer;
    private final String fileName;
    private final TapeBuilder tape;

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        this.tape = new TapeBuilder(fileName);
    }

    // ============ 基础方法 ============

    private Token current() {
        return lexer.getToken();
    }

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    private Token advance() {
        Token consumed = lexer.getToken();
        lexer.next();
        return consumed;
    }

    private boolean check(TokenType type) {
        return current().getType() == type;
    }

    private boolean checkAny(TokenType... types) {
        return current().isOneOf(types);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    private Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error(type.describe());
    }

    private ParseException error(String expected) {
        Token token = current();
        return new ParseException("Expected " + expected + ", but got " + token.describe(),
                fileName, token, expected);
    }

    private SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    // ============ 程序 ============

    /**
     * 编译完整程序：{@code program := exprlist END}
     *
     * @throws ParseException 语法错误（此时不返回任何指令带）
     */
    public Tape parseProgram() {
        parseExprList();
        expect(EOF);
        return tape.build();
    }

    // exprlist := expr { ';' expr }
    private void parseExprList() {
        parseExpr();
        while (check(SEMICOLON)) {
            Token semi = advance();
            tape.emit(Instruction.discard(locationOf(semi)));
            parseExpr();
        }
    }

    // expr := arexpr [ relop arexpr ]
    private void parseExpr() {
        parseArExpr();
        if (current().getType().isRelationalOp()) {
            Token op = advance();
            parseArExpr();
            tape.emit(Instruction.binary(BinaryOp.fromToken(op.getType()), locationOf(op)));
        }
    }

    // arexpr := [ '+' | '-' ] term { ('+'|'-') term }
    private void parseArExpr() {
        Token sign = null;
        if (checkAny(PLUS, MINUS)) {
            sign = advance();
        }

        parseTerm();

        // 前导符号只作用于第一项
        if (sign != null && sign.is(MINUS)) {
            tape.emit(Instruction.negate(locationOf(sign)));
        }

        while (checkAny(PLUS, MINUS)) {
            Token op = advance();
            parseTerm();
            tape.emit(Instruction.binary(BinaryOp.fromToken(op.getType()), locationOf(op)));
        }
    }

    // term := factor { ('*'|'/') factor }
    private void parseTerm() {
        parseFactor();
        while (checkAny(MUL, DIV)) {
            Token op = advance();
            parseFactor();
            tape.emit(Instruction.binary(BinaryOp.fromToken(op.getType()), locationOf(op)));
        }
    }

    // factor := primary { args } | NUMBER | '(' exprlist ')'
    private void parseFactor() {
        Token token = current();
        switch (token.getType()) {
            case INT_LITERAL:
                advance();
                tape.emit(Instruction.pushConst(integerValue(token.getLiteral()), locationOf(token)));
                break;
            case FLOAT_LITERAL:
                advance();
                tape.emit(Instruction.pushConst(ExprDouble.of((Double) token.getLiteral()), locationOf(token)));
                break;
            case LPAREN:
                advance();
                parseExprList();
                expect(RPAREN);
                break;
            case IDENTIFIER:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
            case KW_IF:
            case KW_WHILE:
                parsePrimary();
                while (check(LPAREN)) {
                    parseArgs();
                }
                break;
            default:
                throw error(FACTOR_EXPECTED);
        }
    }

    // primary := IDENT [ '=' expr ] | valkeyword | statement
    private void parsePrimary() {
        Token token = advance();
        SourceLocation loc = locationOf(token);
        switch (token.getType()) {
            case IDENTIFIER:
                if (match(ASSIGN)) {
                    tape.emit(Instruction.pushVarName(token.getLexeme(), loc));
                    parseExpr();
                    tape.emit(Instruction.assign(loc));
                } else {
                    tape.emit(Instruction.loadVar(token.getLexeme(), loc));
                }
                break;
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
                tape.emit(Instruction.pushConst(keywordValue(token.getType()), loc));
                break;
            case KW_IF:
                parseIfRest(loc);
                break;
            case KW_WHILE:
                parseWhileRest(loc);
                break;
            default:
                // parseFactor 已按 token 类型分派，到不了这里
                throw new IllegalStateException("Not a primary: " + token);
        }
    }

    private static ExprValue integerValue(Object literal) {
        if (literal instanceof BigInteger) {
            return ExprBigInt.of((BigInteger) literal);
        }
        return ExprInt.of((Long) literal);
    }

    private static ExprValue keywordValue(TokenType type) {
        switch (type) {
            case KW_TRUE:  return ExprBoolean.TRUE;
            case KW_FALSE: return ExprBoolean.FALSE;
            default:       return ExprNull.NULL;
        }
    }

    // if_stmt := 'if' expr 'then' exprlist [ 'else' exprlist ] 'end'
    private void parseIfRest(SourceLocation loc) {
        parseExpr();
        expect(KW_THEN);
        int falseJump = tape.emitJumpIfFalse(loc);

        parseExprList();
        int endJump = tape.emitJump(loc);

        tape.patchHere(falseJump);
        if (match(KW_ELSE)) {
            parseExprList();
        } else {
            // 无 else 分支时整个结构的值为 NONE
            tape.emit(Instruction.pushConst(ExprNull.NULL, loc));
        }
        expect(KW_END);
        tape.patchHere(endJump);
    }

    // while_stmt := 'while' expr 'do' exprlist 'end'
    private void parseWhileRest(SourceLocation loc) {
        // 循环一次都不执行时的值
        tape.emit(Instruction.pushConst(ExprNull.NULL, loc));

        int loopHead = tape.size();
        parseExpr();
        expect(KW_DO);
        int exitJump = tape.emitJumpIfFalse(loc);

        // 丢弃上一轮循环体的值（首轮为 NONE），保证栈上只留一个值
        tape.emit(Instruction.discard(loc));
        parseExprList();
        expect(KW_END);
        tape.emit(Instruction.jump(loopHead, loc));

        tape.patchHere(exitJump);
    }

    // args := '(' [ expr { ',' expr } ] ')'
    private void parseArgs() {
        Token lparen = expect(LPAREN);
        SourceLocation loc = locationOf(lparen);
        tape.emit(Instruction.makeEmptyList(loc));

        if (!check(RPAREN)) {
            parseExpr();
            tape.emit(Instruction.binary(BinaryOp.LIST_APPEND, loc));
            while (match(COMMA)) {
                parseExpr();
                tape.emit(Instruction.binary(BinaryOp.LIST_APPEND, loc));
            }
        }
        expect(RPAREN);
        tape.emit(Instruction.binary(BinaryOp.CALL, loc));
    }
}
