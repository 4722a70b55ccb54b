package com.evalexpr.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（不含 EOF） */
    private List<Token> tokens(String source) {
        Lexer lexer = new Lexer(source, "<test>");
        List<Token> result = new ArrayList<>();
        for (Token t = lexer.getToken(); !t.is(TokenType.EOF); t = lexer.next()) {
            result.add(t);
        }
        return result;
    }

    private List<TokenType> types(String source) {
        List<TokenType> result = new ArrayList<>();
        for (Token t : tokens(source)) {
            result.add(t.getType());
        }
        return result;
    }

    /** 断言单个 token 的类型 */
    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    @Nested
    @DisplayName("操作符")
    class OperatorTests {

        @Test
        @DisplayName("单字符操作符与标点")
        void testSingleCharOperators() {
            assertEquals(List.of(TokenType.PLUS, TokenType.MINUS, TokenType.MUL, TokenType.DIV,
                            TokenType.LPAREN, TokenType.RPAREN, TokenType.ASSIGN, TokenType.SEMICOLON,
                            TokenType.COMMA, TokenType.LT, TokenType.GT),
                    types("+ - * / ( ) = ; , < >"));
        }

        @Test
        @DisplayName("双字符操作符优先于单字符前缀")
        void testTwoCharOperators() {
            assertSingleToken("<=", TokenType.LE);
            assertSingleToken(">=", TokenType.GE);
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
        }

        @Test
        @DisplayName("无空格的操作符序列")
        void testAdjacentOperators() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LE, TokenType.MINUS, TokenType.INT_LITERAL),
                    types("a<=-1"));
            assertEquals(List.of(TokenType.ASSIGN, TokenType.EQ), types("= =="));
            assertEquals(List.of(TokenType.EQ, TokenType.ASSIGN), types("==="));
        }
    }

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("整数")
        void testInteger() {
            List<Token> toks = tokens("42");
            assertEquals(TokenType.INT_LITERAL, toks.get(0).getType());
            assertEquals(42L, toks.get(0).getLiteral());
        }

        @Test
        @DisplayName("带小数点即为浮点数")
        void testFloat() {
            List<Token> toks = tokens("3.25");
            assertEquals(TokenType.FLOAT_LITERAL, toks.get(0).getType());
            assertEquals(3.25, toks.get(0).getLiteral());
        }

        @Test
        @DisplayName("结尾的小数点")
        void testTrailingDot() {
            List<Token> toks = tokens("7.");
            assertEquals(TokenType.FLOAT_LITERAL, toks.get(0).getType());
            assertEquals(7.0, toks.get(0).getLiteral());
        }

        @Test
        @DisplayName("数字后紧跟字母拆成两个 token")
        void testNumberThenIdentifier() {
            assertEquals(List.of(TokenType.INT_LITERAL, TokenType.IDENTIFIER), types("12abc"));
        }

        @Test
        @DisplayName("超出 64 位的整数保存为 BigInteger")
        void testLargeInteger() {
            List<Token> toks = tokens("1 + 99999999999999999999");
            assertEquals(TokenType.INT_LITERAL, toks.get(2).getType());
            assertEquals(new BigInteger("99999999999999999999"), toks.get(2).getLiteral());
            assertEquals(5, toks.get(2).getColumn());
        }

        @Test
        @DisplayName("64 位边界")
        void testLongBoundary() {
            assertEquals(Long.MAX_VALUE, tokens("9223372036854775807").get(0).getLiteral());
            assertEquals(new BigInteger("9223372036854775808"), tokens("9223372036854775808").get(0).getLiteral());
        }

        @Test
        @DisplayName("带前导零的长字面量仍为 Long")
        void testLeadingZeros() {
            assertEquals(42L, tokens("0000000000000000000042").get(0).getLiteral());
        }
    }

    @Nested
    @DisplayName("标识符与关键词")
    class IdentifierTests {

        @Test
        @DisplayName("字母开头，字母数字延续")
        void testIdentifier() {
            List<Token> toks = tokens("abc123def");
            assertEquals(1, toks.size());
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertEquals("abc123def", toks.get(0).getLexeme());
        }

        @Test
        @DisplayName("保留字")
        void testKeywords() {
            assertEquals(List.of(TokenType.KW_IF, TokenType.KW_THEN, TokenType.KW_ELSE, TokenType.KW_END,
                            TokenType.KW_WHILE, TokenType.KW_DO,
                            TokenType.KW_TRUE, TokenType.KW_FALSE, TokenType.KW_NONE),
                    types("if then else end while do TRUE FALSE NONE"));
        }

        @Test
        @DisplayName("关键词区分大小写")
        void testKeywordsAreCaseSensitive() {
            assertSingleToken("true", TokenType.IDENTIFIER);
            assertSingleToken("If", TokenType.IDENTIFIER);
            assertSingleToken("ending", TokenType.IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("位置跟踪")
    class PositionTests {

        @Test
        @DisplayName("换行递增行号并重置列号")
        void testLineAndColumn() {
            List<Token> toks = tokens("a +\n  bc");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(1, toks.get(1).getLine());
            assertEquals(3, toks.get(1).getColumn());
            assertEquals(2, toks.get(2).getLine());
            assertEquals(3, toks.get(2).getColumn());
        }

        @Test
        @DisplayName("输入结束标记的位置")
        void testEofPosition() {
            Lexer lexer = new Lexer("(1 + ", "<test>");
            Token t = lexer.getToken();
            while (!t.is(TokenType.EOF)) {
                t = lexer.next();
            }
            assertEquals(1, t.getLine());
            assertEquals(6, t.getColumn());
        }

        @Test
        @DisplayName("空源码直接得到 EOF")
        void testEmptySource() {
            Lexer lexer = new Lexer("  \n ", "<test>");
            assertTrue(lexer.getToken().is(TokenType.EOF));
            assertEquals(2, lexer.getToken().getLine());
            assertEquals(2, lexer.getToken().getColumn());
        }
    }

    @Nested
    @DisplayName("词法错误")
    class ErrorTests {

        @Test
        @DisplayName("无法识别的字符报告其位置和片段")
        void testBadCharacter() {
            LexerException e = assertThrows(LexerException.class, () -> tokens("1 + $x"));
            assertEquals(1, e.getLine());
            assertEquals(5, e.getColumn());
            assertEquals("$x", e.getSnippet());
            assertEquals("<test>:1:5:Bad string '$x...'", e.getMessage());
        }

        @Test
        @DisplayName("片段最多三个字符")
        void testSnippetLength() {
            LexerException e = assertThrows(LexerException.class, () -> tokens("x\n !abcdef"));
            assertEquals(2, e.getLine());
            assertEquals(2, e.getColumn());
            assertEquals("!ab", e.getSnippet());
        }

        @Test
        @DisplayName("单独的感叹号不是操作符")
        void testLoneBang() {
            LexerException e = assertThrows(LexerException.class, () -> tokens("a ! b"));
            assertEquals(3, e.getColumn());
        }

        @Test
        @DisplayName("第一个 token 出错时构造即失败")
        void testErrorOnFirstToken() {
            assertThrows(LexerException.class, () -> new Lexer("#", "<test>"));
        }

        @Test
        @DisplayName("错误之前的 token 正常产出")
        void testTokensBeforeError() {
            Lexer lexer = new Lexer("a b @", "<test>");
            assertEquals("a", lexer.getToken().getLexeme());
            assertEquals("b", lexer.next().getLexeme());
            assertThrows(LexerException.class, lexer::next);
        }
    }
}
