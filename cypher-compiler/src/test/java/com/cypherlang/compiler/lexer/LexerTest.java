package com.cypherlang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 不含末尾 EOF 的 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<TokenType> toks = types(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0));
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = scan(source);
        assertEquals(2, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    private LexException lexError(String source) {
        return assertThrows(LexException.class, () -> scan(source));
    }

    // ============ 完整程序 ============

    @Nested
    @DisplayName("程序")
    class ProgramTests {

        @Test
        @DisplayName("状态变量声明")
        void testStateVariableContract() {
            List<Token> toks = scan("contract C { field x public; }");
            assertEquals(Arrays.asList(
                    TokenType.CONTRACT, TokenType.IDENTIFIER, TokenType.LBRACE,
                    TokenType.FIELD, TokenType.IDENTIFIER, TokenType.PUBLIC,
                    TokenType.SEMICOLON, TokenType.RBRACE, TokenType.EOF),
                    toks.stream().map(Token::getType).collect(Collectors.toList()));
            assertEquals("C", toks.get(1).getLexeme());
            assertEquals("x", toks.get(4).getLexeme());
        }

        @Test
        @DisplayName("空源码只产生 EOF")
        void testEmptySource() {
            List<Token> toks = scan("");
            assertEquals(1, toks.size());
            assertEquals(TokenType.EOF, toks.get(0).getType());
        }

        @Test
        @DisplayName("空白和注释只产生 EOF")
        void testOnlyTrivia() {
            List<Token> toks = scan("  // line\n\t/* block\n comment */ \r\n");
            assertEquals(1, toks.size());
            assertEquals(TokenType.EOF, toks.get(0).getType());
        }

        @Test
        @DisplayName("EOF 总是最后一个 token")
        void testEofTerminates() {
            List<Token> toks = scan("contract A { } contract B { }");
            assertEquals(TokenType.EOF, toks.get(toks.size() - 1).getType());
            assertEquals(1, toks.stream().filter(t -> t.is(TokenType.EOF)).count());
        }

        @Test
        @DisplayName("lexeme 还原有效源码")
        void testLexemesCoverSource() {
            String source = "function f(uint256 a) -> bool view { return a != 0x1F; }";
            String joined = scan(source).stream().map(Token::getLexeme).collect(Collectors.joining());
            assertEquals(source.replace(" ", ""), joined);
        }

        @Test
        @DisplayName("token 列表不可修改")
        void testUnmodifiable() {
            List<Token> toks = scan("contract");
            assertThrows(UnsupportedOperationException.class,
                    () -> toks.add(new Token(TokenType.EOF, "", null, 1, 1, 0)));
        }

        @Test
        @DisplayName("Lexer 只能扫描一次")
        void testSingleUse() {
            Lexer lexer = new Lexer("contract", "<test>");
            lexer.scanTokens();
            assertThrows(IllegalStateException.class, lexer::scanTokens);
        }
    }

    // ============ 关键词 ============

    @Nested
    @DisplayName("关键词")
    class KeywordTests {

        @Test
        @DisplayName("每个保留字映射到对应关键词 token")
        void testAllKeywords() {
            String[] words = {"contract", "function", "circuit", "modifier", "private", "public",
                    "pure", "view", "mpc", "field", "uint256", "bytes32", "bool", "address", "hash",
                    "signature", "proof", "commitment", "secret", "witness", "constraint",
                    "if", "else", "for", "while", "return", "require"};
            for (String word : words) {
                List<Token> toks = scan(word);
                TokenType type = toks.get(0).getType();
                assertTrue(type.isKeyword(), word + " should be a keyword, got " + type);
                assertEquals(word.toUpperCase(), type.name());
            }
            assertTrue(Lexer.getKeywords().containsAll(Arrays.asList(words)));
        }

        @Test
        @DisplayName("true 和 false 是布尔字面量")
        void testBooleans() {
            assertSingleToken("true", TokenType.BOOLEAN, Boolean.TRUE);
            assertSingleToken("false", TokenType.BOOLEAN, Boolean.FALSE);
        }

        @Test
        @DisplayName("关键词区分大小写")
        void testCaseSensitive() {
            assertSingleToken("Contract", TokenType.IDENTIFIER);
            assertSingleToken("FIELD", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("标识符可含数字和下划线")
        void testIdentifiers() {
            assertSingleToken("_vk", TokenType.IDENTIFIER);
            assertSingleToken("secret_value2", TokenType.IDENTIFIER);
            assertSingleToken("fields", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("类型关键词")
        void testTypeKeywords() {
            assertTrue(TokenType.FIELD.isTypeKeyword());
            assertTrue(TokenType.WITNESS.isTypeKeyword());
            assertFalse(TokenType.SECRET.isTypeKeyword());
            assertFalse(TokenType.IDENTIFIER.isTypeKeyword());
        }
    }

    // ============ 运算符 ============

    @Nested
    @DisplayName("运算符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("单字符运算符")
        void testSingleChar() {
            assertSingleToken("+", TokenType.PLUS);
            assertSingleToken("-", TokenType.MINUS);
            assertSingleToken("*", TokenType.MULTIPLY);
            assertSingleToken("/", TokenType.DIVIDE);
            assertSingleToken("%", TokenType.MODULO);
            assertSingleToken("=", TokenType.ASSIGN);
            assertSingleToken("<", TokenType.LESS_THAN);
            assertSingleToken(">", TokenType.GREATER_THAN);
            assertSingleToken("!", TokenType.NOT);
            assertSingleToken(".", TokenType.DOT);
        }

        @Test
        @DisplayName("双字符运算符")
        void testTwoChar() {
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("==", TokenType.EQUAL);
            assertSingleToken("!=", TokenType.NOT_EQUAL);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
        }

        @Test
        @DisplayName("括号")
        void testBrackets() {
            assertEquals(Arrays.asList(TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE,
                    TokenType.RBRACE, TokenType.LBRACKET, TokenType.RBRACKET),
                    types("(){}[]"));
        }

        @Test
        @DisplayName("相邻运算符最长匹配")
        void testAdjacent() {
            assertEquals(Arrays.asList(TokenType.EQUAL, TokenType.ASSIGN), types("==="));
            assertEquals(Arrays.asList(TokenType.MINUS, TokenType.ARROW), types("-->"));
        }
    }

    // ============ 字面量 ============

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("十进制数任意精度")
        void testDecimal() {
            assertSingleToken("42", TokenType.NUMBER, BigInteger.valueOf(42));
            String big = "21888242871839275222246405745257275088548364400416034343698204186575808495617";
            assertSingleToken(big, TokenType.NUMBER, new BigInteger(big));
        }

        @Test
        @DisplayName("十六进制数")
        void testHex() {
            assertSingleToken("0xff", TokenType.NUMBER, BigInteger.valueOf(255));
            assertSingleToken("0XAb", TokenType.NUMBER, BigInteger.valueOf(171));
        }

        @Test
        @DisplayName("点号不属于数字")
        void testNoDecimalPoint() {
            assertEquals(Arrays.asList(TokenType.NUMBER, TokenType.DOT, TokenType.NUMBER), types("1.5"));
        }

        @Test
        @DisplayName("双引号与单引号字符串")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING, "hello");
            assertSingleToken("'hello'", TokenType.STRING, "hello");
            assertSingleToken("'say \"hi\"'", TokenType.STRING, "say \"hi\"");
        }

        @Test
        @DisplayName("转义序列被解码，lexeme 保持原文")
        void testEscapes() {
            List<Token> toks = scan("\"a\\nb\\t\\\"c\\\\\\q\"");
            assertEquals("a\nb\t\"c\\q", toks.get(0).getLiteral());
            assertEquals("\"a\\nb\\t\\\"c\\\\\\q\"", toks.get(0).getLexeme());
        }

        @Test
        @DisplayName("字符串可跨行")
        void testMultilineString() {
            List<Token> toks = scan("\"a\nb\" x");
            assertEquals("a\nb", toks.get(0).getLiteral());
            assertEquals(2, toks.get(1).getLine());
        }
    }

    // ============ 位置 ============

    @Nested
    @DisplayName("位置")
    class PositionTests {

        @Test
        @DisplayName("每个 token 的行号和列号")
        void testLineColumn() {
            List<Token> toks = scan("contract C {\n  field x;\n}");
            assertEquals(1, toks.get(0).getLine());
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(10, toks.get(1).getColumn());
            Token field = toks.get(3);
            assertEquals(TokenType.FIELD, field.getType());
            assertEquals(2, field.getLine());
            assertEquals(3, field.getColumn());
            assertEquals(3, toks.get(6).getLine());
        }

        @Test
        @DisplayName("注释推进行号")
        void testCommentLines() {
            List<Token> toks = scan("/* a\nb\nc */ x // tail\ny");
            assertEquals(3, toks.get(0).getLine());
            assertEquals(4, toks.get(1).getLine());
        }

        @Test
        @DisplayName("偏移量索引源码")
        void testOffsets() {
            String source = "a  bb";
            Token bb = scan(source).get(1);
            assertEquals(3, bb.getOffset());
            assertEquals("bb", source.substring(bb.getOffset(), bb.getOffset() + bb.getLexeme().length()));
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("意外字符")
        void testUnexpectedCharacter() {
            LexException e = lexError("contract C { @ }");
            assertEquals(1, e.getLine());
            assertEquals(14, e.getColumn());
            assertTrue(e.getMessage().contains("Unexpected character '@'"));
            assertTrue(e.getMessage().startsWith("[<test>:1:14]"));
        }

        @Test
        @DisplayName("单独的 & 和 |")
        void testLoneLogicalChars() {
            assertTrue(lexError("a & b").getMessage().contains("'&&'"));
            assertTrue(lexError("a | b").getMessage().contains("'||'"));
        }

        @Test
        @DisplayName("字符串未结束")
        void testUnterminatedString() {
            LexException e = lexError("x = \"abc");
            assertEquals("Unterminated string", e.getRawMessage());
            assertEquals(5, e.getColumn());
        }

        @Test
        @DisplayName("十六进制前缀后没有数字")
        void testMalformedHex() {
            assertTrue(lexError("0x").getRawMessage().startsWith("Malformed hex literal"));
            assertTrue(lexError("0xg").getRawMessage().startsWith("Malformed hex literal"));
        }

        @Test
        @DisplayName("未闭合的块注释延续到输入末尾")
        void testUnterminatedBlockComment() {
            assertEquals(Arrays.asList(TokenType.IDENTIFIER), types("x /* never closed"));
        }
    }
}
