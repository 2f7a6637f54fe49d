package com.saika;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Test
    void testOperatorsUseLongestMatch() {
        assertEquals(
            List.of(TokenType.IDENT, TokenType.DEFINE, TokenType.IDENT, TokenType.SHL_ASSIGN, TokenType.INT,
                TokenType.ARROW, TokenType.IDENT, TokenType.NOT_EQ, TokenType.LT_EQ, TokenType.AND,
                TokenType.OR, TokenType.INCREMENT, TokenType.DECREMENT, TokenType.SHR, TokenType.EOF),
            types("a := b <<= 2 <-ch != <= && || ++ -- >>"));
    }

    @Test
    void testSingleCharacterTokens() {
        assertEquals(
            List.of(TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE, TokenType.LBRACKET,
                TokenType.RBRACKET, TokenType.COMMA, TokenType.SEMICOLON, TokenType.COLON, TokenType.DOT,
                TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
                TokenType.BANG, TokenType.ASSIGN, TokenType.EOF),
            types("(){}[],;:.+-*/% ! ="));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e10", "1.5e-5", "3.14", "2E+3"})
    void testFloatLiterals(String literal) {
        Lexer lexer = new Lexer(literal);
        Token token = lexer.nextToken();
        assertEquals(TokenType.FLOAT, token.type());
        assertEquals(literal, token.literal());
        assertTrue(lexer.diagnostics().isEmpty());
    }

    @Test
    void testIntegerLiteral() {
        Token token = new Lexer("12345").nextToken();
        assertEquals(TokenType.INT, token.type());
        assertEquals("12345", token.literal());
    }

    @Test
    void testDigitsFollowedByLettersAreOneIllegalToken() {
        Lexer lexer = new Lexer("x = 123abc");
        List<Token> tokens = lexer.tokenize();

        Token illegal = tokens.get(2);
        assertEquals(TokenType.ILLEGAL, illegal.type());
        assertEquals("123abc", illegal.literal());
        assertEquals(1, illegal.line());
        assertEquals(5, illegal.column());
        assertEquals(TokenType.EOF, tokens.get(3).type());

        assertEquals(1, lexer.diagnostics().size());
        Diagnostic warning = lexer.diagnostics().get(0);
        assertFalse(warning.isError());
        assertEquals("invalid numeric literal '123abc'", warning.message());
        assertEquals(illegal.position(), warning.position());
    }

    @Test
    void testIntegerOutOfRangeIsIllegal() {
        Lexer lexer = new Lexer("99999999999999999999");
        assertEquals(TokenType.ILLEGAL, lexer.nextToken().type());
        assertEquals(1, lexer.diagnostics().size());
    }

    @Test
    void testLeadingZeroDigitsStayOneIntegerToken() {
        Lexer lexer = new Lexer("010 09 0");
        List<Token> tokens = lexer.tokenize();
        assertEquals(List.of("010", "09", "0", ""), tokens.stream().map(Token::literal).toList());
        assertEquals(List.of(TokenType.INT, TokenType.INT, TokenType.INT, TokenType.EOF),
            tokens.stream().map(Token::type).toList());
        assertTrue(lexer.diagnostics().isEmpty());
    }

    @Test
    void testDotAfterIntegerWithoutDigitIsMemberAccess() {
        assertEquals(List.of(TokenType.INT, TokenType.DOT, TokenType.IDENT, TokenType.EOF), types("1.x"));
    }

    @Test
    void testUnterminatedStringYieldsTextThenEof() {
        Lexer lexer = new Lexer("\"abc");
        Token string = lexer.nextToken();
        assertEquals(TokenType.STRING, string.type());
        assertEquals("abc", string.literal());
        assertEquals(TokenType.EOF, lexer.nextToken().type());

        assertEquals(1, lexer.diagnostics().size());
        assertEquals("unterminated string literal", lexer.diagnostics().get(0).message());
    }

    @Test
    void testEscapedQuoteDoesNotEndString() {
        Lexer lexer = new Lexer("\"say \\\"hi\\\"\" x");
        Token string = lexer.nextToken();
        assertEquals("say \\\"hi\\\"", string.literal());
        assertEquals(TokenType.IDENT, lexer.nextToken().type());
        assertTrue(lexer.diagnostics().isEmpty());
    }

    @Test
    void testUnknownEscapeIsReportedAndKept() {
        Lexer lexer = new Lexer("\"a\\qb\"");
        Token string = lexer.nextToken();
        assertEquals("a\\qb", string.literal());
        assertEquals(1, lexer.diagnostics().size());
        assertEquals("unknown escape sequence \\q", lexer.diagnostics().get(0).message());
    }

    @Test
    void testCharacterLiterals() {
        Lexer lexer = new Lexer("'a' '\\n' '字'");
        assertEquals(new Token(TokenType.CHAR, "a", new com.saika.ast.Position(1, 1)), lexer.nextToken());
        assertEquals("\\n", lexer.nextToken().literal());
        assertEquals("字", lexer.nextToken().literal());
        assertTrue(lexer.diagnostics().isEmpty());
    }

    @Test
    void testUnterminatedCharacterLiteral() {
        Lexer lexer = new Lexer("'ab");
        assertEquals(TokenType.CHAR, lexer.nextToken().type());
        assertEquals("unterminated character literal", lexer.diagnostics().get(0).message());
    }

    @Test
    void testCommentsAreSkipped() {
        assertEquals(List.of(TokenType.IDENT, TokenType.IDENT, TokenType.EOF),
            types("a // line comment\n/* block\ncomment */ b"));
    }

    @Test
    void testUnterminatedBlockComment() {
        Lexer lexer = new Lexer("a /* never closed");
        assertEquals(TokenType.IDENT, lexer.nextToken().type());
        assertEquals(TokenType.EOF, lexer.nextToken().type());
        assertEquals("unterminated block comment", lexer.diagnostics().get(0).message());
    }

    @Test
    void testEofRepeatsForever() {
        Lexer lexer = new Lexer("x");
        lexer.nextToken();
        for (int i = 0; i < 3; i++) {
            assertEquals(TokenType.EOF, lexer.nextToken().type());
        }
    }

    @Test
    void testUnicodeKeywordsAndIdentifiers() {
        List<Token> tokens = new Lexer("數 主() { 返回 真 }").tokenize();
        assertEquals(TokenType.SAIKA_FUNCTION, tokens.get(0).type());
        assertEquals(TokenType.IDENT, tokens.get(1).type());
        assertEquals("主", tokens.get(1).literal());
        assertEquals(TokenType.RETURN, tokens.get(5).type());
        assertEquals(TokenType.TRUE, tokens.get(6).type());
    }

    @Test
    void testIdentifiersMayContainDigitsAndUnderscores() {
        Token token = new Lexer("_名稱2x").nextToken();
        assertEquals(TokenType.IDENT, token.type());
        assertEquals("_名稱2x", token.literal());
    }

    @Test
    void testPositionsCountCodePoints() {
        List<Token> tokens = new Lexer("數 f\n  y", "main.saika").tokenize();
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
        assertEquals(3, tokens.get(1).column());
        assertEquals("main.saika", tokens.get(2).position().file());
    }

    @Test
    void testUnknownCharacterIsIllegal() {
        List<Token> tokens = new Lexer("a @ b").tokenize();
        assertEquals(TokenType.ILLEGAL, tokens.get(1).type());
        assertEquals("@", tokens.get(1).literal());
        assertEquals(TokenType.IDENT, tokens.get(2).type());
    }

    @Test
    void testCustomDialectKeywords() {
        Dialect dialect = Dialect.defaults().withKeywords(java.util.Map.of("函數", TokenType.SAIKA_FUNCTION));
        Lexer lexer = new Lexer("函數 f", "", dialect);
        assertEquals(TokenType.SAIKA_FUNCTION, lexer.nextToken().type());
    }
}
