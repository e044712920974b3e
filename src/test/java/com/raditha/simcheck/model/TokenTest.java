package com.raditha.simcheck.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenTest {

    @Test
    void testLeafLabels() {
        assertEquals("IF", new Token(TokenType.KEYWORD, KeywordKind.IF, "if", "if", 1, 1).leafLabel());
        assertEquals("KW", new Token(TokenType.KEYWORD, KeywordKind.DOUBLE, "double", "double", 1, 1).leafLabel());
        assertEquals("var_4", new Token(TokenType.IDENTIFIER, "var_4", "count", 1, 1).leafLabel());
        assertEquals("NUM", new Token(TokenType.NUMBER, "NUM", "0x10", 1, 1).leafLabel());
        assertEquals("STR", new Token(TokenType.STRING, "STR", "\"s\"", 1, 1).leafLabel());
        assertEquals("CHR", new Token(TokenType.CHARACTER, "CHAR", "'c'", 1, 1).leafLabel());
        assertEquals("->", new Token(TokenType.OPERATOR, "->", "->", 1, 1).leafLabel());
        assertEquals(";", new Token(TokenType.PUNCTUATION, ";", ";", 1, 1).leafLabel());
    }

    @Test
    void testPredicates() {
        Token semicolon = new Token(TokenType.PUNCTUATION, ";", ";", 1, 1);
        Token keyword = new Token(TokenType.KEYWORD, KeywordKind.ELSE, "else", "else", 1, 1);

        assertTrue(semicolon.isPunctuation(";"));
        assertFalse(semicolon.isPunctuation(","));
        assertFalse(semicolon.isEnd());
        assertEquals(KeywordKind.UNKNOWN, semicolon.keyword());
        assertTrue(keyword.isKeyword(KeywordKind.ELSE));
        assertFalse(keyword.isKeyword(KeywordKind.IF));
    }

    @Test
    void testKeywordLookup() {
        assertEquals(KeywordKind.TYPEDEF, KeywordKind.lookup("typedef"));
        assertEquals(KeywordKind.UNKNOWN, KeywordKind.lookup("If"));
        assertEquals(KeywordKind.UNKNOWN, KeywordKind.lookup("main"));
    }
}
