package com.raditha.simcheck.parser;

import com.raditha.simcheck.model.KeywordKind;
import com.raditha.simcheck.model.Token;
import com.raditha.simcheck.normalization.SourceScanner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenCursorTest {

    @Test
    void testConsumeAdvances() {
        TokenCursor cursor = new TokenCursor(SourceScanner.tokenize("if (x)"));

        assertTrue(cursor.atKeyword(KeywordKind.IF));
        assertEquals("if", cursor.consume().originalValue());
        assertTrue(cursor.atPunctuation("("));
        assertEquals(1, cursor.position());
    }

    @Test
    void testPeekBeyondBufferIsNull() {
        TokenCursor cursor = new TokenCursor(SourceScanner.tokenize("x"));

        assertNotNull(cursor.peek(1));
        assertNull(cursor.peek(2));
        assertNull(cursor.peek(-1));
    }

    @Test
    void testConsumeAtEndDoesNotMove() {
        TokenCursor cursor = new TokenCursor(SourceScanner.tokenize("x"));
        cursor.consume();

        assertTrue(cursor.atEnd());
        Token end = cursor.consume();
        assertTrue(end.isEnd());
        assertEquals(1, cursor.position());
    }

    @Test
    void testBufferWithoutEndMarker() {
        List<Token> tokens = new ArrayList<>(SourceScanner.tokenize("x"));
        tokens.remove(tokens.size() - 1);
        TokenCursor cursor = new TokenCursor(tokens);

        cursor.consume();
        assertTrue(cursor.atEnd());
        assertNull(cursor.current());
        assertNull(cursor.consume());
        assertFalse(cursor.atPunctuation(";"));
    }

    @Test
    void testCursorCopiesBuffer() {
        List<Token> tokens = new ArrayList<>(SourceScanner.tokenize("a b"));
        TokenCursor cursor = new TokenCursor(tokens);
        tokens.clear();

        assertFalse(cursor.atEnd());
    }
}
