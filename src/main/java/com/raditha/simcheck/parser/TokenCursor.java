package com.raditha.simcheck.parser;

import com.raditha.simcheck.model.KeywordKind;
import com.raditha.simcheck.model.Token;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Read position over a random-access token buffer.
 * Never moves past the end marker, so consuming at the end is a no-op.
 */
public final class TokenCursor {
    private final List<Token> tokens;
    private int position;

    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public int position() {
        return position;
    }

    /**
     * Token at the given distance from the current position, null past the buffer.
     */
    public @Nullable Token peek(int offset) {
        int i = position + offset;
        if (i < 0 || i >= tokens.size()) {
            return null;
        }
        return tokens.get(i);
    }

    public @Nullable Token current() {
        return peek(0);
    }

    public boolean atEnd() {
        Token t = current();
        return t == null || t.isEnd();
    }

    /**
     * Return the current token and move past it unless the cursor is at the end.
     */
    public @Nullable Token consume() {
        Token t = current();
        if (!atEnd()) {
            position++;
        }
        return t;
    }

    public boolean atPunctuation(String text) {
        Token t = current();
        return t != null && t.isPunctuation(text);
    }

    public boolean atKeyword(KeywordKind kind) {
        Token t = current();
        return t != null && t.isKeyword(kind);
    }
}
