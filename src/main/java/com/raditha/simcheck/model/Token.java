package com.raditha.simcheck.model;

/**
 * Represents a normalized token produced by the scanner.
 * Keeps the source text for diagnostics while comparisons only ever see the
 * normalized form.
 *
 * @param type            Token type category
 * @param keyword         Keyword kind, {@link KeywordKind#UNKNOWN} unless type is KEYWORD
 * @param normalizedValue Normalized representation (e.g., "var_3", "NUM", "==")
 * @param originalValue   Original source text (e.g., "count", "0x1F", "==")
 * @param lineNumber      Source line number, starting at 1
 * @param columnNumber    Source column number, starting at 1
 */
public record Token(
        TokenType type,
        KeywordKind keyword,
        String normalizedValue,
        String originalValue,
        int lineNumber,
        int columnNumber) {

    /**
     * Create a non-keyword token.
     */
    public Token(TokenType type, String normalizedValue, String originalValue, int lineNumber, int columnNumber) {
        this(type, KeywordKind.UNKNOWN, normalizedValue, originalValue, lineNumber, columnNumber);
    }

    public boolean isEnd() {
        return type == TokenType.END;
    }

    public boolean isKeyword(KeywordKind kind) {
        return type == TokenType.KEYWORD && keyword == kind;
    }

    public boolean isPunctuation(String text) {
        return type == TokenType.PUNCTUATION && normalizedValue.equals(text);
    }

    /**
     * Label used for this token as a leaf of the structural tree.
     */
    public String leafLabel() {
        return switch (type) {
            case KEYWORD -> keyword.label();
            case IDENTIFIER, OPERATOR, PUNCTUATION -> normalizedValue;
            case NUMBER -> "NUM";
            case STRING -> "STR";
            case CHARACTER -> "CHR";
            case END -> "TOK";
        };
    }
}
