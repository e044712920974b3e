package com.raditha.simcheck.normalization;

import com.raditha.simcheck.model.KeywordKind;
import com.raditha.simcheck.model.Token;
import com.raditha.simcheck.model.TokenType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw source text into normalized tokens.
 * <p>
 * Normalization rules:
 * <ul>
 * <li>identifiers become {@code var_N}, where N counts every identifier occurrence
 * (the same name seen twice gets two different placeholders)</li>
 * <li>numeric literals become {@code NUM}, strings {@code STR}, characters {@code CHAR}</li>
 * <li>keywords, operators and punctuation keep their own text</li>
 * <li>whitespace, comments and unknown characters are skipped</li>
 * </ul>
 * The scanner reads strictly left to right and yields exactly one {@link TokenType#END}
 * token. An instance is single-use.
 */
public class SourceScanner implements Iterator<Token> {

    private static final String OPERATOR_CHARS = "+-*/%=!<>&|^~";
    private static final String PUNCTUATION_CHARS = "(){}[];,.";

    private static final Set<String> COMPOUND_OPERATORS = Set.of(
            "==", "!=", "<=", ">=",
            "&&", "||",
            "++", "--",
            "+=", "-=", "*=", "/=", "%=",
            "<<", ">>",
            "->");

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;
    private int identifierCounter;
    private boolean finished;

    public SourceScanner(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Scan a whole text. The returned list always ends with the end marker.
     */
    public static List<Token> tokenize(String source) {
        SourceScanner scanner = new SourceScanner(source);
        List<Token> tokens = new ArrayList<>();
        while (scanner.hasNext()) {
            tokens.add(scanner.next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("End of input already reached");
        }

        while (true) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                finished = true;
                return new Token(TokenType.END, "", "", line, column);
            }

            char c = source.charAt(pos);
            if (isIdentifierStart(c)) {
                return readIdentifier();
            }
            if (isDigit(c)) {
                return readNumber();
            }
            if (c == '"') {
                return readString();
            }
            if (c == '\'') {
                return readChar();
            }
            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                return readOperator();
            }
            if (PUNCTUATION_CHARS.indexOf(c) >= 0) {
                return readPunctuation();
            }

            // unknown character
            advance();
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isWhitespace(c)) {
                advanceTrackingLines();
            } else if (c == '/' && peek(1) == '/') {
                // the terminating newline is left for the whitespace branch
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        advance();
        advance();
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peek(1) == '/') {
                advance();
                advance();
                return;
            }
            advanceTrackingLines();
        }
    }

    private Token readIdentifier() {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            advance();
        }

        String word = source.substring(start, pos);
        KeywordKind keyword = KeywordKind.lookup(word);
        if (keyword != KeywordKind.UNKNOWN) {
            return new Token(TokenType.KEYWORD, keyword, word, word, startLine, startColumn);
        }
        String placeholder = "var_" + identifierCounter++;
        return new Token(TokenType.IDENTIFIER, placeholder, word, startLine, startColumn);
    }

    private Token readNumber() {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            advance();
            advance();
            while (isHexDigit(peek(0))) {
                advance();
            }
        } else {
            skipDigits();
            if (peek(0) == '.') {
                advance();
                skipDigits();
            }
            if (peek(0) == 'e' || peek(0) == 'E') {
                advance();
                if (peek(0) == '+' || peek(0) == '-') {
                    advance();
                }
                skipDigits();
            }
        }

        while ("LlUuFf".indexOf(peek(0)) >= 0) {
            advance();
        }

        return new Token(TokenType.NUMBER, "NUM", source.substring(start, pos), startLine, startColumn);
    }

    private Token readString() {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        advance();
        while (pos < source.length() && source.charAt(pos) != '"') {
            if (source.charAt(pos) == '\\') {
                advance();
                if (pos < source.length()) {
                    advance();
                }
            } else {
                advanceTrackingLines();
            }
        }
        if (pos < source.length()) {
            advance();
        }

        return new Token(TokenType.STRING, "STR", source.substring(start, pos), startLine, startColumn);
    }

    private Token readChar() {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        advance();
        if (peek(0) == '\\') {
            advance();
        }
        if (pos < source.length()) {
            advance();
        }
        if (peek(0) == '\'') {
            advance();
        }

        return new Token(TokenType.CHARACTER, "CHAR", source.substring(start, pos), startLine, startColumn);
    }

    private Token readOperator() {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        advance();
        if (pos < source.length() && COMPOUND_OPERATORS.contains(source.substring(start, pos + 1))) {
            advance();
        }

        String op = source.substring(start, pos);
        return new Token(TokenType.OPERATOR, op, op, startLine, startColumn);
    }

    private Token readPunctuation() {
        int startLine = line;
        int startColumn = column;
        String punct = String.valueOf(source.charAt(pos));
        advance();
        return new Token(TokenType.PUNCTUATION, punct, punct, startLine, startColumn);
    }

    private void skipDigits() {
        while (isDigit(peek(0))) {
            advance();
        }
    }

    /**
     * Character at the given offset from the current position, 0 past the end.
     */
    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : 0;
    }

    private void advance() {
        pos++;
        column++;
    }

    private void advanceTrackingLines() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
            pos++;
        } else {
            advance();
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
