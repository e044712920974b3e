package com.raditha.simcheck.model;

/**
 * Lexical category of a scanned token.
 * Identifiers and literals are normalized to placeholders, everything else
 * keeps its own text.
 */
public enum TokenType {
    /** End of input, produced exactly once */
    END,

    /** Identifier (normalized to var_N) */
    IDENTIFIER,

    /** Reserved word, see {@link KeywordKind} */
    KEYWORD,

    /** Numeric literal (normalized to NUM) */
    NUMBER,

    /** String literal (normalized to STR) */
    STRING,

    /** Character literal (normalized to CHAR) */
    CHARACTER,

    /** Operator, one or two characters (==, &&, ->, etc.) */
    OPERATOR,

    /** Single character separator: ( ) { } [ ] ; , . */
    PUNCTUATION
}
