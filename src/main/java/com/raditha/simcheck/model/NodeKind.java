package com.raditha.simcheck.model;

/**
 * Kind of node in the structural tree.
 * Only functions, blocks and control structures are modelled; everything else
 * is kept as runs of {@link #TOKEN} leaves under {@link #STMT} or {@link #EXPR}.
 */
public enum NodeKind {
    PROGRAM,
    FUNCTION,
    BLOCK,

    IF,
    FOR,
    WHILE,
    DO_WHILE,
    SWITCH,
    CASE,
    DEFAULT,

    RETURN,
    BREAK,
    CONTINUE,

    /** Generic statement, also used for function headers */
    STMT,

    /** Expression bag: parenthesized header, case label or return value */
    EXPR,

    /** Leaf holding a single token label */
    TOKEN
}
