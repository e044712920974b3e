package com.raditha.simcheck.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reserved words recognised by the scanner.
 * Control keywords carry their own leaf label; type keywords collapse to {@code KW}.
 */
public enum KeywordKind {
    IF("if", "IF"),
    ELSE("else", "ELSE"),
    FOR("for", "FOR"),
    WHILE("while", "WHILE"),
    DO("do", "DO"),
    SWITCH("switch", "SWITCH"),
    CASE("case", "CASE"),
    DEFAULT("default", "DEFAULT"),
    RETURN("return", "RETURN"),
    BREAK("break", "BREAK"),
    CONTINUE("continue", "CONTINUE"),
    INT("int", "KW"),
    CHAR("char", "KW"),
    FLOAT("float", "KW"),
    DOUBLE("double", "KW"),
    VOID("void", "KW"),
    STRUCT("struct", "KW"),
    TYPEDEF("typedef", "KW"),

    /** Not a keyword */
    UNKNOWN(null, "KW");

    private static final Map<String, KeywordKind> BY_WORD = Stream.of(values())
            .filter(k -> k.word != null)
            .collect(Collectors.toUnmodifiableMap(k -> k.word, Function.identity()));

    private final String word;
    private final String label;

    KeywordKind(String word, String label) {
        this.word = word;
        this.label = label;
    }

    public String word() {
        return word;
    }

    /**
     * Label used when a token of this kind becomes a tree leaf.
     */
    public String label() {
        return label;
    }

    /**
     * Look up a scanned word in the keyword table.
     *
     * @return the matching kind, or {@link #UNKNOWN} for ordinary identifiers
     */
    public static KeywordKind lookup(String word) {
        return BY_WORD.getOrDefault(word, UNKNOWN);
    }
}
