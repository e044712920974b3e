package com.raditha.simcheck.model;

/**
 * Reason a single input could not take part in a comparison.
 */
public enum FailureKind {
    /** Text missing or the source could not be read */
    EMPTY_OR_UNREADABLE("empty or unreadable input"),

    /** Readable, but only whitespace and comments */
    ZERO_TOKENS("no tokens produced"),

    /** Resources ran out while building the tree */
    PARSE_FAILURE("parse failure"),

    /** Resources ran out while flattening the tree */
    SERIALIZATION_FAILURE("serialization failure");

    private final String description;

    FailureKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
