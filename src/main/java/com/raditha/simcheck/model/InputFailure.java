package com.raditha.simcheck.model;

/**
 * Failure of one input of a comparison.
 *
 * @param inputName Name of the input (usually the file path)
 * @param kind      Failure category
 * @param detail    Human readable detail, e.g. the I/O error message
 */
public record InputFailure(String inputName, FailureKind kind, String detail) {

    public InputFailure(String inputName, FailureKind kind) {
        this(inputName, kind, kind.description());
    }

    @Override
    public String toString() {
        return inputName + ": " + detail;
    }
}
