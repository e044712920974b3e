package com.raditha.simcheck.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Either a comparison result or the failures that prevented one.
 * Exactly one of {@code result} and {@code failures} is populated.
 *
 * @param inputA   Name of the first input
 * @param inputB   Name of the second input
 * @param result   Comparison result, null on failure
 * @param failures Per-input failures, empty on success
 */
public record ComparisonOutcome(
        String inputA,
        String inputB,
        @Nullable ComparisonResult result,
        List<InputFailure> failures) {

    public ComparisonOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
        if ((result == null) == failures.isEmpty()) {
            throw new IllegalArgumentException("An outcome carries either a result or failures");
        }
    }

    public static ComparisonOutcome success(String inputA, String inputB, ComparisonResult result) {
        return new ComparisonOutcome(inputA, inputB, result, List.of());
    }

    public static ComparisonOutcome failure(String inputA, String inputB, List<InputFailure> failures) {
        return new ComparisonOutcome(inputA, inputB, null, failures);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
