package com.raditha.simcheck.analyzer;

import com.raditha.simcheck.model.InputFailure;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of running one input through scanner, parser and serializer.
 *
 * @param name       Input name
 * @param labels     Label sequence, null on failure
 * @param tokenCount Tokens scanned, end marker excluded
 * @param failure    Failure, null on success
 */
public record ProcessedSource(
        String name,
        @Nullable List<String> labels,
        int tokenCount,
        @Nullable InputFailure failure) {

    static ProcessedSource succeeded(String name, List<String> labels, int tokenCount) {
        return new ProcessedSource(name, labels, tokenCount, null);
    }

    static ProcessedSource failed(InputFailure failure) {
        return new ProcessedSource(failure.inputName(), null, 0, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
