package com.raditha.simcheck.similarity;

import java.util.List;
import java.util.Objects;

/**
 * Calculates similarity using Levenshtein edit distance over label sequences.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinSimilarity {

    /**
     * Calculate Levenshtein-based similarity between two label sequences.
     *
     * @param labels1 First label sequence
     * @param labels2 Second label sequence
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(List<String> labels1, List<String> labels2) {
        int distance = distance(labels1, labels2);
        return similarity(distance, labels1.size(), labels2.size());
    }

    /**
     * Convert an edit distance to a similarity: 1 - distance / maxLength.
     * Two empty sequences are a perfect match.
     */
    public static double similarity(int distance, int length1, int length2) {
        int maxLength = Math.max(length1, length2);
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) distance / maxLength);
    }

    /**
     * Compute Levenshtein edit distance using space-optimized DP.
     * Uses only O(min(m,n)) space instead of O(m*n).
     *
     * @return Number of insertions, deletions and substitutions needed
     */
    public int distance(List<String> labels1, List<String> labels2) {
        Objects.requireNonNull(labels1, "labels1");
        Objects.requireNonNull(labels2, "labels2");

        // Ensure the shorter sequence is the inner dimension
        SequencePair pair = ensureShorterFirst(labels1, labels2);

        int m = pair.shorter().size();
        int n = pair.longer().size();
        if (m == 0) {
            return n;
        }

        // Use rolling array - only need current and previous row
        RollingArrays arrays = new RollingArrays(m);

        for (int i = 0; i <= m; i++) {
            arrays.prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            arrays.curr[0] = j;
            String label = pair.longer().get(j - 1);

            for (int i = 1; i <= m; i++) {
                int cost = label.equals(pair.shorter().get(i - 1)) ? 0 : 1;
                arrays.curr[i] = Math.min(
                        Math.min(arrays.prev[i] + 1, arrays.curr[i - 1] + 1), // delete or insert
                        arrays.prev[i - 1] + cost); // replace
            }

            arrays.swap();
        }

        return arrays.prev[m];
    }

    static SequencePair ensureShorterFirst(List<String> labels1, List<String> labels2) {
        if (labels1.size() > labels2.size()) {
            return new SequencePair(labels2, labels1);
        }
        return new SequencePair(labels1, labels2);
    }

    /**
     * Two DP rows swapped after each outer iteration.
     */
    static class RollingArrays {
        int[] prev;
        int[] curr;

        RollingArrays(int size) {
            this.prev = new int[size + 1];
            this.curr = new int[size + 1];
        }

        void swap() {
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
    }

    record SequencePair(List<String> shorter, List<String> longer) {
    }
}
