package com.raditha.simcheck.model;

/**
 * Result of comparing two sources structurally.
 *
 * @param similarity  Similarity ratio (0.0-1.0)
 * @param distance    Edit distance between the two label sequences
 * @param lengthA     Label sequence length of the first input
 * @param lengthB     Label sequence length of the second input
 * @param tokenCountA Token count of the first input (end marker excluded)
 * @param tokenCountB Token count of the second input (end marker excluded)
 * @param verdict     Classification of the similarity ratio
 */
public record ComparisonResult(
        double similarity,
        int distance,
        int lengthA,
        int lengthB,
        int tokenCountA,
        int tokenCountB,
        SimilarityVerdict verdict) {

    public ComparisonResult {
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0, got " + similarity);
        }
        if (distance < 0) {
            throw new IllegalArgumentException("distance must be >= 0");
        }
    }

    /**
     * Get similarity percentage (0-100).
     */
    public double getSimilarityPercentage() {
        return similarity * 100.0;
    }

    /**
     * Format score as percentage string.
     */
    public String formatScore() {
        return String.format("%.2f%%", getSimilarityPercentage());
    }

    public boolean exceedsThreshold(double threshold) {
        return similarity >= threshold;
    }
}
