package com.raditha.simcheck.config;

import com.raditha.simcheck.model.SimilarityVerdict;

/**
 * Lower bounds of the verdict bands.
 *
 * @param high     Minimum similarity for {@link SimilarityVerdict#HIGH} (0.0-1.0)
 * @param moderate Minimum similarity for {@link SimilarityVerdict#MODERATE} (0.0-1.0)
 * @param low      Minimum similarity for {@link SimilarityVerdict#LOW} (0.0-1.0)
 */
public record VerdictThresholds(double high, double moderate, double low) {

    /**
     * Validate thresholds are in range and non-increasing.
     */
    public VerdictThresholds {
        requireRatio("high", high);
        requireRatio("moderate", moderate);
        requireRatio("low", low);
        if (high < moderate || moderate < low) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds must satisfy high >= moderate >= low, got %.2f/%.2f/%.2f", high, moderate, low));
        }
    }

    /**
     * Standard bands: 90% high, 60% moderate, 30% low.
     */
    public static VerdictThresholds standard() {
        return new VerdictThresholds(0.90, 0.60, 0.30);
    }

    /**
     * Strict bands: only near-identical structure is flagged as high.
     */
    public static VerdictThresholds strict() {
        return new VerdictThresholds(0.95, 0.75, 0.40);
    }

    /**
     * Lenient bands: flags more pairs for review.
     */
    public static VerdictThresholds lenient() {
        return new VerdictThresholds(0.80, 0.50, 0.20);
    }

    public SimilarityVerdict classify(double similarity) {
        if (similarity >= high) {
            return SimilarityVerdict.HIGH;
        }
        if (similarity >= moderate) {
            return SimilarityVerdict.MODERATE;
        }
        if (similarity >= low) {
            return SimilarityVerdict.LOW;
        }
        return SimilarityVerdict.DISSIMILAR;
    }

    private static void requireRatio(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " threshold must be between 0.0 and 1.0");
        }
    }
}
