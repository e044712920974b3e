package com.raditha.simcheck.model;

/**
 * Coarse classification of a similarity ratio.
 * Bands are configured through {@link com.raditha.simcheck.config.VerdictThresholds}.
 */
public enum SimilarityVerdict {
    HIGH("Highly similar, possible plagiarism"),
    MODERATE("Moderately similar, needs manual review"),
    LOW("Partially similar structure"),
    DISSIMILAR("Not similar, structures differ");

    private final String description;

    SimilarityVerdict(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
