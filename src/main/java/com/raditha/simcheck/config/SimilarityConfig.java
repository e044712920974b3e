package com.raditha.simcheck.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Configuration for a similarity check.
 *
 * @param thresholds Verdict bands applied to the similarity ratio
 * @param charset    Encoding used to read source files
 */
public record SimilarityConfig(
        VerdictThresholds thresholds,
        Charset charset) {

    public SimilarityConfig {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (charset == null) {
            charset = StandardCharsets.UTF_8;
        }
    }

    /**
     * Standard preset, the default for most checks.
     */
    public static SimilarityConfig standard() {
        return new SimilarityConfig(VerdictThresholds.standard(), StandardCharsets.UTF_8);
    }

    public static SimilarityConfig strict() {
        return new SimilarityConfig(VerdictThresholds.strict(), StandardCharsets.UTF_8);
    }

    public static SimilarityConfig lenient() {
        return new SimilarityConfig(VerdictThresholds.lenient(), StandardCharsets.UTF_8);
    }

    /**
     * Resolve a preset by name; unknown names fall back to standard.
     */
    public static SimilarityConfig preset(String name) {
        return switch (name) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> standard();
        };
    }
}
