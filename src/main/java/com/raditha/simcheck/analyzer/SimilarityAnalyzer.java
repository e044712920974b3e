package com.raditha.simcheck.analyzer;

import com.raditha.simcheck.config.SimilarityConfig;
import com.raditha.simcheck.io.FileSourceReader;
import com.raditha.simcheck.io.SourceReader;
import com.raditha.simcheck.model.ComparisonOutcome;
import com.raditha.simcheck.model.ComparisonResult;
import com.raditha.simcheck.model.FailureKind;
import com.raditha.simcheck.model.InputFailure;
import com.raditha.simcheck.similarity.LevenshteinSimilarity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for comparing two sources.
 * Processes each input independently, then scores the two label sequences.
 * Never prints; every outcome is returned as a {@link ComparisonOutcome}.
 */
public class SimilarityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityAnalyzer.class);

    private final SimilarityConfig config;
    private final SourceReader reader;
    private final SourceProcessor processor;
    private final LevenshteinSimilarity levenshtein;

    /**
     * Create analyzer with default configuration.
     */
    public SimilarityAnalyzer() {
        this(SimilarityConfig.standard());
    }

    /**
     * Create analyzer reading files in the configured encoding.
     */
    public SimilarityAnalyzer(SimilarityConfig config) {
        this(config, new FileSourceReader(config.charset()));
    }

    public SimilarityAnalyzer(SimilarityConfig config, SourceReader reader) {
        this.config = config;
        this.reader = reader;
        this.processor = new SourceProcessor();
        this.levenshtein = new LevenshteinSimilarity();
    }

    public SimilarityConfig getConfig() {
        return config;
    }

    /**
     * Compare two files. A file that cannot be read is reported as
     * {@link FailureKind#EMPTY_OR_UNREADABLE}.
     */
    public ComparisonOutcome compareFiles(Path fileA, Path fileB) {
        return compare(load(fileA), load(fileB));
    }

    /**
     * Compare two raw texts.
     *
     * @param nameA Name of the first input
     * @param textA Text of the first input, null if it could not be supplied
     * @param nameB Name of the second input
     * @param textB Text of the second input, null if it could not be supplied
     */
    public ComparisonOutcome compare(String nameA, @Nullable String textA, String nameB, @Nullable String textB) {
        return compare(processor.process(nameA, textA), processor.process(nameB, textB));
    }

    /**
     * Render the structural tree of a file for debugging.
     */
    public String dumpTree(Path file) throws IOException {
        return processor.dumpTree(reader.read(file));
    }

    ComparisonOutcome compare(ProcessedSource a, ProcessedSource b) {
        List<InputFailure> failures = new ArrayList<>();
        if (!a.isSuccess()) {
            failures.add(a.failure());
        }
        if (!b.isSuccess()) {
            failures.add(b.failure());
        }
        if (!failures.isEmpty()) {
            logger.debug("Comparison of {} and {} aborted: {}", a.name(), b.name(), failures);
            return ComparisonOutcome.failure(a.name(), b.name(), failures);
        }

        List<String> labelsA = a.labels();
        List<String> labelsB = b.labels();
        int distance = levenshtein.distance(labelsA, labelsB);
        double similarity = LevenshteinSimilarity.similarity(distance, labelsA.size(), labelsB.size());

        ComparisonResult result = new ComparisonResult(
                similarity,
                distance,
                labelsA.size(),
                labelsB.size(),
                a.tokenCount(),
                b.tokenCount(),
                config.thresholds().classify(similarity));

        logger.debug("{} vs {}: distance={}, similarity={}", a.name(), b.name(), distance, result.formatScore());
        return ComparisonOutcome.success(a.name(), b.name(), result);
    }

    private ProcessedSource load(Path file) {
        String name = file.toString();
        try {
            return processor.process(name, reader.read(file));
        } catch (IOException e) {
            logger.debug("Cannot read {}", file, e);
            return ProcessedSource.failed(new InputFailure(name, FailureKind.EMPTY_OR_UNREADABLE,
                    "cannot read: " + e.getMessage()));
        }
    }
}
