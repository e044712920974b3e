package com.raditha.simcheck.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.simcheck.model.ComparisonOutcome;
import com.raditha.simcheck.model.ComparisonResult;
import com.raditha.simcheck.model.InputFailure;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Exports comparison metrics to CSV and JSON for archiving and dashboards.
 */
public class ResultExporter {

    public static final String CSV_FILE = "simcheck-report.csv";
    public static final String JSON_FILE = "simcheck-report.json";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Flat view of one comparison. Score fields are null when the comparison failed.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComparisonMetrics(
            LocalDateTime timestamp,
            String inputA,
            String inputB,
            String status,
            @Nullable Double similarity,
            @Nullable Integer distance,
            @Nullable Integer lengthA,
            @Nullable Integer lengthB,
            @Nullable Integer tokenCountA,
            @Nullable Integer tokenCountB,
            @Nullable String verdict,
            List<String> failures) {
    }

    /**
     * Build metrics from a comparison outcome.
     */
    public ComparisonMetrics buildMetrics(ComparisonOutcome outcome) {
        ComparisonResult result = outcome.result();
        List<String> failures = outcome.failures().stream()
                .map(InputFailure::toString)
                .toList();

        if (result == null) {
            return new ComparisonMetrics(LocalDateTime.now(), outcome.inputA(), outcome.inputB(), "FAILED",
                    null, null, null, null, null, null, null, failures);
        }
        return new ComparisonMetrics(
                LocalDateTime.now(),
                outcome.inputA(),
                outcome.inputB(),
                "OK",
                result.similarity(),
                result.distance(),
                result.lengthA(),
                result.lengthB(),
                result.tokenCountA(),
                result.tokenCountB(),
                result.verdict().name(),
                failures);
    }

    /**
     * Export metrics to CSV format: a header line and one row.
     */
    public void exportToCsv(ComparisonMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        csv.append("timestamp,input_a,input_b,status,similarity,distance,length_a,length_b,tokens_a,tokens_b,verdict,failures\n");
        csv.append(String.join(",",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                escape(metrics.inputA()),
                escape(metrics.inputB()),
                metrics.status(),
                metrics.similarity() == null ? "" : String.format(Locale.ROOT, "%.4f", metrics.similarity()),
                orEmpty(metrics.distance()),
                orEmpty(metrics.lengthA()),
                orEmpty(metrics.lengthB()),
                orEmpty(metrics.tokenCountA()),
                orEmpty(metrics.tokenCountB()),
                orEmpty(metrics.verdict()),
                escape(String.join("; ", metrics.failures()))));
        csv.append("\n");

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ComparisonMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Render metrics as a JSON document.
     */
    public String toJson(ComparisonMetrics metrics) throws IOException {
        return mapper.writeValueAsString(metrics);
    }

    private static String orEmpty(@Nullable Object value) {
        return value == null ? "" : value.toString();
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
