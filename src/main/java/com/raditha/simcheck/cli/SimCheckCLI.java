package com.raditha.simcheck.cli;

import ch.qos.logback.classic.Level;
import com.raditha.simcheck.analyzer.SimilarityAnalyzer;
import com.raditha.simcheck.config.SimilarityConfig;
import com.raditha.simcheck.config.SimilaritySettings;
import com.raditha.simcheck.metrics.ResultExporter;
import com.raditha.simcheck.model.ComparisonOutcome;
import com.raditha.simcheck.model.ComparisonResult;
import com.raditha.simcheck.model.InputFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the similarity checker.
 * <p>
 * Usage:
 * java -jar simcheck.jar [options] &lt;fileA&gt; &lt;fileB&gt;
 * <p>
 * Configuration priority: CLI arguments > simcheck.yml > defaults
 */
@Command(name = "simcheck", mixinStandardHelpOptions = true, version = "simcheck v1.0.0",
        description = "Structural source similarity checker")
@SuppressWarnings("java:S106")
public class SimCheckCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(SimCheckCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPARISON_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    @Parameters(index = "0", description = "First source file", paramLabel = "<fileA>")
    private Path fileA;

    @Parameters(index = "1", description = "Second source file", paramLabel = "<fileB>")
    private Path fileB;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--strict", description = "Strict preset (95%% high, 75%% moderate, 40%% low)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (80%% high, 50%% moderate, 20%% low)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--dump-tree", description = "Print the structural tree of both inputs")
    private boolean dumpTree = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics (default: current directory)",
            paramLabel = "<path>")
    private Path outputPath;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 when the comparison produced a score)
     */
    @Override
    public Integer call() throws Exception {
        configureLogging();
        validateConfiguration();

        String preset = null;
        if (strict) {
            preset = "strict";
        } else if (lenient) {
            preset = "lenient";
        }
        SimilarityConfig config = SimilaritySettings.loadConfig(configFile, preset);
        SimilarityAnalyzer analyzer = new SimilarityAnalyzer(config);

        if (dumpTree) {
            printTree(analyzer, fileA);
            printTree(analyzer, fileB);
        }

        ComparisonOutcome outcome = analyzer.compareFiles(fileA, fileB);
        ResultExporter exporter = new ResultExporter();

        if (jsonOutput) {
            System.out.println(exporter.toJson(exporter.buildMetrics(outcome)));
        } else {
            printTextReport(outcome);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(exporter, outcome);
        }

        return outcome.isSuccess() ? EXIT_OK : EXIT_COMPARISON_FAILED;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Build the command line with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new SimCheckCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG_ERROR;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_COMPARISON_FAILED;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG_ERROR;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (strict && lenient) {
            throw new IllegalArgumentException("Cannot use both --strict and --lenient presets simultaneously");
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        }
    }

    private static void printTree(SimilarityAnalyzer analyzer, Path file) {
        System.out.println("Structural tree of " + file + ":");
        try {
            System.out.print(analyzer.dumpTree(file));
        } catch (IOException e) {
            // the comparison itself reports the unreadable input
            logger.debug("Cannot dump tree of {}", file, e);
            System.out.println("  (unreadable: " + e.getMessage() + ")");
        } catch (StackOverflowError | OutOfMemoryError e) {
            // the comparison reports the same input as a parse failure
            logger.warn("Cannot dump tree of {} ({})", file, e.getClass().getSimpleName());
            System.out.println(e instanceof StackOverflowError ? "  (nesting too deep)" : "  (out of memory)");
        }
        System.out.println();
    }

    private static void printTextReport(ComparisonOutcome outcome) {
        System.out.println("=".repeat(60));
        System.out.println("STRUCTURAL SIMILARITY REPORT");
        System.out.println("=".repeat(60));
        System.out.println("File A: " + outcome.inputA());
        System.out.println("File B: " + outcome.inputB());
        System.out.println("-".repeat(60));

        ComparisonResult result = outcome.result();
        if (result == null) {
            System.out.println("Comparison failed:");
            for (InputFailure failure : outcome.failures()) {
                System.out.println("  " + failure);
            }
            System.out.println("=".repeat(60));
            return;
        }

        System.out.printf("Tokens:          A=%d, B=%d%n", result.tokenCountA(), result.tokenCountB());
        System.out.printf("Sequence length: A=%d, B=%d%n", result.lengthA(), result.lengthB());
        System.out.printf("Edit distance:   %d%n", result.distance());
        System.out.printf("Similarity:      %s%n", result.formatScore());
        System.out.printf("Verdict:         %s%n", result.verdict().description());
        System.out.println("=".repeat(60));
    }

    private void exportMetrics(ResultExporter exporter, ComparisonOutcome outcome) throws IOException {
        Path outputDir = outputPath != null ? outputPath : Path.of(".");
        Files.createDirectories(outputDir);

        ResultExporter.ComparisonMetrics metrics = exporter.buildMetrics(outcome);
        String format = exportFormat.toLowerCase();

        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve(ResultExporter.CSV_FILE);
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }
        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve(ResultExporter.JSON_FILE);
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
