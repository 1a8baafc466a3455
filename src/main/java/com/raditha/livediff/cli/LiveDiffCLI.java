package com.raditha.livediff.cli;

import ch.qos.logback.classic.Level;
import com.raditha.livediff.config.DiffConfig;
import com.raditha.livediff.config.LiveDiffSettings;
import com.raditha.livediff.metrics.MetricsExporter;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.report.ReportJsonWriter;
import com.raditha.livediff.report.ReportRenderer;
import com.raditha.livediff.report.UnifiedDumpDiff;
import com.raditha.livediff.workflow.ComparisonWorkflow;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command-line interface for comparing two live-value dumps.
 * <p>
 * Usage:
 * java -jar livediff.jar [options] &lt;left&gt; &lt;right&gt;
 * <p>
 * Exit status: 0 no differences, 1 differences found, 2 usage or configuration error,
 * 3 unreadable input, 4 anything else.
 * <p>
 * Configuration priority: CLI arguments > livediff.yml > defaults
 */
@Command(name = "livediff", mixinStandardHelpOptions = true, version = "livediff v1.0.0",
        description = "Compares the \"live values at end of each block\" sections of two register allocator dumps")
@SuppressWarnings("java:S106")
public class LiveDiffCLI implements Callable<Integer> {

    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_FAILURE = 4;

    private static final String LOGGER_ROOT = "com.raditha.livediff";

    @Parameters(index = "0", description = "First debug dump file", paramLabel = "<left>")
    private Path left;

    @Parameters(index = "1", description = "Second debug dump file", paramLabel = "<right>")
    private Path right;

    @Option(names = {"--max-changed-vars-per-block", "--max-var-diffs-per-block"},
            description = "Changed variables listed per block (default: 25)", paramLabel = "<n>")
    private Integer maxChangedVars;

    @Option(names = "--max-only-vars", description = "Variables listed per 'vars only in' line (default: 50)",
            paramLabel = "<n>")
    private Integer maxOnlyVars;

    @Option(names = "--label-prefix", description = "File name prefix dropped from labels (default: debug_)",
            paramLabel = "<prefix>")
    private String labelPrefix;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", paramLabel = "<format>",
            converter = OutputFormatConverter.class)
    private OutputFormat format = OutputFormat.TEXT;

    @Option(names = "--context", description = "Context lines for the unified format (default: 3)", paramLabel = "<n>")
    private int contextLines = UnifiedDumpDiff.DEFAULT_CONTEXT_LINES;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--verbose", description = "Log parsing details to standard error")
    private boolean verbose;

    /**
     * Picocli call method - executes the comparison.
     *
     * @return 0 when the dumps are equivalent, 1 when they differ
     */
    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(LOGGER_ROOT)).setLevel(Level.DEBUG);
        }

        validateConfiguration();

        if (configFile != null) {
            LiveDiffSettings.loadConfigMap(new File(configFile));
        } else {
            LiveDiffSettings.loadConfigMap();
        }
        DiffConfig config = LiveDiffSettings.loadConfig(maxChangedVars, maxOnlyVars, labelPrefix);

        ComparisonWorkflow.Outcome outcome = new ComparisonWorkflow(config).run(left, right);
        ComparisonReport report = outcome.report();

        switch (format) {
            case JSON -> new ReportJsonWriter().print(report, System.out);
            case UNIFIED -> new UnifiedDumpDiff().diff(outcome.left(), outcome.right(), contextLines)
                    .forEach(System.out::println);
            default -> new ReportRenderer(config.maxOnlyVarsShown()).print(report, System.out);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(report);
        }

        return report.exitStatus();
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command and return its exit status instead of exiting.
     */
    public static int execute(String... args) {
        CommandLine cmd = new CommandLine(new LiveDiffCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_USAGE;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FAILURE;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_USAGE;
        });

        return cmd.execute(args);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxChangedVars != null && maxChangedVars < 0) {
            throw new IllegalArgumentException("max-changed-vars-per-block must be >= 0, got: " + maxChangedVars);
        }
        if (maxOnlyVars != null && maxOnlyVars < 0) {
            throw new IllegalArgumentException("max-only-vars must be >= 0, got: " + maxOnlyVars);
        }
        if (contextLines < 0) {
            throw new IllegalArgumentException("context must be >= 0, got: " + contextLines);
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            String exported = exportFormat.toLowerCase();
            if (!exported.equals("csv") && !exported.equals("json") && !exported.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(ComparisonReport report) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.ComparisonMetrics metrics = exporter.buildMetrics(report);

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);
        String exported = exportFormat.toLowerCase();

        if ("csv".equals(exported) || "both".equals(exported)) {
            Path csvPath = outputDir.resolve("livediff-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.err.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(exported) || "both".equals(exported)) {
            Path jsonPath = outputDir.resolve("livediff-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.err.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
