package com.raditha.quotient.cli;

import com.raditha.quotient.analyzer.EmptyRepositoryException;
import com.raditha.quotient.analyzer.QualityAnalyzer;
import com.raditha.quotient.config.ConfigLoader;
import com.raditha.quotient.config.InvalidConfigurationException;
import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.Report;
import com.raditha.quotient.report.JsonReportWriter;
import com.raditha.quotient.report.MarkdownReportWriter;
import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SnapshotLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the quality analyzer.
 * <p>
 * Usage:
 * java -jar code-quotient.jar scan [options] &lt;path&gt;
 * <p>
 * Configuration priority: CLI arguments &gt; config file &gt; defaults. Without
 * {@code --config-file} a {@value #DEFAULT_CONFIG_NAME} at the scanned root is used when present.
 */
@Command(name = "quotient", mixinStandardHelpOptions = true, version = "Quotient v" + QuotientCLI.VERSION,
        description = "Deterministic code quality analyzer",
        subcommands = {QuotientCLI.ScanCommand.class, QuotientCLI.ExampleConfigCommand.class})
@SuppressWarnings("java:S106")
public class QuotientCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0";
    static final String DEFAULT_CONFIG_NAME = "quotient.yml";
    static final String JSON_REPORT_NAME = "quotient-report.json";
    static final String MARKDOWN_REPORT_NAME = "quotient-report.md";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_EMPTY = 4;

    @Spec
    CommandLine.Model.CommandSpec spec;

    /**
     * Without a subcommand only the usage is printed.
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_CONFIG;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with exit code mapping for failures.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new QuotientCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof InvalidConfigurationException invalid) {
                commandLine.getErr().println("Configuration error:");
                invalid.getProblems().forEach(p -> commandLine.getErr().println("  - " + p));
                return EXIT_CONFIG;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof EmptyRepositoryException) {
                commandLine.getErr().println("Nothing to analyze: " + ex.getMessage());
                return EXIT_EMPTY;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FAILURE;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Report formats accepted by {@code --format}.
     */
    public enum OutputFormat {
        JSON, MD, BOTH;

        static OutputFormat fromString(String value) {
            return switch (value.toLowerCase()) {
                case "json" -> JSON;
                case "md", "markdown" -> MD;
                case "both" -> BOTH;
                default -> throw new IllegalArgumentException(
                        "Invalid format: " + value + ". Must be: json, md, or both");
            };
        }

        boolean includesJson() {
            return this != MD;
        }

        boolean includesMarkdown() {
            return this != JSON;
        }
    }

    /**
     * Picocli converter for {@link OutputFormat}.
     */
    static class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            try {
                return OutputFormat.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @Command(name = "scan", mixinStandardHelpOptions = true, description = "Analyze a source tree and report its quality")
    static class ScanCommand implements Callable<Integer> {

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Parameters(index = "0", paramLabel = "<path>", description = "Root of the repository to analyze")
        Path root;

        @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
        Path configFile;

        @Option(names = "--output", description = "Directory for report files (default: print to stdout)",
                paramLabel = "<dir>")
        Path outputDir;

        @Option(names = "--format", description = "Report format: json, md or both (default: json)",
                paramLabel = "<format>", converter = OutputFormatConverter.class)
        OutputFormat format = OutputFormat.JSON;

        @Option(names = "--seed", description = "Override the bootstrap seed", paramLabel = "<n>")
        Long seed;

        @Option(names = "--parallelism", description = "Worker threads, 0 for all processors", paramLabel = "<n>")
        Integer parallelism;

        @Override
        public Integer call() throws IOException {
            validateArguments();
            QualityConfig config = loadConfig();

            RepositorySnapshot snapshot = new SnapshotLoader(config.paths().exclude()).load(root);
            Report report = new QualityAnalyzer().analyze(snapshot, config);
            writeReport(report);
            return EXIT_OK;
        }

        /**
         * Validate CLI arguments before touching the repository.
         *
         * @throws IllegalArgumentException if an argument is invalid
         */
        void validateArguments() {
            if (!Files.isDirectory(root)) {
                throw new IllegalArgumentException("Path not found or not a directory: " + root);
            }
            if (parallelism != null && parallelism < 0) {
                throw new IllegalArgumentException("Parallelism must be >= 0, got: " + parallelism);
            }
            if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputDir);
            }
        }

        QualityConfig loadConfig() throws IOException {
            QualityConfig config;
            if (configFile != null) {
                config = ConfigLoader.load(configFile);
            } else if (Files.isRegularFile(root.resolve(DEFAULT_CONFIG_NAME))) {
                config = ConfigLoader.load(root.resolve(DEFAULT_CONFIG_NAME));
            } else {
                config = QualityConfig.defaults();
            }
            if (seed != null) {
                config = config.withSeed(seed);
            }
            if (parallelism != null) {
                config = config.withParallelism(parallelism);
            }
            return config;
        }

        private void writeReport(Report report) throws IOException {
            PrintWriter out = spec.commandLine().getOut();
            if (outputDir == null) {
                if (format.includesMarkdown()) {
                    out.print(new MarkdownReportWriter().toMarkdown(report));
                }
                if (format.includesJson()) {
                    out.println(new JsonReportWriter().toJson(report));
                }
                out.flush();
                return;
            }

            Files.createDirectories(outputDir);
            if (format.includesJson()) {
                Path target = outputDir.resolve(JSON_REPORT_NAME);
                new JsonReportWriter().write(report, target);
                out.println("JSON report: " + target);
            }
            if (format.includesMarkdown()) {
                Path target = outputDir.resolve(MARKDOWN_REPORT_NAME);
                new MarkdownReportWriter().write(report, target);
                out.println("Markdown report: " + target);
            }
            out.println(report.getSummary());
            out.flush();
        }
    }

    @Command(name = "example-config", mixinStandardHelpOptions = true,
            description = "Print the default configuration as YAML")
    static class ExampleConfigCommand implements Callable<Integer> {

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.print(ConfigLoader.toYaml(QualityConfig.defaults()));
            out.flush();
            return EXIT_OK;
        }
    }
}
