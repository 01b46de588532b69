package com.raditha.quotient.tools;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a configured command template and scores its output with a {@link ToolOutputParser}.
 * <p>
 * The argument {@code {files}} expands to the absolute path of every analysed file and
 * {@code {root}} is replaced by the repository root. Launch failures, timeouts and
 * unexpected exit codes make the pillar unavailable; there is no retry.
 */
public class CommandToolAdapter implements ExternalToolAdapter {

    private static final Logger logger = LoggerFactory.getLogger(CommandToolAdapter.class);

    static final String FILES_PLACEHOLDER = "{files}";
    static final String ROOT_PLACEHOLDER = "{root}";

    private final Pillar pillar;
    private final QualityConfig.ToolCommand command;
    private final ToolOutputParser parser;
    private final ProcessRunner runner;
    private final QualityConfig.RoleWeights roleWeights;

    public CommandToolAdapter(Pillar pillar, QualityConfig.ToolCommand command, ToolOutputParser parser,
                              ProcessRunner runner, QualityConfig.RoleWeights roleWeights) {
        this.pillar = pillar;
        this.command = command;
        this.parser = parser;
        this.runner = runner;
        this.roleWeights = roleWeights;
    }

    /**
     * Lint adapter reading Checkstyle plain output.
     */
    public static CommandToolAdapter lint(QualityConfig config, ProcessRunner runner) {
        return new CommandToolAdapter(Pillar.LINT, config.tools().lint(), new LintOutputParser(), runner,
                config.roles());
    }

    /**
     * Typing adapter reading javac diagnostics.
     */
    public static CommandToolAdapter typing(QualityConfig config, ProcessRunner runner) {
        return new CommandToolAdapter(Pillar.TYPING, config.tools().typing(),
                new TypingOutputParser(config.typing().zeroScoreDensity()), runner, config.roles());
    }

    @Override
    public Pillar pillar() {
        return pillar;
    }

    @Override
    public ToolOutcome run(RepositorySnapshot snapshot) {
        if (!command.configured()) {
            return ToolOutcome.unavailable("no " + pillar.key() + " command configured");
        }
        Optional<Path> root = snapshot.root();
        if (root.isEmpty()) {
            return ToolOutcome.unavailable("snapshot has no filesystem root");
        }

        List<String> arguments = expand(root.get(), snapshot);
        ProcessOutput output;
        try {
            output = runner.run(arguments, root.get(), Duration.ofSeconds(command.timeoutSeconds()));
        } catch (IOException e) {
            logger.warn("Could not launch {} tool {}: {}", pillar.key(), arguments.get(0), e.getMessage());
            return ToolOutcome.unavailable("failed to launch " + arguments.get(0) + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolOutcome.unavailable("interrupted while waiting for " + arguments.get(0));
        }

        if (output.timedOut()) {
            logger.warn("{} tool timed out after {}s", pillar.key(), command.timeoutSeconds());
            return ToolOutcome.unavailable("timed out after " + command.timeoutSeconds() + "s");
        }
        if (!command.acceptedExitCodes().contains(output.exitCode())) {
            logger.warn("{} tool exited with {}", pillar.key(), output.exitCode());
            return ToolOutcome.unavailable("exit code " + output.exitCode());
        }

        try {
            DiagnosticSummary summary = parser.parse(output.output(), snapshot);
            double score = weightedScore(summary.fileScores(), snapshot);
            logger.info("{}: {} diagnostics, score {}", pillar.key(), summary.diagnostics(), score);
            return ToolOutcome.available(score, summary.fileScores(), summary.diagnostics());
        } catch (RuntimeException e) {
            logger.warn("Could not read {} tool output: {}", pillar.key(), e.getMessage());
            return ToolOutcome.unavailable("unreadable output: " + e.getMessage());
        }
    }

    List<String> expand(Path root, RepositorySnapshot snapshot) {
        List<String> arguments = new ArrayList<>();
        String rootText = root.toAbsolutePath().normalize().toString();
        for (String argument : command.command()) {
            if (argument.equals(FILES_PLACEHOLDER)) {
                for (SourceFile file : snapshot.files()) {
                    arguments.add(root.resolve(file.path()).toAbsolutePath().normalize().toString());
                }
            } else {
                arguments.add(argument.replace(ROOT_PLACEHOLDER, rootText));
            }
        }
        return arguments;
    }

    /**
     * Line and role weighted mean of the file scores. Files without a score count as 1.
     */
    private double weightedScore(Map<String, Double> fileScores, RepositorySnapshot snapshot) {
        double weighted = 0.0;
        double total = 0.0;
        for (SourceFile file : snapshot.files()) {
            double weight = file.lineCount() * roleWeights.weightOf(file.role());
            weighted += fileScores.getOrDefault(file.path(), 1.0) * weight;
            total += weight;
        }
        double score = total > 0 ? weighted / total : 1.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
