package com.raditha.quotient.tools;

import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Checkstyle plain output such as
 * {@code [WARN] /repo/src/A.java:12:5: Line is longer than 100 characters. [LineLength]}.
 * <p>
 * Each file starts at 100 points and loses 1 per error, 0.5 per warning and 0.25 per
 * info; the file score is the remainder over 100, floored at 0.
 */
public class LintOutputParser implements ToolOutputParser {

    private static final Logger logger = LoggerFactory.getLogger(LintOutputParser.class);

    private static final Pattern LINE = Pattern.compile(
            "^\\[(ERROR|WARN|WARNING|INFO)]\\s+(.+?):(\\d+)(?::(\\d+))?:\\s*(.*)$");

    static final double ERROR_WEIGHT = 1.0;
    static final double WARN_WEIGHT = 0.5;
    static final double INFO_WEIGHT = 0.25;

    @Override
    public DiagnosticSummary parse(String output, RepositorySnapshot snapshot) {
        Map<String, Double> penalties = new HashMap<>();
        int diagnostics = 0;

        for (String line : output.split("\\R")) {
            Matcher matcher = LINE.matcher(line.trim());
            if (!matcher.matches()) {
                continue;
            }
            Optional<String> path = ToolOutputParser.resolvePath(matcher.group(2), snapshot);
            if (path.isEmpty()) {
                logger.debug("Ignoring lint diagnostic for unknown file {}", matcher.group(2));
                continue;
            }
            penalties.merge(path.get(), weightOf(matcher.group(1)), Double::sum);
            diagnostics++;
        }

        Map<String, Double> scores = new TreeMap<>();
        for (SourceFile file : snapshot.files()) {
            double penalty = penalties.getOrDefault(file.path(), 0.0);
            scores.put(file.path(), Math.max(0.0, 100.0 - penalty) / 100.0);
        }
        return new DiagnosticSummary(scores, diagnostics);
    }

    static double weightOf(String level) {
        return switch (level.toUpperCase(Locale.ROOT)) {
            case "ERROR" -> ERROR_WEIGHT;
            case "WARN", "WARNING" -> WARN_WEIGHT;
            default -> INFO_WEIGHT;
        };
    }
}
