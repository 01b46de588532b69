package com.raditha.quotient.tools;

import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses javac diagnostics such as {@code src/A.java:7: error: incompatible types}.
 * Warnings and notes are ignored. A file's score falls linearly with its error
 * density (errors per 1000 lines) and reaches 0 at the configured density.
 */
public class TypingOutputParser implements ToolOutputParser {

    private static final Pattern LINE = Pattern.compile("^(.+?):(\\d+): error: (.*)$");

    private final double zeroScoreDensity;

    public TypingOutputParser(double zeroScoreDensity) {
        this.zeroScoreDensity = zeroScoreDensity;
    }

    @Override
    public DiagnosticSummary parse(String output, RepositorySnapshot snapshot) {
        Map<String, Integer> errors = new HashMap<>();
        int diagnostics = 0;

        for (String line : output.split("\\R")) {
            Matcher matcher = LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            Optional<String> path = ToolOutputParser.resolvePath(matcher.group(1), snapshot);
            if (path.isPresent()) {
                errors.merge(path.get(), 1, Integer::sum);
                diagnostics++;
            }
        }

        Map<String, Double> scores = new TreeMap<>();
        for (SourceFile file : snapshot.files()) {
            int count = errors.getOrDefault(file.path(), 0);
            double density = count * 1000.0 / Math.max(1, file.lineCount());
            scores.put(file.path(), Math.max(0.0, 1.0 - density / zeroScoreDensity));
        }
        return new DiagnosticSummary(scores, diagnostics);
    }
}
