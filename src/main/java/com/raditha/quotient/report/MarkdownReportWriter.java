package com.raditha.quotient.report;

import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.Report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;

/**
 * Human readable rendering of a {@link Report}.
 */
public class MarkdownReportWriter {

    static final int MAX_FILES = 25;

    public String toMarkdown(Report report) {
        StringBuilder md = new StringBuilder();
        ConfidenceInterval ci = report.confidence();

        md.append("# Code Quality Report\n\n");
        md.append(String.format(Locale.ROOT, "**Overall score:** %.1f / 100%s%n%n",
                report.overallScore(), report.partial() ? " (partial)" : ""));
        md.append(String.format(Locale.ROOT, "**Confidence:** %.1f - %.1f at %.0f%% (%d samples, %d resamples)%n%n",
                ci.low(), ci.high(), ci.level() * 100, ci.sampleSize(), ci.resamples()));

        appendPillars(md, report);
        appendFindings(md, report);
        appendClones(md, report);
        appendAbsentRelations(md, report);
        appendFiles(md, report);
        return md.toString();
    }

    public void write(Report report, Path path) throws IOException {
        Files.writeString(path, toMarkdown(report), StandardCharsets.UTF_8);
    }

    private void appendPillars(StringBuilder md, Report report) {
        md.append("## Pillars\n\n");
        md.append("| Pillar | Score | Weight | Interval | Note |\n");
        md.append("|---|---:|---:|---|---|\n");
        for (Pillar pillar : Pillar.values()) {
            PillarScore score = report.pillar(pillar);
            ConfidenceInterval interval = report.pillarIntervals().get(pillar);
            md.append(String.format(Locale.ROOT, "| %s | %s | %.2f | %s | %s |%n",
                    pillar.key(),
                    score.available() ? String.format(Locale.ROOT, "%.3f", score.score()) : "n/a",
                    report.effectiveWeights().getOrDefault(pillar, 0.0),
                    interval == null ? "" : String.format(Locale.ROOT, "%.3f - %.3f", interval.low(), interval.high()),
                    score.available() ? "" : escape(score.reason())));
        }
        md.append("\n");
    }

    private void appendFindings(StringBuilder md, Report report) {
        md.append(String.format(Locale.ROOT, "## Findings (%d)%n%n", report.findings().size()));
        if (report.findings().isEmpty()) {
            md.append("No findings.\n\n");
            return;
        }
        md.append("| Severity | Category | Location | Message |\n");
        md.append("|---|---|---|---|\n");
        for (Finding finding : report.findings()) {
            String location = finding.repositoryLevel() ? "(repository)" : finding.file() + ":" + finding.line();
            md.append(String.format(Locale.ROOT, "| %s | %s | `%s` | %s |%n",
                    finding.severity(), finding.category(), location, escape(finding.message())));
        }
        md.append("\n");
    }

    private void appendClones(StringBuilder md, Report report) {
        md.append(String.format(Locale.ROOT, "## Clone pairs (%d)%n%n", report.clonePairs().size()));
        int index = 1;
        for (ClonePair pair : report.clonePairs()) {
            md.append(String.format(Locale.ROOT, "%d. `%s:%d-%d` and `%s:%d-%d`: %d tokens, %d lines%n",
                    index++,
                    pair.first().file(), pair.first().startLine(), pair.first().endLine(),
                    pair.second().file(), pair.second().startLine(), pair.second().endLine(),
                    pair.tokenLength(), pair.duplicatedLines()));
        }
        md.append("\n");
    }

    private void appendAbsentRelations(StringBuilder md, Report report) {
        if (report.absentRelations().isEmpty()) {
            return;
        }
        md.append("## Absent relations\n\n");
        for (LayerRelation relation : report.absentRelations()) {
            md.append("- ").append(relation.fromLayer()).append(" -> ").append(relation.toLayer()).append("\n");
        }
        md.append("\n");
    }

    /**
     * Lowest graded files first.
     */
    private void appendFiles(StringBuilder md, Report report) {
        md.append("## Lowest graded files\n\n");
        md.append("| File | Role | Lines | Grade | Duplication | Complexity |\n");
        md.append("|---|---|---:|---:|---:|---:|\n");
        report.files().stream()
                .sorted(Comparator.comparingDouble(FileSummary::grade).thenComparing(FileSummary::path))
                .limit(MAX_FILES)
                .forEach(file -> md.append(String.format(Locale.ROOT, "| `%s` | %s | %d | %.1f | %.1f%% | %.0f |%n",
                        file.path(), file.role().key(), file.lines(), file.grade(),
                        file.duplicationRatio() * 100, file.complexity())));
        md.append("\n");
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("|", "\\|");
    }
}
