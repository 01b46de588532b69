package com.raditha.quotient.report;

import com.raditha.quotient.model.ConfidenceInterval;
import com.raditha.quotient.model.Report;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownReportWriterTest {

    private MarkdownReportWriter writer;
    private Report report;

    @BeforeEach
    void setUp() {
        writer = new MarkdownReportWriter();
        report = ReportFixtures.sample();
    }

    @Test
    void testHeader() {
        String md = writer.toMarkdown(report);

        assertTrue(md.startsWith("# Code Quality Report\n"));
        assertTrue(md.contains("**Overall score:** 72.5 / 100 (partial)"));
        assertTrue(md.contains("**Confidence:** 70.0 - 75.0 at 95% (2 samples, 1000 resamples)"));
    }

    @Test
    void testPillarTable() {
        String md = writer.toMarkdown(report);

        assertTrue(md.contains("| duplication | 0.900 | 0.38 | 0.850 - 0.950 |  |"));
        assertTrue(md.contains("| lint | n/a | 0.00 |  | no lint command configured |"));
        assertTrue(md.contains("exit code 2 \\| see log"));
    }

    @Test
    void testFindingsAndClones() {
        String md = writer.toMarkdown(report);

        assertTrue(md.contains("## Findings (3)"));
        assertTrue(md.contains("| WARNING | TOOL | `(repository)` | typing unavailable: exit code 2 |"));
        assertTrue(md.contains("`src/a/Summary.java:3`"));
        assertTrue(md.contains("## Clone pairs (1)"));
        assertTrue(md.contains("1. `src/a/Summary.java:6-17` and `src/b/Totals.java:4-15`: 58 tokens, 12 lines"));
        assertTrue(md.contains("## Absent relations\n\n- web -> domain\n"));
    }

    @Test
    void testFilesOrderedByGrade() {
        String md = writer.toMarkdown(report);

        int summary = md.indexOf("| `src/a/Summary.java` | default | 18 | 65.0 | 70.0% | 4 |");
        int totals = md.indexOf("| `src/b/Totals.java` | default | 19 | 80.0 | 60.0% | 4 |");
        assertTrue(summary > 0);
        assertTrue(totals > summary);
    }

    @Test
    void testEmptySections() {
        Report clean = new Report(100.0, false, report.pillars(), report.effectiveWeights(),
                new ConfidenceInterval(100.0, 100.0, 100.0, 0.95, 1, 1000), report.pillarIntervals(),
                List.of(), List.of(), List.of(), report.files());

        String md = writer.toMarkdown(clean);

        assertTrue(md.contains("**Overall score:** 100.0 / 100\n"));
        assertTrue(md.contains("No findings."));
        assertTrue(md.contains("## Clone pairs (0)"));
        assertFalse(md.contains("## Absent relations"));
    }
}
