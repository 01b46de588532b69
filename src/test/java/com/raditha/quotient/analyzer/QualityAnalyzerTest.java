package com.raditha.quotient.analyzer;

import com.raditha.quotient.config.InvalidConfigurationException;
import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.ClonePair;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.LayerRule;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.Report;
import com.raditha.quotient.model.Severity;
import com.raditha.quotient.normalization.ASTNormalizer;
import com.raditha.quotient.report.JsonReportWriter;
import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;
import com.raditha.quotient.source.SourceParser;
import com.raditha.quotient.tools.ProcessOutput;
import com.raditha.quotient.tools.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QualityAnalyzerTest {

    static final String SUMMARY_PATH = "src/main/java/com/acme/report/Summary.java";
    static final String TOTALS_PATH = "src/main/java/com/acme/stats/Totals.java";

    static final String SUMMARY = """
            package com.acme.report;

            public class Summary {
                private final int limit = 7;

                public int summarize(int[] values, String label) {
                    int total = 0;
                    for (int value : values) {
                        if (value > 10) {
                            total += value * 2;
                        } else {
                            total -= 1;
                        }
                    }
                    String message = label + ": " + total;
                    return message.length() + total;
                }
            }
            """;

    static final String TOTALS = """
            package com.acme.stats;

            public class Totals {
                public int combine(int[] numbers, String name) {
                    int sum = 0;
                    for (int n : numbers) {
                        if (n > 10) {
                            sum += n * 2;
                        } else {
                            sum -= 1;
                        }
                    }
                    String text = name + ": " + sum;
                    return text.length() + sum;
                }

                public String label() {
                    return "totals";
                }
            }
            """;

    private ProcessRunner runner;
    private QualityAnalyzer analyzer;
    private RepositorySnapshot snapshot;

    @BeforeEach
    void setUp() {
        runner = mock(ProcessRunner.class);
        analyzer = new QualityAnalyzer(new SourceParser(), new ASTNormalizer(), runner);
        snapshot = RepositorySnapshot.of(List.of(
                new SourceFile(TOTALS_PATH, TOTALS),
                new SourceFile(SUMMARY_PATH, SUMMARY)));
    }

    @Test
    void testConfigurationIsValidatedBeforeParsing() {
        SourceParser parser = mock(SourceParser.class);
        QualityAnalyzer guarded = new QualityAnalyzer(parser, new ASTNormalizer(), runner);
        QualityConfig config = QualityConfig.defaults()
                .withWeights(new QualityConfig.Weights(0.3, 0.3, 0.2, 0.2, 0.1));

        assertThrows(InvalidConfigurationException.class, () -> guarded.analyze(snapshot, config));
        verifyNoInteractions(parser, runner);
    }

    @Test
    void testEmptySnapshot() {
        assertThrows(EmptyRepositoryException.class,
                () -> analyzer.analyze(RepositorySnapshot.of(List.of()), QualityConfig.defaults()));
    }

    @Test
    void testCrossFileCloneIsReported() {
        Report report = analyzer.analyze(snapshot, QualityConfig.defaults());

        assertEquals(1, report.clonePairs().size());
        ClonePair pair = report.clonePairs().get(0);
        assertEquals(SUMMARY_PATH, pair.first().file());
        assertEquals(TOTALS_PATH, pair.second().file());
        assertEquals(12, pair.duplicatedLines());

        assertTrue(report.partial());
        assertTrue(report.pillar(Pillar.DUPLICATION).available());
        assertTrue(report.pillar(Pillar.DUPLICATION).score() < 1.0);
        assertFalse(report.pillar(Pillar.ARCHITECTURE).available());
        assertFalse(report.pillar(Pillar.LINT).available());
        assertEquals(0.0, report.effectiveWeights().get(Pillar.TYPING));

        assertEquals(1, report.findings().size());
        assertEquals(FindingCategory.DUPLICATION, report.findings().get(0).category());
        assertEquals(2, report.files().size());
        assertTrue(report.files().stream().allMatch(FileSummary::parsed));
    }

    @Test
    void testParseFailureBecomesFinding() {
        RepositorySnapshot withBroken = RepositorySnapshot.of(List.of(
                new SourceFile(SUMMARY_PATH, SUMMARY),
                new SourceFile("src/main/java/com/acme/Broken.java", "class Broken {\n    void m( {\n}\n")));

        Report report = analyzer.analyze(withBroken, QualityConfig.defaults());

        Finding finding = report.findings().get(0);
        assertEquals("src/main/java/com/acme/Broken.java", finding.file());
        assertEquals(FindingCategory.PARSE, finding.category());
        assertEquals(Severity.WARNING, finding.severity());
        assertTrue(finding.message().startsWith("Parse failed: "));

        FileSummary broken = report.files().get(0);
        assertFalse(broken.parsed());
        assertEquals(0, broken.tokens());
        assertTrue(report.pillar(Pillar.COMPLEXITY).available());
    }

    @Test
    void testSameInputsGiveEqualReports() {
        QualityConfig config = QualityConfig.defaults().withSeed(42);

        Report sequential = analyzer.analyze(snapshot, config.withParallelism(1));
        Report parallel = analyzer.analyze(snapshot, config.withParallelism(4));

        assertEquals(sequential, parallel);
        assertEquals(new JsonReportWriter().toJson(sequential), new JsonReportWriter().toJson(parallel));
    }

    @Test
    void testDivergentImportIsReported() {
        RepositorySnapshot layered = RepositorySnapshot.of(List.of(
                new SourceFile("src/main/java/com/acme/web/Controller.java",
                        "package com.acme.web;\n\npublic class Controller {\n}\n"),
                new SourceFile("src/main/java/com/acme/domain/Order.java",
                        "package com.acme.domain;\n\nimport com.acme.web.Controller;\n\npublic class Order {\n"
                                + "    private Controller controller;\n}\n")));
        QualityConfig config = QualityConfig.defaults().withArchitecture(new QualityConfig.ArchitectureSettings(
                List.of(new LayerRule("web", List.of("com.acme.web.**"), List.of("domain"), List.of()),
                        new LayerRule("domain", List.of("com.acme.domain.**"), List.of(), List.of())),
                null, false));

        Report report = analyzer.analyze(layered, config);

        assertEquals(0.0, report.pillar(Pillar.ARCHITECTURE).score());
        assertEquals(List.of(new LayerRelation("web", "domain")), report.absentRelations());
        Finding divergence = report.findings().get(0);
        assertEquals(Severity.ERROR, divergence.severity());
        assertEquals("src/main/java/com/acme/domain/Order.java", divergence.file());
        assertEquals(3, divergence.line());
    }

    @Test
    void testConfiguredToolOutputIsScored() throws Exception {
        RepositorySnapshot rooted = RepositorySnapshot.of(Path.of("/repo"), snapshot.files());
        QualityConfig config = QualityConfig.defaults().withTools(new QualityConfig.ToolsSettings(
                new QualityConfig.ToolCommand(List.of("checkstyle", "{files}"), 90, List.of(0)), null));
        when(runner.run(any(), any(), any()))
                .thenReturn(new ProcessOutput(0, "[ERROR] /repo/" + SUMMARY_PATH + ":6: Bad. [X]\n", false));

        Report report = analyzer.analyze(rooted, config);

        assertTrue(report.pillar(Pillar.LINT).available());
        assertTrue(report.pillar(Pillar.LINT).score() < 1.0);
        assertTrue(report.pillar(Pillar.LINT).score() > 0.99);
        assertFalse(report.pillar(Pillar.TYPING).available());
        assertTrue(report.findings().stream().noneMatch(f -> f.category() == FindingCategory.TOOL));
    }

    @Test
    void testConfiguredToolFailureIsWarned() throws Exception {
        RepositorySnapshot rooted = RepositorySnapshot.of(Path.of("/repo"), snapshot.files());
        QualityConfig config = QualityConfig.defaults().withTools(new QualityConfig.ToolsSettings(
                new QualityConfig.ToolCommand(List.of("checkstyle", "{files}"), 90, List.of(0)), null));
        when(runner.run(any(), any(), any())).thenThrow(new IOException("boom"));

        Report report = analyzer.analyze(rooted, config);

        assertFalse(report.pillar(Pillar.LINT).available());
        Finding warning = report.findings().get(0);
        assertEquals(FindingCategory.TOOL, warning.category());
        assertTrue(warning.repositoryLevel());
        assertEquals(Finding.REPOSITORY, warning.file());
        assertEquals(0, warning.line());
        assertEquals("lint unavailable: failed to launch checkstyle: boom", warning.message());
    }
}
