package com.raditha.quotient.tools;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CommandToolAdapterTest {

    private static final Path ROOT = Path.of("/repo");

    private ProcessRunner runner;
    private RepositorySnapshot snapshot;

    @BeforeEach
    void setUp() {
        runner = mock(ProcessRunner.class);
        snapshot = RepositorySnapshot.of(ROOT, List.of(
                new SourceFile("src/A.java", "x\n".repeat(10)),
                new SourceFile("src/B.java", "x\n".repeat(10))));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private CommandToolAdapter lint(List<String> command, List<Integer> acceptedExitCodes) {
        QualityConfig config = QualityConfig.defaults().withTools(new QualityConfig.ToolsSettings(
                new QualityConfig.ToolCommand(command, 90, acceptedExitCodes), null));
        return CommandToolAdapter.lint(config, runner);
    }

    @Test
    void testUnconfiguredToolIsUnavailable() {
        ToolOutcome outcome = CommandToolAdapter.lint(QualityConfig.defaults(), runner).run(snapshot);

        assertFalse(outcome.available());
        assertEquals("no lint command configured", outcome.reason());
        verifyNoInteractions(runner);
    }

    @Test
    void testSnapshotWithoutRoot() {
        ToolOutcome outcome = lint(List.of("checkstyle"), List.of(0))
                .run(RepositorySnapshot.of(snapshot.files()));

        assertFalse(outcome.available());
        assertEquals("snapshot has no filesystem root", outcome.reason());
        verifyNoInteractions(runner);
    }

    @Test
    void testPlaceholderExpansion() {
        CommandToolAdapter adapter = lint(List.of("checkstyle", "-c", "{root}/checks.xml", "{files}"), List.of(0));

        assertEquals(List.of("checkstyle", "-c", "/repo/checks.xml", "/repo/src/A.java", "/repo/src/B.java"),
                adapter.expand(ROOT, snapshot));
    }

    @Test
    void testSuccessfulRun() throws Exception {
        List<String> expected = List.of("checkstyle", "/repo/src/A.java", "/repo/src/B.java");
        when(runner.run(expected, ROOT, Duration.ofSeconds(90)))
                .thenReturn(new ProcessOutput(1, "[ERROR] /repo/src/A.java:1: Bad. [X]\n", false));

        ToolOutcome outcome = lint(List.of("checkstyle", "{files}"), List.of(0, 1)).run(snapshot);

        assertTrue(outcome.available());
        assertEquals(1, outcome.diagnostics());
        assertEquals(0.995, outcome.score(), 1e-9);
        assertEquals(0.99, outcome.fileScores().get("src/A.java"), 1e-9);
        assertNull(outcome.reason());
    }

    @Test
    void testUnexpectedExitCode() throws Exception {
        when(runner.run(any(), any(), any())).thenReturn(new ProcessOutput(2, "", false));

        ToolOutcome outcome = lint(List.of("checkstyle", "{files}"), List.of(0, 1)).run(snapshot);

        assertFalse(outcome.available());
        assertEquals("exit code 2", outcome.reason());
    }

    @Test
    void testTimeout() throws Exception {
        when(runner.run(any(), any(), any())).thenReturn(ProcessOutput.timeout("partial"));

        ToolOutcome outcome = lint(List.of("checkstyle"), List.of(0)).run(snapshot);

        assertFalse(outcome.available());
        assertEquals("timed out after 90s", outcome.reason());
    }

    @Test
    void testLaunchFailure() throws Exception {
        when(runner.run(any(), any(), any())).thenThrow(new IOException("No such file or directory"));

        ToolOutcome outcome = lint(List.of("checkstyle"), List.of(0)).run(snapshot);

        assertFalse(outcome.available());
        assertEquals("failed to launch checkstyle: No such file or directory", outcome.reason());
    }

    @Test
    void testInterruptedRun() throws Exception {
        when(runner.run(any(), any(), any())).thenThrow(new InterruptedException());

        ToolOutcome outcome = lint(List.of("checkstyle"), List.of(0)).run(snapshot);

        assertFalse(outcome.available());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testTypingAdapterUsesDensity() throws Exception {
        QualityConfig config = QualityConfig.defaults().withTools(new QualityConfig.ToolsSettings(
                null, new QualityConfig.ToolCommand(List.of("javac", "{files}"), 120, List.of(0, 1))));
        when(runner.run(any(), any(), any()))
                .thenReturn(new ProcessOutput(1, "/repo/src/B.java:3: error: cannot find symbol\n", false));

        CommandToolAdapter adapter = CommandToolAdapter.typing(config, runner);
        ToolOutcome outcome = adapter.run(snapshot);

        assertEquals(Pillar.TYPING, adapter.pillar());
        assertTrue(outcome.available());
        assertEquals(0.0, outcome.fileScores().get("src/B.java"));
        assertEquals(0.5, outcome.score(), 1e-9);
        verify(runner).run(List.of("javac", "/repo/src/A.java", "/repo/src/B.java"), ROOT, Duration.ofSeconds(120));
    }
}
