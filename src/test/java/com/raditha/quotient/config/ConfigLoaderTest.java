package com.raditha.quotient.config;

import com.raditha.quotient.architecture.DivergencePolicy;
import com.raditha.quotient.complexity.AggregationMode;
import com.raditha.quotient.confidence.Statistic;
import com.raditha.quotient.model.LayerRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testBlankDocumentYieldsDefaults() {
        assertEquals(QualityConfig.defaults(), ConfigLoader.parse(""));
    }

    @Test
    void testPartialSectionKeepsOtherDefaults() {
        QualityConfig config = ConfigLoader.parse("""
                duplication:
                  k: 7
                bootstrap:
                  seed: 99
                  statistic: median
                """);

        assertEquals(7, config.duplication().k());
        assertEquals(4, config.duplication().w());
        assertEquals(10, config.duplication().minCloneTokens());
        assertEquals(99L, config.bootstrap().seed());
        assertEquals(1000, config.bootstrap().resamples());
        assertEquals(Statistic.MEDIAN, config.bootstrap().statistic());
        assertEquals(QualityConfig.Weights.defaults(), config.weights());
    }

    @Test
    void testLayersAndPolicy() {
        QualityConfig config = ConfigLoader.parse("""
                architecture:
                  divergence_policy: per_occurrence
                  strict_unspecified: true
                  layers:
                    - name: web
                      modules: ["com.acme.web.**"]
                      allow: [domain]
                    - name: domain
                      modules: ["com.acme.domain.**"]
                      forbid: [web]
                """);

        assertEquals(DivergencePolicy.PER_OCCURRENCE, config.architecture().divergencePolicy());
        assertTrue(config.architecture().strictUnspecified());
        assertEquals(List.of(
                new LayerRule("web", List.of("com.acme.web.**"), List.of("domain"), List.of()),
                new LayerRule("domain", List.of("com.acme.domain.**"), List.of(), List.of("web"))),
                config.architecture().layers());
    }

    @Test
    void testToolCommands() {
        QualityConfig config = ConfigLoader.parse("""
                tools:
                  lint:
                    command: [checkstyle, -c, /google_checks.xml, "{files}"]
                    accepted_exit_codes: [0, 1]
                """);

        assertTrue(config.tools().lint().configured());
        assertEquals(List.of(0, 1), config.tools().lint().acceptedExitCodes());
        assertEquals(90, config.tools().lint().timeoutSeconds());
        assertFalse(config.tools().typing().configured());
        assertEquals(120, config.tools().typing().timeoutSeconds());
    }

    @Test
    void testUnknownKeyIsRejected() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> ConfigLoader.parse("duplication:\n  kay: 3\n"));
        assertTrue(e.getMessage().contains("kay"));
    }

    @Test
    void testWrongTypeIsRejected() {
        assertThrows(InvalidConfigurationException.class, () -> ConfigLoader.parse("duplication:\n  k: five\n"));
    }

    @Test
    void testNonMappingRootIsRejected() {
        assertThrows(InvalidConfigurationException.class, () -> ConfigLoader.parse("- a\n- b\n"));
    }

    @Test
    void testDefaultsRoundTripThroughYaml() {
        QualityConfig defaults = QualityConfig.defaults();

        assertEquals(defaults, ConfigLoader.parse(ConfigLoader.toYaml(defaults)));
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("quotient.yml");
        Files.writeString(file, "complexity:\n  aggregation: percentile\n  percentile: 75\n");

        QualityConfig config = ConfigLoader.load(file);

        assertEquals(AggregationMode.PERCENTILE, config.complexity().aggregation());
        assertEquals(75.0, config.complexity().percentile());
    }

    @Test
    void testMissingFileIsAnIoError() {
        assertThrows(NoSuchFileException.class, () -> ConfigLoader.load(tempDir.resolve("absent.yml")));
    }
}
