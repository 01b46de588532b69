package com.raditha.quotient.architecture;

import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.EdgeClass;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.LayerRelation;
import com.raditha.quotient.model.LayerRule;
import com.raditha.quotient.model.Severity;
import com.raditha.quotient.normalization.NormalizedFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConformanceCheckerTest {

    private static final List<LayerRule> LAYERS = List.of(
            new LayerRule("web", List.of("com.acme.web.**"), List.of("domain"), List.of()),
            new LayerRule("domain", List.of("com.acme.domain.**"), List.of(), List.of("web")));

    private static final String ORDER = """
            package com.acme.domain;

            import com.acme.web.Controller;
            import static com.acme.web.Controller.PATH;

            public class Order {
                Controller owner;
            }
            """;

    private static final String CONTROLLER = """
            package com.acme.web;

            public class Controller {
                public static final String PATH = "/orders";
            }
            """;

    @Test
    void testForbiddenEdgeYieldsOneFindingPerModulePair() {
        ConformanceResult result = check(DivergencePolicy.PER_MODULE_PAIR);

        List<Finding> divergences = architectureErrors(result);
        assertEquals(1, divergences.size());
        Finding finding = divergences.get(0);
        assertEquals("src/com/acme/domain/Order.java", finding.file());
        assertEquals(3, finding.line());
        assertTrue(finding.message().contains("com.acme.domain.Order (domain) -> com.acme.web.Controller (web)"));
        assertTrue(finding.message().contains("2 occurrences"));
    }

    @Test
    void testForbiddenEdgeYieldsOneFindingPerOccurrence() {
        ConformanceResult result = check(DivergencePolicy.PER_OCCURRENCE);

        List<Integer> lines = architectureErrors(result).stream()
                .map(Finding::line)
                .collect(Collectors.toList());
        assertEquals(List.of(3, 4), lines);
    }

    @Test
    void testScoreCountsDivergentEdges() {
        ConformanceResult result = check(DivergencePolicy.PER_MODULE_PAIR);

        assertEquals(1, result.divergentCount());
        assertEquals(0.0, result.score().score());
        assertEquals(EdgeClass.DIVERGENT, result.edges().get(0).edgeClass());
        assertEquals(List.of(new LayerRelation("web", "domain")), result.absentRelations());
    }

    @Test
    void testConvergentEdgeRealizesRelation() {
        ImportGraph graph = new ImportGraphExtractor().extract(List.of(
                file("src/com/acme/web/Page.java", "package com.acme.web;\nimport com.acme.domain.Item;\npublic class Page { }"),
                file("src/com/acme/domain/Item.java", "package com.acme.domain;\npublic class Item { }")));

        ConformanceResult result = new ConformanceChecker(settings(DivergencePolicy.PER_MODULE_PAIR)).check(graph);

        assertEquals(1.0, result.score().score());
        assertTrue(result.absentRelations().isEmpty());
        assertTrue(result.findings().isEmpty());
        assertEquals(1, result.samples().size());
        assertEquals("com.acme.web.Page", result.samples().get(0).subject());
    }

    @Test
    void testUnclassifiedModuleIsReportedOnce() {
        ImportGraph graph = new ImportGraphExtractor().extract(List.of(
                file("src/com/acme/web/Page.java", """
                        package com.acme.web;
                        import org.misc.Helper;
                        import org.misc.Other;
                        public class Page { }
                        """),
                file("src/org/misc/Helper.java", "package org.misc;\npublic class Helper { }"),
                file("src/org/misc/Other.java", "package org.misc;\nimport org.misc.Helper;\npublic class Other { }")));

        ConformanceResult result = new ConformanceChecker(settings(DivergencePolicy.PER_MODULE_PAIR)).check(graph);

        assertEquals(List.of("org.misc.Helper", "org.misc.Other"), result.unclassifiedModules());
        List<Finding> warnings = result.findings().stream()
                .filter(f -> f.severity() == Severity.WARNING)
                .collect(Collectors.toList());
        assertEquals(2, warnings.size());
        assertEquals("src/org/misc/Helper.java", warnings.get(0).file());
        assertEquals(1.0, result.score().score());
    }

    @Test
    void testIsolatedModuleIsUnclassified() {
        ImportGraph graph = new ImportGraphExtractor().extract(List.of(
                file("src/com/acme/web/Page.java", "package com.acme.web;\npublic class Page { }"),
                file("src/org/misc/Lonely.java", """
                        package org.misc;
                        import java.util.List;
                        public class Lonely {
                            List<String> names;
                        }
                        """)));

        ConformanceResult result = new ConformanceChecker(settings(DivergencePolicy.PER_MODULE_PAIR)).check(graph);

        assertEquals(List.of("org.misc.Lonely"), result.unclassifiedModules());
        assertEquals(1, result.findings().size());
        Finding warning = result.findings().get(0);
        assertEquals(Severity.WARNING, warning.severity());
        assertEquals("src/org/misc/Lonely.java", warning.file());
        assertTrue(warning.message().contains("org.misc.Lonely"));
        assertTrue(result.edges().isEmpty());
    }

    @Test
    void testNoLayersMakesPillarUnavailable() {
        ConformanceResult result = new ConformanceChecker(QualityConfig.ArchitectureSettings.defaults())
                .check(new ImportGraphExtractor().extract(List.of(file("A.java", "class A { }"))));

        assertFalse(result.score().available());
        assertEquals("no layer model declared", result.score().reason());
    }

    private ConformanceResult check(DivergencePolicy policy) {
        ImportGraph graph = new ImportGraphExtractor().extract(List.of(
                file("src/com/acme/domain/Order.java", ORDER),
                file("src/com/acme/web/Controller.java", CONTROLLER)));
        return new ConformanceChecker(settings(policy)).check(graph);
    }

    private static QualityConfig.ArchitectureSettings settings(DivergencePolicy policy) {
        return new QualityConfig.ArchitectureSettings(LAYERS, policy, false);
    }

    private static List<Finding> architectureErrors(ConformanceResult result) {
        return result.findings().stream()
                .filter(f -> f.category() == FindingCategory.ARCHITECTURE && f.severity() == Severity.ERROR)
                .collect(Collectors.toList());
    }

    private static NormalizedFile file(String path, String content) {
        return ImportGraphExtractorTest.file(path, content);
    }
}
