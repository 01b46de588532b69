package com.raditha.quotient.architecture;

import com.raditha.quotient.model.ImportEdge;
import com.raditha.quotient.model.ModuleNode;
import com.raditha.quotient.normalization.ASTNormalizer;
import com.raditha.quotient.normalization.NormalizedFile;
import com.raditha.quotient.source.SourceFile;
import com.raditha.quotient.source.SourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ImportGraphExtractorTest {

    private ImportGraphExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ImportGraphExtractor();
    }

    @Test
    void testExplicitImportOfInternalType() {
        ImportGraph graph = extractor.extract(List.of(
                file("web/Controller.java", "package web;\nimport core.Service;\npublic class Controller { Service s; }"),
                file("core/Service.java", "package core;\npublic class Service { }")));

        Optional<ImportEdge> edge = graph.edge("web.Controller", "core.Service");
        assertTrue(edge.isPresent());
        assertFalse(edge.get().touchesBoundary());
        assertEquals(2, edge.get().firstLocation().startLine());
        assertEquals("web/Controller.java", edge.get().firstLocation().file());
    }

    @Test
    void testUnresolvedImportBecomesBoundaryNode() {
        ImportGraph graph = extractor.extract(List.of(
                file("web/Controller.java", "package web;\nimport java.util.List;\npublic class Controller { List<String> names; }")));

        ModuleNode list = graph.node("java.util.List").orElseThrow();
        assertTrue(list.boundary());
        assertNull(list.file());
        assertTrue(graph.edge("web.Controller", "java.util.List").orElseThrow().touchesBoundary());
        assertEquals(List.of(graph.node("web.Controller").orElseThrow()), graph.internalModules());
    }

    @Test
    void testWildcardResolvesToReferencedTypesOnly() {
        ImportGraph graph = extractor.extract(List.of(
                file("web/Controller.java", "package web;\nimport core.*;\npublic class Controller { Service s; }"),
                file("core/Service.java", "package core;\npublic class Service { }"),
                file("core/Repository.java", "package core;\npublic class Repository { }")));

        assertTrue(graph.edge("web.Controller", "core.Service").isPresent());
        assertFalse(graph.edge("web.Controller", "core.Repository").isPresent());
    }

    @Test
    void testUnresolvedWildcardIsOneBoundaryNode() {
        ImportGraph graph = extractor.extract(List.of(
                file("web/Controller.java", "package web;\nimport java.util.*;\npublic class Controller { }")));

        assertTrue(graph.node("java.util.*").orElseThrow().boundary());
    }

    @Test
    void testStaticAndNestedImportsResolveToOwner() {
        ImportGraph graph = extractor.extract(List.of(
                file("web/Controller.java", """
                        package web;
                        import static core.Service.DEFAULT;
                        import core.Service.Nested;
                        public class Controller { }
                        """),
                file("core/Service.java", "package core;\npublic class Service { static final int DEFAULT = 1; static class Nested { } }")));

        ImportEdge edge = graph.edge("web.Controller", "core.Service").orElseThrow();
        assertEquals(2, edge.locations().size());
        assertEquals(2, edge.locations().get(0).startLine());
        assertEquals(3, edge.locations().get(1).startLine());
    }

    @Test
    void testSamePackageReferenceIsAnEdge() {
        ImportGraph graph = extractor.extract(List.of(
                file("core/Service.java", "package core;\npublic class Service {\n\n  Repository repo;\n}"),
                file("core/Repository.java", "package core;\npublic class Repository { }")));

        ImportEdge edge = graph.edge("core.Service", "core.Repository").orElseThrow();
        assertEquals(4, edge.firstLocation().startLine());
        assertFalse(graph.edge("core.Repository", "core.Service").isPresent());
    }

    @Test
    void testSelfReferencesAreDropped() {
        ImportGraph graph = extractor.extract(List.of(
                file("core/Node.java", "package core;\npublic class Node { Node next; }")));

        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void testFirstPathWinsForAmbiguousModule() {
        ImportGraph graph = extractor.extract(List.of(
                file("b/core/Service.java", "package core;\npublic class Service { }"),
                file("a/core/Service.java", "package core;\npublic class Service { }")));

        assertEquals("a/core/Service.java", graph.node("core.Service").orElseThrow().file());
    }

    @Test
    void testGraphIsIndependentOfInputOrder() {
        NormalizedFile controller = file("web/Controller.java", "package web;\nimport core.Service;\npublic class Controller { }");
        NormalizedFile service = file("core/Service.java", "package core;\nimport java.util.Map;\npublic class Service { }");

        assertEquals(extractor.extract(List.of(controller, service)).edges(),
                extractor.extract(List.of(service, controller)).edges());
    }

    static NormalizedFile file(String path, String content) {
        SourceFile file = new SourceFile(path, content);
        return new ASTNormalizer().normalize(file, new SourceParser().parse(file).unit());
    }
}
