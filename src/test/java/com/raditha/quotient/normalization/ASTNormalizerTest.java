package com.raditha.quotient.normalization;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.quotient.model.FileRole;
import com.raditha.quotient.source.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ASTNormalizerTest {

    private static final String SOURCE = """
            package com.acme.orders;

            import java.util.List;
            import com.acme.billing.*;
            import static com.acme.util.Strings.trim;

            public class OrderService {
                private final List<Order> orders;

                public OrderService(List<Order> orders) {
                    this.orders = orders;
                }

                public int count() {
                    return Invoices.size(orders);
                }

                abstract static class Hook {
                    abstract void fire();
                }
            }
            """;

    private ASTNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ASTNormalizer();
    }

    @Test
    void testModuleIdUsesPackageAndPublicType() {
        NormalizedFile file = normalize("src/main/java/com/acme/orders/OrderService.java", SOURCE);

        assertEquals("com.acme.orders.OrderService", file.moduleId());
        assertEquals("com.acme.orders", file.packageName());
        assertEquals(FileRole.DEFAULT, file.role());
    }

    @Test
    void testImportsKeepKindAndLine() {
        NormalizedFile file = normalize("OrderService.java", SOURCE);

        assertEquals(3, file.imports().size());
        ImportTarget wildcard = file.imports().get(1);
        assertEquals("com.acme.billing", wildcard.name());
        assertTrue(wildcard.wildcard());
        assertFalse(wildcard.isStatic());
        assertEquals(4, wildcard.line());

        ImportTarget staticImport = file.imports().get(2);
        assertTrue(staticImport.isStatic());
        assertEquals("com.acme.util.Strings.trim", staticImport.name());
    }

    @Test
    void testReferencedTypesRecordFirstLine() {
        NormalizedFile file = normalize("OrderService.java", SOURCE);

        assertEquals(8, file.referencedTypes().get("List"));
        assertEquals(8, file.referencedTypes().get("Order"));
        assertTrue(file.referencedTypes().containsKey("Invoices"));
        assertFalse(file.referencedTypes().containsKey("orders"));
    }

    @Test
    void testFunctionsSkipBodylessMethods() {
        NormalizedFile file = normalize("OrderService.java", SOURCE);

        List<String> names = file.functions().stream().map(FunctionUnit::name).collect(Collectors.toList());
        assertEquals(List.of("OrderService", "count"), names);
        assertEquals(1, file.functions().get(0).arity());
        assertEquals(10, file.functions().get(0).span().startLine());
    }

    @Test
    void testPackageAndImportsAreNotTokens() {
        NormalizedFile withImports = normalize("A.java", "package a;\nimport java.util.List;\nclass A { }");
        NormalizedFile without = normalize("A.java", "class A { }");

        assertEquals(without.tokenCount(), withImports.tokenCount());
    }

    @Test
    void testModuleIdFallsBackToFileStem() {
        CompilationUnit cu = StaticJavaParser.parse("class Helper { } class Other { }");

        assertEquals("Other", ASTNormalizer.moduleId(cu, "pkg/Other.java"));
        assertEquals("Helper", ASTNormalizer.moduleId(cu, "pkg/Misc.java"));
        assertEquals("package-info", ASTNormalizer.moduleId(StaticJavaParser.parse(""), "pkg/package-info.java"));
    }

    @Test
    void testTestFilesGetTestRole() {
        NormalizedFile file = normalize("src/test/java/com/acme/OrderServiceTest.java", "class OrderServiceTest { }");

        assertEquals(FileRole.TEST, file.role());
    }

    private NormalizedFile normalize(String path, String content) {
        return normalizer.normalize(new SourceFile(path, content), StaticJavaParser.parse(content));
    }
}
