package com.raditha.quotient.normalization;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.raditha.quotient.model.NormalizedToken;
import com.raditha.quotient.model.SourceSpan;
import com.raditha.quotient.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts a parsed compilation unit into the {@link NormalizedFile} consumed by
 * the duplication, complexity and architecture analyzers.
 * <p>
 * Tokens come from the type declarations only, so package and import declarations
 * never show up in clones. The compilation unit itself is not modified.
 */
public class ASTNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ASTNormalizer.class);

    private final TokenNormalizer tokenNormalizer;

    public ASTNormalizer() {
        this(new TokenNormalizer());
    }

    public ASTNormalizer(TokenNormalizer tokenNormalizer) {
        this.tokenNormalizer = tokenNormalizer;
    }

    /**
     * Normalize one file.
     *
     * @param file Source file the unit was parsed from
     * @param cu   Parsed compilation unit
     * @return Normalized view of the file
     */
    public NormalizedFile normalize(SourceFile file, CompilationUnit cu) {
        String packageName = cu.getPackageDeclaration()
                .map(PackageDeclaration::getNameAsString)
                .orElse("");

        List<NormalizedToken> tokens = tokenNormalizer.tokenizeAll(cu.getTypes(), file.path());
        List<ImportTarget> imports = extractImports(cu);
        Map<String, Integer> referencedTypes = extractReferencedTypes(cu);
        List<FunctionUnit> functions = extractFunctions(cu, file.path());
        String moduleId = qualify(packageName, primaryTypeName(cu, file.path()));

        logger.debug("{}: {} tokens, {} imports, {} functions", file.path(), tokens.size(),
                imports.size(), functions.size());

        return new NormalizedFile(file.path(), file.role(), file.lineCount(), moduleId, packageName,
                tokens, imports, referencedTypes, functions);
    }

    /**
     * Module identifier of a compilation unit without normalizing it.
     */
    public static String moduleId(CompilationUnit cu, String path) {
        String packageName = cu.getPackageDeclaration()
                .map(PackageDeclaration::getNameAsString)
                .orElse("");
        return qualify(packageName, primaryTypeName(cu, path));
    }

    /**
     * The public top-level type, else the type named after the file, else the first
     * type, else the file stem.
     */
    static String primaryTypeName(CompilationUnit cu, String path) {
        String stem = fileStem(path);
        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (type.isPublic()) {
                return type.getNameAsString();
            }
        }
        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (type.getNameAsString().equals(stem)) {
                return stem;
            }
        }
        if (!cu.getTypes().isEmpty()) {
            return cu.getType(0).getNameAsString();
        }
        return stem;
    }

    static String fileStem(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String qualify(String packageName, String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    private List<ImportTarget> extractImports(CompilationUnit cu) {
        List<ImportTarget> imports = new ArrayList<>();
        for (ImportDeclaration declaration : cu.getImports()) {
            int line = declaration.getBegin().map(p -> p.line).orElse(0);
            imports.add(new ImportTarget(declaration.getNameAsString(), declaration.isAsterisk(),
                    declaration.isStatic(), line));
        }
        return imports;
    }

    private Map<String, Integer> extractReferencedTypes(CompilationUnit cu) {
        Map<String, Integer> names = new TreeMap<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            type.findAll(ClassOrInterfaceType.class).forEach(t -> remember(names, t.getNameAsString(), t));
            type.findAll(AnnotationExpr.class).forEach(a -> remember(names, a.getName().getIdentifier(), a));
            // Static member access such as Foo.bar() parses the scope as a plain name
            type.findAll(NameExpr.class).stream()
                    .filter(n -> Character.isUpperCase(n.getNameAsString().charAt(0)))
                    .forEach(n -> remember(names, n.getNameAsString(), n));
        }
        return names;
    }

    private static void remember(Map<String, Integer> names, String name, Node node) {
        int line = node.getBegin().map(p -> p.line).orElse(0);
        names.merge(name, line, Math::min);
    }

    private List<FunctionUnit> extractFunctions(CompilationUnit cu, String path) {
        List<FunctionUnit> functions = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            for (CallableDeclaration<?> callable : type.findAll(CallableDeclaration.class)) {
                boolean hasBody = callable instanceof ConstructorDeclaration
                        || (callable instanceof MethodDeclaration method && method.getBody().isPresent());
                if (hasBody) {
                    SourceSpan span = callable.getRange()
                            .map(r -> SourceSpan.from(path, r))
                            .orElse(new SourceSpan(path, 0, 0));
                    functions.add(new FunctionUnit(callable.getNameAsString(),
                            callable.getParameters().size(), span, callable));
                }
            }
        }
        return functions;
    }
}
