package com.raditha.quotient.complexity;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.normalization.FunctionUnit;
import com.raditha.quotient.normalization.NormalizedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Cognitive complexity of methods and constructors.
 * <p>
 * Branching constructs cost {@code 1 + nesting}, boolean operators and direct recursion
 * cost 1 flat, jumps cost nothing. Types declared inside a body are scored as their own
 * functions and skipped here.
 */
public class CognitiveComplexityScorer {

    private static final Logger logger = LoggerFactory.getLogger(CognitiveComplexityScorer.class);
    static final String METRIC_NAME = "complexity";

    private final QualityConfig.ComplexitySettings settings;
    private final QualityConfig.RoleWeights roleWeights;

    public CognitiveComplexityScorer(QualityConfig.ComplexitySettings settings, QualityConfig.RoleWeights roleWeights) {
        this.settings = settings;
        this.roleWeights = roleWeights;
    }

    /**
     * Score a single callable.
     */
    public int score(CallableDeclaration<?> callable) {
        ComplexityVisitor visitor = new ComplexityVisitor(callable.getNameAsString(), callable.getParameters().size());
        if (callable instanceof MethodDeclaration method) {
            method.getBody().ifPresent(body -> body.accept(visitor, 0));
        } else if (callable instanceof ConstructorDeclaration constructor) {
            constructor.getBody().accept(visitor, 0);
        }
        return visitor.total;
    }

    public ComplexityResult scoreFiles(List<NormalizedFile> files) {
        return scoreFiles(files, ForkJoinPool.commonPool());
    }

    /**
     * Score every file and fold the results into the pillar score.
     *
     * @param files Normalized files
     * @param pool  Pool used for per-file scoring
     */
    public ComplexityResult scoreFiles(List<NormalizedFile> files, ForkJoinPool pool) {
        if (files.isEmpty()) {
            return new ComplexityResult(PillarScore.unavailable("no parsable source files"), Map.of(), List.of());
        }

        List<NormalizedFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(NormalizedFile::path));

        List<FileComplexity> scored = pool.submit(() -> sorted.parallelStream()
                .map(this::scoreFile)
                .collect(Collectors.toList())).join();

        Map<String, FileComplexity> byPath = new TreeMap<>();
        List<MetricSample> samples = new ArrayList<>();
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < sorted.size(); i++) {
            FileComplexity file = scored.get(i);
            byPath.put(file.path(), file);
            samples.add(new MetricSample(file.path(), METRIC_NAME, file.score()));
            double weight = file.lines() * roleWeights.weightOf(sorted.get(i).role());
            weighted += file.score() * weight;
            totalWeight += weight;
        }

        double score = totalWeight > 0 ? weighted / totalWeight : 1.0;
        logger.info("Complexity: {} files, score {}", sorted.size(), String.format(Locale.ROOT, "%.4f", score));
        return new ComplexityResult(PillarScore.of(Math.max(0.0, Math.min(1.0, score))), byPath, samples);
    }

    FileComplexity scoreFile(NormalizedFile file) {
        List<FunctionComplexity> functions = new ArrayList<>();
        for (FunctionUnit unit : file.functions()) {
            functions.add(new FunctionComplexity(unit.name(), unit.arity(), unit.span(), score(unit.declaration())));
        }
        double value = aggregate(functions);
        double fileScore = fileScore(value, file.lines());
        logger.debug("{}: complexity {} over {} functions", file.path(), value, functions.size());
        return new FileComplexity(file.path(), file.lines(), value, fileScore, functions);
    }

    /**
     * Fold function scores into one value per file.
     */
    double aggregate(List<FunctionComplexity> functions) {
        if (functions.isEmpty()) {
            return 0.0;
        }
        if (settings.aggregation() == AggregationMode.SUM) {
            return functions.stream().mapToInt(FunctionComplexity::score).sum();
        }
        double[] values = functions.stream().mapToDouble(FunctionComplexity::score).toArray();
        Arrays.sort(values);
        int rank = (int) Math.ceil(settings.percentile() / 100.0 * values.length);
        return values[Math.max(0, Math.min(values.length, rank) - 1)];
    }

    /**
     * Map a file value to [0,1]: 0 at or above the hard cap, otherwise linear in
     * complexity per line up to the target.
     */
    double fileScore(double value, int lines) {
        if (value >= settings.hardCap()) {
            return 0.0;
        }
        if (lines <= 0) {
            return value > 0 ? 0.0 : 1.0;
        }
        double density = value / lines;
        return 1.0 - Math.min(1.0, density / settings.targetPerLoc());
    }

    /**
     * Accumulates the score of one body. The argument is the current nesting level.
     */
    private static class ComplexityVisitor extends VoidVisitorAdapter<Integer> {
        private final String functionName;
        private final int arity;
        private int total;

        ComplexityVisitor(String functionName, int arity) {
            this.functionName = functionName;
            this.arity = arity;
        }

        @Override
        public void visit(IfStmt n, Integer nesting) {
            visitIf(n, nesting);
        }

        /**
         * An if and its else-if chain all cost 1 + the nesting of the chain head.
         */
        private void visitIf(IfStmt n, int nesting) {
            total += 1 + nesting;
            n.getCondition().accept(this, nesting);
            n.getThenStmt().accept(this, nesting + 1);
            if (n.getElseStmt().isPresent()) {
                Statement elseStmt = n.getElseStmt().get();
                if (elseStmt instanceof IfStmt elseIf) {
                    visitIf(elseIf, nesting);
                } else {
                    elseStmt.accept(this, nesting + 1);
                }
            }
        }

        @Override
        public void visit(ForStmt n, Integer nesting) {
            total += 1 + nesting;
            n.getInitialization().forEach(e -> e.accept(this, nesting));
            n.getCompare().ifPresent(e -> e.accept(this, nesting));
            n.getUpdate().forEach(e -> e.accept(this, nesting));
            n.getBody().accept(this, nesting + 1);
        }

        @Override
        public void visit(ForEachStmt n, Integer nesting) {
            total += 1 + nesting;
            n.getIterable().accept(this, nesting);
            n.getBody().accept(this, nesting + 1);
        }

        @Override
        public void visit(WhileStmt n, Integer nesting) {
            total += 1 + nesting;
            n.getCondition().accept(this, nesting);
            n.getBody().accept(this, nesting + 1);
        }

        @Override
        public void visit(DoStmt n, Integer nesting) {
            total += 1 + nesting;
            n.getBody().accept(this, nesting + 1);
            n.getCondition().accept(this, nesting);
        }

        @Override
        public void visit(SwitchStmt n, Integer nesting) {
            total += 1 + nesting;
            n.getSelector().accept(this, nesting);
            n.getEntries().forEach(entry -> entry.accept(this, nesting + 1));
        }

        @Override
        public void visit(SwitchExpr n, Integer nesting) {
            total += 1 + nesting;
            n.getSelector().accept(this, nesting);
            n.getEntries().forEach(entry -> entry.accept(this, nesting + 1));
        }

        @Override
        public void visit(ConditionalExpr n, Integer nesting) {
            total += 1 + nesting;
            n.getCondition().accept(this, nesting);
            n.getThenExpr().accept(this, nesting + 1);
            n.getElseExpr().accept(this, nesting + 1);
        }

        @Override
        public void visit(CatchClause n, Integer nesting) {
            total += 1 + nesting;
            n.getBody().accept(this, nesting + 1);
        }

        @Override
        public void visit(BinaryExpr n, Integer nesting) {
            if (n.getOperator() == BinaryExpr.Operator.AND || n.getOperator() == BinaryExpr.Operator.OR) {
                total += 1;
            }
            super.visit(n, nesting);
        }

        @Override
        public void visit(MethodCallExpr n, Integer nesting) {
            boolean unscoped = n.getScope().isEmpty() || n.getScope().get() instanceof ThisExpr;
            if (unscoped && n.getNameAsString().equals(functionName) && n.getArguments().size() == arity) {
                total += 1;
            }
            super.visit(n, nesting);
        }

        @Override
        public void visit(ObjectCreationExpr n, Integer nesting) {
            // Anonymous class methods are functions of their own
            n.getScope().ifPresent(s -> s.accept(this, nesting));
            n.getArguments().forEach(a -> a.accept(this, nesting));
        }

        @Override
        public void visit(LocalClassDeclarationStmt n, Integer nesting) {
            // scored separately
        }

        @Override
        public void visit(LocalRecordDeclarationStmt n, Integer nesting) {
            // scored separately
        }
    }
}
