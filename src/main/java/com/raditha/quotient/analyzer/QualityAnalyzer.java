package com.raditha.quotient.analyzer;

import com.raditha.quotient.aggregate.AggregationInput;
import com.raditha.quotient.aggregate.Aggregator;
import com.raditha.quotient.architecture.ConformanceChecker;
import com.raditha.quotient.architecture.ConformanceResult;
import com.raditha.quotient.architecture.ImportGraph;
import com.raditha.quotient.architecture.ImportGraphExtractor;
import com.raditha.quotient.complexity.CognitiveComplexityScorer;
import com.raditha.quotient.complexity.ComplexityResult;
import com.raditha.quotient.complexity.FileComplexity;
import com.raditha.quotient.confidence.BootstrapEstimator;
import com.raditha.quotient.config.ConfigValidator;
import com.raditha.quotient.config.QualityConfig;
import com.raditha.quotient.duplication.DuplicationDetector;
import com.raditha.quotient.duplication.DuplicationResult;
import com.raditha.quotient.model.FileSummary;
import com.raditha.quotient.model.Finding;
import com.raditha.quotient.model.FindingCategory;
import com.raditha.quotient.model.MetricSample;
import com.raditha.quotient.model.Pillar;
import com.raditha.quotient.model.PillarScore;
import com.raditha.quotient.model.Report;
import com.raditha.quotient.normalization.ASTNormalizer;
import com.raditha.quotient.normalization.NormalizedFile;
import com.raditha.quotient.source.ParseOutcome;
import com.raditha.quotient.source.RepositorySnapshot;
import com.raditha.quotient.source.SourceFile;
import com.raditha.quotient.source.SourceParser;
import com.raditha.quotient.tools.CommandToolAdapter;
import com.raditha.quotient.tools.DefaultProcessRunner;
import com.raditha.quotient.tools.ExternalToolAdapter;
import com.raditha.quotient.tools.ProcessRunner;
import com.raditha.quotient.tools.ToolOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

/**
 * Main orchestrator of an analysis run.
 * Coordinates parsing, normalization, the five pillar analyzers and aggregation.
 * <p>
 * The configuration is validated before any file is parsed. Each stage hands an
 * immutable value to the next; same snapshot, configuration and seed give an equal report.
 */
public class QualityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(QualityAnalyzer.class);

    private final SourceParser parser;
    private final ASTNormalizer normalizer;
    private final ProcessRunner processRunner;

    public QualityAnalyzer() {
        this(new SourceParser(), new ASTNormalizer(), new DefaultProcessRunner());
    }

    public QualityAnalyzer(SourceParser parser, ASTNormalizer normalizer, ProcessRunner processRunner) {
        this.parser = parser;
        this.normalizer = normalizer;
        this.processRunner = processRunner;
    }

    /**
     * Analyze a repository snapshot.
     *
     * @param snapshot Files to analyse
     * @param config   Run configuration
     * @return The report
     * @throws com.raditha.quotient.config.InvalidConfigurationException if the configuration is unusable
     * @throws EmptyRepositoryException                                   if the snapshot has no files
     */
    public Report analyze(RepositorySnapshot snapshot, QualityConfig config) {
        ConfigValidator.validate(config);
        if (snapshot.isEmpty()) {
            throw new EmptyRepositoryException("No source files to analyze");
        }

        ForkJoinPool pool = new ForkJoinPool(config.execution().effectiveParallelism());
        try {
            return run(snapshot, config, pool);
        } finally {
            pool.shutdown();
        }
    }

    private Report run(RepositorySnapshot snapshot, QualityConfig config, ForkJoinPool pool) {
        logger.info("Analyzing {} files with parallelism {}", snapshot.size(), pool.getParallelism());

        List<ParseOutcome> outcomes = pool.submit(() -> snapshot.files().parallelStream()
                .map(parser::parse)
                .collect(Collectors.toList())).join();

        List<Finding> findings = new ArrayList<>();
        List<ParseOutcome> parsed = new ArrayList<>();
        for (ParseOutcome outcome : outcomes) {
            if (outcome.isParsed()) {
                parsed.add(outcome);
            } else {
                findings.add(Finding.warning(outcome.file().path(), outcome.failureLine(), FindingCategory.PARSE,
                        "Parse failed: " + outcome.failure()));
            }
        }

        List<NormalizedFile> normalized = pool.submit(() -> parsed.parallelStream()
                .map(o -> normalizer.normalize(o.file(), o.unit()))
                .collect(Collectors.toList())).join();
        logger.info("Parsed {} of {} files", normalized.size(), snapshot.size());

        DuplicationDetector detector = new DuplicationDetector(config.duplication(), config.roles());
        CognitiveComplexityScorer scorer = new CognitiveComplexityScorer(config.complexity(), config.roles());
        CompletableFuture<DuplicationResult> duplicationTask =
                CompletableFuture.supplyAsync(() -> detector.detect(normalized, pool), pool);
        CompletableFuture<ComplexityResult> complexityTask =
                CompletableFuture.supplyAsync(() -> scorer.scoreFiles(normalized, pool), pool);

        ImportGraph graph = new ImportGraphExtractor().extract(normalized);
        ConformanceResult conformance = new ConformanceChecker(config.architecture()).check(graph);

        ToolOutcome lint = runTool(CommandToolAdapter.lint(config, processRunner),
                config.tools().lint().configured(), snapshot, findings);
        ToolOutcome typing = runTool(CommandToolAdapter.typing(config, processRunner),
                config.tools().typing().configured(), snapshot, findings);

        DuplicationResult duplication = duplicationTask.join();
        ComplexityResult complexity = complexityTask.join();

        findings.addAll(duplication.findings());
        findings.addAll(conformance.findings());

        Map<Pillar, PillarScore> pillars = new EnumMap<>(Pillar.class);
        pillars.put(Pillar.DUPLICATION, duplication.score());
        pillars.put(Pillar.ARCHITECTURE, conformance.score());
        pillars.put(Pillar.LINT, toPillarScore(lint));
        pillars.put(Pillar.TYPING, toPillarScore(typing));
        pillars.put(Pillar.COMPLEXITY, complexity.score());

        Map<Pillar, List<MetricSample>> samples = new EnumMap<>(Pillar.class);
        samples.put(Pillar.DUPLICATION, duplication.samples());
        samples.put(Pillar.ARCHITECTURE, conformance.samples());
        samples.put(Pillar.LINT, toSamples(lint, Pillar.LINT));
        samples.put(Pillar.TYPING, toSamples(typing, Pillar.TYPING));
        samples.put(Pillar.COMPLEXITY, complexity.samples());

        Map<Pillar, Map<String, Double>> fileScores = new EnumMap<>(Pillar.class);
        fileScores.put(Pillar.DUPLICATION, byFile(duplication.samples()));
        fileScores.put(Pillar.ARCHITECTURE, architectureByFile(conformance, graph));
        fileScores.put(Pillar.LINT, lint.fileScores());
        fileScores.put(Pillar.TYPING, typing.fileScores());
        fileScores.put(Pillar.COMPLEXITY, byFile(complexity.samples()));

        List<FileSummary> files = summarize(snapshot, normalized, duplication, complexity);

        Aggregator aggregator = new Aggregator(config.weights(), new BootstrapEstimator(config.bootstrap(), pool));
        return aggregator.aggregate(new AggregationInput(pillars, samples, fileScores, files, findings,
                duplication.clonePairs(), conformance.absentRelations()));
    }

    /**
     * Run a tool adapter. A configured tool that fails leaves a warning in the report.
     */
    private ToolOutcome runTool(ExternalToolAdapter adapter, boolean configured, RepositorySnapshot snapshot,
                                List<Finding> findings) {
        ToolOutcome outcome = adapter.run(snapshot);
        if (!outcome.available()) {
            logger.info("{} pillar unavailable: {}", adapter.pillar().key(), outcome.reason());
        }
        if (!outcome.available() && configured) {
            findings.add(Finding.repositoryWarning(FindingCategory.TOOL,
                    adapter.pillar().key() + " unavailable: " + outcome.reason()));
        }
        return outcome;
    }

    private static PillarScore toPillarScore(ToolOutcome outcome) {
        return outcome.available() ? PillarScore.of(outcome.score()) : PillarScore.unavailable(outcome.reason());
    }

    private static List<MetricSample> toSamples(ToolOutcome outcome, Pillar pillar) {
        List<MetricSample> samples = new ArrayList<>();
        outcome.fileScores().forEach((path, score) -> samples.add(new MetricSample(path, pillar.key(), score)));
        return samples;
    }

    private static Map<String, Double> byFile(List<MetricSample> samples) {
        Map<String, Double> scores = new HashMap<>();
        for (MetricSample sample : samples) {
            scores.put(sample.subject(), sample.value());
        }
        return scores;
    }

    /**
     * Module samples keyed by the file declaring the module.
     */
    private static Map<String, Double> architectureByFile(ConformanceResult conformance, ImportGraph graph) {
        Map<String, Double> scores = new HashMap<>();
        for (MetricSample sample : conformance.samples()) {
            graph.node(sample.subject())
                    .filter(node -> node.file() != null)
                    .ifPresent(node -> scores.put(node.file(), sample.value()));
        }
        return scores;
    }

    private static List<FileSummary> summarize(RepositorySnapshot snapshot, List<NormalizedFile> normalized,
                                               DuplicationResult duplication, ComplexityResult complexity) {
        Map<String, NormalizedFile> byPath = new HashMap<>();
        normalized.forEach(f -> byPath.put(f.path(), f));

        List<FileSummary> files = new ArrayList<>();
        for (SourceFile file : snapshot.files()) {
            NormalizedFile parsedFile = byPath.get(file.path());
            FileComplexity fileComplexity = complexity.file(file.path()).orElse(null);
            files.add(new FileSummary(
                    file.path(),
                    file.role(),
                    file.lineCount(),
                    parsedFile == null ? 0 : parsedFile.tokenCount(),
                    parsedFile != null,
                    duplication.ratioOf(file.path()),
                    fileComplexity == null ? 0.0 : fileComplexity.value(),
                    fileComplexity == null ? 0.0 : fileComplexity.score(),
                    0.0));
        }
        return files;
    }
}
