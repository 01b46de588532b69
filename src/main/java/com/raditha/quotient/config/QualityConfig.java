package com.raditha.quotient.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.raditha.quotient.architecture.DivergencePolicy;
import com.raditha.quotient.complexity.AggregationMode;
import com.raditha.quotient.confidence.Statistic;
import com.raditha.quotient.model.FileRole;
import com.raditha.quotient.model.LayerRule;
import com.raditha.quotient.model.Pillar;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Complete configuration of one analysis run.
 * <p>
 * Records only normalize missing values; range checks live in {@link ConfigValidator}
 * so that every problem can be reported at once.
 */
public record QualityConfig(
        @JsonProperty("weights") Weights weights,
        @JsonProperty("duplication") DuplicationSettings duplication,
        @JsonProperty("complexity") ComplexitySettings complexity,
        @JsonProperty("bootstrap") BootstrapSettings bootstrap,
        @JsonProperty("architecture") ArchitectureSettings architecture,
        @JsonProperty("tools") ToolsSettings tools,
        @JsonProperty("typing") TypingSettings typing,
        @JsonProperty("roles") RoleWeights roles,
        @JsonProperty("paths") PathSettings paths,
        @JsonProperty("execution") ExecutionSettings execution) {

    public QualityConfig {
        weights = weights == null ? Weights.defaults() : weights;
        duplication = duplication == null ? DuplicationSettings.defaults() : duplication;
        complexity = complexity == null ? ComplexitySettings.defaults() : complexity;
        bootstrap = bootstrap == null ? BootstrapSettings.defaults() : bootstrap;
        architecture = architecture == null ? ArchitectureSettings.defaults() : architecture;
        tools = tools == null ? ToolsSettings.defaults() : tools;
        typing = typing == null ? TypingSettings.defaults() : typing;
        roles = roles == null ? RoleWeights.defaults() : roles;
        paths = paths == null ? PathSettings.defaults() : paths;
        execution = execution == null ? ExecutionSettings.defaults() : execution;
    }

    /**
     * Built-in defaults. Also the tree user YAML is merged over.
     */
    public static QualityConfig defaults() {
        return new QualityConfig(null, null, null, null, null, null, null, null, null, null);
    }

    public QualityConfig withWeights(Weights newWeights) {
        return new QualityConfig(newWeights, duplication, complexity, bootstrap, architecture, tools, typing,
                roles, paths, execution);
    }

    public QualityConfig withDuplication(DuplicationSettings settings) {
        return new QualityConfig(weights, settings, complexity, bootstrap, architecture, tools, typing,
                roles, paths, execution);
    }

    public QualityConfig withComplexity(ComplexitySettings settings) {
        return new QualityConfig(weights, duplication, settings, bootstrap, architecture, tools, typing,
                roles, paths, execution);
    }

    public QualityConfig withBootstrap(BootstrapSettings settings) {
        return new QualityConfig(weights, duplication, complexity, settings, architecture, tools, typing,
                roles, paths, execution);
    }

    public QualityConfig withArchitecture(ArchitectureSettings settings) {
        return new QualityConfig(weights, duplication, complexity, bootstrap, settings, tools, typing,
                roles, paths, execution);
    }

    public QualityConfig withTools(ToolsSettings settings) {
        return new QualityConfig(weights, duplication, complexity, bootstrap, architecture, settings, typing,
                roles, paths, execution);
    }

    public QualityConfig withExecution(ExecutionSettings settings) {
        return new QualityConfig(weights, duplication, complexity, bootstrap, architecture, tools, typing,
                roles, paths, settings);
    }

    public QualityConfig withSeed(long seed) {
        return withBootstrap(new BootstrapSettings(bootstrap.resamples(), bootstrap.confidenceLevel(), seed,
                bootstrap.statistic()));
    }

    public QualityConfig withParallelism(int parallelism) {
        return withExecution(new ExecutionSettings(parallelism));
    }

    /**
     * Pillar weights. Must sum to 1.0.
     */
    public record Weights(
            @JsonProperty("duplication") double duplication,
            @JsonProperty("architecture") double architecture,
            @JsonProperty("lint") double lint,
            @JsonProperty("typing") double typing,
            @JsonProperty("complexity") double complexity) {

        public static Weights defaults() {
            return new Weights(0.25, 0.20, 0.20, 0.15, 0.20);
        }

        public double weightOf(Pillar pillar) {
            return switch (pillar) {
                case DUPLICATION -> duplication;
                case ARCHITECTURE -> architecture;
                case LINT -> lint;
                case TYPING -> typing;
                case COMPLEXITY -> complexity;
            };
        }

        public double sum() {
            return duplication + architecture + lint + typing + complexity;
        }

        public Map<Pillar, Double> asMap() {
            Map<Pillar, Double> map = new EnumMap<>(Pillar.class);
            for (Pillar pillar : Pillar.values()) {
                map.put(pillar, weightOf(pillar));
            }
            return map;
        }
    }

    /**
     * Winnowing parameters.
     *
     * @param k              k-gram length in tokens
     * @param w              Window length in k-grams
     * @param minCloneTokens Shortest clone reported, in tokens
     */
    public record DuplicationSettings(
            @JsonProperty("k") int k,
            @JsonProperty("w") int w,
            @JsonProperty("min_clone_tokens") int minCloneTokens) {

        public static DuplicationSettings defaults() {
            return new DuplicationSettings(5, 4, 10);
        }
    }

    /**
     * @param aggregation  How function scores are folded per file
     * @param percentile   Percentile used when aggregation is PERCENTILE, in (0,100]
     * @param targetPerLoc Complexity per line that maps to a score of 0
     * @param hardCap      File value at or above which the file scores 0
     */
    public record ComplexitySettings(
            @JsonProperty("aggregation") AggregationMode aggregation,
            @JsonProperty("percentile") double percentile,
            @JsonProperty("target_per_loc") double targetPerLoc,
            @JsonProperty("hard_cap") int hardCap) {

        public ComplexitySettings {
            aggregation = aggregation == null ? AggregationMode.SUM : aggregation;
        }

        public static ComplexitySettings defaults() {
            return new ComplexitySettings(AggregationMode.SUM, 90.0, 0.25, 50);
        }
    }

    public record BootstrapSettings(
            @JsonProperty("resamples") int resamples,
            @JsonProperty("confidence_level") double confidenceLevel,
            @JsonProperty("seed") long seed,
            @JsonProperty("statistic") Statistic statistic) {

        public BootstrapSettings {
            statistic = statistic == null ? Statistic.MEAN : statistic;
        }

        public static BootstrapSettings defaults() {
            return new BootstrapSettings(1000, 0.95, 1337L, Statistic.MEAN);
        }
    }

    /**
     * Declared layer model.
     *
     * @param layers            Layers in declaration order
     * @param divergencePolicy  Granularity of divergence findings
     * @param strictUnspecified Treat every undeclared relation as divergent
     */
    public record ArchitectureSettings(
            @JsonProperty("layers") List<LayerRule> layers,
            @JsonProperty("divergence_policy") DivergencePolicy divergencePolicy,
            @JsonProperty("strict_unspecified") boolean strictUnspecified) {

        public ArchitectureSettings {
            layers = layers == null ? List.of() : List.copyOf(layers);
            divergencePolicy = divergencePolicy == null ? DivergencePolicy.PER_MODULE_PAIR : divergencePolicy;
        }

        public static ArchitectureSettings defaults() {
            return new ArchitectureSettings(List.of(), DivergencePolicy.PER_MODULE_PAIR, false);
        }
    }

    public record ToolsSettings(
            @JsonProperty("lint") ToolCommand lint,
            @JsonProperty("typing") ToolCommand typing) {

        public ToolsSettings {
            lint = lint == null ? ToolCommand.notConfigured(90) : lint;
            typing = typing == null ? ToolCommand.notConfigured(120) : typing;
        }

        public static ToolsSettings defaults() {
            return new ToolsSettings(null, null);
        }
    }

    /**
     * An external tool invocation.
     *
     * @param command           Argument list; "{files}" and "{root}" are expanded
     * @param timeoutSeconds    Upper bound on the run time
     * @param acceptedExitCodes Exit codes that still count as a usable run
     */
    public record ToolCommand(
            @JsonProperty("command") List<String> command,
            @JsonProperty("timeout_seconds") int timeoutSeconds,
            @JsonProperty("accepted_exit_codes") List<Integer> acceptedExitCodes) {

        public ToolCommand {
            command = command == null ? List.of() : List.copyOf(command);
            acceptedExitCodes = acceptedExitCodes == null ? List.of(0) : List.copyOf(acceptedExitCodes);
        }

        public static ToolCommand notConfigured(int timeoutSeconds) {
            return new ToolCommand(List.of(), timeoutSeconds, List.of(0));
        }

        public boolean configured() {
            return !command.isEmpty();
        }
    }

    /**
     * @param zeroScoreDensity Type errors per 1000 lines that map to a score of 0
     */
    public record TypingSettings(@JsonProperty("zero_score_density") double zeroScoreDensity) {

        public static TypingSettings defaults() {
            return new TypingSettings(20.0);
        }
    }

    /**
     * Aggregation weight multiplier per file role.
     */
    public record RoleWeights(
            @JsonProperty("default") double defaultWeight,
            @JsonProperty("test") double test,
            @JsonProperty("vendor") double vendor,
            @JsonProperty("generated") double generated) {

        public static RoleWeights defaults() {
            return new RoleWeights(1.0, 0.35, 0.2, 0.0);
        }

        public double weightOf(FileRole role) {
            return switch (role) {
                case DEFAULT -> defaultWeight;
                case TEST -> test;
                case VENDOR -> vendor;
                case GENERATED -> generated;
            };
        }
    }

    /**
     * @param exclude Glob patterns of repository paths to skip
     */
    public record PathSettings(@JsonProperty("exclude") List<String> exclude) {

        public PathSettings {
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
        }

        public static PathSettings defaults() {
            return new PathSettings(List.of("**/target/**", "**/build/**", "**/.git/**"));
        }
    }

    /**
     * @param parallelism Worker threads; 0 uses the number of available processors
     */
    public record ExecutionSettings(@JsonProperty("parallelism") int parallelism) {

        public static ExecutionSettings defaults() {
            return new ExecutionSettings(0);
        }

        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }
}
