package com.raditha.quotient.config;

import com.raditha.quotient.model.LayerRule;
import com.raditha.quotient.model.Pillar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link QualityConfig} before any file is touched.
 */
public final class ConfigValidator {

    static final double WEIGHT_EPSILON = 1e-6;

    private ConfigValidator() {
    }

    /**
     * Validate the configuration.
     *
     * @throws InvalidConfigurationException listing every problem found
     */
    public static void validate(QualityConfig config) {
        List<String> problems = collectProblems(config);
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
    }

    /**
     * All problems of the configuration, empty when it is usable.
     */
    public static List<String> collectProblems(QualityConfig config) {
        List<String> problems = new ArrayList<>();
        checkWeights(config.weights(), problems);
        checkDuplication(config.duplication(), problems);
        checkComplexity(config.complexity(), problems);
        checkBootstrap(config.bootstrap(), problems);
        checkLayers(config.architecture().layers(), problems);
        checkTool("tools.lint", config.tools().lint(), problems);
        checkTool("tools.typing", config.tools().typing(), problems);

        if (config.typing().zeroScoreDensity() <= 0) {
            problems.add("typing.zero_score_density must be > 0");
        }
        QualityConfig.RoleWeights roles = config.roles();
        if (roles.defaultWeight() < 0 || roles.test() < 0 || roles.vendor() < 0 || roles.generated() < 0) {
            problems.add("roles weights must be >= 0");
        }
        if (config.execution().parallelism() < 0) {
            problems.add("execution.parallelism must be >= 0");
        }
        return problems;
    }

    private static void checkWeights(QualityConfig.Weights weights, List<String> problems) {
        for (Pillar pillar : Pillar.values()) {
            double weight = weights.weightOf(pillar);
            if (weight < 0 || Double.isNaN(weight)) {
                problems.add("weights." + pillar.key() + " must be >= 0, got " + weight);
            }
        }
        if (Math.abs(weights.sum() - 1.0) > WEIGHT_EPSILON) {
            problems.add("weights must sum to 1.0, got " + weights.sum());
        }
    }

    private static void checkDuplication(QualityConfig.DuplicationSettings settings, List<String> problems) {
        if (settings.k() <= 0) {
            problems.add("duplication.k must be > 0");
        }
        if (settings.w() <= 0) {
            problems.add("duplication.w must be > 0");
        }
        if (settings.minCloneTokens() <= 0) {
            problems.add("duplication.min_clone_tokens must be > 0");
        }
    }

    private static void checkComplexity(QualityConfig.ComplexitySettings settings, List<String> problems) {
        if (settings.percentile() <= 0 || settings.percentile() > 100) {
            problems.add("complexity.percentile must be in (0, 100]");
        }
        if (settings.targetPerLoc() <= 0) {
            problems.add("complexity.target_per_loc must be > 0");
        }
        if (settings.hardCap() <= 0) {
            problems.add("complexity.hard_cap must be > 0");
        }
    }

    private static void checkBootstrap(QualityConfig.BootstrapSettings settings, List<String> problems) {
        if (settings.resamples() <= 0) {
            problems.add("bootstrap.resamples must be > 0");
        }
        if (settings.confidenceLevel() <= 0 || settings.confidenceLevel() >= 1) {
            problems.add("bootstrap.confidence_level must be in (0, 1)");
        }
    }

    private static void checkLayers(List<LayerRule> layers, List<String> problems) {
        Set<String> names = new HashSet<>();
        for (LayerRule layer : layers) {
            if (layer.name() == null || layer.name().isBlank()) {
                problems.add("architecture layer without a name");
                continue;
            }
            if (!names.add(layer.name())) {
                problems.add("duplicate layer name: " + layer.name());
            }
            if (layer.modules().isEmpty()) {
                problems.add("layer " + layer.name() + " declares no module patterns");
            }
        }
        for (LayerRule layer : layers) {
            for (String referenced : layer.allow()) {
                if (!names.contains(referenced)) {
                    problems.add("layer " + layer.name() + " allows undefined layer " + referenced);
                }
            }
            for (String referenced : layer.forbid()) {
                if (!names.contains(referenced)) {
                    problems.add("layer " + layer.name() + " forbids undefined layer " + referenced);
                }
                if (layer.allows(referenced)) {
                    problems.add("layer " + layer.name() + " both allows and forbids " + referenced);
                }
            }
        }
    }

    private static void checkTool(String key, QualityConfig.ToolCommand tool, List<String> problems) {
        if (tool.timeoutSeconds() <= 0) {
            problems.add(key + ".timeout_seconds must be > 0");
        }
    }
}
