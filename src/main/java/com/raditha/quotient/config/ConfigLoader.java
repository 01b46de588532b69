package com.raditha.quotient.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link QualityConfig} from YAML.
 * <p>
 * The user document is deep-merged over the built-in defaults: objects merge key by
 * key, lists and scalars replace. Keys are snake_case; enum values are case-insensitive.
 * <pre>{@code
 * weights:
 *   duplication: 0.3
 *   architecture: 0.2
 *   lint: 0.2
 *   typing: 0.1
 *   complexity: 0.2
 * duplication:
 *   k: 7
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    private ConfigLoader() {
    }

    /**
     * Load configuration from a YAML file.
     *
     * @param configPath Path of the YAML document
     * @return Merged configuration, not yet validated
     * @throws IOException                   if the file cannot be read
     * @throws InvalidConfigurationException if the document is not a usable configuration
     */
    public static QualityConfig load(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new NoSuchFileException(configPath.toString(), null, "configuration file not found");
        }
        logger.debug("Loading configuration from: {}", configPath);
        QualityConfig config = parse(Files.readString(configPath, StandardCharsets.UTF_8));
        logger.info("Loaded configuration from: {}", configPath);
        return config;
    }

    /**
     * Parse a YAML document. A blank document yields the defaults.
     *
     * @throws InvalidConfigurationException on malformed YAML, unknown keys or wrong value types
     */
    public static QualityConfig parse(String yaml) {
        try {
            JsonNode user = YAML_MAPPER.readTree(yaml);
            JsonNode defaults = YAML_MAPPER.valueToTree(QualityConfig.defaults());
            if (user == null || user.isMissingNode() || user.isNull()) {
                return YAML_MAPPER.treeToValue(defaults, QualityConfig.class);
            }
            if (!user.isObject()) {
                throw new InvalidConfigurationException(
                        List.of("configuration root must be a mapping"));
            }
            JsonNode merged = merge(defaults.deepCopy(), user);
            return YAML_MAPPER.treeToValue(merged, QualityConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException(e.getOriginalMessage(), e);
        }
    }

    /**
     * Render a configuration as YAML.
     */
    public static String toYaml(QualityConfig config) {
        try {
            return YAML_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render configuration", e);
        }
    }

    /**
     * Deep-merge {@code overlay} into {@code base}. Objects merge recursively; everything
     * else in the overlay replaces the base value.
     */
    static JsonNode merge(JsonNode base, JsonNode overlay) {
        if (!(base instanceof ObjectNode baseObject) || !overlay.isObject()) {
            return overlay;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = baseObject.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                baseObject.set(field.getKey(), merge(existing, field.getValue()));
            } else {
                baseObject.set(field.getKey(), field.getValue());
            }
        }
        return baseObject;
    }
}
