package org.netpreserve.scriptorium.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds a {@link JobConfig} from the bundled defaults, an optional YAML file and programmatic overrides.
 */
public class ConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Returns the defaults merged with the given file. A missing file is an error only when {@code required}.
     */
    public ObjectNode load(@Nullable Path file, boolean required) throws ConfigurationException {
        ObjectNode tree = defaults();
        if (file == null) return tree;
        if (!Files.exists(file)) {
            if (required) throw new ConfigurationException("Config file not found: " + file);
            return tree;
        }
        try {
            JsonNode override = mapper.readTree(file.toFile());
            if (override == null || override.isMissingNode() || override.isNull()) return tree;
            if (!override.isObject()) throw new ConfigurationException("Config file must contain a mapping: " + file);
            return (ObjectNode) deepMerge(tree, override);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read config file " + file + ": " + e.getMessage(), e);
        }
    }

    public ObjectNode defaults() throws ConfigurationException {
        try (InputStream stream = Objects.requireNonNull(ConfigLoader.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            return (ObjectNode) mapper.readTree(stream);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read built-in defaults: " + e.getMessage(), e);
        }
    }

    public JobConfig bind(JsonNode tree) throws ConfigurationException {
        JobConfig config;
        try {
            config = mapper.treeToValue(tree, JobConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        config.validate();
        return config;
    }

    public String dump(JobConfig config) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    /**
     * Returns the named child object, creating it if absent.
     */
    public static ObjectNode section(ObjectNode tree, String name) {
        JsonNode node = tree.get(name);
        if (node instanceof ObjectNode objectNode) return objectNode;
        return tree.putObject(name);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode baseValue = merged.get(key);
            merged.set(key, baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }
}
