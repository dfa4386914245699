package org.netpreserve.hubfinder.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the bundled defaults and merges a job's config.yaml over them.
 */
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static JobConfig defaults() throws IOException {
        return load(null);
    }

    /**
     * @param configFile YAML overrides, may be null or missing
     */
    public static JobConfig load(@Nullable Path configFile) throws IOException {
        var mapper = mapper();
        JsonNode configTree;
        try (var stream = Objects.requireNonNull(ConfigLoader.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        if (configFile != null && Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                JsonNode baseValue = merged.get(key);
                merged.set(key, deepMerge(baseValue, overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
