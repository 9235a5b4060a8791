package org.netpreserve.sitemirror.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Loads {@code defaults.yaml} from the classpath and merges an optional user file over it.
 */
public class ConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public MirrorConfig load(@Nullable Path userFile) throws IOException {
        JsonNode tree;
        try (InputStream stream = ConfigLoader.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            tree = mapper.readTree(stream);
        }
        if (userFile != null) {
            JsonNode user = mapper.readTree(userFile.toFile());
            if (user != null && !user.isMissingNode() && !user.isNull()) {
                tree = deepMerge(tree, user);
            }
        }
        return mapper.treeToValue(tree, MirrorConfig.class);
    }

    public String dump(MirrorConfig config) throws IOException {
        return mapper.writeValueAsString(config);
    }

    /**
     * Objects merge field by field; scalars and arrays from {@code override} replace those in {@code base}.
     */
    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
