package org.netpreserve.sitemirror.blockid;

import com.fasterxml.jackson.core.type.TypeReference;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitemirror.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists each page's block-ID map as a sidecar file next to its saved document.
 */
public class BlockIdMapper {
    private static final Logger log = LoggerFactory.getLogger(BlockIdMapper.class);
    public static final String SIDECAR = ".block-ids.json";
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    public void save(Path pageDirectory, Map<String, String> blockMap) throws IOException {
        Files.createDirectories(pageDirectory);
        Json.MAPPER.writerWithDefaultPrettyPrinter().writeValue(pageDirectory.resolve(SIDECAR).toFile(), blockMap);
    }

    /**
     * Loads a page's block map. A missing or unreadable sidecar gives an empty map.
     */
    public Map<String, String> load(Path pageDirectory) {
        Path file = pageDirectory.resolve(SIDECAR);
        try {
            Map<String, String> map = Json.MAPPER.readValue(Files.readAllBytes(file), MAP_TYPE);
            return map == null ? Map.of() : map;
        } catch (NoSuchFileException e) {
            return Map.of();
        } catch (IOException e) {
            log.debug("Ignoring unreadable block map {}: {}", file, e.toString());
            return Map.of();
        }
    }

    /**
     * Returns the anchor ID to link to for {@code rawId}: the form rendered on the target page if the
     * page's map knows it, otherwise the structural dashed form. Strings that aren't block IDs are
     * returned unchanged.
     */
    public static String formattedId(String rawId, @Nullable Map<String, String> blockMap) {
        String raw = BlockIds.normalize(rawId);
        if (raw == null) return rawId;
        if (blockMap != null) {
            String rendered = blockMap.get(raw);
            if (rendered != null) return rendered;
        }
        return BlockIds.format(raw);
    }
}
