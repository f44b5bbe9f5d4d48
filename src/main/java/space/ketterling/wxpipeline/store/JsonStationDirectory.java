/*
* Copyright 2025 Taylor Ketterling
* Static station reference table for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Station directory backed by a JSON object of {@code stationId -> metadata}.
 */
public final class JsonStationDirectory implements StationDirectory {
    private static final Logger log = LoggerFactory.getLogger(JsonStationDirectory.class);
    public static final String DEFAULT_RESOURCE = "stations.json";

    private static final TypeReference<LinkedHashMap<String, StationMetadata>> TYPE = new TypeReference<>() {
    };

    private final Map<String, StationMetadata> entries;

    private JsonStationDirectory(Map<String, StationMetadata> entries) {
        this.entries = Map.copyOf(entries);
    }

    /**
     * Loads the table from the classpath; a missing resource yields an empty
     * directory.
     */
    public static JsonStationDirectory fromClasspath(ObjectMapper om, String resource) throws IOException {
        try (InputStream in = JsonStationDirectory.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Station metadata resource {} not found; all stations will use placeholders", resource);
                return new JsonStationDirectory(Map.of());
            }
            Map<String, StationMetadata> m = om.readValue(in, TYPE);
            log.info("Loaded {} station metadata entries from classpath:{}", m.size(), resource);
            return new JsonStationDirectory(m);
        }
    }

    public static JsonStationDirectory fromFile(ObjectMapper om, Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, StationMetadata> m = om.readValue(in, TYPE);
            log.info("Loaded {} station metadata entries from {}", m.size(), file);
            return new JsonStationDirectory(m);
        }
    }

    @Override
    public Optional<StationMetadata> lookup(String stationId) {
        return Optional.ofNullable(entries.get(stationId));
    }

    public int size() {
        return entries.size();
    }
}
