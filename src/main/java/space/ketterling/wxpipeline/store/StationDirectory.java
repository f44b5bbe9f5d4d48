package space.ketterling.wxpipeline.store;

import java.util.Map;
import java.util.Optional;

/**
 * Lookup of reference metadata by station id.
 */
@FunctionalInterface
public interface StationDirectory {

    Optional<StationMetadata> lookup(String stationId);

    static StationDirectory empty() {
        return id -> Optional.empty();
    }

    static StationDirectory of(Map<String, StationMetadata> entries) {
        Map<String, StationMetadata> copy = Map.copyOf(entries);
        return id -> Optional.ofNullable(copy.get(id));
    }
}
