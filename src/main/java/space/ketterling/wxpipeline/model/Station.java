/*
* Copyright 2025 Taylor Ketterling
* Station dimension row for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.model;

import java.time.Instant;

/**
 * Weather station dimension. Coordinates and elevation are null when the
 * station was auto-created from a file name with no known metadata.
 */
public record Station(
        String stationId,
        String name,
        Double latitude,
        Double longitude,
        Double elevation,
        String state,
        String country,
        String timezone,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {
}
