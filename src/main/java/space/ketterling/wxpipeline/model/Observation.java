/*
* Copyright 2025 Taylor Ketterling
* Decoded daily observation for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.model;

import java.time.LocalDate;

/**
 * One decoded source line: the raw tenths-of-unit values plus their physical
 * unit equivalents. A null raw value means the field carried the missing
 * sentinel; the matching clean value is null too.
 */
public record Observation(
        LocalDate date,
        Integer rawMaxTemp,
        Integer rawMinTemp,
        Integer rawPrecip,
        Double maxTempC,
        Double minTempC,
        Double precipMm,
        Double precipCm) {

    /**
     * Builds an observation from raw tenths values, deriving the clean columns.
     */
    public static Observation fromRaw(LocalDate date, Integer rawMaxTemp, Integer rawMinTemp, Integer rawPrecip) {
        Double maxC = tenths(rawMaxTemp);
        Double minC = tenths(rawMinTemp);
        Double mm = tenths(rawPrecip);
        Double cm = (mm == null) ? null : mm / 10.0;
        return new Observation(date, rawMaxTemp, rawMinTemp, rawPrecip, maxC, minC, mm, cm);
    }

    private static Double tenths(Integer raw) {
        return raw == null ? null : raw / 10.0;
    }
}
