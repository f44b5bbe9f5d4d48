/*
* Copyright 2025 Taylor Ketterling
* Weather fact row for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.model;

import space.ketterling.wxpipeline.quality.QualityAssessment;
import space.ketterling.wxpipeline.quality.QualityTier;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One persisted fact, keyed by (stationId, observationDate, source).
 * Written in full on every ingestion of its source line.
 */
public record WeatherFact(
        String stationId,
        LocalDate observationDate,
        String source,
        Integer rawMaxTemp,
        Integer rawMinTemp,
        Integer rawPrecip,
        Double maxTempC,
        Double minTempC,
        Double precipMm,
        Double precipCm,
        QualityTier dataQuality,
        double qualityScore,
        int missingValues,
        int outlierCount,
        String qualityNotes,
        Instant ingestedAt,
        String ingestRunId) {

    /**
     * Assembles a fact from a decoded observation and its quality grade.
     */
    public static WeatherFact of(String stationId, String source, Observation obs, QualityAssessment qa,
            Instant ingestedAt, String ingestRunId) {
        return new WeatherFact(
                stationId,
                obs.date(),
                source,
                obs.rawMaxTemp(),
                obs.rawMinTemp(),
                obs.rawPrecip(),
                obs.maxTempC(),
                obs.minTempC(),
                obs.precipMm(),
                obs.precipCm(),
                qa.tier(),
                qa.score(),
                qa.missingCount(),
                qa.outlierCount(),
                qa.notes(),
                ingestedAt,
                ingestRunId);
    }
}
