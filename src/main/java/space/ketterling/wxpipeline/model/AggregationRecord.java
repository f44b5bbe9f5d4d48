package space.ketterling.wxpipeline.model;

import space.ketterling.wxpipeline.aggregate.Granularity;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Derived per-station summary for one period. Month is set only for monthly
 * rows, quarter only for quarterly rows. Metrics are null when every fact in
 * the period had the metric missing.
 */
public record AggregationRecord(
        Granularity granularity,
        String stationId,
        LocalDate periodStart,
        int year,
        Integer month,
        Integer quarter,
        Double avgMaxTempC,
        Double avgMinTempC,
        Double totalPrecipMm,
        Double totalPrecipCm,
        long recordCount,
        Double avgQualityScore,
        Instant computedAt) {
}
