package space.ketterling.wxpipeline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.wxpipeline.aggregate.Granularity;
import space.ketterling.wxpipeline.db.FactQuery;
import space.ketterling.wxpipeline.model.AggregationRecord;
import space.ketterling.wxpipeline.model.IngestionSummary;
import space.ketterling.wxpipeline.model.Page;
import space.ketterling.wxpipeline.model.WeatherFact;
import space.ketterling.wxpipeline.quality.QualityTier;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Weather fact listing, aggregations and ingestion stats.
 */
final class ApiRoutesWeather {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesWeather() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/weather", ctx -> {
            int page = ApiServer.parseInt(ctx.queryParam("page"), 1, 1, Integer.MAX_VALUE);
            int perPage = ApiServer.parseInt(ctx.queryParam("per_page"), ApiServer.DEFAULT_PER_PAGE, 1,
                    ApiServer.MAX_PER_PAGE);

            LocalDate start = ApiServer.parseDate("start_date", ctx.queryParam("start_date"));
            LocalDate end = ApiServer.parseDate("end_date", ctx.queryParam("end_date"));
            if (start != null && end != null && end.isBefore(start))
                throw new IllegalArgumentException("end_date is before start_date");

            String quality = ctx.queryParam("data_quality");
            if (quality != null && !quality.isBlank())
                quality = QualityTier.fromLabel(quality.trim()).label();

            FactQuery q = new FactQuery(ctx.queryParam("station_id"), start, end, ctx.queryParam("source"), quality);
            Page<WeatherFact> result = api.facts().list(q, page, perPage);

            ArrayNode arr = om.createArrayNode();
            for (WeatherFact f : result.data()) {
                ObjectNode row = om.createObjectNode();
                row.put("station_id", f.stationId());
                row.put("observation_date", f.observationDate().toString());
                row.put("source", f.source());
                api.putNullable(row, "raw_max_temp", f.rawMaxTemp());
                api.putNullable(row, "raw_min_temp", f.rawMinTemp());
                api.putNullable(row, "raw_precip", f.rawPrecip());
                api.putNullable(row, "max_temp_c", f.maxTempC());
                api.putNullable(row, "min_temp_c", f.minTempC());
                api.putNullable(row, "precip_mm", f.precipMm());
                api.putNullable(row, "precip_cm", f.precipCm());
                row.put("data_quality", f.dataQuality().label());
                row.put("quality_score", f.qualityScore());
                row.put("missing_values", f.missingValues());
                row.put("outlier_count", f.outlierCount());
                api.putNullable(row, "quality_notes", f.qualityNotes());
                api.putNullable(row, "ingested_at", f.ingestedAt());
                api.putNullable(row, "ingest_run_id", f.ingestRunId());
                arr.add(row);
            }

            ctx.json(api.envelope(result, arr));
        });

        app.get("/api/weather/aggregations", ctx -> {
            String g = ctx.queryParam("granularity");
            Granularity granularity = (g == null || g.isBlank()) ? Granularity.ANNUAL : Granularity.fromParam(g);
            Integer year = ApiServer.parseInt(ctx.queryParam("year"), null, 1, 9999);

            ArrayNode arr = om.createArrayNode();
            for (AggregationRecord a : api.aggregates().list(granularity, ctx.queryParam("station_id"), year)) {
                ObjectNode row = om.createObjectNode();
                row.put("granularity", a.granularity().name().toLowerCase(Locale.ROOT));
                row.put("station_id", a.stationId());
                row.put("period_start", a.periodStart().toString());
                row.put("year", a.year());
                api.putNullable(row, "month", a.month());
                api.putNullable(row, "quarter", a.quarter());
                api.putNullable(row, "avg_max_temp_c", a.avgMaxTempC());
                api.putNullable(row, "avg_min_temp_c", a.avgMinTempC());
                api.putNullable(row, "total_precip_mm", a.totalPrecipMm());
                api.putNullable(row, "total_precip_cm", a.totalPrecipCm());
                row.put("record_count", a.recordCount());
                api.putNullable(row, "avg_quality_score", a.avgQualityScore());
                api.putNullable(row, "computed_at", a.computedAt());
                arr.add(row);
            }

            ObjectNode out = om.createObjectNode();
            out.set("data", arr);
            ctx.json(out);
        });

        app.get("/api/stats", ctx -> {
            IngestionSummary s = api.facts().summary();
            ObjectNode out = om.createObjectNode();
            out.put("total_stations", s.stations());
            out.put("total_weather_records", s.weatherFacts());
            ObjectNode dist = out.putObject("quality_distribution");
            for (Map.Entry<String, Long> e : s.qualityDistribution().entrySet())
                dist.put(e.getKey(), e.getValue().longValue());
            ctx.json(out);
        });
    }
}
