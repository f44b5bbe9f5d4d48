/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for wx-pipeline, a station weather ingestion,
* quality grading and aggregation pipeline.
*
* Loads configuration, sets up connection pools, verifies the schema, wires
* repositories and services, then either serves the API with the scheduler
* or runs a single job (ingest, aggregate, pipeline, summary) and exits.
*/

package space.ketterling.wxpipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.wxpipeline.aggregate.AggregationService;
import space.ketterling.wxpipeline.api.ApiServer;
import space.ketterling.wxpipeline.config.AppConfig;
import space.ketterling.wxpipeline.db.AggregationRepo;
import space.ketterling.wxpipeline.db.Database;
import space.ketterling.wxpipeline.db.IngestRunRepo;
import space.ketterling.wxpipeline.db.SchemaBootstrap;
import space.ketterling.wxpipeline.db.StationRepo;
import space.ketterling.wxpipeline.db.WeatherFactRepo;
import space.ketterling.wxpipeline.ingest.FileLifecycleManager;
import space.ketterling.wxpipeline.ingest.IngestScheduler;
import space.ketterling.wxpipeline.ingest.PipelineService;
import space.ketterling.wxpipeline.ingest.SweepReport;
import space.ketterling.wxpipeline.model.IngestionSummary;
import space.ketterling.wxpipeline.store.JsonStationDirectory;
import space.ketterling.wxpipeline.store.StationDirectory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Locale;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        String mode = args.length > 0 ? args[0].trim().toLowerCase(Locale.ROOT) : "serve";
        log.info("Starting wx-pipeline (mode={})", mode);

        AppConfig cfg;
        try {
            cfg = AppConfig.load();
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        switch (mode) {
            case "serve" -> serve(cfg);
            case "ingest", "aggregate", "pipeline", "summary" -> System.exit(runOnce(cfg, mode));
            default -> {
                log.error("Unknown mode '{}' (expected serve, ingest, aggregate, pipeline or summary)", mode);
                System.exit(2);
            }
        }
    }

    /**
     * API server plus scheduled sweeps and aggregations until shutdown.
     */
    private static void serve(AppConfig cfg) throws IOException {
        ObjectMapper om = new ObjectMapper();
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        HikariDataSource ingestDs = Database.createIngestDataSource(cfg);

        if (!prepareSchema(cfg, ingestDs)) {
            apiDs.close();
            ingestDs.close();
            System.exit(3);
            return;
        }

        PipelineService pipeline = pipeline(cfg, om, ingestDs);
        IngestScheduler scheduler = new IngestScheduler(cfg, pipeline);
        scheduler.start();

        ApiServer api = new ApiServer(cfg, om, apiDs);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            api.stop();
            scheduler.stop();
            apiDs.close();
            ingestDs.close();
        }));
    }

    /**
     * Runs one job and returns the process exit code.
     */
    static int runOnce(AppConfig cfg, String mode) throws IOException {
        ObjectMapper om = new ObjectMapper();
        try (HikariDataSource ds = Database.createIngestDataSource(cfg)) {
            if (!prepareSchema(cfg, ds))
                return 3;

            PipelineService pipeline = pipeline(cfg, om, ds);
            MDC.put("job", mode);
            try {
                switch (mode) {
                    case "ingest" -> {
                        SweepReport report = pipeline.sweep();
                        return report.failed().isEmpty() ? 0 : 1;
                    }
                    case "aggregate" -> {
                        boolean ok = pipeline.aggregate().stream().allMatch(r -> r.success());
                        return ok ? 0 : 1;
                    }
                    case "pipeline" -> {
                        return pipeline.runPipeline().success() ? 0 : 1;
                    }
                    case "summary" -> {
                        IngestionSummary s = factRepo(cfg, om, ds).summary();
                        log.info("Stations={} facts={} quality={}", s.stations(), s.weatherFacts(),
                                s.qualityDistribution());
                        return 0;
                    }
                    default -> throw new IllegalArgumentException("unknown mode " + mode);
                }
            } catch (SQLException | IOException e) {
                log.error("Job {} failed", mode, e);
                return 1;
            } finally {
                MDC.remove("job");
            }
        }
    }

    /**
     * Applies the schema when configured, then checks the required tables.
     */
    private static boolean prepareSchema(AppConfig cfg, HikariDataSource ds) {
        try {
            if (cfg.dbAutoMigrate())
                SchemaBootstrap.apply(ds);
            SchemaBootstrap.verify(ds);
            return true;
        } catch (IOException | SQLException | IllegalStateException e) {
            log.error("Database schema is not usable; refusing to start", e);
            return false;
        }
    }

    private static PipelineService pipeline(AppConfig cfg, ObjectMapper om, HikariDataSource ds) throws IOException {
        Clock clock = Clock.systemUTC();
        FileLifecycleManager lifecycle = new FileLifecycleManager(factRepo(cfg, om, ds),
                Path.of(cfg.watchDir()), Path.of(cfg.archiveDir()), cfg.fileSuffix(), clock);
        AggregationService aggregation = new AggregationService(new AggregationRepo(ds), clock);
        return new PipelineService(lifecycle, aggregation, new IngestRunRepo(ds, om), cfg.ingestSource(),
                cfg.ingestRunId(), clock);
    }

    private static WeatherFactRepo factRepo(AppConfig cfg, ObjectMapper om, HikariDataSource ds) throws IOException {
        StationDirectory directory = cfg.stationMetadataPath().isBlank()
                ? JsonStationDirectory.fromClasspath(om, JsonStationDirectory.DEFAULT_RESOURCE)
                : JsonStationDirectory.fromFile(om, Path.of(cfg.stationMetadataPath()));
        return new WeatherFactRepo(ds, new StationRepo(ds), directory, Clock.systemUTC());
    }
}
