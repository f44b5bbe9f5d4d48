/*
* Copyright 2025 Taylor Ketterling
* Runtime configuration for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, database, file sweep
 * and schedules.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbApiPoolMax,
        int dbIngestPoolMax,
        boolean dbAutoMigrate,

        // File sweep
        String watchDir,
        String archiveDir,
        String fileSuffix,
        String ingestSource,
        String ingestRunId, // blank = one generated id per sweep
        String stationMetadataPath, // blank = classpath stations.json

        // Schedules
        Duration sweepInterval,
        Duration aggregateInterval) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read application.properties", e);
        }
        return load(p, System.getenv());
    }

    /**
     * Builds the config from explicit sources; used by {@link #load()} and tests.
     */
    public static AppConfig load(Properties p, Map<String, String> env) {
        String dbUrl = requireNonBlank("db.jdbcUrl", envOr(env, p, "DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = envOr(env, p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(env, p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth

        int dbApiPoolMax = Integer.parseInt(envOr(env, p, "DB_API_POOL_MAX", "db.api.poolMax", "4"));
        int dbIngestPoolMax = Integer.parseInt(envOr(env, p, "DB_INGEST_POOL_MAX", "db.ingest.poolMax", "4"));
        boolean autoMigrate = Boolean.parseBoolean(envOr(env, p, "DB_AUTO_MIGRATE", "db.autoMigrate", "false"));

        int port = Integer.parseInt(envOr(env, p, "API_PORT", "api.port", "8080"));

        String watchDir = envOr(env, p, "INGEST_WATCH_DIR", "ingest.watchDir", "data/incoming");
        String archiveDir = envOr(env, p, "INGEST_ARCHIVE_DIR", "ingest.archiveDir", "data/archive");
        String suffix = envOr(env, p, "INGEST_FILE_SUFFIX", "ingest.fileSuffix", ".txt");
        String source = requireNonBlank("ingest.source", envOr(env, p, "INGEST_SOURCE", "ingest.source", "manual"));
        String runId = envOr(env, p, "INGEST_RUN_ID", "ingest.runId", "");
        String stationsPath = envOr(env, p, "STATION_METADATA", "stations.metadata", "");

        Duration sweep = Duration.parse(envOr(env, p, "SCHED_SWEEP", "schedule.sweep", "PT15M"));
        Duration aggregate = Duration.parse(envOr(env, p, "SCHED_AGGREGATE", "schedule.aggregate", "PT1H"));

        if (sweep.isNegative() || sweep.toSeconds() < 1 || aggregate.isNegative() || aggregate.toSeconds() < 1)
            throw new IllegalStateException("schedule intervals must be at least one second");
        if (source.length() > 50)
            throw new IllegalStateException("ingest.source must be at most 50 characters");
        if (runId.length() > 36)
            throw new IllegalStateException("ingest.runId must be at most 36 characters");

        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbApiPoolMax,
                dbIngestPoolMax,
                autoMigrate,

                watchDir,
                archiveDir,
                suffix,
                source,
                runId,
                stationsPath,

                sweep,
                aggregate);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Map<String, String> env, Properties p, String envKey, String propKey, String def) {
        String v = env.get(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String key, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + key + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
