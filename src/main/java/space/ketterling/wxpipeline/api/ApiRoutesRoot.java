package space.ketterling.wxpipeline.api;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.javalin.Javalin;
import space.ketterling.wxpipeline.model.IngestRun;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service index and health check.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "wx-pipeline",
                "status", "ok",
                "endpoints", List.of(
                        "GET /health",
                        "GET /api/stations?state=NE&active=true&page=1&per_page=50",
                        "GET /api/weather?station_id=USC00110072&start_date=2020-01-01&end_date=2020-12-31",
                        "GET /api/weather/aggregations?granularity=monthly&station_id=USC00110072&year=2020",
                        "GET /api/stats",
                        "GET /api/ingest/runs?limit=50"))));

        // 503 only when the database is unreachable
        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", Instant.now().toString());

            try {
                try (Connection c = ds.getConnection()) {
                    out.put("db", c.isValid(2) ? "ok" : "unknown");
                }
                List<IngestRun> last = api.runs().listRecent(1);
                if (!last.isEmpty()) {
                    IngestRun r = last.get(0);
                    out.put("last_run", Map.of("job_name", r.jobName(), "status", r.status(),
                            "started_at", r.startedAt().toString()));
                }
            } catch (SQLException e) {
                out.put("status", "degraded");
                out.put("db", "fail");
                out.put("db_error", String.valueOf(e.getMessage()));
                ctx.status(503);
            }

            HikariPoolMXBean pool = ds.getHikariPoolMXBean();
            if (pool != null)
                out.put("pool", Map.of("active", pool.getActiveConnections(), "idle", pool.getIdleConnections()));

            ctx.json(out);
        });
    }
}
