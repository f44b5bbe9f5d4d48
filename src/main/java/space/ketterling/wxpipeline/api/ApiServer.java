/*
* Copyright 2025 Taylor Ketterling
* API Server for the wx-pipeline station ingest.
* utilizes Javalin for the HTTP server and exposes read-only endpoints over
* stations, weather facts, aggregations and ingest runs.
* uses Jackson for JSON processing and HikariCP for database connection pooling.
*/

package space.ketterling.wxpipeline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.wxpipeline.config.AppConfig;
import space.ketterling.wxpipeline.db.AggregationRepo;
import space.ketterling.wxpipeline.db.IngestRunRepo;
import space.ketterling.wxpipeline.db.StationRepo;
import space.ketterling.wxpipeline.db.WeatherFactRepo;
import space.ketterling.wxpipeline.model.Page;
import space.ketterling.wxpipeline.store.StationDirectory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final int MAX_PER_PAGE = 1000;
    static final int DEFAULT_PER_PAGE = 50;

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final StationRepo stations;
    private final WeatherFactRepo facts;
    private final AggregationRepo aggregates;
    private final IngestRunRepo runs;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.stations = new StationRepo(ds);
        // read-only use; no station is ever auto-created through the API
        this.facts = new WeatherFactRepo(ds, stations, StationDirectory.empty(), Clock.systemUTC());
        this.aggregates = new AggregationRepo(ds);
        this.runs = new IngestRunRepo(ds, om);
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            log.warn("Bad request on {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(400).json(om.createObjectNode()
                    .put("error", "bad_request")
                    .put("message", e.getMessage() == null ? "Invalid request" : e.getMessage()));
        });

        // JSON error instead of the default HTML error page
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesStations.register(this);
        ApiRoutesWeather.register(this);
        ApiRoutesIngest.register(this);

        app.start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int port() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    StationRepo stations() {
        return stations;
    }

    WeatherFactRepo facts() {
        return facts;
    }

    AggregationRepo aggregates() {
        return aggregates;
    }

    IngestRunRepo runs() {
        return runs;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    /**
     * Wraps a page of rows in the {@code {data, pagination}} envelope.
     */
    ObjectNode envelope(Page<?> page, ArrayNode data) {
        ObjectNode out = om.createObjectNode();
        out.set("data", data);
        ObjectNode p = out.putObject("pagination");
        p.put("page", page.page());
        p.put("per_page", page.perPage());
        p.put("total", page.total());
        p.put("pages", page.pages());
        p.put("has_next", page.hasNext());
        p.put("has_prev", page.hasPrev());
        return out;
    }

    void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Integer)
            obj.put(key, (Integer) value);
        else if (value instanceof Long)
            obj.put(key, (Long) value);
        else if (value instanceof Number)
            obj.put(key, ((Number) value).doubleValue());
        else if (value instanceof Boolean)
            obj.put(key, (Boolean) value);
        else
            obj.put(key, value.toString());
    }

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /**
     * Parses an ISO date parameter; blank means absent.
     */
    static LocalDate parseDate(String name, String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be YYYY-MM-DD", e);
        }
    }

    static Boolean parseBoolean(String s) {
        if (s == null || s.isBlank())
            return null;
        return Boolean.parseBoolean(s.trim());
    }
}
