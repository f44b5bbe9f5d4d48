package space.ketterling.wxpipeline.api;

import static org.assertj.core.api.Assertions.assertThat;
import static space.ketterling.wxpipeline.db.TestDatabase.fact;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxpipeline.aggregate.Granularity;
import space.ketterling.wxpipeline.config.AppConfig;
import space.ketterling.wxpipeline.db.AggregationRepo;
import space.ketterling.wxpipeline.db.IngestRunRepo;
import space.ketterling.wxpipeline.db.StationRepo;
import space.ketterling.wxpipeline.db.TestDatabase;
import space.ketterling.wxpipeline.db.WeatherFactRepo;
import space.ketterling.wxpipeline.store.StationDirectory;
import space.ketterling.wxpipeline.store.StationMetadata;

class ApiServerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private HikariDataSource ds;
    private ApiServer api;

    @BeforeEach
    void setUp() throws Exception {
        ds = TestDatabase.withSchema();
        WeatherFactRepo facts = new WeatherFactRepo(ds, new StationRepo(ds),
                StationDirectory.of(Map.of("USC00110072",
                        new StationMetadata("Lincoln Municipal Airport", 40.85, -96.75, "NE", 362.0))),
                Clock.fixed(NOW, ZoneOffset.UTC));
        facts.upsert(fact("USC00110072", LocalDate.of(2020, 1, 1), "manual", null, 10, 5, NOW));
        facts.upsert(fact("USC00110072", LocalDate.of(2020, 1, 2), "manual", 120, 40, 0, NOW));
        facts.upsert(fact("OTHER", LocalDate.of(2020, 2, 1), "manual", 100, 20, 0, NOW));
        new AggregationRepo(ds).replace(Granularity.MONTHLY, NOW);
        IngestRunRepo runs = new IngestRunRepo(ds, om);
        runs.startRun("run-1", "sweep", NOW);
        runs.finishRun("run-1", true, Map.of("accepted", 3), NOW.plusSeconds(2));

        Properties p = new Properties();
        p.setProperty("api.port", "0");
        p.setProperty("db.jdbcUrl", "jdbc:duckdb:");
        api = new ApiServer(AppConfig.load(p, Map.of()), om, ds);
        api.start();
    }

    @AfterEach
    void tearDown() {
        api.stop();
        ds.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path)).GET().build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode getJson(String path) throws Exception {
        HttpResponse<String> res = get(path);
        assertThat(res.statusCode()).isEqualTo(200);
        return om.readTree(res.body());
    }

    @Test
    void health_reportsDatabaseOk() throws Exception {
        JsonNode body = getJson("/health");

        assertThat(body.get("status").asText()).isEqualTo("ok");
        assertThat(body.get("db").asText()).isEqualTo("ok");
        assertThat(body.get("last_run").get("status").asText()).isEqualTo("SUCCESS");
    }

    @Test
    void weather_pagesNewestFirstWithEnvelope() throws Exception {
        JsonNode body = getJson("/api/weather?station_id=USC00110072&per_page=1");

        JsonNode row = body.get("data").get(0);
        assertThat(row.get("observation_date").asText()).isEqualTo("2020-01-02");
        assertThat(row.get("max_temp_c").asDouble()).isEqualTo(12.0);
        assertThat(row.get("data_quality").asText()).isEqualTo("excellent");

        JsonNode pg = body.get("pagination");
        assertThat(pg.get("page").asInt()).isEqualTo(1);
        assertThat(pg.get("per_page").asInt()).isEqualTo(1);
        assertThat(pg.get("total").asLong()).isEqualTo(2);
        assertThat(pg.get("pages").asInt()).isEqualTo(2);
        assertThat(pg.get("has_next").asBoolean()).isTrue();
        assertThat(pg.get("has_prev").asBoolean()).isFalse();
    }

    @Test
    void weather_missingValuesAreJsonNull() throws Exception {
        JsonNode body = getJson("/api/weather?station_id=USC00110072&end_date=2020-01-01");

        JsonNode row = body.get("data").get(0);
        assertThat(row.get("max_temp_c").isNull()).isTrue();
        assertThat(row.get("min_temp_c").asDouble()).isEqualTo(1.0);
    }

    @Test
    void weather_perPageIsCapped() throws Exception {
        JsonNode body = getJson("/api/weather?per_page=5000");

        assertThat(body.get("pagination").get("per_page").asInt()).isEqualTo(ApiServer.MAX_PER_PAGE);
    }

    @Test
    void listings_withoutPerPage_defaultToFifty() throws Exception {
        assertThat(getJson("/api/weather").get("pagination").get("per_page").asInt()).isEqualTo(50);
        assertThat(getJson("/api/stations").get("pagination").get("per_page").asInt()).isEqualTo(50);
    }

    @Test
    void weather_badDateOrQuality_isBadRequest() throws Exception {
        assertThat(get("/api/weather?start_date=01/01/2020").statusCode()).isEqualTo(400);
        assertThat(get("/api/weather?data_quality=stellar").statusCode()).isEqualTo(400);
        assertThat(get("/api/weather?start_date=2020-02-01&end_date=2020-01-01").statusCode()).isEqualTo(400);
    }

    @Test
    void stations_filtersByState() throws Exception {
        JsonNode body = getJson("/api/stations?state=NE");

        assertThat(body.get("data")).hasSize(1);
        assertThat(body.get("data").get(0).get("name").asText()).isEqualTo("Lincoln Municipal Airport");
        assertThat(body.get("pagination").get("total").asLong()).isEqualTo(1);
    }

    @Test
    void aggregations_returnsMonthlyRows() throws Exception {
        JsonNode body = getJson("/api/weather/aggregations?granularity=monthly&station_id=USC00110072");

        JsonNode row = body.get("data").get(0);
        assertThat(row.get("month").asInt()).isEqualTo(1);
        assertThat(row.get("quarter").isNull()).isTrue();
        assertThat(row.get("record_count").asLong()).isEqualTo(2);
        assertThat(row.get("avg_max_temp_c").asDouble()).isEqualTo(12.0);

        assertThat(get("/api/weather/aggregations?granularity=weekly").statusCode()).isEqualTo(400);
    }

    @Test
    void stats_reportsDistribution() throws Exception {
        JsonNode body = getJson("/api/stats");

        assertThat(body.get("total_stations").asLong()).isEqualTo(2);
        assertThat(body.get("total_weather_records").asLong()).isEqualTo(3);
        assertThat(body.get("quality_distribution").get("excellent").asLong()).isEqualTo(2);
        assertThat(body.get("quality_distribution").get("good").asLong()).isEqualTo(1);
        assertThat(body.get("quality_distribution").get("poor").asLong()).isZero();
    }

    @Test
    void ingestRuns_embedsNotesAsJson() throws Exception {
        JsonNode body = getJson("/api/ingest/runs");

        assertThat(body).hasSize(1);
        assertThat(body.get(0).get("status").asText()).isEqualTo("SUCCESS");
        assertThat(body.get(0).get("notes").get("accepted").asInt()).isEqualTo(3);
    }
}
