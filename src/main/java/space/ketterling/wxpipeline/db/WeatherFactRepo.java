/*
* Copyright 2025 Taylor Ketterling
* Weather Fact Repository for the wx-pipeline station ingest.
* Utilizes HikariCP for database connection pooling and performs composite-key
* upserts into the weather_facts table.
*/
package space.ketterling.wxpipeline.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.wxpipeline.model.IngestionSummary;
import space.ketterling.wxpipeline.model.Page;
import space.ketterling.wxpipeline.model.WeatherFact;
import space.ketterling.wxpipeline.quality.QualityTier;
import space.ketterling.wxpipeline.store.FactConstraints;
import space.ketterling.wxpipeline.store.FactRejectedException;
import space.ketterling.wxpipeline.store.FactStore;
import space.ketterling.wxpipeline.store.StationDirectory;
import space.ketterling.wxpipeline.store.StationMetadata;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Database access for weather facts: the composite-key upsert used by ingest
 * plus the read queries used by the API and summaries.
 */
public class WeatherFactRepo implements FactStore {
    private final HikariDataSource ds;
    private final StationRepo stationRepo;
    private final StationDirectory directory;
    private final Clock clock;
    private final Set<String> knownStations = ConcurrentHashMap.newKeySet();
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(WeatherFactRepo.class);

    private static final String COLUMNS = "station_id, observation_date, source, raw_max_temp, raw_min_temp, "
            + "raw_precip, max_temp_c, min_temp_c, precip_mm, precip_cm, data_quality, quality_score, "
            + "missing_values, outlier_count, quality_notes, ingested_at, ingest_run_id";

    private static final String UPSERT_SQL = "INSERT INTO weather_facts (" + COLUMNS + ") " +
            "VALUES (?, CAST(? AS DATE), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS TIMESTAMP), ?) " +
            "ON CONFLICT (station_id, observation_date, source) DO UPDATE SET " +
            "raw_max_temp=EXCLUDED.raw_max_temp, raw_min_temp=EXCLUDED.raw_min_temp, " +
            "raw_precip=EXCLUDED.raw_precip, max_temp_c=EXCLUDED.max_temp_c, min_temp_c=EXCLUDED.min_temp_c, " +
            "precip_mm=EXCLUDED.precip_mm, precip_cm=EXCLUDED.precip_cm, data_quality=EXCLUDED.data_quality, " +
            "quality_score=EXCLUDED.quality_score, missing_values=EXCLUDED.missing_values, " +
            "outlier_count=EXCLUDED.outlier_count, quality_notes=EXCLUDED.quality_notes, " +
            "ingested_at=EXCLUDED.ingested_at, ingest_run_id=EXCLUDED.ingest_run_id";

    /**
     * Creates a repo backed by the provided datasource. Unknown stations are
     * created from {@code directory} metadata, or a placeholder, on first write.
     */
    public WeatherFactRepo(HikariDataSource ds, StationRepo stationRepo, StationDirectory directory, Clock clock) {
        this.ds = ds;
        this.stationRepo = stationRepo;
        this.directory = directory;
        this.clock = clock;
    }

    /**
     * Inserts or fully replaces one fact row.
     */
    @Override
    public void upsert(WeatherFact f) throws FactRejectedException, SQLException {
        FactConstraints.check(f);
        ensureStation(f.stationId());

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, f.stationId());
            ps.setString(2, f.observationDate().toString());
            ps.setString(3, f.source());
            JdbcSupport.setInt(ps, 4, f.rawMaxTemp());
            JdbcSupport.setInt(ps, 5, f.rawMinTemp());
            JdbcSupport.setInt(ps, 6, f.rawPrecip());
            JdbcSupport.setDouble(ps, 7, f.maxTempC());
            JdbcSupport.setDouble(ps, 8, f.minTempC());
            JdbcSupport.setDouble(ps, 9, f.precipMm());
            JdbcSupport.setDouble(ps, 10, f.precipCm());
            ps.setString(11, f.dataQuality().label());
            ps.setDouble(12, f.qualityScore());
            ps.setInt(13, f.missingValues());
            ps.setInt(14, f.outlierCount());
            ps.setString(15, f.qualityNotes());
            ps.setString(16, JdbcSupport.timestamp(f.ingestedAt()));
            ps.setString(17, f.ingestRunId());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (JdbcSupport.isConstraintViolation(e))
                throw new FactRejectedException("Rejected by database constraint: " + e.getMessage(), e);
            throw e;
        }

        log.debug("upsert: {} {} {}", f.stationId(), f.observationDate(), f.source());
    }

    /**
     * Creates the station row once per process for each station id seen.
     */
    private void ensureStation(String stationId) throws SQLException {
        if (knownStations.contains(stationId))
            return;

        StationMetadata md = directory.lookup(stationId).orElse(null);
        if (md != null) {
            try {
                md.validate();
            } catch (IllegalArgumentException e) {
                log.warn("Invalid station metadata for {}: {}; using placeholder", stationId, e.getMessage());
                md = null;
            }
        }
        if (md == null)
            md = StationMetadata.placeholder(stationId);

        if (stationRepo.ensureStation(stationId, md, clock.instant()))
            log.info("Created station {} ({})", stationId, md.name());
        knownStations.add(stationId);
    }

    /**
     * Returns one fact by its composite key.
     */
    public Optional<WeatherFact> find(String stationId, LocalDate date, String source)
            throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM weather_facts "
                + "WHERE station_id = ? AND observation_date = CAST(? AS DATE) AND source = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stationId);
            ps.setString(2, date.toString());
            ps.setString(3, source);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists facts newest first (then by station and source).
     */
    public Page<WeatherFact> list(FactQuery q, int page, int perPage) throws SQLException {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<String> params = new ArrayList<>();
        if (q.stationId() != null && !q.stationId().isBlank()) {
            where.append(" AND station_id = ?");
            params.add(q.stationId());
        }
        if (q.startDate() != null) {
            where.append(" AND observation_date >= CAST(? AS DATE)");
            params.add(q.startDate().toString());
        }
        if (q.endDate() != null) {
            where.append(" AND observation_date <= CAST(? AS DATE)");
            params.add(q.endDate().toString());
        }
        if (q.source() != null && !q.source().isBlank()) {
            where.append(" AND source = ?");
            params.add(q.source());
        }
        if (q.dataQuality() != null && !q.dataQuality().isBlank()) {
            where.append(" AND data_quality = ?");
            params.add(q.dataQuality());
        }

        long total;
        List<WeatherFact> rows = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM weather_facts" + where)) {
                for (int i = 0; i < params.size(); i++)
                    ps.setString(i + 1, params.get(i));
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }

            String sql = "SELECT " + COLUMNS + " FROM weather_facts" + where
                    + " ORDER BY observation_date DESC, station_id, source"
                    + " LIMIT " + perPage + " OFFSET " + (long) (page - 1) * perPage;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (int i = 0; i < params.size(); i++)
                    ps.setString(i + 1, params.get(i));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        rows.add(map(rs));
                }
            }
        }
        return new Page<>(rows, page, perPage, total);
    }

    public long count() throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM weather_facts");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Station and fact counts plus the fact distribution by quality tier. Every
     * tier is present in the distribution, with zero when unused.
     */
    public IngestionSummary summary() throws SQLException {
        Map<String, Long> dist = new LinkedHashMap<>();
        for (QualityTier t : QualityTier.values())
            dist.put(t.label(), 0L);

        String sql = "SELECT data_quality, COUNT(*) AS n FROM weather_facts GROUP BY data_quality";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                dist.put(rs.getString("data_quality"), rs.getLong("n"));
        }

        return new IngestionSummary(stationRepo.count(), count(), dist);
    }

    private static WeatherFact map(ResultSet rs) throws SQLException {
        return new WeatherFact(
                rs.getString("station_id"),
                JdbcSupport.getDate(rs, "observation_date"),
                rs.getString("source"),
                JdbcSupport.getInt(rs, "raw_max_temp"),
                JdbcSupport.getInt(rs, "raw_min_temp"),
                JdbcSupport.getInt(rs, "raw_precip"),
                JdbcSupport.getDouble(rs, "max_temp_c"),
                JdbcSupport.getDouble(rs, "min_temp_c"),
                JdbcSupport.getDouble(rs, "precip_mm"),
                JdbcSupport.getDouble(rs, "precip_cm"),
                QualityTier.fromLabel(rs.getString("data_quality")),
                rs.getDouble("quality_score"),
                rs.getInt("missing_values"),
                rs.getInt("outlier_count"),
                rs.getString("quality_notes"),
                JdbcSupport.getInstant(rs, "ingested_at"),
                rs.getString("ingest_run_id"));
    }
}
