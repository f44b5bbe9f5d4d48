/*
* Copyright 2025 Taylor Ketterling
* Station Repository for the wx-pipeline station ingest.
* Utilizes HikariCP for database connection pooling and performs insert-if-absent
* operations on station metadata.
*/
package space.ketterling.wxpipeline.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.wxpipeline.model.Page;
import space.ketterling.wxpipeline.model.Station;
import space.ketterling.wxpipeline.store.StationMetadata;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for the station dimension.
 */
public class StationRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(StationRepo.class);

    static final String DEFAULT_COUNTRY = "USA";
    static final String DEFAULT_TIMEZONE = "UTC";

    private static final String COLUMNS = "station_id, name, latitude, longitude, elevation, state, country, "
            + "timezone, active, created_at, updated_at";

    /**
     * Creates a repo backed by the provided datasource.
     */
    public StationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts the station if it does not exist yet. Existing rows are left
     * untouched.
     *
     * @return true when a row was created
     */
    public boolean ensureStation(String stationId, StationMetadata md, Instant now) throws SQLException {
        String sql = "INSERT INTO stations (" + COLUMNS + ") " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS TIMESTAMP), CAST(? AS TIMESTAMP)) " +
                "ON CONFLICT (station_id) DO NOTHING";

        int inserted;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stationId);
            ps.setString(2, md.name());
            JdbcSupport.setDouble(ps, 3, md.latitude());
            JdbcSupport.setDouble(ps, 4, md.longitude());
            JdbcSupport.setDouble(ps, 5, md.elevation());
            ps.setString(6, md.state());
            ps.setString(7, DEFAULT_COUNTRY);
            ps.setString(8, DEFAULT_TIMEZONE);
            ps.setBoolean(9, true);
            ps.setString(10, JdbcSupport.timestamp(now));
            ps.setString(11, JdbcSupport.timestamp(now));
            inserted = ps.executeUpdate();
        }

        log.debug("ensureStation: {} created={}", stationId, inserted > 0);
        return inserted > 0;
    }

    /**
     * Returns the station, or empty if unknown.
     */
    public Optional<Station> find(String stationId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM stations WHERE station_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists stations ordered by id, optionally filtered by state, active flag
     * and country.
     */
    public Page<Station> list(String state, Boolean active, String country, int page, int perPage)
            throws SQLException {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (state != null && !state.isBlank()) {
            where.append(" AND state = ?");
            params.add(state);
        }
        if (active != null) {
            where.append(" AND active = ?");
            params.add(active);
        }
        if (country != null && !country.isBlank()) {
            where.append(" AND country = ?");
            params.add(country);
        }

        long total;
        List<Station> rows = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM stations" + where)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }

            String sql = "SELECT " + COLUMNS + " FROM stations" + where + " ORDER BY station_id"
                    + " LIMIT " + perPage + " OFFSET " + (long) (page - 1) * perPage;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, params);
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
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM stations");
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            if (p instanceof Boolean)
                ps.setBoolean(i + 1, (Boolean) p);
            else
                ps.setString(i + 1, String.valueOf(p));
        }
    }

    private static Station map(ResultSet rs) throws SQLException {
        return new Station(
                rs.getString("station_id"),
                rs.getString("name"),
                JdbcSupport.getDouble(rs, "latitude"),
                JdbcSupport.getDouble(rs, "longitude"),
                JdbcSupport.getDouble(rs, "elevation"),
                rs.getString("state"),
                rs.getString("country"),
                rs.getString("timezone"),
                rs.getBoolean("active"),
                JdbcSupport.getInstant(rs, "created_at"),
                JdbcSupport.getInstant(rs, "updated_at"));
    }
}
