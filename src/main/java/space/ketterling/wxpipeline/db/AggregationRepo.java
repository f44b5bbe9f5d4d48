/*
* Copyright 2025 Taylor Ketterling
* Aggregation Repository for the wx-pipeline station ingest.
* Recomputes per-station period summaries from weather_facts and replaces
* them inside a single transaction.
*/
package space.ketterling.wxpipeline.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.wxpipeline.aggregate.Granularity;
import space.ketterling.wxpipeline.model.AggregationRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Database access for weather_aggregates.
 */
public class AggregationRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AggregationRepo.class);

    private static final String COLUMNS = "granularity, station_id, period_start, period_year, period_month, "
            + "period_quarter, avg_max_temp_c, avg_min_temp_c, total_precip_mm, total_precip_cm, record_count, "
            + "avg_quality_score, computed_at";

    /**
     * Creates a repo backed by the provided datasource.
     */
    public AggregationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Deletes every row of one granularity and recomputes it from the current
     * facts, all in one transaction. On failure the transaction is rolled back
     * and the previous rows stay in place. A concurrent replace of the same
     * granularity from another process collides on the primary key and is
     * rolled back the same way.
     *
     * @return number of groups written
     */
    public int replace(Granularity g, Instant computedAt) throws SQLException {
        String delete = "DELETE FROM weather_aggregates WHERE granularity = ?";
        String insert = recomputeSql(g);

        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                int removed;
                try (PreparedStatement ps = c.prepareStatement(delete)) {
                    ps.setString(1, g.name());
                    removed = ps.executeUpdate();
                }
                int written;
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    ps.setString(1, JdbcSupport.timestamp(computedAt));
                    written = ps.executeUpdate();
                }
                c.commit();
                log.debug("replace {}: removed={} written={}", g, removed, written);
                return written;
            } catch (SQLException e) {
                try {
                    c.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    /**
     * INSERT ... SELECT grouping every fact by station and period start. AVG and
     * SUM skip nulls, so an all-null metric yields null.
     */
    static String recomputeSql(Granularity g) {
        String month = g == Granularity.MONTHLY ? "CAST(EXTRACT(MONTH FROM period_start) AS INTEGER)"
                : "CAST(NULL AS INTEGER)";
        String quarter = g == Granularity.QUARTERLY ? "CAST(EXTRACT(QUARTER FROM period_start) AS INTEGER)"
                : "CAST(NULL AS INTEGER)";
        String periodStart = "CAST(date_trunc('" + g.truncUnit() + "', CAST(observation_date AS TIMESTAMP)) AS DATE)";

        return "INSERT INTO weather_aggregates (" + COLUMNS + ") "
                + "SELECT '" + g.name() + "', station_id, period_start, "
                + "CAST(EXTRACT(YEAR FROM period_start) AS INTEGER), " + month + ", " + quarter + ", "
                + "AVG(max_temp_c), AVG(min_temp_c), SUM(precip_mm), SUM(precip_cm), COUNT(*), "
                + "AVG(quality_score), CAST(? AS TIMESTAMP) "
                + "FROM (SELECT station_id, max_temp_c, min_temp_c, precip_mm, precip_cm, quality_score, "
                + periodStart + " AS period_start FROM weather_facts) f "
                + "GROUP BY station_id, period_start";
    }

    /**
     * Lists rows of one granularity, optionally for one station and/or year,
     * ordered by station and period.
     */
    public List<AggregationRecord> list(Granularity g, String stationId, Integer year) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM weather_aggregates WHERE granularity = ?");
        boolean byStation = stationId != null && !stationId.isBlank();
        if (byStation)
            sql.append(" AND station_id = ?");
        if (year != null)
            sql.append(" AND period_year = ?");
        sql.append(" ORDER BY station_id, period_start");

        List<AggregationRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setString(i++, g.name());
            if (byStation)
                ps.setString(i++, stationId);
            if (year != null)
                ps.setInt(i, year);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    public long count(Granularity g) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT COUNT(*) FROM weather_aggregates WHERE granularity = ?")) {
            ps.setString(1, g.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private static AggregationRecord map(ResultSet rs) throws SQLException {
        return new AggregationRecord(
                Granularity.valueOf(rs.getString("granularity")),
                rs.getString("station_id"),
                JdbcSupport.getDate(rs, "period_start"),
                rs.getInt("period_year"),
                JdbcSupport.getInt(rs, "period_month"),
                JdbcSupport.getInt(rs, "period_quarter"),
                JdbcSupport.getDouble(rs, "avg_max_temp_c"),
                JdbcSupport.getDouble(rs, "avg_min_temp_c"),
                JdbcSupport.getDouble(rs, "total_precip_mm"),
                JdbcSupport.getDouble(rs, "total_precip_cm"),
                rs.getLong("record_count"),
                JdbcSupport.getDouble(rs, "avg_quality_score"),
                JdbcSupport.getInstant(rs, "computed_at"));
    }
}
