/*
* Copyright 2025 Taylor Ketterling
* Ingest Run Repository for the wx-pipeline station ingest.
* Records the start, finish and outcome of sweeps and aggregation jobs.
*/
package space.ketterling.wxpipeline.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.wxpipeline.model.IngestRun;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Database access for ingest run logs.
 */
public class IngestRunRepo {
    private final HikariDataSource ds;
    private final ObjectMapper om;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestRunRepo.class);

    public static final String RUNNING = "RUNNING";
    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";

    /**
     * Creates a repo backed by the provided datasource and JSON mapper.
     */
    public IngestRunRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Records a run as RUNNING. Reusing a run id (a retried sweep with a fixed id)
     * restarts the existing row.
     */
    public void startRun(String runId, String jobName, Instant startedAt) throws SQLException {
        String sql = "INSERT INTO ingest_run (run_id, job_name, started_at, status) "
                + "VALUES (?, ?, CAST(? AS TIMESTAMP), ?) "
                + "ON CONFLICT (run_id) DO UPDATE SET job_name=EXCLUDED.job_name, started_at=EXCLUDED.started_at, "
                + "finished_at=NULL, status=EXCLUDED.status, notes=NULL";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, jobName);
            ps.setString(3, JdbcSupport.timestamp(startedAt));
            ps.setString(4, RUNNING);
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
    }

    /**
     * Marks a run as success or failure; {@code notes} is stored as JSON.
     */
    public void finishRun(String runId, boolean success, Map<String, ?> notes, Instant finishedAt)
            throws SQLException {
        String json;
        try {
            json = notes == null ? null : om.writeValueAsString(notes);
        } catch (JsonProcessingException e) {
            throw new SQLException("Could not serialize run notes for " + runId, e);
        }

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE ingest_run SET finished_at=CAST(? AS TIMESTAMP), status=?, notes=? WHERE run_id=?")) {
            ps.setString(1, JdbcSupport.timestamp(finishedAt));
            ps.setString(2, success ? SUCCESS : FAILED);
            ps.setString(3, json);
            ps.setString(4, runId);
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, json);
    }

    /**
     * Most recent runs first.
     */
    public List<IngestRun> listRecent(int limit) throws SQLException {
        String sql = "SELECT run_id, job_name, started_at, finished_at, status, notes FROM ingest_run "
                + "ORDER BY started_at DESC LIMIT " + Math.max(1, limit);
        List<IngestRun> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new IngestRun(
                        rs.getString("run_id"),
                        rs.getString("job_name"),
                        JdbcSupport.getInstant(rs, "started_at"),
                        JdbcSupport.getInstant(rs, "finished_at"),
                        rs.getString("status"),
                        rs.getString("notes")));
            }
        }
        return out;
    }
}
