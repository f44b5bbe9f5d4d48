package space.ketterling.wxpipeline.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small JDBC helpers shared by the repositories.
 *
 * <p>
 * Dates and timestamps travel as ISO strings wrapped in {@code CAST(? AS ...)}
 * so the same SQL runs on PostgreSQL and the embedded test database.
 * Timestamps are stored as UTC wall-clock values.
 * </p>
 */
final class JdbcSupport {
    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS");

    private JdbcSupport() {
    }

    static void setInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.INTEGER);
        else
            ps.setInt(idx, v);
    }

    static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    static String timestamp(Instant i) {
        return i == null ? null : LocalDateTime.ofInstant(i, ZoneOffset.UTC).format(TS_FORMAT);
    }

    static Instant getInstant(ResultSet rs, String col) throws SQLException {
        String s = rs.getString(col);
        if (s == null)
            return null;
        return LocalDateTime.parse(s.trim().replace(' ', 'T')).toInstant(ZoneOffset.UTC);
    }

    static LocalDate getDate(ResultSet rs, String col) throws SQLException {
        String s = rs.getString(col);
        return s == null ? null : LocalDate.parse(s.trim());
    }

    static Double getDouble(ResultSet rs, String col) throws SQLException {
        Object o = rs.getObject(col);
        return o == null ? null : ((Number) o).doubleValue();
    }

    static Integer getInt(ResultSet rs, String col) throws SQLException {
        Object o = rs.getObject(col);
        return o == null ? null : ((Number) o).intValue();
    }

    /**
     * True for integrity-constraint violations (SQLState class 23, or the
     * embedded engine's constraint error text).
     */
    static boolean isConstraintViolation(SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("23"))
            return true;
        String msg = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        return msg.startsWith("constraint error") || msg.contains("violates check constraint");
    }
}
