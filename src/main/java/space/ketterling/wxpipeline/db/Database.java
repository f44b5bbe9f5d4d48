package space.ketterling.wxpipeline.db;

import space.ketterling.wxpipeline.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a connection pool for API requests.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg.dbJdbcUrl(), cfg.dbUsername(), cfg.dbPassword(), "api", cfg.dbApiPoolMax());
    }

    /**
     * Builds a connection pool for ingest/aggregation jobs.
     */
    public static HikariDataSource createIngestDataSource(AppConfig cfg) {
        return createDataSource(cfg.dbJdbcUrl(), cfg.dbUsername(), cfg.dbPassword(), "ingest",
                cfg.dbIngestPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    public static HikariDataSource createDataSource(String jdbcUrl, String username, String password, String role,
            int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(jdbcUrl);
        if (username != null && !username.isBlank())
            hc.setUsername(username);
        if (password != null && !password.isBlank())
            hc.setPassword(password);
        hc.setPoolName("wxpipeline-" + role);
        hc.setMaximumPoolSize(Math.max(1, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
