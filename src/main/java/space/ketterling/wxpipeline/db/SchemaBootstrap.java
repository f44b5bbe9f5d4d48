package space.ketterling.wxpipeline.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies and verifies the relational schema the pipeline depends on.
 */
public final class SchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrap.class);

    static final String SCHEMA_RESOURCE = "schema.sql";
    static final List<String> REQUIRED_TABLES = List.of("stations", "weather_facts", "weather_aggregates",
            "ingest_run");

    private SchemaBootstrap() {
    }

    /**
     * Runs every statement of schema.sql (all are idempotent CREATE ... IF NOT
     * EXISTS).
     */
    public static void apply(HikariDataSource ds) throws IOException, SQLException {
        List<String> statements = statements(readSchema());
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
        log.info("Applied {} schema statements", statements.size());
    }

    /**
     * Fails fast when a required table is absent or the connection target is
     * unusable.
     *
     * @throws IllegalStateException naming the first missing table
     */
    public static void verify(HikariDataSource ds) {
        for (String table : REQUIRED_TABLES) {
            try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
                st.executeQuery("SELECT 1 FROM " + table + " WHERE 1 = 0").close();
            } catch (SQLException e) {
                throw new IllegalStateException("Schema check failed for table " + table + ": " + e.getMessage(), e);
            }
        }
        log.info("Schema verified: {}", REQUIRED_TABLES);
    }

    private static String readSchema() throws IOException {
        try (InputStream in = SchemaBootstrap.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null)
                throw new IOException("Missing classpath resource " + SCHEMA_RESOURCE);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Splits a script on semicolons after dropping {@code --} comment lines.
     */
    static List<String> statements(String script) {
        StringBuilder sb = new StringBuilder();
        for (String line : script.split("\n")) {
            if (line.strip().startsWith("--"))
                continue;
            sb.append(line).append('\n');
        }
        List<String> out = new ArrayList<>();
        for (String part : sb.toString().split(";")) {
            if (!part.isBlank())
                out.add(part.strip());
        }
        return out;
    }
}
