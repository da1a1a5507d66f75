package in.optiontick.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the tick table on startup.
 *
 * The composite primary key (instrument_key, ts_us) on a WITHOUT ROWID table is
 * the clustered index that serves both the latest-per-instrument and the range
 * queries.
 */
public final class TickSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(TickSchemaMigration.class);

    static final String CREATE_TICKS = """
        CREATE TABLE IF NOT EXISTS ticks (
            instrument_key TEXT    NOT NULL,
            ts_us          INTEGER NOT NULL,
            ltp            REAL,
            cp             REAL,
            oi             REAL,
            iv             REAL,
            delta          REAL,
            gamma          REAL,
            vega           REAL,
            theta          REAL,
            PRIMARY KEY (instrument_key, ts_us)
        ) WITHOUT ROWID
        """;

    private final DataSource dataSource;

    public TickSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, "ticks")) {
                log.info("[STORE MIGRATION] ticks table already exists");
                return;
            }
            try (Statement st = conn.createStatement()) {
                st.execute(CREATE_TICKS);
            }
            log.info("[STORE MIGRATION] ✓ ticks table created");
        } catch (SQLException e) {
            log.error("[STORE MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Tick schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
