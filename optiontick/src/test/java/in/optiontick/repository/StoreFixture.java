package in.optiontick.repository;

import com.zaxxer.hikari.HikariDataSource;
import in.optiontick.domain.data.Observation;
import in.optiontick.migration.TickSchemaMigration;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * Temporary SQLite tick store for tests.
 */
public final class StoreFixture implements AutoCloseable {

    private final HikariDataSource dataSource;
    private final SqliteTickRepository repository;

    public StoreFixture(Path dir) {
        this(dir, 2, 2000);
    }

    public StoreFixture(Path dir, int poolSize, int busyTimeoutMs) {
        this.dataSource = SqliteDataSources.create(dir.resolve("ticks.db"), poolSize, busyTimeoutMs);
        new TickSchemaMigration(dataSource).migrate();
        this.repository = new SqliteTickRepository(dataSource);
    }

    public HikariDataSource dataSource() {
        return dataSource;
    }

    public SqliteTickRepository repository() {
        return repository;
    }

    /**
     * Take the store's write lock on a pooled connection until the returned lock is closed.
     */
    public WriteLock holdWriteLock() throws SQLException {
        Connection conn = dataSource.getConnection();
        try {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("INSERT INTO ticks (instrument_key, ts_us) VALUES ('LOCK', 0)");
            }
            return new WriteLock(conn);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    /**
     * Open write transaction; closing rolls it back and returns the connection.
     */
    public static final class WriteLock implements AutoCloseable {
        private final Connection conn;

        private WriteLock(Connection conn) {
            this.conn = conn;
        }

        @Override
        public void close() throws SQLException {
            try {
                conn.rollback();
                conn.setAutoCommit(true);
            } finally {
                conn.close();
            }
        }
    }

    public static Observation tick(String key, Instant ts, double ltp, double cp) {
        return new Observation(ts, key, ltp, cp, 0, 0, 0, 0, 0, 0);
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
