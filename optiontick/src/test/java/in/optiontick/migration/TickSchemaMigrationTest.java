package in.optiontick.migration;

import com.zaxxer.hikari.HikariDataSource;
import in.optiontick.repository.SqliteDataSources;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TickSchemaMigrationTest {

    @TempDir
    Path tempDir;

    @Test
    void migrate_isIdempotentAndEnablesWal() throws Exception {
        try (HikariDataSource dataSource = SqliteDataSources.create(tempDir.resolve("nested/live.db"), 1, 500)) {
            TickSchemaMigration migration = new TickSchemaMigration(dataSource);
            migration.migrate();
            migration.migrate();

            try (Connection conn = dataSource.getConnection();
                 Statement st = conn.createStatement()) {
                try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'ticks'")) {
                    assertTrue(rs.next());
                    assertEquals(1, rs.getInt(1));
                }
                try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                    assertTrue(rs.next());
                    assertEquals("wal", rs.getString(1).toLowerCase());
                }
            }
        }
    }
}
