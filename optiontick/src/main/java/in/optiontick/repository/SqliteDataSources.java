package in.optiontick.repository;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pooled connections to the embedded tick store.
 *
 * The database runs in WAL mode so readers and the single writer do not block
 * each other; busy_timeout bounds how long a statement waits on a lock.
 */
public final class SqliteDataSources {
    private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

    public static HikariDataSource create(Path storePath, int poolSize, int busyTimeoutMs) {
        Path parent = storePath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create store directory " + parent, e);
            }
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + storePath.toAbsolutePath());
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("optiontick-sqlite");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));

        log.info("[STORE] path={}, pool={}, busyTimeoutMs={}", storePath, poolSize, busyTimeoutMs);
        return new HikariDataSource(config);
    }

    private SqliteDataSources() {}
}
