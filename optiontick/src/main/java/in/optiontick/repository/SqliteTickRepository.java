package in.optiontick.repository;

import in.optiontick.domain.data.FieldName;
import in.optiontick.domain.data.Observation;
import in.optiontick.domain.data.PriceChange;
import in.optiontick.domain.data.SeriesPoint;
import in.optiontick.domain.repository.TickRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static in.optiontick.util.MonotonicMicros.fromMicros;
import static in.optiontick.util.MonotonicMicros.toMicros;
import static in.optiontick.util.MonotonicMicros.toMicrosCeil;

/**
 * SQLite implementation of TickRepository.
 */
public final class SqliteTickRepository implements TickRepository {
    private static final Logger log = LoggerFactory.getLogger(SqliteTickRepository.class);

    /** Upper bound on bound parameters per IN list. */
    static final int MAX_KEYS_PER_QUERY = 500;

    private static final String INSERT_SQL = """
        INSERT INTO ticks (instrument_key, ts_us, ltp, cp, oi, iv, delta, gamma, vega, theta)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final DataSource dataSource;

    public SqliteTickRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(Observation observation) {
        appendBatch(List.of(observation));
    }

    @Override
    public void appendBatch(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            return;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                for (Observation o : observations) {
                    ps.setString(1, o.instrumentKey());
                    ps.setLong(2, toMicros(o.timestamp()));
                    ps.setDouble(3, o.lastPrice());
                    ps.setDouble(4, o.prevClose());
                    ps.setDouble(5, o.openInterest());
                    ps.setDouble(6, o.impliedVol());
                    ps.setDouble(7, o.delta());
                    ps.setDouble(8, o.gamma());
                    ps.setDouble(9, o.vega());
                    ps.setDouble(10, o.theta());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }

            log.debug("[STORE] Appended {} ticks", observations.size());

        } catch (SQLException e) {
            log.error("[STORE] Failed to append {} ticks: {}", observations.size(), e.getMessage());
            throw new TickStorageException("append", observations.size(), "Failed to append ticks", e);
        }
    }

    @Override
    public Map<String, Observation> findLatestInWindow(Collection<String> instrumentKeys, Instant start, Instant end) {
        if (instrumentKeys.isEmpty()) {
            return Map.of();
        }

        List<String> keys = new ArrayList<>(new LinkedHashSet<>(instrumentKeys));
        Map<String, Observation> result = new HashMap<>();

        try (Connection conn = dataSource.getConnection()) {
            for (int from = 0; from < keys.size(); from += MAX_KEYS_PER_QUERY) {
                List<String> chunk = keys.subList(from, Math.min(from + MAX_KEYS_PER_QUERY, keys.size()));
                readLatest(conn, chunk, start, end, result);
            }
        } catch (SQLException e) {
            log.error("[STORE] Snapshot read failed for {} keys: {}", keys.size(), e.getMessage());
            throw new TickStorageException("snapshot", keys.size(), "Failed to read latest ticks", e);
        }

        return result;
    }

    private void readLatest(Connection conn, List<String> keys, Instant start, Instant end,
                            Map<String, Observation> into) throws SQLException {
        String placeholders = String.join(", ", Collections.nCopies(keys.size(), "?"));
        String sql = """
            SELECT t.instrument_key, t.ts_us, t.ltp, t.cp, t.oi, t.iv, t.delta, t.gamma, t.vega, t.theta
            FROM ticks t
            JOIN (
                SELECT instrument_key, MAX(ts_us) AS max_ts
                FROM ticks
                WHERE instrument_key IN (%s) AND ts_us BETWEEN ? AND ?
                GROUP BY instrument_key
            ) latest ON t.instrument_key = latest.instrument_key AND t.ts_us = latest.max_ts
            """.formatted(placeholders);

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            for (String key : keys) {
                ps.setString(i++, key);
            }
            ps.setLong(i++, toMicrosCeil(start));
            ps.setLong(i, toMicros(end));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Observation o = mapObservation(rs);
                    into.put(o.instrumentKey(), o);
                }
            }
        }
    }

    @Override
    public List<SeriesPoint> findSeries(String instrumentKey, FieldName field, Instant start, Instant end) {
        String columns = field.isDerived() ? "ltp, cp" : field.column();
        String sql = """
            SELECT ts_us, %s
            FROM ticks
            WHERE instrument_key = ? AND ts_us BETWEEN ? AND ?
            ORDER BY ts_us ASC
            """.formatted(columns);

        List<SeriesPoint> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instrumentKey);
            ps.setLong(2, toMicrosCeil(start));
            ps.setLong(3, toMicros(end));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Instant ts = fromMicros(rs.getLong(1));
                    double value = field == FieldName.CHANGE_PERCENT
                        ? PriceChange.percent(numeric(rs, 2), numeric(rs, 3))
                        : numeric(rs, 2);
                    result.add(new SeriesPoint(ts, value));
                }
            }

        } catch (SQLException e) {
            log.error("[STORE] Range read failed for {} {}: {}", instrumentKey, field, e.getMessage());
            throw new TickStorageException("range", 0, "Failed to read series for " + instrumentKey, e);
        }

        return result;
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM ticks")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            log.error("[STORE] Count failed: {}", e.getMessage());
            throw new TickStorageException("count", 0, "Failed to count ticks", e);
        }
    }

    private Observation mapObservation(ResultSet rs) throws SQLException {
        return new Observation(
            fromMicros(rs.getLong("ts_us")),
            rs.getString("instrument_key"),
            numeric(rs, "ltp"),
            numeric(rs, "cp"),
            numeric(rs, "oi"),
            numeric(rs, "iv"),
            numeric(rs, "delta"),
            numeric(rs, "gamma"),
            numeric(rs, "vega"),
            numeric(rs, "theta")
        );
    }

    // SQLite is dynamically typed: a REAL column may hold NULL or text.
    private static double numeric(ResultSet rs, String column) throws SQLException {
        return toDouble(rs.getObject(column));
    }

    private static double numeric(ResultSet rs, int index) throws SQLException {
        return toDouble(rs.getObject(index));
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        return 0.0;
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
