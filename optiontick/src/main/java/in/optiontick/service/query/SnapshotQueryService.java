package in.optiontick.service.query;

import in.optiontick.domain.data.Observation;
import in.optiontick.domain.data.SnapshotRow;
import in.optiontick.domain.repository.TickRepository;
import in.optiontick.infrastructure.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Latest observation per instrument within a window.
 *
 * One indexed store query per call (chunked for very large key sets); nothing is
 * cached in process. Instruments without an observation in the window are absent
 * from the result.
 */
public final class SnapshotQueryService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotQueryService.class);

    private final TickRepository repository;
    private final FeedMetrics metrics;

    public SnapshotQueryService(TickRepository repository, FeedMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * @return rows keyed by instrument, in the iteration order of {@code instrumentKeys}
     * @throws InvalidQueryException on null arguments, null keys or start after end
     */
    public Map<String, SnapshotRow> snapshot(Set<String> instrumentKeys, Instant start, Instant end) {
        if (instrumentKeys == null) {
            throw new InvalidQueryException("Instrument keys are required");
        }
        if (start == null || end == null) {
            throw new InvalidQueryException("Window start and end are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidQueryException("Window start " + start + " is after end " + end);
        }
        WindowResolver.requireRepresentable(start, end);
        for (String key : instrumentKeys) {
            if (key == null) {
                throw new InvalidQueryException("Instrument keys must not contain null");
            }
        }
        if (instrumentKeys.isEmpty()) {
            return Collections.emptyMap();
        }

        long t0 = System.nanoTime();
        Map<String, Observation> latest = repository.findLatestInWindow(instrumentKeys, start, end);

        Map<String, SnapshotRow> rows = new LinkedHashMap<>();
        for (String key : instrumentKeys) {
            Observation observation = latest.get(key);
            if (observation != null) {
                rows.put(key, SnapshotRow.of(observation));
            }
        }

        Duration took = Duration.ofNanos(System.nanoTime() - t0);
        metrics.recordQuery("snapshot", took, rows.size());
        log.debug("[QUERY] snapshot {} keys [{} .. {}] -> {} rows in {}ms",
            instrumentKeys.size(), start, end, rows.size(), took.toMillis());
        return rows;
    }

    /**
     * Latest known values as of {@code asOf}: the window runs from midnight IST of
     * that day up to {@code asOf}.
     */
    public Map<String, SnapshotRow> latest(Set<String> instrumentKeys, Instant asOf) {
        if (asOf == null) {
            throw new InvalidQueryException("asOf is required");
        }
        return snapshot(instrumentKeys, SessionClock.getDayStart(SessionClock.dateOf(asOf)), asOf);
    }
}
