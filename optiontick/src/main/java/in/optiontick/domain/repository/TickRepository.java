package in.optiontick.domain.repository;

import in.optiontick.domain.data.FieldName;
import in.optiontick.domain.data.Observation;
import in.optiontick.domain.data.SeriesPoint;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of option ticks keyed by (instrument key, timestamp).
 *
 * Failures surface as {@link in.optiontick.repository.TickStorageException}.
 */
public interface TickRepository {

    /**
     * Append one observation.
     */
    void append(Observation observation);

    /**
     * Append observations atomically: either all rows become visible or none do.
     */
    void appendBatch(List<Observation> observations);

    /**
     * For each key, the observation with the greatest timestamp in [start, end].
     * Keys with no observation in the window are absent from the result.
     */
    Map<String, Observation> findLatestInWindow(Collection<String> instrumentKeys, Instant start, Instant end);

    /**
     * Values of one field for one instrument in [start, end], ascending by timestamp.
     * Absent or non-numeric values read as 0.0.
     */
    List<SeriesPoint> findSeries(String instrumentKey, FieldName field, Instant start, Instant end);

    /**
     * Total number of stored observations.
     */
    long count();
}
