package in.optiontick.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics for feed ingestion, tick persistence and queries.
 *
 * Key metrics:
 * - Frames received, decode failures, skipped instrument entries
 * - Ticks ingested, written and dropped (by reason)
 * - Writer queue depth
 * - Query latency
 */
public interface FeedMetrics {

    /**
     * Record a complete binary message from the stream.
     *
     * @param bytes Message size
     */
    void recordFrame(int bytes);

    /**
     * Record a message that could not be decoded.
     */
    void recordDecodeError();

    /**
     * Record instrument entries dropped from an otherwise valid frame.
     */
    void recordSkippedEntries(int count);

    /**
     * Record a market status notice.
     */
    void recordMarketStatus();

    /**
     * Record observations handed to the writer.
     */
    void recordTicksIngested(int count);

    /**
     * Record an authorize call.
     */
    void recordAuthorization(boolean success, Duration latency);

    /**
     * Record a pipeline state change.
     *
     * @param state New state name
     */
    void recordStateChange(String state);

    /**
     * Record a committed write.
     */
    void recordWrite(int rows, Duration latency);

    /**
     * Record observations dropped by the writer.
     *
     * @param reason backpressure, storage_error, contention or shutdown
     */
    void recordWriteDropped(String reason, int rows);

    void setWriterInFlight(int inFlight);

    /**
     * Record a served query.
     *
     * @param type snapshot or range
     */
    void recordQuery(String type, Duration latency, int rows);
}
