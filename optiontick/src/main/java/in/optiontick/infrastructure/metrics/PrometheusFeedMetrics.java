package in.optiontick.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of FeedMetrics.
 *
 * Key Metrics:
 * - feed_frames_total / feed_frame_bytes - Messages received and their size
 * - feed_decode_errors_total - Undecodable messages
 * - feed_ticks_ingested_total - Observations handed to the writer
 * - tick_writes_total / tick_write_latency_seconds - Committed batches
 * - tick_writes_dropped_total{reason} - Dropped observations
 * - tick_writer_in_flight - Batches queued or being written
 * - feed_pipeline_state{state} - 1 for the current state
 * - query_latency_seconds{type} - Snapshot and range latency
 */
public class PrometheusFeedMetrics implements FeedMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusFeedMetrics.class);

    private static final String[] STATES = {
        "UNAUTHENTICATED", "CONNECTING", "SUBSCRIBED", "STREAMING", "CLOSED", "FAILED"
    };

    private final CollectorRegistry registry;

    // Feed
    private final Counter frameCounter;
    private final Histogram frameBytes;
    private final Counter decodeErrorCounter;
    private final Counter skippedEntryCounter;
    private final Counter marketStatusCounter;
    private final Counter ticksIngestedCounter;
    private final Counter authCounter;
    private final Histogram authLatency;
    private final Gauge pipelineState;

    // Writer
    private final Counter writeCounter;
    private final Counter rowsWrittenCounter;
    private final Histogram writeLatency;
    private final Counter droppedCounter;
    private final Gauge writerInFlight;

    // Queries
    private final Histogram queryLatency;
    private final Counter queryRows;

    public PrometheusFeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.frameCounter = Counter.build()
            .name("feed_frames_total")
            .help("Total number of binary feed messages received")
            .register(registry);

        this.frameBytes = Histogram.build()
            .name("feed_frame_bytes")
            .help("Size of feed messages in bytes")
            .buckets(256, 1024, 4096, 16384, 65536, 262144)
            .register(registry);

        this.decodeErrorCounter = Counter.build()
            .name("feed_decode_errors_total")
            .help("Total number of feed messages that failed to decode")
            .register(registry);

        this.skippedEntryCounter = Counter.build()
            .name("feed_skipped_entries_total")
            .help("Total number of malformed instrument entries skipped")
            .register(registry);

        this.marketStatusCounter = Counter.build()
            .name("feed_market_status_total")
            .help("Total number of market status notices")
            .register(registry);

        this.ticksIngestedCounter = Counter.build()
            .name("feed_ticks_ingested_total")
            .help("Total number of observations handed to the writer")
            .register(registry);

        this.authCounter = Counter.build()
            .name("feed_authorizations_total")
            .help("Total number of feed authorize calls")
            .labelNames("status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("feed_authorization_latency_seconds")
            .help("Feed authorize latency in seconds")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.pipelineState = Gauge.build()
            .name("feed_pipeline_state")
            .help("Current ingestion pipeline state (1=current)")
            .labelNames("state")
            .register(registry);

        this.writeCounter = Counter.build()
            .name("tick_writes_total")
            .help("Total number of committed tick batches")
            .register(registry);

        this.rowsWrittenCounter = Counter.build()
            .name("tick_rows_written_total")
            .help("Total number of observations committed")
            .register(registry);

        this.writeLatency = Histogram.build()
            .name("tick_write_latency_seconds")
            .help("Batch write latency in seconds")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.0)
            .register(registry);

        this.droppedCounter = Counter.build()
            .name("tick_writes_dropped_total")
            .help("Total number of observations dropped by the writer")
            .labelNames("reason")
            .register(registry);

        this.writerInFlight = Gauge.build()
            .name("tick_writer_in_flight")
            .help("Batches queued or being written")
            .register(registry);

        this.queryLatency = Histogram.build()
            .name("query_latency_seconds")
            .help("Query latency in seconds")
            .labelNames("type")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
            .register(registry);

        this.queryRows = Counter.build()
            .name("query_rows_total")
            .help("Total number of rows returned by queries")
            .labelNames("type")
            .register(registry);

        for (String state : STATES) {
            pipelineState.labels(state).set(0);
        }

        log.info("[METRICS] Feed metrics registered");
    }

    @Override
    public void recordFrame(int bytes) {
        frameCounter.inc();
        frameBytes.observe(bytes);
    }

    @Override
    public void recordDecodeError() {
        decodeErrorCounter.inc();
    }

    @Override
    public void recordSkippedEntries(int count) {
        skippedEntryCounter.inc(count);
    }

    @Override
    public void recordMarketStatus() {
        marketStatusCounter.inc();
    }

    @Override
    public void recordTicksIngested(int count) {
        ticksIngestedCounter.inc(count);
    }

    @Override
    public void recordAuthorization(boolean success, Duration latency) {
        authCounter.labels(success ? "success" : "failure").inc();
        authLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordStateChange(String state) {
        for (String s : STATES) {
            pipelineState.labels(s).set(s.equals(state) ? 1 : 0);
        }
    }

    @Override
    public void recordWrite(int rows, Duration latency) {
        writeCounter.inc();
        rowsWrittenCounter.inc(rows);
        writeLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordWriteDropped(String reason, int rows) {
        droppedCounter.labels(reason).inc(rows);
    }

    @Override
    public void setWriterInFlight(int inFlight) {
        writerInFlight.set(inFlight);
    }

    @Override
    public void recordQuery(String type, Duration latency, int rows) {
        queryLatency.labels(type).observe(latency.toNanos() / 1_000_000_000.0);
        queryRows.labels(type).inc(rows);
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
