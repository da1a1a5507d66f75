package in.optiontick.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.optiontick.domain.data.Observation;
import in.optiontick.infrastructure.feed.DecodedFrame;
import in.optiontick.infrastructure.feed.FeedAuthenticationException;
import in.optiontick.infrastructure.feed.FeedAuthorizer;
import in.optiontick.infrastructure.feed.FeedConnectionException;
import in.optiontick.infrastructure.feed.FeedDecodeException;
import in.optiontick.infrastructure.feed.FeedFields;
import in.optiontick.infrastructure.feed.FeedSubscription;
import in.optiontick.infrastructure.feed.FeedTransport;
import in.optiontick.infrastructure.feed.FeedTransport.FeedSession;
import in.optiontick.infrastructure.feed.UpstoxFeedDecoder;
import in.optiontick.infrastructure.metrics.FeedMetrics;
import in.optiontick.util.MonotonicMicros;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Authorize, connect, subscribe and stream the Upstox option feed into the tick store.
 *
 * <pre>
 * UNAUTHENTICATED -> CONNECTING -> SUBSCRIBED -> STREAMING -> CLOSED
 *                        any state -> FAILED
 * </pre>
 *
 * One pipeline instance serves one run. Frames are decoded one at a time on the
 * transport thread; persistence is handed to {@link TickPersistenceWriter} and
 * never awaited. Reconnecting is the caller's decision.
 */
public final class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    public enum State {
        UNAUTHENTICATED,
        CONNECTING,
        SUBSCRIBED,
        STREAMING,
        CLOSED,
        FAILED;

        public boolean isTerminal() {
            return this == CLOSED || this == FAILED;
        }
    }

    /**
     * Observer of state changes.
     */
    @FunctionalInterface
    public interface StateListener {
        void onStateChange(State from, State to);
    }

    private final FeedAuthorizer authorizer;
    private final FeedTransport transport;
    private final UpstoxFeedDecoder decoder;
    private final TickPersistenceWriter writer;
    private final FeedMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MonotonicMicros stamps;
    private final String mode;
    private final Duration connectTimeout;

    private final List<StateListener> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private State state = State.UNAUTHENTICATED;
    private volatile FeedSession session;
    private volatile FeedSubscription subscription;
    private volatile String endpointHost = "feed";
    private volatile Instant lastFrameAt;

    public IngestionPipeline(FeedAuthorizer authorizer,
                             FeedTransport transport,
                             UpstoxFeedDecoder decoder,
                             TickPersistenceWriter writer,
                             FeedMetrics metrics,
                             ObjectMapper objectMapper,
                             Clock clock,
                             String mode,
                             Duration connectTimeout) {
        this.authorizer = authorizer;
        this.transport = transport;
        this.decoder = decoder;
        this.writer = writer;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.stamps = new MonotonicMicros(clock);
        this.mode = mode;
        this.connectTimeout = connectTimeout;
    }

    public void addStateListener(StateListener listener) {
        listeners.add(listener);
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Subscription sent on the current connection, or null before subscribing.
     */
    public FeedSubscription getSubscription() {
        return subscription;
    }

    public Instant getLastFrameAt() {
        return lastFrameAt;
    }

    /**
     * Run to completion: returns when the stream closes normally.
     *
     * @throws FeedAuthenticationException if authorization fails
     * @throws FeedConnectionException if the socket cannot be opened or fails
     */
    public void run(String accessToken, Set<String> instrumentKeys) {
        try {
            start(accessToken, instrumentKeys).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Authorize synchronously, then connect and stream in the background.
     * The returned future completes when the stream closes normally and fails with
     * {@link FeedConnectionException} on socket failure.
     *
     * @throws FeedAuthenticationException if authorization fails
     */
    public CompletableFuture<Void> start(String accessToken, Set<String> instrumentKeys) {
        synchronized (this) {
            if (state != State.UNAUTHENTICATED) {
                throw new IllegalStateException("Pipeline already started: " + state);
            }
        }

        URI endpoint = authorize(accessToken);
        endpointHost = endpoint.getHost() != null ? endpoint.getHost() : "feed";
        if (!transition(State.UNAUTHENTICATED, State.CONNECTING)) {
            return done;
        }

        FeedSubscription sub = FeedSubscription.subscribe(mode, new ArrayList<>(instrumentKeys));
        log.info("[FEED] Connecting, {} instruments, mode={}, guid={}",
            instrumentKeys.size(), mode, sub.guid());

        transport.connect(endpoint, new PipelineFrameListener())
            .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((opened, error) -> {
                if (error != null) {
                    fail(new FeedConnectionException(endpointHost, "Failed to open feed socket", unwrap(error)));
                    return;
                }
                onConnected(opened, sub);
            });

        return done;
    }

    /**
     * Close the socket normally and drain the writer.
     */
    public void stop(Duration drainTimeout) {
        State previous;
        synchronized (this) {
            previous = state;
        }
        if (!previous.isTerminal()) {
            log.info("[FEED] Stopping from {}", previous);
            closeSession();
            transition(previous, State.CLOSED);
            done.complete(null);
        }
        writer.close(drainTimeout);
    }

    private URI authorize(String accessToken) {
        long start = System.nanoTime();
        try {
            URI endpoint = authorizer.authorize(accessToken);
            metrics.recordAuthorization(true, Duration.ofNanos(System.nanoTime() - start));
            return endpoint;
        } catch (FeedAuthenticationException e) {
            metrics.recordAuthorization(false, Duration.ofNanos(System.nanoTime() - start));
            log.error("[FEED] Authorization failed: {}", e.getMessage());
            transition(State.UNAUTHENTICATED, State.FAILED);
            done.completeExceptionally(e);
            throw e;
        }
    }

    private void onConnected(FeedSession opened, FeedSubscription sub) {
        session = opened;
        if (getState().isTerminal()) {
            opened.close();
            return;
        }

        subscription = sub;
        opened.sendBinary(sub.toBinary(objectMapper)).whenComplete((v, error) -> {
            if (error != null) {
                fail(new FeedConnectionException(endpointHost, "Failed to send subscription", unwrap(error)));
                return;
            }
            if (transition(State.CONNECTING, State.SUBSCRIBED)) {
                log.info("[FEED] ✓ Subscribed {} instruments (guid={})",
                    sub.data().instrumentKeys().size(), sub.guid());
            }
        });
    }

    void handleFrame(ByteBuffer frame) {
        if (getState().isTerminal()) {
            return;
        }
        lastFrameAt = clock.instant();
        int size = frame.remaining();
        metrics.recordFrame(size);

        DecodedFrame decoded;
        try {
            decoded = decoder.decode(frame);
        } catch (FeedDecodeException e) {
            log.warn("[FEED] {}", e.getMessage());
            metrics.recordDecodeError();
            return;
        }

        transition(State.SUBSCRIBED, State.STREAMING);

        if (decoded.skippedEntries() > 0) {
            metrics.recordSkippedEntries(decoded.skippedEntries());
        }

        if (decoded.kind() == DecodedFrame.Kind.MARKET_STATUS) {
            log.info("[FEED] Market status at {}: {}", decoded.currentTs(), decoded.segmentStatus());
            metrics.recordMarketStatus();
            return;
        }

        if (decoded.feeds().isEmpty()) {
            log.debug("[FEED] Empty {} frame", decoded.frameType());
            return;
        }

        Instant stamp = stamps.next();
        List<Observation> batch = new ArrayList<>(decoded.feeds().size());
        for (Map.Entry<String, FeedFields> entry : decoded.feeds().entrySet()) {
            batch.add(entry.getValue().toObservation(entry.getKey(), stamp));
        }

        writer.submit(batch);
        metrics.recordTicksIngested(batch.size());
        log.debug("[FEED] {} frame: {} ticks, serverTs={}", decoded.frameType(), batch.size(), decoded.currentTs());
    }

    private void handleClosed(int statusCode, String reason) {
        if (statusCode == WebSocket.NORMAL_CLOSURE || statusCode == 1001) {
            State previous = getState();
            if (!previous.isTerminal() && transition(previous, State.CLOSED)) {
                log.info("[FEED] Stream closed by server: {} {}", statusCode, reason);
            }
            done.complete(null);
            return;
        }
        fail(new FeedConnectionException(endpointHost,
            "Stream closed abnormally: " + statusCode + " " + reason));
    }

    private void fail(FeedConnectionException error) {
        State previous = getState();
        if (previous.isTerminal()) {
            return;
        }
        log.error("[FEED] {}", error.getMessage());
        transition(previous, State.FAILED);
        closeSession();
        done.completeExceptionally(error);
    }

    private void closeSession() {
        FeedSession current = session;
        if (current != null) {
            current.close();
        }
    }

    /**
     * Move from {@code expected} to {@code next}; no-op when the pipeline is elsewhere.
     */
    private boolean transition(State expected, State next) {
        synchronized (this) {
            if (state != expected || state == next) {
                return false;
            }
            state = next;
        }
        log.info("[FEED] State {} -> {}", expected, next);
        metrics.recordStateChange(next.name());
        for (StateListener listener : listeners) {
            listener.onStateChange(expected, next);
        }
        return true;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private final class PipelineFrameListener implements FeedTransport.FrameListener {

        @Override
        public void onFrame(ByteBuffer frame) {
            try {
                handleFrame(frame);
            } catch (RuntimeException e) {
                log.error("[FEED] Frame handling failed: {}", e.getMessage(), e);
            }
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            handleClosed(statusCode, reason);
        }

        @Override
        public void onError(Throwable error) {
            fail(new FeedConnectionException(endpointHost, "Feed socket error: " + error.getMessage(), error));
        }
    }
}
