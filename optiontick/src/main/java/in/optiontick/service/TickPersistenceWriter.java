package in.optiontick.service;

import in.optiontick.domain.data.Observation;
import in.optiontick.domain.repository.TickRepository;
import in.optiontick.infrastructure.metrics.FeedMetrics;
import in.optiontick.repository.TickStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous, bounded hand-off of observations to the tick store.
 *
 * One writer thread drains batches in submission order, one transaction per
 * batch. At most {@code maxInFlight} batches are queued or being written; a
 * caller waits at most {@code offerTimeout} for room and the batch is dropped
 * otherwise. Storage failures drop the batch: delivery is at most once.
 */
public final class TickPersistenceWriter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TickPersistenceWriter.class);

    public enum WriteStatus {
        WRITTEN,
        DROPPED_STORAGE_ERROR,
        DROPPED_BACKPRESSURE,
        DROPPED_SHUTDOWN
    }

    private final TickRepository repository;
    private final FeedMetrics metrics;
    private final int maxInFlight;
    private final long offerTimeoutMs;
    private final Semaphore permits;
    private final ExecutorService executor;

    private volatile boolean closed = false;

    public TickPersistenceWriter(TickRepository repository, FeedMetrics metrics, int maxInFlight, Duration offerTimeout) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1: " + maxInFlight);
        }
        this.repository = repository;
        this.metrics = metrics;
        this.maxInFlight = maxInFlight;
        this.offerTimeoutMs = offerTimeout.toMillis();
        this.permits = new Semaphore(maxInFlight);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "TickWriter");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a batch for writing. Returns once the batch is queued or dropped; the
     * future completes when the batch is committed or dropped.
     */
    public CompletableFuture<WriteStatus> submit(List<Observation> batch) {
        if (closed) {
            metrics.recordWriteDropped("shutdown", batch.size());
            return CompletableFuture.completedFuture(WriteStatus.DROPPED_SHUTDOWN);
        }
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(WriteStatus.WRITTEN);
        }

        boolean acquired;
        try {
            acquired = permits.tryAcquire(offerTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            log.warn("[WRITER] Writer saturated ({} in flight), dropped {} ticks", maxInFlight, batch.size());
            metrics.recordWriteDropped("backpressure", batch.size());
            return CompletableFuture.completedFuture(WriteStatus.DROPPED_BACKPRESSURE);
        }

        WriteTask task = new WriteTask(List.copyOf(batch));
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            task.abandon();
        }
        metrics.setWriterInFlight(inFlight());
        return task.result;
    }

    /**
     * Batches queued or being written.
     */
    public int inFlight() {
        return maxInFlight - permits.availablePermits();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop accepting batches and let queued ones finish within {@code timeout}.
     * Batches still queued after that are abandoned with {@link WriteStatus#DROPPED_SHUTDOWN}.
     *
     * @return true if every queued batch finished
     */
    public boolean close(Duration timeout) {
        if (closed) {
            return executor.isTerminated();
        }
        closed = true;
        log.info("[WRITER] Closing, {} batches in flight", inFlight());

        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("[WRITER] ✓ Drained");
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<Runnable> pending = executor.shutdownNow();
        for (Runnable r : pending) {
            if (r instanceof WriteTask) {
                ((WriteTask) r).abandon();
            }
        }
        log.warn("[WRITER] Abandoned {} queued batches after {}ms", pending.size(), timeout.toMillis());
        return false;
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }

    private WriteStatus write(List<Observation> batch) {
        long start = System.nanoTime();
        try {
            repository.appendBatch(batch);
            metrics.recordWrite(batch.size(), Duration.ofNanos(System.nanoTime() - start));
            return WriteStatus.WRITTEN;
        } catch (TickStorageException e) {
            log.error("[WRITER] Dropped {} ticks: {}", batch.size(), e.getMessage());
            metrics.recordWriteDropped(e.isContention() ? "contention" : "storage_error", batch.size());
            return WriteStatus.DROPPED_STORAGE_ERROR;
        } catch (RuntimeException e) {
            log.error("[WRITER] Dropped {} ticks on unexpected error: {}", batch.size(), e.getMessage(), e);
            metrics.recordWriteDropped("storage_error", batch.size());
            return WriteStatus.DROPPED_STORAGE_ERROR;
        }
    }

    private final class WriteTask implements Runnable {
        private final List<Observation> batch;
        private final CompletableFuture<WriteStatus> result = new CompletableFuture<>();

        WriteTask(List<Observation> batch) {
            this.batch = batch;
        }

        @Override
        public void run() {
            try {
                result.complete(write(batch));
            } finally {
                permits.release();
                metrics.setWriterInFlight(inFlight());
            }
        }

        void abandon() {
            permits.release();
            metrics.recordWriteDropped("shutdown", batch.size());
            result.complete(WriteStatus.DROPPED_SHUTDOWN);
        }
    }
}
