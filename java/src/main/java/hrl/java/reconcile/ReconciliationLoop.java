package hrl.java.reconcile;

import hrl.java.store.ChangeEvent;
import hrl.java.store.ChangeStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains a {@link ChangeStream} on a single background thread and hands each
 * batch to a {@link ReconciliationWorker}.
 *
 * <p>Polls every {@code pollInterval}; a full batch is followed immediately by
 * the next poll until the stream is empty. A failing batch is logged and the
 * loop keeps running.
 */
public final class ReconciliationLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLoop.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ChangeStream stream;
    private final ReconciliationWorker worker;
    private final Duration pollInterval;
    private final int batchSize;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong batchesFailed = new AtomicLong();

    public ReconciliationLoop(ChangeStream stream, ReconciliationWorker worker, Duration pollInterval, int batchSize) {
        if (stream == null) {
            throw new IllegalArgumentException("stream cannot be null");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        this.stream = stream;
        this.worker = worker;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hrl-reconcile");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::drainSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.atInfo()
            .addKeyValue("poll_interval_ms", pollInterval.toMillis())
            .addKeyValue("batch_size", batchSize)
            .log("Reconciliation loop started");
    }

    /**
     * Processes batches until the stream has nothing pending. Runs on the
     * caller's thread.
     *
     * @return number of events processed
     */
    public int drain() {
        int total = 0;
        while (true) {
            List<ChangeEvent> batch = stream.poll(batchSize);
            if (batch.isEmpty()) return total;
            ProcessResult result = worker.process(batch);
            total += result.processedCount();
            eventsProcessed.addAndGet(result.processedCount());
            if (batch.size() < batchSize) return total;
        }
    }

    private void drainSafely() {
        try {
            drain();
        } catch (RuntimeException e) {
            batchesFailed.incrementAndGet();
            log.error("Reconciliation batch failed", e);
        }
    }

    public long eventsProcessed() {
        return eventsProcessed.get();
    }

    public long batchesFailed() {
        return batchesFailed.get();
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        log.info("Reconciliation loop stopped after {} events", eventsProcessed.get());
    }
}
