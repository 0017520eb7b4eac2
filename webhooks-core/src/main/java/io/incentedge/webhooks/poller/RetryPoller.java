package io.incentedge.webhooks.poller;

import io.incentedge.webhooks.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link RetryScheduler#processRetries()} at a fixed delay on a single daemon thread,
 * for deployments without an external cron.
 *
 * <p>The {@link #start()} and {@link #close()} methods are synchronized to prevent
 * concurrent lifecycle transitions.
 */
public final class RetryPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetryPoller.class.getName());

    public static final long DEFAULT_INTERVAL_MS = 60_000;

    private final RetryScheduler scheduler;
    private final long intervalMs;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    public RetryPoller(RetryScheduler scheduler, long intervalMs) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.intervalMs = intervalMs;
    }

    /**
     * Starts the schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetryPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("webhook-retry-"));
        pollTask = executor.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes one run. Called by the schedule; may also be invoked directly.
     */
    public void poll() {
        if (closed) {
            return;
        }
        try {
            RetryBatchResult result = scheduler.processRetries();
            if (result.processed() > 0) {
                logger.log(Level.INFO, "Processed {0} due deliveries: {1} delivered, {2} failed",
                        new Object[] {result.processed(), result.succeeded(), result.failed()});
            }
        } catch (Throwable t) {
            // an escaped throwable would cancel the fixed-delay schedule
            logger.log(Level.SEVERE, "Retry cycle failed", t);
        }
    }

    public boolean isRunning() {
        return pollTask != null && !closed;
    }

    /**
     * Cancels the schedule and shuts down the thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
