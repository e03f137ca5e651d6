package com.aporkolab.messaging.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backoff on a shared {@link ScheduledExecutorService}: a waiting message holds a
 * timer entry, not a thread. Completions are handed to {@code executor} so that the
 * next attempt never runs on the timer thread.
 */
public class ScheduledBackoffScheduler implements BackoffScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackoffScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Executor executor;
    private final boolean ownsScheduler;

    public ScheduledBackoffScheduler() {
        this(newTimer(), ForkJoinPool.commonPool(), true);
    }

    public ScheduledBackoffScheduler(ScheduledExecutorService scheduler, Executor executor) {
        this(scheduler, executor, false);
    }

    private ScheduledBackoffScheduler(ScheduledExecutorService scheduler, Executor executor, boolean ownsScheduler) {
        this.scheduler = scheduler;
        this.executor = executor;
        this.ownsScheduler = ownsScheduler;
    }

    private static ScheduledExecutorService newTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "messaging-backoff");
            thread.setDaemon(true);
            return thread;
        });
        // cancelled waits must not pile up in the queue
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @Override
    public CompletableFuture<Void> delay(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> executor.execute(() -> future.complete(null)),
                duration.toMillis(), TimeUnit.MILLISECONDS);

        future.whenComplete((ignored, ex) -> {
            if (future.isCancelled()) {
                timer.cancel(false);
            }
        });
        return future;
    }

    @Override
    public void close() {
        if (!ownsScheduler) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Backoff scheduler did not stop in time, {} waits dropped", scheduler.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
