package com.aporkolab.messaging.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking wait between attempts.
 */
@FunctionalInterface
public interface BackoffScheduler {

    /**
     * Returns a future that completes after {@code duration}. Cancelling the future
     * cancels the pending wait.
     */
    CompletableFuture<Void> delay(Duration duration);
}
