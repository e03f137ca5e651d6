package com.aporkolab.messaging.retry;

import java.time.Duration;

import com.aporkolab.messaging.dlq.FailureType;

/**
 * Observer of retry middleware decisions. Called on the thread that made the decision,
 * after the outcome is settled; implementations must be fast. A listener that throws is
 * logged and skipped.
 */
public interface RetryListener {

    default void onRetry(String messageType, String sourceQueue, int failedAttempt, FailureType failureType,
                         Duration delay) {
    }

    default void onDelivered(String messageType, String sourceQueue, int attempts) {
    }

    default void onQuarantined(String messageType, String sourceQueue, int attempts, FailureType failureType) {
    }
}
