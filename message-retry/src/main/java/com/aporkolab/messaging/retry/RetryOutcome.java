package com.aporkolab.messaging.retry;

import com.aporkolab.messaging.dlq.DeadLetterRecord;

/**
 * Terminal result of {@link MessageRetryMiddleware#executeWithRetry}.
 *
 * @param status     how handling ended
 * @param attempts   number of handler invocations
 * @param deadLetter the quarantine record, {@code null} when delivered
 */
public record RetryOutcome(Status status, int attempts, DeadLetterRecord deadLetter) {

    public enum Status {
        DELIVERED,
        QUARANTINED
    }

    public static RetryOutcome delivered(int attempts) {
        return new RetryOutcome(Status.DELIVERED, attempts, null);
    }

    public static RetryOutcome quarantined(int attempts, DeadLetterRecord deadLetter) {
        return new RetryOutcome(Status.QUARANTINED, attempts, deadLetter);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }

    public boolean isQuarantined() {
        return status == Status.QUARANTINED;
    }
}
