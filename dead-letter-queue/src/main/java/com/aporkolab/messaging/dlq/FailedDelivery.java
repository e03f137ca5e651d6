package com.aporkolab.messaging.dlq;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.aporkolab.messaging.bus.MessageEnvelope;

/**
 * What the retry middleware knows about a message when it gives up on it.
 *
 * @param envelope       the message as it was delivered to the handler
 * @param failure        the last failure
 * @param handlerType    handler class name, for the operator
 * @param attemptCount   attempts made, including the last one
 * @param firstAttemptAt when the first attempt started; {@code null} if unknown
 * @param history        one entry per failed attempt, oldest first
 */
public record FailedDelivery(
        MessageEnvelope<?> envelope,
        Throwable failure,
        String handlerType,
        int attemptCount,
        Instant firstAttemptAt,
        List<DeadLetterRecord.FailureAttempt> history) {

    public FailedDelivery {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(failure, "failure");
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be at least 1, was " + attemptCount);
        }
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static FailedDelivery of(MessageEnvelope<?> envelope, Throwable failure, String handlerType, int attemptCount) {
        return new FailedDelivery(envelope, failure, handlerType, attemptCount, null, List.of());
    }
}
