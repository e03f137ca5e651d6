package com.aporkolab.messaging.bus;

import java.util.concurrent.CompletionStage;

/**
 * Application callback for consumed messages.
 * <p>
 * The returned stage completes when the message has been handled. Throwing, or
 * completing the stage exceptionally, signals a failed attempt.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    CompletionStage<Void> handle(T message) throws Exception;

    /**
     * Entry point used by the transports. Handlers that need routing metadata
     * (correlation id, source queue) override this instead of {@link #handle(Object)}.
     */
    default CompletionStage<Void> handleEnvelope(MessageEnvelope<T> envelope) throws Exception {
        return handle(envelope.getPayload());
    }
}
