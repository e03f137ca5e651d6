package com.aporkolab.messaging.dlq;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.aporkolab.messaging.bus.MessageEnvelope;
import com.aporkolab.messaging.bus.TransportMode;

/**
 * Quarantines messages that will not be retried any more, and lets operators
 * inspect, replay and remove them.
 */
public interface DeadLetterService {

    /**
     * Writes a {@link DeadLetterRecord} to the dead-letter location of the delivery's
     * source queue. The future fails with a
     * {@link com.aporkolab.messaging.exception.DeadLetterException} if the write fails.
     */
    CompletableFuture<DeadLetterRecord> sendToDeadLetter(FailedDelivery delivery);

    default CompletableFuture<DeadLetterRecord> sendToDeadLetter(MessageEnvelope<?> envelope, Throwable failure,
                                                                 String handlerType, int attemptCount) {
        return sendToDeadLetter(FailedDelivery.of(envelope, failure, handlerType, attemptCount));
    }

    /**
     * Peeks at up to {@code maxCount} records without removing them.
     */
    List<DeadLetterRecord> listDeadLetters(String sourceQueue, int maxCount);

    /**
     * Republishes the original body of a record to its source queue.
     *
     * @return {@code false} if no record with that id was found
     */
    boolean reprocess(String sourceQueue, String messageId);

    boolean purge(String sourceQueue, String messageId);

    DeadLetterStatistics statistics();

    /**
     * Idempotently creates the dead-letter locations for the given source queues.
     */
    void ensureInfrastructure(Collection<String> sourceQueues);

    TransportMode getTransportMode();
}
