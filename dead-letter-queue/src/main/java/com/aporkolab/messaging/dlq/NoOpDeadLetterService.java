package com.aporkolab.messaging.dlq;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.bus.MessageEnvelope;
import com.aporkolab.messaging.bus.TransportMode;

/**
 * Used when messaging is disabled: logs the quarantine and drops the message.
 */
public class NoOpDeadLetterService implements DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(NoOpDeadLetterService.class);

    @Override
    public CompletableFuture<DeadLetterRecord> sendToDeadLetter(FailedDelivery delivery) {
        MessageEnvelope<?> envelope = delivery.envelope();
        log.debug("Messaging disabled, dropping dead letter {} of type {} from {} after {} attempts: {}",
                envelope.getMessageId(), envelope.getMessageType(), envelope.getSourceQueue(),
                delivery.attemptCount(), DeadLetterRecord.describe(delivery.failure()));

        return CompletableFuture.completedFuture(DeadLetterRecord.builder()
                .messageId(envelope.getMessageId())
                .originalMessageId(envelope.getMessageId())
                .messageType(envelope.getMessageType())
                .sourceQueue(envelope.getSourceQueue())
                .correlationId(envelope.getCorrelationId())
                .handlerType(delivery.handlerType())
                .attemptCount(delivery.attemptCount())
                .failureType(FailureClassifier.classify(delivery.failure()))
                .failureReason(DeadLetterRecord.describe(FailureClassifier.unwrap(delivery.failure())))
                .build());
    }

    @Override
    public List<DeadLetterRecord> listDeadLetters(String sourceQueue, int maxCount) {
        return List.of();
    }

    @Override
    public boolean reprocess(String sourceQueue, String messageId) {
        return false;
    }

    @Override
    public boolean purge(String sourceQueue, String messageId) {
        return false;
    }

    @Override
    public DeadLetterStatistics statistics() {
        return DeadLetterStatistics.empty();
    }

    @Override
    public void ensureInfrastructure(Collection<String> sourceQueues) {
        log.debug("Messaging disabled, no dead letter infrastructure for {}", sourceQueues);
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.DISABLED;
    }
}
