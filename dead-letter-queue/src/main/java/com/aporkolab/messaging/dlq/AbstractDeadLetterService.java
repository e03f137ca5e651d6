package com.aporkolab.messaging.dlq;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.bus.MessageEnvelope;
import com.aporkolab.messaging.exception.DeadLetterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Record building, logging and notification shared by the broker-backed services.
 * Subclasses only know how to write and read their own dead-letter location.
 */
public abstract class AbstractDeadLetterService implements DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(AbstractDeadLetterService.class);

    protected final RetryPolicySettings settings;
    protected final ObjectMapper objectMapper;
    private final DeadLetterOrigin origin;
    private final List<DeadLetterNotifier> notifiers;
    protected final Clock clock;

    protected AbstractDeadLetterService(RetryPolicySettings settings, ObjectMapper objectMapper, DeadLetterOrigin origin,
                                        List<DeadLetterNotifier> notifiers, Clock clock) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.origin = origin;
        this.notifiers = List.copyOf(notifiers);
        this.clock = clock;
    }

    /**
     * Writes the serialized record; the future completes once the broker accepted it.
     */
    protected abstract CompletableFuture<Void> write(DeadLetterRecord record, String json);

    @Override
    public CompletableFuture<DeadLetterRecord> sendToDeadLetter(FailedDelivery delivery) {
        MessageEnvelope<?> envelope = delivery.envelope();
        String sourceQueue = envelope.getSourceQueue();

        CompletableFuture<Void> written;
        DeadLetterRecord deadLetter;
        try {
            deadLetter = createRecord(delivery);
            written = write(deadLetter, objectMapper.writeValueAsString(deadLetter));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to send message {} from {} to dead letter", envelope.getMessageId(), sourceQueue, e);
            return CompletableFuture.failedFuture(new DeadLetterException(sourceQueue, envelope.getMessageType(), e));
        }

        CompletableFuture<DeadLetterRecord> result = new CompletableFuture<>();
        written.whenComplete((ignored, ex) -> {
            if (ex != null) {
                Throwable cause = FailureClassifier.unwrap(ex);
                log.error("Failed to send message {} from {} to dead letter", deadLetter.getMessageId(), sourceQueue, cause);
                result.completeExceptionally(new DeadLetterException(sourceQueue, deadLetter.getMessageType(), cause));
                return;
            }

            log.warn("Message {} of type {} sent to dead letter for {} after {} attempts: {}",
                    deadLetter.getOriginalMessageId(), deadLetter.getMessageType(), sourceQueue,
                    deadLetter.getAttemptCount(), deadLetter.getFailureReason());
            if (settings.isEnableDetailedLogging()) {
                deadLetter.getFailureHistory().forEach(attempt -> log.warn("  attempt {} at {} by {} took {}: {}: {}",
                        attempt.attemptNumber(), attempt.attemptedAt(), attempt.handlerType(),
                        attempt.processingDuration(), attempt.exceptionType(), attempt.exceptionMessage()));
            }
            if (settings.isEnableAdminNotifications()) {
                notifyAdmins(deadLetter);
            }
            result.complete(deadLetter);
        });
        return result;
    }

    DeadLetterRecord createRecord(FailedDelivery delivery) throws JsonProcessingException {
        MessageEnvelope<?> envelope = delivery.envelope();
        Throwable failure = FailureClassifier.unwrap(delivery.failure());
        Instant now = clock.instant();
        String body = envelope.getBody() != null
                ? envelope.getBody()
                : objectMapper.writeValueAsString(envelope.getPayload());

        return DeadLetterRecord.builder()
                .messageId(UUID.randomUUID().toString())
                .originalMessageId(envelope.getMessageId())
                .messageType(envelope.getMessageType())
                .originalMessage(body)
                .sourceQueue(envelope.getSourceQueue())
                .correlationId(envelope.getCorrelationId())
                .handlerType(delivery.handlerType())
                .firstAttemptAt(delivery.firstAttemptAt() != null ? delivery.firstAttemptAt() : now)
                .lastAttemptAt(now)
                .attemptCount(delivery.attemptCount())
                .failureType(FailureClassifier.classify(failure))
                .failureReason(DeadLetterRecord.describe(failure))
                .stackTrace(DeadLetterRecord.stackTraceOf(failure))
                .failureHistory(delivery.history())
                .originalHeaders(envelope.getHeaders())
                .environment(origin.stamp(now))
                .expiresAt(now.plus(settings.deadLetterTtl()))
                .build();
    }

    protected Optional<DeadLetterRecord> readRecord(String json, String location) {
        try {
            DeadLetterRecord deadLetter = objectMapper.readValue(json, DeadLetterRecord.class);
            if (deadLetter.getMessageId() == null || deadLetter.getOriginalMessage() == null) {
                log.debug("Message in {} is not a dead letter record", location);
                return Optional.empty();
            }
            return Optional.of(deadLetter);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable dead letter in {}: {}", location, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void notifyAdmins(DeadLetterRecord deadLetter) {
        for (DeadLetterNotifier notifier : notifiers) {
            try {
                notifier.notify(deadLetter);
            } catch (RuntimeException e) {
                log.error("Notifier {} failed for dead letter {}", notifier.name(), deadLetter.getMessageId(), e);
            }
        }
    }

    public RetryPolicySettings getSettings() {
        return settings;
    }
}
