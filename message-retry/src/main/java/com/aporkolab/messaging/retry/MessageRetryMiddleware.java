package com.aporkolab.messaging.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.bus.MessageEnvelope;
import com.aporkolab.messaging.bus.MessageHandler;
import com.aporkolab.messaging.dlq.DeadLetterRecord;
import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.FailedDelivery;
import com.aporkolab.messaging.dlq.FailureClassifier;
import com.aporkolab.messaging.dlq.FailureType;
import com.aporkolab.messaging.dlq.RetryPolicy;
import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.logging.CorrelationContext;

/**
 * Runs one handler for one source queue with retry and quarantine.
 * <p>
 * Each message goes through Attempting, then Waiting and back while the
 * {@link RetryPolicy} allows it, and ends either Delivered or Quarantined in the
 * {@link DeadLetterService}. All per-message state lives in the invocation, so one
 * instance serves any number of concurrent messages.
 * <p>
 * Cancelling the future returned by {@link #executeWithRetry} cancels the running
 * handler stage or the pending wait; nothing is retried or quarantined afterwards.
 */
public class MessageRetryMiddleware<T> {

    private static final Logger log = LoggerFactory.getLogger(MessageRetryMiddleware.class);

    private final Class<T> messageType;
    private final MessageHandler<T> handler;
    private final String handlerType;
    private final String sourceQueue;
    private final RetryPolicy policy;
    private final DeadLetterService deadLetterService;
    private final BackoffScheduler scheduler;
    private final List<RetryListener> listeners;
    private final Clock clock;

    public MessageRetryMiddleware(Class<T> messageType, MessageHandler<T> handler, String sourceQueue,
                                  RetryPolicy policy, DeadLetterService deadLetterService,
                                  BackoffScheduler scheduler, List<RetryListener> listeners, Clock clock) {
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.handlerType = handler.getClass().getName();
        this.sourceQueue = Objects.requireNonNull(sourceQueue, "sourceQueue");
        this.policy = policy;
        this.deadLetterService = deadLetterService;
        this.scheduler = scheduler;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public CompletableFuture<RetryOutcome> executeWithRetry(T message) {
        return executeWithRetry(MessageEnvelope.of(message, sourceQueue));
    }

    public CompletableFuture<RetryOutcome> executeWithRetry(MessageEnvelope<T> envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        MessageEnvelope<T> routed = envelope.getSourceQueue() != null
                ? envelope
                : envelope.toBuilder().sourceQueue(sourceQueue).build();

        Execution execution = new Execution(routed);
        execution.attempt(1);
        return execution.result;
    }

    /**
     * Adapts this middleware for {@code MessageBus.subscribe}: the returned handler
     * completes normally once the message is delivered or quarantined, and fails only
     * if the quarantine itself fails, leaving the message to the transport.
     */
    public MessageHandler<T> asHandler() {
        return new MessageHandler<>() {
            @Override
            public CompletionStage<Void> handle(T message) {
                return executeWithRetry(message).thenApply(outcome -> null);
            }

            @Override
            public CompletionStage<Void> handleEnvelope(MessageEnvelope<T> envelope) {
                return executeWithRetry(envelope).thenApply(outcome -> null);
            }
        };
    }

    public Class<T> getMessageType() {
        return messageType;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public String getSourceQueue() {
        return sourceQueue;
    }

    /**
     * State of one message travelling through the middleware.
     */
    private final class Execution {

        private final MessageEnvelope<T> envelope;
        private final String typeName;
        private final CompletableFuture<RetryOutcome> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<?>> pending = new AtomicReference<>();
        private final List<DeadLetterRecord.FailureAttempt> history = new ArrayList<>();
        private Instant firstAttemptAt;

        private Execution(MessageEnvelope<T> envelope) {
            this.envelope = envelope;
            this.typeName = envelope.getMessageType() != null
                    ? envelope.getMessageType()
                    : EventTypeCatalog.nameOf(messageType);
            result.whenComplete((outcome, ex) -> {
                if (result.isCancelled()) {
                    CompletableFuture<?> current = pending.get();
                    if (current != null) {
                        current.cancel(true);
                    }
                }
            });
        }

        private void attempt(int attemptNumber) {
            if (result.isDone()) {
                return;
            }
            Instant startedAt = clock.instant();
            if (firstAttemptAt == null) {
                firstAttemptAt = startedAt;
            }

            CompletableFuture<Void> stage = invokeHandler(attemptNumber);
            track(stage);
            stage.whenComplete((ignored, ex) -> {
                if (result.isDone()) {
                    return;
                }
                try {
                    if (ex == null) {
                        delivered(attemptNumber);
                    } else {
                        failed(attemptNumber, startedAt, FailureClassifier.unwrap(ex));
                    }
                } catch (RuntimeException e) {
                    log.error("Retry decision for message {} failed at attempt {}",
                            envelope.getMessageId(), attemptNumber, e);
                    result.completeExceptionally(e);
                }
            });
        }

        private CompletableFuture<Void> invokeHandler(int attemptNumber) {
            try (CorrelationContext ignored = CorrelationContext
                    .forMessage(envelope.getCorrelationId(), envelope.getMessageId(), envelope.getSourceQueue())
                    .withAttempt(attemptNumber)) {
                CompletionStage<Void> stage = handler.handleEnvelope(envelope);
                return stage != null ? stage.toCompletableFuture() : CompletableFuture.completedFuture(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.failedFuture(e);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void delivered(int attempts) {
            log.debug("Message {} of type {} delivered from {} after {} attempt(s)",
                    envelope.getMessageId(), typeName, envelope.getSourceQueue(), attempts);
            result.complete(RetryOutcome.delivered(attempts));
            notifyListeners("onDelivered",
                    listener -> listener.onDelivered(typeName, envelope.getSourceQueue(), attempts));
        }

        private void failed(int attemptNumber, Instant startedAt, Throwable failure) {
            if (FailureClassifier.isCancellation(failure)) {
                log.debug("Handling of message {} cancelled at attempt {}", envelope.getMessageId(), attemptNumber);
                CancellationException cancellation = new CancellationException(
                        "Handler " + handlerType + " cancelled message " + envelope.getMessageId());
                cancellation.initCause(failure);
                result.completeExceptionally(cancellation);
                return;
            }

            Instant endedAt = clock.instant();
            history.add(DeadLetterRecord.FailureAttempt.of(attemptNumber, startedAt, failure,
                    Duration.between(startedAt, endedAt), handlerType));
            FailureType failureType = FailureClassifier.classify(failure);

            if (!policy.shouldRetry(failure, attemptNumber)) {
                quarantine(attemptNumber, failure, failureType);
                return;
            }

            Duration delay = policy.calculateRetryDelay(attemptNumber);
            if (policy.getSettings().isEnableDetailedLogging()) {
                log.warn("Attempt {} of message {} ({}) from {} failed with {}, retrying in {}ms",
                        attemptNumber, envelope.getMessageId(), typeName, envelope.getSourceQueue(),
                        DeadLetterRecord.describe(failure), delay.toMillis());
            } else {
                log.debug("Attempt {} of message {} failed, retrying in {}ms",
                        attemptNumber, envelope.getMessageId(), delay.toMillis());
            }
            notifyListeners("onRetry", listener ->
                    listener.onRetry(typeName, envelope.getSourceQueue(), attemptNumber, failureType, delay));

            CompletableFuture<Void> wait = scheduler.delay(delay);
            track(wait);
            wait.whenComplete((ignored, ex) -> {
                if (result.isDone()) {
                    return;
                }
                if (ex != null) {
                    result.completeExceptionally(FailureClassifier.unwrap(ex));
                    return;
                }
                attempt(attemptNumber + 1);
            });
        }

        private void quarantine(int attempts, Throwable failure, FailureType failureType) {
            FailedDelivery delivery = new FailedDelivery(envelope, failure, handlerType, attempts, firstAttemptAt, history);
            deadLetterService.sendToDeadLetter(delivery).whenComplete((deadLetter, ex) -> {
                if (ex != null) {
                    Throwable cause = FailureClassifier.unwrap(ex);
                    log.error("Message {} from {} could not be quarantined after {} attempts",
                            envelope.getMessageId(), envelope.getSourceQueue(), attempts, cause);
                    result.completeExceptionally(cause);
                    return;
                }
                result.complete(RetryOutcome.quarantined(attempts, deadLetter));
                notifyListeners("onQuarantined", listener ->
                        listener.onQuarantined(typeName, envelope.getSourceQueue(), attempts, failureType));
            });
        }

        // a failing listener never decides the outcome of a message
        private void notifyListeners(String event, Consumer<RetryListener> call) {
            for (RetryListener listener : listeners) {
                try {
                    call.accept(listener);
                } catch (RuntimeException e) {
                    log.error("Retry listener {} failed in {} for message {}",
                            listener.getClass().getName(), event, envelope.getMessageId(), e);
                }
            }
        }

        private void track(CompletableFuture<?> stage) {
            pending.set(stage);
            if (result.isCancelled()) {
                stage.cancel(true);
            }
        }
    }
}
