package com.aporkolab.messaging.retry;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.aporkolab.messaging.bus.MessageHandler;
import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.RetryPolicy;

/**
 * Creates one {@link MessageRetryMiddleware} per (message type, handler, source queue).
 */
public class MessageRetryMiddlewareFactory {

    private final RetryPolicy policy;
    private final DeadLetterService deadLetterService;
    private final BackoffScheduler scheduler;
    private final List<RetryListener> listeners;
    private final Clock clock;

    public MessageRetryMiddlewareFactory(RetryPolicy policy, DeadLetterService deadLetterService,
                                         BackoffScheduler scheduler, List<RetryListener> listeners) {
        this(policy, deadLetterService, scheduler, listeners, Clock.systemUTC());
    }

    public MessageRetryMiddlewareFactory(RetryPolicy policy, DeadLetterService deadLetterService,
                                         BackoffScheduler scheduler, List<RetryListener> listeners, Clock clock) {
        this.policy = policy;
        this.deadLetterService = deadLetterService;
        this.scheduler = scheduler;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public <T> MessageRetryMiddleware<T> create(Class<T> messageType, MessageHandler<T> handler, String sourceQueue) {
        return new MessageRetryMiddleware<>(messageType, handler, sourceQueue, policy, deadLetterService,
                scheduler, listeners, clock);
    }

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<RetryOutcome> executeWithRetry(T message, MessageHandler<T> handler, String sourceQueue) {
        return create((Class<T>) message.getClass(), handler, sourceQueue).executeWithRetry(message);
    }
}
