package com.aporkolab.messaging.bus;

import java.util.concurrent.CompletableFuture;

/**
 * Transport-independent messaging entry point.
 * <p>
 * Implementations are shared by all callers and safe for concurrent use. All
 * operations are asynchronous: delivery failures surface through the returned
 * future, never by blocking the caller.
 */
public interface MessageBus {

    /**
     * Point-to-point delivery to a queue.
     *
     * @param destination queue name, or {@code null} for the configured default queue
     */
    <T> CompletableFuture<Void> send(T message, String destination);

    default <T> CompletableFuture<Void> send(T message) {
        return send(message, null);
    }

    /**
     * Fan-out delivery to every subscriber of the event's type.
     *
     * @param topic topic (exchange) name, or {@code null} for the configured default
     */
    <T> CompletableFuture<Void> publish(T event, String topic);

    default <T> CompletableFuture<Void> publish(T event) {
        return publish(event, null);
    }

    /**
     * Registers a long-lived consumer for messages of the given type.
     *
     * @param subscriptionName consumer name (queue or consumer group), or {@code null}
     *                         to derive one from the message type
     */
    <T> Subscription subscribe(Class<T> messageType, MessageHandler<T> handler, String subscriptionName);

    default <T> Subscription subscribe(Class<T> messageType, MessageHandler<T> handler) {
        return subscribe(messageType, handler, null);
    }

    /**
     * Idempotently declares the queues, topics and exchanges this bus relies on.
     */
    void ensureInfrastructure();

    TransportMode getTransportMode();
}
