package com.aporkolab.messaging.bus;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts every call and performs no transport I/O.
 * Used when messaging is disabled and in the testing environment.
 */
public class NoOpMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(NoOpMessageBus.class);

    @Override
    public <T> CompletableFuture<Void> send(T message, String destination) {
        log.debug("Messaging disabled: dropping send of {} to {}", typeOf(message), destination);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public <T> CompletableFuture<Void> publish(T event, String topic) {
        log.debug("Messaging disabled: dropping publish of {} to {}", typeOf(event), topic);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public <T> Subscription subscribe(Class<T> messageType, MessageHandler<T> handler, String subscriptionName) {
        String name = subscriptionName != null ? subscriptionName : SubscriptionNames.forType(messageType);
        log.debug("Messaging disabled: subscription {} will never receive messages", name);
        return new Subscription() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean isActive() {
                return false;
            }

            @Override
            public void close() {
                // nothing was started
            }
        };
    }

    @Override
    public void ensureInfrastructure() {
        log.debug("Messaging disabled: no infrastructure to declare");
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.DISABLED;
    }

    private static String typeOf(Object message) {
        return message != null ? message.getClass().getSimpleName() : "null";
    }
}
