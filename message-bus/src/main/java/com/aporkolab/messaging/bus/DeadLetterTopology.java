package com.aporkolab.messaging.bus;

import java.util.Objects;

/**
 * Naming of the transport-native dead-letter locations.
 *
 * <ul>
 *   <li>RabbitMQ: exchange {@code dlx.messaging}, queue {@code dlq.<source>},
 *       routing key {@code deadletter.<source>}</li>
 *   <li>Kafka: topic {@code <source>.dlq}</li>
 * </ul>
 */
public final class DeadLetterTopology {

    public static final DeadLetterTopology DEFAULT = new DeadLetterTopology("dlx.messaging", "deadletter", "dlq", ".dlq");

    private final String exchange;
    private final String routingKeyPrefix;
    private final String queuePrefix;
    private final String topicSuffix;

    public DeadLetterTopology(String exchange, String routingKeyPrefix, String queuePrefix, String topicSuffix) {
        this.exchange = requireText(exchange, "exchange");
        this.routingKeyPrefix = requireText(routingKeyPrefix, "routingKeyPrefix");
        this.queuePrefix = requireText(queuePrefix, "queuePrefix");
        this.topicSuffix = requireText(topicSuffix, "topicSuffix");
    }

    public String getExchange() {
        return exchange;
    }

    public String queueFor(String sourceQueue) {
        return queuePrefix + "." + sourceQueue;
    }

    public String routingKeyFor(String sourceQueue) {
        return routingKeyPrefix + "." + sourceQueue;
    }

    public String topicFor(String sourceQueue) {
        return sourceQueue + topicSuffix;
    }

    /**
     * Inverse of {@link #queueFor(String)}; returns {@code null} for names outside the prefix.
     */
    public String sourceQueueOf(String deadLetterQueue) {
        String prefix = queuePrefix + ".";
        if (deadLetterQueue == null || !deadLetterQueue.startsWith(prefix)) {
            return null;
        }
        return deadLetterQueue.substring(prefix.length());
    }

    public String getRoutingKeyPrefix() {
        return routingKeyPrefix;
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    public String getTopicSuffix() {
        return topicSuffix;
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
