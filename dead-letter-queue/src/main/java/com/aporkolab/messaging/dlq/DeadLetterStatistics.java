package com.aporkolab.messaging.dlq;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dead-letter depth per source queue at one point in time.
 */
public record DeadLetterStatistics(Map<String, Long> messagesByQueue, Instant collectedAt) {

    public DeadLetterStatistics {
        messagesByQueue = Collections.unmodifiableMap(new LinkedHashMap<>(messagesByQueue));
    }

    public static DeadLetterStatistics empty() {
        return new DeadLetterStatistics(Map.of(), Instant.now());
    }

    public long totalMessages() {
        long total = 0;
        for (long count : messagesByQueue.values()) {
            total += count;
        }
        return total;
    }

    public long messagesIn(String sourceQueue) {
        return messagesByQueue.getOrDefault(sourceQueue, 0L);
    }
}
