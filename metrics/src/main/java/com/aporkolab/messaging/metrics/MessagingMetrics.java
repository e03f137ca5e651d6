package com.aporkolab.messaging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.DeadLetterStatistics;
import com.aporkolab.messaging.dlq.FailureType;
import com.aporkolab.messaging.events.CachedValue;
import com.aporkolab.messaging.retry.RetryListener;

import java.time.Duration;
import java.util.Collection;

/**
 * Micrometer metrics for message retry and quarantine.
 *
 * Provides the following metrics:
 * - messaging_retries_total: Failed attempts that were retried, by queue and failure type
 * - messaging_delivered_total: Delivered messages, by queue
 * - messaging_quarantined_total: Messages sent to the dead-letter location, by queue and failure type
 * - messaging_delivery_attempts: Attempts needed per delivered message
 * - messaging_backoff_delay: Requested backoff waits
 * - messaging_dead_letter_depth: Records currently held per source queue
 */
public class MessagingMetrics implements RetryListener {

    private static final String METRIC_PREFIX = "messaging";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final Timer backoffTimer;

    public MessagingMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public MessagingMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.backoffTimer = Timer.builder(METRIC_PREFIX + "_backoff_delay")
                .description("Backoff waits scheduled between attempts")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onRetry(String messageType, String sourceQueue, int failedAttempt, FailureType failureType,
                        Duration delay) {
        Counter.builder(METRIC_PREFIX + "_retries_total")
                .description("Failed attempts that were retried")
                .tags(queueTags(messageType, sourceQueue).and("failure_type", failureType.name()))
                .register(registry)
                .increment();

        backoffTimer.record(delay);
    }

    @Override
    public void onDelivered(String messageType, String sourceQueue, int attempts) {
        Counter.builder(METRIC_PREFIX + "_delivered_total")
                .description("Messages handled successfully")
                .tags(queueTags(messageType, sourceQueue))
                .register(registry)
                .increment();

        registry.summary(METRIC_PREFIX + "_delivery_attempts", queueTags(messageType, sourceQueue))
                .record(attempts);
    }

    @Override
    public void onQuarantined(String messageType, String sourceQueue, int attempts, FailureType failureType) {
        Counter.builder(METRIC_PREFIX + "_quarantined_total")
                .description("Messages sent to the dead-letter location")
                .tags(queueTags(messageType, sourceQueue).and("failure_type", failureType.name()))
                .register(registry)
                .increment();
    }

    /**
     * Registers a depth gauge per source queue. Scrapes read statistics cached for
     * {@code refresh}, so the broker is asked at most once per interval.
     */
    public void bindDeadLetterDepth(DeadLetterService deadLetterService, Collection<String> sourceQueues,
                                    Duration refresh) {
        CachedValue<DeadLetterStatistics> statistics = new CachedValue<>(deadLetterService::statistics, refresh);

        for (String sourceQueue : sourceQueues) {
            Gauge.builder(METRIC_PREFIX + "_dead_letter_depth", statistics, s -> s.get().messagesIn(sourceQueue))
                    .description("Records currently held in the dead-letter location")
                    .tags(baseTags.and("source_queue", sourceQueue))
                    .register(registry);
        }
    }

    private Tags queueTags(String messageType, String sourceQueue) {
        return baseTags.and("message_type", messageType, "source_queue", sourceQueue);
    }
}
