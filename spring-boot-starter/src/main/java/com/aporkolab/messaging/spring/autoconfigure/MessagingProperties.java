package com.aporkolab.messaging.spring.autoconfigure;

import com.aporkolab.messaging.bus.CloudBrokerOptions;
import com.aporkolab.messaging.bus.DeadLetterTopology;
import com.aporkolab.messaging.bus.RabbitMqOptions;
import com.aporkolab.messaging.dlq.RetryPolicySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties for reliable messaging.
 * 
 * Example application.yml:
 * <pre>
 * messaging:
 *   enabled: true
 *   environment: production
 *   application-version: 2.4.1
 *   rabbit-mq:
 *     host: localhost
 *     default-queue: messaging.default
 *     domain-queues:
 *       users: users-events
 *   cloud:
 *     bootstrap-servers: ${KAFKA_BOOTSTRAP_SERVERS}
 *     connection-string: ${CLOUD_BROKER_CONNECTION_STRING}
 *     default-topic: messaging-events
 *   dead-letter:
 *     max-retry-attempts: 5
 *     initial-retry-delay-seconds: 5
 *     backoff-multiplier: 2.0
 *     max-retry-delay-seconds: 300
 *     dead-letter-ttl-hours: 72
 *   event-registry:
 *     cache-ttl-minutes: 60
 * </pre>
 */
@ConfigurationProperties(prefix = "messaging")
public class MessagingProperties {

    private boolean enabled = true;

    /**
     * Overrides the environment derived from the active profiles.
     */
    private String environment;

    private String applicationVersion = "unknown";

    @NestedConfigurationProperty
    private RabbitMqOptions rabbitMq = new RabbitMqOptions();

    @NestedConfigurationProperty
    private CloudBrokerOptions cloud = new CloudBrokerOptions();

    private DeadLetterProperties deadLetter = new DeadLetterProperties();
    private EventRegistryProperties eventRegistry = new EventRegistryProperties();
    private MetricsProperties metrics = new MetricsProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = applicationVersion;
    }

    public RabbitMqOptions getRabbitMq() {
        return rabbitMq;
    }

    public void setRabbitMq(RabbitMqOptions rabbitMq) {
        this.rabbitMq = rabbitMq;
    }

    public CloudBrokerOptions getCloud() {
        return cloud;
    }

    public void setCloud(CloudBrokerOptions cloud) {
        this.cloud = cloud;
    }

    public DeadLetterProperties getDeadLetter() {
        return deadLetter;
    }

    public void setDeadLetter(DeadLetterProperties deadLetter) {
        this.deadLetter = deadLetter;
    }

    public EventRegistryProperties getEventRegistry() {
        return eventRegistry;
    }

    public void setEventRegistry(EventRegistryProperties eventRegistry) {
        this.eventRegistry = eventRegistry;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    // ==================== NESTED PROPERTIES CLASSES ====================

    /**
     * Retry policy plus the naming of the dead-letter locations.
     */
    public static class DeadLetterProperties extends RetryPolicySettings {
        private String queuePrefix = DeadLetterTopology.DEFAULT.getQueuePrefix();
        private String exchange = DeadLetterTopology.DEFAULT.getExchange();
        private String routingKey = DeadLetterTopology.DEFAULT.getRoutingKeyPrefix();
        private String topicSuffix = DeadLetterTopology.DEFAULT.getTopicSuffix();

        public DeadLetterTopology toTopology() {
            return new DeadLetterTopology(exchange, routingKey, queuePrefix, topicSuffix);
        }

        public String getQueuePrefix() {
            return queuePrefix;
        }

        public void setQueuePrefix(String queuePrefix) {
            this.queuePrefix = queuePrefix;
        }

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public void setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
        }

        public String getTopicSuffix() {
            return topicSuffix;
        }

        public void setTopicSuffix(String topicSuffix) {
            this.topicSuffix = topicSuffix;
        }
    }

    public static class EventRegistryProperties {
        private long cacheTtlMinutes = 60;

        public long getCacheTtlMinutes() {
            return cacheTtlMinutes;
        }

        public void setCacheTtlMinutes(long cacheTtlMinutes) {
            this.cacheTtlMinutes = cacheTtlMinutes;
        }
    }

    public static class MetricsProperties {
        private boolean enabled = true;
        private long depthRefreshSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDepthRefreshSeconds() {
            return depthRefreshSeconds;
        }

        public void setDepthRefreshSeconds(long depthRefreshSeconds) {
            this.depthRefreshSeconds = depthRefreshSeconds;
        }
    }
}
