package com.aporkolab.messaging.spring.autoconfigure;

import com.aporkolab.messaging.bus.DeadLetterTopology;
import com.aporkolab.messaging.bus.DeploymentEnvironment;
import com.aporkolab.messaging.bus.EnvelopeCodec;
import com.aporkolab.messaging.bus.KafkaMessageBus;
import com.aporkolab.messaging.bus.MessageBus;
import com.aporkolab.messaging.bus.MessageBusFactory;
import com.aporkolab.messaging.bus.RabbitMqMessageBus;
import com.aporkolab.messaging.bus.TransportMode;
import com.aporkolab.messaging.bus.TransportModeSelector;
import com.aporkolab.messaging.dlq.DeadLetterNotifier;
import com.aporkolab.messaging.dlq.DeadLetterOrigin;
import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.DeadLetterServiceFactory;
import com.aporkolab.messaging.dlq.KafkaDeadLetterService;
import com.aporkolab.messaging.dlq.LoggingDeadLetterNotifier;
import com.aporkolab.messaging.dlq.RabbitMqDeadLetterService;
import com.aporkolab.messaging.dlq.RetryPolicy;
import com.aporkolab.messaging.events.EventTypeModule;
import com.aporkolab.messaging.events.EventTypeRegistry;
import com.aporkolab.messaging.metrics.MessagingMetrics;
import com.aporkolab.messaging.retry.BackoffScheduler;
import com.aporkolab.messaging.retry.MessageRetryMiddlewareFactory;
import com.aporkolab.messaging.retry.RetryListener;
import com.aporkolab.messaging.retry.ScheduledBackoffScheduler;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Spring Boot Auto-Configuration for reliable messaging.
 * 
 * Automatically configures:
 * - Transport selection from messaging.enabled and the deployment environment
 * - Message bus and dead-letter service for the selected transport
 * - Retry policy and retry middleware factory
 * - Event type registry from all EventTypeModule beans
 * - Retry metrics when a MeterRegistry is present
 * 
 * Only the selected transport's broker clients are ever connected.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableConfigurationProperties(MessagingProperties.class)
public class MessagingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MessagingAutoConfiguration.class);

    // ==================== TRANSPORT SELECTION ====================

    @Bean
    @ConditionalOnMissingBean
    public DeploymentEnvironment messagingDeploymentEnvironment(MessagingProperties properties,
                                                                Environment environment) {
        DeploymentEnvironment resolved = properties.getEnvironment() != null
                ? DeploymentEnvironment.fromName(properties.getEnvironment())
                : DeploymentEnvironment.fromProfiles(environment.getActiveProfiles());
        log.info("Messaging deployment environment: {}", resolved.getDisplayName());
        return resolved;
    }

    // broker settings are checked before any bean can send
    @Bean
    @ConditionalOnMissingBean
    public TransportMode messagingTransportMode(MessagingProperties properties,
                                                DeploymentEnvironment environment) {
        TransportMode mode = TransportModeSelector.select(properties.isEnabled(), environment);
        switch (mode) {
            case LOCAL_BROKER -> properties.getRabbitMq().validateFor(environment);
            case MANAGED_CLOUD_BROKER -> properties.getCloud().validateFor(environment);
            case DISABLED -> {
            }
        }
        return mode;
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterTopology deadLetterTopology(MessagingProperties properties) {
        return properties.getDeadLetter().toTopology();
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor messagingTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("messaging-io-");
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(1000);
        executor.initialize();
        return executor;
    }

    @Bean
    RabbitMqClients messagingRabbitMqClients(MessagingProperties properties) {
        return new RabbitMqClients(properties.getRabbitMq());
    }

    @Bean
    KafkaClients messagingKafkaClients(MessagingProperties properties) {
        return new KafkaClients(properties.getCloud());
    }

    // ==================== EVENT TYPES ====================

    @Bean
    @ConditionalOnMissingBean
    public EventTypeRegistry eventTypeRegistry(MessagingProperties properties,
                                               ObjectProvider<EventTypeModule> modules) {
        return new EventTypeRegistry(modules.orderedStream().toList(),
                Duration.ofMinutes(properties.getEventRegistry().getCacheTtlMinutes()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(EventTypeRegistry eventTypeRegistry) {
        return new EnvelopeCodec(EnvelopeCodec.defaultObjectMapper(), eventTypeRegistry);
    }

    // ==================== MESSAGE BUS ====================

    @Bean
    @ConditionalOnMissingBean
    public MessageBusFactory messageBusFactory(TransportMode mode, MessagingProperties properties, EnvelopeCodec codec,
                                               DeadLetterTopology topology, RabbitMqClients rabbit,
                                               KafkaClients kafka,
                                               @Qualifier("messagingTaskExecutor") Executor executor) {
        return new MessageBusFactory(mode,
                () -> new RabbitMqMessageBus(rabbit.template(), rabbit.admin(), rabbit.connectionFactory(),
                        codec, properties.getRabbitMq(), topology, executor),
                () -> new KafkaMessageBus(kafka.template(), kafka.consumerFactory(), kafka.admin(),
                        codec, properties.getCloud(), topology));
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageBus messageBus(MessageBusFactory messageBusFactory) {
        return messageBusFactory.createMessageBus();
    }

    // ==================== DEAD LETTERS ====================

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(MessagingProperties properties) {
        return new RetryPolicy(properties.getDeadLetter());
    }

    @Bean
    @ConditionalOnMissingBean(name = "loggingDeadLetterNotifier")
    public LoggingDeadLetterNotifier loggingDeadLetterNotifier() {
        return new LoggingDeadLetterNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterServiceFactory deadLetterServiceFactory(TransportMode mode, DeploymentEnvironment environment,
                                                             MessagingProperties properties, EnvelopeCodec codec,
                                                             DeadLetterTopology topology, RabbitMqClients rabbit,
                                                             KafkaClients kafka,
                                                             ObjectProvider<DeadLetterNotifier> notifiers,
                                                             @Qualifier("messagingTaskExecutor") Executor executor) {
        DeadLetterOrigin origin = DeadLetterOrigin.detect(environment.getDisplayName(),
                properties.getApplicationVersion());
        List<DeadLetterNotifier> notifierList = notifiers.orderedStream().toList();
        Clock clock = Clock.systemUTC();

        return new DeadLetterServiceFactory(mode,
                () -> new RabbitMqDeadLetterService(rabbit.template(), rabbit.admin(), properties.getRabbitMq(),
                        topology, properties.getDeadLetter(), codec.getObjectMapper(), origin, notifierList,
                        executor, clock),
                () -> new KafkaDeadLetterService(kafka.template(), kafka.consumerFactory(), kafka.admin(),
                        properties.getCloud(), topology, properties.getDeadLetter(), codec.getObjectMapper(),
                        origin, notifierList, clock));
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterService deadLetterService(DeadLetterServiceFactory deadLetterServiceFactory) {
        return deadLetterServiceFactory.createDeadLetterService();
    }

    // ==================== RETRY ====================

    @Bean
    @ConditionalOnMissingBean
    public BackoffScheduler backoffScheduler() {
        return new ScheduledBackoffScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageRetryMiddlewareFactory messageRetryMiddlewareFactory(RetryPolicy retryPolicy,
                                                                       DeadLetterService deadLetterService,
                                                                       BackoffScheduler backoffScheduler,
                                                                       ObjectProvider<RetryListener> listeners) {
        return new MessageRetryMiddlewareFactory(retryPolicy, deadLetterService, backoffScheduler,
                listeners.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagingInfrastructureInitializer messagingInfrastructureInitializer(
            MessageBus messageBus, DeadLetterService deadLetterService, RetryPolicy retryPolicy,
            EventTypeRegistry eventTypeRegistry, TransportMode mode, MessagingProperties properties,
            Environment environment) {
        String serviceName = environment.getProperty("spring.application.name", "messaging");
        return new MessagingInfrastructureInitializer(messageBus, deadLetterService, retryPolicy,
                eventTypeRegistry, sourceQueues(mode, properties), serviceName);
    }

    static Collection<String> sourceQueues(TransportMode mode, MessagingProperties properties) {
        Set<String> queues = new LinkedHashSet<>();
        switch (mode) {
            case LOCAL_BROKER -> {
                queues.add(properties.getRabbitMq().getDefaultQueue());
                queues.addAll(properties.getRabbitMq().getDomainQueues().values());
            }
            case MANAGED_CLOUD_BROKER -> queues.add(properties.getCloud().getDefaultTopic());
            case DISABLED -> {
            }
        }
        return new ArrayList<>(queues);
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "messaging.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MessagingMetrics messagingMetrics(MeterRegistry registry, DeadLetterService deadLetterService,
                                                 TransportMode mode, MessagingProperties properties) {
            MessagingMetrics metrics = new MessagingMetrics(registry);
            if (mode != TransportMode.DISABLED) {
                metrics.bindDeadLetterDepth(deadLetterService, sourceQueues(mode, properties),
                        Duration.ofSeconds(properties.getMetrics().getDepthRefreshSeconds()));
            }
            return metrics;
        }
    }
}
