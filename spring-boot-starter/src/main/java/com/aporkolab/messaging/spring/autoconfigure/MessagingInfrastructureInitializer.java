package com.aporkolab.messaging.spring.autoconfigure;

import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import com.aporkolab.messaging.bus.MessageBus;
import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.RetryPolicy;
import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.events.EventTypeRegistry;
import com.aporkolab.messaging.exception.MessagingConfigurationException;

/**
 * Builds the event type catalog, declares broker infrastructure and checks the retry
 * policy once the context is refreshed, before other lifecycle beans start consuming.
 * <p>
 * Any failure aborts startup with a {@link MessagingConfigurationException}.
 */
public class MessagingInfrastructureInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MessagingInfrastructureInitializer.class);

    static final int PHASE = Integer.MIN_VALUE + 1000;

    private final MessageBus messageBus;
    private final DeadLetterService deadLetterService;
    private final RetryPolicy retryPolicy;
    private final EventTypeRegistry eventTypeRegistry;
    private final List<String> sourceQueues;
    private final String serviceName;
    private volatile boolean running;

    public MessagingInfrastructureInitializer(MessageBus messageBus, DeadLetterService deadLetterService,
                                              RetryPolicy retryPolicy, EventTypeRegistry eventTypeRegistry,
                                              Collection<String> sourceQueues, String serviceName) {
        this.messageBus = messageBus;
        this.deadLetterService = deadLetterService;
        this.retryPolicy = retryPolicy;
        this.eventTypeRegistry = eventTypeRegistry;
        this.sourceQueues = List.copyOf(sourceQueues);
        this.serviceName = serviceName;
    }

    @Override
    public void start() {
        EventTypeCatalog catalog;
        try {
            // name clashes between event modules fail here instead of on the first message
            catalog = eventTypeRegistry.getAllEventTypes();
            messageBus.ensureInfrastructure();
            deadLetterService.ensureInfrastructure(sourceQueues);
            retryPolicy.validateConfiguration(serviceName);
        } catch (MessagingConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            MessagingConfigurationException ex = new MessagingConfigurationException(
                    "Messaging infrastructure could not be prepared for " + messageBus.getTransportMode(), e);
            ex.with("transportMode", messageBus.getTransportMode());
            ex.with("sourceQueues", sourceQueues);
            throw ex;
        }
        log.info("Messaging ready: transport={}, dead letters={}, source queues={}, event types={}",
                messageBus.getTransportMode(), deadLetterService.getTransportMode(), sourceQueues, catalog.size());
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
