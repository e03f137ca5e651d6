package com.aporkolab.messaging.bus;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.ImmediateRequeueAmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.aporkolab.messaging.logging.CorrelationContext;

/**
 * RabbitMQ transport.
 * <p>
 * {@code send} goes through the default exchange straight to the named queue.
 * {@code publish} goes to a durable topic exchange with the event type name as
 * routing key. Every queue this bus declares dead-letters into the
 * {@link DeadLetterTopology} exchange, so a message the consumer rejects ends up
 * in {@code dlq.<queue>}.
 */
public class RabbitMqMessageBus implements MessageBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqMessageBus.class);

    private final AmqpTemplate template;
    private final AmqpAdmin admin;
    private final ConnectionFactory connectionFactory;
    private final EnvelopeCodec codec;
    private final RabbitMqOptions options;
    private final DeadLetterTopology deadLetters;
    private final Executor executor;
    private final Map<String, SimpleMessageListenerContainer> containers = new ConcurrentHashMap<>();

    public RabbitMqMessageBus(AmqpTemplate template, AmqpAdmin admin, ConnectionFactory connectionFactory,
                              EnvelopeCodec codec, RabbitMqOptions options, DeadLetterTopology deadLetters,
                              Executor executor) {
        this.template = template;
        this.admin = admin;
        this.connectionFactory = connectionFactory;
        this.codec = codec;
        this.options = options;
        this.deadLetters = deadLetters;
        this.executor = executor;
    }

    @Override
    public <T> CompletableFuture<Void> send(T message, String destination) {
        Objects.requireNonNull(message, "message must not be null");
        String queue = destination != null ? destination : options.getDefaultQueue();
        return deliver("", queue, message, queue);
    }

    @Override
    public <T> CompletableFuture<Void> publish(T event, String topic) {
        Objects.requireNonNull(event, "event must not be null");
        String exchange = topic != null ? topic : options.getEventsExchange();
        return deliver(exchange, EventTypeCatalog.nameOf(event.getClass()), event, exchange);
    }

    private CompletableFuture<Void> deliver(String exchange, String routingKey, Object payload, String target) {
        Message amqpMessage = toAmqpMessage(payload);
        String messageType = amqpMessage.getMessageProperties().getType();
        String messageId = amqpMessage.getMessageProperties().getMessageId();

        return CompletableFuture.runAsync(CorrelationContext.wrap(() -> {
            try {
                template.send(exchange, routingKey, amqpMessage);
                log.debug("Message {} sent to {} with MessageId {}", messageType, target, messageId);
            } catch (AmqpConnectException e) {
                log.error("Failed to send message {} to {}: broker unreachable", messageType, target, e);
                throw TransientMessagingException.brokerUnavailable("rabbitmq", e);
            } catch (AmqpException e) {
                log.error("Failed to send message {} to {}", messageType, target, e);
                throw e;
            }
        }), executor);
    }

    Message toAmqpMessage(Object payload) {
        MessageEnvelope<Object> envelope = MessageEnvelope.of(payload, null);

        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageHeaders.CONTENT_TYPE_JSON);
        properties.setContentEncoding(StandardCharsets.UTF_8.name());
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(envelope.getMessageId());
        properties.setCorrelationId(envelope.getCorrelationId());
        properties.setType(envelope.getMessageType());
        properties.setTimestamp(Date.from(envelope.getCreatedAt()));
        properties.setHeader(MessageHeaders.MESSAGE_TYPE, envelope.getMessageType());
        properties.setHeader(MessageHeaders.MESSAGE_ID, envelope.getMessageId());
        properties.setHeader(MessageHeaders.CORRELATION_ID, envelope.getCorrelationId());
        properties.setHeader(MessageHeaders.CREATED_AT, envelope.getCreatedAt().toString());

        return new Message(codec.encode(payload).getBytes(StandardCharsets.UTF_8), properties);
    }

    @Override
    public <T> Subscription subscribe(Class<T> messageType, MessageHandler<T> handler, String subscriptionName) {
        Objects.requireNonNull(messageType, "messageType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        String queueName = subscriptionName != null ? subscriptionName : SubscriptionNames.forType(messageType);

        SimpleMessageListenerContainer existing = containers.get(queueName);
        if (existing != null) {
            log.warn("Subscription {} already exists", queueName);
            return new ContainerSubscription(queueName, existing);
        }

        TopicExchange events = declareEventsExchange();
        Queue queue = declareQueue(queueName);
        admin.declareBinding(BindingBuilder.bind(queue).to(events).with(EventTypeCatalog.nameOf(messageType)));

        SimpleMessageListenerContainer container = createListenerContainer(queueName);
        container.setMessageListener((MessageListener) message -> onMessage(messageType, handler, queueName, message));

        SimpleMessageListenerContainer raced = containers.putIfAbsent(queueName, container);
        if (raced != null) {
            return new ContainerSubscription(queueName, raced);
        }
        container.start();

        log.info("Started consuming {} from queue {}", messageType.getSimpleName(), queueName);
        return new ContainerSubscription(queueName, container);
    }

    protected SimpleMessageListenerContainer createListenerContainer(String queueName) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(queueName);
        container.setConcurrentConsumers(options.getConcurrency());
        container.setPrefetchCount(options.getPrefetch());
        // rejected deliveries go to the dead-letter exchange instead of looping
        container.setDefaultRequeueRejected(false);
        return container;
    }

    <T> void onMessage(Class<T> messageType, MessageHandler<T> handler, String queueName, Message message) {
        MessageProperties properties = message.getMessageProperties();
        Map<String, String> headers = headersOf(properties);
        String body = new String(message.getBody(), StandardCharsets.UTF_8);

        try (CorrelationContext ctx = CorrelationContext.forMessage(
                headers.get(MessageHeaders.CORRELATION_ID), properties.getMessageId(), queueName)) {

            MessageEnvelope<T> envelope = codec.toEnvelope(messageType, body, headers, queueName);
            handler.handleEnvelope(envelope).toCompletableFuture().get();
            log.debug("Message {} processed from {}", envelope.getMessageType(), queueName);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImmediateRequeueAmqpException("Interrupted while handling message", e);
        } catch (ExecutionException e) {
            throw rejected(properties.getMessageId(), queueName, e.getCause());
        } catch (Exception e) {
            throw rejected(properties.getMessageId(), queueName, e);
        }
    }

    // a cancelled handler returns the message to its queue; anything else is dead-lettered
    private static AmqpException rejected(String messageId, String queueName, Throwable cause) {
        if (Cancellations.isCancellation(cause)) {
            log.info("Handling of message {} from {} was cancelled; requeueing", messageId, queueName);
            return new ImmediateRequeueAmqpException("Handler cancelled", cause);
        }
        log.error("Error processing message {} from {}", messageId, queueName, cause);
        return new AmqpRejectAndDontRequeueException("Handler failed", cause);
    }

    @Override
    public void ensureInfrastructure() {
        declareEventsExchange();
        admin.declareExchange(ExchangeBuilder.topicExchange(deadLetters.getExchange()).durable(true).build());

        declareQueue(options.getDefaultQueue());
        options.getDomainQueues().forEach((domain, queue) -> {
            declareQueue(queue);
            log.debug("Declared queue {} for domain {}", queue, domain);
        });

        log.info("RabbitMQ infrastructure ready: exchange {}, {} queues",
                options.getEventsExchange(), options.getDomainQueues().size() + 1);
    }

    private TopicExchange declareEventsExchange() {
        TopicExchange exchange = ExchangeBuilder.topicExchange(options.getEventsExchange()).durable(true).build();
        admin.declareExchange(exchange);
        return exchange;
    }

    private Queue declareQueue(String name) {
        Queue queue = QueueBuilder.durable(name)
                .deadLetterExchange(deadLetters.getExchange())
                .deadLetterRoutingKey(deadLetters.routingKeyFor(name))
                .build();
        admin.declareQueue(queue);
        return queue;
    }

    static Map<String, String> headersOf(MessageProperties properties) {
        Map<String, String> headers = new LinkedHashMap<>();
        properties.getHeaders().forEach((key, value) -> {
            if (value != null) {
                headers.put(key, value.toString());
            }
        });
        if (properties.getMessageId() != null) {
            headers.putIfAbsent(MessageHeaders.MESSAGE_ID, properties.getMessageId());
        }
        if (properties.getCorrelationId() != null) {
            headers.putIfAbsent(MessageHeaders.CORRELATION_ID, properties.getCorrelationId());
        }
        if (properties.getType() != null) {
            headers.putIfAbsent(MessageHeaders.MESSAGE_TYPE, properties.getType());
        }
        return headers;
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.LOCAL_BROKER;
    }

    @Override
    public void close() {
        containers.values().forEach(SimpleMessageListenerContainer::stop);
        containers.clear();
    }

    private final class ContainerSubscription implements Subscription {

        private final String name;
        private final SimpleMessageListenerContainer container;

        private ContainerSubscription(String name, SimpleMessageListenerContainer container) {
            this.name = name;
            this.container = container;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isActive() {
            return container.isRunning();
        }

        @Override
        public void close() {
            container.stop();
            containers.remove(name, container);
            log.info("Stopped subscription {}", name);
        }
    }
}
