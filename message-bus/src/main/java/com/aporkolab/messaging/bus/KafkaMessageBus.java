package com.aporkolab.messaging.bus;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.util.backoff.FixedBackOff;

import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.aporkolab.messaging.logging.CorrelationContext;
import com.aporkolab.messaging.logging.KafkaCorrelationInterceptor;

/**
 * Managed cloud broker transport on top of a hosted Kafka endpoint.
 * <p>
 * Queues and topics are both Kafka topics. The record key is the correlation id,
 * so messages of one conversation keep their order. A subscription is a consumer
 * group; records that still fail after the handler returns are published to the
 * {@code <topic>.dlq} topic, except when the handler was cancelled.
 */
public class KafkaMessageBus implements MessageBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBus.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaAdmin kafkaAdmin;
    private final EnvelopeCodec codec;
    private final CloudBrokerOptions options;
    private final DeadLetterTopology deadLetters;
    private final Map<String, ConcurrentMessageListenerContainer<String, String>> containers = new ConcurrentHashMap<>();

    public KafkaMessageBus(KafkaTemplate<String, String> kafkaTemplate, ConsumerFactory<String, String> consumerFactory,
                           KafkaAdmin kafkaAdmin, EnvelopeCodec codec, CloudBrokerOptions options,
                           DeadLetterTopology deadLetters) {
        this.kafkaTemplate = kafkaTemplate;
        this.consumerFactory = consumerFactory;
        this.kafkaAdmin = kafkaAdmin;
        this.codec = codec;
        this.options = options;
        this.deadLetters = deadLetters;
    }

    @Override
    public <T> CompletableFuture<Void> send(T message, String destination) {
        Objects.requireNonNull(message, "message must not be null");
        return produce(destination != null ? destination : options.getDefaultTopic(), message);
    }

    @Override
    public <T> CompletableFuture<Void> publish(T event, String topic) {
        Objects.requireNonNull(event, "event must not be null");
        return produce(topic != null ? topic : options.getDefaultTopic(), event);
    }

    private CompletableFuture<Void> produce(String topic, Object payload) {
        ProducerRecord<String, String> record = toRecord(topic, payload);
        String messageType = EventTypeCatalog.nameOf(payload.getClass());

        return kafkaTemplate.send(record)
                .handle((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to send message {} to topic {}", messageType, topic, ex);
                        throw TransientMessagingException.brokerUnavailable("kafka", ex);
                    }
                    log.debug("Message {} sent to topic {} at offset {}", messageType, topic,
                            result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : -1);
                    return null;
                });
    }

    ProducerRecord<String, String> toRecord(String topic, Object payload) {
        MessageEnvelope<Object> envelope = MessageEnvelope.of(payload, topic);
        ProducerRecord<String, String> record = new ProducerRecord<>(
                topic, null, envelope.getCorrelationId(), codec.encode(payload));

        addHeader(record, MessageHeaders.MESSAGE_TYPE, envelope.getMessageType());
        addHeader(record, MessageHeaders.MESSAGE_ID, envelope.getMessageId());
        addHeader(record, MessageHeaders.CORRELATION_ID, envelope.getCorrelationId());
        addHeader(record, MessageHeaders.CREATED_AT, envelope.getCreatedAt().toString());
        return record;
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Consumes the default topic, where {@code publish} delivers events, together with
     * the topic named by {@code subscriptionName}, where {@code send(message, destination)}
     * delivers. The subscription name is also the consumer group.
     */
    @Override
    public <T> Subscription subscribe(Class<T> messageType, MessageHandler<T> handler, String subscriptionName) {
        Objects.requireNonNull(messageType, "messageType must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        String groupId = subscriptionName != null ? subscriptionName : SubscriptionNames.forType(messageType);
        List<String> topics = subscribedTopics(subscriptionName);
        String key = String.join(",", topics) + "/" + groupId;

        ConcurrentMessageListenerContainer<String, String> existing = containers.get(key);
        if (existing != null) {
            log.warn("Processor for {} already exists", key);
            return new ContainerSubscription(key, existing);
        }

        if (topics.size() > 1) {
            kafkaAdmin.createOrModifyTopics(
                    new NewTopic(subscriptionName, options.getPartitions(), options.getReplicationFactor()));
        }

        ContainerProperties containerProperties = new ContainerProperties(topics.toArray(new String[0]));
        containerProperties.setGroupId(groupId);
        containerProperties.setMessageListener(
                (MessageListener<String, String>) record -> onRecord(messageType, handler, record));

        ConcurrentMessageListenerContainer<String, String> container =
                new ConcurrentMessageListenerContainer<>(consumerFactory, containerProperties);
        container.setConcurrency(options.getConcurrency());
        container.setCommonErrorHandler(new DefaultErrorHandler(recoverer(), new FixedBackOff(0L, 0L)));

        ConcurrentMessageListenerContainer<String, String> raced = containers.putIfAbsent(key, container);
        if (raced != null) {
            return new ContainerSubscription(key, raced);
        }
        container.start();

        log.info("Started processing messages for {}", key);
        return new ContainerSubscription(key, container);
    }

    List<String> subscribedTopics(String subscriptionName) {
        String defaultTopic = options.getDefaultTopic();
        if (subscriptionName == null || subscriptionName.isBlank() || subscriptionName.equals(defaultTopic)) {
            return List.of(defaultTopic);
        }
        return List.of(defaultTopic, subscriptionName);
    }

    /**
     * Publishes failed records to {@code <topic>.dlq}. A cancelled handler is not a
     * failure: recovery is refused, so the error handler seeks back and the record
     * is delivered again.
     */
    ConsumerRecordRecoverer recoverer() {
        DeadLetterPublishingRecoverer deadLetterPublisher = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (failed, ex) -> new TopicPartition(deadLetters.topicFor(failed.topic()), -1));
        return (record, ex) -> {
            if (Cancellations.isCancellation(ex)) {
                log.info("Handling of record {}-{}@{} was cancelled; it will be redelivered",
                        record.topic(), record.partition(), record.offset());
                throw new KafkaException("Handling cancelled for " + record.topic() + "@" + record.offset(), ex);
            }
            deadLetterPublisher.accept(record, ex);
        };
    }

    <T> void onRecord(Class<T> messageType, MessageHandler<T> handler, ConsumerRecord<String, String> record) {
        Map<String, String> headers = headersOf(record);
        String typeName = headers.get(MessageHeaders.MESSAGE_TYPE);

        // the topic is shared by many event types; each subscription takes only its own
        if (typeName != null && !typeName.equals(EventTypeCatalog.nameOf(messageType))) {
            return;
        }

        try (CorrelationContext ctx = KafkaCorrelationInterceptor.setupContext(record)
                .with(CorrelationContext.MESSAGE_ID_KEY, headers.get(MessageHeaders.MESSAGE_ID))) {

            MessageEnvelope<T> envelope = codec.toEnvelope(messageType, record.value(), headers, record.topic());
            handler.handleEnvelope(envelope).toCompletableFuture().get();
            log.debug("Message {} processed from {}-{}@{}", envelope.getMessageType(),
                    record.topic(), record.partition(), record.offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientMessagingException("Interrupted while handling record from " + record.topic(), e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Handler failed", cause);
    }

    @Override
    public void ensureInfrastructure() {
        kafkaAdmin.createOrModifyTopics(
                new NewTopic(options.getDefaultTopic(), options.getPartitions(), options.getReplicationFactor()));
        log.info("Kafka topics ready: {}", options.getDefaultTopic());
    }

    static Map<String, String> headersOf(ConsumerRecord<?, ?> record) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            if (header.value() != null) {
                headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
            }
        }
        return headers;
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.MANAGED_CLOUD_BROKER;
    }

    @Override
    public void close() {
        containers.values().forEach(ConcurrentMessageListenerContainer::stop);
        containers.clear();
    }

    private final class ContainerSubscription implements Subscription {

        private final String name;
        private final ConcurrentMessageListenerContainer<String, String> container;

        private ContainerSubscription(String name, ConcurrentMessageListenerContainer<String, String> container) {
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
