package com.aporkolab.messaging.dlq;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.config.TopicConfig;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.KafkaHeaders;

import com.aporkolab.messaging.bus.CloudBrokerOptions;
import com.aporkolab.messaging.bus.DeadLetterTopology;
import com.aporkolab.messaging.bus.MessageHeaders;
import com.aporkolab.messaging.bus.TransportMode;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Dead letters on the managed Kafka endpoint: one {@code <topic>.dlq} topic per source
 * topic, created with {@code retention.ms} equal to the dead-letter TTL at startup or
 * before the first write for that topic.
 * <p>
 * Kafka cannot delete single records, so purge is left to retention and a reprocessed
 * record stays in the dead-letter topic until it expires.
 */
public class KafkaDeadLetterService extends AbstractDeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterService.class);

    static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    private static final int MAX_EMPTY_POLLS = 3;
    private static final long SEND_TIMEOUT_SECONDS = 30;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaAdmin kafkaAdmin;
    private final CloudBrokerOptions options;
    private final DeadLetterTopology topology;
    private final Set<String> knownTopics = ConcurrentHashMap.newKeySet();

    public KafkaDeadLetterService(KafkaTemplate<String, String> kafkaTemplate, ConsumerFactory<String, String> consumerFactory,
                                  KafkaAdmin kafkaAdmin, CloudBrokerOptions options, DeadLetterTopology topology,
                                  RetryPolicySettings settings, ObjectMapper objectMapper, DeadLetterOrigin origin,
                                  List<DeadLetterNotifier> notifiers, Clock clock) {
        super(settings, objectMapper, origin, notifiers, clock);
        this.kafkaTemplate = kafkaTemplate;
        this.consumerFactory = consumerFactory;
        this.kafkaAdmin = kafkaAdmin;
        this.options = options;
        this.topology = topology;
    }

    @Override
    protected CompletableFuture<Void> write(DeadLetterRecord deadLetter, String json) {
        String sourceQueue = deadLetter.getSourceQueue();
        String dlqTopic = topology.topicFor(sourceQueue);
        if (!knownTopics.contains(sourceQueue)) {
            kafkaAdmin.createOrModifyTopics(deadLetterTopic(sourceQueue));
            knownTopics.add(sourceQueue);
            log.info("Kafka dead letter topic {} created on first use", dlqTopic);
        }
        ProducerRecord<String, String> record = toProducerRecord(deadLetter, json);

        return kafkaTemplate.send(record)
                .handle((result, ex) -> {
                    if (ex != null) {
                        throw TransientMessagingException.brokerUnavailable("kafka", ex);
                    }
                    log.debug("Dead letter {} written to {} at offset {}", deadLetter.getMessageId(), dlqTopic,
                            result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : -1);
                    return null;
                });
    }

    ProducerRecord<String, String> toProducerRecord(DeadLetterRecord deadLetter, String json) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
                topology.topicFor(deadLetter.getSourceQueue()), null, deadLetter.getCorrelationId(), json);

        addHeader(record, MessageHeaders.MESSAGE_ID, deadLetter.getMessageId());
        addHeader(record, MessageHeaders.CORRELATION_ID, deadLetter.getCorrelationId());
        addHeader(record, DeadLetterHeaders.ORIGINAL_MESSAGE_TYPE, deadLetter.getMessageType());
        addHeader(record, DeadLetterHeaders.FAILURE_REASON, deadLetter.getFailureReason());
        addHeader(record, DeadLetterHeaders.FAILURE_TYPE, deadLetter.getFailureType().name());
        addHeader(record, DeadLetterHeaders.ATTEMPT_COUNT, Integer.toString(deadLetter.getAttemptCount()));
        addHeader(record, DeadLetterHeaders.SOURCE_QUEUE, deadLetter.getSourceQueue());
        addHeader(record, DeadLetterHeaders.HANDLER_TYPE, deadLetter.getHandlerType());
        addHeader(record, DeadLetterHeaders.FAILED_AT, deadLetter.getLastAttemptAt().toString());
        return record;
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Override
    public List<DeadLetterRecord> listDeadLetters(String sourceQueue, int maxCount) {
        List<DeadLetterRecord> found = new ArrayList<>();
        if (maxCount <= 0) {
            return found;
        }
        scan(sourceQueue, deadLetter -> {
            found.add(deadLetter);
            return found.size() >= maxCount;
        });
        return found;
    }

    @Override
    public boolean reprocess(String sourceQueue, String messageId) {
        Optional<DeadLetterRecord> match = scan(sourceQueue, deadLetter ->
                messageId.equals(deadLetter.getMessageId()) || messageId.equals(deadLetter.getOriginalMessageId()));
        if (match.isEmpty()) {
            log.warn("Dead letter {} not found in {}", messageId, topology.topicFor(sourceQueue));
            return false;
        }

        DeadLetterRecord deadLetter = match.get();
        ProducerRecord<String, String> record = new ProducerRecord<>(
                sourceQueue, null, deadLetter.getCorrelationId(), deadLetter.getOriginalMessage());
        deadLetter.getOriginalHeaders().forEach((name, value) -> addHeader(record, name, value));
        record.headers().remove(MessageHeaders.MESSAGE_TYPE);
        addHeader(record, MessageHeaders.MESSAGE_TYPE, deadLetter.getMessageType());
        addHeader(record, DeadLetterHeaders.REPROCESSED_FROM_DLQ, "true");
        addHeader(record, DeadLetterHeaders.ORIGINAL_MESSAGE_ID, deadLetter.getMessageId());
        addHeader(record, DeadLetterHeaders.REPROCESSED_AT, clock.instant().toString());

        try {
            kafkaTemplate.send(record).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransientMessagingException.brokerUnavailable("kafka", e);
        } catch (ExecutionException e) {
            throw TransientMessagingException.brokerUnavailable("kafka", e.getCause());
        } catch (TimeoutException e) {
            throw TransientMessagingException.timeout(sourceQueue, Duration.ofSeconds(SEND_TIMEOUT_SECONDS));
        }

        log.info("Dead letter {} republished to {}; it stays in {} until retention expires",
                messageId, sourceQueue, topology.topicFor(sourceQueue));
        return true;
    }

    @Override
    public boolean purge(String sourceQueue, String messageId) {
        log.info("Dead letter {} in {} is removed by retention after {}h, not on request",
                messageId, topology.topicFor(sourceQueue), settings.getDeadLetterTtlHours());
        return false;
    }

    /**
     * Reads the dead-letter topic from the beginning with a throwaway consumer that
     * commits nothing, until {@code stop} matches or the end offsets are reached.
     */
    private Optional<DeadLetterRecord> scan(String sourceQueue, Predicate<DeadLetterRecord> stop) {
        String dlqTopic = topology.topicFor(sourceQueue);
        try (Consumer<String, String> consumer = createBrowsingConsumer()) {
            List<TopicPartition> partitions = partitionsOf(consumer, dlqTopic);
            if (partitions.isEmpty()) {
                return Optional.empty();
            }
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);
            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);

            int emptyPolls = 0;
            while (!reachedEnd(consumer, endOffsets) && emptyPolls < MAX_EMPTY_POLLS) {
                ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                emptyPolls = records.isEmpty() ? emptyPolls + 1 : 0;
                for (ConsumerRecord<String, String> record : records) {
                    DeadLetterRecord deadLetter = toRecord(record, sourceQueue);
                    if (stop.test(deadLetter)) {
                        return Optional.of(deadLetter);
                    }
                }
            }
            return Optional.empty();
        } catch (KafkaException e) {
            throw TransientMessagingException.brokerUnavailable("kafka", e);
        }
    }

    private Consumer<String, String> createBrowsingConsumer() {
        Properties properties = new Properties();
        properties.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        properties.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return consumerFactory.createConsumer("dlq-browser-" + UUID.randomUUID(), null, null, properties);
    }

    private static List<TopicPartition> partitionsOf(Consumer<String, String> consumer, String topic) {
        List<PartitionInfo> infos = consumer.partitionsFor(topic);
        List<TopicPartition> partitions = new ArrayList<>();
        if (infos != null) {
            for (PartitionInfo info : infos) {
                partitions.add(new TopicPartition(topic, info.partition()));
            }
        }
        return partitions;
    }

    private static boolean reachedEnd(Consumer<String, String> consumer, Map<TopicPartition, Long> endOffsets) {
        for (Map.Entry<TopicPartition, Long> end : endOffsets.entrySet()) {
            if (consumer.position(end.getKey()) < end.getValue()) {
                return false;
            }
        }
        return true;
    }

    private DeadLetterRecord toRecord(ConsumerRecord<String, String> record, String sourceQueue) {
        return readRecord(record.value(), record.topic())
                .orElseGet(() -> rejectedByConsumer(record, sourceQueue));
    }

    /**
     * Records the listener container forwarded after the handler failed carry the
     * original value and the container's exception headers.
     */
    private DeadLetterRecord rejectedByConsumer(ConsumerRecord<String, String> record, String sourceQueue) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            if (header.value() != null) {
                headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
            }
        }
        String exceptionType = headers.get(KafkaHeaders.DLT_EXCEPTION_FQCN);
        String exceptionMessage = headers.get(KafkaHeaders.DLT_EXCEPTION_MESSAGE);
        String messageId = headers.getOrDefault(MessageHeaders.MESSAGE_ID,
                record.topic() + "-" + record.partition() + "@" + record.offset());

        return DeadLetterRecord.builder()
                .messageId(messageId)
                .originalMessageId(messageId)
                .messageType(headers.get(MessageHeaders.MESSAGE_TYPE))
                .originalMessage(record.value())
                .sourceQueue(sourceQueue)
                .correlationId(record.key())
                .attemptCount(1)
                .failureType(FailureType.UNKNOWN)
                .failureReason(exceptionType != null ? exceptionType + ": " + exceptionMessage : "Rejected by consumer")
                .originalHeaders(headers)
                .lastAttemptAt(Instant.ofEpochMilli(record.timestamp()))
                .build();
    }

    @Override
    public DeadLetterStatistics statistics() {
        Map<String, Long> counts = new LinkedHashMap<>();
        try (Consumer<String, String> consumer = createBrowsingConsumer()) {
            for (String sourceQueue : monitoredTopics()) {
                String dlqTopic = topology.topicFor(sourceQueue);
                try {
                    List<TopicPartition> partitions = partitionsOf(consumer, dlqTopic);
                    if (partitions.isEmpty()) {
                        continue;
                    }
                    Map<TopicPartition, Long> begin = consumer.beginningOffsets(partitions);
                    Map<TopicPartition, Long> end = consumer.endOffsets(partitions);
                    long depth = 0;
                    for (TopicPartition partition : partitions) {
                        depth += end.getOrDefault(partition, 0L) - begin.getOrDefault(partition, 0L);
                    }
                    counts.put(sourceQueue, depth);
                } catch (KafkaException e) {
                    log.warn("Could not read dead letter statistics for {}: {}", dlqTopic, e.getMessage());
                }
            }
        }
        return new DeadLetterStatistics(counts, clock.instant());
    }

    private Set<String> monitoredTopics() {
        Set<String> topics = new LinkedHashSet<>();
        topics.add(options.getDefaultTopic());
        topics.addAll(knownTopics);
        return topics;
    }

    @Override
    public void ensureInfrastructure(Collection<String> sourceQueues) {
        Set<String> topics = new LinkedHashSet<>(sourceQueues);
        topics.addAll(monitoredTopics());

        NewTopic[] dlqTopics = topics.stream()
                .map(this::deadLetterTopic)
                .toArray(NewTopic[]::new);
        kafkaAdmin.createOrModifyTopics(dlqTopics);
        knownTopics.addAll(topics);

        log.info("Kafka dead letter topics ready: {} with retention {}ms",
                topics.size(), settings.deadLetterTtl().toMillis());
    }

    private NewTopic deadLetterTopic(String sourceQueue) {
        return TopicBuilder.name(topology.topicFor(sourceQueue))
                .partitions(options.getPartitions())
                .replicas(options.getReplicationFactor())
                .config(TopicConfig.RETENTION_MS_CONFIG, Long.toString(settings.deadLetterTtl().toMillis()))
                .build();
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.MANAGED_CLOUD_BROKER;
    }
}
