package com.aporkolab.messaging.dlq;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageBuilderSupport;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.core.RabbitOperations;

import com.aporkolab.messaging.bus.DeadLetterTopology;
import com.aporkolab.messaging.bus.MessageHeaders;
import com.aporkolab.messaging.bus.RabbitMqOptions;
import com.aporkolab.messaging.bus.TransportMode;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.GetResponse;

/**
 * Dead letters on RabbitMQ: a durable topic exchange routing to one {@code dlq.<queue>}
 * queue per source queue, with per-message expiration and a queue-level TTL.
 * <p>
 * The queue can also contain raw messages the broker dead-lettered itself after a
 * consumer rejected them; those are listed with what their properties tell.
 */
public class RabbitMqDeadLetterService extends AbstractDeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqDeadLetterService.class);

    private final RabbitOperations rabbitOperations;
    private final AmqpAdmin admin;
    private final RabbitMqOptions options;
    private final DeadLetterTopology topology;
    private final Executor executor;
    private final Set<String> knownQueues = ConcurrentHashMap.newKeySet();

    public RabbitMqDeadLetterService(RabbitOperations rabbitOperations, AmqpAdmin admin, RabbitMqOptions options,
                                     DeadLetterTopology topology, RetryPolicySettings settings, ObjectMapper objectMapper,
                                     DeadLetterOrigin origin, List<DeadLetterNotifier> notifiers,
                                     Executor executor, Clock clock) {
        super(settings, objectMapper, origin, notifiers, clock);
        this.rabbitOperations = rabbitOperations;
        this.admin = admin;
        this.options = options;
        this.topology = topology;
        this.executor = executor;
    }

    @Override
    protected CompletableFuture<Void> write(DeadLetterRecord deadLetter, String json) {
        String sourceQueue = deadLetter.getSourceQueue();
        Message message = toAmqpMessage(deadLetter, json);

        return CompletableFuture.runAsync(() -> {
            try {
                if (!knownQueues.contains(sourceQueue)) {
                    declareDeadLetterQueue(declareExchange(), sourceQueue);
                }
                rabbitOperations.send(topology.getExchange(), topology.routingKeyFor(sourceQueue), message);
                log.debug("Dead letter {} written to {}", deadLetter.getMessageId(), topology.queueFor(sourceQueue));
            } catch (AmqpException e) {
                throw TransientMessagingException.brokerUnavailable("rabbitmq", e);
            }
        }, executor);
    }

    Message toAmqpMessage(DeadLetterRecord deadLetter, String json) {
        long ttlMillis = settings.deadLetterTtl().toMillis();
        return MessageBuilder.withBody(json.getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding(StandardCharsets.UTF_8.name())
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(deadLetter.getMessageId())
                .setCorrelationId(deadLetter.getCorrelationId())
                .setType(deadLetter.getMessageType())
                .setExpiration(Long.toString(ttlMillis))
                .setHeader(DeadLetterHeaders.ORIGINAL_MESSAGE_TYPE, deadLetter.getMessageType())
                .setHeader(DeadLetterHeaders.FAILURE_REASON, deadLetter.getFailureReason())
                .setHeader(DeadLetterHeaders.FAILURE_TYPE, deadLetter.getFailureType().name())
                .setHeader(DeadLetterHeaders.ATTEMPT_COUNT, deadLetter.getAttemptCount())
                .setHeader(DeadLetterHeaders.SOURCE_QUEUE, deadLetter.getSourceQueue())
                .setHeader(DeadLetterHeaders.HANDLER_TYPE, deadLetter.getHandlerType())
                .setHeader(DeadLetterHeaders.FAILED_AT, deadLetter.getLastAttemptAt().toString())
                .build();
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
        }, null);
        return found;
    }

    @Override
    public boolean reprocess(String sourceQueue, String messageId) {
        Optional<DeadLetterRecord> republished = scan(sourceQueue, deadLetter -> matches(deadLetter, messageId),
                match -> rabbitOperations.send("", sourceQueue, reprocessedMessage(match)));
        if (republished.isPresent()) {
            log.info("Dead letter {} republished to {}", messageId, sourceQueue);
            return true;
        }
        log.warn("Dead letter {} not found in {}", messageId, topology.queueFor(sourceQueue));
        return false;
    }

    @Override
    public boolean purge(String sourceQueue, String messageId) {
        Optional<DeadLetterRecord> purged = scan(sourceQueue, deadLetter -> matches(deadLetter, messageId),
                match -> log.debug("Removing dead letter {}", match.getMessageId()));
        if (purged.isPresent()) {
            log.info("Dead letter {} purged from {}", messageId, topology.queueFor(sourceQueue));
            return true;
        }
        log.warn("Dead letter {} not found in {}", messageId, topology.queueFor(sourceQueue));
        return false;
    }

    private static boolean matches(DeadLetterRecord deadLetter, String messageId) {
        return messageId.equals(deadLetter.getMessageId()) || messageId.equals(deadLetter.getOriginalMessageId());
    }

    /**
     * Pulls messages off the dead-letter queue one by one, holding them unacknowledged,
     * until {@code stop} matches or the queue is drained, then returns every held message
     * to the queue. With a {@code removeWith} action the matching message is handed to it
     * and then acknowledged, i.e. removed; if the action throws, it stays queued.
     */
    private Optional<DeadLetterRecord> scan(String sourceQueue, Predicate<DeadLetterRecord> stop,
                                            Consumer<DeadLetterRecord> removeWith) {
        String queue = topology.queueFor(sourceQueue);
        try {
            return rabbitOperations.execute(channel -> {
                long lastHeld = -1;
                DeadLetterRecord match = null;
                GetResponse response;
                try {
                    while ((response = channel.basicGet(queue, false)) != null) {
                        long tag = response.getEnvelope().getDeliveryTag();
                        DeadLetterRecord deadLetter = toRecord(response, sourceQueue);
                        if (stop.test(deadLetter)) {
                            if (removeWith != null) {
                                long heldBefore = lastHeld;
                                lastHeld = tag;
                                removeWith.accept(deadLetter);
                                channel.basicAck(tag, false);
                                lastHeld = heldBefore;
                            } else {
                                lastHeld = tag;
                            }
                            match = deadLetter;
                            break;
                        }
                        lastHeld = tag;
                    }
                } finally {
                    if (lastHeld >= 0) {
                        channel.basicNack(lastHeld, true, true);
                    }
                }
                return Optional.ofNullable(match);
            });
        } catch (AmqpException e) {
            throw TransientMessagingException.brokerUnavailable("rabbitmq", e);
        }
    }

    private DeadLetterRecord toRecord(GetResponse response, String sourceQueue) {
        String body = new String(response.getBody(), StandardCharsets.UTF_8);
        return readRecord(body, topology.queueFor(sourceQueue))
                .orElseGet(() -> rejectedByBroker(response.getProps(), body, sourceQueue));
    }

    private DeadLetterRecord rejectedByBroker(AMQP.BasicProperties props, String body, String sourceQueue) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (props.getHeaders() != null) {
            props.getHeaders().forEach((key, value) -> {
                if (value != null) {
                    headers.put(key, value.toString());
                }
            });
        }
        Instant timestamp = props.getTimestamp() != null ? props.getTimestamp().toInstant() : null;
        return DeadLetterRecord.builder()
                .messageId(props.getMessageId())
                .originalMessageId(props.getMessageId())
                .messageType(props.getType() != null ? props.getType() : headers.get(MessageHeaders.MESSAGE_TYPE))
                .originalMessage(body)
                .sourceQueue(sourceQueue)
                .correlationId(props.getCorrelationId())
                .attemptCount(1)
                .failureType(FailureType.UNKNOWN)
                .failureReason("Rejected by consumer")
                .originalHeaders(headers)
                .lastAttemptAt(timestamp)
                .build();
    }

    private Message reprocessedMessage(DeadLetterRecord deadLetter) {
        MessageBuilderSupport<Message> builder = MessageBuilder
                .withBody(deadLetter.getOriginalMessage().getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .setMessageId(deadLetter.getOriginalMessageId())
                .setCorrelationId(deadLetter.getCorrelationId())
                .setType(deadLetter.getMessageType());
        deadLetter.getOriginalHeaders().forEach(builder::setHeader);
        builder.setHeader(MessageHeaders.MESSAGE_TYPE, deadLetter.getMessageType())
                .setHeader(DeadLetterHeaders.REPROCESSED_FROM_DLQ, true)
                .setHeader(DeadLetterHeaders.ORIGINAL_MESSAGE_ID, deadLetter.getMessageId())
                .setHeader(DeadLetterHeaders.REPROCESSED_AT, clock.instant().toString());
        return builder.build();
    }

    @Override
    public DeadLetterStatistics statistics() {
        Map<String, Long> counts = new HashMap<>();
        for (String sourceQueue : monitoredQueues()) {
            String queue = topology.queueFor(sourceQueue);
            try {
                QueueInformation info = admin.getQueueInfo(queue);
                if (info != null) {
                    counts.put(sourceQueue, (long) info.getMessageCount());
                }
            } catch (AmqpException e) {
                log.warn("Could not read dead letter statistics for {}: {}", queue, e.getMessage());
            }
        }
        return new DeadLetterStatistics(counts, clock.instant());
    }

    private Set<String> monitoredQueues() {
        Set<String> queues = new LinkedHashSet<>();
        queues.add(options.getDefaultQueue());
        queues.addAll(options.getDomainQueues().values());
        queues.addAll(knownQueues);
        return queues;
    }

    @Override
    public void ensureInfrastructure(Collection<String> sourceQueues) {
        TopicExchange exchange = declareExchange();

        Set<String> queues = new LinkedHashSet<>(sourceQueues);
        queues.addAll(monitoredQueues());
        for (String sourceQueue : queues) {
            declareDeadLetterQueue(exchange, sourceQueue);
        }
        log.info("RabbitMQ dead letter infrastructure ready: exchange {}, {} queues", topology.getExchange(), queues.size());
    }

    private TopicExchange declareExchange() {
        TopicExchange exchange = ExchangeBuilder.topicExchange(topology.getExchange()).durable(true).build();
        admin.declareExchange(exchange);
        return exchange;
    }

    // queue, binding and TTL must match what ensureInfrastructure declared
    private void declareDeadLetterQueue(TopicExchange exchange, String sourceQueue) {
        int ttlMillis = (int) Math.min(Integer.MAX_VALUE, settings.deadLetterTtl().toMillis());
        Queue queue = QueueBuilder.durable(topology.queueFor(sourceQueue)).ttl(ttlMillis).build();
        admin.declareQueue(queue);
        admin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(topology.routingKeyFor(sourceQueue)));
        knownQueues.add(sourceQueue);
    }

    @Override
    public TransportMode getTransportMode() {
        return TransportMode.LOCAL_BROKER;
    }
}
