package com.aporkolab.messaging.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.aporkolab.messaging.bus.MessageBus;
import com.aporkolab.messaging.bus.MessageHandler;
import com.aporkolab.messaging.bus.TransportMode;
import com.aporkolab.messaging.dlq.DeadLetterHeaders;
import com.aporkolab.messaging.dlq.DeadLetterRecord;
import com.aporkolab.messaging.dlq.DeadLetterService;
import com.aporkolab.messaging.dlq.FailureType;
import com.aporkolab.messaging.events.EventTypeModule;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.aporkolab.messaging.retry.MessageRetryMiddleware;
import com.aporkolab.messaging.retry.MessageRetryMiddlewareFactory;
import com.aporkolab.messaging.retry.RetryOutcome;
import com.aporkolab.messaging.spring.autoconfigure.MessagingAutoConfiguration;

/**
 * Local broker flow against a real RabbitMQ:
 * 1. Publish and consume through a subscription
 * 2. Retry a failing handler, then quarantine to dlq.orders
 * 3. Inspect, replay and purge the dead letter
 */
@Testcontainers(disabledWithoutDocker = true)
class RabbitMqMessagingIntegrationTest {

    private static final String ORDERS_QUEUE = "orders";

    @Container
    static RabbitMQContainer rabbit = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.12-management"));

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(MessagingAutoConfiguration.class))
                .withBean("orderEvents", EventTypeModule.class, () -> catalog -> catalog.register(OrderSubmitted.class))
                .withPropertyValues(
                        "messaging.environment=development",
                        "messaging.rabbit-mq.host=" + rabbit.getHost(),
                        "messaging.rabbit-mq.port=" + rabbit.getAmqpPort(),
                        "messaging.rabbit-mq.username=" + rabbit.getAdminUsername(),
                        "messaging.rabbit-mq.password=" + rabbit.getAdminPassword(),
                        "messaging.rabbit-mq.default-queue=" + ORDERS_QUEUE,
                        "messaging.dead-letter.max-retry-attempts=3",
                        "messaging.dead-letter.initial-retry-delay-seconds=0",
                        "messaging.dead-letter.max-retry-delay-seconds=0");
    }

    @Test
    @DisplayName("should deliver a published event to its subscription")
    void shouldDeliverPublishedEvent() {
        contextRunner().run(context -> {
            assertThat(context).hasNotFailed();
            MessageBus bus = context.getBean(MessageBus.class);
            assertThat(bus.getTransportMode()).isEqualTo(TransportMode.LOCAL_BROKER);

            List<OrderSubmitted> received = new CopyOnWriteArrayList<>();
            bus.subscribe(OrderSubmitted.class, order -> {
                received.add(order);
                return CompletableFuture.completedFuture(null);
            }, "orders-audit");

            bus.publish(new OrderSubmitted("order-1", 2)).get(10, TimeUnit.SECONDS);

            await().atMost(Duration.ofSeconds(15))
                    .untilAsserted(() -> assertThat(received).containsExactly(new OrderSubmitted("order-1", 2)));
        });
    }

    @Test
    @DisplayName("should retry, quarantine and replay a failing message")
    void shouldQuarantineAndReplay() {
        contextRunner().run(context -> {
            MessageRetryMiddlewareFactory retries = context.getBean(MessageRetryMiddlewareFactory.class);
            DeadLetterService deadLetters = context.getBean(DeadLetterService.class);
            AtomicInteger attempts = new AtomicInteger();

            MessageHandler<OrderSubmitted> inventoryDown = order -> {
                attempts.incrementAndGet();
                throw TransientMessagingException.timeout("inventory", Duration.ofSeconds(5));
            };

            RetryOutcome outcome = retries.executeWithRetry(new OrderSubmitted("order-2", 1), inventoryDown, ORDERS_QUEUE)
                    .get(30, TimeUnit.SECONDS);

            assertThat(outcome.isQuarantined()).isTrue();
            assertThat(attempts).hasValue(3);

            String deadLetterId = outcome.deadLetter().getMessageId();
            await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
                List<DeadLetterRecord> listed = deadLetters.listDeadLetters(ORDERS_QUEUE, 10);
                assertThat(listed).extracting(DeadLetterRecord::getMessageId).contains(deadLetterId);
                DeadLetterRecord stored = listed.get(0);
                assertThat(stored.getFailureType()).isEqualTo(FailureType.TRANSIENT);
                assertThat(stored.getAttemptCount()).isEqualTo(3);
                assertThat(stored.getFailureHistory()).hasSize(3);
            });

            assertThat(deadLetters.reprocess(ORDERS_QUEUE, deadLetterId)).isTrue();
            assertThat(deadLetters.listDeadLetters(ORDERS_QUEUE, 10)).isEmpty();

            Message replayed = directTemplate().receive(ORDERS_QUEUE, 10_000);
            assertThat(replayed).isNotNull();
            assertThat(replayed.getMessageProperties().getHeaders())
                    .containsKey(DeadLetterHeaders.REPROCESSED_FROM_DLQ);
            assertThat(new String(replayed.getBody())).contains("order-2");
        });
    }

    @Test
    @DisplayName("should quarantine messages the subscription cannot handle and purge them")
    void shouldQuarantineFromSubscriptionAndPurge() {
        contextRunner().run(context -> {
            MessageBus bus = context.getBean(MessageBus.class);
            MessageRetryMiddlewareFactory retries = context.getBean(MessageRetryMiddlewareFactory.class);
            DeadLetterService deadLetters = context.getBean(DeadLetterService.class);

            MessageRetryMiddleware<OrderSubmitted> middleware = retries.create(OrderSubmitted.class, order -> {
                throw new IllegalArgumentException("quantity must be positive");
            }, "orders-fulfilment");
            bus.subscribe(OrderSubmitted.class, middleware.asHandler(), "orders-fulfilment");

            bus.publish(new OrderSubmitted("order-3", -1)).get(10, TimeUnit.SECONDS);

            await().atMost(Duration.ofSeconds(20))
                    .until(() -> !deadLetters.listDeadLetters("orders-fulfilment", 10).isEmpty());
            DeadLetterRecord quarantined = deadLetters.listDeadLetters("orders-fulfilment", 10).get(0);
            assertThat(quarantined.getFailureType()).isEqualTo(FailureType.PERMANENT);
            assertThat(quarantined.getAttemptCount()).isEqualTo(1);
            assertThat(quarantined.getFailureReason()).contains("quantity must be positive");

            assertThat(deadLetters.purge("orders-fulfilment", quarantined.getMessageId())).isTrue();
            assertThat(deadLetters.listDeadLetters("orders-fulfilment", 10)).isEmpty();
        });
    }

    private static RabbitTemplate directTemplate() {
        CachingConnectionFactory connectionFactory = new CachingConnectionFactory(rabbit.getHost(), rabbit.getAmqpPort());
        connectionFactory.setUsername(rabbit.getAdminUsername());
        connectionFactory.setPassword(rabbit.getAdminPassword());
        return new RabbitTemplate(connectionFactory);
    }
}
