package com.aporkolab.messaging.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.aporkolab.messaging.events.EventTypeRegistry;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.aporkolab.messaging.logging.CorrelationContext;

@ExtendWith(MockitoExtension.class)
class KafkaMessageBusTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private ConsumerFactory<String, String> consumerFactory;

    @Mock
    private KafkaAdmin kafkaAdmin;

    private KafkaMessageBus bus;

    @BeforeEach
    void setUp() {
        CloudBrokerOptions options = new CloudBrokerOptions();
        options.setBootstrapServers("broker:9093");
        options.setDefaultTopic("orders-events");
        options.setPartitions(6);
        options.setReplicationFactor((short) 3);

        EnvelopeCodec codec = new EnvelopeCodec(EnvelopeCodec.defaultObjectMapper(),
                new EventTypeRegistry(List.of(catalog -> catalog.register(OrderPlaced.class))));
        bus = new KafkaMessageBus(kafkaTemplate, consumerFactory, kafkaAdmin, codec, options, DeadLetterTopology.DEFAULT);
    }

    @Nested
    @DisplayName("Producing")
    class Producing {

        @Test
        @DisplayName("should key records by correlation id and tag the message type")
        void shouldKeyByCorrelationId() {
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenAnswer(invocation -> CompletableFuture.completedFuture(
                            new SendResult<>(invocation.getArgument(0), null)));

            try (CorrelationContext ctx = CorrelationContext.create("corr-9")) {
                bus.send(new OrderPlaced("o-1", BigDecimal.TEN), "payments").join();
            }

            @SuppressWarnings("unchecked")
            ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
            verify(kafkaTemplate).send(captor.capture());

            ProducerRecord<String, String> record = captor.getValue();
            assertThat(record.topic()).isEqualTo("payments");
            assertThat(record.key()).isEqualTo("corr-9");
            assertThat(new String(record.headers().lastHeader(MessageHeaders.MESSAGE_TYPE).value(), StandardCharsets.UTF_8))
                    .isEqualTo("OrderPlaced");
            assertThat(record.value()).contains("\"orderId\":\"o-1\"");
        }

        @Test
        @DisplayName("should publish to the default topic when none is given")
        void shouldPublishToDefaultTopic() {
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenAnswer(invocation -> CompletableFuture.completedFuture(
                            new SendResult<>(invocation.getArgument(0), null)));

            bus.publish(new OrderPlaced("o-1", BigDecimal.TEN)).join();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
            verify(kafkaTemplate).send(captor.capture());
            assertThat(captor.getValue().topic()).isEqualTo("orders-events");
        }

        @Test
        @DisplayName("should surface producer failures as transient errors")
        void shouldSurfaceProducerFailures() {
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

            CompletableFuture<Void> result = bus.publish(new OrderPlaced("o-1", BigDecimal.TEN));

            assertThatThrownBy(result::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(TransientMessagingException.class);
        }
    }

    @Nested
    @DisplayName("Consuming")
    class Consuming {

        private ConsumerRecord<String, String> record(String type, String body) {
            ConsumerRecord<String, String> record = new ConsumerRecord<>("orders-events", 0, 42L, "c-1", body);
            record.headers().add(MessageHeaders.MESSAGE_TYPE, type.getBytes(StandardCharsets.UTF_8));
            return record;
        }

        @Test
        @DisplayName("should skip records of other event types")
        void shouldSkipOtherTypes() {
            AtomicInteger calls = new AtomicInteger();
            MessageHandler<OrderPlaced> handler = message -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            };

            bus.onRecord(OrderPlaced.class, handler, record("InvoiceIssued", "{}"));
            bus.onRecord(OrderPlaced.class, handler, record("OrderPlaced", "{\"orderId\":\"o-1\"}"));

            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("should rethrow handler failures so the error handler dead-letters the record")
        void shouldRethrowHandlerFailure() {
            MessageHandler<OrderPlaced> handler = message ->
                    CompletableFuture.failedFuture(new IllegalArgumentException("invalid order"));

            assertThatThrownBy(() -> bus.onRecord(OrderPlaced.class, handler, record("OrderPlaced", "{}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("invalid order");
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should rethrow a cancelled handler as a cancellation")
        void shouldRethrowCancellation() {
            MessageHandler<OrderPlaced> handler = message ->
                    CompletableFuture.failedFuture(new CancellationException("shutdown"));
            ConsumerRecord<String, String> record = new ConsumerRecord<>("orders-events", 0, 7L, "c-1", "{}");
            record.headers().add(MessageHeaders.MESSAGE_TYPE, "OrderPlaced".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> bus.onRecord(OrderPlaced.class, handler, record))
                    .isInstanceOf(CancellationException.class);
        }

        @Test
        @DisplayName("should refuse to dead-letter a cancelled record so it is redelivered")
        void shouldNotDeadLetterCancelledRecord() {
            ConsumerRecord<String, String> record = new ConsumerRecord<>("orders-events", 0, 7L, "c-1", "{}");
            Exception failure = new IllegalStateException("Listener failed", new CancellationException("shutdown"));

            assertThatThrownBy(() -> bus.recoverer().accept(record, failure))
                    .isInstanceOf(KafkaException.class)
                    .hasMessageContaining("cancelled");

            verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
        }
    }

    @Nested
    @DisplayName("Subscription topics")
    class SubscriptionTopics {

        @Test
        @DisplayName("should consume the default topic and the topic named by the subscription")
        void shouldConsumeNamedTopic() {
            assertThat(bus.subscribedTopics("payments")).containsExactly("orders-events", "payments");
        }

        @Test
        @DisplayName("should consume only the default topic for unnamed subscriptions")
        void shouldConsumeDefaultTopicOnly() {
            assertThat(bus.subscribedTopics(null)).containsExactly("orders-events");
            assertThat(bus.subscribedTopics("orders-events")).containsExactly("orders-events");
        }
    }

    @Test
    @DisplayName("should create the default topic with the configured layout")
    void shouldCreateDefaultTopic() {
        bus.ensureInfrastructure();

        ArgumentCaptor<NewTopic> captor = ArgumentCaptor.forClass(NewTopic.class);
        verify(kafkaAdmin).createOrModifyTopics(captor.capture());

        assertThat(captor.getValue().name()).isEqualTo("orders-events");
        assertThat(captor.getValue().numPartitions()).isEqualTo(6);
    }
}
