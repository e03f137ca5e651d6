package com.aporkolab.messaging.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class KafkaCorrelationInterceptorTest {

    private final KafkaCorrelationInterceptor.Producer producer = new KafkaCorrelationInterceptor.Producer();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should stamp outgoing record with current correlation ID")
    void shouldStampOutgoingRecord() {
        ProducerRecord<Object, Object> record = new ProducerRecord<>("orders", "key", "payload");

        try (CorrelationContext ctx = CorrelationContext.create("corr-42").withService("billing")) {
            producer.onSend(record);
        }

        assertThat(new String(record.headers().lastHeader(KafkaCorrelationInterceptor.CORRELATION_ID_HEADER).value(),
                StandardCharsets.UTF_8)).isEqualTo("corr-42");
        assertThat(new String(record.headers().lastHeader(KafkaCorrelationInterceptor.SOURCE_SERVICE_HEADER).value(),
                StandardCharsets.UTF_8)).isEqualTo("billing");
    }

    @Test
    @DisplayName("should keep correlation header already set by the sender")
    void shouldKeepExistingHeader() {
        ProducerRecord<Object, Object> record = new ProducerRecord<>("orders", "key", "payload");
        record.headers().add(KafkaCorrelationInterceptor.CORRELATION_ID_HEADER,
                "original".getBytes(StandardCharsets.UTF_8));

        try (CorrelationContext ctx = CorrelationContext.create("other")) {
            producer.onSend(record);
        }

        assertThat(record.headers().headers(KafkaCorrelationInterceptor.CORRELATION_ID_HEADER)).hasSize(1);
    }

    @Test
    @DisplayName("should restore context from consumed record")
    void shouldRestoreContextFromConsumedRecord() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("orders", 0, 0L, "key", "payload");
        record.headers().add(KafkaCorrelationInterceptor.CORRELATION_ID_HEADER,
                "corr-7".getBytes(StandardCharsets.UTF_8));

        try (CorrelationContext ctx = KafkaCorrelationInterceptor.setupContext(record)) {
            assertThat(CorrelationContext.getCurrentCorrelationId()).isEqualTo("corr-7");
            assertThat(MDC.get(CorrelationContext.SOURCE_QUEUE_KEY)).isEqualTo("orders");
        }
    }

    @Test
    @DisplayName("should return null when record carries no correlation header")
    void shouldReturnNullWithoutHeader() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("orders", 0, 0L, "key", "payload");

        assertThat(KafkaCorrelationInterceptor.extractCorrelationId(record)).isNull();
    }
}
