package com.aporkolab.messaging.logging;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerInterceptor;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;

/**
 * Kafka support for correlation ID propagation.
 * 
 * Producer: adds the correlation ID from MDC to outgoing records that do not
 * carry one yet. Registered by the cloud transport through
 * {@code interceptor.classes}.
 * Consumer side: {@link #setupContext(ConsumerRecord)} restores it on the
 * listener thread.
 */
public final class KafkaCorrelationInterceptor {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String SOURCE_SERVICE_HEADER = "X-Source-Service";

    private KafkaCorrelationInterceptor() {
    }

    public static class Producer implements ProducerInterceptor<Object, Object> {

        @Override
        public ProducerRecord<Object, Object> onSend(ProducerRecord<Object, Object> record) {
            String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_KEY);
            if (correlationId != null && record.headers().lastHeader(CORRELATION_ID_HEADER) == null) {
                record.headers().add(CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8));
            }

            String serviceName = MDC.get(CorrelationContext.SERVICE_NAME_KEY);
            if (serviceName != null && record.headers().lastHeader(SOURCE_SERVICE_HEADER) == null) {
                record.headers().add(SOURCE_SERVICE_HEADER, serviceName.getBytes(StandardCharsets.UTF_8));
            }

            return record;
        }

        @Override
        public void onAcknowledgement(RecordMetadata metadata, Exception exception) {
            // nothing to track
        }

        @Override
        public void close() {
            // no resources
        }

        @Override
        public void configure(Map<String, ?> configs) {
            // no configuration
        }
    }

    public static String extractCorrelationId(ConsumerRecord<?, ?> record) {
        Header header = record.headers().lastHeader(CORRELATION_ID_HEADER);
        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        return null;
    }

    public static CorrelationContext setupContext(ConsumerRecord<?, ?> record) {
        return CorrelationContext.continueOrCreate(extractCorrelationId(record))
                .with(CorrelationContext.SOURCE_QUEUE_KEY, record.topic());
    }
}
