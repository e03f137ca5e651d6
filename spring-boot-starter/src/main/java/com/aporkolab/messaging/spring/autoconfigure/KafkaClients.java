package com.aporkolab.messaging.spring.autoconfigure;

import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;

import com.aporkolab.messaging.bus.CloudBrokerOptions;
import com.aporkolab.messaging.logging.KafkaCorrelationInterceptor;

/**
 * Kafka producer, consumer factory and admin for the managed cloud broker, created
 * on first use.
 */
class KafkaClients implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KafkaClients.class);

    private final CloudBrokerOptions options;
    private DefaultKafkaProducerFactory<String, String> producerFactory;
    private KafkaTemplate<String, String> template;
    private ConsumerFactory<String, String> consumerFactory;
    private KafkaAdmin admin;

    KafkaClients(CloudBrokerOptions options) {
        this.options = options;
    }

    synchronized KafkaTemplate<String, String> template() {
        if (template == null) {
            Map<String, Object> props = commonProperties();
            props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            props.put(ProducerConfig.ACKS_CONFIG, "all");
            props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
            props.put(ProducerConfig.INTERCEPTOR_CLASSES_CONFIG, KafkaCorrelationInterceptor.Producer.class.getName());
            producerFactory = new DefaultKafkaProducerFactory<>(props);
            template = new KafkaTemplate<>(producerFactory);
            log.info("Kafka producer created for {}", options.getBootstrapServers());
        }
        return template;
    }

    synchronized ConsumerFactory<String, String> consumerFactory() {
        if (consumerFactory == null) {
            Map<String, Object> props = commonProperties();
            props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
            consumerFactory = new DefaultKafkaConsumerFactory<>(props);
        }
        return consumerFactory;
    }

    synchronized KafkaAdmin admin() {
        if (admin == null) {
            admin = new KafkaAdmin(commonProperties());
            admin.setFatalIfBrokerNotAvailable(false);
        }
        return admin;
    }

    private Map<String, Object> commonProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, options.getBootstrapServers());
        props.putAll(options.saslProperties());
        return props;
    }

    @Override
    public synchronized void close() {
        if (producerFactory != null) {
            producerFactory.destroy();
            log.info("Kafka producer closed");
        }
    }
}
