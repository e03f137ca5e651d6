package com.aporkolab.messaging.spring.autoconfigure;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import com.aporkolab.messaging.bus.RabbitMqOptions;

/**
 * RabbitMQ connection, template and admin shared by the bus and the dead-letter
 * service. Nothing connects until one of the accessors is called.
 */
class RabbitMqClients implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqClients.class);

    private final RabbitMqOptions options;
    private CachingConnectionFactory connectionFactory;
    private RabbitTemplate template;
    private RabbitAdmin admin;

    RabbitMqClients(RabbitMqOptions options) {
        this.options = options;
    }

    synchronized CachingConnectionFactory connectionFactory() {
        if (connectionFactory == null) {
            connectionFactory = new CachingConnectionFactory(URI.create(options.resolveConnectionString()));
            connectionFactory.setConnectionNameStrategy(cf -> "reliable-messaging");
            log.info("RabbitMQ connection factory created for {}:{}", connectionFactory.getHost(),
                    connectionFactory.getPort());
        }
        return connectionFactory;
    }

    synchronized RabbitTemplate template() {
        if (template == null) {
            template = new RabbitTemplate(connectionFactory());
        }
        return template;
    }

    synchronized RabbitAdmin admin() {
        if (admin == null) {
            admin = new RabbitAdmin(connectionFactory());
        }
        return admin;
    }

    @Override
    public synchronized void close() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
            log.info("RabbitMQ connection factory closed");
        }
    }
}
