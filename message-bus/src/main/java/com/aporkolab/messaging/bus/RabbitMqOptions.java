package com.aporkolab.messaging.bus;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

/**
 * Connection and naming settings for the RabbitMQ transport.
 */
public class RabbitMqOptions {

    private static final Logger log = LoggerFactory.getLogger(RabbitMqOptions.class);

    /**
     * Full AMQP URI. When empty it is built from host, port, credentials and virtual host.
     */
    private String connectionString = "";
    private String host = "localhost";
    private int port = 5672;
    private String username = "guest";
    private String password = "guest";
    private String virtualHost = "/";

    /**
     * Queue used by {@code send} when no destination is given.
     */
    private String defaultQueue = "messaging.default";

    /**
     * Topic exchange that {@code publish} delivers to.
     */
    private String eventsExchange = "messaging.events";

    /**
     * Logical domain to queue name, declared at startup.
     */
    private Map<String, String> domainQueues = new LinkedHashMap<>();

    private int concurrency = 1;
    private int prefetch = 10;

    /**
     * Checks the connection settings before any client is built.
     * <p>
     * An unresolved placeholder in the connection string is fatal in production. Elsewhere
     * it is logged and the URI is built from host and port instead.
     *
     * @throws MessagingConfigurationException in production when a setting is unusable
     */
    public void validateFor(DeploymentEnvironment environment) {
        String envName = environment.getDisplayName();

        if (connectionString != null && connectionString.contains("${")) {
            if (environment.isProduction()) {
                throw MessagingConfigurationException.unresolvedPlaceholder("messaging.rabbit-mq.connection-string", envName);
            }
            connectionString = "";
            log.warn("RabbitMQ connection string is a placeholder; using {}:{} in the {} environment",
                    host, port, envName);
        }

        if (host == null || host.isBlank() || host.contains("${")) {
            if (environment.isProduction()) {
                throw MessagingConfigurationException.missingSetting("messaging.rabbit-mq.host", envName);
            }
            log.warn("RabbitMQ host is not configured; using localhost in the {} environment", envName);
            host = "localhost";
        }
    }

    public String resolveConnectionString() {
        if (connectionString != null && !connectionString.isBlank()) {
            return connectionString;
        }
        String vhost = "/".equals(virtualHost) || virtualHost == null || virtualHost.isBlank()
                ? ""
                : URLEncoder.encode(virtualHost, StandardCharsets.UTF_8);
        return String.format("amqp://%s:%s@%s:%d/%s",
                URLEncoder.encode(username, StandardCharsets.UTF_8),
                URLEncoder.encode(password, StandardCharsets.UTF_8),
                host, port, vhost);
    }

    public String getConnectionString() {
        return connectionString;
    }

    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public void setDefaultQueue(String defaultQueue) {
        this.defaultQueue = defaultQueue;
    }

    public String getEventsExchange() {
        return eventsExchange;
    }

    public void setEventsExchange(String eventsExchange) {
        this.eventsExchange = eventsExchange;
    }

    public Map<String, String> getDomainQueues() {
        return domainQueues;
    }

    public void setDomainQueues(Map<String, String> domainQueues) {
        this.domainQueues = domainQueues;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public void setPrefetch(int prefetch) {
        this.prefetch = prefetch;
    }
}
