package com.aporkolab.messaging.bus;

import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

/**
 * Settings for the managed cloud broker (a hosted Kafka endpoint).
 * <p>
 * {@code connectionString} carries SASL credentials in the Event Hubs style
 * ({@code Endpoint=sb://...;SharedAccessKeyName=...;SharedAccessKey=...}) and is
 * optional for endpoints that authenticate otherwise.
 */
public class CloudBrokerOptions {

    private static final Logger log = LoggerFactory.getLogger(CloudBrokerOptions.class);

    /**
     * Value shipped in sample configuration files; never valid against a real broker.
     */
    public static final String DUMMY_CONNECTION_STRING =
            "Endpoint=sb://localhost/;SharedAccessKeyName=default;SharedAccessKey=default";

    public static final String DEVELOPMENT_BOOTSTRAP_SERVERS = "localhost:9092";
    public static final String DEVELOPMENT_DEFAULT_TOPIC = "messaging-events";

    private String bootstrapServers = "";
    private String connectionString = "";
    private String defaultTopic = "";
    private int partitions = 3;
    private short replicationFactor = 3;
    private int concurrency = 1;

    /**
     * Checks that the endpoint can actually be reached with these settings.
     * <p>
     * In production a missing, placeholder or dummy value is fatal. Elsewhere the
     * problem is logged and development defaults are filled in.
     *
     * @throws MessagingConfigurationException in production when a setting is unusable
     */
    public void validateFor(DeploymentEnvironment environment) {
        String envName = environment.getDisplayName();

        if (isUnusable(bootstrapServers)) {
            if (environment.isProduction()) {
                throw isBlank(bootstrapServers)
                        ? MessagingConfigurationException.missingSetting("messaging.cloud.bootstrap-servers", envName)
                        : MessagingConfigurationException.unresolvedPlaceholder("messaging.cloud.bootstrap-servers", envName);
            }
            log.warn("Cloud broker bootstrap servers are not configured; messaging functionality will be limited "
                    + "in the {} environment (using {})", envName, DEVELOPMENT_BOOTSTRAP_SERVERS);
            bootstrapServers = DEVELOPMENT_BOOTSTRAP_SERVERS;
        }

        if (!isBlank(connectionString) && isUnusable(connectionString)) {
            if (environment.isProduction()) {
                throw MessagingConfigurationException.unresolvedPlaceholder("messaging.cloud.connection-string", envName);
            }
            log.warn("Cloud broker connection string is a placeholder; connecting without credentials "
                    + "in the {} environment", envName);
            connectionString = "";
        }

        if (isBlank(defaultTopic)) {
            if (environment.isProduction()) {
                throw MessagingConfigurationException.missingSetting("messaging.cloud.default-topic", envName);
            }
            log.warn("Cloud broker default topic is not configured; using '{}' in the {} environment",
                    DEVELOPMENT_DEFAULT_TOPIC, envName);
            defaultTopic = DEVELOPMENT_DEFAULT_TOPIC;
        }
    }

    /**
     * Kafka client properties needed for SASL authentication, derived from the connection string.
     * Empty when no connection string is configured.
     */
    public Map<String, Object> saslProperties() {
        if (isBlank(connectionString)) {
            return Map.of();
        }
        String jaas = "org.apache.kafka.common.security.plain.PlainLoginModule required "
                + "username=\"$ConnectionString\" password=\"" + connectionString.replace("\"", "\\\"") + "\";";
        return Map.of(
                "security.protocol", "SASL_SSL",
                "sasl.mechanism", "PLAIN",
                "sasl.jaas.config", jaas);
    }

    static boolean isUnusable(String value) {
        return isBlank(value)
                || value.contains("${")
                || value.trim().toLowerCase(Locale.ROOT).equals(DUMMY_CONNECTION_STRING.toLowerCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public void setBootstrapServers(String bootstrapServers) {
        this.bootstrapServers = bootstrapServers;
    }

    public String getConnectionString() {
        return connectionString;
    }

    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    public String getDefaultTopic() {
        return defaultTopic;
    }

    public void setDefaultTopic(String defaultTopic) {
        this.defaultTopic = defaultTopic;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }

    public short getReplicationFactor() {
        return replicationFactor;
    }

    public void setReplicationFactor(short replicationFactor) {
        this.replicationFactor = replicationFactor;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }
}
