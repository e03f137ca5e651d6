package com.aporkolab.messaging.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

class CloudBrokerOptionsTest {

    private static CloudBrokerOptions options(String bootstrap, String connection, String topic) {
        CloudBrokerOptions options = new CloudBrokerOptions();
        options.setBootstrapServers(bootstrap);
        options.setConnectionString(connection);
        options.setDefaultTopic(topic);
        return options;
    }

    @Nested
    @DisplayName("Production")
    class Production {

        @Test
        @DisplayName("should accept a fully configured endpoint")
        void shouldAcceptConfiguredEndpoint() {
            CloudBrokerOptions options = options("broker.example.com:9093",
                    "Endpoint=sb://prod.servicebus.windows.net/;SharedAccessKeyName=app;SharedAccessKey=s3cret",
                    "orders-events");

            assertThatCode(() -> options.validateFor(DeploymentEnvironment.PRODUCTION)).doesNotThrowAnyException();
            assertThat(options.saslProperties()).containsEntry("sasl.mechanism", "PLAIN");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "${KAFKA_BOOTSTRAP_SERVERS}", CloudBrokerOptions.DUMMY_CONNECTION_STRING})
        @DisplayName("should reject unusable bootstrap servers")
        void shouldRejectUnusableBootstrapServers(String bootstrap) {
            CloudBrokerOptions options = options(bootstrap, "", "orders-events");

            assertThatThrownBy(() -> options.validateFor(DeploymentEnvironment.PRODUCTION))
                    .isInstanceOf(MessagingConfigurationException.class)
                    .hasMessageContaining("messaging.cloud.bootstrap-servers")
                    .hasMessageContaining("Production");
        }

        @Test
        @DisplayName("should reject an unresolved connection string placeholder")
        void shouldRejectPlaceholderConnectionString() {
            CloudBrokerOptions options = options("broker:9093", "${CLOUD_BROKER_CONNECTION_STRING}", "orders-events");

            assertThatThrownBy(() -> options.validateFor(DeploymentEnvironment.PRODUCTION))
                    .isInstanceOf(MessagingConfigurationException.class)
                    .hasMessageContaining("messaging.cloud.connection-string");
        }

        @Test
        @DisplayName("should reject the sample dummy connection string regardless of case")
        void shouldRejectDummyConnectionString() {
            CloudBrokerOptions options = options("broker:9093",
                    CloudBrokerOptions.DUMMY_CONNECTION_STRING.toUpperCase(), "orders-events");

            assertThatThrownBy(() -> options.validateFor(DeploymentEnvironment.PRODUCTION))
                    .isInstanceOf(MessagingConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a missing default topic")
        void shouldRejectMissingTopic() {
            CloudBrokerOptions options = options("broker:9093", "", " ");

            assertThatThrownBy(() -> options.validateFor(DeploymentEnvironment.PRODUCTION))
                    .isInstanceOf(MessagingConfigurationException.class)
                    .hasMessageContaining("messaging.cloud.default-topic");
        }
    }

    @Nested
    @DisplayName("Development and testing")
    class NonProduction {

        @Test
        @DisplayName("should fall back to local defaults instead of failing")
        void shouldFallBackToDefaults() {
            CloudBrokerOptions options = options("${KAFKA_BOOTSTRAP_SERVERS}", "${CLOUD_BROKER_CONNECTION_STRING}", "");

            assertThatCode(() -> options.validateFor(DeploymentEnvironment.DEVELOPMENT)).doesNotThrowAnyException();

            assertThat(options.getBootstrapServers()).isEqualTo(CloudBrokerOptions.DEVELOPMENT_BOOTSTRAP_SERVERS);
            assertThat(options.getDefaultTopic()).isEqualTo(CloudBrokerOptions.DEVELOPMENT_DEFAULT_TOPIC);
            assertThat(options.getConnectionString()).isEmpty();
            assertThat(options.saslProperties()).isEmpty();
        }

        @Test
        @DisplayName("should keep explicit values in testing")
        void shouldKeepExplicitValues() {
            CloudBrokerOptions options = options("kafka:9092", "", "test-events");

            options.validateFor(DeploymentEnvironment.TESTING);

            assertThat(options.getBootstrapServers()).isEqualTo("kafka:9092");
            assertThat(options.getDefaultTopic()).isEqualTo("test-events");
        }
    }
}
