package com.aporkolab.messaging.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExceptionFrameworkTest {

    @Nested
    @DisplayName("MessagingException Base Class")
    class MessagingExceptionTest {

        @Test
        @DisplayName("should store code, message and timestamp")
        void shouldStoreBasicProperties() {
            DeserializationException exception = new DeserializationException("OrderPlaced", "truncated body");

            assertThat(exception.getCode()).isEqualTo("DESERIALIZATION_ERROR");
            assertThat(exception.getMessage()).contains("OrderPlaced").contains("truncated body");
            assertThat(exception.getTimestamp()).isNotNull();
        }

        @Test
        @DisplayName("should ignore null context values")
        void shouldIgnoreNullContextValues() {
            TransientMessagingException exception = new TransientMessagingException("boom");
            exception.with("destination", null);

            assertThat(exception.getContext()).doesNotContainKey("destination");
        }

        @Test
        @DisplayName("context should be immutable copy")
        void contextShouldBeImmutableCopy() {
            DeadLetterException exception = new DeadLetterException("orders", "OrderPlaced", new RuntimeException("x"));

            assertThat(exception.getContext()).isNotSameAs(exception.getContext());
            assertThat(exception.getContext())
                    .containsEntry("sourceQueue", "orders")
                    .containsEntry("messageType", "OrderPlaced");
        }
    }

    @Nested
    @DisplayName("MessagingConfigurationException")
    class ConfigurationExceptionTest {

        @Test
        @DisplayName("should name the missing property and environment")
        void shouldNameMissingProperty() {
            MessagingConfigurationException exception = MessagingConfigurationException
                    .missingSetting("messaging.cloud.default-topic", "PRODUCTION");

            assertThat(exception.getCode()).isEqualTo("CONFIGURATION_ERROR");
            assertThat(exception.getMessage()).contains("messaging.cloud.default-topic").contains("PRODUCTION");
            assertThat(exception.getContext()).containsEntry("property", "messaging.cloud.default-topic");
        }

        @Test
        @DisplayName("should describe unresolved placeholders")
        void shouldDescribePlaceholder() {
            MessagingConfigurationException exception = MessagingConfigurationException
                    .unresolvedPlaceholder("messaging.cloud.connection-string", "PRODUCTION");

            assertThat(exception.getMessage()).contains("unresolved placeholder");
        }
    }

    @Nested
    @DisplayName("TransientMessagingException")
    class TransientTest {

        @Test
        @DisplayName("should build broker unavailable with cause")
        void shouldBuildBrokerUnavailable() {
            TransientMessagingException exception = TransientMessagingException
                    .brokerUnavailable("rabbitmq", new java.net.ConnectException("refused"));

            assertThat(exception.getMessage()).contains("rabbitmq").contains("refused");
            assertThat(exception.getCause()).isInstanceOf(java.net.ConnectException.class);
            assertThat(exception.getContext()).containsEntry("broker", "rabbitmq");
        }

        @Test
        @DisplayName("should build timeout and throttled variants")
        void shouldBuildTimeoutAndThrottled() {
            assertThat(TransientMessagingException.timeout("orders", Duration.ofSeconds(5)).getMessage())
                    .contains("timed out");
            assertThat(TransientMessagingException.throttled("orders").getMessage())
                    .contains("throttled");
        }
    }

    @Nested
    @DisplayName("Permanent failures")
    class PermanentTest {

        @Test
        @DisplayName("validation and deserialization errors should be permanent")
        void shouldBePermanent() {
            assertThat(new MessageValidationException("email", "required"))
                    .isInstanceOf(PermanentMessagingException.class);
            assertThat(DeserializationException.unknownType("Ghost"))
                    .isInstanceOf(PermanentMessagingException.class)
                    .hasMessageContaining("no registered event type");
        }

        @Test
        @DisplayName("should handle multiple field errors")
        void shouldHandleMultipleFieldErrors() {
            List<MessageValidationException.FieldError> errors = List.of(
                    new MessageValidationException.FieldError("email", "required"),
                    new MessageValidationException.FieldError("amount", "must be positive")
            );

            MessageValidationException exception = new MessageValidationException(errors);

            assertThat(exception.getMessage()).contains("multiple fields");
            assertThat(exception.getContext()).containsKey("errors");
        }
    }
}
