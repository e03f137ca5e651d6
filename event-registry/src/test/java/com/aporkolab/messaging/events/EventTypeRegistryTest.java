package com.aporkolab.messaging.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

class EventTypeRegistryTest {

    public static class OrderPlaced implements IntegrationEvent {
        public String orderId;
    }

    public static class OrderCancelled implements IntegrationEvent {
        public String orderId;
    }

    public abstract static class AbstractOrderEvent implements IntegrationEvent {
    }

    public interface OrderEvent extends IntegrationEvent {
    }

    static class InternalOrderEvent implements IntegrationEvent {
    }

    public static class NotAnEvent {
    }

    static final class Billing {
        public static class PaymentReceived implements IntegrationEvent {
        }
    }

    static final class Accounting {
        public static class PaymentReceived implements IntegrationEvent {
        }
    }

    private static final EventTypeModule ORDERS = catalog -> catalog
            .register(OrderPlaced.class)
            .register(OrderCancelled.class);

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("should resolve an event once its module is registered")
        void shouldResolveRegisteredEvent() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS));

            assertThat(registry.getEventType("OrderPlaced")).contains(OrderPlaced.class);
        }

        @Test
        @DisplayName("should report not found when no module defines the event")
        void shouldReportNotFoundWithoutModule() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of());

            assertThat(registry.getEventType("OrderPlaced")).isEmpty();
            assertThat(registry.getEventType(null)).isEmpty();
        }

        @Test
        @DisplayName("should return every registered event type")
        void shouldReturnAllEventTypes() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS));

            assertThat(registry.getAllEventTypes().asMap())
                    .containsOnlyKeys("OrderPlaced", "OrderCancelled");
        }

        @Test
        @DisplayName("event instances should report their wire type name")
        void eventShouldReportTypeName() {
            assertThat(new OrderPlaced().eventType()).isEqualTo("OrderPlaced");
        }
    }

    @Nested
    @DisplayName("Event shape")
    class EventShape {

        @Test
        @DisplayName("should skip abstract, interface, non-public and non-event types")
        void shouldSkipTypesThatAreNotEventShaped() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(catalog -> catalog
                    .register(AbstractOrderEvent.class)
                    .register(OrderEvent.class)
                    .register(InternalOrderEvent.class)
                    .register(NotAnEvent.class)
                    .register(OrderPlaced.class)));

            assertThat(registry.getAllEventTypes().names()).containsExactly("OrderPlaced");
        }

        @Test
        @DisplayName("registering the same class twice should be harmless")
        void shouldTolerateDuplicateRegistrationOfSameClass() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS, ORDERS));

            assertThat(registry.getAllEventTypes().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail when two modules claim the same name with different classes")
        void shouldFailOnNameCollision() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(
                    catalog -> catalog.register(Billing.PaymentReceived.class),
                    catalog -> catalog.register(Accounting.PaymentReceived.class)));

            assertThatThrownBy(registry::getAllEventTypes)
                    .isInstanceOf(MessagingConfigurationException.class)
                    .hasMessageContaining("PaymentReceived")
                    .hasMessageContaining(Billing.PaymentReceived.class.getName())
                    .hasMessageContaining(Accounting.PaymentReceived.class.getName());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

        @Test
        @DisplayName("should build the catalog once for repeated lookups")
        void shouldBuildOnce() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS), Duration.ofHours(1), clock);

            registry.getEventType("OrderPlaced");
            registry.getEventType("OrderCancelled");
            registry.getAllEventTypes();

            assertThat(registry.rebuildCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("invalidate followed by lookup should trigger exactly one rebuild")
        void invalidateShouldTriggerExactlyOneRebuild() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS), Duration.ofHours(1), clock);
            registry.getAllEventTypes();

            registry.invalidateCache();
            EventTypeCatalog rebuilt = registry.getAllEventTypes();
            registry.getAllEventTypes();

            assertThat(registry.rebuildCount()).isEqualTo(2);
            assertThat(rebuilt.names()).containsExactlyInAnyOrder("OrderPlaced", "OrderCancelled");
        }

        @Test
        @DisplayName("should pick up a module registered after the first build")
        void shouldPickUpLateModule() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS), Duration.ofHours(1), clock);
            assertThat(registry.getEventType("PaymentReceived")).isEmpty();

            registry.register(catalog -> catalog.register(Billing.PaymentReceived.class));

            assertThat(registry.getEventType("PaymentReceived")).contains(Billing.PaymentReceived.class);
            assertThat(registry.getEventType("OrderPlaced")).contains(OrderPlaced.class);
            assertThat(registry.rebuildCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should report a clash with a late module on the next lookup")
        void shouldRejectClashingLateModule() {
            EventTypeRegistry registry = new EventTypeRegistry(
                    List.of(catalog -> catalog.register(Billing.PaymentReceived.class)), Duration.ofHours(1), clock);
            registry.getAllEventTypes();

            registry.register(catalog -> catalog.register(Accounting.PaymentReceived.class));

            assertThatThrownBy(registry::getAllEventTypes).isInstanceOf(MessagingConfigurationException.class);
        }

        @Test
        @DisplayName("should rebuild after the cache ttl elapses")
        void shouldRebuildAfterTtl() {
            EventTypeRegistry registry = new EventTypeRegistry(List.of(ORDERS), Duration.ofHours(1), clock);
            registry.getAllEventTypes();

            clock.advance(Duration.ofMinutes(61));
            registry.getAllEventTypes();

            assertThat(registry.rebuildCount()).isEqualTo(2);
        }
    }
}
