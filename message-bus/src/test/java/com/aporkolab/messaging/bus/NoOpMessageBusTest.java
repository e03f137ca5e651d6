package com.aporkolab.messaging.bus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NoOpMessageBusTest {

    private final NoOpMessageBus bus = new NoOpMessageBus();

    @Test
    @DisplayName("send and publish should complete immediately for any input")
    void sendAndPublishShouldComplete() {
        assertThat(bus.send(new OrderPlaced("o-1", BigDecimal.TEN), "orders")).isCompleted();
        assertThat(bus.send(null, null)).isCompleted();
        assertThat(bus.publish(new OrderPlaced("o-1", BigDecimal.ONE))).isCompleted();
        assertThat(bus.publish(null, null)).isCompleted();
    }

    @Test
    @DisplayName("subscribe should never invoke the handler")
    void subscribeShouldNeverInvokeHandler() {
        AtomicInteger calls = new AtomicInteger();

        Subscription subscription = bus.subscribe(OrderPlaced.class, message -> {
            calls.incrementAndGet();
            return null;
        });

        assertThat(subscription.getName()).isEqualTo("order-placed");
        assertThat(subscription.isActive()).isFalse();
        assertThatCode(subscription::close).doesNotThrowAnyException();
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should tolerate null subscription arguments")
    void shouldTolerateNullSubscriptionArguments() {
        assertThatCode(() -> bus.subscribe(null, null, null)).doesNotThrowAnyException();
        assertThatCode(bus::ensureInfrastructure).doesNotThrowAnyException();
        assertThat(bus.getTransportMode()).isEqualTo(TransportMode.DISABLED);
    }
}
