package com.aporkolab.messaging.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CachedValueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final AtomicInteger counter = new AtomicInteger();

    @Test
    @DisplayName("should load once and serve the cached value until expiry")
    void shouldServeCachedValueUntilExpiry() {
        CachedValue<Integer> value = new CachedValue<>(counter::incrementAndGet, Duration.ofMinutes(60), clock);

        assertThat(value.get()).isEqualTo(1);
        clock.advance(Duration.ofMinutes(59));
        assertThat(value.get()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));
        assertThat(value.get()).isEqualTo(2);
        assertThat(value.loadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reload exactly once after invalidation")
    void shouldReloadOnceAfterInvalidation() {
        CachedValue<Integer> value = new CachedValue<>(counter::incrementAndGet, Duration.ofMinutes(60), clock);
        value.get();

        value.invalidate();
        assertThat(value.isLoaded()).isFalse();

        assertThat(value.get()).isEqualTo(2);
        assertThat(value.get()).isEqualTo(2);
        assertThat(value.loadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should propagate loader failure and retry on next access")
    void shouldPropagateLoaderFailure() {
        AtomicInteger calls = new AtomicInteger();
        CachedValue<String> value = new CachedValue<>(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return "ok";
        }, Duration.ofMinutes(1), clock);

        assertThatThrownBy(value::get).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(value.get()).isEqualTo("ok");
    }

    @Test
    @DisplayName("should reject non-positive ttl")
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> new CachedValue<>(() -> "x", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent misses should share a single load")
    void concurrentMissesShouldShareSingleLoad() throws Exception {
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CachedValue<Integer> value = new CachedValue<>(() -> {
            loaderEntered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return counter.incrementAndGet();
        }, Duration.ofMinutes(60), clock);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            results.add(executor.submit(value::get));
            assertThat(loaderEntered.await(5, TimeUnit.SECONDS)).isTrue();

            for (int i = 0; i < 7; i++) {
                results.add(executor.submit(value::get));
            }
            release.countDown();

            for (Future<Integer> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            }
            assertThat(value.loadCount()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
