package com.aporkolab.messaging.events;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Lazily computed value with time-based expiry and explicit invalidation.
 * <p>
 * Concurrent readers that miss at the same time share one load: the first
 * reader to claim the in-flight slot computes the value, the others wait for
 * its result.
 */
public class CachedValue<T> {

    private final Supplier<T> loader;
    private final Duration ttl;
    private final Clock clock;

    private final AtomicReference<Entry<T>> current = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<T>> inFlight = new AtomicReference<>();
    private final AtomicLong loads = new AtomicLong();

    public CachedValue(Supplier<T> loader, Duration ttl) {
        this(loader, ttl, Clock.systemUTC());
    }

    public CachedValue(Supplier<T> loader, Duration ttl, Clock clock) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    public T get() {
        Entry<T> entry = current.get();
        if (isFresh(entry)) {
            return entry.value();
        }

        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletableFuture<T> running = inFlight.compareAndExchange(null, mine);
        if (running != null) {
            return await(running);
        }

        try {
            // another reader may have finished loading between our miss and the claim
            entry = current.get();
            if (isFresh(entry)) {
                mine.complete(entry.value());
                return entry.value();
            }

            T value = loader.get();
            loads.incrementAndGet();
            current.set(new Entry<>(value, clock.instant().plus(ttl)));
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.compareAndSet(mine, null);
        }
    }

    /**
     * Drops the current value; the next {@link #get()} reloads.
     */
    public void invalidate() {
        current.set(null);
    }

    public boolean isLoaded() {
        return isFresh(current.get());
    }

    /**
     * Number of times the loader has run.
     */
    public long loadCount() {
        return loads.get();
    }

    private boolean isFresh(Entry<T> entry) {
        return entry != null && clock.instant().isBefore(entry.expiresAt());
    }

    private static <T> T await(CompletableFuture<T> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private record Entry<T>(T value, Instant expiresAt) {
    }
}
