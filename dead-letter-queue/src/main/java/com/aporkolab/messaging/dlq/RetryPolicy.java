package com.aporkolab.messaging.dlq;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a failed attempt is retried and how long to wait before the next one.
 * <p>
 * Backoff is {@code min(initial * multiplier^(attempt-1), max)}, deterministic and
 * non-decreasing in the attempt number. Stateless apart from its settings, so one
 * instance is shared by every middleware.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryPolicySettings settings;

    public RetryPolicy(RetryPolicySettings settings) {
        this.settings = settings.validate();
    }

    public boolean shouldRetry(Throwable failure, int attemptNumber) {
        if (attemptNumber >= settings.getMaxRetryAttempts()) {
            return false;
        }

        return switch (FailureClassifier.classify(failure)) {
            case TRANSIENT -> true;
            case PERMANENT, CRITICAL -> false;
            case UNKNOWN -> attemptNumber < settings.getMaxRetryAttempts() / 2;
        };
    }

    public Duration calculateRetryDelay(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be at least 1, was " + attemptNumber);
        }

        long maxMillis = settings.maxRetryDelay().toMillis();
        double exponential = settings.initialRetryDelay().toMillis()
                * Math.pow(settings.getBackoffMultiplier(), attemptNumber - 1);

        if (Double.isInfinite(exponential) || exponential >= maxMillis) {
            return Duration.ofMillis(maxMillis);
        }
        return Duration.ofMillis(Math.round(exponential));
    }

    /**
     * Startup smoke test of the policy wiring: evaluates both functions against a
     * synthetic non-retryable failure and logs what it got.
     */
    public void validateConfiguration(String serviceName) {
        IllegalStateException sample = new IllegalStateException("Configuration self-check");
        boolean retry = shouldRetry(sample, 1);
        Duration delay = calculateRetryDelay(1);

        log.info("Retry policy validated for {}: {} -> shouldRetry={}, firstDelay={}ms",
                serviceName, settings, retry, delay.toMillis());
    }

    public RetryPolicySettings getSettings() {
        return settings;
    }
}
