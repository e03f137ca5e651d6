package com.aporkolab.messaging.dlq;

import java.time.Duration;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

/**
 * Retry and quarantine tuning, loaded once at startup.
 * <p>
 * Unset values take the development preset; production deployments configure
 * theirs explicitly or start from {@link #forProduction()}.
 */
public class RetryPolicySettings {

    private int maxRetryAttempts = 3;
    private int initialRetryDelaySeconds = 2;
    private double backoffMultiplier = 2.0;
    private int maxRetryDelaySeconds = 60;
    private int deadLetterTtlHours = 24;
    private boolean enableDetailedLogging = true;
    private boolean enableAdminNotifications = false;

    public static RetryPolicySettings forDevelopment() {
        RetryPolicySettings settings = new RetryPolicySettings();
        settings.maxRetryAttempts = 3;
        settings.initialRetryDelaySeconds = 2;
        settings.backoffMultiplier = 2.0;
        settings.maxRetryDelaySeconds = 60;
        settings.deadLetterTtlHours = 24;
        settings.enableDetailedLogging = true;
        settings.enableAdminNotifications = false;
        return settings;
    }

    public static RetryPolicySettings forProduction() {
        RetryPolicySettings settings = new RetryPolicySettings();
        settings.maxRetryAttempts = 5;
        settings.initialRetryDelaySeconds = 5;
        settings.backoffMultiplier = 2.0;
        settings.maxRetryDelaySeconds = 300;
        settings.deadLetterTtlHours = 72;
        settings.enableDetailedLogging = false;
        settings.enableAdminNotifications = true;
        return settings;
    }

    /**
     * @throws MessagingConfigurationException if a value is out of range
     */
    public RetryPolicySettings validate() {
        require(maxRetryAttempts >= 1, "max-retry-attempts", "must be at least 1");
        require(initialRetryDelaySeconds >= 0, "initial-retry-delay-seconds", "must not be negative");
        require(backoffMultiplier >= 1.0, "backoff-multiplier", "must be at least 1.0");
        require(maxRetryDelaySeconds >= initialRetryDelaySeconds, "max-retry-delay-seconds",
                "must not be lower than initial-retry-delay-seconds");
        require(deadLetterTtlHours >= 0, "dead-letter-ttl-hours", "must not be negative");
        return this;
    }

    private static void require(boolean condition, String property, String problem) {
        if (!condition) {
            throw (MessagingConfigurationException) new MessagingConfigurationException(
                    "messaging.dead-letter." + property + " " + problem)
                    .with("property", "messaging.dead-letter." + property);
        }
    }

    public Duration initialRetryDelay() {
        return Duration.ofSeconds(initialRetryDelaySeconds);
    }

    public Duration maxRetryDelay() {
        return Duration.ofSeconds(maxRetryDelaySeconds);
    }

    public Duration deadLetterTtl() {
        return Duration.ofHours(deadLetterTtlHours);
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public void setMaxRetryAttempts(int maxRetryAttempts) {
        this.maxRetryAttempts = maxRetryAttempts;
    }

    public int getInitialRetryDelaySeconds() {
        return initialRetryDelaySeconds;
    }

    public void setInitialRetryDelaySeconds(int initialRetryDelaySeconds) {
        this.initialRetryDelaySeconds = initialRetryDelaySeconds;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public int getMaxRetryDelaySeconds() {
        return maxRetryDelaySeconds;
    }

    public void setMaxRetryDelaySeconds(int maxRetryDelaySeconds) {
        this.maxRetryDelaySeconds = maxRetryDelaySeconds;
    }

    public int getDeadLetterTtlHours() {
        return deadLetterTtlHours;
    }

    public void setDeadLetterTtlHours(int deadLetterTtlHours) {
        this.deadLetterTtlHours = deadLetterTtlHours;
    }

    public boolean isEnableDetailedLogging() {
        return enableDetailedLogging;
    }

    public void setEnableDetailedLogging(boolean enableDetailedLogging) {
        this.enableDetailedLogging = enableDetailedLogging;
    }

    public boolean isEnableAdminNotifications() {
        return enableAdminNotifications;
    }

    public void setEnableAdminNotifications(boolean enableAdminNotifications) {
        this.enableAdminNotifications = enableAdminNotifications;
    }

    @Override
    public String toString() {
        return "RetryPolicySettings{" +
                "maxRetryAttempts=" + maxRetryAttempts +
                ", initialRetryDelaySeconds=" + initialRetryDelaySeconds +
                ", backoffMultiplier=" + backoffMultiplier +
                ", maxRetryDelaySeconds=" + maxRetryDelaySeconds +
                ", deadLetterTtlHours=" + deadLetterTtlHours +
                '}';
    }
}
