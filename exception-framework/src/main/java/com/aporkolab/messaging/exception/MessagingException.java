package com.aporkolab.messaging.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all messaging exceptions.
 * 
 * Provides:
 * - Error code for programmatic handling
 * - Structured context for debugging
 * - Timestamp for correlation with broker-side logs
 */
public abstract class MessagingException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected MessagingException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    protected MessagingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public MessagingException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
