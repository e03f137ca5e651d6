package com.aporkolab.messaging.logging;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Manages the per-message logging context via MDC (Mapped Diagnostic Context).
 * 
 * The correlation ID travels with every envelope as a transport header, so a
 * message handled on a consumer thread logs with the same correlation ID as
 * the request that produced it.
 * 
 * Usage:
 * <pre>
 * try (var ctx = CorrelationContext.forMessage(envelope.getCorrelationId(),
 *                                              envelope.getMessageId(),
 *                                              envelope.getSourceQueue())) {
 *     log.info("Handling message"); // Logs include correlationId, messageId, sourceQueue
 * }
 * </pre>
 */
public class CorrelationContext implements AutoCloseable {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String MESSAGE_ID_KEY = "messageId";
    public static final String SOURCE_QUEUE_KEY = "sourceQueue";
    public static final String ATTEMPT_KEY = "attempt";
    public static final String SERVICE_NAME_KEY = "service";

    private final Map<String, String> previousContext;

    private CorrelationContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Creates a new context with a generated correlation ID.
     */
    public static CorrelationContext create() {
        return create(generateId());
    }

    /**
     * Creates a new context with the specified correlation ID.
     */
    public static CorrelationContext create(String correlationId) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return new CorrelationContext(previous);
    }

    /**
     * Continues an existing correlation ID or creates a new one if not present.
     */
    public static CorrelationContext continueOrCreate(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return create();
        }
        return create(correlationId);
    }

    /**
     * Opens a context describing one message being handled.
     */
    public static CorrelationContext forMessage(String correlationId, String messageId, String sourceQueue) {
        return continueOrCreate(correlationId)
                .with(MESSAGE_ID_KEY, messageId)
                .with(SOURCE_QUEUE_KEY, sourceQueue);
    }

    /**
     * Gets the current correlation ID, or null if not set.
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    /**
     * Returns the current correlation ID, generating a fresh one when none is set.
     */
    public static String currentOrNewCorrelationId() {
        String current = getCurrentCorrelationId();
        return current != null ? current : generateId();
    }

    public CorrelationContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public CorrelationContext withAttempt(int attempt) {
        return with(ATTEMPT_KEY, String.valueOf(attempt));
    }

    public CorrelationContext withService(String serviceName) {
        return with(SERVICE_NAME_KEY, serviceName);
    }

    /**
     * Wraps a Runnable to propagate the current context onto another thread.
     */
    public static Runnable wrap(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    /**
     * Wraps a Callable to propagate the current context onto another thread.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    public static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }
}
