package com.aporkolab.messaging.exception;

import java.time.Duration;

/**
 * Delivery failure that is expected to go away on its own: broker unreachable,
 * request timeout, throttling. Always eligible for retry.
 */
public class TransientMessagingException extends MessagingException {

    public TransientMessagingException(String message) {
        super("TRANSIENT_DELIVERY_ERROR", message);
    }

    public TransientMessagingException(String message, Throwable cause) {
        super("TRANSIENT_DELIVERY_ERROR", message, cause);
    }

    public static TransientMessagingException brokerUnavailable(String broker, Throwable cause) {
        TransientMessagingException ex = new TransientMessagingException(
                String.format("Broker '%s' is unreachable: %s", broker,
                        cause != null ? cause.getMessage() : "no connection"),
                cause);
        ex.with("broker", broker);
        return ex;
    }

    public static TransientMessagingException timeout(String destination, Duration after) {
        TransientMessagingException ex = new TransientMessagingException(
                String.format("Delivery to '%s' timed out after %s", destination, after));
        ex.with("destination", destination);
        ex.with("timeout", after);
        return ex;
    }

    public static TransientMessagingException throttled(String destination) {
        TransientMessagingException ex = new TransientMessagingException(
                String.format("Delivery to '%s' was throttled by the broker", destination));
        ex.with("destination", destination);
        return ex;
    }
}
