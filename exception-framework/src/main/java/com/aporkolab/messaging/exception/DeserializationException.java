package com.aporkolab.messaging.exception;

/**
 * Message body could not be turned back into its payload type.
 */
public class DeserializationException extends PermanentMessagingException {

    public DeserializationException(String messageType, Throwable cause) {
        super("DESERIALIZATION_ERROR",
                String.format("Failed to deserialize payload of type '%s': %s", messageType,
                        cause != null ? cause.getMessage() : "unknown cause"),
                cause);
        with("messageType", messageType);
    }

    public DeserializationException(String messageType, String reason) {
        super("DESERIALIZATION_ERROR",
                String.format("Failed to deserialize payload of type '%s': %s", messageType, reason));
        with("messageType", messageType);
    }

    public static DeserializationException unknownType(String messageType) {
        return new DeserializationException(messageType, "no registered event type with that name");
    }
}
