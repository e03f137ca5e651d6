package com.aporkolab.messaging.exception;

/**
 * Writing a message to its dead-letter location failed.
 */
public class DeadLetterException extends MessagingException {

    public DeadLetterException(String sourceQueue, String messageType, Throwable cause) {
        super("DEAD_LETTER_ERROR",
                String.format("Failed to quarantine message of type '%s' from '%s': %s",
                        messageType, sourceQueue, cause != null ? cause.getMessage() : "unknown cause"),
                cause);
        with("sourceQueue", sourceQueue);
        with("messageType", messageType);
    }
}
