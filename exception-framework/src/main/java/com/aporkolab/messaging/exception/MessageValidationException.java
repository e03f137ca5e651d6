package com.aporkolab.messaging.exception;

import java.util.List;

/**
 * Thrown by handlers when a well-formed message violates business rules.
 */
public class MessageValidationException extends PermanentMessagingException {

    public MessageValidationException(String field, String message) {
        super("VALIDATION_ERROR", String.format("Validation failed for '%s': %s", field, message));
        with("field", field);
    }

    public MessageValidationException(List<FieldError> errors) {
        super("VALIDATION_ERROR", "Validation failed for multiple fields");
        with("errors", errors);
    }

    public record FieldError(String field, String message) {}
}
