package com.aporkolab.messaging.exception;

/**
 * Base class for failures that will not succeed on retry.
 * 
 * A message failing with one of these is quarantined on the first attempt.
 */
public abstract class PermanentMessagingException extends MessagingException {

    protected PermanentMessagingException(String code, String message) {
        super(code, message);
    }

    protected PermanentMessagingException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
