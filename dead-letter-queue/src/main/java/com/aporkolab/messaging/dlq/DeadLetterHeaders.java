package com.aporkolab.messaging.dlq;

/**
 * Header names written on dead-lettered and reprocessed messages.
 */
public final class DeadLetterHeaders {

    public static final String ORIGINAL_MESSAGE_TYPE = "original-message-type";
    public static final String FAILURE_REASON = "failure-reason";
    public static final String FAILURE_TYPE = "failure-type";
    public static final String ATTEMPT_COUNT = "attempt-count";
    public static final String SOURCE_QUEUE = "source-queue";
    public static final String HANDLER_TYPE = "handler-type";
    public static final String FAILED_AT = "failed-at";

    public static final String REPROCESSED_FROM_DLQ = "reprocessed-from-dlq";
    public static final String ORIGINAL_MESSAGE_ID = "original-message-id";
    public static final String REPROCESSED_AT = "reprocessed-at";

    private DeadLetterHeaders() {
    }
}
