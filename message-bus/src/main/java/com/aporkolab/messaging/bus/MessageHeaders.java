package com.aporkolab.messaging.bus;

import com.aporkolab.messaging.logging.KafkaCorrelationInterceptor;

/**
 * Transport header names shared by every broker implementation.
 */
public final class MessageHeaders {

    public static final String MESSAGE_TYPE = "message-type";
    public static final String MESSAGE_ID = "message-id";
    public static final String CORRELATION_ID = KafkaCorrelationInterceptor.CORRELATION_ID_HEADER;
    public static final String SOURCE_QUEUE = "source-queue";
    public static final String CREATED_AT = "created-at";

    public static final String CONTENT_TYPE_JSON = "application/json";

    private MessageHeaders() {
    }
}
