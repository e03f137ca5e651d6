package com.aporkolab.messaging.bus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.logging.CorrelationContext;

/**
 * A message together with its routing metadata.
 * <p>
 * Immutable. {@code body} is the serialized form as it travelled on the wire and
 * is {@code null} for envelopes built in-process that were never serialized.
 */
public final class MessageEnvelope<T> {

    private final String messageId;
    private final String messageType;
    private final T payload;
    private final String body;
    private final String correlationId;
    private final String sourceQueue;
    private final Map<String, String> headers;
    private final Instant createdAt;

    private MessageEnvelope(Builder<T> builder) {
        this.payload = Objects.requireNonNull(builder.payload, "payload");
        this.messageId = builder.messageId != null ? builder.messageId : UUID.randomUUID().toString();
        this.messageType = builder.messageType != null ? builder.messageType : EventTypeCatalog.nameOf(payload.getClass());
        this.body = builder.body;
        this.correlationId = builder.correlationId != null
                ? builder.correlationId
                : CorrelationContext.currentOrNewCorrelationId();
        this.sourceQueue = builder.sourceQueue;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public static <T> MessageEnvelope<T> of(T payload, String sourceQueue) {
        return MessageEnvelope.<T>builder(payload).sourceQueue(sourceQueue).build();
    }

    public static <T> Builder<T> builder(T payload) {
        return new Builder<T>().payload(payload);
    }

    public String getMessageId() {
        return messageId;
    }

    public String getMessageType() {
        return messageType;
    }

    public T getPayload() {
        return payload;
    }

    public String getBody() {
        return body;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getSourceQueue() {
        return sourceQueue;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Builder<T> toBuilder() {
        Builder<T> builder = new Builder<T>()
                .payload(payload)
                .messageId(messageId)
                .messageType(messageType)
                .body(body)
                .correlationId(correlationId)
                .sourceQueue(sourceQueue)
                .createdAt(createdAt);
        builder.headers.putAll(headers);
        return builder;
    }

    @Override
    public String toString() {
        return "MessageEnvelope{" +
                "messageId='" + messageId + '\'' +
                ", messageType='" + messageType + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", sourceQueue='" + sourceQueue + '\'' +
                '}';
    }

    public static final class Builder<T> {
        private String messageId;
        private String messageType;
        private T payload;
        private String body;
        private String correlationId;
        private String sourceQueue;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Instant createdAt;

        private Builder() {
        }

        public Builder<T> messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder<T> messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder<T> payload(T payload) {
            this.payload = payload;
            return this;
        }

        public Builder<T> body(String body) {
            this.body = body;
            return this;
        }

        public Builder<T> correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder<T> sourceQueue(String sourceQueue) {
            this.sourceQueue = sourceQueue;
            return this;
        }

        public Builder<T> header(String name, String value) {
            if (name != null && value != null) {
                this.headers.put(name, value);
            }
            return this;
        }

        public Builder<T> headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder<T> createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public MessageEnvelope<T> build() {
            return new MessageEnvelope<>(this);
        }
    }
}
