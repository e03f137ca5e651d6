package com.aporkolab.messaging.bus;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.events.EventTypeCatalog;
import com.aporkolab.messaging.events.EventTypeRegistry;
import com.aporkolab.messaging.events.IntegrationEvent;
import com.aporkolab.messaging.exception.DeserializationException;
import com.aporkolab.messaging.exception.MessageValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding of payloads and reconstruction of envelopes from wire messages.
 * <p>
 * The wire carries only a type name in the {@link MessageHeaders#MESSAGE_TYPE}
 * header; the {@link EventTypeRegistry} maps it back to a class.
 */
public class EnvelopeCodec {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry eventTypes;

    public EnvelopeCodec(ObjectMapper objectMapper, EventTypeRegistry eventTypes) {
        this.objectMapper = objectMapper;
        this.eventTypes = eventTypes;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String encode(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MessageValidationException("payload",
                    "cannot be serialized as " + EventTypeCatalog.nameOf(payload.getClass()) + ": " + e.getOriginalMessage());
        }
    }

    /**
     * Resolves the type name through the registry and deserializes the body.
     *
     * @throws DeserializationException if the name is unknown or the body does not match the type
     */
    public IntegrationEvent decode(String typeName, String body) {
        Class<? extends IntegrationEvent> type = eventTypes.getEventType(typeName)
                .orElseThrow(() -> DeserializationException.unknownType(typeName));
        return readValue(body, type, typeName);
    }

    /**
     * Rebuilds an envelope for a consumer that expects {@code expectedType}.
     * <p>
     * When the message names a registered type, that type is used (it must be
     * assignable to {@code expectedType}); otherwise the body is read as {@code expectedType}.
     */
    public <T> MessageEnvelope<T> toEnvelope(Class<T> expectedType, String body, Map<String, String> headers,
                                             String sourceQueue) {
        String typeName = headers.getOrDefault(MessageHeaders.MESSAGE_TYPE, EventTypeCatalog.nameOf(expectedType));
        Class<?> target = eventTypes.getEventType(typeName)
                .<Class<?>>map(registered -> registered)
                .orElse(expectedType);

        if (!expectedType.isAssignableFrom(target)) {
            throw new DeserializationException(typeName,
                    "registered as " + target.getName() + ", which is not a " + expectedType.getName());
        }

        T payload = expectedType.cast(readValue(body, target, typeName));

        return MessageEnvelope.builder(payload)
                .messageType(typeName)
                .messageId(headers.get(MessageHeaders.MESSAGE_ID))
                .correlationId(headers.get(MessageHeaders.CORRELATION_ID))
                .sourceQueue(sourceQueue)
                .body(body)
                .headers(headers)
                .createdAt(parseInstant(headers.get(MessageHeaders.CREATED_AT)))
                .build();
    }

    private <T> T readValue(String body, Class<T> type, String typeName) {
        if (body == null || body.isBlank()) {
            throw new DeserializationException(typeName, "message body is empty");
        }
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new DeserializationException(typeName, "message body is null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new DeserializationException(typeName, e);
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed {} header '{}'", MessageHeaders.CREATED_AT, value);
            return null;
        }
    }
}
