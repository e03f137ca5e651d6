package com.aporkolab.messaging.dlq;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Quarantined message stored in the dead-letter location.
 * Contains all context needed for debugging and reprocessing.
 * <p>
 * Written once, never updated; the store expires it after {@link #getExpiresAt()}.
 */
@JsonDeserialize(builder = DeadLetterRecord.Builder.class)
public class DeadLetterRecord {

    static final int MAX_STACK_TRACE_LENGTH = 2000;

    private String messageId;
    private String originalMessageId;
    private String messageType;
    private String originalMessage;
    private String sourceQueue;
    private String correlationId;
    private String handlerType;
    private Instant firstAttemptAt;
    private Instant lastAttemptAt;
    private int attemptCount;
    private FailureType failureType;
    private String failureReason;
    private String stackTrace;
    private List<FailureAttempt> failureHistory = List.of();
    private Map<String, String> originalHeaders = Map.of();
    private EnvironmentMetadata environment;
    private Instant expiresAt;

    private DeadLetterRecord() {}

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public String getMessageId() { return messageId; }
    public String getOriginalMessageId() { return originalMessageId; }
    public String getMessageType() { return messageType; }
    public String getOriginalMessage() { return originalMessage; }
    public String getSourceQueue() { return sourceQueue; }
    public String getCorrelationId() { return correlationId; }
    public String getHandlerType() { return handlerType; }
    public Instant getFirstAttemptAt() { return firstAttemptAt; }
    public Instant getLastAttemptAt() { return lastAttemptAt; }
    public int getAttemptCount() { return attemptCount; }
    public FailureType getFailureType() { return failureType; }
    public String getFailureReason() { return failureReason; }
    public String getStackTrace() { return stackTrace; }
    public List<FailureAttempt> getFailureHistory() { return failureHistory; }
    public Map<String, String> getOriginalHeaders() { return originalHeaders; }
    public EnvironmentMetadata getEnvironment() { return environment; }
    public Instant getExpiresAt() { return expiresAt; }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public static String describe(Throwable failure) {
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    public static String stackTraceOf(Throwable failure) {
        StringBuilder sb = new StringBuilder(describe(failure)).append("\n");
        for (StackTraceElement element : failure.getStackTrace()) {
            if (sb.length() > MAX_STACK_TRACE_LENGTH) {
                sb.append("...(truncated)");
                break;
            }
            sb.append("\tat ").append(element).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "DeadLetterRecord{" +
                "messageId='" + messageId + '\'' +
                ", messageType='" + messageType + '\'' +
                ", sourceQueue='" + sourceQueue + '\'' +
                ", attemptCount=" + attemptCount +
                ", failureType=" + failureType +
                ", failureReason='" + failureReason + '\'' +
                '}';
    }

    /**
     * One failed handling attempt.
     */
    public record FailureAttempt(
            int attemptNumber,
            Instant attemptedAt,
            String exceptionType,
            String exceptionMessage,
            Duration processingDuration,
            String handlerType) {

        public static FailureAttempt of(int attemptNumber, Instant attemptedAt, Throwable failure,
                                        Duration processingDuration, String handlerType) {
            return new FailureAttempt(attemptNumber, attemptedAt, failure.getClass().getName(),
                    failure.getMessage(), processingDuration, handlerType);
        }
    }

    /**
     * Where the record was produced.
     */
    public record EnvironmentMetadata(
            String machineName,
            String environmentName,
            String applicationVersion,
            String serviceInstance,
            Instant createdAt) {
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private final DeadLetterRecord record = new DeadLetterRecord();

        public Builder messageId(String messageId) {
            record.messageId = messageId;
            return this;
        }

        public Builder originalMessageId(String originalMessageId) {
            record.originalMessageId = originalMessageId;
            return this;
        }

        public Builder messageType(String messageType) {
            record.messageType = messageType;
            return this;
        }

        public Builder originalMessage(String originalMessage) {
            record.originalMessage = originalMessage;
            return this;
        }

        public Builder sourceQueue(String sourceQueue) {
            record.sourceQueue = sourceQueue;
            return this;
        }

        public Builder correlationId(String correlationId) {
            record.correlationId = correlationId;
            return this;
        }

        public Builder handlerType(String handlerType) {
            record.handlerType = handlerType;
            return this;
        }

        public Builder firstAttemptAt(Instant firstAttemptAt) {
            record.firstAttemptAt = firstAttemptAt;
            return this;
        }

        public Builder lastAttemptAt(Instant lastAttemptAt) {
            record.lastAttemptAt = lastAttemptAt;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            record.attemptCount = attemptCount;
            return this;
        }

        public Builder failureType(FailureType failureType) {
            record.failureType = failureType;
            return this;
        }

        public Builder failureReason(String failureReason) {
            record.failureReason = failureReason;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            record.stackTrace = stackTrace;
            return this;
        }

        public Builder failureHistory(List<FailureAttempt> failureHistory) {
            record.failureHistory = failureHistory == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(failureHistory));
            return this;
        }

        public Builder originalHeaders(Map<String, String> originalHeaders) {
            record.originalHeaders = originalHeaders == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(originalHeaders));
            return this;
        }

        public Builder environment(EnvironmentMetadata environment) {
            record.environment = environment;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            record.expiresAt = expiresAt;
            return this;
        }

        public DeadLetterRecord build() {
            return record;
        }
    }
}
