package com.aporkolab.messaging.dlq;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.common.errors.RetriableException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpTimeoutException;

import com.aporkolab.messaging.exception.PermanentMessagingException;
import com.aporkolab.messaging.exception.TransientMessagingException;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Maps a handler failure to a {@link FailureType}.
 */
public final class FailureClassifier {

    private static final List<Class<? extends Throwable>> TRANSIENT_TYPES = List.of(
            TransientMessagingException.class,
            TimeoutException.class,
            IOException.class,
            UncheckedIOException.class,
            RetriableException.class,
            AmqpConnectException.class,
            AmqpTimeoutException.class
    );

    private static final List<Class<? extends Throwable>> PERMANENT_TYPES = List.of(
            PermanentMessagingException.class,
            JsonProcessingException.class,
            IllegalArgumentException.class,
            IllegalStateException.class,
            NullPointerException.class,
            UnsupportedOperationException.class,
            ClassCastException.class
    );

    private FailureClassifier() {
    }

    public static FailureType classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause == null) {
            return FailureType.UNKNOWN;
        }
        if (cause instanceof Error) {
            return FailureType.CRITICAL;
        }
        if (isAnyOf(cause, TRANSIENT_TYPES)) {
            return FailureType.TRANSIENT;
        }
        if (isAnyOf(cause, PERMANENT_TYPES)) {
            return FailureType.PERMANENT;
        }
        return FailureType.UNKNOWN;
    }

    /**
     * Strips the wrappers added by {@code CompletableFuture} and {@code Future.get()}.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Cancellation is a control signal, never a delivery failure.
     */
    public static boolean isCancellation(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause instanceof CancellationException || cause instanceof InterruptedException;
    }

    private static boolean isAnyOf(Throwable failure, List<Class<? extends Throwable>> types) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }
}
