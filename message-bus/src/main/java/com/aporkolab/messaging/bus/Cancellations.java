package com.aporkolab.messaging.bus;

import java.util.concurrent.CancellationException;

/**
 * Recognizes a cancelled handler anywhere in a failure's cause chain.
 * <p>
 * A cancelled handler has not failed: the message goes back to the broker
 * instead of the dead-letter location.
 */
public final class Cancellations {

    private Cancellations() {
    }

    public static boolean isCancellation(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
