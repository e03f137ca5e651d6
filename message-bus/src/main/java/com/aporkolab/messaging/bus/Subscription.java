package com.aporkolab.messaging.bus;

/**
 * Handle to a running consumer. Closing it stops message delivery to the handler.
 */
public interface Subscription extends AutoCloseable {

    String getName();

    boolean isActive();

    @Override
    void close();
}
