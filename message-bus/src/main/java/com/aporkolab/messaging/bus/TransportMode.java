package com.aporkolab.messaging.bus;

/**
 * Concrete wire mechanism behind the messaging abstractions.
 * Chosen once at startup; never changes for the life of the process.
 */
public enum TransportMode {

    /** RabbitMQ. */
    LOCAL_BROKER,

    /** Managed Kafka endpoint. */
    MANAGED_CLOUD_BROKER,

    /** No transport I/O at all. */
    DISABLED
}
