package com.aporkolab.messaging.events;

/**
 * Marker for payloads that travel between services as integration events.
 * <p>
 * A class is accepted by the {@link EventTypeRegistry} only when it is public,
 * concrete and implements this interface. Its simple class name is the type
 * name written on the wire.
 */
public interface IntegrationEvent {

    default String eventType() {
        return EventTypeCatalog.nameOf(getClass());
    }
}
