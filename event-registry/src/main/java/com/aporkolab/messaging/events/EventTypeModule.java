package com.aporkolab.messaging.events;

/**
 * Implemented once per application module to declare the integration events it owns.
 *
 * <pre>
 * public class OrdersEvents implements EventTypeModule {
 *     public void registerEventTypes(EventTypeCatalog.Builder catalog) {
 *         catalog.register(OrderPlaced.class)
 *                .register(OrderCancelled.class);
 *     }
 * }
 * </pre>
 */
@FunctionalInterface
public interface EventTypeModule {

    void registerEventTypes(EventTypeCatalog.Builder catalog);

    default String moduleName() {
        return getClass().getSimpleName();
    }
}
