package com.aporkolab.messaging.bus;

import java.util.Locale;

final class SubscriptionNames {

    private SubscriptionNames() {
    }

    /**
     * {@code OrderPlaced} becomes {@code order-placed}.
     */
    static String forType(Class<?> type) {
        if (type == null) {
            return "messages";
        }
        return type.getSimpleName()
                .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
                .toLowerCase(Locale.ROOT);
    }
}
