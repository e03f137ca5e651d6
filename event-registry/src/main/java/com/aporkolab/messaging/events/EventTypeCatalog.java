package com.aporkolab.messaging.events;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.messaging.exception.MessagingConfigurationException;

/**
 * Immutable snapshot mapping event type names to their payload classes.
 * Built wholesale by {@link Builder}; never patched after {@link Builder#build()}.
 */
public final class EventTypeCatalog {

    private static final EventTypeCatalog EMPTY = new EventTypeCatalog(Map.of());

    private final Map<String, Class<? extends IntegrationEvent>> types;

    private EventTypeCatalog(Map<String, Class<? extends IntegrationEvent>> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static EventTypeCatalog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String nameOf(Class<?> type) {
        return type.getSimpleName();
    }

    public Optional<Class<? extends IntegrationEvent>> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(name));
    }

    public boolean contains(String name) {
        return name != null && types.containsKey(name);
    }

    public Set<String> names() {
        return types.keySet();
    }

    public Map<String, Class<? extends IntegrationEvent>> asMap() {
        return types;
    }

    public int size() {
        return types.size();
    }

    @Override
    public String toString() {
        return "EventTypeCatalog" + types.keySet();
    }

    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(Builder.class);

        private final Map<String, Class<? extends IntegrationEvent>> types = new LinkedHashMap<>();
        private String currentModule = "unknown";

        private Builder() {
        }

        Builder forModule(String moduleName) {
            this.currentModule = moduleName;
            return this;
        }

        /**
         * Adds an event type under its simple class name.
         * Types that are not public, concrete event classes are skipped with a warning.
         *
         * @throws MessagingConfigurationException if another class already owns the name
         */
        public Builder register(Class<?> type) {
            if (!isEventShaped(type)) {
                log.warn("Module {} registered {} which is not a public concrete IntegrationEvent; skipping",
                        currentModule, type.getName());
                return this;
            }

            @SuppressWarnings("unchecked")
            Class<? extends IntegrationEvent> eventType = (Class<? extends IntegrationEvent>) type;
            String name = nameOf(eventType);
            Class<? extends IntegrationEvent> existing = types.get(name);

            if (existing != null && !existing.equals(eventType)) {
                throw new MessagingConfigurationException(
                        "Event type name '" + name + "' is claimed by both " + existing.getName()
                                + " and " + eventType.getName())
                        .with("eventType", name)
                        .with("module", currentModule);
            }

            types.put(name, eventType);
            return this;
        }

        public EventTypeCatalog build() {
            return new EventTypeCatalog(types);
        }

        static boolean isEventShaped(Class<?> type) {
            int modifiers = type.getModifiers();
            return IntegrationEvent.class.isAssignableFrom(type)
                    && Modifier.isPublic(modifiers)
                    && !Modifier.isAbstract(modifiers)
                    && !type.isInterface()
                    && !type.isAnonymousClass()
                    && !type.isLocalClass();
        }
    }
}
