package com.aporkolab.messaging.bus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves exactly one implementation of {@code T} for a {@link TransportMode}.
 * <p>
 * Holds one supplier per mode and only ever invokes the supplier of the selected
 * mode, once. The other implementations are never constructed.
 */
public class TransportFactory<T> {

    private static final Logger log = LoggerFactory.getLogger(TransportFactory.class);

    private final String component;
    private final TransportMode mode;
    private final Map<TransportMode, Supplier<? extends T>> suppliers;
    private volatile T instance;

    private TransportFactory(String component, TransportMode mode, Map<TransportMode, Supplier<? extends T>> suppliers) {
        this.component = component;
        this.mode = mode;
        this.suppliers = suppliers;
    }

    public static <T> Builder<T> builder(String component) {
        return new Builder<>(component);
    }

    public TransportMode getMode() {
        return mode;
    }

    public T get() {
        T resolved = instance;
        if (resolved == null) {
            synchronized (this) {
                resolved = instance;
                if (resolved == null) {
                    resolved = Objects.requireNonNull(suppliers.get(mode).get(),
                            () -> component + " supplier for " + mode + " returned null");
                    log.info("Resolved {} for transport {}: {}", component, mode, resolved.getClass().getSimpleName());
                    instance = resolved;
                }
            }
        }
        return resolved;
    }

    public static final class Builder<T> {

        private final String component;
        private final Map<TransportMode, Supplier<? extends T>> suppliers = new EnumMap<>(TransportMode.class);

        private Builder(String component) {
            this.component = component;
        }

        public Builder<T> localBroker(Supplier<? extends T> supplier) {
            suppliers.put(TransportMode.LOCAL_BROKER, supplier);
            return this;
        }

        public Builder<T> managedCloudBroker(Supplier<? extends T> supplier) {
            suppliers.put(TransportMode.MANAGED_CLOUD_BROKER, supplier);
            return this;
        }

        public Builder<T> disabled(Supplier<? extends T> supplier) {
            suppliers.put(TransportMode.DISABLED, supplier);
            return this;
        }

        public TransportFactory<T> build(TransportMode mode) {
            Objects.requireNonNull(mode, "mode");
            for (TransportMode candidate : TransportMode.values()) {
                if (!suppliers.containsKey(candidate)) {
                    throw new IllegalStateException(component + " has no implementation for transport " + candidate);
                }
            }
            return new TransportFactory<>(component, mode, new EnumMap<>(suppliers));
        }
    }
}
