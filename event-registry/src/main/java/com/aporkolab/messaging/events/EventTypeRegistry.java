package com.aporkolab.messaging.events;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves wire type names to integration event classes.
 * <p>
 * The catalog is assembled from the registered {@link EventTypeModule}s and
 * cached. It is rebuilt when the cache expires or after {@link #invalidateCache()}.
 * A module initialized after startup, for example after a hot-deploy, adds itself
 * through {@link #register(EventTypeModule)}.
 */
public class EventTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventTypeRegistry.class);

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);

    private final List<EventTypeModule> modules;
    private final CachedValue<EventTypeCatalog> catalog;

    public EventTypeRegistry(List<EventTypeModule> modules) {
        this(modules, DEFAULT_CACHE_TTL);
    }

    public EventTypeRegistry(List<EventTypeModule> modules, Duration cacheTtl) {
        this(modules, cacheTtl, Clock.systemUTC());
    }

    public EventTypeRegistry(List<EventTypeModule> modules, Duration cacheTtl, Clock clock) {
        this.modules = new CopyOnWriteArrayList<>(modules);
        this.catalog = new CachedValue<>(this::buildCatalog, cacheTtl, clock);
    }

    /**
     * Adds a module and drops the cached catalog, so the next lookup sees its event types.
     * A name clash with an already registered module surfaces on that lookup.
     */
    public void register(EventTypeModule module) {
        Objects.requireNonNull(module, "module must not be null");
        modules.add(module);
        catalog.invalidate();
        log.info("Registered event type module {}", module.moduleName());
    }

    public EventTypeCatalog getAllEventTypes() {
        return catalog.get();
    }

    public Optional<Class<? extends IntegrationEvent>> getEventType(String name) {
        return catalog.get().find(name);
    }

    public Map<String, Class<? extends IntegrationEvent>> asMap() {
        return catalog.get().asMap();
    }

    public void invalidateCache() {
        catalog.invalidate();
        log.info("Event type cache invalidated; next lookup rebuilds the catalog");
    }

    public long rebuildCount() {
        return catalog.loadCount();
    }

    private EventTypeCatalog buildCatalog() {
        long start = System.nanoTime();
        EventTypeCatalog.Builder builder = EventTypeCatalog.builder();

        for (EventTypeModule module : modules) {
            builder.forModule(module.moduleName());
            module.registerEventTypes(builder);
        }

        EventTypeCatalog built = builder.build();
        log.info("Built event type catalog: {} types from {} modules in {}ms",
                built.size(), modules.size(), (System.nanoTime() - start) / 1_000_000);
        log.debug("Registered event types: {}", built.names());
        return built;
    }
}
