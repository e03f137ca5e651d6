package com.aporkolab.messaging.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single decision point mapping {enabled, environment} to a {@link TransportMode}.
 *
 * <pre>
 * enabled=false, any environment  -> DISABLED
 * enabled=true,  DEVELOPMENT      -> LOCAL_BROKER
 * enabled=true,  PRODUCTION       -> MANAGED_CLOUD_BROKER
 * enabled=true,  TESTING          -> DISABLED (test harness injects its own transport)
 * enabled=true,  OTHER            -> DISABLED, reported as a configuration gap
 * </pre>
 */
public final class TransportModeSelector {

    private static final Logger log = LoggerFactory.getLogger(TransportModeSelector.class);

    private TransportModeSelector() {
    }

    public static TransportMode select(boolean enabled, DeploymentEnvironment environment) {
        if (!enabled) {
            log.info("Messaging disabled; using no-op transport");
            return TransportMode.DISABLED;
        }

        TransportMode mode = switch (environment) {
            case DEVELOPMENT -> TransportMode.LOCAL_BROKER;
            case PRODUCTION -> TransportMode.MANAGED_CLOUD_BROKER;
            case TESTING -> TransportMode.DISABLED;
            case OTHER -> {
                log.error("Messaging is enabled but the deployment environment is not recognized. "
                        + "No transport can be chosen; messaging falls back to no-op. "
                        + "Set 'messaging.environment' to development, production or testing.");
                yield TransportMode.DISABLED;
            }
        };

        log.info("Selected transport {} for environment {}", mode, environment.getDisplayName());
        return mode;
    }
}
