package com.aporkolab.messaging.bus;

import java.util.Locale;

/**
 * Where the process runs. Drives which transport is selected at startup.
 */
public enum DeploymentEnvironment {

    DEVELOPMENT("Development"),
    PRODUCTION("Production"),
    TESTING("Testing"),
    OTHER("Other");

    private final String displayName;

    DeploymentEnvironment(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isProduction() {
        return this == PRODUCTION;
    }

    /**
     * Parses an environment or profile name. Unrecognized or blank names map to {@link #OTHER}.
     */
    public static DeploymentEnvironment fromName(String name) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "dev", "development", "local" -> DEVELOPMENT;
            case "prod", "production" -> PRODUCTION;
            case "test", "testing" -> TESTING;
            default -> OTHER;
        };
    }

    /**
     * Picks the first profile that names a known environment.
     */
    public static DeploymentEnvironment fromProfiles(String... profiles) {
        if (profiles != null) {
            for (String profile : profiles) {
                DeploymentEnvironment environment = fromName(profile);
                if (environment != OTHER) {
                    return environment;
                }
            }
        }
        return OTHER;
    }
}
