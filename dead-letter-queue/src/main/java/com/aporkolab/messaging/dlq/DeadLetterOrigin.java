package com.aporkolab.messaging.dlq;

import java.time.Instant;

/**
 * Identifies the process that quarantines messages.
 */
public record DeadLetterOrigin(
        String machineName,
        String environmentName,
        String applicationVersion,
        String serviceInstance) {

    public static DeadLetterOrigin detect(String environmentName, String applicationVersion) {
        String hostname = System.getenv().getOrDefault("HOSTNAME", "unknown");
        String instance = hostname + ":" + ProcessHandle.current().pid();
        return new DeadLetterOrigin(hostname, environmentName,
                applicationVersion != null ? applicationVersion : "unknown", instance);
    }

    public DeadLetterRecord.EnvironmentMetadata stamp(Instant createdAt) {
        return new DeadLetterRecord.EnvironmentMetadata(
                machineName, environmentName, applicationVersion, serviceInstance, createdAt);
    }
}
