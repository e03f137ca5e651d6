package com.aporkolab.messaging.exception;

/**
 * Invalid or missing messaging configuration.
 * 
 * Fatal at startup in production. Outside production the configuration layer
 * logs a warning and falls back to defaults instead of throwing.
 */
public class MessagingConfigurationException extends MessagingException {

    public MessagingConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public MessagingConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }

    public static MessagingConfigurationException missingSetting(String property, String environment) {
        MessagingConfigurationException ex = new MessagingConfigurationException(String.format(
                "'%s' is required in the %s environment. Configure it or set 'messaging.enabled' to false.",
                property, environment));
        ex.with("property", property);
        ex.with("environment", environment);
        return ex;
    }

    public static MessagingConfigurationException unresolvedPlaceholder(String property, String environment) {
        MessagingConfigurationException ex = new MessagingConfigurationException(String.format(
                "'%s' contains an unresolved placeholder or a development default in the %s environment.",
                property, environment));
        ex.with("property", property);
        ex.with("environment", environment);
        return ex;
    }
}
